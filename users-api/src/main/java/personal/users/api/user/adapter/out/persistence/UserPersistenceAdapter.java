package personal.users.api.user.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import personal.users.api.user.application.port.out.UserRepository;
import personal.users.api.user.domain.exception.UserPersistenceException;
import personal.users.api.user.domain.model.User;

import java.sql.SQLException;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * User Persistence Adapter
 * JPA를 사용한 사용자 저장소 구현체
 * Spring DataAccessException은 UserPersistenceException으로 변환한다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class UserPersistenceAdapter implements UserRepository {

    private final JpaUserRepository jpaUserRepository;

    @Override
    public List<User> findAll() {
        log.debug("Finding all users");
        try {
            return jpaUserRepository.findAll().stream()
                    .map(UserEntity::toDomain)
                    .toList();
        } catch (DataAccessException e) {
            throw translate(e);
        }
    }

    @Override
    public Optional<User> findById(UUID userId) {
        log.debug("Finding user by id: {}", userId);
        try {
            return jpaUserRepository.findById(userId)
                    .map(UserEntity::toDomain);
        } catch (DataAccessException e) {
            throw translate(e);
        }
    }

    @Override
    public boolean create(User user) {
        log.debug("Saving user: userId={}", user.id());
        try {
            // 중복 ID는 기본 키 제약 조건 위반으로 거부된다 (INSERT만 수행)
            jpaUserRepository.saveAndFlush(UserEntity.fromDomain(user));
            return true;
        } catch (DataIntegrityViolationException e) {
            log.warn("User rejected by constraint: userId={}, reason={}", user.id(), e.getMostSpecificCause().getMessage());
            return false;
        } catch (DataAccessException e) {
            throw translate(e);
        }
    }

    @Override
    public boolean deleteById(UUID userId) {
        log.debug("Deleting user: userId={}", userId);
        try {
            return jpaUserRepository.deleteUserById(userId) > 0;
        } catch (DataAccessException e) {
            throw translate(e);
        }
    }

    private UserPersistenceException translate(DataAccessException e) {
        return new UserPersistenceException(e.getMessage(), vendorCode(e), e);
    }

    private int vendorCode(Throwable throwable) {
        for (Throwable cause = throwable; cause != null; cause = cause.getCause()) {
            if (cause instanceof SQLException sqlException) {
                return sqlException.getErrorCode();
            }
        }
        return UserPersistenceException.UNKNOWN_CODE;
    }
}
