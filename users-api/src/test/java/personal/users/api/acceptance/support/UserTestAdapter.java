package personal.users.api.acceptance.support;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.users.api.user.adapter.out.persistence.JpaUserRepository;
import personal.users.api.user.adapter.out.persistence.UserEntity;
import personal.users.api.user.domain.model.User;

import java.util.UUID;

/**
 * User 테스트 데이터 어댑터
 * API를 거치지 않고 저장소 상태를 준비/검증한다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class UserTestAdapter {

    private final JpaUserRepository userRepository;

    public void clearAllData() {
        log.debug(">>> DB: delete all users");
        userRepository.deleteAll();
    }

    public UUID createUser(String fullName) {
        User user = User.create(fullName);
        userRepository.saveAndFlush(UserEntity.fromDomain(user));
        log.debug(">>> DB: user created - userId={}", user.id());
        return user.id();
    }

    public boolean exists(UUID userId) {
        return userRepository.existsById(userId);
    }

    public long count() {
        return userRepository.count();
    }
}
