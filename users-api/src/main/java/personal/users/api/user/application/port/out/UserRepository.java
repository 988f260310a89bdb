package personal.users.api.user.application.port.out;

import personal.users.api.user.domain.model.User;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * User Repository (Output Port)
 * 사용자 저장소 인터페이스
 * 모든 메서드는 저장소 장애 시 UserPersistenceException을 던진다.
 */
public interface UserRepository {

    /**
     * 전체 사용자 조회
     * @return 사용자 목록 (없으면 빈 목록)
     */
    List<User> findAll();

    /**
     * 사용자 ID로 조회
     * @param userId 사용자 ID
     * @return 사용자 정보 (없으면 Optional.empty())
     */
    Optional<User> findById(UUID userId);

    /**
     * 사용자 저장
     * @param user 저장할 사용자
     * @return 저장 성공 여부 (중복 ID, 제약 조건 위반 시 false)
     */
    boolean create(User user);

    /**
     * 사용자 삭제
     * @param userId 사용자 ID
     * @return 삭제 여부 (존재하지 않으면 false)
     */
    boolean deleteById(UUID userId);
}
