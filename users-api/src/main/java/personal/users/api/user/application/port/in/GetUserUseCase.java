package personal.users.api.user.application.port.in;

import personal.users.api.user.domain.model.User;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Get User UseCase (Input Port)
 * 사용자 조회 유스케이스
 */
public interface GetUserUseCase {

    /**
     * 전체 사용자 조회
     * @return 사용자 목록 (없으면 빈 목록)
     */
    List<User> getAll();

    /**
     * 사용자 ID로 조회
     * @param userId 사용자 ID
     * @return 사용자 정보 (없으면 Optional.empty())
     */
    Optional<User> getById(UUID userId);
}
