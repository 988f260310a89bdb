package personal.users.api.user.application.port.in;

import java.util.UUID;

/**
 * Delete User UseCase (Input Port)
 * 사용자 삭제 유스케이스
 */
public interface DeleteUserUseCase {

    /**
     * 사용자 삭제
     * @param userId 사용자 ID
     * @return 삭제 여부 (존재하지 않으면 false)
     */
    boolean deleteById(UUID userId);
}
