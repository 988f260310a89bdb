package personal.users.api.user.application.port.in;

import personal.users.api.user.domain.model.User;

/**
 * Create User UseCase (Input Port)
 * 사용자 생성 유스케이스
 */
public interface CreateUserUseCase {

    /**
     * 사용자 생성
     * @param user ID가 발급된 사용자
     * @return 생성 성공 여부 (저장소가 거부하면 false)
     */
    boolean create(User user);
}
