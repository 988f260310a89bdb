package personal.users.api.user.adapter.in.web.dto;

import jakarta.validation.constraints.NotBlank;
import personal.users.api.user.domain.model.User;

/**
 * 사용자 생성 요청 DTO
 */
public record CreateUserRequest(
        @NotBlank(message = "이름은 필수입니다.")
        String fullName
) {
    public User toUser() {
        return User.create(fullName);
    }
}
