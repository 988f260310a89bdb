package personal.users.api.user.adapter.in.web.dto;

import personal.users.api.user.domain.model.User;

import java.util.UUID;

/**
 * 사용자 조회/생성 응답 DTO
 */
public record UserResponse(
        UUID id,
        String fullName
) {
    public static UserResponse from(User user) {
        return new UserResponse(
                user.id(),
                user.fullName()
        );
    }
}
