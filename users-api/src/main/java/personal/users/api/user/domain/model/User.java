package personal.users.api.user.domain.model;

import personal.users.common.exception.BusinessException;
import personal.users.common.exception.ErrorCode;

import java.util.UUID;

/**
 * User Domain Model
 * 사용자 도메인의 불변 모델
 * 생성 이후 필드는 변경되지 않으며, 저장/삭제는 항상 엔티티 단위로 이루어진다.
 */
public record User(
        UUID id,
        String fullName
) {
    public User {
        if (id == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "User ID cannot be null");
        }
    }

    /**
     * 새 사용자 생성 (ID 발급)
     */
    public static User create(String fullName) {
        return new User(UUID.randomUUID(), fullName);
    }
}
