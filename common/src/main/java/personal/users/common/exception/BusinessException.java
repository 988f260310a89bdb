package personal.users.common.exception;

import lombok.Getter;

/**
 * 비즈니스 규칙 위반 시 발생하는 예외
 * ErrorCode를 통해 HTTP 상태 코드가 결정된다.
 */
@Getter
public class BusinessException extends RuntimeException {

    private final ErrorCode errorCode;

    public BusinessException(ErrorCode errorCode) {
        super(errorCode.getMessage());
        this.errorCode = errorCode;
    }

    public BusinessException(ErrorCode errorCode, String detail) {
        super(detail);
        this.errorCode = errorCode;
    }
}
