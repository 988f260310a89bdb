package personal.users.api.user.domain.exception;

/**
 * User Persistence Exception
 * 사용자 저장소 접근 중 예상하지 못한 장애가 발생했을 때의 예외
 * code는 저장소(DB 벤더) 고유의 에러 코드
 */
public class UserPersistenceException extends RuntimeException {

    public static final int UNKNOWN_CODE = -1;

    private final int code;

    public UserPersistenceException(String message, int code) {
        super(message);
        this.code = code;
    }

    public UserPersistenceException(String message, int code, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public int getCode() {
        return code;
    }
}
