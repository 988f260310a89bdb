package personal.users.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Users API Application
 * 사용자 조회/생성/삭제 API를 제공하는 서비스
 */
@SpringBootApplication(
    scanBasePackages = {
        "personal.users.api",
        "personal.users.common"  // common 모듈의 GlobalExceptionHandler 등을 스캔
    }
)
public class UsersApiApplication {
    public static void main(String[] args) {
        SpringApplication.run(UsersApiApplication.class, args);
    }
}
