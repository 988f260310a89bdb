package personal.users.api.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import personal.users.api.user.application.service.UserService;
import personal.users.common.logging.LoggerAdapter;
import personal.users.common.logging.Slf4jLoggerAdapter;

/**
 * LoggerAdapter 빈 등록
 * 컴포넌트별로 타입 파라미터를 지정해 Logger 이름을 구분한다.
 */
@Configuration
public class LoggingConfig {

    @Bean
    public LoggerAdapter<UserService> userServiceLogger() {
        return new Slf4jLoggerAdapter<>(UserService.class);
    }
}
