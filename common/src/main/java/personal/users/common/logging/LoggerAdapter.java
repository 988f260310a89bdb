package personal.users.common.logging;

/**
 * 구조화 로깅 포트
 * 로그 호출 자체를 검증해야 하는 컴포넌트가 Logger 대신 주입받아 사용한다.
 * 템플릿의 {@code {}} 자리에 인자가 순서대로 채워진다.
 *
 * @param <T> 로그를 남기는 컴포넌트 타입 (Logger 이름으로 사용)
 */
public interface LoggerAdapter<T> {

    /**
     * INFO 레벨 로그
     * @param template 메시지 템플릿
     * @param args     템플릿 인자
     */
    void logInformation(String template, Object... args);

    /**
     * ERROR 레벨 로그 (원인 예외 포함)
     * @param exception 원인 예외
     * @param template  메시지 템플릿
     * @param args      템플릿 인자
     */
    void logError(Throwable exception, String template, Object... args);
}
