package personal.users.common.exception;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * GlobalExceptionHandler 단위 테스트
 * Spring Context 없이 standalone MockMvc로 예외 -> 응답 변환만 검증
 */
@DisplayName("GlobalExceptionHandler 단위 테스트")
class GlobalExceptionHandlerTest {

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new SampleController())
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    @DisplayName("BusinessException은 ErrorCode의 상태 코드로 응답한다")
    void businessException_UsesErrorCodeStatus() throws Exception {
        mockMvc.perform(get("/samples/business"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value(ErrorCode.INVALID_INPUT.getCode()))
                .andExpect(jsonPath("$.message").value(ErrorCode.INVALID_INPUT.getMessage()));
    }

    @Test
    @DisplayName("요청 본문 검증 실패 시 첫 번째 필드 에러 메시지로 400을 응답한다")
    void validationFailure_ReturnsBadRequest() throws Exception {
        mockMvc.perform(post("/samples")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value(ErrorCode.INVALID_INPUT.getCode()))
                .andExpect(jsonPath("$.message").value("이름은 필수입니다."));
    }

    @Test
    @DisplayName("읽을 수 없는 요청 본문은 400을 응답한다")
    void malformedBody_ReturnsBadRequest() throws Exception {
        mockMvc.perform(post("/samples")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{not-json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value(ErrorCode.INVALID_INPUT.getCode()));
    }

    @Test
    @DisplayName("경로 변수 형식 오류는 400을 응답한다")
    void typeMismatch_ReturnsBadRequest() throws Exception {
        mockMvc.perform(get("/samples/{id}", "not-a-uuid"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value(ErrorCode.INVALID_INPUT.getCode()));
    }

    @Test
    @DisplayName("예상하지 못한 예외는 500과 일반 메시지로 응답한다")
    void unexpectedException_ReturnsInternalServerError() throws Exception {
        mockMvc.perform(get("/samples/failure"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.code").value(ErrorCode.INTERNAL_SERVER_ERROR.getCode()))
                .andExpect(jsonPath("$.message").value(ErrorCode.INTERNAL_SERVER_ERROR.getMessage()));
    }

    public record SampleRequest(@NotBlank(message = "이름은 필수입니다.") String name) {
    }

    @RestController
    public static class SampleController {

        @GetMapping("/samples/business")
        public ResponseEntity<Void> business() {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "detail");
        }

        @GetMapping("/samples/failure")
        public ResponseEntity<Void> failure() {
            throw new IllegalStateException("Something went wrong");
        }

        @GetMapping("/samples/{id}")
        public ResponseEntity<UUID> byId(@PathVariable UUID id) {
            return ResponseEntity.ok(id);
        }

        @PostMapping("/samples")
        public ResponseEntity<Void> create(@Valid @RequestBody SampleRequest request) {
            return ResponseEntity.ok().build();
        }
    }
}
