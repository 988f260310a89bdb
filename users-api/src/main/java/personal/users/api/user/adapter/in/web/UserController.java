package personal.users.api.user.adapter.in.web;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.util.UriComponentsBuilder;
import personal.users.api.user.adapter.in.web.dto.CreateUserRequest;
import personal.users.api.user.adapter.in.web.dto.UserResponse;
import personal.users.api.user.application.port.in.CreateUserUseCase;
import personal.users.api.user.application.port.in.DeleteUserUseCase;
import personal.users.api.user.application.port.in.GetUserUseCase;
import personal.users.api.user.domain.model.User;

import java.net.URI;
import java.util.List;
import java.util.UUID;

/**
 * User API Controller
 * 사용자 조회/생성/삭제 REST API
 * 없음(404)과 거부(400)는 UseCase의 반환값으로만 판단하고, 예외는 GlobalExceptionHandler에 맡긴다.
 */
@Slf4j
@RestController
@RequestMapping("/users")
@RequiredArgsConstructor
public class UserController {

    private final GetUserUseCase getUserUseCase;
    private final CreateUserUseCase createUserUseCase;
    private final DeleteUserUseCase deleteUserUseCase;

    /**
     * 사용자 단건 조회
     * GET /users/{id}
     */
    @GetMapping("/{id}")
    public ResponseEntity<UserResponse> getById(@PathVariable UUID id) {
        log.info("Get user: userId={}", id);

        return getUserUseCase.getById(id)
                .map(UserResponse::from)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    /**
     * 전체 사용자 조회
     * GET /users
     */
    @GetMapping
    public ResponseEntity<List<UserResponse>> getAll() {
        log.info("Get all users");

        List<UserResponse> response = getUserUseCase.getAll().stream()
                .map(UserResponse::from)
                .toList();

        return ResponseEntity.ok(response);
    }

    /**
     * 사용자 생성
     * POST /users
     */
    @PostMapping
    public ResponseEntity<UserResponse> create(
            @Valid @RequestBody CreateUserRequest request,
            UriComponentsBuilder uriComponentsBuilder
    ) {
        User user = request.toUser();
        log.info("Create user: userId={}", user.id());

        if (!createUserUseCase.create(user)) {
            return ResponseEntity.badRequest().build();
        }

        URI location = uriComponentsBuilder
                .path("/users/{id}")
                .buildAndExpand(user.id())
                .toUri();

        return ResponseEntity.created(location).body(UserResponse.from(user));
    }

    /**
     * 사용자 삭제
     * DELETE /users/{id}
     */
    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteById(@PathVariable UUID id) {
        log.info("Delete user: userId={}", id);

        if (!deleteUserUseCase.deleteById(id)) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok().build();
    }
}
