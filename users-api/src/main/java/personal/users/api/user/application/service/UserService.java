package personal.users.api.user.application.service;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.util.StopWatch;
import personal.users.api.user.application.port.in.CreateUserUseCase;
import personal.users.api.user.application.port.in.DeleteUserUseCase;
import personal.users.api.user.application.port.in.GetUserUseCase;
import personal.users.api.user.application.port.out.UserRepository;
import personal.users.api.user.domain.model.User;
import personal.users.common.logging.LoggerAdapter;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * User Application Service
 * 사용자 관련 모든 UseCase를 구현하는 Application Service
 * 저장소 호출마다 시작/소요 시간 로그를 남기고, 예외는 에러 로그 후 그대로 다시 던진다.
 */
@Service
@RequiredArgsConstructor
public class UserService implements GetUserUseCase, CreateUserUseCase, DeleteUserUseCase {

    private final UserRepository userRepository;
    private final LoggerAdapter<UserService> logger;

    @Override
    public List<User> getAll() {
        logger.logInformation("Retrieving all users");
        StopWatch stopWatch = startStopWatch();
        try {
            return userRepository.findAll();
        } catch (RuntimeException e) {
            logger.logError(e, "Something went wrong while retrieving all users");
            throw e;
        } finally {
            stopWatch.stop();
            logger.logInformation("All users retrieved in {}ms", stopWatch.getTotalTimeMillis());
        }
    }

    @Override
    public Optional<User> getById(UUID userId) {
        logger.logInformation("Retrieving user with id: {}", userId);
        StopWatch stopWatch = startStopWatch();
        try {
            return userRepository.findById(userId);
        } catch (RuntimeException e) {
            logger.logError(e, "Something went wrong while retrieving user with id {}", userId);
            throw e;
        } finally {
            stopWatch.stop();
            logger.logInformation("User with id {} retrieved in {}ms", userId, stopWatch.getTotalTimeMillis());
        }
    }

    @Override
    public boolean create(User user) {
        logger.logInformation("Creating user with id {} and name: {}", user.id(), user.fullName());
        StopWatch stopWatch = startStopWatch();
        try {
            return userRepository.create(user);
        } catch (RuntimeException e) {
            logger.logError(e, "Something went wrong while creating a user");
            throw e;
        } finally {
            stopWatch.stop();
            logger.logInformation("User with id {} created in {}ms", user.id(), stopWatch.getTotalTimeMillis());
        }
    }

    @Override
    public boolean deleteById(UUID userId) {
        logger.logInformation("Deleting user with id: {}", userId);
        StopWatch stopWatch = startStopWatch();
        try {
            return userRepository.deleteById(userId);
        } catch (RuntimeException e) {
            logger.logError(e, "Something went wrong while deleting user with id {}", userId);
            throw e;
        } finally {
            stopWatch.stop();
            logger.logInformation("User with id {} deleted in {}ms", userId, stopWatch.getTotalTimeMillis());
        }
    }

    private StopWatch startStopWatch() {
        StopWatch stopWatch = new StopWatch();
        stopWatch.start();
        return stopWatch;
    }
}
