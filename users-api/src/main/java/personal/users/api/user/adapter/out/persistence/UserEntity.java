package personal.users.api.user.adapter.out.persistence;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.springframework.data.domain.Persistable;
import personal.users.api.user.domain.model.User;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * User JPA Entity
 * 사용자 테이블 매핑 (ID는 애플리케이션에서 발급)
 * fromDomain으로 만든 엔티티는 새 엔티티로 취급되어 merge 대신 persist(INSERT)로 저장된다.
 */
@Entity
@Table(name = "users")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class UserEntity implements Persistable<UUID> {

    @Id
    private UUID id;

    @Column(name = "full_name", nullable = false, length = 100)
    private String fullName;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Transient
    @Getter(AccessLevel.NONE)
    private boolean newEntity;

    public static UserEntity fromDomain(User user) {
        UserEntity entity = new UserEntity();
        entity.id = user.id();
        entity.fullName = user.fullName();
        entity.createdAt = LocalDateTime.now();
        entity.newEntity = true;
        return entity;
    }

    @Override
    public boolean isNew() {
        return newEntity;
    }

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
    }

    @PostPersist
    @PostLoad
    protected void markNotNew() {
        newEntity = false;
    }

    /**
     * 도메인 모델로 변환
     */
    public User toDomain() {
        return new User(id, fullName);
    }
}
