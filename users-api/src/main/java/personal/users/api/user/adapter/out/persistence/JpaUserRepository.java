package personal.users.api.user.adapter.out.persistence;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

/**
 * Spring Data JPA Repository for User
 */
public interface JpaUserRepository extends JpaRepository<UserEntity, UUID> {

    /**
     * 사용자 ID로 삭제 (단일 DELETE 문)
     * @return 삭제된 행 수 (없으면 0)
     */
    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("delete from UserEntity u where u.id = :id")
    int deleteUserById(@Param("id") UUID id);
}
