package com.hhplus.strategy.infrastructure.persistence.user;

import com.hhplus.strategy.domain.user.User;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

/**
 * User JPA Repository
 */
public interface UserJpaRepository extends JpaRepository<User, Long> {

    Optional<User> findByEmail(String email);

    List<User> findAllByEnterpriseId(Long enterpriseId);

    List<User> findAllByDepartmentId(Long departmentId);

    long countByEnterpriseId(Long enterpriseId);

    /**
     * 부서 이동 (벌크 업데이트)
     */
    @Modifying(clearAutomatically = true)
    @Query("UPDATE User u SET u.departmentId = :toDepartmentId WHERE u.departmentId = :fromDepartmentId")
    int moveDepartment(@Param("fromDepartmentId") Long fromDepartmentId,
                       @Param("toDepartmentId") Long toDepartmentId);
}
