package com.hhplus.strategy.domain.user;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * 사용자 엔티티
 *
 * 기업과 부서는 ID 로만 참조한다.
 */
@Entity
@Table(name = "users")
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class User {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "user_id")
    private Long userId;

    @Column(name = "email", nullable = false, unique = true)
    private String email;

    @Column(name = "name", nullable = false)
    private String name;

    @Column(name = "enterprise_id")
    private Long enterpriseId;

    @Column(name = "department_id")
    private Long departmentId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    public static User create(String email, String name, Long enterpriseId, Long departmentId) {
        if (email == null || email.isBlank()) {
            throw new IllegalArgumentException("이메일은 필수입니다");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("이름은 필수입니다");
        }
        LocalDateTime now = LocalDateTime.now();
        return User.builder()
                .email(email)
                .name(name)
                .enterpriseId(enterpriseId)
                .departmentId(departmentId)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    public void rename(String newName) {
        if (newName == null || newName.isBlank()) {
            throw new IllegalArgumentException("이름은 필수입니다");
        }
        this.name = newName;
        this.updatedAt = LocalDateTime.now();
    }
}
