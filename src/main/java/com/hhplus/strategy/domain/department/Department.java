package com.hhplus.strategy.domain.department;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * 부서 엔티티
 */
@Entity
@Table(name = "departments")
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Department {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "department_id")
    private Long departmentId;

    @Column(name = "enterprise_id", nullable = false)
    private Long enterpriseId;

    @Column(name = "name", nullable = false)
    private String name;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    public static Department create(Long enterpriseId, String name) {
        if (enterpriseId == null) {
            throw new IllegalArgumentException("기업 ID는 필수입니다");
        }
        LocalDateTime now = LocalDateTime.now();
        return Department.builder()
                .enterpriseId(enterpriseId)
                .name(name)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }
}
