package com.hhplus.strategy.domain.strategy;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * 전략 엔티티
 *
 * 비즈니스 규칙:
 * - 초기 상태는 DRAFT
 * - ARCHIVED 상태의 전략은 상태를 바꿀 수 없음
 */
@Entity
@Table(name = "strategies")
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Strategy {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "strategy_id")
    private Long strategyId;

    @Column(name = "enterprise_id", nullable = false)
    private Long enterpriseId;

    @Column(name = "department_id")
    private Long departmentId;

    @Column(name = "title", nullable = false)
    private String title;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false)
    private StrategyStatus status;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    public static Strategy create(Long enterpriseId, Long departmentId, String title) {
        if (title == null || title.isBlank()) {
            throw new IllegalArgumentException("전략 제목은 필수입니다");
        }
        LocalDateTime now = LocalDateTime.now();
        return Strategy.builder()
                .enterpriseId(enterpriseId)
                .departmentId(departmentId)
                .title(title)
                .status(StrategyStatus.DRAFT)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    public void changeStatus(StrategyStatus newStatus) {
        if (this.status == StrategyStatus.ARCHIVED) {
            throw new IllegalStateException("보관된 전략의 상태는 변경할 수 없습니다");
        }
        this.status = newStatus;
        this.updatedAt = LocalDateTime.now();
    }
}
