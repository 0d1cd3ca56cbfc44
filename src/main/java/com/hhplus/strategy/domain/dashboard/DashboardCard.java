package com.hhplus.strategy.domain.dashboard;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * 대시보드 카드 (기업별 지표 요약)
 */
@Entity
@Table(name = "dashboard_cards")
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DashboardCard {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "card_id")
    private Long cardId;

    @Column(name = "enterprise_id", nullable = false)
    private Long enterpriseId;

    @Column(name = "title", nullable = false)
    private String title;

    @Column(name = "metric_value")
    private Long metricValue;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    public static DashboardCard create(Long enterpriseId, String title, Long metricValue) {
        return DashboardCard.builder()
                .enterpriseId(enterpriseId)
                .title(title)
                .metricValue(metricValue)
                .updatedAt(LocalDateTime.now())
                .build();
    }
}
