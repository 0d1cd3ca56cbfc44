package com.hhplus.strategy.domain.enterprise;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * 기업 엔티티
 */
@Entity
@Table(name = "enterprises")
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Enterprise {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "enterprise_id")
    private Long enterpriseId;

    @Column(name = "name", nullable = false)
    private String name;

    @Column(name = "industry")
    private String industry;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    public static Enterprise create(String name, String industry) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("기업명은 필수입니다");
        }
        LocalDateTime now = LocalDateTime.now();
        return Enterprise.builder()
                .name(name)
                .industry(industry)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    public void rename(String newName) {
        this.name = newName;
        this.updatedAt = LocalDateTime.now();
    }
}
