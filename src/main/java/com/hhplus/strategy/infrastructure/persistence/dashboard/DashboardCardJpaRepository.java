package com.hhplus.strategy.infrastructure.persistence.dashboard;

import com.hhplus.strategy.domain.dashboard.DashboardCard;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

/**
 * DashboardCard JPA Repository
 */
public interface DashboardCardJpaRepository extends JpaRepository<DashboardCard, Long> {

    List<DashboardCard> findAllByEnterpriseId(Long enterpriseId);
}
