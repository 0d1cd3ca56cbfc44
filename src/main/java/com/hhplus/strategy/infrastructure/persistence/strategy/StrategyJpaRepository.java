package com.hhplus.strategy.infrastructure.persistence.strategy;

import com.hhplus.strategy.domain.strategy.Strategy;
import com.hhplus.strategy.domain.strategy.StrategyStatus;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.stream.Stream;

/**
 * Strategy JPA Repository
 */
public interface StrategyJpaRepository extends JpaRepository<Strategy, Long> {

    List<Strategy> findAllByEnterpriseIdAndStatus(Long enterpriseId, StrategyStatus status);

    List<Strategy> findAllByDepartmentId(Long departmentId);

    Page<Strategy> findAllByEnterpriseId(Long enterpriseId, Pageable pageable);

    Stream<Strategy> streamAllByEnterpriseId(Long enterpriseId);

    boolean existsByEnterpriseIdAndTitle(Long enterpriseId, String title);
}
