package com.hhplus.strategy.infrastructure.persistence.enterprise;

import com.hhplus.strategy.domain.enterprise.Enterprise;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

/**
 * Enterprise JPA Repository
 */
public interface EnterpriseJpaRepository extends JpaRepository<Enterprise, Long> {

    List<Enterprise> findAllByOrderByNameAsc();

    List<Enterprise> findAllByIndustry(String industry);
}
