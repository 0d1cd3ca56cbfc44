package com.hhplus.strategy.infrastructure.persistence.department;

import com.hhplus.strategy.domain.department.Department;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

/**
 * Department JPA Repository
 */
public interface DepartmentJpaRepository extends JpaRepository<Department, Long> {

    List<Department> findAllByEnterpriseId(Long enterpriseId);
}
