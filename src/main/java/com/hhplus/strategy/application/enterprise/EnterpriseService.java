package com.hhplus.strategy.application.enterprise;

import com.hhplus.strategy.application.enterprise.dto.EnterpriseListResponse;
import com.hhplus.strategy.application.enterprise.dto.EnterpriseResponse;
import com.hhplus.strategy.common.exception.ApplicationException;
import com.hhplus.strategy.common.exception.ErrorCode;
import com.hhplus.strategy.domain.enterprise.Enterprise;
import com.hhplus.strategy.infrastructure.persistence.enterprise.EnterpriseJpaRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.stream.Collectors;

/**
 * EnterpriseService - 기업 조회/변경 (Application 계층)
 *
 * 리포지토리 호출은 RepositoryCacheAspect 를 거치므로
 * 조회는 캐시되고, 저장은 커밋 후 Enterprise 캐시와 enterprise 태그를 무효화한다.
 */
@Service
public class EnterpriseService {

    private final EnterpriseJpaRepository enterpriseRepository;

    public EnterpriseService(EnterpriseJpaRepository enterpriseRepository) {
        this.enterpriseRepository = enterpriseRepository;
    }

    public EnterpriseListResponse getEnterprises() {
        List<EnterpriseResponse> enterprises = enterpriseRepository.findAllByOrderByNameAsc().stream()
                .map(EnterpriseResponse::from)
                .collect(Collectors.toList());
        return new EnterpriseListResponse(enterprises, enterprises.size());
    }

    public EnterpriseResponse getEnterprise(Long enterpriseId) {
        return EnterpriseResponse.from(findEnterprise(enterpriseId));
    }

    @Transactional
    public EnterpriseResponse createEnterprise(String name, String industry) {
        Enterprise saved = enterpriseRepository.save(Enterprise.create(name, industry));
        return EnterpriseResponse.from(saved);
    }

    /**
     * 이름 변경
     *
     * 변경 감지 대신 save 를 명시적으로 호출해야 캐시 무효화가 일어난다.
     */
    @Transactional
    public EnterpriseResponse renameEnterprise(Long enterpriseId, String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("기업명은 필수입니다");
        }
        Enterprise enterprise = findEnterprise(enterpriseId);
        enterprise.rename(name);
        return EnterpriseResponse.from(enterpriseRepository.save(enterprise));
    }

    private Enterprise findEnterprise(Long enterpriseId) {
        if (enterpriseId == null || enterpriseId <= 0) {
            throw new IllegalArgumentException("enterprise_id는 양수여야 합니다");
        }
        return enterpriseRepository.findById(enterpriseId)
                .orElseThrow(() -> new ApplicationException(ErrorCode.ENTERPRISE_NOT_FOUND,
                        "enterpriseId: " + enterpriseId));
    }
}
