package com.hhplus.strategy.application.dashboard;

import com.hhplus.strategy.application.cache.CacheResult;
import com.hhplus.strategy.application.cache.CacheService;
import com.hhplus.strategy.application.cache.WarmupEntry;
import com.hhplus.strategy.application.cache.WarmupReport;
import com.hhplus.strategy.application.dashboard.dto.DashboardSummary;
import com.hhplus.strategy.common.exception.ApplicationException;
import com.hhplus.strategy.common.exception.ErrorCode;
import com.hhplus.strategy.domain.cache.CacheKey;
import com.hhplus.strategy.domain.cache.CacheKeyType;
import com.hhplus.strategy.domain.enterprise.Enterprise;
import com.hhplus.strategy.domain.strategy.StrategyStatus;
import com.hhplus.strategy.infrastructure.persistence.dashboard.DashboardCardJpaRepository;
import com.hhplus.strategy.infrastructure.persistence.department.DepartmentJpaRepository;
import com.hhplus.strategy.infrastructure.persistence.enterprise.EnterpriseJpaRepository;
import com.hhplus.strategy.infrastructure.persistence.strategy.StrategyJpaRepository;
import com.hhplus.strategy.infrastructure.persistence.user.UserJpaRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;

/**
 * DashboardService - 기업 대시보드 요약 (Application 계층)
 *
 * 역할:
 * 1. 요약 조회: getOrSet 으로 dashboard:{enterpriseId} 캐시
 * 2. 동시 미스 시 집계는 lock:dashboard:{enterpriseId} 락 안에서 한 번만 수행
 *    (락 대기 시간 초과 시 락 없이 집계, 요청은 실패하지 않음)
 * 3. 전체 기업 대시보드 워밍업
 *
 * 대시보드 키는 dashboard 태그를 가지므로 DashboardCard/DepartmentMetricTrend 변경 시 함께 무효화된다.
 */
@Slf4j
@Service
public class DashboardService {

    private static final String LOCK_OPERATION = "dashboard";

    private final CacheService cacheService;
    private final EnterpriseJpaRepository enterpriseRepository;
    private final DepartmentJpaRepository departmentRepository;
    private final UserJpaRepository userRepository;
    private final StrategyJpaRepository strategyRepository;
    private final DashboardCardJpaRepository dashboardCardRepository;

    public DashboardService(CacheService cacheService,
                            EnterpriseJpaRepository enterpriseRepository,
                            DepartmentJpaRepository departmentRepository,
                            UserJpaRepository userRepository,
                            StrategyJpaRepository strategyRepository,
                            DashboardCardJpaRepository dashboardCardRepository) {
        this.cacheService = cacheService;
        this.enterpriseRepository = enterpriseRepository;
        this.departmentRepository = departmentRepository;
        this.userRepository = userRepository;
        this.strategyRepository = strategyRepository;
        this.dashboardCardRepository = dashboardCardRepository;
    }

    public DashboardSummary getDashboard(Long enterpriseId) {
        if (enterpriseId == null || enterpriseId <= 0) {
            throw new IllegalArgumentException("enterprise_id는 양수여야 합니다");
        }
        CacheKey key = CacheKeyType.DASHBOARD.key(enterpriseId);
        return cacheService.getOrSet(key, DashboardSummary.class, () -> summarizeOnce(key, enterpriseId));
    }

    /**
     * 락 안에서 집계. 락 대기 시간을 넘기면 락 없이 집계한다.
     */
    private DashboardSummary summarizeOnce(CacheKey key, Long enterpriseId) {
        String lockKey = CacheKeyType.LOCK.buildKey(LOCK_OPERATION, enterpriseId);
        CacheResult<DashboardSummary> locked = cacheService.tryWithLock(lockKey,
                // 락 대기 중 다른 요청이 기록했을 수 있다
                () -> cacheService.get(key, DashboardSummary.class)
                        .orElseGet(() -> summarize(enterpriseId)));
        if (locked.isSuccess()) {
            return locked.getValue();
        }
        log.warn("[DashboardService] 대시보드 락 획득 실패, 락 없이 집계 - enterpriseId: {}, error: {}",
                enterpriseId, locked.getError().orElse(null));
        return summarize(enterpriseId);
    }

    /**
     * 모든 기업의 대시보드를 미리 계산해 캐시에 기록
     */
    public WarmupReport warmupDashboards() {
        List<WarmupEntry<DashboardSummary>> entries = enterpriseRepository.findAll().stream()
                .map(Enterprise::getEnterpriseId)
                .map(id -> WarmupEntry.of(CacheKeyType.DASHBOARD.key(id), () -> summarize(id)))
                .collect(Collectors.toList());

        WarmupReport report = cacheService.warmup(entries);
        log.info("[DashboardService] 대시보드 워밍업 - 성공: {}, 실패: {}", report.getSucceeded(), report.getFailed());
        return report;
    }

    private DashboardSummary summarize(Long enterpriseId) {
        Enterprise enterprise = enterpriseRepository.findById(enterpriseId)
                .orElseThrow(() -> new ApplicationException(ErrorCode.ENTERPRISE_NOT_FOUND,
                        "enterpriseId: " + enterpriseId));

        return DashboardSummary.builder()
                .enterpriseId(enterpriseId)
                .enterpriseName(enterprise.getName())
                .departmentCount(departmentRepository.findAllByEnterpriseId(enterpriseId).size())
                .userCount(userRepository.countByEnterpriseId(enterpriseId))
                .activeStrategyCount(strategyRepository
                        .findAllByEnterpriseIdAndStatus(enterpriseId, StrategyStatus.ACTIVE).size())
                .cardCount(dashboardCardRepository.findAllByEnterpriseId(enterpriseId).size())
                .generatedAt(LocalDateTime.now())
                .build();
    }
}
