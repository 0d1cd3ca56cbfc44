package com.hhplus.strategy.presentation.cache;

import com.hhplus.strategy.application.cache.CacheService;
import com.hhplus.strategy.application.dashboard.DashboardService;
import com.hhplus.strategy.common.exception.ApplicationException;
import com.hhplus.strategy.common.exception.ErrorCode;
import com.hhplus.strategy.domain.cache.CacheTag;
import com.hhplus.strategy.presentation.cache.response.CacheStatsResponse;
import com.hhplus.strategy.presentation.cache.response.InvalidationResponse;
import com.hhplus.strategy.presentation.cache.response.WarmupResponse;
import com.hhplus.strategy.presentation.common.response.ApiResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * CacheAdminController - 캐시 운영 API
 *
 * API:
 * - GET /api/admin/cache/stats (저장소 진단)
 * - POST /api/admin/cache/cleanup (빈 태그 Set 정리)
 * - POST /api/admin/cache/warmup (대시보드 워밍업)
 * - DELETE /api/admin/cache/tags/{tag} (태그 무효화)
 * - DELETE /api/admin/cache/keys?pattern= (패턴 삭제)
 *
 * 저장소 장애 시에도 200 으로 응답한다 (connected=false, removed_count=0).
 */
@RestController
@RequestMapping("/api/admin/cache")
public class CacheAdminController {

    private static final Logger log = LoggerFactory.getLogger(CacheAdminController.class);

    private final CacheService cacheService;
    private final DashboardService dashboardService;

    public CacheAdminController(CacheService cacheService, DashboardService dashboardService) {
        this.cacheService = cacheService;
        this.dashboardService = dashboardService;
    }

    @GetMapping("/stats")
    public ResponseEntity<ApiResponse<CacheStatsResponse>> getStats() {
        CacheStatsResponse response = cacheService.getStats()
                .map(CacheStatsResponse::from)
                .orElseGet(CacheStatsResponse::disconnected);
        return ResponseEntity.ok(ApiResponse.success(response));
    }

    @PostMapping("/cleanup")
    public ResponseEntity<ApiResponse<InvalidationResponse>> cleanup() {
        int removed = cacheService.cleanup();
        return ResponseEntity.ok(ApiResponse.success(new InvalidationResponse("tag:*", removed)));
    }

    @PostMapping("/warmup")
    public ResponseEntity<ApiResponse<WarmupResponse>> warmup() {
        return ResponseEntity.ok(ApiResponse.success(WarmupResponse.from(dashboardService.warmupDashboards())));
    }

    /**
     * 태그 무효화
     *
     * @param tag "strategy" 또는 "tag:strategy"
     */
    @DeleteMapping("/tags/{tag}")
    public ResponseEntity<ApiResponse<InvalidationResponse>> invalidateTag(@PathVariable String tag) {
        CacheTag cacheTag = CacheTag.fromKey(tag)
                .orElseThrow(() -> new ApplicationException(ErrorCode.UNKNOWN_CACHE_TAG, "tag: " + tag));
        long removed = cacheService.invalidateByTag(cacheTag);
        log.info("[CacheAdminController] 태그 무효화 요청 - tag: {}, removed: {}", cacheTag.getKey(), removed);
        return ResponseEntity.ok(ApiResponse.success(new InvalidationResponse(cacheTag.getKey(), removed)));
    }

    @DeleteMapping("/keys")
    public ResponseEntity<ApiResponse<InvalidationResponse>> deleteByPattern(@RequestParam String pattern) {
        if (pattern.isBlank()) {
            throw new ApplicationException(ErrorCode.INVALID_CACHE_KEY, "pattern 은 비어 있을 수 없습니다");
        }
        long removed = cacheService.deleteMany(pattern);
        log.info("[CacheAdminController] 패턴 삭제 요청 - pattern: {}, removed: {}", pattern, removed);
        return ResponseEntity.ok(ApiResponse.success(new InvalidationResponse(pattern, removed)));
    }
}
