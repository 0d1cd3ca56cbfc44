package com.hhplus.strategy.presentation.enterprise;

import com.hhplus.strategy.application.enterprise.EnterpriseService;
import com.hhplus.strategy.application.enterprise.dto.EnterpriseListResponse;
import com.hhplus.strategy.application.enterprise.dto.EnterpriseResponse;
import com.hhplus.strategy.domain.cache.CacheKey;
import com.hhplus.strategy.domain.cache.CacheTag;
import com.hhplus.strategy.domain.cache.TtlTier;
import com.hhplus.strategy.presentation.common.CachedApiResponder;
import com.hhplus.strategy.presentation.common.RequestCacheKeyGenerator;
import com.hhplus.strategy.presentation.common.response.ApiResponse;
import com.hhplus.strategy.presentation.enterprise.request.CreateEnterpriseRequest;
import com.hhplus.strategy.presentation.enterprise.request.RenameEnterpriseRequest;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.EnumSet;

/**
 * EnterpriseController - Presentation 계층
 *
 * API:
 * - GET /api/enterprises (목록, 응답 캐시)
 * - GET /api/enterprises/{enterpriseId} (상세, 응답 캐시)
 * - POST /api/enterprises (생성)
 * - PATCH /api/enterprises/{enterpriseId} (이름 변경)
 *
 * 응답 캐시 키는 enterprise 태그를 가지므로 기업 변경 시 함께 무효화된다.
 */
@RestController
@RequestMapping("/api/enterprises")
public class EnterpriseController {

    private static final Logger log = LoggerFactory.getLogger(EnterpriseController.class);

    private final EnterpriseService enterpriseService;
    private final CachedApiResponder cachedApiResponder;
    private final RequestCacheKeyGenerator requestCacheKeyGenerator;

    public EnterpriseController(EnterpriseService enterpriseService,
                                CachedApiResponder cachedApiResponder,
                                RequestCacheKeyGenerator requestCacheKeyGenerator) {
        this.enterpriseService = enterpriseService;
        this.cachedApiResponder = cachedApiResponder;
        this.requestCacheKeyGenerator = requestCacheKeyGenerator;
    }

    @GetMapping
    public ResponseEntity<ApiResponse<EnterpriseListResponse>> getEnterprises(HttpServletRequest request) {
        CacheKey key = requestCacheKeyGenerator.generate(request, EnumSet.of(CacheTag.ENTERPRISE));
        return cachedApiResponder.respond(key, EnterpriseListResponse.class, enterpriseService::getEnterprises);
    }

    @GetMapping("/{enterpriseId}")
    public ResponseEntity<ApiResponse<EnterpriseResponse>> getEnterprise(
            @PathVariable Long enterpriseId,
            HttpServletRequest request) {
        CacheKey key = requestCacheKeyGenerator.generate(request, EnumSet.of(CacheTag.ENTERPRISE))
                .withTtlTier(TtlTier.API_DETAIL);
        return cachedApiResponder.respond(key, EnterpriseResponse.class,
                () -> enterpriseService.getEnterprise(enterpriseId));
    }

    @PostMapping
    public ResponseEntity<ApiResponse<EnterpriseResponse>> createEnterprise(
            @RequestBody CreateEnterpriseRequest request) {
        EnterpriseResponse response = enterpriseService.createEnterprise(request.getName(), request.getIndustry());
        log.info("[EnterpriseController] 기업 생성 - enterpriseId: {}", response.getEnterpriseId());
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.success(response));
    }

    @PatchMapping("/{enterpriseId}")
    public ResponseEntity<ApiResponse<EnterpriseResponse>> renameEnterprise(
            @PathVariable Long enterpriseId,
            @RequestBody RenameEnterpriseRequest request) {
        EnterpriseResponse response = enterpriseService.renameEnterprise(enterpriseId, request.getName());
        return ResponseEntity.ok(ApiResponse.success(response));
    }
}
