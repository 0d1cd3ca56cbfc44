package com.hhplus.strategy.presentation.dashboard;

import com.hhplus.strategy.application.dashboard.DashboardService;
import com.hhplus.strategy.application.dashboard.dto.DashboardSummary;
import com.hhplus.strategy.presentation.common.response.ApiResponse;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * DashboardController - Presentation 계층
 *
 * GET /api/enterprises/{enterpriseId}/dashboard
 */
@RestController
@RequestMapping("/api/enterprises/{enterpriseId}/dashboard")
public class DashboardController {

    private final DashboardService dashboardService;

    public DashboardController(DashboardService dashboardService) {
        this.dashboardService = dashboardService;
    }

    @GetMapping
    public ResponseEntity<ApiResponse<DashboardSummary>> getDashboard(@PathVariable Long enterpriseId) {
        return ResponseEntity.ok(ApiResponse.success(dashboardService.getDashboard(enterpriseId)));
    }
}
