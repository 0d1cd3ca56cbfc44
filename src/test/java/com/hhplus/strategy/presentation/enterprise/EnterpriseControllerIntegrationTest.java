package com.hhplus.strategy.presentation.enterprise;

import com.hhplus.strategy.config.BaseIntegrationTest;
import com.hhplus.strategy.domain.department.Department;
import com.hhplus.strategy.domain.enterprise.Enterprise;
import com.hhplus.strategy.domain.user.User;
import com.hhplus.strategy.infrastructure.persistence.department.DepartmentJpaRepository;
import com.hhplus.strategy.infrastructure.persistence.enterprise.EnterpriseJpaRepository;
import com.hhplus.strategy.infrastructure.persistence.user.UserJpaRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Duration;

import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * EnterpriseControllerIntegrationTest - API 응답 캐시 통합 테스트
 *
 * 테스트 범위:
 * 1. 첫 요청 MISS, 다음 요청 HIT (X-Cache, X-Cache-Key 헤더)
 * 2. 기업 생성/변경 후 응답 캐시 무효화
 * 3. 없는 기업 404, 결과는 캐시하지 않음
 * 4. 대시보드 요약 캐시 (락 대기 초과 시에도 응답)
 */
@AutoConfigureMockMvc
@DisplayName("EnterpriseController 통합 테스트")
class EnterpriseControllerIntegrationTest extends BaseIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private EnterpriseJpaRepository enterpriseRepository;

    @Autowired
    private DepartmentJpaRepository departmentRepository;

    @Autowired
    private UserJpaRepository userRepository;

    private Long enterpriseId;

    @BeforeEach
    void setUp() {
        userRepository.deleteAllInBatch();
        departmentRepository.deleteAllInBatch();
        enterpriseRepository.deleteAllInBatch();

        enterpriseId = enterpriseRepository.save(Enterprise.create("항해전자", "manufacturing")).getEnterpriseId();
        enterpriseRepository.save(Enterprise.create("가나다소프트", "it"));
        departmentRepository.save(Department.create(enterpriseId, "영업"));
        departmentRepository.save(Department.create(enterpriseId, "개발"));
        userRepository.save(User.create("kim@example.com", "김철수", enterpriseId, null));
        store().flushAll();
    }

    @Test
    @DisplayName("기업 목록 - 첫 요청 MISS, 두 번째 요청 HIT")
    void testGetEnterprises_MissThenHit() throws Exception {
        mockMvc.perform(get("/api/enterprises"))
                .andExpect(status().isOk())
                .andExpect(header().string("X-Cache", "MISS"))
                .andExpect(header().string("X-Cache-Key", "api:GET:api:enterprises"))
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.enterprises", hasSize(2)))
                .andExpect(jsonPath("$.data.enterprises[0].name").value("가나다소프트"));

        mockMvc.perform(get("/api/enterprises"))
                .andExpect(status().isOk())
                .andExpect(header().string("X-Cache", "HIT"))
                .andExpect(jsonPath("$.data.total_count").value(2))
                .andExpect(jsonPath("$.data.enterprises[1].name").value("항해전자"));
    }

    @Test
    @DisplayName("기업 생성 - enterprise 태그 무효화로 목록 캐시 삭제")
    void testCreateEnterprise_InvalidatesList() throws Exception {
        mockMvc.perform(get("/api/enterprises"));
        assertTrue(store().get("api:GET:api:enterprises").isPresent());

        mockMvc.perform(post("/api/enterprises")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"다라마\",\"industry\":\"retail\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.data.enterprise_id").exists());

        assertTrue(store().get("api:GET:api:enterprises").isEmpty());
        mockMvc.perform(get("/api/enterprises"))
                .andExpect(header().string("X-Cache", "MISS"))
                .andExpect(jsonPath("$.data.enterprises", hasSize(3)));
    }

    @Test
    @DisplayName("기업 이름 변경 - 상세 캐시 무효화")
    void testRenameEnterprise_InvalidatesDetail() throws Exception {
        mockMvc.perform(get("/api/enterprises/{id}", enterpriseId))
                .andExpect(header().string("X-Cache", "MISS"));

        mockMvc.perform(patch("/api/enterprises/{id}", enterpriseId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"항해전자2\"}"))
                .andExpect(status().isOk());

        mockMvc.perform(get("/api/enterprises/{id}", enterpriseId))
                .andExpect(header().string("X-Cache", "MISS"))
                .andExpect(jsonPath("$.data.name").value("항해전자2"));
    }

    @Test
    @DisplayName("쿼리 파라미터 - 정렬된 쿼리가 키에 포함")
    void testGetEnterprises_QueryInKey() throws Exception {
        mockMvc.perform(get("/api/enterprises").param("size", "10").param("page", "0"))
                .andExpect(header().string("X-Cache-Key", "api:GET:api:enterprises:page=0&size=10"));
    }

    @Test
    @DisplayName("없는 기업 - 404, 캐시하지 않음")
    void testGetEnterprise_NotFound() throws Exception {
        mockMvc.perform(get("/api/enterprises/{id}", 999_999L))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error_code").value("DOMAIN_ENTERPRISE_NOT_FOUND"));

        assertTrue(store().keys("api:*").isEmpty());
    }

    @Test
    @DisplayName("대시보드 - 집계 후 dashboard:{id} 로 캐시, 락은 해제")
    void testGetDashboard_Cached() throws Exception {
        mockMvc.perform(get("/api/enterprises/{id}/dashboard", enterpriseId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.enterprise_name").value("항해전자"))
                .andExpect(jsonPath("$.data.department_count").value(2))
                .andExpect(jsonPath("$.data.user_count").value(1));

        assertTrue(store().get("dashboard:" + enterpriseId).isPresent());
        assertTrue(store().get("lock:dashboard:" + enterpriseId).isEmpty());
    }

    @Test
    @DisplayName("대시보드 - 다른 보유자가 락을 놓지 않아도 락 없이 집계, 200")
    void testGetDashboard_LockHeldElsewhere() throws Exception {
        // Given: 비정상 종료된 보유자가 남긴 락 (보유 시간 5분)
        String lockKey = "lock:dashboard:" + enterpriseId;
        assertTrue(store().setIfAbsent(lockKey, "crashed-holder", Duration.ofMinutes(5)));

        // When & Then
        mockMvc.perform(get("/api/enterprises/{id}/dashboard", enterpriseId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.enterprise_name").value("항해전자"))
                .andExpect(jsonPath("$.data.department_count").value(2));

        assertTrue(store().get("dashboard:" + enterpriseId).isPresent());
        assertEquals("crashed-holder", store().get(lockKey).orElseThrow());
    }

    @Test
    @DisplayName("대시보드 - 없는 기업 404")
    void testGetDashboard_NotFound() throws Exception {
        mockMvc.perform(get("/api/enterprises/{id}/dashboard", 999_999L))
                .andExpect(status().isNotFound());
    }
}
