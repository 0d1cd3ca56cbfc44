package com.hhplus.strategy.presentation.common;

import com.hhplus.strategy.domain.cache.CacheKey;
import com.hhplus.strategy.domain.cache.CacheTag;
import com.hhplus.strategy.domain.cache.TtlTier;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;

import java.util.EnumSet;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RequestCacheKeyGenerator 단위 테스트")
class RequestCacheKeyGeneratorTest {

    private final RequestCacheKeyGenerator generator = new RequestCacheKeyGenerator();

    @Test
    @DisplayName("쿼리 없음 - prefix:METHOD:path")
    void testGenerate_NoQuery() {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/enterprises");

        assertEquals("api:GET:api:enterprises", generator.generate(request, "api"));
    }

    @Test
    @DisplayName("쿼리 파라미터 - 이름순 정렬, 순서만 다른 요청은 같은 키")
    void testGenerate_SortedQuery() {
        MockHttpServletRequest first = new MockHttpServletRequest("GET", "/api/strategies/");
        first.addParameter("size", "10");
        first.addParameter("page", "0");
        MockHttpServletRequest second = new MockHttpServletRequest("GET", "/api/strategies");
        second.addParameter("page", "0");
        second.addParameter("size", "10");

        assertEquals("api:GET:api:strategies:page=0&size=10", generator.generate(first, "api"));
        assertEquals(generator.generate(first, "api"), generator.generate(second, "api"));
    }

    @Test
    @DisplayName("다중 값 파라미터 - 쉼표로 연결")
    void testGenerate_MultiValueParameter() {
        MockHttpServletRequest request = new MockHttpServletRequest("get", "/api/enterprises");
        request.addParameter("industry", "it", "finance");

        assertEquals("v1:GET:api:enterprises:industry=it,finance", generator.generate(request, "v1"));
    }

    @Test
    @DisplayName("구조화된 키 - 지정한 태그와 API 응답 TTL 등급")
    void testGenerate_CacheKey() {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/enterprises");

        CacheKey key = generator.generate(request, EnumSet.of(CacheTag.ENTERPRISE));

        assertEquals("api:GET:api:enterprises", key.getValue());
        assertEquals(EnumSet.of(CacheTag.ENTERPRISE), key.getTags());
        assertEquals(TtlTier.API_LIST, key.getTtlTier());
    }
}
