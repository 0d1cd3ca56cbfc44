package com.hhplus.strategy.presentation.common;

import com.hhplus.strategy.domain.cache.CacheKey;
import com.hhplus.strategy.domain.cache.CacheKeyType;
import com.hhplus.strategy.domain.cache.CacheTag;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * HTTP 요청 → 캐시 키
 *
 * 형식: {prefix}:{METHOD}:{path}[:{정렬된 쿼리}]
 * 예: GET /api/enterprises?size=10&page=0 → api:GET:api:enterprises:page=0&size=10
 *
 * 쿼리 파라미터는 이름순으로 정렬하므로 순서만 다른 요청은 같은 키가 된다.
 */
@Component
public class RequestCacheKeyGenerator {

    private static final String API_PREFIX = "api";

    public String generate(HttpServletRequest request, String prefix) {
        String path = request.getRequestURI()
                .replaceAll("^/+|/+$", "")
                .replace('/', ':');

        StringBuilder key = new StringBuilder()
                .append(prefix).append(':')
                .append(request.getMethod().toUpperCase()).append(':')
                .append(path);

        String query = sortedQuery(request.getParameterMap());
        if (!query.isEmpty()) {
            key.append(':').append(query);
        }
        return key.toString();
    }

    /**
     * 기본 접두사(api)와 API 응답 TTL 등급, 지정한 태그로 구조화된 키 생성
     */
    public CacheKey generate(HttpServletRequest request, Set<CacheTag> tags) {
        return CacheKey.of(generate(request, API_PREFIX), tags, CacheKeyType.API_RESPONSE.getTtlTier());
    }

    private String sortedQuery(Map<String, String[]> parameters) {
        return new TreeMap<>(parameters).entrySet().stream()
                .map(entry -> entry.getKey() + "=" + String.join(",", entry.getValue()))
                .collect(Collectors.joining("&"));
    }
}
