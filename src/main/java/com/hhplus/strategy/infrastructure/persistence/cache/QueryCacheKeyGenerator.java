package com.hhplus.strategy.infrastructure.persistence.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.hhplus.strategy.domain.cache.CacheKeyType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Example;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Component;

import java.lang.reflect.Method;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * 리포지토리 조회 → 캐시 키
 *
 * - findById(id): jpa:{Model}:id:{id}
 * - 그 외: jpa:{Model}:query:{base64url(정규화된 JSON)}
 *
 * 정규화:
 * - 메서드 이름과 파라미터 타입, 인자를 JSON 으로 직렬화
 * - 객체 속성과 Map 키를 정렬하므로 구조가 같은 조회는 항상 같은 키가 된다
 * - Pageable, Sort 는 페이지/크기/정렬 조건만 사용
 *
 * Example, Specification 처럼 직렬화할 수 없는 인자가 있으면 캐시하지 않는다.
 */
@Slf4j
@Component
public class QueryCacheKeyGenerator {

    private static final String KEY_PREFIX = "jpa:";

    private final ObjectMapper canonicalMapper = JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
            .build();

    /**
     * @return 캐시할 수 없는 조회면 빈 Optional
     */
    public Optional<String> generate(String model, Method method, Object[] args) {
        if ("findById".equals(method.getName()) && args.length == 1 && args[0] != null) {
            return Optional.of(CacheKeyType.JPA_ENTITY_BY_ID.buildKey(model, args[0]));
        }

        List<Object> normalizedArgs = new ArrayList<>();
        for (Object arg : args) {
            if (!isCacheable(arg)) {
                log.debug("[RepositoryCache] 캐시할 수 없는 조회 인자 - model: {}, method: {}, arg: {}",
                        model, method.getName(), arg.getClass().getSimpleName());
                return Optional.empty();
            }
            normalizedArgs.add(normalize(arg));
        }

        Map<String, Object> query = new LinkedHashMap<>();
        query.put("method", method.getName() + "(" + parameterTypes(method) + ")");
        query.put("args", normalizedArgs);

        try {
            String json = canonicalMapper.writeValueAsString(query);
            String fingerprint = Base64.getUrlEncoder().withoutPadding()
                    .encodeToString(json.getBytes(StandardCharsets.UTF_8));
            return Optional.of(CacheKeyType.JPA_QUERY.buildKey(model, fingerprint));
        } catch (JsonProcessingException e) {
            log.debug("[RepositoryCache] 조회 인자 직렬화 실패 - model: {}, method: {}", model, method.getName());
            return Optional.empty();
        }
    }

    /**
     * 모델의 모든 조회 캐시에 매칭되는 패턴 (jpa:{Model}:*)
     */
    public static String modelPattern(String model) {
        return KEY_PREFIX + model + ":*";
    }

    private boolean isCacheable(Object arg) {
        if (arg == null) {
            return true;
        }
        if (arg instanceof Example) {
            return false;
        }
        // 람다/익명 클래스 (Specification 등)
        Class<?> type = arg.getClass();
        return !type.isSynthetic() && !type.isAnonymousClass() && !type.getName().contains("$$Lambda");
    }

    private Object normalize(Object arg) {
        if (arg instanceof Pageable) {
            Pageable pageable = (Pageable) arg;
            if (pageable.isUnpaged()) {
                Map<String, Object> unpaged = new LinkedHashMap<>();
                unpaged.put("unpaged", true);
                unpaged.put("sort", normalize(pageable.getSort()));
                return unpaged;
            }
            Map<String, Object> page = new LinkedHashMap<>();
            page.put("page", pageable.getPageNumber());
            page.put("size", pageable.getPageSize());
            page.put("sort", normalize(pageable.getSort()));
            return page;
        }
        if (arg instanceof Sort) {
            return ((Sort) arg).stream()
                    .map(order -> order.getProperty() + ":" + order.getDirection().name())
                    .collect(Collectors.toList());
        }
        if (arg instanceof Enum) {
            return ((Enum<?>) arg).name();
        }
        if (arg != null && arg.getClass().isArray() && !arg.getClass().getComponentType().isPrimitive()) {
            return Arrays.asList((Object[]) arg);
        }
        return arg;
    }

    private String parameterTypes(Method method) {
        return Arrays.stream(method.getParameterTypes())
                .map(Class::getSimpleName)
                .collect(Collectors.joining(","));
    }
}
