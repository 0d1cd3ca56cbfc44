package com.hhplus.strategy.infrastructure.persistence.cache;

import org.springframework.core.annotation.AnnotatedElementUtils;
import org.springframework.data.jpa.repository.Modifying;

import java.lang.reflect.Method;
import java.util.List;
import java.util.Set;

/**
 * 리포지토리 메서드 분류
 *
 * - WRITE: save*, delete*, remove*, update*, insert*, upsert*, @Modifying 쿼리
 * - READ: find*, get*, read*, query*, search*, count*, exists*
 * - PASSTHROUGH: 그 외 (flush, 프록시 참조 조회 등)
 */
public enum RepositoryOperation {

    READ,
    WRITE,
    PASSTHROUGH;

    private static final List<String> WRITE_PREFIXES =
            List.of("save", "delete", "remove", "update", "insert", "upsert");

    private static final List<String> READ_PREFIXES =
            List.of("find", "get", "read", "query", "search", "count", "exists");

    // 지연 로딩 프록시를 돌려주는 메서드는 캐시하지 않는다
    private static final Set<String> PROXY_REFERENCE_METHODS =
            Set.of("getReferenceById", "getById", "getOne");

    public static RepositoryOperation classify(Method method) {
        if (AnnotatedElementUtils.hasAnnotation(method, Modifying.class)) {
            return WRITE;
        }
        String name = method.getName();
        if (WRITE_PREFIXES.stream().anyMatch(name::startsWith)) {
            return WRITE;
        }
        if (PROXY_REFERENCE_METHODS.contains(name)) {
            return PASSTHROUGH;
        }
        if (READ_PREFIXES.stream().anyMatch(name::startsWith)) {
            return READ;
        }
        return PASSTHROUGH;
    }
}
