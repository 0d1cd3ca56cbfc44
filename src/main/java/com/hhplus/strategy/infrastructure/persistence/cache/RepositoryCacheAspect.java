package com.hhplus.strategy.infrastructure.persistence.cache;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.type.TypeFactory;
import com.hhplus.strategy.application.cache.CacheSerializer;
import com.hhplus.strategy.application.cache.CacheService;
import com.hhplus.strategy.domain.cache.CacheKey;
import com.hhplus.strategy.domain.cache.EntityCachePolicy;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.reflect.MethodSignature;
import org.springframework.core.ResolvableType;
import org.springframework.data.domain.Slice;
import org.springframework.data.repository.Repository;
import org.springframework.data.repository.core.support.AbstractRepositoryMetadata;
import org.springframework.stereotype.Component;
import org.springframework.util.ClassUtils;

import java.lang.reflect.Method;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Future;
import java.util.stream.BaseStream;

/**
 * 리포지토리 캐시 AOP (조회 캐시 + 변경 시 무효화)
 *
 * 애플리케이션 패키지의 Spring Data 리포지토리 메서드를 가로챈다.
 *
 * 조회 (READ):
 * 1. 메서드와 인자로 캐시 키 생성 (QueryCacheKeyGenerator)
 * 2. 캐시 히트면 DB 조회 없이 반환 (Optional 은 다시 감싸서 반환)
 * 3. 미스면 조회 후 모델의 TTL 등급과 태그로 기록
 * - 빈 Optional, null 은 캐시하지 않는다
 * - Stream, Page/Slice, Iterator, Future 반환 메서드는 캐시하지 않는다
 * - Object, 프로젝션 인터페이스처럼 반환 타입만으로 복원할 수 없는 값은 캐시하지 않는다
 * - 현재 트랜잭션에서 변경한 모델은 커밋 전까지 캐시를 건너뛴다
 *
 * 변경 (WRITE):
 * 1. 리포지토리 메서드 실행
 * 2. 모델 조회 캐시와 태그 무효화 (트랜잭션 중이면 커밋 후)
 *
 * 캐시 처리 실패는 로그만 남기고 리포지토리 결과를 그대로 반환한다.
 * 리포지토리 자체의 예외는 그대로 전파된다.
 */
@Slf4j
@Aspect
@Component
public class RepositoryCacheAspect {

    private static final String BASE_PACKAGE = "com.hhplus.strategy";

    private final CacheService cacheService;
    private final CacheSerializer cacheSerializer;
    private final EntityCachePolicy entityCachePolicy;
    private final QueryCacheKeyGenerator keyGenerator;
    private final ModelCacheInvalidator invalidator;

    private final Map<Class<?>, Optional<RepositoryTarget>> targets = new ConcurrentHashMap<>();

    public RepositoryCacheAspect(CacheService cacheService,
                                 CacheSerializer cacheSerializer,
                                 EntityCachePolicy entityCachePolicy,
                                 QueryCacheKeyGenerator keyGenerator,
                                 ModelCacheInvalidator invalidator) {
        this.cacheService = cacheService;
        this.cacheSerializer = cacheSerializer;
        this.entityCachePolicy = entityCachePolicy;
        this.keyGenerator = keyGenerator;
        this.invalidator = invalidator;
    }

    @Around("execution(* org.springframework.data.repository.Repository+.*(..))")
    public Object around(ProceedingJoinPoint joinPoint) throws Throwable {
        Object target = joinPoint.getTarget();
        Optional<RepositoryTarget> repository = target == null
                ? Optional.empty()
                : targets.computeIfAbsent(target.getClass(), RepositoryCacheAspect::resolveTarget);
        if (repository.isEmpty()) {
            return joinPoint.proceed();
        }

        Method method = ((MethodSignature) joinPoint.getSignature()).getMethod();
        return switch (RepositoryOperation.classify(method)) {
            case READ -> cachedRead(joinPoint, repository.get(), method);
            case WRITE -> writeAndInvalidate(joinPoint, repository.get());
            case PASSTHROUGH -> joinPoint.proceed();
        };
    }

    private Object cachedRead(ProceedingJoinPoint joinPoint, RepositoryTarget repository, Method method)
            throws Throwable {
        String model = repository.model;
        ReadPlan plan = planRead(repository, method, joinPoint.getArgs());
        if (plan == null || invalidator.hasPendingInvalidation(model)) {
            return joinPoint.proceed();
        }

        Optional<Object> cached = lookup(plan);
        if (cached.isPresent()) {
            log.debug("[RepositoryCache] 캐시 히트 - key: {}", plan.key.getValue());
            return plan.optional ? Optional.of(cached.get()) : cached.get();
        }

        Object result = joinPoint.proceed();
        store(plan, result);
        return result;
    }

    private Object writeAndInvalidate(ProceedingJoinPoint joinPoint, RepositoryTarget repository) throws Throwable {
        Object result = joinPoint.proceed();
        try {
            invalidator.invalidateAfterCommit(repository.model);
        } catch (RuntimeException e) {
            log.warn("[RepositoryCache] 무효화 처리 실패 - model: {}", repository.model, e);
        }
        return result;
    }

    private ReadPlan planRead(RepositoryTarget repository, Method method, Object[] args) {
        try {
            ResolvableType returnType = ResolvableType.forMethodReturnType(method, repository.repositoryInterface);
            Class<?> rawType = returnType.resolve(Object.class);
            if (!isCacheableReturnType(rawType)) {
                return null;
            }

            boolean optional = Optional.class.equals(rawType);
            ResolvableType valueType = optional ? returnType.getGeneric(0) : returnType;

            Optional<String> key = keyGenerator.generate(repository.model, method, args);
            if (key.isEmpty()) {
                return null;
            }

            JavaType javaType = toJavaType(valueType);
            if (!isRestorable(javaType)) {
                log.debug("[RepositoryCache] 타입으로 복원할 수 없는 반환값 - model: {}, method: {}, type: {}",
                        repository.model, method.getName(), javaType);
                return null;
            }

            CacheKey cacheKey = CacheKey.of(key.get(),
                    entityCachePolicy.invalidationTagsOf(repository.model),
                    entityCachePolicy.ttlTierOf(repository.model));
            return new ReadPlan(cacheKey, javaType, optional);
        } catch (RuntimeException e) {
            log.warn("[RepositoryCache] 조회 캐시 준비 실패 - model: {}, method: {}",
                    repository.model, method.getName(), e);
            return null;
        }
    }

    private Optional<Object> lookup(ReadPlan plan) {
        try {
            return cacheService.get(plan.key.getValue(), plan.valueType);
        } catch (RuntimeException e) {
            log.warn("[RepositoryCache] 캐시 조회 실패 - key: {}", plan.key.getValue(), e);
            return Optional.empty();
        }
    }

    private void store(ReadPlan plan, Object result) {
        Object value = result;
        if (plan.optional) {
            value = result == null ? null : ((Optional<?>) result).orElse(null);
        }
        if (value == null) {
            return;
        }
        try {
            cacheService.set(plan.key, value);
        } catch (RuntimeException e) {
            log.warn("[RepositoryCache] 캐시 기록 실패 - key: {}", plan.key.getValue(), e);
        }
    }

    private boolean isCacheableReturnType(Class<?> rawType) {
        return !(void.class.equals(rawType)
                || Void.class.equals(rawType)
                || Slice.class.isAssignableFrom(rawType)
                || BaseStream.class.isAssignableFrom(rawType)
                || Iterator.class.isAssignableFrom(rawType)
                || Future.class.isAssignableFrom(rawType));
    }

    /**
     * 캐시 값에는 타입 정보가 없으므로 반환 타입만으로 복원 가능한 경우에만 캐시한다.
     * Object, Object[] 행, 인터페이스 프로젝션은 제외한다.
     */
    private boolean isRestorable(JavaType type) {
        if (type.isJavaLangObject()) {
            return false;
        }
        if (type.isInterface() && !type.isContainerType()) {
            return false;
        }
        if (type.isArrayType() || type.isContainerType()) {
            if (type.getKeyType() != null && !isRestorable(type.getKeyType())) {
                return false;
            }
            return isRestorable(type.getContentType());
        }
        for (int i = 0; i < type.containedTypeCount(); i++) {
            if (!isRestorable(type.containedType(i))) {
                return false;
            }
        }
        return true;
    }

    private JavaType toJavaType(ResolvableType type) {
        TypeFactory typeFactory = cacheSerializer.getTypeFactory();
        if (type.isArray()) {
            return typeFactory.constructArrayType(toJavaType(type.getComponentType()));
        }
        Class<?> raw = type.resolve(Object.class);
        if (!type.hasGenerics()) {
            return typeFactory.constructType(raw);
        }
        ResolvableType[] generics = type.getGenerics();
        JavaType[] parameters = new JavaType[generics.length];
        for (int i = 0; i < generics.length; i++) {
            parameters[i] = toJavaType(generics[i]);
        }
        return typeFactory.constructParametricType(raw, parameters);
    }

    /**
     * 대상 객체(리포지토리 프록시)에서 애플리케이션 리포지토리 인터페이스와 도메인 모델을 찾는다.
     */
    private static Optional<RepositoryTarget> resolveTarget(Class<?> targetClass) {
        for (Class<?> candidate : ClassUtils.getAllInterfacesForClassAsSet(targetClass)) {
            if (Repository.class.isAssignableFrom(candidate)
                    && candidate.getName().startsWith(BASE_PACKAGE)) {
                Class<?> domainType = AbstractRepositoryMetadata.getMetadata(candidate).getDomainType();
                log.debug("[RepositoryCache] 리포지토리 등록 - repository: {}, model: {}",
                        candidate.getSimpleName(), domainType.getSimpleName());
                return Optional.of(new RepositoryTarget(candidate, domainType.getSimpleName()));
            }
        }
        return Optional.empty();
    }

    private static final class RepositoryTarget {

        private final Class<?> repositoryInterface;
        private final String model;

        private RepositoryTarget(Class<?> repositoryInterface, String model) {
            this.repositoryInterface = repositoryInterface;
            this.model = model;
        }
    }

    private static final class ReadPlan {

        private final CacheKey key;
        private final JavaType valueType;
        private final boolean optional;

        private ReadPlan(CacheKey key, JavaType valueType, boolean optional) {
            this.key = key;
            this.valueType = valueType;
            this.optional = optional;
        }
    }
}
