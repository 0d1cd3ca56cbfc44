package com.hhplus.strategy.config;

import com.hhplus.strategy.infrastructure.store.InMemoryStoreClient;
import com.hhplus.strategy.infrastructure.store.StoreClient;
import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

/**
 * 통합 테스트 기본 클래스
 *
 * - H2 (MySQL 모드) + 인메모리 캐시 저장소 (application-test.yml)
 * - 테스트마다 캐시 저장소를 비운다
 */
@SpringBootTest
@ActiveProfiles("test")
public abstract class BaseIntegrationTest {

    @Autowired
    protected StoreClient storeClient;

    @BeforeEach
    void resetCacheStore() {
        ((InMemoryStoreClient) storeClient).flushAll();
    }

    protected InMemoryStoreClient store() {
        return (InMemoryStoreClient) storeClient;
    }
}
