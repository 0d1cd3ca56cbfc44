package com.hhplus.strategy.infrastructure.persistence.cache;

import com.hhplus.strategy.domain.strategy.StrategyStatus;
import com.hhplus.strategy.infrastructure.persistence.strategy.StrategyJpaRepository;
import com.hhplus.strategy.infrastructure.persistence.user.UserJpaRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RepositoryOperation 분류 테스트")
class RepositoryOperationTest {

    @Test
    @DisplayName("조회 메서드 - READ")
    void testClassify_Read() throws Exception {
        assertEquals(RepositoryOperation.READ,
                RepositoryOperation.classify(UserJpaRepository.class.getMethod("findByEmail", String.class)));
        assertEquals(RepositoryOperation.READ,
                RepositoryOperation.classify(UserJpaRepository.class.getMethod("countByEnterpriseId", Long.class)));
        assertEquals(RepositoryOperation.READ,
                RepositoryOperation.classify(UserJpaRepository.class.getMethod("findById", Object.class)));
        assertEquals(RepositoryOperation.READ, RepositoryOperation.classify(StrategyJpaRepository.class
                .getMethod("existsByEnterpriseIdAndTitle", Long.class, String.class)));
        assertEquals(RepositoryOperation.READ, RepositoryOperation.classify(StrategyJpaRepository.class
                .getMethod("findAllByEnterpriseIdAndStatus", Long.class, StrategyStatus.class)));
    }

    @Test
    @DisplayName("변경 메서드 - WRITE")
    void testClassify_Write() throws Exception {
        assertEquals(RepositoryOperation.WRITE,
                RepositoryOperation.classify(UserJpaRepository.class.getMethod("save", Object.class)));
        assertEquals(RepositoryOperation.WRITE,
                RepositoryOperation.classify(UserJpaRepository.class.getMethod("deleteById", Object.class)));
        assertEquals(RepositoryOperation.WRITE,
                RepositoryOperation.classify(UserJpaRepository.class.getMethod("deleteAllInBatch")));
    }

    @Test
    @DisplayName("@Modifying 쿼리 - 이름과 관계없이 WRITE")
    void testClassify_ModifyingQuery() throws Exception {
        assertEquals(RepositoryOperation.WRITE, RepositoryOperation.classify(
                UserJpaRepository.class.getMethod("moveDepartment", Long.class, Long.class)));
    }

    @Test
    @DisplayName("프록시 참조 조회, flush - PASSTHROUGH")
    void testClassify_Passthrough() throws Exception {
        assertEquals(RepositoryOperation.PASSTHROUGH,
                RepositoryOperation.classify(UserJpaRepository.class.getMethod("getReferenceById", Object.class)));
        assertEquals(RepositoryOperation.PASSTHROUGH,
                RepositoryOperation.classify(UserJpaRepository.class.getMethod("flush")));
    }
}
