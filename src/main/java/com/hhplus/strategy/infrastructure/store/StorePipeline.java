package com.hhplus.strategy.infrastructure.store;

/**
 * 파이프라인에 적재할 수 있는 명령
 */
public interface StorePipeline {

    void del(String key);

    void sadd(String setKey, String member);

    void srem(String setKey, String member);
}
