package com.hhplus.strategy.application.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.type.TypeFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * 캐시 값 ↔ JSON 문자열 변환
 *
 * cacheObjectMapper 를 사용한다. 값에 타입 정보를 싣지 않으므로 조회 시 항상 타입을 지정한다.
 */
@Component
public class CacheSerializer {

    private final ObjectMapper cacheObjectMapper;

    public CacheSerializer(@Qualifier("cacheObjectMapper") ObjectMapper cacheObjectMapper) {
        this.cacheObjectMapper = cacheObjectMapper;
    }

    public String serialize(Object value) {
        try {
            return cacheObjectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new CacheSerializationException("type: " + value.getClass().getName(), e);
        }
    }

    public <T> T deserialize(String payload, JavaType type) {
        try {
            return cacheObjectMapper.readValue(payload, type);
        } catch (JsonProcessingException e) {
            throw new CacheSerializationException("type: " + type, e);
        }
    }

    public JavaType typeOf(Class<?> type) {
        return cacheObjectMapper.constructType(type);
    }

    public TypeFactory getTypeFactory() {
        return cacheObjectMapper.getTypeFactory();
    }
}
