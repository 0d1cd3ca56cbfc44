package com.hhplus.strategy.infrastructure.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;

/**
 * ObjectMapper 설정
 *
 * 구성:
 * 1. objectMapper (@Primary): API 응답용. spring.jackson.* 설정을 그대로 따른다
 * 2. cacheObjectMapper: 캐시 값 전용. 타입 정보를 싣지 않는 순수 JSON
 *
 * cacheObjectMapper 를 빈으로 등록하면 Boot 의 기본 ObjectMapper 가 생성되지 않으므로
 * API 응답용 매퍼를 여기서 명시적으로 등록한다.
 */
@Configuration
public class JacksonConfig {

    @Bean
    @Primary
    public ObjectMapper objectMapper(Jackson2ObjectMapperBuilder builder) {
        return builder.createXmlMapper(false).build();
    }

    /**
     * 캐시 전용 ObjectMapper
     *
     * 조회는 항상 Class / JavaType 을 지정하므로 값 자체에는 타입 정보를 넣지 않는다.
     * List.of, Map.of 같은 불변 컬렉션도 그대로 저장/복원된다.
     * 캐시된 값의 필드가 추가/삭제되어도 기존 캐시를 읽을 수 있도록 알 수 없는 속성은 무시한다.
     */
    @Bean
    public ObjectMapper cacheObjectMapper() {
        return JsonMapper.builder()
                .addModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .build();
    }
}
