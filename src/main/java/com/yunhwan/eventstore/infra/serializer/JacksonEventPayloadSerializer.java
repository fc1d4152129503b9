package com.yunhwan.eventstore.infra.serializer;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.yunhwan.eventstore.domain.event.Event;
import com.yunhwan.eventstore.domain.event.EventPayload;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * 객체를 JSON 바이트 페이로드로 바꾼다.
 * 스토어 자체는 페이로드를 해석하지 않는다. JSON 은 호출자 쪽 편의일 뿐이다.
 */
@Component
@RequiredArgsConstructor
public class JacksonEventPayloadSerializer {

    private final ObjectMapper objectMapper;

    public EventPayload toPayload(Object value) {
        byte[] bytes;
        try {
            bytes = objectMapper.writeValueAsBytes(value);
        } catch (IOException e) {
            throw new IllegalStateException("failed to serialize event payload", e);
        }
        return bytes::clone;
    }

    public <T> T read(Event event, Class<T> type) {
        try {
            return objectMapper.readValue(event.getPayload(), type);
        } catch (IOException e) {
            throw new IllegalStateException("failed to deserialize event payload. streamId="
                    + event.getStreamId() + ", version=" + event.getVersion(), e);
        }
    }
}
