package com.yunhwan.eventstore.usecase.events.dto;

import com.yunhwan.eventstore.domain.event.EventPayload;
import com.yunhwan.eventstore.domain.stream.IdempotencyKey;
import com.yunhwan.eventstore.domain.stream.StreamId;
import com.yunhwan.eventstore.domain.stream.StreamVersion;

import java.util.Objects;

/**
 * append 요청.
 * idempotencyKey 는 스트림의 키와 별개로, 재시도된 append 를 중복 insert 로부터 막는다.
 */
public record EventToAdd(
        StreamId streamId,
        IdempotencyKey idempotencyKey,
        StreamVersion expectedVersion,
        EventPayload payload
) {
    public EventToAdd {
        Objects.requireNonNull(streamId, "streamId must not be null");
        Objects.requireNonNull(idempotencyKey, "idempotencyKey must not be null");
        Objects.requireNonNull(expectedVersion, "expectedVersion must not be null");
        Objects.requireNonNull(payload, "payload must not be null");
    }
}
