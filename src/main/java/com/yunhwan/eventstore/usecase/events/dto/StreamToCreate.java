package com.yunhwan.eventstore.usecase.events.dto;

import com.yunhwan.eventstore.domain.stream.IdempotencyKey;
import com.yunhwan.eventstore.domain.stream.StreamId;

import java.util.Objects;

public record StreamToCreate(
        StreamId streamId,
        IdempotencyKey idempotencyKey
) {
    public StreamToCreate {
        Objects.requireNonNull(streamId, "streamId must not be null");
        Objects.requireNonNull(idempotencyKey, "idempotencyKey must not be null");
    }
}
