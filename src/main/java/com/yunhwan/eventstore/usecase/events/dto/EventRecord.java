package com.yunhwan.eventstore.usecase.events.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * stream_event row 그대로. recordedAt 은 null 이거나 infinity 일 수 있다.
 */
public record EventRecord(
        UUID streamId,
        long version,
        OffsetDateTime recordedAt,
        byte[] payload
) {
}
