package com.yunhwan.eventstore.usecase.events.dto;

import java.util.UUID;

/**
 * event_stream row 그대로. 검증 전 값이다.
 */
public record StreamRecord(
        UUID streamId,
        UUID idempotencyKey,
        long latestVersion
) {
}
