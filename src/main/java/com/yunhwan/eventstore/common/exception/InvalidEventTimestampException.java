package com.yunhwan.eventstore.common.exception;

import java.time.OffsetDateTime;
import java.util.UUID;

public class InvalidEventTimestampException extends EventStoreException {

    public InvalidEventTimestampException(UUID streamId, long version, OffsetDateTime recordedAt) {
        super("invalid event timestamp. streamId=" + streamId + ", version=" + version + ", recordedAt=" + recordedAt);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.VALIDATION;
    }
}
