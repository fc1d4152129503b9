package com.yunhwan.eventstore.common.exception;

import java.util.UUID;

/**
 * stream_id 또는 idempotency_key 유니크 제약 위반.
 * 어느 쪽이 충돌했는지는 구분하지 않는다. 어느 경우든 새 스트림은 만들어지지 않았다.
 */
public class StreamAlreadyExistsException extends EventStoreException {

    private final UUID streamId;
    private final UUID idempotencyKey;

    public StreamAlreadyExistsException(UUID streamId, UUID idempotencyKey, Throwable cause) {
        super("stream already exists. streamId=" + streamId + ", idempotencyKey=" + idempotencyKey, cause);
        this.streamId = streamId;
        this.idempotencyKey = idempotencyKey;
    }

    public UUID getStreamId() {
        return streamId;
    }

    public UUID getIdempotencyKey() {
        return idempotencyKey;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.CONFLICT;
    }
}
