package com.yunhwan.eventstore.common.exception;

import java.util.UUID;

public class StreamNotFoundException extends EventStoreException {

    private final UUID streamId;

    public StreamNotFoundException(UUID streamId) {
        super("stream not found. streamId=" + streamId);
        this.streamId = streamId;
    }

    public UUID getStreamId() {
        return streamId;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.NOT_FOUND;
    }
}
