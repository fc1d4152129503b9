package com.yunhwan.eventstore.common.exception;

public class StreamFetchFailureException extends EventStoreException {

    public StreamFetchFailureException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.INFRASTRUCTURE;
    }
}
