package com.yunhwan.eventstore.common.exception;

public class EventStreamFetchFailureException extends EventStoreException {

    public EventStreamFetchFailureException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.INFRASTRUCTURE;
    }
}
