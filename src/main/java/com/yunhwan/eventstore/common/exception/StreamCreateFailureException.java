package com.yunhwan.eventstore.common.exception;

public class StreamCreateFailureException extends EventStoreException {

    public StreamCreateFailureException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.INFRASTRUCTURE;
    }
}
