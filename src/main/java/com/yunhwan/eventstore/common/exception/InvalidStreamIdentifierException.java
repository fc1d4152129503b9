package com.yunhwan.eventstore.common.exception;

public class InvalidStreamIdentifierException extends EventStoreException {

    public InvalidStreamIdentifierException(String raw, Throwable cause) {
        super("expected UUID stream identifier. value=" + raw, cause);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.VALIDATION;
    }
}
