package com.yunhwan.eventstore.common.exception;

public class TransactionStartFailureException extends EventStoreException {

    public TransactionStartFailureException(Throwable cause) {
        super("could not start transaction", cause);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.INFRASTRUCTURE;
    }
}
