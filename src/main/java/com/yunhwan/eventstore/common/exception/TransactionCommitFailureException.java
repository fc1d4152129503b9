package com.yunhwan.eventstore.common.exception;

public class TransactionCommitFailureException extends EventStoreException {

    public TransactionCommitFailureException(Throwable cause) {
        super("could not commit transaction", cause);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.INFRASTRUCTURE;
    }
}
