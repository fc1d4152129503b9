package com.yunhwan.eventstore.common.exception;

/**
 * 이벤트 스토어의 모든 실패의 공통 부모.
 */
public abstract class EventStoreException extends RuntimeException {

    protected EventStoreException(String message) {
        super(message);
    }

    protected EventStoreException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract ErrorKind kind();
}
