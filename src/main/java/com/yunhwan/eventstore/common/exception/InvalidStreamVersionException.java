package com.yunhwan.eventstore.common.exception;

public class InvalidStreamVersionException extends EventStoreException {

    private final long version;

    public InvalidStreamVersionException(long version) {
        super("expected unsigned 64-bit integer as stream version. version=" + version);
        this.version = version;
    }

    public long getVersion() {
        return version;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.VALIDATION;
    }
}
