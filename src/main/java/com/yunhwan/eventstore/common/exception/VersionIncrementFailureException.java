package com.yunhwan.eventstore.common.exception;

import java.util.UUID;

/**
 * 조건부 버전 증가가 0건 반영됨: 스트림이 없거나 현재 버전이 기대 버전과 다르다.
 * 호출자가 최신 버전을 다시 읽고 재시도하는 정상 경로의 오류.
 */
public class VersionIncrementFailureException extends EventStoreException {

    private final UUID streamId;
    private final long expectedVersion;

    public VersionIncrementFailureException(UUID streamId, long expectedVersion) {
        super(message(streamId, expectedVersion));
        this.streamId = streamId;
        this.expectedVersion = expectedVersion;
    }

    public VersionIncrementFailureException(UUID streamId, long expectedVersion, Throwable cause) {
        super(message(streamId, expectedVersion), cause);
        this.streamId = streamId;
        this.expectedVersion = expectedVersion;
    }

    private static String message(UUID streamId, long expectedVersion) {
        return "could not increment stream version. streamId=" + streamId + ", expectedVersion=" + expectedVersion;
    }

    public UUID getStreamId() {
        return streamId;
    }

    public long getExpectedVersion() {
        return expectedVersion;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.CONFLICT;
    }
}
