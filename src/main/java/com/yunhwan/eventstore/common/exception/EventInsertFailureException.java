package com.yunhwan.eventstore.common.exception;

import java.util.UUID;

/**
 * 이벤트가 추가되지 않았음.
 * insert 실패뿐 아니라 트랜잭션 시작/커밋 실패도 이 예외로 감싸서 올린다.
 * 호출자 입장에선 어느 쪽이든 "추가 안 됨"이고 대응(전체 재시도)도 같다.
 */
public class EventInsertFailureException extends EventStoreException {

    private final UUID streamId;

    public EventInsertFailureException(UUID streamId, String reason, Throwable cause) {
        super("could not add event to stream. streamId=" + streamId + ", reason=" + reason, cause);
        this.streamId = streamId;
    }

    public UUID getStreamId() {
        return streamId;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.INFRASTRUCTURE;
    }
}
