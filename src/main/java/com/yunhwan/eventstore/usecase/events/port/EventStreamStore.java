package com.yunhwan.eventstore.usecase.events.port;

import com.yunhwan.eventstore.usecase.events.dto.EventRecord;
import com.yunhwan.eventstore.usecase.events.dto.StreamRecord;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.UUID;

/**
 * event_stream / stream_event 저장소 포트.
 * 실패는 Spring {@link org.springframework.dao.DataAccessException} 으로 올라온다.
 * 제약 위반은 {@link org.springframework.dao.DataIntegrityViolationException}.
 */
public interface EventStreamStore {

    Optional<StreamRecord> findStream(UUID streamId);

    /**
     * version 0 으로 insert. stream_id / idempotency_key 유니크 제약이 중복을 막는다.
     */
    StreamRecord insertStream(UUID streamId, UUID idempotencyKey, OffsetDateTime now);

    /**
     * latest_version = expectedVersion 인 경우에만 +1 하고 새 버전을 돌려준다.
     * 갱신된 row 는 트랜잭션이 끝날 때까지 배타 락이 걸린다.
     * 스트림이 없거나 버전이 다르면 empty.
     */
    OptionalLong incrementVersion(UUID streamId, long expectedVersion);

    EventRecord insertEvent(UUID streamId, UUID idempotencyKey, long version, byte[] payload, OffsetDateTime recordedAt);

    /**
     * 버전 오름차순.
     */
    List<EventRecord> findEvents(UUID streamId);
}
