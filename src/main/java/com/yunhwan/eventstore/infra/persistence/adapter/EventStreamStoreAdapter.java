package com.yunhwan.eventstore.infra.persistence.adapter;

import com.yunhwan.eventstore.infra.persistence.entity.EventStreamEntity;
import com.yunhwan.eventstore.infra.persistence.entity.StoredEventEntity;
import com.yunhwan.eventstore.infra.persistence.jpa.EventStreamJpaRepository;
import com.yunhwan.eventstore.infra.persistence.jpa.StoredEventJpaRepository;
import com.yunhwan.eventstore.usecase.events.dto.EventRecord;
import com.yunhwan.eventstore.usecase.events.dto.StreamRecord;
import com.yunhwan.eventstore.usecase.events.port.EventStreamStore;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.UUID;

@Repository
@RequiredArgsConstructor
@Transactional
public class EventStreamStoreAdapter implements EventStreamStore {

    private final EventStreamJpaRepository streamRepo;
    private final StoredEventJpaRepository eventRepo;

    @Override
    @Transactional(readOnly = true)
    public Optional<StreamRecord> findStream(UUID streamId) {
        return streamRepo.findById(streamId).map(EventStreamStoreAdapter::toRecord);
    }

    @Override
    public StreamRecord insertStream(UUID streamId, UUID idempotencyKey, OffsetDateTime now) {
        return toRecord(streamRepo.insertReturning(streamId, idempotencyKey, now));
    }

    @Override
    public OptionalLong incrementVersion(UUID streamId, long expectedVersion) {
        return streamRepo.incrementVersion(streamId, expectedVersion)
                .map(OptionalLong::of)
                .orElseGet(OptionalLong::empty);
    }

    @Override
    public EventRecord insertEvent(UUID streamId, UUID idempotencyKey, long version, byte[] payload,
                                   OffsetDateTime recordedAt) {
        return toRecord(eventRepo.insertReturning(streamId, idempotencyKey, version, recordedAt, payload));
    }

    @Override
    @Transactional(readOnly = true)
    public List<EventRecord> findEvents(UUID streamId) {
        return eventRepo.findAllByStreamIdOrderByVersionAsc(streamId).stream()
                .map(EventStreamStoreAdapter::toRecord)
                .toList();
    }

    private static StreamRecord toRecord(EventStreamEntity e) {
        return new StreamRecord(e.getStreamId(), e.getIdempotencyKey(), e.getLatestVersion());
    }

    private static EventRecord toRecord(StoredEventEntity e) {
        return new EventRecord(e.getStreamId(), e.getVersion(), e.getRecordedAt(), e.getPayload());
    }
}
