package com.yunhwan.eventstore.usecase.events;

import com.yunhwan.eventstore.common.exception.EventInsertFailureException;
import com.yunhwan.eventstore.common.exception.EventStoreException;
import com.yunhwan.eventstore.common.exception.EventStreamFetchFailureException;
import com.yunhwan.eventstore.common.exception.StreamAlreadyExistsException;
import com.yunhwan.eventstore.common.exception.StreamCreateFailureException;
import com.yunhwan.eventstore.common.exception.StreamFetchFailureException;
import com.yunhwan.eventstore.common.exception.StreamNotFoundException;
import com.yunhwan.eventstore.common.exception.TransactionCommitFailureException;
import com.yunhwan.eventstore.common.exception.TransactionStartFailureException;
import com.yunhwan.eventstore.common.exception.VersionIncrementFailureException;
import com.yunhwan.eventstore.domain.event.Event;
import com.yunhwan.eventstore.domain.stream.Stream;
import com.yunhwan.eventstore.domain.stream.StreamId;
import com.yunhwan.eventstore.infra.logging.EventStoreEventLogger;
import com.yunhwan.eventstore.infra.metrics.EventStoreMetrics;
import com.yunhwan.eventstore.usecase.events.dto.EventRecord;
import com.yunhwan.eventstore.usecase.events.dto.EventToAdd;
import com.yunhwan.eventstore.usecase.events.dto.StreamRecord;
import com.yunhwan.eventstore.usecase.events.dto.StreamToCreate;
import com.yunhwan.eventstore.usecase.events.port.EventStreamStore;
import com.yunhwan.eventstore.usecase.events.port.TransactionalExecutor;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import static com.yunhwan.eventstore.infra.metrics.MetricsConfig.RESULT_SUCCESS;

@Service
@RequiredArgsConstructor
public class EventStoreImpl implements EventStore {

    private final EventStreamStore eventStreamStore;
    private final TransactionalExecutor transactionalExecutor;
    private final Clock clock;
    private final EventStoreEventLogger eventLogger;
    private final EventStoreMetrics metrics;

    @Override
    public Stream getStream(StreamId streamId) {
        // 커넥션 획득 실패, 트랜잭션 타임아웃은 DataAccessException 이 아니라 TransactionException 으로 온다.
        try {
            StreamRecord row = eventStreamStore.findStream(streamId.value())
                    .orElseThrow(() -> new StreamNotFoundException(streamId.value()));
            return toStream(row);
        } catch (DataAccessException | TransactionException e) {
            throw readFailed("get_stream", streamId,
                    new StreamFetchFailureException("failed to get stream. streamId=" + streamId, e));
        } catch (StreamNotFoundException e) {
            throw e;
        } catch (EventStoreException e) {
            throw readFailed("get_stream", streamId, e);
        }
    }

    /**
     * 유니크 제약(stream_id, idempotency_key)이 유일한 중복 방지 수단이다.
     * 먼저 조회하고 insert 하는 방식은 경합에 취약하므로 쓰지 않는다.
     */
    @Override
    public Stream createStream(StreamToCreate streamToCreate) {
        UUID streamId = streamToCreate.streamId().value();
        UUID idempotencyKey = streamToCreate.idempotencyKey().value();

        try {
            Stream created = transactionalExecutor.runInTransaction(store -> {
                StreamRecord row;
                try {
                    row = store.insertStream(streamId, idempotencyKey, OffsetDateTime.now(clock));
                } catch (DataIntegrityViolationException e) {
                    throw new StreamAlreadyExistsException(streamId, idempotencyKey, e);
                } catch (DataAccessException | TransactionException e) {
                    throw new StreamCreateFailureException("failed to create stream. streamId=" + streamId, e);
                }
                return toStream(row);
            });

            metrics.streamCreateCompleted(RESULT_SUCCESS);
            eventLogger.streamCreated(created);
            return created;
        } catch (TransactionStartFailureException | TransactionCommitFailureException e) {
            StreamCreateFailureException failure =
                    new StreamCreateFailureException("failed to create stream. streamId=" + streamId, e);
            createFailed(streamToCreate, failure);
            throw failure;
        } catch (EventStoreException e) {
            createFailed(streamToCreate, e);
            throw e;
        }
    }

    @Override
    public List<Event> getEvents(StreamId streamId) {
        List<EventRecord> rows;
        try {
            rows = eventStreamStore.findEvents(streamId.value());
        } catch (DataAccessException | TransactionException e) {
            throw readFailed("get_events", streamId,
                    new EventStreamFetchFailureException("could not fetch event stream. streamId=" + streamId, e));
        }

        try {
            return rows.stream()
                    .map(EventStoreImpl::toEvent)
                    .toList();
        } catch (EventStoreException e) {
            throw readFailed("get_events", streamId, e);
        }
    }

    /**
     * 한 트랜잭션으로:
     * 1) 조건부 버전 증가 (낙관적 동시성 검사 + 스트림 row 배타 락)
     * 2) 증가된 버전으로 이벤트 insert
     * 3) 도메인 이벤트로 변환
     * 중간에 실패하면 버전 증가와 insert 둘 다 반영되지 않는다.
     */
    @Override
    public Event addEventToStream(EventToAdd eventToAdd) {
        Timer.Sample sample = metrics.startAppend();
        try {
            Event event = transactionalExecutor.runInTransaction(store -> appendInTransaction(store, eventToAdd));

            metrics.appendCompleted(sample, RESULT_SUCCESS);
            eventLogger.eventAppended(eventToAdd, event);
            return event;
        } catch (TransactionStartFailureException | TransactionCommitFailureException e) {
            EventInsertFailureException failure =
                    new EventInsertFailureException(eventToAdd.streamId().value(), e.getMessage(), e);
            appendFailed(sample, eventToAdd, failure);
            throw failure;
        } catch (EventStoreException e) {
            appendFailed(sample, eventToAdd, e);
            throw e;
        }
    }

    private Event appendInTransaction(EventStreamStore store, EventToAdd eventToAdd) {
        UUID streamId = eventToAdd.streamId().value();
        long expectedVersion = eventToAdd.expectedVersion().value();

        long newVersion;
        try {
            newVersion = store.incrementVersion(streamId, expectedVersion)
                    .orElseThrow(() -> new VersionIncrementFailureException(streamId, expectedVersion));
        } catch (DataAccessException | TransactionException e) {
            throw new VersionIncrementFailureException(streamId, expectedVersion, e);
        }

        EventRecord row;
        try {
            row = store.insertEvent(
                    streamId,
                    eventToAdd.idempotencyKey().value(),
                    newVersion,
                    eventToAdd.payload().serializePayload(),
                    OffsetDateTime.now(clock)
            );
        } catch (DataIntegrityViolationException e) {
            throw new EventInsertFailureException(streamId,
                    "duplicate event idempotencyKey=" + eventToAdd.idempotencyKey(), e);
        } catch (DataAccessException | TransactionException e) {
            throw new EventInsertFailureException(streamId, "insert failed at version " + newVersion, e);
        }

        try {
            return toEvent(row);
        } catch (EventStoreException e) {
            throw new EventInsertFailureException(streamId, "could not create domain event from stored row", e);
        }
    }

    private static Stream toStream(StreamRecord row) {
        return Stream.restore(row.streamId(), row.idempotencyKey(), row.latestVersion());
    }

    private static Event toEvent(EventRecord row) {
        return Event.restore(row.streamId(), row.version(), row.recordedAt(), row.payload());
    }

    private EventStoreException readFailed(String operation, StreamId streamId, EventStoreException e) {
        eventLogger.readFailed(operation, streamId, e);
        return e;
    }

    private void createFailed(StreamToCreate streamToCreate, EventStoreException e) {
        metrics.streamCreateCompleted(EventStoreMetrics.resultOf(e));
        eventLogger.streamCreateRejected(streamToCreate, e);
    }

    private void appendFailed(Timer.Sample sample, EventToAdd eventToAdd, EventStoreException e) {
        metrics.appendCompleted(sample, EventStoreMetrics.resultOf(e));
        eventLogger.appendRejected(eventToAdd, e);
    }
}
