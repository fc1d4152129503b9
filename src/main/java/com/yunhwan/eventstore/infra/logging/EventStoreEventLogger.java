package com.yunhwan.eventstore.infra.logging;

import com.yunhwan.eventstore.common.exception.ErrorKind;
import com.yunhwan.eventstore.common.exception.EventStoreException;
import com.yunhwan.eventstore.domain.event.Event;
import com.yunhwan.eventstore.domain.stream.Stream;
import com.yunhwan.eventstore.domain.stream.StreamId;
import com.yunhwan.eventstore.usecase.events.dto.EventToAdd;
import com.yunhwan.eventstore.usecase.events.dto.StreamToCreate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

import static net.logstash.logback.argument.StructuredArguments.entries;

/**
 * 이벤트 스토어 도메인 로그. 한 줄짜리 구조화 로그(event_store_event)로 남긴다.
 * 경합(CONFLICT)은 정상 경로라 INFO, 나머지 실패는 원인과 함께 WARN.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EventStoreEventLogger {

    private final Clock clock;

    public void streamCreated(Stream stream) {
        Map<String, Object> evt = createBaseEvent("event_store.stream_created", stream.getStreamId());
        evt.put("idempotency_key", stream.getIdempotencyKey().toString());
        evt.put("version", stream.getLatestVersion().value());

        log.info("event_store_event {}", entries(evt));
    }

    public void streamCreateRejected(StreamToCreate request, EventStoreException e) {
        Map<String, Object> evt = createBaseEvent("event_store.stream_create_rejected", request.streamId());
        evt.put("idempotency_key", request.idempotencyKey().toString());
        putError(evt, e);

        logFailure(evt, e);
    }

    public void eventAppended(EventToAdd request, Event event) {
        Map<String, Object> evt = createBaseEvent("event_store.event_appended", event.getStreamId());
        evt.put("idempotency_key", request.idempotencyKey().toString());
        evt.put("expected_version", request.expectedVersion().value());
        evt.put("version", event.getVersion().value());

        log.info("event_store_event {}", entries(evt));
    }

    public void appendRejected(EventToAdd request, EventStoreException e) {
        Map<String, Object> evt = createBaseEvent("event_store.append_rejected", request.streamId());
        evt.put("idempotency_key", request.idempotencyKey().toString());
        evt.put("expected_version", request.expectedVersion().value());
        putError(evt, e);

        logFailure(evt, e);
    }

    public void readFailed(String operation, StreamId streamId, EventStoreException e) {
        Map<String, Object> evt = createBaseEvent("event_store.read_failed", streamId);
        evt.put("operation", operation);
        putError(evt, e);

        logFailure(evt, e);
    }

    private void logFailure(Map<String, Object> evt, EventStoreException e) {
        if (e.kind() == ErrorKind.CONFLICT) {
            log.info("event_store_event {}", entries(evt));
        } else {
            log.warn("event_store_event {}", entries(evt), e);
        }
    }

    private Map<String, Object> createBaseEvent(String eventType, StreamId streamId) {
        Map<String, Object> evt = new LinkedHashMap<>();
        evt.put("event_type", eventType);
        evt.put("event_id", UUID.randomUUID().toString());
        evt.put("occurred_at", OffsetDateTime.now(clock).toString());
        evt.put("stream_id", streamId.toString());
        return evt;
    }

    private void putError(Map<String, Object> evt, EventStoreException e) {
        evt.put("error_kind", e.kind().name());

        Map<String, Object> error = new LinkedHashMap<>();
        error.put("exception", e.getClass().getSimpleName());
        error.put("message", e.getMessage());
        if (e.getCause() != null) {
            error.put("cause", e.getCause().getClass().getName());
        }
        evt.put("error", error);
    }
}
