package com.yunhwan.eventstore.usecase.events;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.yunhwan.eventstore.common.exception.EventInsertFailureException;
import com.yunhwan.eventstore.common.exception.InvalidEventTimestampException;
import com.yunhwan.eventstore.common.exception.VersionIncrementFailureException;
import com.yunhwan.eventstore.domain.event.Event;
import com.yunhwan.eventstore.domain.stream.IdempotencyKey;
import com.yunhwan.eventstore.domain.stream.Stream;
import com.yunhwan.eventstore.domain.stream.StreamId;
import com.yunhwan.eventstore.domain.stream.StreamVersion;
import com.yunhwan.eventstore.infra.serializer.JacksonEventPayloadSerializer;
import com.yunhwan.eventstore.testsupport.base.AbstractIntegrationTest;
import com.yunhwan.eventstore.usecase.events.dto.EventToAdd;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.jdbc.core.JdbcTemplate;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.LongStream;

import static com.yunhwan.eventstore.testsupport.fixtures.EventStoreFixtures.SUCCESS_PAYLOAD_JSON;
import static com.yunhwan.eventstore.testsupport.fixtures.EventStoreFixtures.createTestStream;
import static com.yunhwan.eventstore.testsupport.fixtures.EventStoreFixtures.eventToAdd;
import static com.yunhwan.eventstore.testsupport.fixtures.EventStoreFixtures.jsonPayload;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("[ES-04] 이벤트 append 통합 테스트")
class EventStoreAppendIntegrationTest extends AbstractIntegrationTest {

    @Autowired
    EventStore eventStore;

    @Autowired
    JacksonEventPayloadSerializer payloadSerializer;

    @Autowired
    ObjectMapper objectMapper;

    @Autowired
    JdbcTemplate jdbcTemplate;

    @Test
    @DisplayName("[ES-04] 존재하지 않는 스트림에 append 하면 VersionIncrementFailure")
    void 없는_스트림에_append_하면_실패한다() {
        StreamId streamId = StreamId.random();

        assertThatThrownBy(() -> eventStore.addEventToStream(eventToAdd(streamId, 0, "{}")))
                .isInstanceOf(VersionIncrementFailureException.class)
                .satisfies(e -> {
                    VersionIncrementFailureException failure = (VersionIncrementFailureException) e;
                    assertThat(failure.getStreamId()).isEqualTo(streamId.value());
                    assertThat(failure.getExpectedVersion()).isZero();
                });
    }

    @Test
    @DisplayName("[ES-04] append 성공 시 버전은 기대 버전 + 1, 페이로드는 입력과 같다")
    void append_성공() throws Exception {
        Stream stream = createTestStream(eventStore);

        Event event = eventStore.addEventToStream(
                eventToAdd(stream.getStreamId(), stream.getLatestVersion().value(), SUCCESS_PAYLOAD_JSON));

        assertThat(event.getStreamId()).isEqualTo(stream.getStreamId());
        assertThat(event.getVersion()).isEqualTo(stream.getLatestVersion().next());
        assertThat(event.getRecordedAt()).isNotNull();
        assertThat(objectMapper.readTree(event.getPayload()))
                .withFailMessage("페이로드는 구조적으로 입력 JSON 과 같아야 합니다.")
                .isEqualTo(objectMapper.readTree(SUCCESS_PAYLOAD_JSON));

        assertThat(eventStore.getStream(stream.getStreamId()).getLatestVersion())
                .isEqualTo(StreamVersion.of(1));
    }

    @Test
    @DisplayName("[ES-05] 시나리오: 기대 버전 0 성공 -> 낡은 기대 버전 0 실패 -> 기대 버전 1 성공")
    void 낙관적_동시성_시나리오() {
        Stream stream = createTestStream(eventStore);
        StreamId streamId = stream.getStreamId();

        Event first = eventStore.addEventToStream(eventToAdd(streamId, 0, SUCCESS_PAYLOAD_JSON));
        assertThat(first.getVersion().value()).isEqualTo(1L);

        assertThatThrownBy(() -> eventStore.addEventToStream(eventToAdd(streamId, 0, SUCCESS_PAYLOAD_JSON)))
                .withFailMessage("낡은 기대 버전으로는 append 할 수 없어야 합니다.")
                .isInstanceOf(VersionIncrementFailureException.class);

        Event second = eventStore.addEventToStream(eventToAdd(streamId, 1, SUCCESS_PAYLOAD_JSON));
        assertThat(second.getVersion().value()).isEqualTo(2L);

        assertThat(eventStore.getStream(streamId).getLatestVersion().value()).isEqualTo(2L);
    }

    @Test
    @DisplayName("[ES-06] getEvents 는 1부터 빈틈없이 증가하는 버전 순서로 반환한다")
    void 이벤트는_버전_오름차순으로_빈틈없이_조회된다() {
        Stream stream = createTestStream(eventStore);
        int count = 7;
        for (long expected = 0; expected < count; expected++) {
            eventStore.addEventToStream(new EventToAdd(
                    stream.getStreamId(),
                    IdempotencyKey.random(),
                    StreamVersion.of(expected),
                    payloadSerializer.toPayload(Map.of("seq", expected))
            ));
        }

        List<Event> events = eventStore.getEvents(stream.getStreamId());

        assertThat(events)
                .extracting(e -> e.getVersion().value())
                .containsExactlyElementsOf(LongStream.rangeClosed(1, count).boxed().toList());
        assertThat(events)
                .extracting(e -> payloadSerializer.read(e, Map.class).get("seq"))
                .containsExactly(0, 1, 2, 3, 4, 5, 6);
    }

    @Test
    @DisplayName("[ES-06] 이벤트가 없는 스트림(또는 없는 스트림)은 빈 목록을 반환한다")
    void 이벤트_없는_스트림은_빈_목록() {
        Stream stream = createTestStream(eventStore);

        assertThat(eventStore.getEvents(stream.getStreamId())).isEmpty();
        assertThat(eventStore.getEvents(StreamId.random())).isEmpty();
    }

    @ParameterizedTest
    @ValueSource(strings = {"infinity", "-infinity"})
    @DisplayName("[ES-06] recorded_at 이 infinity 인 손상된 row 가 있으면 getEvents 는 InvalidEventTimestamp")
    void infinity_기록시각_row_는_거부된다(String sentinel) {
        Stream stream = createTestStream(eventStore);
        UUID streamId = stream.getStreamId().value();
        jdbcTemplate.update(
                "insert into stream_event (stream_id, idempotency_key, version, recorded_at, payload) "
                        + "values (?, ?, 1, ?::timestamptz, ?)",
                streamId, UUID.randomUUID(), sentinel, "{}".getBytes(StandardCharsets.UTF_8)
        );

        assertThatThrownBy(() -> eventStore.getEvents(stream.getStreamId()))
                .isInstanceOf(InvalidEventTimestampException.class)
                .hasMessageContaining(streamId.toString());
    }

    @Test
    @DisplayName("[ES-07] 같은 이벤트 멱등키로 재시도하면 EventInsertFailure, 버전 증가도 롤백된다")
    void 같은_이벤트_멱등키_재시도는_중복_insert_되지_않는다() {
        Stream stream = createTestStream(eventStore);
        StreamId streamId = stream.getStreamId();
        IdempotencyKey eventKey = IdempotencyKey.random();

        eventStore.addEventToStream(new EventToAdd(streamId, eventKey, StreamVersion.of(0), jsonPayload("{\"n\":1}")));

        assertThatThrownBy(() -> eventStore.addEventToStream(
                new EventToAdd(streamId, eventKey, StreamVersion.of(1), jsonPayload("{\"n\":1}"))))
                .isInstanceOf(EventInsertFailureException.class);

        assertThat(eventStore.getStream(streamId).getLatestVersion().value())
                .withFailMessage("insert 실패 시 버전 증가는 반영되면 안 됩니다.")
                .isEqualTo(1L);
        assertThat(countEvents(streamId.value())).isEqualTo(1L);
    }

    private long countEvents(UUID streamId) {
        Long count = jdbcTemplate.queryForObject(
                "select count(*) from stream_event where stream_id = ?",
                Long.class,
                streamId
        );
        return count == null ? 0L : count;
    }
}
