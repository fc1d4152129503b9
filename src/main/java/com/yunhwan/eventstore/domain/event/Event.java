package com.yunhwan.eventstore.domain.event;

import com.yunhwan.eventstore.common.exception.InvalidEventTimestampException;
import com.yunhwan.eventstore.common.exception.InvalidStreamVersionException;
import com.yunhwan.eventstore.domain.stream.StreamId;
import com.yunhwan.eventstore.domain.stream.StreamVersion;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.util.Arrays;
import java.util.Objects;
import java.util.UUID;

/**
 * 스트림에 기록된 불변 사실.
 * 한 스트림의 이벤트 버전은 1부터 빈틈없이 증가한다.
 */
public final class Event {

    private final StreamId streamId;
    private final StreamVersion version;
    private final OffsetDateTime recordedAt;
    private final byte[] payload;

    private Event(StreamId streamId, StreamVersion version, OffsetDateTime recordedAt, byte[] payload) {
        this.streamId = streamId;
        this.version = version;
        this.recordedAt = recordedAt;
        this.payload = payload;
    }

    /**
     * 저장된 row 를 도메인 이벤트로 변환한다.
     * <ul>
     *     <li>version &lt; 0 이면 {@link InvalidStreamVersionException}</li>
     *     <li>recordedAt 이 없거나 무한대(infinity sentinel)면 {@link InvalidEventTimestampException}</li>
     * </ul>
     */
    public static Event restore(UUID streamId, long version, OffsetDateTime recordedAt, byte[] payload) {
        if (version < 0) {
            throw new InvalidStreamVersionException(version);
        }
        if (!isFinite(recordedAt)) {
            throw new InvalidEventTimestampException(streamId, version, recordedAt);
        }
        Objects.requireNonNull(payload, "payload must not be null");

        return new Event(
                StreamId.of(streamId),
                StreamVersion.of(version),
                recordedAt,
                payload.clone()
        );
    }

    // PgJDBC PGStatement.DATE_POSITIVE_INFINITY / DATE_NEGATIVE_INFINITY.
    // getTimestamp 로 읽은 'infinity' / '-infinity' 는 이 epoch millis 를 가진 Timestamp 가 된다.
    private static final Instant PG_POSITIVE_INFINITY = Instant.ofEpochMilli(9223372036825200000L);
    private static final Instant PG_NEGATIVE_INFINITY = Instant.ofEpochMilli(-9223372036832400000L);

    // getObject(OffsetDateTime) 경로에서는 OffsetDateTime.MAX / MIN 으로 매핑된다.
    static boolean isFinite(OffsetDateTime t) {
        if (t == null) {
            return false;
        }
        LocalDateTime local = t.toLocalDateTime();
        if (local.equals(LocalDateTime.MAX) || local.equals(LocalDateTime.MIN)) {
            return false;
        }
        Instant instant = t.toInstant();
        return !instant.equals(PG_POSITIVE_INFINITY) && !instant.equals(PG_NEGATIVE_INFINITY);
    }

    public StreamId getStreamId() {
        return streamId;
    }

    public StreamVersion getVersion() {
        return version;
    }

    public OffsetDateTime getRecordedAt() {
        return recordedAt;
    }

    public byte[] getPayload() {
        return payload.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Event)) return false;
        Event that = (Event) o;
        return streamId.equals(that.streamId)
                && version.equals(that.version)
                && recordedAt.isEqual(that.recordedAt)
                && Arrays.equals(payload, that.payload);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(streamId, version, recordedAt.toInstant());
        return 31 * result + Arrays.hashCode(payload);
    }

    @Override
    public String toString() {
        return "Event[streamId=" + streamId + ", version=" + version + ", recordedAt=" + recordedAt
                + ", payloadBytes=" + payload.length + "]";
    }
}
