package com.yunhwan.eventstore.domain.stream;

import java.util.Objects;
import java.util.UUID;

public record StreamId(UUID value) {

    public StreamId {
        Objects.requireNonNull(value, "streamId must not be null");
    }

    public static StreamId of(UUID value) {
        return new StreamId(value);
    }

    public static StreamId random() {
        return new StreamId(UUID.randomUUID());
    }

    /**
     * 외부 입력(문자열)을 스트림 ID 로 변환. UUID 형식이 아니면 거부한다.
     */
    public static StreamId parse(String raw) {
        return new StreamId(Identifiers.parseUuid(raw));
    }

    @Override
    public String toString() {
        return value.toString();
    }
}
