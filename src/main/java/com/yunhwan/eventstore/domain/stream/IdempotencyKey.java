package com.yunhwan.eventstore.domain.stream;

import java.util.Objects;
import java.util.UUID;

/**
 * 호출자가 제공하는 중복 제거 키.
 * 스트림 생성과 이벤트 추가에 각각 따로 쓰인다.
 */
public record IdempotencyKey(UUID value) {

    public IdempotencyKey {
        Objects.requireNonNull(value, "idempotencyKey must not be null");
    }

    public static IdempotencyKey of(UUID value) {
        return new IdempotencyKey(value);
    }

    public static IdempotencyKey random() {
        return new IdempotencyKey(UUID.randomUUID());
    }

    public static IdempotencyKey parse(String raw) {
        return new IdempotencyKey(Identifiers.parseUuid(raw));
    }

    @Override
    public String toString() {
        return value.toString();
    }
}
