package com.yunhwan.eventstore.domain.stream;

import com.yunhwan.eventstore.common.exception.InvalidStreamIdentifierException;

import java.util.UUID;

final class Identifiers {

    private Identifiers() {}

    static UUID parseUuid(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new InvalidStreamIdentifierException(raw, null);
        }
        try {
            UUID parsed = UUID.fromString(raw.trim());
            // UUID.fromString 은 "1-1-1-1-1" 같은 축약형도 받아준다. 정규 표기만 허용.
            if (!parsed.toString().equalsIgnoreCase(raw.trim())) {
                throw new InvalidStreamIdentifierException(raw, null);
            }
            return parsed;
        } catch (IllegalArgumentException e) {
            throw new InvalidStreamIdentifierException(raw, e);
        }
    }
}
