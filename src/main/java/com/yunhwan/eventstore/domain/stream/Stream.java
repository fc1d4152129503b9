package com.yunhwan.eventstore.domain.stream;

import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

import java.util.UUID;

/**
 * 스트림 스냅샷. 저장소와의 연결 없이 조회 시점의 값만 들고 있다.
 * (streamId, idempotencyKey) 는 생성 후 바뀌지 않으며 버전은 append 로만 증가한다.
 */
@Getter
@ToString
@EqualsAndHashCode
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class Stream {

    private final StreamId streamId;
    private final IdempotencyKey idempotencyKey;
    private final StreamVersion latestVersion;

    /**
     * 저장된 row 값으로 복원. 음수 버전은 손상된 데이터로 보고 거부한다.
     */
    public static Stream restore(UUID streamId, UUID idempotencyKey, long latestVersion) {
        return new Stream(
                StreamId.of(streamId),
                IdempotencyKey.of(idempotencyKey),
                StreamVersion.of(latestVersion)
        );
    }
}
