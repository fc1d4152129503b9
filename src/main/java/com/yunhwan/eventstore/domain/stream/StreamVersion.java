package com.yunhwan.eventstore.domain.stream;

import com.yunhwan.eventstore.common.exception.InvalidStreamVersionException;

/**
 * 스트림 버전. 생성 시 0, append 성공마다 정확히 1 증가.
 * 저장소(bigint) 제약상 음수가 아닌 long 범위만 표현한다.
 */
public record StreamVersion(long value) implements Comparable<StreamVersion> {

    private static final StreamVersion INITIAL = new StreamVersion(0L);

    public StreamVersion {
        if (value < 0) {
            throw new InvalidStreamVersionException(value);
        }
    }

    public static StreamVersion of(long value) {
        return new StreamVersion(value);
    }

    public static StreamVersion initial() {
        return INITIAL;
    }

    public StreamVersion next() {
        return new StreamVersion(Math.addExact(value, 1L));
    }

    @Override
    public int compareTo(StreamVersion other) {
        return Long.compare(value, other.value);
    }

    @Override
    public String toString() {
        return Long.toString(value);
    }
}
