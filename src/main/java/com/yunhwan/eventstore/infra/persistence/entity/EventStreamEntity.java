package com.yunhwan.eventstore.infra.persistence.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * 스트림 row. 쓰기는 네이티브 쿼리(insert/조건부 update)로만 한다.
 */
@Entity
@Table(
        name = "event_stream",
        uniqueConstraints = {
                @UniqueConstraint(name = "ux_event_stream_idempotency_key", columnNames = "idempotency_key")
        }
)
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@Getter
public class EventStreamEntity {

    @Id
    @Column(name = "stream_id", nullable = false, updatable = false)
    private UUID streamId;

    @Column(name = "idempotency_key", nullable = false, updatable = false)
    private UUID idempotencyKey;

    @Column(name = "latest_version", nullable = false)
    private long latestVersion;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;
}
