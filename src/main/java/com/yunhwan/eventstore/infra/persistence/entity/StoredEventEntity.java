package com.yunhwan.eventstore.infra.persistence.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;
import java.util.UUID;

@Entity
@Table(
        name = "stream_event",
        indexes = {
                @Index(name = "ix_stream_event_stream_version", columnList = "stream_id,version")
        },
        uniqueConstraints = {
                @UniqueConstraint(name = "ux_stream_event_idempotency_key", columnNames = {"stream_id", "idempotency_key"}),
                @UniqueConstraint(name = "ux_stream_event_version", columnNames = {"stream_id", "version"})
        }
)
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@Getter
public class StoredEventEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "stream_id", nullable = false, updatable = false)
    private UUID streamId;

    @Column(name = "idempotency_key", nullable = false, updatable = false)
    private UUID idempotencyKey;

    @Column(name = "version", nullable = false, updatable = false)
    private long version;

    /**
     * nullable 로 둔다. null / infinity 는 도메인 변환 시 거부된다.
     */
    @Column(name = "recorded_at", updatable = false)
    private OffsetDateTime recordedAt;

    @Column(name = "payload", nullable = false, updatable = false, columnDefinition = "bytea")
    private byte[] payload;
}
