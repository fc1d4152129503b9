package com.yunhwan.eventstore.infra.persistence.jpa;

import com.yunhwan.eventstore.infra.persistence.entity.StoredEventEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

public interface StoredEventJpaRepository extends JpaRepository<StoredEventEntity, Long> {

    List<StoredEventEntity> findAllByStreamIdOrderByVersionAsc(UUID streamId);

    // (stream_id, idempotency_key) 중복이면 제약 위반. 재시도된 append 가 두 번 들어가지 않는다.
    @Query(value = """
            insert into stream_event (stream_id, idempotency_key, version, recorded_at, payload)
            values (:streamId, :idempotencyKey, :version, :recordedAt, :payload)
            returning *
            """, nativeQuery = true)
    StoredEventEntity insertReturning(@Param("streamId") UUID streamId,
                                      @Param("idempotencyKey") UUID idempotencyKey,
                                      @Param("version") long version,
                                      @Param("recordedAt") OffsetDateTime recordedAt,
                                      @Param("payload") byte[] payload);
}
