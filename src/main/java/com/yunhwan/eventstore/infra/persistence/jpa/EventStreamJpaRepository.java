package com.yunhwan.eventstore.infra.persistence.jpa;

import com.yunhwan.eventstore.infra.persistence.entity.EventStreamEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

public interface EventStreamJpaRepository extends JpaRepository<EventStreamEntity, UUID> {

    /**
     * 스트림 생성.
     * ON CONFLICT 를 쓰지 않는다. 중복은 유니크 제약 위반으로 호출자에게 그대로 올라가야 한다.
     */
    @Query(value = """
            insert into event_stream (stream_id, idempotency_key, latest_version, created_at)
            values (:streamId, :idempotencyKey, 0, :now)
            returning *
            """, nativeQuery = true)
    EventStreamEntity insertReturning(@Param("streamId") UUID streamId,
                                      @Param("idempotencyKey") UUID idempotencyKey,
                                      @Param("now") OffsetDateTime now);

    /**
     * 낙관적 동시성 검사 + row 락.
     * 같은 expectedVersion 으로 동시에 들어온 요청은 락 대기 후 where 절을 다시 평가하므로 0건이 된다.
     */
    @Query(value = """
            update event_stream
               set latest_version = latest_version + 1
             where stream_id = :streamId
               and latest_version = :expectedVersion
            returning latest_version
            """, nativeQuery = true)
    Optional<Long> incrementVersion(@Param("streamId") UUID streamId,
                                    @Param("expectedVersion") long expectedVersion);
}
