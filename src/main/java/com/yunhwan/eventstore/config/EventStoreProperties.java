package com.yunhwan.eventstore.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Isolation;

import java.time.Duration;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "event-store")
public class EventStoreProperties {

    private Transaction transaction = new Transaction();

    @Getter @Setter
    public static class Transaction {
        /**
         * 트랜잭션 하나의 최대 시간. 초과하면 롤백된다. 0 이하면 DB/드라이버 기본값.
         */
        private Duration timeout = Duration.ofSeconds(10);

        /**
         * 조건부 update 의 row 락과 함께 쓰므로 READ_COMMITTED 로 충분하다.
         */
        private Isolation isolation = Isolation.READ_COMMITTED;
    }
}
