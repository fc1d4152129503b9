package com.yunhwan.eventstore.infra.metrics;

import com.yunhwan.eventstore.common.exception.ErrorKind;
import com.yunhwan.eventstore.common.exception.EventStoreException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import static com.yunhwan.eventstore.infra.metrics.MetricsConfig.*;

@Component
@RequiredArgsConstructor
public class EventStoreMetrics {

    private final MeterRegistry meterRegistry;

    public static String resultOf(EventStoreException e) {
        return e.kind() == ErrorKind.CONFLICT ? RESULT_CONFLICT : RESULT_ERROR;
    }

    public void streamCreateCompleted(String result) {
        Counter.builder(METRIC_STREAM_CREATE)
                .tag(TAG_RESULT, result)
                .register(meterRegistry)
                .increment();
    }

    public Timer.Sample startAppend() {
        return Timer.start(meterRegistry);
    }

    public void appendCompleted(Timer.Sample sample, String result) {
        sample.stop(Timer.builder(METRIC_APPEND_DURATION)
                .tag(TAG_RESULT, result)
                .register(meterRegistry));

        Counter.builder(METRIC_APPEND)
                .tag(TAG_RESULT, result)
                .register(meterRegistry)
                .increment();
    }
}
