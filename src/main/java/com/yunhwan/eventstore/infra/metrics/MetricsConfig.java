package com.yunhwan.eventstore.infra.metrics;

public final class MetricsConfig {

    private MetricsConfig() {}

    public static final String METRIC_STREAM_CREATE = "event_store.stream.create";
    public static final String METRIC_APPEND = "event_store.append";
    public static final String METRIC_APPEND_DURATION = "event_store.append.duration";

    // 고카디널리티 금지(stream_id / idempotency_key 제외)
    public static final String TAG_RESULT = "result";

    public static final String RESULT_SUCCESS = "success";
    public static final String RESULT_CONFLICT = "conflict";
    public static final String RESULT_ERROR = "error";
}
