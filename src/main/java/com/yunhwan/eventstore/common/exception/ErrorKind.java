package com.yunhwan.eventstore.common.exception;

/**
 * 이벤트 스토어 오류 분류.
 * 호출자는 kind 만 보고 재시도 여부를 결정할 수 있어야 한다.
 */
public enum ErrorKind {

    /** 요청한 스트림이 없음. 먼저 생성해야 한다. */
    NOT_FOUND(false),

    /** 경합(중복 생성, 기대 버전 불일치). 최신 상태로 다시 시도한다. */
    CONFLICT(true),

    /** 저장된 데이터 손상 또는 잘못된 입력. 입력/데이터를 고치기 전엔 재시도 무의미. */
    VALIDATION(false),

    /** DB/트랜잭션 장애. 원인에 따라 재시도 가능. */
    INFRASTRUCTURE(true);

    private final boolean retryable;

    ErrorKind(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
