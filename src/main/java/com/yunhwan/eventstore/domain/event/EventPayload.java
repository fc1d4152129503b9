package com.yunhwan.eventstore.domain.event;

/**
 * 호출자가 제공하는 페이로드 직렬화 능력.
 * 스토어는 결과 바이트를 해석하지 않고 그대로 저장한다.
 */
@FunctionalInterface
public interface EventPayload {

    byte[] serializePayload();
}
