package com.yunhwan.eventstore.usecase.events.port;

/**
 * 트랜잭션 안에서 실행할 작업.
 * 전달받은 store 로 수행한 읽기/쓰기는 커밋 전까지 밖에서 보이지 않는다.
 */
@FunctionalInterface
public interface TransactionalWork<T> {

    T execute(EventStreamStore store);
}
