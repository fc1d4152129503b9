package com.yunhwan.eventstore.usecase.events.port;

/**
 * 작업 하나를 단일 트랜잭션으로 실행한다.
 * <ul>
 *     <li>트랜잭션 시작 실패: {@link com.yunhwan.eventstore.common.exception.TransactionStartFailureException}</li>
 *     <li>작업 실패: 롤백 후 작업이 던진 예외를 그대로 전파</li>
 *     <li>커밋 실패: {@link com.yunhwan.eventstore.common.exception.TransactionCommitFailureException}</li>
 * </ul>
 * 어떤 경로로 빠져나가든 커밋되지 않은 트랜잭션은 롤백된다.
 */
public interface TransactionalExecutor {

    <T> T runInTransaction(TransactionalWork<T> work);
}
