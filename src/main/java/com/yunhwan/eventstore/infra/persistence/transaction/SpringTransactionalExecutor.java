package com.yunhwan.eventstore.infra.persistence.transaction;

import com.yunhwan.eventstore.common.exception.TransactionCommitFailureException;
import com.yunhwan.eventstore.common.exception.TransactionStartFailureException;
import com.yunhwan.eventstore.config.EventStoreProperties;
import com.yunhwan.eventstore.usecase.events.port.EventStreamStore;
import com.yunhwan.eventstore.usecase.events.port.TransactionalExecutor;
import com.yunhwan.eventstore.usecase.events.port.TransactionalWork;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.TransactionStatus;
import org.springframework.transaction.support.DefaultTransactionDefinition;

/**
 * {@link PlatformTransactionManager} 를 직접 다루는 트랜잭션 실행기.
 * TransactionTemplate 은 시작 실패와 커밋 실패를 구분해주지 않아서 직접 구현한다.
 * <p>
 * 호출마다 새 트랜잭션(REQUIRES_NEW)을 연다. 동시에 실행되는 논리 작업끼리 트랜잭션을 공유하지 않는다.
 */
@Slf4j
@Component
public class SpringTransactionalExecutor implements TransactionalExecutor {

    private final PlatformTransactionManager transactionManager;
    private final EventStreamStore eventStreamStore;
    private final TransactionDefinition definition;

    public SpringTransactionalExecutor(PlatformTransactionManager transactionManager,
                                       EventStreamStore eventStreamStore,
                                       EventStoreProperties properties) {
        this.transactionManager = transactionManager;
        this.eventStreamStore = eventStreamStore;
        this.definition = definitionOf(properties.getTransaction());
    }

    static TransactionDefinition definitionOf(EventStoreProperties.Transaction tx) {
        DefaultTransactionDefinition def = new DefaultTransactionDefinition(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        def.setIsolationLevel(tx.getIsolation().value());
        if (tx.getTimeout() != null && !tx.getTimeout().isZero() && !tx.getTimeout().isNegative()) {
            def.setTimeout(Math.toIntExact(Math.max(1L, tx.getTimeout().toSeconds())));
        }
        def.setName(SpringTransactionalExecutor.class.getSimpleName());
        return def;
    }

    @Override
    public <T> T runInTransaction(TransactionalWork<T> work) {
        TransactionStatus status;
        try {
            status = transactionManager.getTransaction(definition);
        } catch (TransactionException e) {
            throw new TransactionStartFailureException(e);
        }

        boolean rollbackAttempted = false;
        try {
            T result = work.execute(eventStreamStore);
            try {
                transactionManager.commit(status);
            } catch (TransactionException e) {
                throw new TransactionCommitFailureException(e);
            }
            return result;
        } catch (RuntimeException | Error e) {
            rollbackAttempted = true;
            rollbackIfActive(status, e);
            throw e;
        } finally {
            // 어떤 경로로 나가든 완료되지 않은 트랜잭션은 남기지 않는다. 롤백은 한 번만 시도.
            if (!rollbackAttempted) {
                rollbackIfActive(status, null);
            }
        }
    }

    private void rollbackIfActive(TransactionStatus status, Throwable original) {
        if (status.isCompleted()) {
            return;
        }
        try {
            transactionManager.rollback(status);
        } catch (RuntimeException rollbackFailure) {
            log.warn("transaction rollback failed", rollbackFailure);
            if (original != null) {
                original.addSuppressed(rollbackFailure);
            }
        }
    }
}
