package com.flagship.exchange_ledger.common;

import com.flagship.exchange_ledger.exception.ConcurrencyConflictException;
import com.flagship.exchange_ledger.exception.LedgerException;
import com.flagship.exchange_ledger.exception.PersistenceFailureException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.function.Supplier;

/**
 * One atomic unit of work against the ledger database.
 *
 * Every mutating operation (deposit, withdraw, adjust, reconcile, settle,
 * closing submit) runs its whole body through {@link #execute}. The body either
 * commits as a whole or is rolled back as a whole; components below it declare
 * {@code Propagation.MANDATORY} and refuse to run outside one.
 *
 * Failures leaving the unit are translated into the service's taxonomy:
 * - LedgerException: passed through unchanged
 * - lock timeout or deadlock: ConcurrencyConflictException (retryable)
 * - any other storage error: PersistenceFailureException
 *
 * Nothing is retried here.
 */
@Component
@Slf4j
public class UnitOfWork {

    private final TransactionTemplate transactionTemplate;

    public UnitOfWork(PlatformTransactionManager transactionManager) {
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    public <T> T execute(String operation, Supplier<T> work) {
        try {
            return transactionTemplate.execute(status -> work.get());
        } catch (LedgerException e) {
            throw e;
        } catch (PessimisticLockingFailureException | QueryTimeoutException e) {
            log.warn("Lock conflict during {}: {}", operation, e.getMessage());
            throw new ConcurrencyConflictException(
                    "Balance is locked by a concurrent operation during " + operation + ", please retry", e);
        } catch (DataAccessException | TransactionException e) {
            log.error("Storage failure during {}: {}", operation, e.getMessage());
            throw new PersistenceFailureException("Storage failure during " + operation, e);
        }
    }

    public void run(String operation, Runnable work) {
        execute(operation, () -> {
            work.run();
            return null;
        });
    }
}
