package com.flagship.exchange_ledger.common;

import com.flagship.exchange_ledger.exception.ConcurrencyConflictException;
import com.flagship.exchange_ledger.exception.ErrorCode;
import com.flagship.exchange_ledger.exception.InsufficientFundsException;
import com.flagship.exchange_ledger.exception.LedgerException;
import com.flagship.exchange_ledger.exception.PersistenceFailureException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionSystemException;
import org.springframework.transaction.support.SimpleTransactionStatus;

import java.math.BigDecimal;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Storage failures leaving a unit of work are mapped onto the error taxonomy,
 * and every failure rolls the unit back.
 */
class UnitOfWorkTest {

    private PlatformTransactionManager transactionManager;
    private UnitOfWork unitOfWork;

    @BeforeEach
    void setUp() {
        transactionManager = mock(PlatformTransactionManager.class);
        when(transactionManager.getTransaction(any())).thenReturn(new SimpleTransactionStatus());
        unitOfWork = new UnitOfWork(transactionManager);
    }

    @Test
    @DisplayName("Successful work is committed and its result returned")
    void testExecute_Commits() {
        assertEquals("done", unitOfWork.execute("test", () -> "done"));
        verify(transactionManager).commit(any());
        verify(transactionManager, never()).rollback(any());
    }

    @Test
    @DisplayName("Business failures pass through unchanged after rollback")
    void testExecute_LedgerExceptionPassesThrough() {
        InsufficientFundsException failure = new InsufficientFundsException(
            UUID.randomUUID(), "USD", new BigDecimal("10.00"), new BigDecimal("20.00"));

        InsufficientFundsException thrown = assertThrows(InsufficientFundsException.class,
            () -> unitOfWork.execute("withdraw", () -> {
                throw failure;
            }));

        assertSame(failure, thrown);
        assertFalse(thrown.isRetryable());
        verify(transactionManager).rollback(any());
        verify(transactionManager, never()).commit(any());
    }

    @Test
    @DisplayName("Lock timeouts become retryable concurrency conflicts")
    void testExecute_LockTimeout() {
        LedgerException thrown = assertThrows(ConcurrencyConflictException.class,
            () -> unitOfWork.execute("settle", () -> {
                throw new CannotAcquireLockException("lock timeout");
            }));

        assertEquals(ErrorCode.CONCURRENCY_CONFLICT, thrown.getCode());
        assertTrue(thrown.isRetryable());
        verify(transactionManager).rollback(any());

        assertThrows(ConcurrencyConflictException.class,
            () -> unitOfWork.execute("settle", () -> {
                throw new QueryTimeoutException("statement timeout");
            }));
    }

    @Test
    @DisplayName("Other storage errors become non-retryable persistence failures")
    void testExecute_StorageFailure() {
        LedgerException thrown = assertThrows(PersistenceFailureException.class,
            () -> unitOfWork.execute("deposit", () -> {
                throw new DataIntegrityViolationException("check constraint");
            }));

        assertEquals(ErrorCode.PERSISTENCE_FAILURE, thrown.getCode());
        assertFalse(thrown.isRetryable());
        assertInstanceOf(DataIntegrityViolationException.class, thrown.getCause());
    }

    @Test
    @DisplayName("A failing commit is a persistence failure")
    void testExecute_CommitFailure() {
        doThrow(new TransactionSystemException("commit failed")).when(transactionManager).commit(any());

        assertThrows(PersistenceFailureException.class, () -> unitOfWork.execute("deposit", () -> "ok"));
    }
}
