package com.flagship.exchange_ledger.balance;

import com.flagship.exchange_ledger.drawer.Drawer;
import com.flagship.exchange_ledger.exception.InsufficientFundsException;
import com.flagship.exchange_ledger.exception.ValidationException;
import com.flagship.exchange_ledger.ledger.ConsistencyReport;
import com.flagship.exchange_ledger.ledger.EntryType;
import com.flagship.exchange_ledger.ledger.LedgerEntry;
import com.flagship.exchange_ledger.ledger.LedgerHistoryFilter;
import com.flagship.exchange_ledger.ledger.LedgerQueryService;
import com.flagship.exchange_ledger.operator.Operator;
import com.flagship.exchange_ledger.operator.OperatorRole;
import com.flagship.exchange_ledger.support.IntegrationTestBase;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataAccessException;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Single-currency movements against PostgreSQL: every balance change has exactly
 * one ledger entry, rejected operations leave no trace, and concurrent debits
 * never overdraw.
 */
class DrawerBalanceIntegrationTest extends IntegrationTestBase {

    @Autowired
    private LedgerQueryService ledgerQueryService;

    private final Operator employee = Operator.of(UUID.randomUUID(), OperatorRole.EMPLOYEE);
    private final Operator manager = Operator.of(UUID.randomUUID(), OperatorRole.MANAGER);

    @Test
    @DisplayName("Deposit then withdrawal chain their ledger entries")
    void testDepositAndWithdraw_ChainEntries() {
        Drawer drawer = newDrawer(null);

        drawerBalanceService.deposit(drawer.getId(), "USD", new BigDecimal("500.00"), null, employee);
        BalanceMutationResult withdrawal =
            drawerBalanceService.withdraw(drawer.getId(), "USD", new BigDecimal("120.50"), "payout", employee);

        assertEquals(0, new BigDecimal("379.50").compareTo(withdrawal.getBalanceAfter()));
        assertEquals(0, new BigDecimal("379.50").compareTo(balanceOf(drawer.getId(), "USD")));

        List<LedgerEntry> entries = ledgerQueryService
            .getLedgerHistory(drawer.getId(), LedgerHistoryFilter.none(), null, null)
            .getData();
        assertEquals(2, entries.size());
        assertEquals(EntryType.WITHDRAWAL, entries.get(0).getType());
        assertEquals(EntryType.DEPOSIT, entries.get(1).getType());
        assertEquals(0, entries.get(1).getBalanceAfter().compareTo(entries.get(0).getBalanceBefore()));
        assertEquals("payout", entries.get(0).getNotes());
    }

    @Test
    @DisplayName("Withdrawal beyond the balance fails and writes nothing")
    void testWithdraw_InsufficientFunds() {
        Drawer drawer = newDrawer(null);
        fund(drawer.getId(), "EUR", "100.00");
        long entriesBefore = ledgerEntryCount(drawer.getId());

        InsufficientFundsException e = assertThrows(InsufficientFundsException.class,
            () -> drawerBalanceService.withdraw(drawer.getId(), "EUR", new BigDecimal("100.01"), null, employee));

        assertEquals(0, new BigDecimal("100.00").compareTo(e.getAvailable()));
        assertEquals(0, new BigDecimal("100.00").compareTo(balanceOf(drawer.getId(), "EUR")));
        assertEquals(entriesBefore, ledgerEntryCount(drawer.getId()));
    }

    @Test
    @DisplayName("Adjustment with an empty reason is rejected and writes nothing")
    void testAdjust_EmptyReason() {
        Drawer drawer = newDrawer(null);
        fund(drawer.getId(), "USD", "100.00");
        long entriesBefore = ledgerEntryCount(drawer.getId());

        assertThrows(ValidationException.class,
            () -> drawerBalanceService.adjust(drawer.getId(), "USD", new BigDecimal("80.00"), "   ", admin));

        assertEquals(0, new BigDecimal("100.00").compareTo(balanceOf(drawer.getId(), "USD")));
        assertEquals(entriesBefore, ledgerEntryCount(drawer.getId()));
    }

    @Test
    @DisplayName("Adjustment sets the balance and records the signed delta")
    void testAdjust_RecordsDelta() {
        Drawer drawer = newDrawer(null);
        fund(drawer.getId(), "USD", "100.00");

        BalanceMutationResult result =
            drawerBalanceService.adjust(drawer.getId(), "USD", new BigDecimal("80.00"), "Counted twice", admin);

        assertEquals(EntryType.ADJUSTMENT, result.getType());
        assertEquals(0, new BigDecimal("-20.00").compareTo(result.getAmount()));
        assertEquals(0, new BigDecimal("80.00").compareTo(balanceOf(drawer.getId(), "USD")));
    }

    @Test
    @DisplayName("Adjustment to the current balance is rejected and writes nothing")
    void testAdjust_UnchangedBalance() {
        Drawer drawer = newDrawer(null);
        fund(drawer.getId(), "USD", "100.00");
        long entriesBefore = ledgerEntryCount(drawer.getId());

        assertThrows(ValidationException.class,
            () -> drawerBalanceService.adjust(drawer.getId(), "USD", new BigDecimal("100.00"), "Recount matched", admin));

        assertEquals(entriesBefore, ledgerEntryCount(drawer.getId()));
    }

    @Test
    @DisplayName("Deposit that would overflow the balance column is rejected and writes nothing")
    void testDeposit_BeyondColumnLimit() {
        Drawer drawer = newDrawer(null);
        fund(drawer.getId(), "IQD", "9999999999999999.99");
        long entriesBefore = ledgerEntryCount(drawer.getId());

        assertThrows(ValidationException.class,
            () -> drawerBalanceService.deposit(drawer.getId(), "IQD", new BigDecimal("0.01"), null, employee));
        assertThrows(ValidationException.class,
            () -> drawerBalanceService.deposit(drawer.getId(), "USD", new BigDecimal("100000000000000000"), null, employee));

        assertEquals(0, new BigDecimal("9999999999999999.99").compareTo(balanceOf(drawer.getId(), "IQD")));
        assertEquals(0, balanceOf(drawer.getId(), "USD").signum());
        assertEquals(entriesBefore, ledgerEntryCount(drawer.getId()));
    }

    @Test
    @DisplayName("Short reconciliation corrects the balance and keeps the ledger consistent")
    void testReconcile_ShortIsCorrected() {
        Drawer drawer = newDrawer(null);
        fund(drawer.getId(), "GBP", "250.00");

        Reconciliation reconciliation =
            drawerBalanceService.reconcile(drawer.getId(), "GBP", new BigDecimal("240.00"), "end of shift", manager);

        assertEquals(ReconciliationStatus.SHORT, reconciliation.getStatus());
        assertEquals(0, new BigDecimal("-10.00").compareTo(reconciliation.getDifference()));
        assertNotNull(reconciliation.getLedgerEntryId());
        assertEquals(0, new BigDecimal("240.00").compareTo(balanceOf(drawer.getId(), "GBP")));
        assertEquals(1, drawerBalanceService.getReconciliations(drawer.getId()).size());

        List<ConsistencyReport> reports = ledgerQueryService.verifyConsistency(drawer.getId());
        assertEquals(1, reports.size());
        assertTrue(reports.get(0).isConsistent());
        assertEquals(0, new BigDecimal("240.00").compareTo(ledgerQueryService.sumOfDeltas(drawer.getId(), "GBP")));
    }

    @Test
    @DisplayName("Ledger entries cannot be updated or deleted")
    void testLedger_AppendOnly() {
        Drawer drawer = newDrawer(null);
        fund(drawer.getId(), "USD", "10.00");

        assertThrows(DataAccessException.class,
            () -> jdbcTemplate.update("UPDATE ledger_entries SET amount = 1 WHERE drawer_id = ?", drawer.getId()));
        assertThrows(DataAccessException.class,
            () -> jdbcTemplate.update("DELETE FROM ledger_entries WHERE drawer_id = ?", drawer.getId()));
        assertEquals(1, ledgerEntryCount(drawer.getId()));
    }

    @Test
    @DisplayName("Concurrent withdrawals never overdraw the drawer")
    void testWithdraw_ConcurrentNoOverdraw() throws Exception {
        Drawer drawer = newDrawer(null);
        fund(drawer.getId(), "USD", "100.00");

        int threads = 10;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threads);
        AtomicInteger succeeded = new AtomicInteger();
        AtomicInteger rejected = new AtomicInteger();

        for (int i = 0; i < threads; i++) {
            executor.submit(() -> {
                try {
                    start.await();
                    drawerBalanceService.withdraw(drawer.getId(), "USD", new BigDecimal("20.00"), null, employee);
                    succeeded.incrementAndGet();
                } catch (InsufficientFundsException e) {
                    rejected.incrementAndGet();
                } catch (Exception e) {
                    fail("Unexpected failure: " + e);
                } finally {
                    done.countDown();
                }
                return null;
            });
        }

        start.countDown();
        assertTrue(done.await(30, TimeUnit.SECONDS));
        executor.shutdown();

        assertEquals(5, succeeded.get());
        assertEquals(5, rejected.get());
        assertEquals(0, BigDecimal.ZERO.compareTo(balanceOf(drawer.getId(), "USD")));
        assertEquals(6, ledgerEntryCount(drawer.getId()));
        assertTrue(ledgerQueryService.verifyConsistency(drawer.getId()).stream()
            .allMatch(ConsistencyReport::isConsistent));
    }
}
