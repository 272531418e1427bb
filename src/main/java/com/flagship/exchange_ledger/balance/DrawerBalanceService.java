package com.flagship.exchange_ledger.balance;

import com.flagship.exchange_ledger.common.Amounts;
import com.flagship.exchange_ledger.common.UnitOfWork;
import com.flagship.exchange_ledger.currency.CurrencyDirectory;
import com.flagship.exchange_ledger.drawer.DrawerService;
import com.flagship.exchange_ledger.exception.LedgerException;
import com.flagship.exchange_ledger.exception.ValidationException;
import com.flagship.exchange_ledger.ledger.EntryType;
import com.flagship.exchange_ledger.ledger.LedgerEntry;
import com.flagship.exchange_ledger.ledger.LedgerRecorder;
import com.flagship.exchange_ledger.ledger.LedgerReference;
import com.flagship.exchange_ledger.observability.CorrelationContext;
import com.flagship.exchange_ledger.observability.LedgerMetrics;
import com.flagship.exchange_ledger.operator.Operator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.List;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Single-currency cash movements on a drawer: deposit, withdraw, adjust and reconcile.
 *
 * Each operation is one unit of work: lock the (drawer, currency) row, validate
 * against the locked value, write the new balance and append exactly one ledger
 * entry. Any failure rolls back both.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DrawerBalanceService {

    private final BalanceStore balanceStore;
    private final LedgerRecorder ledgerRecorder;
    private final ReconciliationRepository reconciliationRepository;
    private final DrawerService drawerService;
    private final CurrencyDirectory currencyDirectory;
    private final UnitOfWork unitOfWork;
    private final LedgerMetrics ledgerMetrics;
    private final Clock clock;

    /**
     * Puts cash into an active drawer.
     */
    public BalanceMutationResult deposit(UUID drawerId, String currency, BigDecimal amount,
                                         String notes, Operator operator) {
        String code = CurrencyDirectory.normalize(currency);
        BigDecimal validAmount = Amounts.requirePositive("Amount", amount);

        return observe("deposit", drawerId, code, () -> unitOfWork.execute("deposit", () -> {
            drawerService.requireActiveDrawer(drawerId);
            currencyDirectory.requireActive(code);

            BalanceChange change = balanceStore.credit(drawerId, code, validAmount, operator.getId());
            LedgerEntry entry = ledgerRecorder.record(
                change, EntryType.DEPOSIT, validAmount, LedgerReference.none(), notes, operator.getId());
            return BalanceMutationResult.from(entry);
        }));
    }

    /**
     * Takes cash out of an active drawer.
     *
     * @throws com.flagship.exchange_ledger.exception.InsufficientFundsException if the drawer holds less than the amount
     */
    public BalanceMutationResult withdraw(UUID drawerId, String currency, BigDecimal amount,
                                          String notes, Operator operator) {
        String code = CurrencyDirectory.normalize(currency);
        BigDecimal validAmount = Amounts.requirePositive("Amount", amount);

        return observe("withdraw", drawerId, code, () -> unitOfWork.execute("withdraw", () -> {
            drawerService.requireActiveDrawer(drawerId);
            currencyDirectory.requireActive(code);

            BalanceChange change = balanceStore.debit(drawerId, code, validAmount, operator.getId());
            LedgerEntry entry = ledgerRecorder.record(
                change, EntryType.WITHDRAWAL, validAmount, LedgerReference.none(), notes, operator.getId());
            return BalanceMutationResult.from(entry);
        }));
    }

    /**
     * Administrator correction: sets the balance to {@code newBalance}. The ledger
     * entry's amount is the signed delta. Role, reason and the new value are all
     * checked before any row is locked; a new value equal to the locked balance is rejected.
     */
    public BalanceMutationResult adjust(UUID drawerId, String currency, BigDecimal newBalance,
                                        String reason, Operator operator) {
        operator.requireAdmin("adjust drawer balances");
        balanceStore.requireReason(reason);
        String code = CurrencyDirectory.normalize(currency);
        BigDecimal target = Amounts.requireNonNegative("New balance", newBalance);

        return observe("adjust", drawerId, code, () -> unitOfWork.execute("adjust", () -> {
            drawerService.getDrawer(drawerId);
            currencyDirectory.requireActive(code);

            BigDecimal current = balanceStore.lockInOrder(drawerId, List.of(code)).get(0).getBalance();
            if (current.compareTo(target) == 0) {
                throw new ValidationException("New balance equals the current balance of " + current.toPlainString());
            }

            BalanceChange change = balanceStore.setAbsolute(drawerId, code, target, reason, operator.getId());
            LedgerEntry entry = ledgerRecorder.record(
                change, EntryType.ADJUSTMENT, change.delta(), LedgerReference.none(), reason.trim(), operator.getId());
            log.info("Balance adjusted: delta={}, reason={}", change.delta(), reason.trim());
            return BalanceMutationResult.from(entry);
        }));
    }

    /**
     * Records a physical count of one currency and, if it differs from the
     * ledger, corrects the balance to the counted amount with a RECONCILIATION entry.
     */
    public Reconciliation reconcile(UUID drawerId, String currency, BigDecimal actualBalance,
                                    String notes, Operator operator) {
        operator.requireManagerOrAdmin("reconcile drawer balances");
        String code = CurrencyDirectory.normalize(currency);
        BigDecimal actual = Amounts.requireNonNegative("Actual balance", actualBalance);
        String validNotes = ledgerRecorder.normalizeNotes(notes);

        return observe("reconcile", drawerId, code, () -> unitOfWork.execute("reconcile", () -> {
            drawerService.getDrawer(drawerId);
            currencyDirectory.requireActive(code);

            BigDecimal expected = balanceStore.lockInOrder(drawerId, List.of(code)).get(0).getBalance();
            BigDecimal difference = actual.subtract(expected);
            ReconciliationStatus status = ReconciliationStatus.of(difference);

            Reconciliation reconciliation = new Reconciliation(
                UUID.randomUUID(), drawerId, code, expected, actual, difference, status,
                validNotes, operator.getId(), clock.instant(), null);
            reconciliationRepository.insert(reconciliation);

            if (status == ReconciliationStatus.BALANCED) {
                log.info("Reconciliation balanced: expected={}, actual={}", expected, actual);
                return reconciliation;
            }

            BalanceChange change = balanceStore.setAbsolute(drawerId, code, actual,
                "Reconciliation " + status + " by " + difference.abs().toPlainString(), operator.getId());
            LedgerEntry entry = ledgerRecorder.record(change, EntryType.RECONCILIATION, difference,
                LedgerReference.reconciliation(reconciliation.getId()), validNotes, operator.getId());

            log.warn("Reconciliation corrected balance: status={}, expected={}, actual={}, difference={}",
                    status, expected, actual, difference);
            return new Reconciliation(
                reconciliation.getId(), drawerId, code, expected, actual, difference, status,
                validNotes, operator.getId(), reconciliation.getCreatedAt(), entry.getId());
        }));
    }

    public List<CurrencyBalance> getBalances(UUID drawerId) {
        drawerService.getDrawer(drawerId);
        return balanceStore.findAllForDrawer(drawerId);
    }

    public List<Reconciliation> getReconciliations(UUID drawerId) {
        drawerService.getDrawer(drawerId);
        return reconciliationRepository.findByDrawer(drawerId);
    }

    private <T> T observe(String operation, UUID drawerId, String currency, Supplier<T> work) {
        long startTime = System.currentTimeMillis();
        MDC.put(CorrelationContext.DRAWER_ID_MDC_KEY, String.valueOf(drawerId));

        try {
            T result = work.get();
            long duration = System.currentTimeMillis() - startTime;
            ledgerMetrics.recordCashMovement(operation, currency, "success");
            ledgerMetrics.recordLatency(operation, duration);
            log.info("Drawer {} completed: currency={}, duration={}ms", operation, currency, duration);
            return result;

        } catch (LedgerException e) {
            ledgerMetrics.recordCashMovement(operation, currency, e.getCode().name());
            log.warn("Drawer {} rejected: currency={}, code={}, reason={}", operation, currency, e.getCode(), e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            ledgerMetrics.recordCashMovement(operation, currency, LedgerMetrics.outcomeOf(e));
            log.error("Drawer {} failed: currency={}, error={}", operation, currency, e.getMessage(), e);
            throw e;
        } finally {
            MDC.remove(CorrelationContext.DRAWER_ID_MDC_KEY);
        }
    }
}
