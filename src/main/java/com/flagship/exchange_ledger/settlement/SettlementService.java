package com.flagship.exchange_ledger.settlement;

import com.flagship.exchange_ledger.balance.BalanceChange;
import com.flagship.exchange_ledger.balance.BalanceStore;
import com.flagship.exchange_ledger.balance.CurrencyBalance;
import com.flagship.exchange_ledger.common.Amounts;
import com.flagship.exchange_ledger.common.UnitOfWork;
import com.flagship.exchange_ledger.currency.Currency;
import com.flagship.exchange_ledger.currency.CurrencyDirectory;
import com.flagship.exchange_ledger.drawer.Drawer;
import com.flagship.exchange_ledger.drawer.DrawerService;
import com.flagship.exchange_ledger.exception.ComplianceBlockedException;
import com.flagship.exchange_ledger.exception.InsufficientFundsException;
import com.flagship.exchange_ledger.exception.LedgerException;
import com.flagship.exchange_ledger.exception.NotFoundException;
import com.flagship.exchange_ledger.exception.PersistenceFailureException;
import com.flagship.exchange_ledger.exception.ValidationException;
import com.flagship.exchange_ledger.ledger.EntryType;
import com.flagship.exchange_ledger.ledger.LedgerRecorder;
import com.flagship.exchange_ledger.ledger.LedgerReference;
import com.flagship.exchange_ledger.observability.CorrelationContext;
import com.flagship.exchange_ledger.observability.LedgerMetrics;
import com.flagship.exchange_ledger.settlement.broadcast.SettlementCompletedEvent;
import com.flagship.exchange_ledger.settlement.compliance.ComplianceEvaluator;
import com.flagship.exchange_ledger.settlement.compliance.ComplianceVerdict;
import com.flagship.exchange_ledger.settlement.compliance.PendingExchange;
import com.flagship.exchange_ledger.settlement.customer.CustomerDirectory;
import com.flagship.exchange_ledger.settlement.customer.ResolvedCustomer;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Settles two-currency exchanges against the operator's drawer.
 *
 * Key principles:
 * - Customer resolution completes in its own transaction before any balance lock
 * - Both balance rows are locked in ascending currency order before the funds check
 * - Transaction row, both balance changes and both ledger entries commit together or not at all
 * - The broadcast happens after commit and can never undo a settlement
 * - A repeated idempotency key returns the first settlement instead of settling again
 */
@Service
@Slf4j
public class SettlementService {

    private final DrawerService drawerService;
    private final CurrencyDirectory currencyDirectory;
    private final BalanceStore balanceStore;
    private final LedgerRecorder ledgerRecorder;
    private final ExchangeTransactionRepository transactionRepository;
    private final CustomerDirectory customerDirectory;
    private final ComplianceEvaluator complianceEvaluator;
    private final IdempotencyService idempotencyService;
    private final ApplicationEventPublisher eventPublisher;
    private final UnitOfWork unitOfWork;
    private final LedgerMetrics ledgerMetrics;
    private final Clock clock;
    private final boolean enforceBlock;

    public SettlementService(DrawerService drawerService,
                             CurrencyDirectory currencyDirectory,
                             BalanceStore balanceStore,
                             LedgerRecorder ledgerRecorder,
                             ExchangeTransactionRepository transactionRepository,
                             CustomerDirectory customerDirectory,
                             ComplianceEvaluator complianceEvaluator,
                             IdempotencyService idempotencyService,
                             ApplicationEventPublisher eventPublisher,
                             UnitOfWork unitOfWork,
                             LedgerMetrics ledgerMetrics,
                             Clock clock,
                             @Value("${exchange.compliance.enforce-block:false}") boolean enforceBlock) {
        this.drawerService = drawerService;
        this.currencyDirectory = currencyDirectory;
        this.balanceStore = balanceStore;
        this.ledgerRecorder = ledgerRecorder;
        this.transactionRepository = transactionRepository;
        this.customerDirectory = customerDirectory;
        this.complianceEvaluator = complianceEvaluator;
        this.idempotencyService = idempotencyService;
        this.eventPublisher = eventPublisher;
        this.unitOfWork = unitOfWork;
        this.ledgerMetrics = ledgerMetrics;
        this.clock = clock;
        this.enforceBlock = enforceBlock;
    }

    /**
     * Settles an exchange.
     *
     * @throws com.flagship.exchange_ledger.exception.NoActiveDrawerException if the operator has no active drawer
     * @throws InsufficientFundsException if the drawer cannot pay out amountOut; nothing is written
     * @throws ComplianceBlockedException if a BLOCK verdict is enforced; nothing is written
     */
    public SettlementResult settle(SettlementRequest request) {
        long startTime = System.currentTimeMillis();

        try {
            ValidatedSettlement valid = validate(request);

            if (valid.idempotencyKey != null) {
                var existing = idempotencyService.findSettledTransaction(valid.idempotencyKey);
                if (existing.isPresent()) {
                    ledgerMetrics.recordIdempotencyHit();
                    ledgerMetrics.recordSettlement("replayed");
                    log.info("Idempotency key already used, returning existing transaction: transactionId={}",
                            existing.get());
                    return replay(existing.get());
                }
                ledgerMetrics.recordIdempotencyMiss();
            }

            ResolvedCustomer customer = customerDirectory.resolve(request.getCustomer(), valid.operatorId);

            SettlementResult result;
            try {
                result = unitOfWork.execute("settle", () -> settleLocked(valid, customer));
            } catch (PersistenceFailureException e) {
                if (valid.idempotencyKey != null && e.getCause() instanceof DataIntegrityViolationException) {
                    // a concurrent request with the same key committed first
                    UUID winner = transactionRepository.findByIdempotencyKey(valid.idempotencyKey)
                        .map(ExchangeTransactionEntity::getId)
                        .orElseThrow(() -> e);
                    ledgerMetrics.recordSettlement("replayed");
                    log.info("Concurrent settlement with same idempotency key won: transactionId={}", winner);
                    return replay(winner);
                }
                throw e;
            }

            if (valid.idempotencyKey != null) {
                idempotencyService.remember(valid.idempotencyKey, result.getTransaction().getId());
            }
            if (result.isReplayed()) {
                ledgerMetrics.recordSettlement("replayed");
                return result;
            }

            long duration = System.currentTimeMillis() - startTime;
            ledgerMetrics.recordSettlement("success");
            ledgerMetrics.recordLatency("settle", duration);
            log.info("Exchange settled: transactionId={}, {} {} in, {} {} out, profit={}, flagged={}, duration={}ms",
                    result.getTransaction().getId(),
                    valid.amountIn, valid.currencyIn, valid.amountOut, valid.currencyOut,
                    result.getTransaction().getProfit(), result.getTransaction().isFlagged(), duration);
            return result;

        } catch (LedgerException e) {
            ledgerMetrics.recordSettlement(e.getCode().name());
            ledgerMetrics.recordLatency("settle", System.currentTimeMillis() - startTime);
            log.warn("Settlement rejected: code={}, reason={}", e.getCode(), e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            ledgerMetrics.recordSettlement(LedgerMetrics.outcomeOf(e));
            ledgerMetrics.recordLatency("settle", System.currentTimeMillis() - startTime);
            log.error("Settlement failed: error={}", e.getMessage(), e);
            throw e;
        } finally {
            MDC.remove(CorrelationContext.DRAWER_ID_MDC_KEY);
            MDC.remove(CorrelationContext.TRANSACTION_ID_MDC_KEY);
        }
    }

    @Transactional(readOnly = true)
    public ExchangeTransaction getTransaction(UUID transactionId) {
        return transactionRepository.findById(transactionId)
            .map(ExchangeTransactionEntity::toDomain)
            .orElseThrow(() -> new NotFoundException("Exchange transaction not found: " + transactionId));
    }

    /**
     * Exchanges settled by a drawer on one business day, newest first.
     */
    @Transactional(readOnly = true)
    public List<ExchangeTransaction> listTransactions(UUID drawerId, LocalDate date) {
        drawerService.getDrawer(drawerId);
        ZoneId zone = clock.getZone();
        LocalDate day = date != null ? date : LocalDate.now(clock);
        return transactionRepository
            .findByDrawerIdAndCreatedAtGreaterThanEqualAndCreatedAtLessThanOrderByCreatedAtDesc(
                drawerId,
                day.atStartOfDay(zone).toInstant(),
                day.plusDays(1).atStartOfDay(zone).toInstant())
            .stream()
            .map(ExchangeTransactionEntity::toDomain)
            .collect(Collectors.toList());
    }

    private SettlementResult settleLocked(ValidatedSettlement valid, ResolvedCustomer customer) {
        Drawer drawer = drawerService.resolveActiveDrawer(valid.operatorId);
        MDC.put(CorrelationContext.DRAWER_ID_MDC_KEY, drawer.getId().toString());

        Currency incoming = currencyDirectory.requireActive(valid.currencyIn);
        Currency outgoing = currencyDirectory.requireActive(valid.currencyOut);

        List<CurrencyBalance> locked = balanceStore.lockInOrder(
            drawer.getId(), List.of(valid.currencyIn, valid.currencyOut));

        // a request with the same key may have committed while this one waited for the locks
        if (valid.idempotencyKey != null) {
            Optional<UUID> settled = transactionRepository.findByIdempotencyKey(valid.idempotencyKey)
                .map(ExchangeTransactionEntity::getId);
            if (settled.isPresent()) {
                log.info("Idempotency key settled while waiting for balance locks: transactionId={}", settled.get());
                return replay(settled.get());
            }
        }
        BigDecimal available = locked.stream()
            .filter(balance -> balance.getCurrency().equals(valid.currencyOut))
            .map(CurrencyBalance::getBalance)
            .findFirst()
            .orElse(Amounts.zero());
        if (valid.amountOut.compareTo(available) > 0) {
            throw new InsufficientFundsException(drawer.getId(), valid.currencyOut, available, valid.amountOut);
        }

        ExchangeTransaction priced = ExchangeTransaction.price(
            drawer.getId(), valid.operatorId, customer.getId(),
            valid.currencyIn, valid.currencyOut, valid.amountIn, valid.amountOut,
            valid.appliedRate, valid.marketRate, valid.notes, clock.instant());
        MDC.put(CorrelationContext.TRANSACTION_ID_MDC_KEY, priced.getId().toString());

        ComplianceVerdict verdict = complianceEvaluator.evaluate(
            new PendingExchange(drawer.getId(), valid.operatorId, incoming, outgoing,
                valid.amountIn, valid.amountOut, valid.appliedRate),
            customer);
        if (verdict.isFlagged()) {
            ledgerMetrics.recordFlaggedSettlement(verdict.getAction().name());
            if (verdict.isBlocking() && enforceBlock) {
                throw new ComplianceBlockedException("Exchange blocked by compliance: " + verdict.getReason());
            }
            log.warn("Exchange flagged by compliance: reason={}, action={}", verdict.getReason(), verdict.getAction());
        }
        ExchangeTransaction transaction = priced.withCompliance(verdict);

        // flush now so a duplicate idempotency key fails before any balance is written
        transactionRepository.saveAndFlush(ExchangeTransactionEntity.fromDomain(transaction, valid.idempotencyKey));

        BalanceChange out = balanceStore.debit(drawer.getId(), valid.currencyOut, valid.amountOut, valid.operatorId);
        BalanceChange in = balanceStore.credit(drawer.getId(), valid.currencyIn, valid.amountIn, valid.operatorId);

        LedgerReference reference = LedgerReference.transaction(transaction.getId());
        ledgerRecorder.record(out, EntryType.TRANSACTION_OUT, valid.amountOut, reference, valid.notes, valid.operatorId);
        ledgerRecorder.record(in, EntryType.TRANSACTION_IN, valid.amountIn, reference, valid.notes, valid.operatorId);

        eventPublisher.publishEvent(new SettlementCompletedEvent(transaction, CorrelationContext.getCorrelationId()));

        Map<String, BigDecimal> balances = new LinkedHashMap<>();
        balances.put(out.getCurrency(), out.getBalanceAfter());
        balances.put(in.getCurrency(), in.getBalanceAfter());
        return new SettlementResult(transaction, balances, false);
    }

    private SettlementResult replay(UUID transactionId) {
        ExchangeTransaction transaction = getTransaction(transactionId);
        Map<String, BigDecimal> balances = new LinkedHashMap<>();
        balances.put(transaction.getCurrencyOut(),
            balanceStore.getBalance(transaction.getDrawerId(), transaction.getCurrencyOut()));
        balances.put(transaction.getCurrencyIn(),
            balanceStore.getBalance(transaction.getDrawerId(), transaction.getCurrencyIn()));
        return new SettlementResult(transaction, balances, true);
    }

    private ValidatedSettlement validate(SettlementRequest request) {
        if (request.getOperatorId() == null) {
            throw new ValidationException("Operator id is required");
        }
        String currencyIn = CurrencyDirectory.normalize(request.getCurrencyIn());
        String currencyOut = CurrencyDirectory.normalize(request.getCurrencyOut());
        if (currencyIn.equals(currencyOut)) {
            throw new ValidationException("Incoming and outgoing currency must differ");
        }
        String idempotencyKey = request.getIdempotencyKey();
        if (idempotencyKey != null) {
            idempotencyService.requireKey(idempotencyKey);
        }

        return new ValidatedSettlement(
            request.getOperatorId(),
            currencyIn,
            currencyOut,
            Amounts.requirePositive("Amount in", request.getAmountIn()),
            Amounts.requirePositive("Amount out", request.getAmountOut()),
            Amounts.requireRate("Applied rate", request.getAppliedRate()),
            request.getMarketRate() != null ? Amounts.requireRate("Market rate", request.getMarketRate()) : null,
            ledgerRecorder.normalizeNotes(request.getNotes()),
            idempotencyKey
        );
    }

    private static final class ValidatedSettlement {
        final UUID operatorId;
        final String currencyIn;
        final String currencyOut;
        final BigDecimal amountIn;
        final BigDecimal amountOut;
        final BigDecimal appliedRate;
        final BigDecimal marketRate;
        final String notes;
        final String idempotencyKey;

        ValidatedSettlement(UUID operatorId, String currencyIn, String currencyOut,
                            BigDecimal amountIn, BigDecimal amountOut,
                            BigDecimal appliedRate, BigDecimal marketRate,
                            String notes, String idempotencyKey) {
            this.operatorId = operatorId;
            this.currencyIn = currencyIn;
            this.currencyOut = currencyOut;
            this.amountIn = amountIn;
            this.amountOut = amountOut;
            this.appliedRate = appliedRate;
            this.marketRate = marketRate;
            this.notes = notes;
            this.idempotencyKey = idempotencyKey;
        }
    }
}
