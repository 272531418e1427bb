package com.flagship.exchange_ledger.settlement;

import com.flagship.exchange_ledger.balance.BalanceChange;
import com.flagship.exchange_ledger.balance.BalanceStore;
import com.flagship.exchange_ledger.balance.CurrencyBalance;
import com.flagship.exchange_ledger.common.UnitOfWork;
import com.flagship.exchange_ledger.currency.Currency;
import com.flagship.exchange_ledger.currency.CurrencyDirectory;
import com.flagship.exchange_ledger.drawer.Drawer;
import com.flagship.exchange_ledger.drawer.DrawerService;
import com.flagship.exchange_ledger.exception.ComplianceBlockedException;
import com.flagship.exchange_ledger.exception.InsufficientFundsException;
import com.flagship.exchange_ledger.exception.NoActiveDrawerException;
import com.flagship.exchange_ledger.exception.ValidationException;
import com.flagship.exchange_ledger.ledger.EntryType;
import com.flagship.exchange_ledger.ledger.LedgerRecorder;
import com.flagship.exchange_ledger.ledger.LedgerReference;
import com.flagship.exchange_ledger.observability.LedgerMetrics;
import com.flagship.exchange_ledger.settlement.broadcast.SettlementCompletedEvent;
import com.flagship.exchange_ledger.settlement.compliance.ComplianceAction;
import com.flagship.exchange_ledger.settlement.compliance.ComplianceEvaluator;
import com.flagship.exchange_ledger.settlement.compliance.ComplianceVerdict;
import com.flagship.exchange_ledger.settlement.customer.CustomerDirectory;
import com.flagship.exchange_ledger.settlement.customer.ResolvedCustomer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.context.ApplicationEventPublisher;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Settlement protocol against mocked collaborators: ordering of locks and
 * writes, and that every rejection happens before anything is written.
 */
@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class SettlementServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @Mock private DrawerService drawerService;
    @Mock private CurrencyDirectory currencyDirectory;
    @Mock private BalanceStore balanceStore;
    @Mock private LedgerRecorder ledgerRecorder;
    @Mock private ExchangeTransactionRepository transactionRepository;
    @Mock private CustomerDirectory customerDirectory;
    @Mock private ComplianceEvaluator complianceEvaluator;
    @Mock private IdempotencyService idempotencyService;
    @Mock private ApplicationEventPublisher eventPublisher;
    @Mock private UnitOfWork unitOfWork;

    private final UUID operatorId = UUID.randomUUID();
    private final UUID drawerId = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        when(unitOfWork.execute(anyString(), any())).thenAnswer(invocation -> {
            Supplier<?> work = invocation.getArgument(1);
            return work.get();
        });
        when(ledgerRecorder.normalizeNotes(any())).thenAnswer(invocation -> invocation.getArgument(0));
        when(drawerService.resolveActiveDrawer(operatorId)).thenReturn(
            new Drawer(drawerId, "Front desk", null, true, BigDecimal.ZERO, operatorId, operatorId, NOW, NOW));
        when(currencyDirectory.requireActive("USD"))
            .thenReturn(new Currency("USD", "US Dollar", true, new BigDecimal("10000.00")));
        when(currencyDirectory.requireActive("IQD"))
            .thenReturn(new Currency("IQD", "Iraqi Dinar", true, new BigDecimal("15000000.00")));
        when(customerDirectory.resolve(any(), eq(operatorId))).thenReturn(ResolvedCustomer.anonymous());
        when(complianceEvaluator.evaluate(any(), any())).thenReturn(ComplianceVerdict.clear());
        when(transactionRepository.saveAndFlush(any())).thenAnswer(invocation -> invocation.getArgument(0));
    }

    private SettlementService service(boolean enforceBlock) {
        return new SettlementService(drawerService, currencyDirectory, balanceStore, ledgerRecorder,
            transactionRepository, customerDirectory, complianceEvaluator, idempotencyService, eventPublisher,
            unitOfWork, new LedgerMetrics(new SimpleMeterRegistry()), Clock.fixed(NOW, ZoneOffset.UTC), enforceBlock);
    }

    private void givenBalances(String usd, String iqd) {
        when(balanceStore.lockInOrder(eq(drawerId), anyCollection())).thenReturn(List.of(
            new CurrencyBalance(drawerId, "IQD", new BigDecimal(iqd), null, NOW),
            new CurrencyBalance(drawerId, "USD", new BigDecimal(usd), null, NOW)));
        when(balanceStore.debit(eq(drawerId), eq("USD"), any(), eq(operatorId))).thenAnswer(invocation -> {
            BigDecimal before = new BigDecimal(usd);
            return new BalanceChange(drawerId, "USD", before, before.subtract(invocation.getArgument(2)));
        });
        when(balanceStore.credit(eq(drawerId), eq("IQD"), any(), eq(operatorId))).thenAnswer(invocation -> {
            BigDecimal before = new BigDecimal(iqd);
            return new BalanceChange(drawerId, "IQD", before, before.add(invocation.getArgument(2)));
        });
    }

    private SettlementRequest sellUsd(String amountOut, String amountIn) {
        return SettlementRequest.builder()
            .operatorId(operatorId)
            .currencyIn("IQD")
            .currencyOut("USD")
            .amountIn(new BigDecimal(amountIn))
            .amountOut(new BigDecimal(amountOut))
            .appliedRate(new BigDecimal("1460"))
            .build();
    }

    private void verifyNothingWritten() {
        verify(transactionRepository, never()).saveAndFlush(any());
        verify(balanceStore, never()).debit(any(), any(), any(), any());
        verify(balanceStore, never()).credit(any(), any(), any(), any());
        verify(ledgerRecorder, never()).record(any(), any(), any(), any(), any(), any());
        verify(eventPublisher, never()).publishEvent(any(Object.class));
    }

    @Test
    @DisplayName("Selling 100 USD at 1460 debits USD, credits IQD and records both legs")
    void testSettle_SellUsd() {
        givenBalances("1000.00", "0.00");

        SettlementResult result = service(false).settle(sellUsd("100", "146000"));

        assertFalse(result.isReplayed());
        assertEquals(new BigDecimal("900.00"), result.getUpdatedBalances().get("USD"));
        assertEquals(new BigDecimal("146000.00"), result.getUpdatedBalances().get("IQD"));
        assertEquals(0, result.getTransaction().getProfit().signum());
        assertEquals(drawerId, result.getTransaction().getDrawerId());

        @SuppressWarnings("unchecked")
        ArgumentCaptor<Collection<String>> locked = ArgumentCaptor.forClass(Collection.class);
        InOrder order = inOrder(customerDirectory, balanceStore, transactionRepository, ledgerRecorder, eventPublisher);
        order.verify(customerDirectory).resolve(any(), eq(operatorId));
        order.verify(balanceStore).lockInOrder(eq(drawerId), locked.capture());
        order.verify(transactionRepository).saveAndFlush(any());
        order.verify(balanceStore).debit(drawerId, "USD", new BigDecimal("100.00"), operatorId);
        order.verify(balanceStore).credit(drawerId, "IQD", new BigDecimal("146000.00"), operatorId);
        order.verify(ledgerRecorder).record(any(), eq(EntryType.TRANSACTION_OUT), eq(new BigDecimal("100.00")),
            eq(LedgerReference.transaction(result.getTransaction().getId())), any(), eq(operatorId));
        order.verify(ledgerRecorder).record(any(), eq(EntryType.TRANSACTION_IN), eq(new BigDecimal("146000.00")),
            eq(LedgerReference.transaction(result.getTransaction().getId())), any(), eq(operatorId));
        order.verify(eventPublisher).publishEvent(any(SettlementCompletedEvent.class));

        assertTrue(locked.getValue().containsAll(List.of("USD", "IQD")));
    }

    @Test
    @DisplayName("Insufficient outgoing balance aborts before anything is written")
    void testSettle_InsufficientFunds() {
        givenBalances("50.00", "0.00");

        InsufficientFundsException e = assertThrows(InsufficientFundsException.class,
            () -> service(false).settle(sellUsd("100", "146000")));

        assertEquals("USD", e.getCurrency());
        assertEquals(new BigDecimal("50.00"), e.getAvailable());
        verifyNothingWritten();
    }

    @Test
    @DisplayName("Operator without an active drawer cannot settle")
    void testSettle_NoActiveDrawer() {
        UUID stranger = UUID.randomUUID();
        when(customerDirectory.resolve(any(), eq(stranger))).thenReturn(ResolvedCustomer.anonymous());
        when(drawerService.resolveActiveDrawer(stranger)).thenThrow(new NoActiveDrawerException(stranger));

        SettlementRequest request = SettlementRequest.builder()
            .operatorId(stranger)
            .currencyIn("IQD")
            .currencyOut("USD")
            .amountIn(new BigDecimal("146000"))
            .amountOut(new BigDecimal("100"))
            .appliedRate(new BigDecimal("1460"))
            .build();

        assertThrows(NoActiveDrawerException.class, () -> service(false).settle(request));
        verify(balanceStore, never()).lockInOrder(any(), anyCollection());
        verifyNothingWritten();
    }

    @Test
    @DisplayName("Same incoming and outgoing currency is rejected before customer resolution")
    void testSettle_SameCurrency() {
        SettlementRequest request = SettlementRequest.builder()
            .operatorId(operatorId)
            .currencyIn("usd")
            .currencyOut("USD")
            .amountIn(new BigDecimal("1"))
            .amountOut(new BigDecimal("1"))
            .appliedRate(BigDecimal.ONE)
            .build();

        assertThrows(ValidationException.class, () -> service(false).settle(request));
        verifyNoInteractions(customerDirectory, unitOfWork);
    }

    @Test
    @DisplayName("Flagged exchange is recorded but not blocked by default")
    void testSettle_FlaggedNotEnforced() {
        givenBalances("1000.00", "0.00");
        when(complianceEvaluator.evaluate(any(), any()))
            .thenReturn(ComplianceVerdict.flagged("High Value Transaction (>= 100000 IQD)", ComplianceAction.BLOCK));

        SettlementResult result = service(false).settle(sellUsd("100", "146000"));

        assertTrue(result.getTransaction().isFlagged());
        assertEquals(ComplianceAction.BLOCK, result.getTransaction().getComplianceAction());

        ArgumentCaptor<ExchangeTransactionEntity> saved = ArgumentCaptor.forClass(ExchangeTransactionEntity.class);
        verify(transactionRepository).saveAndFlush(saved.capture());
        assertTrue(saved.getValue().isFlagged());
        assertEquals("High Value Transaction (>= 100000 IQD)", saved.getValue().getFlagReason());
    }

    @Test
    @DisplayName("Enforced BLOCK verdict aborts before anything is written")
    void testSettle_BlockEnforced() {
        givenBalances("1000.00", "0.00");
        when(complianceEvaluator.evaluate(any(), any()))
            .thenReturn(ComplianceVerdict.flagged("High Value Transaction (>= 100000 IQD)", ComplianceAction.BLOCK));

        assertThrows(ComplianceBlockedException.class, () -> service(true).settle(sellUsd("100", "146000")));
        verifyNothingWritten();
    }

    @Test
    @DisplayName("Known idempotency key replays the stored transaction without settling again")
    void testSettle_IdempotentReplay() {
        ExchangeTransaction stored = ExchangeTransaction.price(drawerId, operatorId, null, "IQD", "USD",
            new BigDecimal("146000.00"), new BigDecimal("100.00"), new BigDecimal("1460.000000"), null, null, NOW);
        when(idempotencyService.findSettledTransaction("retry-1")).thenReturn(Optional.of(stored.getId()));
        when(transactionRepository.findById(stored.getId()))
            .thenReturn(Optional.of(ExchangeTransactionEntity.fromDomain(stored, "retry-1")));
        when(balanceStore.getBalance(drawerId, "USD")).thenReturn(new BigDecimal("900.00"));
        when(balanceStore.getBalance(drawerId, "IQD")).thenReturn(new BigDecimal("146000.00"));

        SettlementRequest request = SettlementRequest.builder()
            .operatorId(operatorId)
            .currencyIn("IQD")
            .currencyOut("USD")
            .amountIn(new BigDecimal("146000"))
            .amountOut(new BigDecimal("100"))
            .appliedRate(new BigDecimal("1460"))
            .idempotencyKey("retry-1")
            .build();

        SettlementResult result = service(false).settle(request);

        assertTrue(result.isReplayed());
        assertEquals(stored.getId(), result.getTransaction().getId());
        assertEquals(new BigDecimal("900.00"), result.getUpdatedBalances().get("USD"));
        verifyNoInteractions(unitOfWork, customerDirectory);
        verifyNothingWritten();
    }

    @Test
    @DisplayName("New idempotency key is remembered after the settlement commits")
    void testSettle_RemembersKey() {
        givenBalances("1000.00", "0.00");
        when(idempotencyService.findSettledTransaction("first-1")).thenReturn(Optional.empty());

        SettlementRequest request = SettlementRequest.builder()
            .operatorId(operatorId)
            .currencyIn("IQD")
            .currencyOut("USD")
            .amountIn(new BigDecimal("146000"))
            .amountOut(new BigDecimal("100"))
            .appliedRate(new BigDecimal("1460"))
            .idempotencyKey("first-1")
            .build();

        SettlementResult result = service(false).settle(request);

        verify(idempotencyService).remember("first-1", result.getTransaction().getId());
        ArgumentCaptor<ExchangeTransactionEntity> saved = ArgumentCaptor.forClass(ExchangeTransactionEntity.class);
        verify(transactionRepository).saveAndFlush(saved.capture());
        assertEquals("first-1", saved.getValue().getIdempotencyKey());
    }

    @Test
    @DisplayName("Key settled by a concurrent request while waiting for locks is replayed, not re-checked for funds")
    void testSettle_KeySettledWhileWaitingForLocks() {
        givenBalances("0.00", "146000.00");
        ExchangeTransaction stored = ExchangeTransaction.price(drawerId, operatorId, null, "IQD", "USD",
            new BigDecimal("146000.00"), new BigDecimal("100.00"), new BigDecimal("1460.000000"), null, null, NOW);
        ExchangeTransactionEntity entity = ExchangeTransactionEntity.fromDomain(stored, "late-1");
        when(idempotencyService.findSettledTransaction("late-1")).thenReturn(Optional.empty());
        when(transactionRepository.findByIdempotencyKey("late-1")).thenReturn(Optional.of(entity));
        when(transactionRepository.findById(stored.getId())).thenReturn(Optional.of(entity));
        when(balanceStore.getBalance(drawerId, "USD")).thenReturn(new BigDecimal("0.00"));
        when(balanceStore.getBalance(drawerId, "IQD")).thenReturn(new BigDecimal("146000.00"));

        SettlementRequest request = SettlementRequest.builder()
            .operatorId(operatorId)
            .currencyIn("IQD")
            .currencyOut("USD")
            .amountIn(new BigDecimal("146000"))
            .amountOut(new BigDecimal("100"))
            .appliedRate(new BigDecimal("1460"))
            .idempotencyKey("late-1")
            .build();

        SettlementResult result = service(true).settle(request);

        assertTrue(result.isReplayed());
        assertEquals(stored.getId(), result.getTransaction().getId());
        verify(balanceStore).lockInOrder(eq(drawerId), anyCollection());
        verify(complianceEvaluator, never()).evaluate(any(), any());
        verifyNothingWritten();
    }
}
