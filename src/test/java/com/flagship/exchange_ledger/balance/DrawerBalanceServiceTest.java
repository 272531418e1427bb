package com.flagship.exchange_ledger.balance;

import com.flagship.exchange_ledger.common.UnitOfWork;
import com.flagship.exchange_ledger.currency.CurrencyDirectory;
import com.flagship.exchange_ledger.drawer.DrawerService;
import com.flagship.exchange_ledger.exception.UnauthorizedException;
import com.flagship.exchange_ledger.exception.ValidationException;
import com.flagship.exchange_ledger.ledger.EntryType;
import com.flagship.exchange_ledger.ledger.LedgerEntry;
import com.flagship.exchange_ledger.ledger.LedgerRecorder;
import com.flagship.exchange_ledger.ledger.LedgerReference;
import com.flagship.exchange_ledger.observability.LedgerMetrics;
import com.flagship.exchange_ledger.operator.Operator;
import com.flagship.exchange_ledger.operator.OperatorRole;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class DrawerBalanceServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T18:00:00Z");

    @Mock private BalanceStore balanceStore;
    @Mock private LedgerRecorder ledgerRecorder;
    @Mock private ReconciliationRepository reconciliationRepository;
    @Mock private DrawerService drawerService;
    @Mock private CurrencyDirectory currencyDirectory;
    @Mock private UnitOfWork unitOfWork;

    private DrawerBalanceService service;

    private final UUID drawerId = UUID.randomUUID();
    private final Operator admin = Operator.of(UUID.randomUUID(), OperatorRole.ADMIN);
    private final Operator manager = Operator.of(UUID.randomUUID(), OperatorRole.MANAGER);
    private final Operator employee = Operator.of(UUID.randomUUID(), OperatorRole.EMPLOYEE);

    @BeforeEach
    void setUp() {
        when(unitOfWork.execute(anyString(), any())).thenAnswer(invocation -> {
            Supplier<?> work = invocation.getArgument(1);
            return work.get();
        });
        when(ledgerRecorder.normalizeNotes(any())).thenAnswer(invocation -> invocation.getArgument(0));
        when(ledgerRecorder.record(any(), any(), any(), any(), any(), any())).thenAnswer(invocation -> {
            BalanceChange change = invocation.getArgument(0);
            EntryType type = invocation.getArgument(1);
            LedgerReference reference = invocation.getArgument(3);
            return new LedgerEntry(UUID.randomUUID(), 1L, change.getDrawerId(), change.getCurrency(), type,
                invocation.getArgument(2), change.getBalanceBefore(), change.getBalanceAfter(),
                reference.getType(), reference.getId(), invocation.getArgument(4), invocation.getArgument(5), NOW);
        });

        service = new DrawerBalanceService(balanceStore, ledgerRecorder, reconciliationRepository, drawerService,
            currencyDirectory, unitOfWork, new LedgerMetrics(new SimpleMeterRegistry()),
            Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private void givenLockedBalance(String currency, String balance) {
        when(balanceStore.lockInOrder(drawerId, List.of(currency)))
            .thenReturn(List.of(new CurrencyBalance(drawerId, currency, new BigDecimal(balance), null, NOW)));
    }

    @Test
    @DisplayName("Deposit credits the drawer and records a DEPOSIT entry")
    void testDeposit_RecordsEntry() {
        when(balanceStore.credit(drawerId, "USD", new BigDecimal("500.00"), employee.getId()))
            .thenReturn(new BalanceChange(drawerId, "USD", new BigDecimal("0.00"), new BigDecimal("500.00")));

        BalanceMutationResult result = service.deposit(drawerId, "usd", new BigDecimal("500"), "opening float", employee);

        assertEquals(EntryType.DEPOSIT, result.getType());
        assertEquals(new BigDecimal("500.00"), result.getBalanceAfter());
        verify(drawerService).requireActiveDrawer(drawerId);
        verify(currencyDirectory).requireActive("USD");
    }

    @Test
    @DisplayName("Amount with more than two decimals is rejected before the unit of work starts")
    void testWithdraw_RejectsSubCentAmount() {
        assertThrows(ValidationException.class,
            () -> service.withdraw(drawerId, "USD", new BigDecimal("1.005"), null, employee));
        verifyNoInteractions(unitOfWork, balanceStore);
    }

    @Test
    @DisplayName("Only administrators may adjust; nothing is touched otherwise")
    void testAdjust_RequiresAdmin() {
        assertThrows(UnauthorizedException.class,
            () -> service.adjust(drawerId, "USD", new BigDecimal("80.00"), "Count correction", manager));
        assertThrows(UnauthorizedException.class,
            () -> service.adjust(drawerId, "USD", new BigDecimal("80.00"), "Count correction", employee));
        verifyNoInteractions(unitOfWork, balanceStore);
        verify(ledgerRecorder, never()).record(any(), any(), any(), any(), any(), any());
    }

    @Test
    @DisplayName("Adjustment records the signed delta with the trimmed reason")
    void testAdjust_RecordsSignedDelta() {
        givenLockedBalance("USD", "100.00");
        when(balanceStore.setAbsolute(eq(drawerId), eq("USD"), eq(new BigDecimal("80.00")), anyString(), eq(admin.getId())))
            .thenReturn(new BalanceChange(drawerId, "USD", new BigDecimal("100.00"), new BigDecimal("80.00")));

        BalanceMutationResult result = service.adjust(drawerId, "USD", new BigDecimal("80"), "  Miscount  ", admin);

        assertEquals(EntryType.ADJUSTMENT, result.getType());
        assertEquals(new BigDecimal("-20.00"), result.getAmount());
        verify(balanceStore).requireReason("  Miscount  ");
        verify(ledgerRecorder).record(any(), eq(EntryType.ADJUSTMENT), eq(new BigDecimal("-20.00")),
            eq(LedgerReference.none()), eq("Miscount"), eq(admin.getId()));
    }

    @Test
    @DisplayName("Adjusting to the current balance is rejected and records nothing")
    void testAdjust_UnchangedBalance() {
        givenLockedBalance("USD", "100.00");

        assertThrows(ValidationException.class,
            () -> service.adjust(drawerId, "USD", new BigDecimal("100"), "Recount matched", admin));

        verify(balanceStore, never()).setAbsolute(any(), any(), any(), any(), any());
        verify(ledgerRecorder, never()).record(any(), any(), any(), any(), any(), any());
    }

    @Test
    @DisplayName("Employees cannot reconcile")
    void testReconcile_RequiresManager() {
        assertThrows(UnauthorizedException.class,
            () -> service.reconcile(drawerId, "USD", new BigDecimal("100.00"), null, employee));
        verifyNoInteractions(unitOfWork, reconciliationRepository);
    }

    @Test
    @DisplayName("Balanced count is stored without touching the balance")
    void testReconcile_Balanced() {
        givenLockedBalance("USD", "100.00");

        Reconciliation reconciliation = service.reconcile(drawerId, "USD", new BigDecimal("100"), null, manager);

        assertEquals(ReconciliationStatus.BALANCED, reconciliation.getStatus());
        assertEquals(0, reconciliation.getDifference().signum());
        assertNull(reconciliation.getLedgerEntryId());
        verify(reconciliationRepository).insert(any());
        verify(balanceStore, never()).setAbsolute(any(), any(), any(), any(), any());
        verify(ledgerRecorder, never()).record(any(), any(), any(), any(), any(), any());
    }

    @Test
    @DisplayName("Short count corrects the balance and links the RECONCILIATION entry")
    void testReconcile_ShortCorrectsBalance() {
        givenLockedBalance("USD", "100.00");
        when(balanceStore.setAbsolute(eq(drawerId), eq("USD"), eq(new BigDecimal("90.00")), anyString(), eq(manager.getId())))
            .thenReturn(new BalanceChange(drawerId, "USD", new BigDecimal("100.00"), new BigDecimal("90.00")));

        Reconciliation reconciliation = service.reconcile(drawerId, "USD", new BigDecimal("90.00"), "till short", manager);

        assertEquals(ReconciliationStatus.SHORT, reconciliation.getStatus());
        assertEquals(new BigDecimal("-10.00"), reconciliation.getDifference());
        assertNotNull(reconciliation.getLedgerEntryId());

        ArgumentCaptor<LedgerReference> reference = ArgumentCaptor.forClass(LedgerReference.class);
        verify(ledgerRecorder).record(any(), eq(EntryType.RECONCILIATION), eq(new BigDecimal("-10.00")),
            reference.capture(), eq("till short"), eq(manager.getId()));
        assertEquals(LedgerReference.RECONCILIATION, reference.getValue().getType());
        assertEquals(reconciliation.getId(), reference.getValue().getId());
    }
}
