package com.flagship.group_access.reconciliation;

import com.flagship.group_access.config.MembershipProperties;
import com.flagship.group_access.observability.MembershipMetrics;
import com.flagship.group_access.payment.IngestionResult;
import com.flagship.group_access.payment.Payment;
import com.flagship.group_access.payment.PaymentIngestionService;
import com.flagship.group_access.payment.PaymentKind;
import com.flagship.group_access.payment.PaymentSource;
import com.flagship.group_access.payment.RecordResult;
import com.flagship.group_access.user.UserProfile;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class ReconciliationEngineTest {

    private static final Instant NOW = Instant.parse("2025-03-10T00:00:00Z");
    private static final Instant CURSOR = Instant.parse("2025-03-09T00:00:00Z");

    @Mock
    private TransactionLedgerClient ledgerClient;
    @Mock
    private PaymentIngestionService ingestionService;
    @Mock
    private ReconciliationCursorService cursorService;
    @Mock
    private MembershipMetrics metrics;

    private MembershipProperties properties;
    private ReconciliationEngine engine;

    @BeforeEach
    void setUp() {
        properties = new MembershipProperties();
        properties.getReconciliation().setPageSize(2);
        engine = new ReconciliationEngine(ledgerClient, ingestionService, cursorService, properties, metrics,
                Clock.fixed(NOW, ZoneOffset.UTC));

        when(cursorService.currentPosition(any(), any())).thenReturn(CURSOR);
        when(cursorService.advance(any(), any(), anyInt(), any())).thenAnswer(inv ->
            inv.getArgument(0) != null ? inv.getArgument(0) : CURSOR);
        when(ingestionService.ingest(any(), any())).thenAnswer(inv ->
            new IngestionResult(RecordResult.Outcome.INSERTED, inv.getArgument(1), null));
    }

    private static ExternalTransaction incoming(String id, long userId, Instant at, boolean recurring) {
        return new ExternalTransaction(id, id, userId, 250, at, recurring, "plan-30d");
    }

    @Test
    @DisplayName("Missing payments are ingested and the cursor moves to the newest one")
    void ingestsAndAdvances() {
        Instant t1 = NOW.minus(Duration.ofHours(5));
        Instant t2 = NOW.minus(Duration.ofHours(1));
        when(ledgerClient.fetchPage(any(), eq(0), eq(2)))
            .thenReturn(new LedgerPage(List.of(incoming("tx-1", 11L, t1, false), incoming("tx-2", 12L, t2, true)), true));
        when(ledgerClient.fetchPage(any(), eq(2), eq(2)))
            .thenReturn(new LedgerPage(List.of(), false));

        ReconciliationResult result = engine.run();

        assertEquals(ReconciliationResult.Status.COMPLETED, result.getStatus());
        assertEquals(2, result.getPaymentsFound());
        assertEquals(2, result.getPaymentsInserted());
        assertEquals(t2, result.getCursorAdvancedTo());
        assertEquals(CURSOR.minus(Duration.ofHours(72)), result.getWindowStart());
        verify(cursorService).advance(eq(t2), eq("tx-2"), eq(0), any());
    }

    @Test
    @DisplayName("Recovered payments go through ingestion as reconciliation payments")
    void mapsTransactions() {
        Instant t = NOW.minus(Duration.ofHours(2));
        when(ledgerClient.fetchPage(any(), anyInt(), anyInt()))
            .thenReturn(new LedgerPage(List.of(incoming("tx-9", 99L, t, true)), false));

        engine.run();

        ArgumentCaptor<UserProfile> profile = ArgumentCaptor.forClass(UserProfile.class);
        ArgumentCaptor<Payment> payment = ArgumentCaptor.forClass(Payment.class);
        verify(ingestionService).ingest(profile.capture(), payment.capture());

        assertEquals(99L, profile.getValue().getUserId());
        Payment p = payment.getValue();
        assertEquals("tx-9", p.getChargeId());
        assertEquals("tx-9", p.getExternalTxId());
        assertEquals(PaymentKind.RECURRING_RENEWAL, p.getKind());
        assertEquals(PaymentSource.RECONCILIATION, p.getSource());
        assertEquals(t.plus(Duration.ofDays(30)), p.getSubscriptionExpirationHint());
        assertEquals("XTR", p.getCurrency());
    }

    @Test
    @DisplayName("Outgoing entries and entries outside the window are skipped")
    void skipsIrrelevantEntries() {
        ExternalTransaction withdrawal = new ExternalTransaction("w-1", null, null, 500, NOW.minusSeconds(60), false, null);
        ExternalTransaction tooOld = incoming("old", 5L, CURSOR.minus(Duration.ofDays(10)), false);
        when(ledgerClient.fetchPage(any(), anyInt(), anyInt()))
            .thenReturn(new LedgerPage(List.of(withdrawal, tooOld), false));

        ReconciliationResult result = engine.run();

        assertEquals(0, result.getPaymentsFound());
        verify(ingestionService, never()).ingest(any(), any());
    }

    @Test
    @DisplayName("Duplicates already recorded by the live path are not counted as inserted")
    void duplicatesConverge() {
        when(ledgerClient.fetchPage(any(), anyInt(), anyInt()))
            .thenReturn(new LedgerPage(List.of(incoming("tx-1", 11L, NOW.minusSeconds(600), false)), false));
        when(ingestionService.ingest(any(), any())).thenAnswer(inv ->
            new IngestionResult(RecordResult.Outcome.ALREADY_EXISTS, inv.getArgument(1), null));

        ReconciliationResult result = engine.run();

        assertEquals(1, result.getPaymentsFound());
        assertEquals(0, result.getPaymentsInserted());
        assertEquals(ReconciliationResult.Status.COMPLETED, result.getStatus());
    }

    @Test
    @DisplayName("A failed page leaves the cursor untouched")
    void fetchFailureKeepsCursor() {
        when(ledgerClient.fetchPage(any(), eq(0), anyInt()))
            .thenReturn(new LedgerPage(List.of(incoming("tx-1", 11L, NOW.minusSeconds(600), false),
                    incoming("tx-2", 12L, NOW.minusSeconds(300), false)), true));
        when(ledgerClient.fetchPage(any(), eq(2), anyInt()))
            .thenThrow(new LedgerFetchException("getStarTransactions failed at offset 2", null));

        ReconciliationResult result = engine.run();

        assertEquals(ReconciliationResult.Status.FAILED, result.getStatus());
        assertEquals(CURSOR, result.getCursorAdvancedTo());
        assertNotNull(result.getError());
        verify(cursorService, never()).advance(any(), any(), anyInt(), any());
        verify(metrics).recordReconciliationRun("FAILED", 2);
    }

    @Test
    @DisplayName("A failed ingestion aborts the run without moving the cursor")
    void ingestionFailureKeepsCursor() {
        when(ledgerClient.fetchPage(any(), anyInt(), anyInt()))
            .thenReturn(new LedgerPage(List.of(incoming("tx-1", 11L, NOW.minusSeconds(600), false)), false));
        when(ingestionService.ingest(any(), any())).thenThrow(new IllegalStateException("db down"));

        ReconciliationResult result = engine.run();

        assertEquals(ReconciliationResult.Status.FAILED, result.getStatus());
        verify(cursorService, never()).advance(any(), anyString(), anyInt(), any());
    }

    @Test
    @DisplayName("The page limit truncates the run but still advances to what was read")
    void truncatesAtPageLimit() {
        properties.getReconciliation().setMaxPages(1);
        Instant t = NOW.minusSeconds(600);
        when(ledgerClient.fetchPage(any(), eq(0), anyInt()))
            .thenReturn(new LedgerPage(List.of(incoming("tx-1", 11L, t, false), incoming("tx-2", 12L, t.minusSeconds(1), false)), true));

        ReconciliationResult result = engine.run();

        assertEquals(ReconciliationResult.Status.TRUNCATED, result.getStatus());
        assertEquals(1, result.getPagesFetched());
        verify(ledgerClient, times(1)).fetchPage(any(), anyInt(), anyInt());
        assertEquals(2, result.getNextOffset());
        verify(cursorService).advance(eq(t), eq("tx-1"), eq(2), any());
    }

    @Test
    @DisplayName("An empty ledger completes and keeps the cursor")
    void emptyLedger() {
        when(ledgerClient.fetchPage(any(), anyInt(), anyInt())).thenReturn(new LedgerPage(List.of(), false));

        ReconciliationResult result = engine.run();

        assertEquals(ReconciliationResult.Status.COMPLETED, result.getStatus());
        assertEquals(CURSOR, result.getCursorAdvancedTo());
        verify(cursorService).advance(eq(null), eq(null), eq(0), any());
    }

    @Test
    @DisplayName("A complete run skips pages that fall entirely before the next window")
    void completeRunSkipsOldPages() {
        Instant old = CURSOR.minus(Duration.ofDays(100));
        Instant recent = NOW.minus(Duration.ofHours(1));
        when(ledgerClient.fetchPage(any(), eq(0), anyInt()))
            .thenReturn(new LedgerPage(List.of(incoming("old-1", 5L, old, false), incoming("old-2", 6L, old, false)), true));
        when(ledgerClient.fetchPage(any(), eq(2), anyInt()))
            .thenReturn(new LedgerPage(List.of(incoming("tx-3", 7L, recent, false)), false));

        ReconciliationResult result = engine.run();

        assertEquals(ReconciliationResult.Status.COMPLETED, result.getStatus());
        assertEquals(0, result.getStartOffset());
        assertEquals(2, result.getNextOffset());
        verify(cursorService).advance(eq(recent), eq("tx-3"), eq(2), any());
    }

    @Test
    @DisplayName("A run starts at the stored resume offset")
    void startsAtResumeOffset() {
        when(cursorService.resumeOffset()).thenReturn(4);
        when(ledgerClient.fetchPage(any(), eq(4), anyInt()))
            .thenReturn(new LedgerPage(List.of(incoming("tx-5", 11L, NOW.minusSeconds(60), false)), false));

        ReconciliationResult result = engine.run();

        assertEquals(4, result.getStartOffset());
        assertEquals(1, result.getPaymentsInserted());
        verify(ledgerClient, never()).fetchPage(any(), eq(0), anyInt());
    }

    @Test
    @DisplayName("A failed run keeps the resume offset")
    void failureKeepsResumeOffset() {
        when(cursorService.resumeOffset()).thenReturn(4);
        when(ledgerClient.fetchPage(any(), eq(4), anyInt()))
            .thenThrow(new LedgerFetchException("getStarTransactions failed at offset 4", null));

        ReconciliationResult result = engine.run();

        assertEquals(ReconciliationResult.Status.FAILED, result.getStatus());
        assertEquals(4, result.getNextOffset());
        verify(cursorService, never()).advance(any(), any(), anyInt(), any());
    }

    @Test
    @DisplayName("History longer than one run's page budget is caught up over later runs")
    void longHistoryConverges() {
        properties.getReconciliation().setMaxPages(2);
        List<ExternalTransaction> history = new ArrayList<>();
        for (int i = 1; i <= 6; i++) {
            history.add(incoming("tx-" + i, 10L + i, NOW.minus(Duration.ofHours(7 - i)), false));
        }
        when(ledgerClient.fetchPage(any(), anyInt(), anyInt())).thenAnswer(inv -> {
            int offset = inv.getArgument(1);
            int limit = inv.getArgument(2);
            List<ExternalTransaction> page = history.subList(Math.min(offset, history.size()),
                    Math.min(offset + limit, history.size()));
            return new LedgerPage(new ArrayList<>(page), page.size() == limit);
        });
        AtomicInteger storedOffset = new AtomicInteger();
        when(cursorService.resumeOffset()).thenAnswer(inv -> storedOffset.get());
        when(cursorService.advance(any(), any(), anyInt(), any())).thenAnswer(inv -> {
            storedOffset.set(Math.max(storedOffset.get(), inv.<Integer>getArgument(2)));
            return inv.getArgument(0) != null ? inv.getArgument(0) : CURSOR;
        });

        List<ReconciliationResult> results = new ArrayList<>();
        for (int run = 0; run < 5; run++) {
            results.add(engine.run());
        }

        assertEquals(ReconciliationResult.Status.TRUNCATED, results.get(0).getStatus());
        assertEquals(ReconciliationResult.Status.COMPLETED, results.get(1).getStatus());
        assertEquals(ReconciliationResult.Status.COMPLETED, results.get(4).getStatus());

        ArgumentCaptor<Payment> payments = ArgumentCaptor.forClass(Payment.class);
        verify(ingestionService, atLeastOnce()).ingest(any(), payments.capture());
        assertTrue(payments.getAllValues().stream().anyMatch(p -> "tx-6".equals(p.getExternalTxId())));
        verify(ledgerClient, times(1)).fetchPage(any(), eq(0), anyInt());
    }

    @Test
    @DisplayName("A failing heartbeat stops paging and fails the run")
    void heartbeatFailureAborts() {
        when(ledgerClient.fetchPage(any(), eq(0), anyInt()))
            .thenReturn(new LedgerPage(List.of(incoming("tx-1", 11L, NOW.minusSeconds(600), false),
                    incoming("tx-2", 12L, NOW.minusSeconds(300), false)), true));
        AtomicInteger beats = new AtomicInteger();

        ReconciliationResult result = engine.run(() -> {
            beats.incrementAndGet();
            throw new IllegalStateException("lease lost");
        });

        assertEquals(ReconciliationResult.Status.FAILED, result.getStatus());
        assertEquals("lease lost", result.getError());
        assertEquals(1, beats.get());
        verify(ledgerClient, never()).fetchPage(any(), eq(2), anyInt());
        verify(cursorService, never()).advance(any(), any(), anyInt(), any());
    }
}
