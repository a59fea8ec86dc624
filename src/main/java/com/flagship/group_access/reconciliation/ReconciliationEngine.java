package com.flagship.group_access.reconciliation;

import com.flagship.group_access.config.MembershipProperties;
import com.flagship.group_access.observability.MembershipMetrics;
import com.flagship.group_access.payment.IngestionResult;
import com.flagship.group_access.payment.Payment;
import com.flagship.group_access.payment.PaymentIngestionService;
import com.flagship.group_access.payment.PaymentKind;
import com.flagship.group_access.payment.PaymentSource;
import com.flagship.group_access.user.UserProfile;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Repairs the payment store and subscription ledger from the platform's transaction ledger.
 *
 * Each run re-reads a window that starts a fixed margin before the stored cursor, because the
 * platform does not guarantee delivery order. Every incoming user payment in the window goes
 * through the normal ingestion path; duplicates are absorbed there, so re-reading is harmless.
 *
 * The cursor moves to the newest transaction seen, and only after every page was processed.
 * Any failure leaves it untouched and the next run covers the same window again.
 *
 * Ledger offsets are absolute, and the stored resume offset says where the next run starts.
 * A run cut short by the page limit resumes exactly where it stopped. A complete run rewinds
 * only to the first page that still overlaps the next window, so history older than the margin
 * is not read again and the newest entries are always reached.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReconciliationEngine {

    private final TransactionLedgerClient ledgerClient;
    private final PaymentIngestionService ingestionService;
    private final ReconciliationCursorService cursorService;
    private final MembershipProperties properties;
    private final MembershipMetrics metrics;
    private final Clock clock;

    public ReconciliationResult run() {
        return run(() -> { });
    }

    /**
     * @param heartbeat run before every page after the first; an exception from it fails the run
     */
    public ReconciliationResult run(Runnable heartbeat) {
        MembershipProperties.Reconciliation config = properties.getReconciliation();
        Instant now = clock.instant();
        Instant cursor = cursorService.currentPosition(now.minus(config.getInitialLookback()), now);
        Instant windowStart = cursor.minus(config.getLookbackMargin());
        int startOffset = cursorService.resumeOffset();

        log.info("Reconciliation started: cursor={}, windowStart={}, windowEnd={}, offset={}",
                cursor, windowStart, now, startOffset);

        int found = 0;
        int inserted = 0;
        int pages = 0;
        int offset = startOffset;
        boolean hasMore = true;
        Instant maxSeenAt = null;
        String maxSeenTxId = null;
        List<PageMark> marks = new ArrayList<>();

        try {
            while (hasMore && pages < config.getMaxPages()) {
                if (pages > 0) {
                    heartbeat.run();
                }
                LedgerPage page = ledgerClient.fetchPage(windowStart, offset, config.getPageSize());
                pages++;

                Instant pageNewest = null;
                for (ExternalTransaction tx : page.getTransactions()) {
                    if (pageNewest == null || tx.getOccurredAt().isAfter(pageNewest)) {
                        pageNewest = tx.getOccurredAt();
                    }
                    if (!tx.isIncomingUserPayment()
                            || tx.getOccurredAt().isBefore(windowStart)
                            || tx.getOccurredAt().isAfter(now)) {
                        continue;
                    }
                    found++;

                    IngestionResult result = ingestionService.ingest(UserProfile.idOnly(tx.getUserId()), toPayment(tx));
                    if (result.isInserted()) {
                        inserted++;
                        log.info("Reconciliation recovered missing payment: txId={}, userId={}, amount={}, at={}",
                                tx.getId(), tx.getUserId(), tx.getAmount(), tx.getOccurredAt());
                    }

                    if (maxSeenAt == null || tx.getOccurredAt().isAfter(maxSeenAt)) {
                        maxSeenAt = tx.getOccurredAt();
                        maxSeenTxId = tx.getId();
                    }
                }
                if (pageNewest != null) {
                    marks.add(new PageMark(offset, pageNewest));
                }

                offset += page.getTransactions().size();
                hasMore = page.isHasMore() && !page.getTransactions().isEmpty();
            }
        } catch (RuntimeException e) {
            log.error("Reconciliation failed, cursor not advanced: page={}, offset={}, found={}, inserted={}, error={}",
                    pages, offset, found, inserted, e.getMessage(), e);
            metrics.recordReconciliationRun(ReconciliationResult.Status.FAILED.name(), inserted);
            return ReconciliationResult.builder()
                .status(ReconciliationResult.Status.FAILED)
                .paymentsFound(found)
                .paymentsInserted(inserted)
                .pagesFetched(pages)
                .windowStart(windowStart)
                .windowEnd(now)
                .cursorAdvancedTo(cursor)
                .startOffset(startOffset)
                .nextOffset(startOffset)
                .error(e.getMessage())
                .build();
        }

        ReconciliationResult.Status status = ReconciliationResult.Status.COMPLETED;
        int nextOffset;
        if (hasMore) {
            status = ReconciliationResult.Status.TRUNCATED;
            nextOffset = offset;
            log.warn("Reconciliation stopped at page limit, next run resumes: maxPages={}, offset={}",
                    config.getMaxPages(), offset);
        } else {
            Instant nextWindowStart = latest(cursor, maxSeenAt).minus(config.getLookbackMargin());
            nextOffset = firstPageReaching(marks, nextWindowStart, offset);
        }

        Instant advancedTo = cursorService.advance(maxSeenAt, maxSeenTxId, nextOffset, clock.instant());
        metrics.recordReconciliationRun(status.name(), inserted);
        log.info("Reconciliation finished: status={}, pages={}, found={}, inserted={}, cursor={}, nextOffset={}",
                status, pages, found, inserted, advancedTo, nextOffset);

        return ReconciliationResult.builder()
            .status(status)
            .paymentsFound(found)
            .paymentsInserted(inserted)
            .pagesFetched(pages)
            .windowStart(windowStart)
            .windowEnd(now)
            .cursorAdvancedTo(advancedTo)
            .startOffset(startOffset)
            .nextOffset(nextOffset)
            .build();
    }

    /**
     * Offset of the first page still holding entries inside the next window, so the lookback
     * margin is re-read without paging through older history again. {@code endOffset} when no
     * page does.
     */
    private static int firstPageReaching(List<PageMark> marks, Instant nextWindowStart, int endOffset) {
        for (PageMark mark : marks) {
            if (!mark.getNewestAt().isBefore(nextWindowStart)) {
                return mark.getOffset();
            }
        }
        return endOffset;
    }

    private static Instant latest(Instant a, Instant b) {
        if (b == null) {
            return a;
        }
        return a.isAfter(b) ? a : b;
    }

    /**
     * Recurring entries are renewals whose new expiry is one renewal period after the charge.
     */
    private Payment toPayment(ExternalTransaction tx) {
        PaymentKind kind = tx.isRecurring() ? PaymentKind.RECURRING_RENEWAL : PaymentKind.ONE_TIME;
        Instant hint = tx.isRecurring()
            ? tx.getOccurredAt().plus(properties.getPlan().getRenewalPeriod())
            : null;
        return Payment.create(
            tx.getUserId(),
            tx.getChargeId(),
            tx.getId(),
            tx.getAmount(),
            properties.getPlan().getCurrency(),
            kind,
            tx.getOccurredAt(),
            hint,
            tx.getInvoicePayload(),
            PaymentSource.RECONCILIATION);
    }

    @Value
    private static class PageMark {
        int offset;
        Instant newestAt;
    }
}
