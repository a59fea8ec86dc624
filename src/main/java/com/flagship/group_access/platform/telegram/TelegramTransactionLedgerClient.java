package com.flagship.group_access.platform.telegram;

import com.fasterxml.jackson.databind.JsonNode;
import com.flagship.group_access.access.PlatformCallException;
import com.flagship.group_access.reconciliation.ExternalTransaction;
import com.flagship.group_access.reconciliation.LedgerFetchException;
import com.flagship.group_access.reconciliation.LedgerPage;
import com.flagship.group_access.reconciliation.TransactionLedgerClient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reads the bot's Star transaction history through {@code getStarTransactions}.
 *
 * The Bot API cannot filter by time, so {@code since} is ignored here and the whole history is
 * paged in chronological order. For an incoming payment the Star transaction id is the same
 * value the live payment event reports as its charge id, so it is carried as both keys.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TelegramTransactionLedgerClient implements TransactionLedgerClient {

    private final TelegramBotApiClient botApi;

    @Override
    public LedgerPage fetchPage(Instant since, int offset, int limit) {
        JsonNode result;
        try {
            result = botApi.call("getStarTransactions", Map.of("offset", offset, "limit", limit));
        } catch (PlatformCallException e) {
            throw new LedgerFetchException("getStarTransactions failed at offset " + offset, e);
        }

        List<ExternalTransaction> transactions = new ArrayList<>();
        for (JsonNode tx : result.path("transactions")) {
            transactions.add(toTransaction(tx));
        }
        log.debug("Fetched star transactions: offset={}, count={}", offset, transactions.size());
        return new LedgerPage(transactions, transactions.size() == limit);
    }

    static ExternalTransaction toTransaction(JsonNode tx) {
        String id = tx.path("id").asText();
        JsonNode source = tx.path("source");
        Long userId = null;
        boolean recurring = false;
        String payload = null;

        // Incoming payments have a user source; outgoing entries have a receiver instead.
        if ("user".equals(source.path("type").asText()) && source.path("user").hasNonNull("id")) {
            userId = source.path("user").path("id").asLong();
            recurring = source.hasNonNull("subscription_period");
            payload = source.path("invoice_payload").asText(null);
        }

        return new ExternalTransaction(
            id,
            userId != null ? id : null,
            userId,
            tx.path("amount").asLong(),
            Instant.ofEpochSecond(tx.path("date").asLong()),
            recurring,
            payload);
    }
}
