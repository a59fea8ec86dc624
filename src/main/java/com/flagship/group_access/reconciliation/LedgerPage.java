package com.flagship.group_access.reconciliation;

import lombok.Value;

import java.util.List;

@Value
public class LedgerPage {
    List<ExternalTransaction> transactions;
    boolean hasMore;
}
