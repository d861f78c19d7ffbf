package com.ledgersync.dto;

import com.ledgersync.model.TransactionSource;

public record SyncResult(
    TransactionSource source,
    int received,
    int filtered,
    int rejected,
    int transactionsWritten,
    int lineItemsWritten) {}
