package com.ledgersync.store;

public record EventSnapshot(
    String legacyId,
    String description,
    String category,
    boolean duplicate,
    int lineItemCount,
    int tagCount) {}
