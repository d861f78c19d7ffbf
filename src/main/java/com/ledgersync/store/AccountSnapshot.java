package com.ledgersync.store;

public record AccountSnapshot(String source, String displayName) {}
