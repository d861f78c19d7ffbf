package com.ledgersync.store;

public record UserSnapshot(String email, String firstName, String lastName) {}
