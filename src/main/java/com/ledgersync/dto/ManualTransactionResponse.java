package com.ledgersync.dto;

public record ManualTransactionResponse(String transactionId, LineItemResponse lineItem) {}
