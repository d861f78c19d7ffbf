package com.ledgersync.dto;

import com.ledgersync.model.PaymentMethodType;

public record PaymentMethodResponse(String id, String name, PaymentMethodType type, boolean active) {}
