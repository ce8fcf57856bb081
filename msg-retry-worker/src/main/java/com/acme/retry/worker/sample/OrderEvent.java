package com.acme.retry.worker.sample;

import java.math.BigDecimal;

public record OrderEvent(String orderId, String customerId, BigDecimal amount, String mode) {}
