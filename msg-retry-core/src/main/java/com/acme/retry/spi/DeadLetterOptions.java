package com.acme.retry.spi;

public record DeadLetterOptions(String deadLetterReason, String deadLetterErrorDescription) {}
