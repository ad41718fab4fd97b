package io.kandiegang.shop.email;

/** Outcome of a single send. {@code messageId} is the provider's id on success. */
public record SendResult(boolean success, String messageId, String errorMessage) {}
