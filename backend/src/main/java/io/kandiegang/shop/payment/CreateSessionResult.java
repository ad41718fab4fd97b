package io.kandiegang.shop.payment;

/** Result of a {@link PaymentGateway#createCheckoutSession(CheckoutSessionRequest)} call. */
public record CreateSessionResult(String sessionId, String redirectUrl) {}
