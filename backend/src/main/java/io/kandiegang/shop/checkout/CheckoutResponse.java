package io.kandiegang.shop.checkout;

public record CheckoutResponse(String sessionId, String url) {}
