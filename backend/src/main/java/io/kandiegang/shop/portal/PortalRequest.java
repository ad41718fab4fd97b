package io.kandiegang.shop.portal;

public record PortalRequest(String userId) {}
