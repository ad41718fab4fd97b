package io.kandiegang.shop.portal;

public record PortalResponse(String url) {}
