package io.kandiegang.shop.membership;

import java.util.UUID;

/**
 * Who to grant membership to. The profile is looked up by {@code profileId} first and by
 * case-insensitive {@code payerEmail} otherwise.
 */
public record GrantRequest(UUID profileId, String payerEmail, String customerRef) {}
