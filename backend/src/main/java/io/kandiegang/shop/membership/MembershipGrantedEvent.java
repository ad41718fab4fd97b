package io.kandiegang.shop.membership;

import java.time.LocalDate;
import java.util.UUID;

/** Published inside the grant transaction; listeners act after it commits. */
public record MembershipGrantedEvent(
    UUID profileId, String recipientEmail, LocalDate memberSince, LocalDate expiration) {}
