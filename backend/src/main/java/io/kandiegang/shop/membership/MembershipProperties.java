package io.kandiegang.shop.membership;

import java.time.Period;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * The membership product. {@code productSlug} identifies it in a basket and in completed-checkout
 * metadata; {@code planName} is the plan recorded on the profile.
 */
@ConfigurationProperties(prefix = "shop.membership")
public record MembershipProperties(
    @DefaultValue("kandie-gang-cycling-club-membership") String productSlug,
    @DefaultValue("Kandie Gang Cycling Club Membership") String planName,
    @DefaultValue("supabase") String source,
    @DefaultValue("P1Y") Period term) {}
