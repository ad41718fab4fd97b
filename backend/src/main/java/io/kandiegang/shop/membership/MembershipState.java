package io.kandiegang.shop.membership;

import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/** Membership columns of a profile as a value. {@code plans} is an insertion-ordered set. */
public record MembershipState(
    boolean member, Set<String> plans, LocalDate memberSince, LocalDate expiration) {

  public MembershipState {
    plans = Collections.unmodifiableSet(new LinkedHashSet<>(plans == null ? Set.of() : plans));
  }

  public static MembershipState none() {
    return new MembershipState(false, Set.of(), null, null);
  }
}
