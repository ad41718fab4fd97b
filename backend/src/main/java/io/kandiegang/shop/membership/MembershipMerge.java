package io.kandiegang.shop.membership;

import java.time.LocalDate;
import java.time.Period;
import java.util.LinkedHashSet;

/**
 * Grant merge. Plans are unioned and the expiration only moves forward, so applying the same
 * grant twice yields the same state as applying it once.
 */
public final class MembershipMerge {

  private MembershipMerge() {}

  public static MembershipState grant(
      MembershipState current, String planName, LocalDate today, Period term) {
    var plans = new LinkedHashSet<>(current.plans());
    plans.add(planName);

    var termEnd = today.plus(term);
    var expiration =
        current.expiration() != null && current.expiration().isAfter(termEnd)
            ? current.expiration()
            : termEnd;

    var memberSince =
        current.member() && current.memberSince() != null ? current.memberSince() : today;

    return new MembershipState(true, plans, memberSince, expiration);
  }
}
