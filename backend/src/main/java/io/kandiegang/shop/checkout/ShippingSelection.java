package io.kandiegang.shop.checkout;

import java.math.BigDecimal;
import java.util.Objects;

/** Buyer's shipping choice plus the basket subtotal the cost is computed from. */
public record ShippingSelection(ShippingOption option, BigDecimal subtotal) {

  public ShippingSelection {
    Objects.requireNonNull(option, "option");
    Objects.requireNonNull(subtotal, "subtotal");
    if (subtotal.signum() < 0) {
      throw new IllegalArgumentException("subtotal must not be negative");
    }
  }
}
