package io.kandiegang.shop.payment;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Gateway-facing line item. Either references a catalog price ({@link #ofPrice}) or carries an
 * ad-hoc name and amount ({@link #adHoc}), as used for the shipping line.
 */
public record SessionLineItem(
    String priceRef, long quantity, String name, BigDecimal unitAmount, String currency) {

  public static SessionLineItem ofPrice(String priceRef, long quantity) {
    Objects.requireNonNull(priceRef, "priceRef");
    return new SessionLineItem(priceRef, quantity, null, null, null);
  }

  public static SessionLineItem adHoc(String name, BigDecimal unitAmount, String currency) {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(unitAmount, "unitAmount");
    Objects.requireNonNull(currency, "currency");
    return new SessionLineItem(null, 1L, name, unitAmount, currency);
  }

  public boolean isAdHoc() {
    return priceRef == null;
  }
}
