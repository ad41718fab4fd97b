package io.kandiegang.shop.checkout;

import java.util.Locale;
import java.util.Optional;

public enum ShippingOption {
  DOMESTIC("domestic", "Shipping (Standard – Germany)"),
  REGIONAL("regional", "Shipping (Standard – EU)"),
  PICKUP("pickup", "Shipping (Local pickup)");

  private final String wireValue;
  private final String label;

  ShippingOption(String wireValue, String label) {
    this.wireValue = wireValue;
    this.label = label;
  }

  public String wireValue() {
    return wireValue;
  }

  /** Buyer-facing label of the synthetic shipping line. */
  public String label() {
    return label;
  }

  /**
   * Parses a request value. Accepts the current names and the storefront's older {@code de} /
   * {@code eu} codes. Empty for anything else.
   */
  public static Optional<ShippingOption> fromValue(String value) {
    if (value == null) {
      return Optional.empty();
    }
    return switch (value.trim().toLowerCase(Locale.ROOT)) {
      case "domestic", "de" -> Optional.of(DOMESTIC);
      case "regional", "eu" -> Optional.of(REGIONAL);
      case "pickup" -> Optional.of(PICKUP);
      default -> Optional.empty();
    };
  }
}
