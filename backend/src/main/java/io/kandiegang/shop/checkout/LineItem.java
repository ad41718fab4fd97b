package io.kandiegang.shop.checkout;

import java.util.Objects;

/**
 * One validated basket line. {@code priceRef} is the payment gateway's price identifier; the
 * product fields only travel as checkout metadata.
 */
public record LineItem(
    String priceRef, int quantity, String productId, String productTitle, String productSlug) {

  public LineItem {
    Objects.requireNonNull(priceRef, "priceRef");
    Objects.requireNonNull(productId, "productId");
    Objects.requireNonNull(productTitle, "productTitle");
    Objects.requireNonNull(productSlug, "productSlug");
    if (quantity < 1) {
      throw new IllegalArgumentException("quantity must be at least 1, was " + quantity);
    }
  }
}
