package io.kandiegang.shop.checkout;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/** Canonical, non-empty basket. Built once at the request boundary from either input shape. */
public record Basket(List<LineItem> items) {

  public Basket {
    if (items == null || items.isEmpty()) {
      throw new IllegalArgumentException("basket must contain at least one line item");
    }
    items = List.copyOf(items);
  }

  /** Distinct price references in first-seen order. */
  public Set<String> distinctPriceRefs() {
    var refs = new LinkedHashSet<String>();
    items.forEach(item -> refs.add(item.priceRef()));
    return refs;
  }

  /** True when every line is the given (digital) product, e.g. a membership-only basket. */
  public boolean isDigitalOnly(String digitalProductSlug) {
    return items.stream().allMatch(item -> item.productSlug().equals(digitalProductSlug));
  }
}
