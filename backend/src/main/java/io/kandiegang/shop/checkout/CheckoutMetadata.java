package io.kandiegang.shop.checkout;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Correlation data attached to a checkout session and read back from its completion webhook. Kept
 * typed inside the service and flattened to the gateway's string map only at the boundary.
 *
 * <p>Titles are joined with {@code |} because product titles may contain commas.
 */
public record CheckoutMetadata(
    List<String> productIds,
    List<String> productTitles,
    List<String> productSlugs,
    String userId,
    String shippingOption) {

  public static final String GUEST = "guest";

  static final String PRODUCT_IDS = "productIds";
  static final String PRODUCT_TITLES = "productTitles";
  static final String PRODUCT_SLUGS = "productSlugs";
  static final String USER_ID = "userId";
  static final String SHIPPING_OPTION = "shippingOption";

  public CheckoutMetadata {
    productIds = List.copyOf(productIds);
    productTitles = List.copyOf(productTitles);
    productSlugs = List.copyOf(productSlugs);
    userId = (userId == null || userId.isBlank()) ? GUEST : userId.trim();
  }

  public static CheckoutMetadata of(Basket basket, String userId, ShippingOption shippingOption) {
    return new CheckoutMetadata(
        basket.items().stream().map(LineItem::productId).toList(),
        basket.items().stream().map(LineItem::productTitle).toList(),
        basket.items().stream().map(LineItem::productSlug).toList(),
        userId,
        shippingOption != null ? shippingOption.wireValue() : null);
  }

  /** Parses gateway metadata back. Missing keys read as empty lists and a guest buyer. */
  public static CheckoutMetadata fromMap(Map<String, String> metadata) {
    return new CheckoutMetadata(
        split(metadata.get(PRODUCT_IDS), ","),
        split(metadata.get(PRODUCT_TITLES), "\\|"),
        split(metadata.get(PRODUCT_SLUGS), ","),
        metadata.get(USER_ID),
        metadata.get(SHIPPING_OPTION));
  }

  public Map<String, String> toMap() {
    var map = new LinkedHashMap<String, String>();
    map.put(PRODUCT_IDS, String.join(",", productIds));
    map.put(PRODUCT_TITLES, String.join("|", productTitles));
    map.put(PRODUCT_SLUGS, String.join(",", productSlugs));
    map.put(USER_ID, userId);
    if (shippingOption != null) {
      map.put(SHIPPING_OPTION, shippingOption);
    }
    return map;
  }

  public boolean containsSlug(String slug) {
    return productSlugs.contains(slug);
  }

  /** The buyer's profile id, when the checkout was made signed in with a well-formed id. */
  public Optional<UUID> userUuid() {
    if (GUEST.equals(userId)) {
      return Optional.empty();
    }
    try {
      return Optional.of(UUID.fromString(userId));
    } catch (IllegalArgumentException e) {
      return Optional.empty();
    }
  }

  private static List<String> split(String value, String separatorRegex) {
    if (value == null || value.isBlank()) {
      return List.of();
    }
    return Arrays.stream(value.split(separatorRegex))
        .map(String::trim)
        .filter(part -> !part.isEmpty())
        .toList();
  }
}
