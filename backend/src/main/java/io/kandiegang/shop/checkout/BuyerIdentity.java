package io.kandiegang.shop.checkout;

/** Optional signed-in buyer. Both fields may be null for a guest checkout. */
public record BuyerIdentity(String userId, String email) {

  public static BuyerIdentity guest() {
    return new BuyerIdentity(null, null);
  }
}
