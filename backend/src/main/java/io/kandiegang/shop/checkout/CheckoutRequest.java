package io.kandiegang.shop.checkout;

import com.fasterxml.jackson.databind.JsonNode;
import java.math.BigDecimal;

/**
 * Request body of {@code POST /api/checkout/session}. Either {@code lineItems} (array) or the
 * legacy single-product fields are sent; {@link BasketValidator} resolves the two shapes into one
 * {@link Basket}. {@code lineItems} stays untyped so structural errors surface as the checkout's
 * own 400 instead of a generic parse failure.
 */
public record CheckoutRequest(
    JsonNode lineItems,
    String priceId,
    String productId,
    String productTitle,
    String productSlug,
    String userId,
    String userEmail,
    String shippingOption,
    BigDecimal subtotal) {}
