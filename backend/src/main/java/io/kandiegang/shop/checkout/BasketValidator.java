package io.kandiegang.shop.checkout;

import com.fasterxml.jackson.databind.JsonNode;
import io.kandiegang.shop.exception.InvalidRequestException;
import io.kandiegang.shop.payment.BillingMode;
import io.kandiegang.shop.payment.PaymentGateway;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Canonicalises the checkout request into a {@link Basket} and resolves its single {@link
 * BillingMode}. All structural checks run before the first gateway call.
 */
@Component
public class BasketValidator {

  private static final Logger log = LoggerFactory.getLogger(BasketValidator.class);

  static final String INVALID_LINE_ITEMS =
      "Invalid lineItems: each item must have priceId, quantity, productId, productTitle,"
          + " productSlug";
  static final String MISSING_ITEMS =
      "Either lineItems array or single priceId + productId + productTitle + productSlug is"
          + " required";
  static final String MIXED_MODES =
      "Basket cannot mix one-time payment and subscription items. Please checkout separately.";

  private final PaymentGateway paymentGateway;

  public BasketValidator(PaymentGateway paymentGateway) {
    this.paymentGateway = paymentGateway;
  }

  public Basket toBasket(CheckoutRequest request) {
    var lineItems = request.lineItems();
    if (lineItems != null && lineItems.isArray() && !lineItems.isEmpty()) {
      var items = new ArrayList<LineItem>(lineItems.size());
      for (JsonNode node : lineItems) {
        items.add(parseLineItem(node));
      }
      return new Basket(items);
    }
    if (isPresent(request.priceId())
        && isPresent(request.productId())
        && isPresent(request.productTitle())
        && isPresent(request.productSlug())) {
      return new Basket(
          List.of(
              new LineItem(
                  request.priceId(),
                  1,
                  request.productId(),
                  request.productTitle(),
                  request.productSlug())));
    }
    throw new InvalidRequestException(MISSING_ITEMS);
  }

  /**
   * One price lookup per distinct price reference. The first reference fixes the mode; any later
   * disagreement rejects the basket.
   */
  public BillingMode resolveMode(Basket basket) {
    BillingMode mode = null;
    for (var priceRef : basket.distinctPriceRefs()) {
      var itemMode = paymentGateway.resolveBillingMode(priceRef);
      if (mode == null) {
        mode = itemMode;
      } else if (mode != itemMode) {
        log.info("Rejected mixed basket: {} is {}, basket is {}", priceRef, itemMode, mode);
        throw new InvalidRequestException(MIXED_MODES);
      }
    }
    return mode;
  }

  private static LineItem parseLineItem(JsonNode node) {
    if (node == null || !node.isObject()) {
      throw new InvalidRequestException(INVALID_LINE_ITEMS);
    }
    var priceId = text(node, "priceId");
    var productId = text(node, "productId");
    var productTitle = text(node, "productTitle");
    var productSlug = text(node, "productSlug");
    var quantity = node.get("quantity");
    if (priceId == null
        || productId == null
        || productTitle == null
        || productSlug == null
        || quantity == null
        || !quantity.isNumber()
        || quantity.asDouble() < 1) {
      throw new InvalidRequestException(INVALID_LINE_ITEMS);
    }
    var floored = Math.max(1, (int) Math.min(Math.floor(quantity.asDouble()), Integer.MAX_VALUE));
    return new LineItem(priceId, floored, productId, productTitle, productSlug);
  }

  private static String text(JsonNode node, String field) {
    var value = node.get(field);
    if (value == null || !value.isTextual() || value.asText().isBlank()) {
      return null;
    }
    return value.asText();
  }

  private static boolean isPresent(String value) {
    return value != null && !value.isBlank();
  }
}
