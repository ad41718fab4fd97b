package io.kandiegang.shop.checkout;

import io.kandiegang.shop.membership.MembershipProperties;
import io.kandiegang.shop.payment.BillingMode;
import io.kandiegang.shop.payment.CheckoutSessionRequest;
import io.kandiegang.shop.payment.SessionLineItem;
import java.util.ArrayList;
import org.springframework.stereotype.Component;

/** Assembles the gateway-facing session request from a validated basket. */
@Component
public class CheckoutSessionBuilder {

  static final String FREE_SUFFIX = " – Free";

  private final ShippingCalculator shippingCalculator;
  private final MembershipProperties membershipProperties;

  public CheckoutSessionBuilder(
      ShippingCalculator shippingCalculator, MembershipProperties membershipProperties) {
    this.shippingCalculator = shippingCalculator;
    this.membershipProperties = membershipProperties;
  }

  /**
   * @param shipping null when the storefront sent no subtotal; no shipping line is added then
   * @param option the shipping option recorded in metadata, even when {@code shipping} is null
   */
  public CheckoutSessionRequest build(
      Basket basket,
      BillingMode mode,
      ShippingOption option,
      ShippingSelection shipping,
      BuyerIdentity buyer,
      String baseUrl) {
    var lineItems = new ArrayList<SessionLineItem>(basket.items().size() + 1);
    for (var item : basket.items()) {
      lineItems.add(SessionLineItem.ofPrice(item.priceRef(), item.quantity()));
    }

    if (shipping != null) {
      var digitalOnly = basket.isDigitalOnly(membershipProperties.productSlug());
      var amount =
          shippingCalculator.shippingCost(shipping.option(), shipping.subtotal(), digitalOnly);
      var label = shipping.option().label() + (amount.signum() == 0 ? FREE_SUFFIX : "");
      lineItems.add(SessionLineItem.adHoc(label, amount, shippingCalculator.currency()));
    }

    var metadata = CheckoutMetadata.of(basket, buyer.userId(), option);
    return new CheckoutSessionRequest(
        lineItems,
        mode,
        baseUrl + "/checkout/success?session_id={CHECKOUT_SESSION_ID}",
        baseUrl + "/shop",
        buyer.email(),
        metadata.toMap(),
        true);
  }
}
