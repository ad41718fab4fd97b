package io.kandiegang.shop.checkout;

import java.math.BigDecimal;
import org.springframework.stereotype.Component;

/**
 * Flat-rate shipping. Rules apply in order: digital-only baskets ship free, pickup is free, orders
 * at or above the free-shipping threshold are free, otherwise the regional flat rate applies. A
 * zero subtotal has nothing to ship and costs nothing.
 */
@Component
public class ShippingCalculator {

  private final ShippingProperties properties;

  public ShippingCalculator(ShippingProperties properties) {
    this.properties = properties;
  }

  public BigDecimal shippingCost(ShippingOption option, BigDecimal subtotal, boolean digitalOnly) {
    if (digitalOnly || option == ShippingOption.PICKUP) {
      return BigDecimal.ZERO;
    }
    if (subtotal == null || subtotal.signum() <= 0) {
      return BigDecimal.ZERO;
    }
    if (subtotal.compareTo(properties.freeShippingThreshold()) >= 0) {
      return BigDecimal.ZERO;
    }
    return option == ShippingOption.REGIONAL
        ? properties.regionalRate()
        : properties.domesticRate();
  }

  public String currency() {
    return properties.currency();
  }
}
