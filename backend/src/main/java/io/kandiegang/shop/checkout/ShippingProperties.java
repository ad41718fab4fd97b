package io.kandiegang.shop.checkout;

import java.math.BigDecimal;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

@ConfigurationProperties(prefix = "shop.shipping")
public record ShippingProperties(
    @DefaultValue("eur") String currency,
    @DefaultValue("99.00") BigDecimal freeShippingThreshold,
    @DefaultValue("5.90") BigDecimal domesticRate,
    @DefaultValue("9.90") BigDecimal regionalRate) {}
