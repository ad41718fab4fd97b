package io.kandiegang.shop.payment;

/** How a price is charged. A checkout session supports exactly one mode. */
public enum BillingMode {
  /** Single charge at checkout. */
  ONE_TIME,
  /** Recurring subscription charge. */
  RECURRING
}
