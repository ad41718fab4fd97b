package io.kandiegang.shop.payment;

/** Coarse classification of gateway failures, separating buyer input from operator mistakes. */
public enum PaymentErrorClass {
  /** The request was rejected as invalid, e.g. an unknown price reference. */
  INVALID_REQUEST,
  /** The gateway rejected our credentials. */
  AUTHENTICATION,
  /** Anything else: outages, rate limits, network failures. */
  PROVIDER
}
