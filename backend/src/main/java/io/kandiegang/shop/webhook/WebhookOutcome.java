package io.kandiegang.shop.webhook;

/** Terminal state of one webhook delivery. Every outcome is acknowledged with 200. */
public enum WebhookOutcome {
  IGNORED_EVENT_TYPE,
  NOT_MEMBERSHIP,
  DUPLICATE,
  PROFILE_NOT_FOUND,
  GRANTED
}
