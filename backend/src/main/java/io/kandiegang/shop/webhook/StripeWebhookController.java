package io.kandiegang.shop.webhook;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Stripe webhook endpoint. The body is taken as raw bytes so the signature is checked against
 * exactly what Stripe sent.
 */
@RestController
@RequestMapping("/api/webhooks")
public class StripeWebhookController {

  private final MembershipWebhookService webhookService;

  public StripeWebhookController(MembershipWebhookService webhookService) {
    this.webhookService = webhookService;
  }

  @PostMapping("/stripe")
  public ResponseEntity<Map<String, Boolean>> handle(
      @RequestBody(required = false) byte[] body,
      @RequestHeader(value = "Stripe-Signature", required = false) String signature) {
    var payload = body != null ? new String(body, StandardCharsets.UTF_8) : "";
    webhookService.handle(payload, signature);
    return ResponseEntity.ok(Map.of("received", true));
  }
}
