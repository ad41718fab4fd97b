package io.kandiegang.shop.checkout;

import io.kandiegang.shop.config.SiteUrlResolver;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/checkout")
public class CheckoutController {

  private final CheckoutService checkoutService;
  private final SiteUrlResolver siteUrlResolver;

  public CheckoutController(CheckoutService checkoutService, SiteUrlResolver siteUrlResolver) {
    this.checkoutService = checkoutService;
    this.siteUrlResolver = siteUrlResolver;
  }

  @PostMapping("/session")
  public ResponseEntity<CheckoutResponse> createSession(
      @RequestBody CheckoutRequest request, HttpServletRequest httpRequest) {
    return ResponseEntity.ok(
        checkoutService.createSession(request, siteUrlResolver.resolve(httpRequest)));
  }
}
