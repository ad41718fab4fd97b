package io.kandiegang.shop.portal;

import io.kandiegang.shop.config.SiteUrlResolver;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/billing")
public class PortalController {

  private final PortalService portalService;
  private final SiteUrlResolver siteUrlResolver;

  public PortalController(PortalService portalService, SiteUrlResolver siteUrlResolver) {
    this.portalService = portalService;
    this.siteUrlResolver = siteUrlResolver;
  }

  @PostMapping("/portal")
  public ResponseEntity<PortalResponse> createPortalSession(
      @RequestBody(required = false) PortalRequest request, HttpServletRequest httpRequest) {
    var userId = request != null ? request.userId() : null;
    return ResponseEntity.ok(
        portalService.createPortalSession(userId, siteUrlResolver.resolve(httpRequest)));
  }
}
