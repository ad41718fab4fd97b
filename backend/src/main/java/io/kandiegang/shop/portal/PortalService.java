package io.kandiegang.shop.portal;

import io.kandiegang.shop.exception.OperationFailedException;
import io.kandiegang.shop.exception.ResourceNotFoundException;
import io.kandiegang.shop.exception.UnauthorizedException;
import io.kandiegang.shop.membership.MemberProfileRepository;
import io.kandiegang.shop.payment.PaymentGateway;
import io.kandiegang.shop.payment.PaymentProviderException;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Opens a Stripe billing portal session for a member with a stored Stripe customer. */
@Service
public class PortalService {

  private static final Logger log = LoggerFactory.getLogger(PortalService.class);

  private final MemberProfileRepository profileRepository;
  private final PaymentGateway paymentGateway;

  public PortalService(MemberProfileRepository profileRepository, PaymentGateway paymentGateway) {
    this.profileRepository = profileRepository;
    this.paymentGateway = paymentGateway;
  }

  @Transactional(readOnly = true)
  public PortalResponse createPortalSession(String userId, String baseUrl) {
    if (userId == null || userId.isBlank()) {
      throw new UnauthorizedException("Unauthorized - userId required");
    }
    var profile =
        parseUuid(userId)
            .flatMap(profileRepository::findById)
            .orElseThrow(() -> new ResourceNotFoundException("Profile", "Profile not found"));
    if (!profile.hasStripeCustomer()) {
      log.warn("No Stripe customer stored for profile {}", profile.getId());
      throw new ResourceNotFoundException(
          "Stripe customer", "No Stripe customer found. Please contact support.");
    }

    try {
      var url =
          paymentGateway.createPortalSession(profile.getStripeCustomerId(), baseUrl + "/members");
      log.info("Created billing portal session for profile {}", profile.getId());
      return new PortalResponse(url);
    } catch (PaymentProviderException e) {
      throw new OperationFailedException("Failed to create portal session", e);
    }
  }

  private static Optional<UUID> parseUuid(String value) {
    try {
      return Optional.of(UUID.fromString(value.trim()));
    } catch (IllegalArgumentException e) {
      return Optional.empty();
    }
  }
}
