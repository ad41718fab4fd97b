package io.kandiegang.shop.membership;

import io.kandiegang.shop.exception.OperationFailedException;
import java.time.Clock;
import java.time.LocalDate;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Applies a membership grant to a profile. Each attempt is a fresh read-merge-write transaction;
 * a concurrent update detected by the version column triggers another attempt.
 */
@Service
public class MembershipGrantService {

  private static final Logger log = LoggerFactory.getLogger(MembershipGrantService.class);

  static final int MAX_ATTEMPTS = 3;
  static final String UPDATE_FAILED = "Failed to update membership";

  private final MemberProfileRepository profileRepository;
  private final TransactionTemplate transactionTemplate;
  private final ApplicationEventPublisher eventPublisher;
  private final MembershipProperties properties;
  private final Clock clock;

  public MembershipGrantService(
      MemberProfileRepository profileRepository,
      PlatformTransactionManager txManager,
      ApplicationEventPublisher eventPublisher,
      MembershipProperties properties,
      Clock clock) {
    this.profileRepository = profileRepository;
    this.transactionTemplate = new TransactionTemplate(txManager);
    this.eventPublisher = eventPublisher;
    this.properties = properties;
    this.clock = clock;
  }

  /**
   * @return the granted event, or empty when no profile matches the request
   * @throws OperationFailedException when the profile cannot be written
   */
  public Optional<MembershipGrantedEvent> grant(GrantRequest request) {
    for (int attempt = 1; ; attempt++) {
      try {
        return transactionTemplate.execute(status -> grantOnce(request));
      } catch (OptimisticLockingFailureException e) {
        if (attempt >= MAX_ATTEMPTS) {
          log.error("Membership grant gave up after {} concurrent-update conflicts", attempt);
          throw new OperationFailedException(UPDATE_FAILED, e);
        }
        log.warn("Membership grant conflicted with a concurrent update, attempt {}", attempt);
      } catch (DataAccessException e) {
        log.error("Membership grant failed: {}", e.getMessage());
        throw new OperationFailedException(UPDATE_FAILED, e);
      }
    }
  }

  private Optional<MembershipGrantedEvent> grantOnce(GrantRequest request) {
    var found = resolveProfile(request);
    if (found.isEmpty()) {
      return Optional.empty();
    }
    var profile = found.get();
    var merged =
        MembershipMerge.grant(
            profile.membershipState(),
            properties.planName(),
            LocalDate.now(clock),
            properties.term());
    profile.applyMembership(merged, properties.source());
    profile.attachStripeCustomer(request.customerRef());
    profileRepository.saveAndFlush(profile);

    var recipient =
        request.payerEmail() != null && !request.payerEmail().isBlank()
            ? request.payerEmail()
            : profile.getEmail();
    var event =
        new MembershipGrantedEvent(
            profile.getId(), recipient, merged.memberSince(), merged.expiration());
    eventPublisher.publishEvent(event);
    log.info(
        "Granted membership to profile {} (expires {})", profile.getId(), merged.expiration());
    return Optional.of(event);
  }

  private Optional<MemberProfile> resolveProfile(GrantRequest request) {
    if (request.profileId() != null) {
      var byId = profileRepository.findById(request.profileId());
      if (byId.isPresent()) {
        return byId;
      }
      log.warn("No profile with id {}, falling back to payer email", request.profileId());
    }
    if (request.payerEmail() == null || request.payerEmail().isBlank()) {
      return Optional.empty();
    }
    return profileRepository.findFirstByEmailIgnoreCase(request.payerEmail().trim());
  }
}
