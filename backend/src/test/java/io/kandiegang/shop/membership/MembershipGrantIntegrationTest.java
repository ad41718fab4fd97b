package io.kandiegang.shop.membership;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.kandiegang.shop.TestcontainersConfiguration;
import java.time.Clock;
import java.time.LocalDate;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.test.context.ActiveProfiles;
import org.testcontainers.junit.jupiter.Testcontainers;

@SpringBootTest
@Import(TestcontainersConfiguration.class)
@ActiveProfiles("test")
@Testcontainers(disabledWithoutDocker = true)
class MembershipGrantIntegrationTest {

  private static final String PLAN = "Kandie Gang Cycling Club Membership";

  @Autowired private MembershipGrantService grantService;
  @Autowired private MemberProfileRepository profileRepository;
  @Autowired private Clock clock;

  @Test
  void granting_same_checkout_twice_leaves_identical_state() {
    var profile = saveProfile(uniqueEmail("twice"), null);
    var request = new GrantRequest(profile.getId(), null, "cus_" + UUID.randomUUID());

    assertThat(grantService.grant(request)).isPresent();
    var afterFirst = reload(profile);
    assertThat(grantService.grant(request)).isPresent();
    var afterSecond = reload(profile);

    var today = LocalDate.now(clock);
    assertThat(afterSecond.isMember()).isTrue();
    assertThat(afterSecond.getMembershipPlans()).containsExactly(PLAN);
    assertThat(afterSecond.getMemberSince()).isEqualTo(today);
    assertThat(afterSecond.getMembershipExpiration()).isEqualTo(today.plusYears(1));
    assertThat(afterSecond.getMembershipPlans()).isEqualTo(afterFirst.getMembershipPlans());
    assertThat(afterSecond.getMembershipExpiration())
        .isEqualTo(afterFirst.getMembershipExpiration());
    assertThat(afterSecond.getStripeCustomerId()).isEqualTo(request.customerRef());
  }

  @Test
  void existing_plans_survive_the_text_array_round_trip() {
    var today = LocalDate.now(clock);
    var since = today.minusYears(2);
    var existingExpiry = today.plusYears(3);
    var profile =
        saveProfile(
            uniqueEmail("guide"),
            new MembershipState(true, Set.of("Guide"), since, existingExpiry));

    grantService.grant(new GrantRequest(profile.getId(), null, null));

    var granted = reload(profile);
    assertThat(granted.getMembershipPlans()).containsExactly("Guide", PLAN);
    assertThat(granted.getMemberSince()).isEqualTo(since);
    assertThat(granted.getMembershipExpiration()).isEqualTo(existingExpiry);
    assertThat(granted.getMembershipSource()).isEqualTo("supabase");
  }

  @Test
  void payer_email_lookup_ignores_case() {
    var email = "Rider." + UUID.randomUUID() + "@Example.com";
    var profile = saveProfile(email, null);

    var event = grantService.grant(new GrantRequest(null, email.toLowerCase(), null));

    assertThat(event).map(MembershipGrantedEvent::profileId).contains(profile.getId());
    assertThat(reload(profile).isMember()).isTrue();
  }

  @Test
  void unknown_profile_grants_nothing() {
    var event =
        grantService.grant(new GrantRequest(UUID.randomUUID(), uniqueEmail("nobody"), null));

    assertThat(event).isEmpty();
  }

  @Test
  void stale_profile_write_is_rejected_by_version_column() {
    var profile = saveProfile(uniqueEmail("stale"), null);
    var stale = reload(profile);

    grantService.grant(new GrantRequest(profile.getId(), null, null));

    assertThat(reload(profile).getVersion()).isGreaterThan(stale.getVersion());
    assertThatThrownBy(() -> profileRepository.saveAndFlush(stale))
        .isInstanceOf(OptimisticLockingFailureException.class);
  }

  @Test
  void concurrent_grants_lose_no_plan() throws Exception {
    var today = LocalDate.now(clock);
    var profile =
        saveProfile(
            uniqueEmail("concurrent"),
            new MembershipState(true, Set.of("Guide"), today.minusMonths(6), today.plusMonths(1)));
    var request = new GrantRequest(profile.getId(), null, null);

    var latch = new CountDownLatch(1);
    var results = new ConcurrentLinkedQueue<Optional<MembershipGrantedEvent>>();
    var errors = new ConcurrentLinkedQueue<Throwable>();
    var executor = Executors.newFixedThreadPool(2);

    for (int i = 0; i < 2; i++) {
      executor.submit(
          () -> {
            try {
              latch.await();
              results.add(grantService.grant(request));
            } catch (Exception e) {
              errors.add(e);
            }
          });
    }

    latch.countDown();

    executor.shutdown();
    assertThat(executor.awaitTermination(30, TimeUnit.SECONDS)).isTrue();
    assertThat(errors).isEmpty();
    assertThat(results).hasSize(2).allMatch(Optional::isPresent);

    var granted = reload(profile);
    assertThat(granted.getMembershipPlans()).containsExactly("Guide", PLAN);
    assertThat(granted.getMemberSince()).isEqualTo(today.minusMonths(6));
    assertThat(granted.getMembershipExpiration()).isEqualTo(today.plusYears(1));
  }

  private MemberProfile saveProfile(String email, MembershipState state) {
    var profile = new MemberProfile(UUID.randomUUID(), email);
    if (state != null) {
      profile.applyMembership(state, "supabase");
    }
    return profileRepository.saveAndFlush(profile);
  }

  private MemberProfile reload(MemberProfile profile) {
    return profileRepository.findById(profile.getId()).orElseThrow();
  }

  private static String uniqueEmail(String prefix) {
    return prefix + "-" + UUID.randomUUID() + "@example.com";
  }
}
