package io.kandiegang.shop.membership;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.UUID;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/**
 * Club member profile. Rows are created by account sign-up elsewhere; this service only updates
 * the membership columns and the Stripe customer reference.
 */
@Entity
@Table(name = "profiles")
public class MemberProfile {

  @Id private UUID id;

  @Column(name = "email")
  private String email;

  @Column(name = "display_name")
  private String displayName;

  @Column(name = "is_member", nullable = false)
  private boolean member;

  @Column(name = "membership_source")
  private String membershipSource;

  @JdbcTypeCode(SqlTypes.ARRAY)
  @Column(name = "membership_plans", nullable = false, columnDefinition = "text[]")
  private List<String> membershipPlans = new ArrayList<>();

  @Column(name = "member_since")
  private LocalDate memberSince;

  @Column(name = "membership_expiration")
  private LocalDate membershipExpiration;

  @Column(name = "stripe_customer_id", unique = true)
  private String stripeCustomerId;

  @Version private Integer version;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected MemberProfile() {}

  public MemberProfile(UUID id, String email) {
    this.id = id;
    this.email = email;
    this.updatedAt = Instant.now();
  }

  public MembershipState membershipState() {
    return new MembershipState(
        member,
        new LinkedHashSet<>(membershipPlans != null ? membershipPlans : List.of()),
        memberSince,
        membershipExpiration);
  }

  /** Overwrites the membership columns with a merged state. Plans keep their set order. */
  public void applyMembership(MembershipState state, String source) {
    this.member = state.member();
    this.membershipPlans = new ArrayList<>(state.plans());
    this.memberSince = state.memberSince();
    this.membershipExpiration = state.expiration();
    this.membershipSource = source;
    this.updatedAt = Instant.now();
  }

  /** Records the Stripe customer once. An existing reference is never replaced. */
  public boolean attachStripeCustomer(String customerRef) {
    if (customerRef == null || customerRef.isBlank() || hasStripeCustomer()) {
      return false;
    }
    this.stripeCustomerId = customerRef;
    this.updatedAt = Instant.now();
    return true;
  }

  public boolean hasStripeCustomer() {
    return stripeCustomerId != null && !stripeCustomerId.isBlank();
  }

  public UUID getId() {
    return id;
  }

  public String getEmail() {
    return email;
  }

  public String getDisplayName() {
    return displayName;
  }

  public boolean isMember() {
    return member;
  }

  public String getMembershipSource() {
    return membershipSource;
  }

  public List<String> getMembershipPlans() {
    return List.copyOf(membershipPlans);
  }

  public LocalDate getMemberSince() {
    return memberSince;
  }

  public LocalDate getMembershipExpiration() {
    return membershipExpiration;
  }

  public String getStripeCustomerId() {
    return stripeCustomerId;
  }

  public Integer getVersion() {
    return version;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
