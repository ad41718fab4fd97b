package io.kandiegang.shop.membership;

import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface MemberProfileRepository extends JpaRepository<MemberProfile, UUID> {

  /** Emails are expected to be unique across profiles; the first match wins otherwise. */
  Optional<MemberProfile> findFirstByEmailIgnoreCase(String email);
}
