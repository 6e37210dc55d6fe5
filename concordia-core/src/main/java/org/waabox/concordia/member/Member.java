package org.waabox.concordia.member;

import java.util.Objects;

/**
 * A directory member in the uniform shape the reconciliation works on.
 *
 * @param email         the normalized email, never null nor blank
 * @param displayName   the full name, never null, possibly empty
 * @param planSlug      the lowercased plan title, never null
 * @param kind          where the member came from, never null
 * @param corporateName the company, set only for corporate kinds
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record Member(
    String email,
    String displayName,
    String planSlug,
    MemberKind kind,
    String corporateName
) {

  /** Validates the member. */
  public Member {
    Objects.requireNonNull(email, "email must not be null");
    if (email.isBlank()) {
      throw new IllegalArgumentException("email must not be blank");
    }
    Objects.requireNonNull(displayName, "displayName must not be null");
    Objects.requireNonNull(planSlug, "planSlug must not be null");
    Objects.requireNonNull(kind, "kind must not be null");
    if (kind.isCorporate()) {
      Objects.requireNonNull(corporateName,
          "corporateName must not be null for " + kind);
    } else if (corporateName != null) {
      throw new IllegalArgumentException(
          "corporateName is only allowed for corporate members");
    }
  }
}
