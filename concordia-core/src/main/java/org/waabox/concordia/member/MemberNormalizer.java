package org.waabox.concordia.member;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.waabox.concordia.source.Contact;
import org.waabox.concordia.source.CorporateMembershipRecord;
import org.waabox.concordia.source.IndividualMembershipRecord;
import org.waabox.concordia.source.Membership;
import org.waabox.concordia.source.MembershipType;

/**
 * Flattens individual and corporate directory records into {@link Member}s.
 *
 * <p>A corporate record yields its administrator followed by its member
 * contacts. Contacts without an email are dropped. A record that can not
 * be read is logged and left out; the others are still normalized.
 *
 * <p>Stateless and thread-safe.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class MemberNormalizer {

  /** The class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(MemberNormalizer.class);

  /** The plan slug of a membership without a type. */
  public static final String UNMAPPED_PLAN = "unmapped";

  /** The company name of a corporate membership without one. */
  public static final String UNKNOWN_CORPORATION = "Unknown Corporation";

  /**
   * Normalizes both record lists, individuals first.
   *
   * @param individuals the individual memberships, never null
   * @param corporates  the corporate memberships, never null
   *
   * @return the members in input order, never null
   */
  public List<Member> normalize(
      final List<IndividualMembershipRecord> individuals,
      final List<CorporateMembershipRecord> corporates) {
    Objects.requireNonNull(individuals, "individuals must not be null");
    Objects.requireNonNull(corporates, "corporates must not be null");

    final List<Member> members = new ArrayList<>();
    for (final IndividualMembershipRecord individual : individuals) {
      try {
        normalizeIndividual(individual).ifPresent(members::add);
      } catch (final RuntimeException e) {
        log.warn("Failed to normalize individual member: {}",
            e.getMessage());
      }
    }
    int corporateContacts = 0;
    for (final CorporateMembershipRecord corporate : corporates) {
      try {
        final List<Member> contacts = normalizeCorporate(corporate);
        corporateContacts += contacts.size();
        members.addAll(contacts);
      } catch (final RuntimeException e) {
        log.warn("Failed to normalize corporate membership: {}",
            e.getMessage());
      }
    }
    log.info("Normalized {} members ({} individual records, {} corporate"
        + " contacts)", members.size(), individuals.size(), corporateContacts);
    return members;
  }

  /**
   * Normalizes an individual membership.
   *
   * @param individual the record, never null
   *
   * @return the member, or empty when the record has no email
   */
  public Optional<Member> normalizeIndividual(
      final IndividualMembershipRecord individual) {
    Objects.requireNonNull(individual, "individual must not be null");
    final String plan = planSlug(individual.membership());
    return toMember(individual.individualMember(), plan,
        MemberKind.INDIVIDUAL, null);
  }

  /**
   * Normalizes a corporate membership into its contacts.
   *
   * @param corporate the record, never null
   *
   * @return the administrator, if any, then the member contacts, never
   *         null
   */
  public List<Member> normalizeCorporate(
      final CorporateMembershipRecord corporate) {
    Objects.requireNonNull(corporate, "corporate must not be null");
    final Membership membership = corporate.membership();
    final String plan = planSlug(membership);
    final String company = membership == null || membership.name() == null
        || membership.name().isBlank()
        ? UNKNOWN_CORPORATION : membership.name();

    final List<Member> contacts = new ArrayList<>();
    toMember(corporate.adminContact(), plan, MemberKind.CORPORATE_ADMIN,
        company).ifPresent(contacts::add);
    if (corporate.memberContacts() != null) {
      for (final Contact contact : corporate.memberContacts()) {
        toMember(contact, plan, MemberKind.CORPORATE_CONTACT, company)
            .ifPresent(contacts::add);
      }
    }
    return contacts;
  }

  /**
   * Computes the plan slug of a membership: its type title, else its
   * internal title, trimmed and lowercased.
   *
   * @param membership the membership, may be null
   *
   * @return the slug, {@link #UNMAPPED_PLAN} when no title exists
   */
  static String planSlug(final Membership membership) {
    final MembershipType type = membership == null
        ? null : membership.membershipType();
    String title = null;
    if (type != null) {
      title = isEmpty(type.title()) ? type.internalTitle() : type.title();
    }
    if (isEmpty(title)) {
      title = UNMAPPED_PLAN;
    }
    return title.trim().toLowerCase(Locale.ROOT);
  }

  private static Optional<Member> toMember(final Contact contact,
      final String plan, final MemberKind kind, final String company) {
    if (contact == null || contact.emailAddress() == null) {
      return Optional.empty();
    }
    final String email = Emails.normalize(contact.emailAddress().value());
    if (email.isEmpty()) {
      return Optional.empty();
    }
    final String name = (nullToEmpty(contact.givenName()) + " "
        + nullToEmpty(contact.familyName())).trim();
    return Optional.of(new Member(email, name, plan, kind, company));
  }

  private static boolean isEmpty(final String value) {
    return value == null || value.isEmpty();
  }

  private static String nullToEmpty(final String value) {
    return value == null ? "" : value;
  }
}
