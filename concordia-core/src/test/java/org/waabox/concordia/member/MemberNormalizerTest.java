package org.waabox.concordia.member;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.waabox.concordia.FakeSourceDirectory.contact;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.Test;
import org.waabox.concordia.source.Contact;
import org.waabox.concordia.source.CorporateMembershipRecord;
import org.waabox.concordia.source.EmailAddress;
import org.waabox.concordia.source.IndividualMembershipRecord;
import org.waabox.concordia.source.Membership;
import org.waabox.concordia.source.MembershipType;

/**
 * Tests for {@link MemberNormalizer}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class MemberNormalizerTest {

  private final MemberNormalizer normalizer = new MemberNormalizer();

  @Test
  void whenNormalizingIndividual_givenMixedCaseEmail_shouldNormalizeIt() {
    final IndividualMembershipRecord record = new IndividualMembershipRecord(
        new Membership(null, "active", new MembershipType(" Gold ", null)),
        contact("  Ana@Example.COM ", "Ana", "Lopez"));

    final Optional<Member> member = normalizer.normalizeIndividual(record);

    assertTrue(member.isPresent());
    assertEquals("ana@example.com", member.get().email());
    assertEquals("Ana Lopez", member.get().displayName());
    assertEquals("gold", member.get().planSlug());
    assertEquals(MemberKind.INDIVIDUAL, member.get().kind());
    assertNull(member.get().corporateName());
  }

  @Test
  void whenNormalizingIndividual_givenNoEmail_shouldDropIt() {
    final IndividualMembershipRecord record = new IndividualMembershipRecord(
        new Membership(null, "active", null),
        contact("  ", "Ana", null));

    assertTrue(normalizer.normalizeIndividual(record).isEmpty());
  }

  @Test
  void whenComputingPlan_givenOnlyInternalTitle_shouldUseIt() {
    assertEquals("corp-basic", MemberNormalizer.planSlug(new Membership(
        null, null, new MembershipType("", "Corp-Basic"))));
    assertEquals(MemberNormalizer.UNMAPPED_PLAN,
        MemberNormalizer.planSlug(new Membership(null, null, null)));
    assertEquals(MemberNormalizer.UNMAPPED_PLAN,
        MemberNormalizer.planSlug(null));
  }

  @Test
  void whenNormalizingCorporate_shouldListAdminFirstThenContacts() {
    final CorporateMembershipRecord record = new CorporateMembershipRecord(
        new Membership("Acme", "active", new MembershipType("Corporate",
            null)),
        contact("boss@acme.com", "Bo", "Ss"),
        Arrays.asList(contact("dev@acme.com", "De", "V"),
            contact(null, "No", "Mail"), null));

    final List<Member> members = normalizer.normalizeCorporate(record);

    assertEquals(2, members.size());
    assertEquals("boss@acme.com", members.get(0).email());
    assertEquals(MemberKind.CORPORATE_ADMIN, members.get(0).kind());
    assertEquals("dev@acme.com", members.get(1).email());
    assertEquals(MemberKind.CORPORATE_CONTACT, members.get(1).kind());
    assertEquals("Acme", members.get(1).corporateName());
    assertEquals("corporate", members.get(1).planSlug());
  }

  @Test
  void whenNormalizingCorporate_givenNoName_shouldUseUnknownCorporation() {
    final CorporateMembershipRecord record = new CorporateMembershipRecord(
        new Membership(null, null, null),
        contact("boss@acme.com", "Bo", null), null);

    final List<Member> members = normalizer.normalizeCorporate(record);

    assertEquals(1, members.size());
    assertEquals(MemberNormalizer.UNKNOWN_CORPORATION,
        members.get(0).corporateName());
    assertEquals("Bo", members.get(0).displayName());
  }

  @Test
  void whenNormalizing_givenBadRecord_shouldKeepTheOthers() {
    final List<IndividualMembershipRecord> individuals = Arrays.asList(
        null,
        new IndividualMembershipRecord(null,
            new Contact(
                new EmailAddress("ok@x.com"), null, null)));

    final List<Member> members = normalizer.normalize(individuals,
        List.of());

    assertEquals(1, members.size());
    assertEquals("ok@x.com", members.get(0).email());
    assertEquals(MemberNormalizer.UNMAPPED_PLAN, members.get(0).planSlug());
  }
}
