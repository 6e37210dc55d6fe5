package org.waabox.concordia.source;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * An entry of the corporate membership directory.
 *
 * @param membership     the membership, may be null
 * @param adminContact   the company's administrator, may be null
 * @param memberContacts the company's other members, may be null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CorporateMembershipRecord(Membership membership,
    Contact adminContact, List<Contact> memberContacts) {
}
