package org.waabox.concordia.source;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * An entry of the individual membership directory.
 *
 * @param membership       the membership, may be null
 * @param individualMember the member, may be null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record IndividualMembershipRecord(Membership membership,
    Contact individualMember) {
}
