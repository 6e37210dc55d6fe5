package org.waabox.concordia.source;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * A membership as listed by the directory.
 *
 * @param name           the membership name; for corporate memberships the
 *                       company name, may be null
 * @param status         the membership status, may be null
 * @param membershipType the plan, may be null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Membership(String name, String status,
    MembershipType membershipType) {
}
