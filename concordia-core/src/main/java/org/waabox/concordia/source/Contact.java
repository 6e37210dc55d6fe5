package org.waabox.concordia.source;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * A person attached to a membership.
 *
 * @param emailAddress the address, may be null
 * @param givenName    the given name, may be null
 * @param familyName   the family name, may be null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Contact(EmailAddress emailAddress, String givenName,
    String familyName) {
}
