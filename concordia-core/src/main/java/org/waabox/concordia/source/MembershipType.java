package org.waabox.concordia.source;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * The plan a membership belongs to.
 *
 * @param title         the public title, may be null
 * @param internalTitle the back-office title, may be null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record MembershipType(String title, String internalTitle) {
}
