package org.waabox.concordia.target;

/**
 * A group in the target registry.
 *
 * @param id   the space id, may be null for malformed records
 * @param name the display name, may be null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record Space(String id, String name) {
}
