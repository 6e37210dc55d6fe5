package org.waabox.concordia.target;

/**
 * A community member of the target registry.
 *
 * @param id    the member id, may be null
 * @param email the email as the registry stores it, may be null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record TargetMember(String id, String email) {
}
