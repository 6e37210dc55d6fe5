package org.waabox.concordia.target;

/**
 * What the target registry returns for a created event.
 *
 * @param id   the new event id, never null
 * @param slug the slug the registry assigned, null if it kept ours
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record CreatedEvent(String id, String slug) {
}
