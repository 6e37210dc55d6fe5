package org.waabox.concordia.source;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * An image of an event template.
 *
 * @param uri the image location, possibly relative and possibly holding a
 *            {@code ::size::} placeholder; may be null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ImageRef(String uri) {
}
