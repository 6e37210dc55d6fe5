package org.waabox.concordia.source;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Venue coordinates.
 *
 * @param latitude  the latitude, may be null
 * @param longitude the longitude, may be null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GeoPoint(Double latitude, Double longitude) {
}
