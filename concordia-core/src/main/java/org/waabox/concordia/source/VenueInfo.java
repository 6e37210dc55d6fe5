package org.waabox.concordia.source;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Where an event takes place.
 *
 * @param name     the venue name, may be null
 * @param address  the street address, may be null
 * @param city     the city, may be null
 * @param country  the country, may be null
 * @param timezone the IANA timezone of the venue, may be null
 * @param map      the coordinates, may be null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record VenueInfo(TextValue name, TextValue address, TextValue city,
    TextValue country, String timezone, GeoPoint map) {
}
