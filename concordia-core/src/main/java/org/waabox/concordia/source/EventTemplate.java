package org.waabox.concordia.source;

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * The presentation template of an event.
 *
 * @param images the images keyed by role ({@code banner},
 *               {@code headerImage}), may be null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EventTemplate(Map<String, ImageRef> images) {
}
