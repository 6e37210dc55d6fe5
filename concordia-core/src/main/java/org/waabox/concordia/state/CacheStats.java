package org.waabox.concordia.state;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Entry counts per section of the state document.
 *
 * @param members      the number of cached member identities
 * @param memberSpaces the number of cached member space lists
 * @param events       the number of event mappings
 * @param webhooks     the number of ledger entries
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record CacheStats(
    @JsonProperty("members_count") int members,
    @JsonProperty("member_spaces_count") int memberSpaces,
    @JsonProperty("events_count") int events,
    @JsonProperty("webhooks_count") int webhooks
) {
}
