package org.waabox.concordia.state;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSetter;
import com.fasterxml.jackson.annotation.Nulls;

/**
 * The persisted state: four independent sections.
 *
 * <p>A section absent from a stored document deserializes as an empty
 * map. This class is mutable and only accessed through
 * {@link StateCache}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@JsonIgnoreProperties(ignoreUnknown = true)
final class StateDocument {

  /** Normalized email to target member marker. */
  @JsonProperty("email_to_member_id")
  @JsonSetter(nulls = Nulls.AS_EMPTY)
  private Map<String, String> memberIds = new LinkedHashMap<>();

  /** Target member id to space ids. */
  @JsonProperty("member_spaces")
  @JsonSetter(nulls = Nulls.AS_EMPTY)
  private Map<String, List<String>> memberSpaces = new LinkedHashMap<>();

  /** Source event id to event mapping. */
  @JsonProperty("events")
  @JsonSetter(nulls = Nulls.AS_EMPTY)
  private Map<String, EventMapping> events = new LinkedHashMap<>();

  /** Webhook id to ledger entry. */
  @JsonProperty("webhook_events")
  @JsonSetter(nulls = Nulls.AS_EMPTY)
  private Map<String, WebhookRecord> webhooks = new LinkedHashMap<>();

  Map<String, String> memberIds() {
    return memberIds;
  }

  Map<String, List<String>> memberSpaces() {
    return memberSpaces;
  }

  Map<String, EventMapping> events() {
    return events;
  }

  Map<String, WebhookRecord> webhooks() {
    return webhooks;
  }
}
