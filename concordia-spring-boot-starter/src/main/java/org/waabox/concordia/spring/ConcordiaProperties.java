package org.waabox.concordia.spring;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for Concordia, mapped from the
 * {@code concordia.*} prefix in application.yml or application.properties.
 *
 * <p>Supports:
 * <ul>
 *   <li>{@code concordia.mapping.default-spaces} - the spaces every member
 *       belongs in.</li>
 *   <li>{@code concordia.mapping.plans-to-spaces.<plan-slug>} - the extra
 *       spaces of a membership plan.</li>
 *   <li>{@code concordia.events.*} - what an event sync run may do, see
 *       {@link Events}.</li>
 * </ul>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@ConfigurationProperties(prefix = "concordia")
public class ConcordiaProperties {

  /** Plan to space mapping. */
  private final Mapping mapping = new Mapping();

  /** Event sync settings. */
  private final Events events = new Events();

  public Mapping getMapping() {
    return mapping;
  }

  public Events getEvents() {
    return events;
  }

  /** Membership plan to space mapping. */
  public static class Mapping {

    /** The spaces every member belongs in. */
    private List<String> defaultSpaces = new ArrayList<>();

    /** Plan slug to extra spaces. */
    private Map<String, List<String>> plansToSpaces = new LinkedHashMap<>();

    public List<String> getDefaultSpaces() {
      return defaultSpaces;
    }

    public void setDefaultSpaces(final List<String> theDefaultSpaces) {
      defaultSpaces = theDefaultSpaces;
    }

    public Map<String, List<String>> getPlansToSpaces() {
      return plansToSpaces;
    }

    public void setPlansToSpaces(
        final Map<String, List<String>> thePlansToSpaces) {
      plansToSpaces = thePlansToSpaces;
    }
  }

  /**
   * Event sync settings.
   *
   * <p>Events are only created when {@code default-space-id} is set.
   */
  public static class Events {

    /** The space events are created in. */
    private String defaultSpaceId;

    /** Whether new events are created. */
    private boolean createNew = true;

    /** Whether changed events are updated. */
    private boolean updateExisting = true;

    /** Whether events gone from the source are deleted. */
    private boolean deleteRemoved = false;

    /** Whether only published events are read. */
    private boolean publishedOnly = true;

    /** Whether only events that have not ended are read. */
    private boolean futureOnly = true;

    /** Values replacing the derived ones. */
    private final FieldOverrides fieldOverrides = new FieldOverrides();

    public String getDefaultSpaceId() {
      return defaultSpaceId;
    }

    public void setDefaultSpaceId(final String theDefaultSpaceId) {
      defaultSpaceId = theDefaultSpaceId;
    }

    public boolean isCreateNew() {
      return createNew;
    }

    public void setCreateNew(final boolean enabled) {
      createNew = enabled;
    }

    public boolean isUpdateExisting() {
      return updateExisting;
    }

    public void setUpdateExisting(final boolean enabled) {
      updateExisting = enabled;
    }

    public boolean isDeleteRemoved() {
      return deleteRemoved;
    }

    public void setDeleteRemoved(final boolean enabled) {
      deleteRemoved = enabled;
    }

    public boolean isPublishedOnly() {
      return publishedOnly;
    }

    public void setPublishedOnly(final boolean enabled) {
      publishedOnly = enabled;
    }

    public boolean isFutureOnly() {
      return futureOnly;
    }

    public void setFutureOnly(final boolean enabled) {
      futureOnly = enabled;
    }

    public FieldOverrides getFieldOverrides() {
      return fieldOverrides;
    }
  }

  /**
   * Event fields forced by configuration. Unset values keep their
   * defaults.
   */
  public static class FieldOverrides {

    /** The host label. */
    private String host;

    /** One of in_person, virtual or tbd. */
    private String locationType;

    private Boolean rsvpDisabled;

    private Boolean sendEmailConfirmation;

    private Boolean sendEmailReminder;

    public String getHost() {
      return host;
    }

    public void setHost(final String theHost) {
      host = theHost;
    }

    public String getLocationType() {
      return locationType;
    }

    public void setLocationType(final String theLocationType) {
      locationType = theLocationType;
    }

    public Boolean getRsvpDisabled() {
      return rsvpDisabled;
    }

    public void setRsvpDisabled(final Boolean disabled) {
      rsvpDisabled = disabled;
    }

    public Boolean getSendEmailConfirmation() {
      return sendEmailConfirmation;
    }

    public void setSendEmailConfirmation(final Boolean enabled) {
      sendEmailConfirmation = enabled;
    }

    public Boolean getSendEmailReminder() {
      return sendEmailReminder;
    }

    public void setSendEmailReminder(final Boolean enabled) {
      sendEmailReminder = enabled;
    }
  }
}
