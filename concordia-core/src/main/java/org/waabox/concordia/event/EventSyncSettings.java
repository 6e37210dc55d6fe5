package org.waabox.concordia.event;

import java.util.Objects;

/**
 * What an event sync run is allowed to do, and where.
 *
 * <p>Created through {@link #builder()}. Defaults: no default space,
 * create and update enabled, delete disabled, only published and future
 * events, no field overrides.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class EventSyncSettings {

  private final String defaultSpaceId;
  private final boolean createNew;
  private final boolean updateExisting;
  private final boolean deleteRemoved;
  private final boolean publishedOnly;
  private final boolean futureOnly;
  private final FieldOverrides fieldOverrides;

  private EventSyncSettings(final Builder builder) {
    defaultSpaceId = builder.defaultSpaceId;
    createNew = builder.createNew;
    updateExisting = builder.updateExisting;
    deleteRemoved = builder.deleteRemoved;
    publishedOnly = builder.publishedOnly;
    futureOnly = builder.futureOnly;
    fieldOverrides = builder.fieldOverrides;
  }

  /**
   * Creates a new builder.
   *
   * @return the builder, never null
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns settings with every default.
   *
   * @return the settings, never null
   */
  public static EventSyncSettings defaults() {
    return builder().build();
  }

  /**
   * Returns the space events are created in.
   *
   * @return the space id, null when not configured
   */
  public String defaultSpaceId() {
    return defaultSpaceId;
  }

  public boolean createNew() {
    return createNew;
  }

  public boolean updateExisting() {
    return updateExisting;
  }

  public boolean deleteRemoved() {
    return deleteRemoved;
  }

  public boolean publishedOnly() {
    return publishedOnly;
  }

  public boolean futureOnly() {
    return futureOnly;
  }

  public FieldOverrides fieldOverrides() {
    return fieldOverrides;
  }

  /** Builds {@link EventSyncSettings}. */
  public static final class Builder {

    private String defaultSpaceId;
    private boolean createNew = true;
    private boolean updateExisting = true;
    private boolean deleteRemoved = false;
    private boolean publishedOnly = true;
    private boolean futureOnly = true;
    private FieldOverrides fieldOverrides = FieldOverrides.none();

    private Builder() {
    }

    /**
     * Sets the space events are created in.
     *
     * @param theSpaceId the space id, may be null to leave it unset
     *
     * @return this builder for chaining, never null
     */
    public Builder defaultSpaceId(final String theSpaceId) {
      defaultSpaceId = theSpaceId == null || theSpaceId.isBlank()
          ? null : theSpaceId;
      return this;
    }

    public Builder createNew(final boolean enabled) {
      createNew = enabled;
      return this;
    }

    public Builder updateExisting(final boolean enabled) {
      updateExisting = enabled;
      return this;
    }

    public Builder deleteRemoved(final boolean enabled) {
      deleteRemoved = enabled;
      return this;
    }

    public Builder publishedOnly(final boolean enabled) {
      publishedOnly = enabled;
      return this;
    }

    public Builder futureOnly(final boolean enabled) {
      futureOnly = enabled;
      return this;
    }

    /**
     * Sets the field overrides.
     *
     * @param theOverrides the overrides, never null
     *
     * @return this builder for chaining, never null
     *
     * @throws NullPointerException if theOverrides is null
     */
    public Builder fieldOverrides(final FieldOverrides theOverrides) {
      fieldOverrides = Objects.requireNonNull(theOverrides,
          "fieldOverrides must not be null");
      return this;
    }

    /**
     * Builds the settings.
     *
     * @return the settings, never null
     */
    public EventSyncSettings build() {
      return new EventSyncSettings(this);
    }
  }
}
