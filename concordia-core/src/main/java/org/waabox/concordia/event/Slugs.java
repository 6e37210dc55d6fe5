package org.waabox.concordia.event;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * URL slug helpers.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class Slugs {

  /** The maximum slug length. */
  public static final int MAX_LENGTH = 100;

  /** Anything that is neither a word character, whitespace nor a hyphen. */
  private static final Pattern DISALLOWED = Pattern.compile("[^\\w\\s-]",
      Pattern.UNICODE_CHARACTER_CLASS);

  /** Runs of hyphens and whitespace. */
  private static final Pattern SEPARATORS = Pattern.compile("[-\\s]+",
      Pattern.UNICODE_CHARACTER_CLASS);

  private Slugs() {
  }

  /**
   * Turns text into a URL-safe slug.
   *
   * <p>Lowercases, drops disallowed characters, collapses separator runs
   * into one hyphen, trims hyphens from both ends and truncates to
   * {@link #MAX_LENGTH} characters.
   *
   * @param text the text, never null
   *
   * @return the slug, never null, possibly empty
   */
  public static String slugify(final String text) {
    Objects.requireNonNull(text, "text must not be null");
    String slug = text.toLowerCase(Locale.ROOT);
    slug = DISALLOWED.matcher(slug).replaceAll("");
    slug = SEPARATORS.matcher(slug).replaceAll("-");
    int start = 0;
    int end = slug.length();
    while (start < end && slug.charAt(start) == '-') {
      start++;
    }
    while (end > start && slug.charAt(end - 1) == '-') {
      end--;
    }
    slug = slug.substring(start, end);
    return slug.length() > MAX_LENGTH ? slug.substring(0, MAX_LENGTH) : slug;
  }

  /**
   * Builds the slug of an event from its title and source id.
   *
   * <p>The id part is never truncated: only the title part is shortened so
   * the whole slug fits in {@link #MAX_LENGTH} characters. Two events with
   * the same title always get different slugs.
   *
   * @param title the event title, never null
   * @param id the source event id, never null
   *
   * @return the slug, never null
   */
  public static String eventSlug(final String title, final String id) {
    Objects.requireNonNull(title, "title must not be null");
    Objects.requireNonNull(id, "id must not be null");
    final String idPart = slugify(id);
    String titlePart = slugify(title);
    if (idPart.isEmpty()) {
      return titlePart;
    }
    final int room = Math.max(0, MAX_LENGTH - 1 - idPart.length());
    if (titlePart.length() > room) {
      titlePart = trimTrailingHyphens(titlePart.substring(0, room));
    }
    return titlePart.isEmpty() ? idPart : titlePart + "-" + idPart;
  }

  private static String trimTrailingHyphens(final String text) {
    int end = text.length();
    while (end > 0 && text.charAt(end - 1) == '-') {
      end--;
    }
    return text.substring(0, end);
  }
}
