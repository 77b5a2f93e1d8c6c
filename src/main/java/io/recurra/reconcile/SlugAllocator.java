package io.recurra.reconcile;

import io.recurra.calendar.CalendarDate;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Hands out instance slugs of the form {@code <series-name>-<YYYY-MM-DD>} for one batch.
 *
 * <p>A slug already taken in the store, or earlier in the same batch, gets the first free numeric
 * suffix ({@code -2}, {@code -3}, ...). The result depends only on the inputs, so a retried batch
 * receives the same slugs.
 */
final class SlugAllocator {
  /** Highest numeric suffix probed for a single date; later probes use a hashed suffix. */
  static final int MAX_SUFFIX = 10_000;

  private final String baseSlug;
  private final SlugIndex index;
  private final Set<String> issued = new HashSet<>();

  SlugAllocator(String seriesName, SlugIndex index) {
    this.baseSlug = slugify(seriesName);
    this.index = index;
  }

  /**
   * Returns a free slug for a date and reserves it for the rest of the batch.
   *
   * @param date the instance date
   * @return the slug
   */
  String allocate(CalendarDate date) {
    String candidate = baseSlug + "-" + date;
    String slug = candidate;
    for (int attempt = 2; isTaken(slug); attempt++) {
      slug =
          attempt <= MAX_SUFFIX
              ? candidate + "-" + attempt
              : candidate + "-" + hashedSuffix(candidate, attempt);
    }
    issued.add(slug);
    return slug;
  }

  /** Eight hex digits, never equal to a numeric suffix within {@link #MAX_SUFFIX}. */
  static String hashedSuffix(String candidate, int attempt) {
    return String.format("%08x", (candidate + "#" + attempt).hashCode());
  }

  private boolean isTaken(String slug) {
    return issued.contains(slug) || index.isTaken(slug);
  }

  /**
   * Lowercases text and collapses every run of other characters into a single hyphen.
   *
   * @param text the text
   * @return the slug, or "event" if nothing usable remains
   */
  static String slugify(String text) {
    String slug =
        text.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "-").replaceAll("^-+|-+$", "");
    return slug.isEmpty() ? "event" : slug;
  }
}
