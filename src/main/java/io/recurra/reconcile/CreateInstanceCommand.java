package io.recurra.reconcile;

import io.recurra.calendar.CalendarDate;

/**
 * A request to the store to create one instance. {@code (seriesId, instanceDate)} is the natural
 * key; a store that enforces it makes replays of the same command harmless.
 *
 * @param seriesId the owning series
 * @param instanceDate the generated date
 * @param slug the unique slug for the instance
 * @param isException always false for generated instances
 */
public record CreateInstanceCommand(
    String seriesId, CalendarDate instanceDate, String slug, boolean isException) {

  /**
   * Creates a command for a generated, non-exception instance.
   *
   * @param seriesId the owning series
   * @param instanceDate the generated date
   * @param slug the slug
   * @return a new command
   */
  public static CreateInstanceCommand generated(
      String seriesId, CalendarDate instanceDate, String slug) {
    return new CreateInstanceCommand(seriesId, instanceDate, slug, false);
  }
}
