package io.recurra.reconcile;

import io.recurra.calendar.CalendarDate;
import java.util.Objects;

/**
 * What the reconciler needs to know about an instance already in the store.
 *
 * @param id the instance id
 * @param instanceDate the date the instance was generated for
 * @param slug the instance slug (may be null)
 * @param hasRegistrations whether anything depends on the instance
 * @param isException whether the instance content was edited away from the template
 */
public record ExistingInstance(
    String id,
    CalendarDate instanceDate,
    String slug,
    boolean hasRegistrations,
    boolean isException) {

  /** Requires an id and a date. */
  public ExistingInstance {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(instanceDate, "instanceDate");
  }

  /**
   * Creates a plain instance with no slug, registrations or edits.
   *
   * @param id the instance id
   * @param instanceDate the instance date
   * @return a new instance view
   */
  public static ExistingInstance of(String id, CalendarDate instanceDate) {
    return new ExistingInstance(id, instanceDate, null, false, false);
  }

  /**
   * Returns a copy marked as having registrations.
   *
   * @return a new instance view
   */
  public ExistingInstance withRegistrations() {
    return new ExistingInstance(id, instanceDate, slug, true, isException);
  }

  /**
   * Returns a copy marked as an exception.
   *
   * @return a new instance view
   */
  public ExistingInstance asException() {
    return new ExistingInstance(id, instanceDate, slug, hasRegistrations, true);
  }

  /**
   * Returns a copy with a slug.
   *
   * @param slug the slug
   * @return a new instance view
   */
  public ExistingInstance withSlug(String slug) {
    return new ExistingInstance(id, instanceDate, slug, hasRegistrations, isException);
  }

  /**
   * Returns whether the instance falls on or after the given day.
   *
   * @param today the reference day
   * @return true for today and later
   */
  public boolean isUpcoming(CalendarDate today) {
    return !instanceDate.isBefore(today);
  }

  /**
   * Returns whether template-driven changes must leave this instance alone.
   *
   * @return true if it has registrations or is an exception
   */
  public boolean isPinned() {
    return hasRegistrations || isException;
  }
}
