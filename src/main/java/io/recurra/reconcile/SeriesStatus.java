package io.recurra.reconcile;

import java.util.Optional;

/** Lifecycle state of a series template. */
public enum SeriesStatus {
  /** Instances are generated and extended. */
  ACTIVE("active"),
  /** Existing instances stay; nothing new is generated until resumed. */
  PAUSED("paused"),
  /** The series is over; nothing new is generated. */
  ENDED("ended");

  private final String value;

  SeriesStatus(String value) {
    this.value = value;
  }

  /**
   * Returns the stored name.
   *
   * @return the lowercase name
   */
  public String value() {
    return value;
  }

  /**
   * Parses a stored name (case insensitive).
   *
   * @param s the string to parse
   * @return the status if valid
   */
  public static Optional<SeriesStatus> parse(String s) {
    for (SeriesStatus status : values()) {
      if (status.value.equalsIgnoreCase(s)) {
        return Optional.of(status);
      }
    }
    return Optional.empty();
  }

  @Override
  public String toString() {
    return value;
  }
}
