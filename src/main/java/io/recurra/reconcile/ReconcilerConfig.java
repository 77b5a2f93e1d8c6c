package io.recurra.reconcile;

/**
 * How far ahead each reconciliation reaches, in months from "today".
 *
 * @param initialHorizonMonths horizon for the first materialization of a series
 * @param extendHorizonMonths horizon for extending a series
 * @param regenerateHorizonMonths horizon for regenerating a series
 */
public record ReconcilerConfig(
    int initialHorizonMonths, int extendHorizonMonths, int regenerateHorizonMonths) {

  /** Rejects negative horizons. */
  public ReconcilerConfig {
    if (initialHorizonMonths < 0 || extendHorizonMonths < 0 || regenerateHorizonMonths < 0) {
      throw new IllegalArgumentException("horizons must not be negative");
    }
  }

  /**
   * Returns the defaults: 3 months initially, 6 months when extending, 3 when regenerating.
   *
   * @return the default configuration
   */
  public static ReconcilerConfig defaults() {
    return new ReconcilerConfig(3, 6, 3);
  }

  /**
   * Returns a copy with the specified initial horizon.
   *
   * @param months the horizon in months
   * @return a new configuration
   */
  public ReconcilerConfig withInitialHorizonMonths(int months) {
    return new ReconcilerConfig(months, extendHorizonMonths, regenerateHorizonMonths);
  }

  /**
   * Returns a copy with the specified extension horizon.
   *
   * @param months the horizon in months
   * @return a new configuration
   */
  public ReconcilerConfig withExtendHorizonMonths(int months) {
    return new ReconcilerConfig(initialHorizonMonths, months, regenerateHorizonMonths);
  }

  /**
   * Returns a copy with the specified regeneration horizon.
   *
   * @param months the horizon in months
   * @return a new configuration
   */
  public ReconcilerConfig withRegenerateHorizonMonths(int months) {
    return new ReconcilerConfig(initialHorizonMonths, extendHorizonMonths, months);
  }
}
