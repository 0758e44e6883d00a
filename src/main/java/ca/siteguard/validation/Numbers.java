package ca.siteguard.validation;

/**
 * <strong>What:</strong> Numeric validation helpers used by SiteGuard configuration parsing and domain records.
 * <p><strong>Why:</strong> Guards against invalid thresholds, weights and timeouts before the orchestrator
 * allocates executors or starts a session.</p>
 * <p><strong>Role:</strong> Cross-cutting support utilities invoked by records, loaders and the config layer.</p>
 * <p><strong>Thread-safety:</strong> Immutable stateless utility.</p>
 * <p><strong>Observability:</strong> Emits no metrics or logs; throws {@link IllegalArgumentException} when
 * validation fails.</p>
 *
 * @since SiteGuard 0.1
 * @see Strings
 */
public final class Numbers {
  private Numbers() {
    // Utility
  }

  /**
   * Validates that a numeric value falls within an inclusive range.
   *
   * @param name logical parameter name included in diagnostics; defaults to {@code "value"} when blank
   * @param value candidate value expressed in the caller's units (e.g., ms, calls)
   * @param min minimum inclusive value in the same units as {@code value}
   * @param max maximum inclusive value in the same units as {@code value}
   * @return the validated value for fluent call sites
   * @throws IllegalArgumentException if {@code value} lies outside {@code [min, max]}
   */
  public static long requireRange(String name, long value, long min, long max) {
    if (value < min || value > max) {
      throw new IllegalArgumentException(
          label(name) + " must be between " + min + " and " + max + " (was " + value + ")");
    }
    return value;
  }

  /**
   * Validates that a floating-point value is finite and falls within an inclusive range.
   *
   * @param name logical parameter name included in diagnostics
   * @param value candidate value
   * @param min minimum inclusive value
   * @param max maximum inclusive value
   * @return the validated value
   * @throws IllegalArgumentException if {@code value} is NaN, infinite or outside {@code [min, max]}
   */
  public static double requireRange(String name, double value, double min, double max) {
    if (!Double.isFinite(value) || value < min || value > max) {
      throw new IllegalArgumentException(
          label(name) + " must be between " + min + " and " + max + " (was " + value + ")");
    }
    return value;
  }

  /**
   * Validates a confidence or rate in {@code [0, 1]}.
   *
   * @param name logical parameter name included in diagnostics
   * @param value candidate value
   * @return the validated value
   * @throws IllegalArgumentException if {@code value} is outside the unit interval
   */
  public static double requireUnitInterval(String name, double value) {
    return requireRange(name, value, 0d, 1d);
  }

  /**
   * Validates a strictly positive, finite value such as a backend weight.
   *
   * @param name logical parameter name included in diagnostics
   * @param value candidate value
   * @return the validated value
   * @throws IllegalArgumentException if {@code value} is not finite or not greater than zero
   */
  public static double requirePositive(String name, double value) {
    if (!Double.isFinite(value) || value <= 0d) {
      throw new IllegalArgumentException(label(name) + " must be positive (was " + value + ")");
    }
    return value;
  }

  private static String label(String name) {
    return name == null || name.isBlank() ? "value" : name;
  }
}
