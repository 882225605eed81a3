package ca.gc.cra.syncbuf.validation;

import java.time.Duration;

/**
 * <strong>What:</strong> Numeric validation helpers used by buffer configuration, read tolerances, and CLI parsing.
 * <p><strong>Why:</strong> Rejects nonsensical capacities, timeouts, and tolerances before a buffer allocates
 * storage or starts its worker.
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Enforce inclusive numeric bounds declared in configuration schemas.</li>
 *   <li>Reject negative tolerances with consistent messages.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable stateless utility.
 * <p><strong>Observability:</strong> Emits no metrics or logs; throws {@link IllegalArgumentException} when
 * validation fails.
 *
 * @since 0.1.0
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
   * @param value candidate value expressed in the caller's units (e.g., entries, ms)
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
   * Validates that a value is zero or positive.
   *
   * @param name logical parameter name included in diagnostics
   * @param value candidate value
   * @return the validated value
   * @throws IllegalArgumentException if {@code value} is negative
   */
  public static long requireNonNegative(String name, long value) {
    if (value < 0) {
      throw new IllegalArgumentException(label(name) + " must not be negative (was " + value + ")");
    }
    return value;
  }

  /**
   * Validates that a duration is present and not negative.
   *
   * @param name logical parameter name included in diagnostics
   * @param value candidate duration
   * @return the validated duration
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if {@code value} is negative
   */
  public static Duration requireNonNegative(String name, Duration value) {
    if (value == null) {
      throw new NullPointerException(label(name));
    }
    if (value.isNegative()) {
      throw new IllegalArgumentException(label(name) + " must not be negative (was " + value + ")");
    }
    return value;
  }

  private static String label(String name) {
    return name == null || name.isBlank() ? "value" : name;
  }
}
