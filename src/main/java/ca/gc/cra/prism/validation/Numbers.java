package ca.gc.cra.prism.validation;

/**
 * Range checks for ports, timeouts and filter arguments.
 *
 * @since 0.1.0
 * @see Strings
 */
public final class Numbers {
  private Numbers() {
    // Utility
  }

  /**
   * Checks that {@code value} lies in {@code [min, max]}.
   *
   * @param name argument name used in messages
   * @param value candidate value
   * @param min lowest accepted value
   * @param max highest accepted value
   * @return {@code value}
   * @throws IllegalArgumentException if the value is out of range
   */
  public static long requireRange(String name, long value, long min, long max) {
    if (value >= min && value <= max) {
      return value;
    }
    String label = Strings.isBlank(name) ? "value" : name;
    throw new IllegalArgumentException(label + " must be between " + min + " and " + max + " (was " + value + ")");
  }

  /**
   * Parses decimal text such as {@code port=8888} or a filter argument, then range-checks it.
   *
   * @throws IllegalArgumentException if the text is blank, not an integer or out of range
   */
  public static int parseInRange(String name, String raw, int min, int max) {
    String text = Strings.requireNonBlank(name, raw);
    int parsed;
    try {
      parsed = Integer.parseInt(text);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(name + " must be numeric (was " + text + ")", ex);
    }
    return (int) requireRange(name, parsed, min, max);
  }
}
