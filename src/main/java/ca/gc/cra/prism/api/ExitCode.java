package ca.gc.cra.prism.api;

/**
 * <strong>What:</strong> Process exit codes returned by the PRISM command line.
 * <p><strong>Why:</strong> Lets supervisors tell argument, configuration, binding and resolution failures
 * apart without parsing logs.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Clean exit, including shutdown after an interruption. */
  SUCCESS(0),
  /** Command-line arguments were invalid. */
  INVALID_ARGS(2),
  /** The listening socket could not be acquired. */
  IO_ERROR(3),
  /** Configuration was malformed or failed startup validation. */
  CONFIG_ERROR(4),
  /** Unexpected runtime failure. */
  RUNTIME_FAILURE(5),
  /** A configured component or application name is unknown. */
  RESOLUTION_ERROR(6);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * Returns the numeric value reported to the operating system.
   *
   * @return numeric exit code
   */
  public int code() {
    return code;
  }
}
