package ca.gc.cra.courier.api;

/**
 * <strong>What:</strong> Process exit codes returned by courier commands.
 * <p><strong>Why:</strong> Lets operators and scripts tell argument mistakes from broker failures.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Successful execution. */
  SUCCESS(0),
  /** Command-line arguments were invalid. */
  INVALID_ARGS(2),
  /** A configuration file could not be read. */
  IO_ERROR(3),
  /** Configuration was missing or malformed. */
  CONFIG_ERROR(4),
  /** Broker or runtime failure. */
  RUNTIME_FAILURE(5),
  /** Stopped by a signal (for example SIGINT). */
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * Returns the numeric process status.
   *
   * @return numeric exit code
   */
  public int code() {
    return code;
  }
}
