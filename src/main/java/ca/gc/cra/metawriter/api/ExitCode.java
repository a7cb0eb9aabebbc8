package ca.gc.cra.metawriter.api;

/**
 * <strong>What:</strong> Process exit codes shared by the metawriter commands.
 * <p><strong>Why:</strong> Scripts driving replays react to the class of failure, not to log text.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Successful execution. */
  SUCCESS(0),
  /** Command-line arguments were invalid. */
  INVALID_ARGS(2),
  /** An input or store file could not be read or written. */
  IO_ERROR(3),
  /** Configuration was missing or malformed. */
  CONFIG_ERROR(4),
  /** Unexpected runtime failure. */
  RUNTIME_FAILURE(5),
  /** Process was interrupted. */
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * Returns the numeric process status.
   *
   * @return exit status
   */
  public int code() {
    return code;
  }
}
