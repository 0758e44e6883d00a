package ca.siteguard.api;

/**
 * Process exit codes returned by the SiteGuard CLI.
 *
 * @since SiteGuard 0.1
 */
public enum ExitCode {
  /** Command completed. */
  SUCCESS(0),
  /** Arguments were missing or malformed. */
  INVALID_ARGS(2),
  /** A file could not be read or written. */
  IO_ERROR(3),
  /** Configuration or taxonomy content was invalid. */
  CONFIG_ERROR(4),
  /** The command ran but did not succeed. */
  RUNTIME_FAILURE(5),
  /** The process was interrupted. */
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }
}
