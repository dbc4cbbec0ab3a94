package logsink;

/**
 * Severity of a {@link LogMessage}. The numeric values leave gaps so that
 * sinks can map ranges rather than single levels.
 */
public enum LogLevel {
  DEBUG(100),
  INFO(300),
  WARNING(500),
  FATAL(1000);

  private final int value;

  LogLevel(int value) {
    this.value = value;
  }

  public int value() {
    return value;
  }

  /**
   * Returns the level with the given numeric value.
   *
   * @param value a value returned by {@link #value()}
   * @return the matching level
   * @throws IllegalArgumentException if no level has that value
   */
  public static LogLevel ofValue(int value) {
    for (LogLevel level : values()) {
      if (level.value == value) {
        return level;
      }
    }
    throw new IllegalArgumentException("Unknown log level value: " + value);
  }
}
