package logsink.registry;

/**
 * Thrown when a lookup or finalization references a sink name that was never
 * reserved, has been removed, or is still waiting for its key.
 */
public final class UnknownNameException extends SinkRegistryException {

  private final String name;

  public UnknownNameException(String name) {
    this(name, "Unknown sink name: " + name);
  }

  public UnknownNameException(String name, String message) {
    super(message);
    this.name = name;
  }

  public String name() {
    return name;
  }
}
