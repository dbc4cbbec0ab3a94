package logsink.registry;

/**
 * Thrown when a sink is created under a name that another sink of the same
 * kind already claims.
 */
public final class NameAlreadyExistsException extends SinkRegistryException {

  private final String name;

  public NameAlreadyExistsException(String name) {
    super("Sink name already exists: " + name);
    this.name = name;
  }

  public String name() {
    return name;
  }
}
