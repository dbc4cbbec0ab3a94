package logsink.registry;

/**
 * Thrown when a second sink is created for a kind that allows a single live
 * instance only.
 */
public final class InstanceLimitExceededException extends SinkRegistryException {

  private final String kind;

  public InstanceLimitExceededException(String kind) {
    super("Only one " + kind + " sink may exist at a time");
    this.kind = kind;
  }

  public String kind() {
    return kind;
  }
}
