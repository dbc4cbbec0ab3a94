package logsink.registry;

/**
 * Thrown when an operation references a key that is not currently in use,
 * either because it was never issued or because its sink has been removed.
 */
public final class InvalidKeyException extends SinkRegistryException {

  private final int key;

  public InvalidKeyException(int key) {
    super("Sink key not in use: " + key);
    this.key = key;
  }

  public int key() {
    return key;
  }
}
