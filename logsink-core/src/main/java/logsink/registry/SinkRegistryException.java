package logsink.registry;

/**
 * Base class for contract violations reported by the sink registries and the
 * {@link logsink.SinkAccess} façade.
 *
 * <p>These are programming errors on the caller's side, not transient faults:
 * they are thrown synchronously and never retried. A registry that throws one
 * of these is left exactly as it was before the call.
 */
public abstract class SinkRegistryException extends RuntimeException {

  protected SinkRegistryException(String message) {
    super(message);
  }
}
