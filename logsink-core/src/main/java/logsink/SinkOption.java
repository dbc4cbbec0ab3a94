package logsink;

/**
 * Per-kind options applied by the {@link SinkAccess} façade.
 */
public enum SinkOption {
  /** More than one sink of the kind may be live at the same time. */
  MULTIPLE_INSTANCES
}
