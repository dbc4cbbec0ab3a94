package logsink.worker;

import logsink.LogMessage;

/**
 * Destination the {@link LogWorker} hands every message to. Each sink kind's
 * {@link logsink.SinkAccess} façade is one receiver.
 *
 * <p>Receivers run on the worker thread, one message at a time, in
 * registration order. They should not throw: a failure is logged and the
 * next receiver still gets the message.
 */
@FunctionalInterface
public interface MessageReceiver {

  /**
   * Delivers one message.
   *
   * @param message the message to deliver
   */
  void receive(LogMessage message);
}
