/**
 * The shared background worker that owns message delivery.
 *
 * <p>{@link logsink.worker.LogWorker} drains a bounded queue on a single daemon
 * thread and hands each message to every registered
 * {@link logsink.worker.MessageReceiver}, so sinks only ever see messages one at
 * a time and in submission order.
 */
package logsink.worker;
