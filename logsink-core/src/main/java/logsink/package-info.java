/**
 * Root API for logsink: a process-wide registry of log sinks fed by a single
 * background worker.
 *
 * <h2>Core Design</h2>
 * <p>Messages are queued on the {@linkplain logsink.worker.LogWorker worker}
 * through {@link logsink.SinkManager#log}. The worker thread hands every message
 * to each {@linkplain logsink.SinkAccess sink façade}, which delivers it to every
 * live sink of its kind while holding that kind's registry lock.
 *
 * <p>Sinks are owned by a {@linkplain logsink.registry.KeyRegistry key registry}
 * and optionally indexed by name. Callers never hold a sink directly: they get
 * a {@link logsink.SinkHandle} carrying the sink's key and a counted reference to
 * the manager, and every operation through the handle locks the sink for its
 * duration. A handle to a removed sink fails with
 * {@link logsink.registry.InvalidKeyException}.
 *
 * <h2>Module Layout</h2>
 * <ul>
 *   <li><b>logsink-core</b>: manager, façades, registries, worker and the
 *       built-in sinks (zero external deps)</li>
 *   <li><b>logsink-micrometer</b>: Micrometer bridge for the
 *       {@link logsink.spi.MetricsExporter} SPI</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * try (SharedRef<SinkManager> ref = SinkManager.getInstance(false)) {
 *     SinkManager manager = ref.get();
 *
 *     LogRotateSinkHandle file = manager.logRotateSinks()
 *         .newSink("app", () -> new LogRotateSink(Path.of("/var/log/app"), "app"));
 *     file.setMaxLogSize(5 * 1024 * 1024);
 *     file.setFlushPolicy(1);
 *
 *     manager.colorTermSinks().newSink(() -> new ColorTermSink(System.out)).close();
 *     manager.log(LogLevel.INFO, "service started");
 *     file.close();
 * }
 * }</pre>
 *
 * @see logsink.SinkManager
 * @see logsink.SinkAccess
 * @see logsink.SinkHandle
 * @see logsink.SinkKind
 * @see logsink.LogMessage
 */
package logsink;
