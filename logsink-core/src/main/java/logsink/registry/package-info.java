/**
 * Key and name registries backing every sink kind.
 *
 * <p>{@link logsink.registry.KeyRegistry} owns the sinks themselves and hands
 * out exclusive access through {@link logsink.registry.LockedResource};
 * {@link logsink.registry.NameRegistry} maps caller-chosen names to keys. Each
 * registry has its own lock. Contract violations are reported as subclasses of
 * {@link logsink.registry.SinkRegistryException}.
 *
 * @see logsink.registry.KeyRegistry
 * @see logsink.registry.NameRegistry
 * @see logsink.registry.LockedResource
 */
package logsink.registry;
