/**
 * Reference-counted singleton lifecycle.
 *
 * <p>{@link logsink.lifecycle.SharedSingleton} builds its instance exactly once
 * per lifetime and tears it down either at process exit (keep-alive policy) or
 * when the last {@link logsink.lifecycle.SharedRef} is closed (scope-bound
 * policy). The policy is fixed by the first successful construction.
 */
package logsink.lifecycle;
