package logsink.registry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableSet;
import java.util.Objects;
import java.util.TreeSet;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Owns the mapping from integer key to an exclusively owned resource.
 *
 * <p>Keys are positive; {@link #INVALID_KEY} ({@code 0}) is never issued.
 * Retired keys are reused before new ones are minted, smallest first, which
 * keeps the key space compact and makes key values deterministic.
 *
 * <p>One fair lock guards every structure in the registry. It is held for the
 * duration of {@link #insert}, {@link #remove} and the lookups, and handed to
 * the caller by {@link #access}, which keeps it until the returned
 * {@link LockedResource} is closed.
 *
 * <p>This class is thread-safe.
 *
 * @param <T> the resource type
 */
public final class KeyRegistry<T> {
  private static final Logger logger = Logger.getLogger(KeyRegistry.class.getName());

  /** Sentinel meaning "no key". */
  public static final int INVALID_KEY = 0;

  private final ReentrantLock lock = new ReentrantLock(true);
  private final NavigableSet<Integer> inUse = new TreeSet<>();
  private final NavigableSet<Integer> free = new TreeSet<>();
  private final Map<Integer, T> resources = new HashMap<>();
  private int nextKey = INVALID_KEY + 1;

  /**
   * Takes ownership of a resource and returns the key it is stored under.
   *
   * @param resource the resource, never shared with the caller afterwards
   * @return a key that was free or has never been issued
   * @throws IllegalStateException if the key space is exhausted
   */
  public int insert(T resource) {
    Objects.requireNonNull(resource, "resource");
    lock.lock();
    try {
      int key;
      if (!free.isEmpty()) {
        key = free.pollFirst();
      } else {
        if (nextKey == INVALID_KEY) {
          throw new IllegalStateException("Sink key space exhausted");
        }
        key = nextKey;
        // wraps to INVALID_KEY after Integer.MAX_VALUE, which marks exhaustion
        nextKey = key == Integer.MAX_VALUE ? INVALID_KEY : key + 1;
      }
      inUse.add(key);
      resources.put(key, resource);
      return key;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Locks the registry and exposes the resource stored under {@code key}.
   *
   * @param key a key returned by {@link #insert}
   * @return an accessor holding the registry lock
   * @throws InvalidKeyException if {@code key} is not in use
   */
  public LockedResource<T> access(int key) {
    lock.lock();
    T resource = resources.get(key);
    if (resource == null) {
      lock.unlock();
      throw new InvalidKeyException(key);
    }
    return LockedResource.adopt(lock, resource);
  }

  /**
   * Retires {@code key} and gives the resource back so the caller can release
   * it outside the registry lock.
   *
   * @param key the key to retire
   * @return the resource that was stored under {@code key}
   * @throws InvalidKeyException if {@code key} is not in use
   */
  public T remove(int key) {
    lock.lock();
    try {
      if (!inUse.contains(key)) {
        throw new InvalidKeyException(key);
      }
      T removed = resources.remove(key);
      inUse.remove(key);
      free.add(key);
      logger.log(Level.FINE, "Retired sink key {0}", key);
      return removed;
    } finally {
      lock.unlock();
    }
  }

  public boolean contains(int key) {
    lock.lock();
    try {
      return inUse.contains(key);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Returns a snapshot of the keys in use, in ascending order.
   *
   * @return an unmodifiable list of live keys
   */
  public List<Integer> keys() {
    lock.lock();
    try {
      return Collections.unmodifiableList(new ArrayList<>(inUse));
    } finally {
      lock.unlock();
    }
  }

  public int size() {
    lock.lock();
    try {
      return inUse.size();
    } finally {
      lock.unlock();
    }
  }
}
