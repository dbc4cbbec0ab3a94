package logsink.registry;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Secondary index from a caller-chosen sink name to its key.
 *
 * <p>Creating a named sink is a two-step affair: the name is first
 * {@linkplain #reserve reserved} (mapped to {@link KeyRegistry#INVALID_KEY}),
 * and only once the key exists is it {@linkplain #setKey finalized}. Two
 * callers racing for the same name therefore cannot both believe they created
 * it.
 *
 * <p>The registry has its own lock, independent of the {@link KeyRegistry}
 * lock, so name lookups never wait on a caller holding a sink accessor.
 *
 * <p>This class is thread-safe.
 */
public final class NameRegistry {
  private final ReentrantLock lock = new ReentrantLock(true);
  private final Map<String, Integer> nameToKey = new TreeMap<>();

  /**
   * Claims {@code name} before its key is known.
   *
   * @param name the sink name
   * @return {@code true} if reserved, {@code false} if the name already exists
   */
  public boolean reserve(String name) {
    Objects.requireNonNull(name, "name");
    lock.lock();
    try {
      if (nameToKey.containsKey(name)) {
        return false;
      }
      nameToKey.put(name, KeyRegistry.INVALID_KEY);
      return true;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Records the key for a reserved name, replacing any previous value.
   *
   * @param name a name previously passed to {@link #reserve}
   * @param key the key to record
   * @throws UnknownNameException if {@code name} was never reserved
   */
  public void setKey(String name, int key) {
    Objects.requireNonNull(name, "name");
    lock.lock();
    try {
      if (!nameToKey.containsKey(name)) {
        throw new UnknownNameException(name, "Sink name was never reserved: " + name);
      }
      nameToKey.put(name, key);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Returns the key recorded for {@code name}.
   *
   * @param name the sink name
   * @return the key, or {@link KeyRegistry#INVALID_KEY} while the reservation
   *     is not finalized
   * @throws UnknownNameException if {@code name} is absent
   */
  public int getKey(String name) {
    Objects.requireNonNull(name, "name");
    lock.lock();
    try {
      Integer key = nameToKey.get(name);
      if (key == null) {
        throw new UnknownNameException(name);
      }
      return key;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Deletes {@code name}. Does nothing if it is absent.
   *
   * @param name the sink name
   */
  public void remove(String name) {
    Objects.requireNonNull(name, "name");
    lock.lock();
    try {
      nameToKey.remove(name);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Deletes every name currently pointing at {@code key}.
   *
   * @param key a retired key
   * @return the number of names removed
   */
  public int removeKey(int key) {
    lock.lock();
    try {
      int before = nameToKey.size();
      nameToKey.values().removeIf(k -> k == key);
      return before - nameToKey.size();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Returns a sorted snapshot of all names, finalized or not.
   *
   * @return an unmodifiable set of names
   */
  public Set<String> names() {
    lock.lock();
    try {
      return Collections.unmodifiableSet(new TreeSet<>(nameToKey.keySet()));
    } finally {
      lock.unlock();
    }
  }

  public int size() {
    lock.lock();
    try {
      return nameToKey.size();
    } finally {
      lock.unlock();
    }
  }
}
