package com.codeheadsystems.justbot.session.storage;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Per-session key-value area, partitioned per plugin.
 * <p>
 * Every key argument is normalized through {@link StorageKey#from(Object)}, so a plugin
 * can pass itself and all instances of that plugin share one slot. Lives exactly as long
 * as the owning session. Safe for concurrent use.
 */
public class SessionStorage {

  private static final Logger log = LoggerFactory.getLogger(SessionStorage.class);

  private final ConcurrentHashMap<StorageKey, Object> storage = new ConcurrentHashMap<>();

  /**
   * Returns the value stored under the key.
   *
   * @param key a name, a {@link StorageKey}, a {@link StorageKeyed} or any object
   * @return the value, or empty if the slot was never set
   */
  public Optional<Object> get(Object key) {
    return Optional.ofNullable(storage.get(StorageKey.from(key)));
  }

  /**
   * Returns the value stored under the key, cast to the given type.
   *
   * @param key  the raw key
   * @param type expected value type
   * @param <T>  the value type
   * @return the value, or empty if the slot was never set
   * @throws ClassCastException if the slot holds a value of another type
   */
  public <T> Optional<T> get(Object key, Class<T> type) {
    return get(key).map(type::cast);
  }

  /**
   * Stores the value under the key, replacing whatever was there. A null value clears the slot.
   *
   * @param key   the raw key
   * @param value the value
   */
  public void set(Object key, Object value) {
    StorageKey storageKey = StorageKey.from(key);
    if (value == null) {
      storage.remove(storageKey);
    } else {
      storage.put(storageKey, value);
    }
    log.debug("set({})", storageKey);
  }

  /**
   * Clears the slot.
   *
   * @param key the raw key
   * @return the previous value, if any
   */
  public Optional<Object> remove(Object key) {
    return Optional.ofNullable(storage.remove(StorageKey.from(key)));
  }

  /**
   * Snapshot of every slot, for introspection by the host.
   *
   * @return an unmodifiable copy of the storage
   */
  public Map<StorageKey, Object> all() {
    return Map.copyOf(storage);
  }
}
