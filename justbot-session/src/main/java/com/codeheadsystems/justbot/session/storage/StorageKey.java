package com.codeheadsystems.justbot.session.storage;

import java.util.Objects;

/**
 * Normalized name of a slot in a {@link SessionStorage}.
 *
 * @param name the slot name
 */
public record StorageKey(String name) {

  public StorageKey {
    Objects.requireNonNull(name, "name");
  }

  /**
   * Key for an explicit slot name.
   *
   * @param name the slot name
   * @return the storage key
   */
  public static StorageKey of(String name) {
    return new StorageKey(name);
  }

  /**
   * Key shared by every instance of the given type.
   *
   * @param type the type
   * @return the storage key named after the type's fully-qualified name
   */
  public static StorageKey forType(Class<?> type) {
    return new StorageKey(type.getName());
  }

  /**
   * Normalizes an arbitrary storage key argument.
   * <ul>
   *   <li>{@link String}: the key with that name</li>
   *   <li>{@link StorageKey}: itself</li>
   *   <li>{@link StorageKeyed}: the key the object names for itself</li>
   *   <li>anything else: the key for the object's class</li>
   * </ul>
   *
   * @param key the raw key
   * @return the normalized key
   */
  public static StorageKey from(Object key) {
    Objects.requireNonNull(key, "key");
    if (key instanceof String name) {
      return of(name);
    }
    if (key instanceof StorageKey storageKey) {
      return storageKey;
    }
    if (key instanceof StorageKeyed keyed) {
      return Objects.requireNonNull(keyed.storageKey(), "storageKey()");
    }
    return forType(key.getClass());
  }

  @Override
  public String toString() {
    return name;
  }
}
