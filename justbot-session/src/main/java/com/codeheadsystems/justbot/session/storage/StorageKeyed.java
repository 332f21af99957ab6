package com.codeheadsystems.justbot.session.storage;

/**
 * Implemented by plugins that name their own {@link SessionStorage} slot instead of
 * using their class name.
 */
@FunctionalInterface
public interface StorageKeyed {

  /**
   * The slot this object reads and writes.
   *
   * @return the storage key, never null
   */
  StorageKey storageKey();
}
