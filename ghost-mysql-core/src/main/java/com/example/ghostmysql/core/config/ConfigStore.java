package com.example.ghostmysql.core.config;

import java.util.Optional;

/**
 * Persisted configuration of the host application, addressed with dotted keys such as {@code
 * database.connection.user}.
 *
 * <p>Changes made with {@link #set(String, String)} are only durable after {@link #save()}.
 */
public interface ConfigStore {

  /**
   * Reads a scalar value.
   *
   * @param key dotted key
   * @return the value as text, or empty when the key is absent or not a scalar
   */
  Optional<String> get(String key);

  /**
   * Sets a scalar value, creating intermediate sections as needed.
   *
   * @param key dotted key
   * @param value new value
   * @return this store, for chaining
   */
  ConfigStore set(String key, String value);

  /** Writes pending changes to the backing storage. */
  void save();
}
