package de.ialistannen.searchlight.storage;

import java.io.IOException;
import java.util.Optional;

/**
 * Stores opaque text documents under slash separated keys.
 */
public interface BlobStore {

  /**
   * Creates the underlying container (bucket, directory) if it does not exist yet.
   *
   * @throws IOException if the container can not be created
   */
  void ensureExists() throws IOException;

  /**
   * Stores a document, replacing any previous one with the same key.
   *
   * @param key the key, e.g. {@code docker.io_library_nginx_latest/1234.json}
   * @param content the content
   * @throws IOException if writing fails
   */
  void put(String key, String content) throws IOException;

  /**
   * @param key the key
   * @return the stored document, if any
   * @throws IOException if reading fails
   */
  Optional<String> get(String key) throws IOException;
}
