package de.ialistannen.searchlight.storage;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A {@link BlobStore} backed by a directory. Keys map to relative paths below it.
 */
public class FileBlobStore implements BlobStore {

  private static final Logger LOGGER = LoggerFactory.getLogger(FileBlobStore.class);

  private final Path root;

  public FileBlobStore(Path root) {
    this.root = root.toAbsolutePath().normalize();
  }

  @Override
  public void ensureExists() throws IOException {
    if (Files.isDirectory(root)) {
      LOGGER.debug("Result store {} already exists", root);
      return;
    }
    Files.createDirectories(root);
    LOGGER.info("Created result store {}", root);
  }

  @Override
  public void put(String key, String content) throws IOException {
    Path target = resolve(key);
    Files.createDirectories(target.getParent());
    Files.writeString(target, content, StandardCharsets.UTF_8);
  }

  @Override
  public Optional<String> get(String key) throws IOException {
    Path target = resolve(key);
    if (Files.notExists(target)) {
      return Optional.empty();
    }
    return Optional.of(Files.readString(target, StandardCharsets.UTF_8));
  }

  private Path resolve(String key) {
    Path resolved = root.resolve(key).normalize();
    if (!resolved.startsWith(root) || resolved.equals(root)) {
      throw new IllegalArgumentException("Key '" + key + "' does not point into " + root);
    }
    return resolved;
  }
}
