package de.ialistannen.searchlight.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A {@link MetadataStore} that keeps one json document per scan id in a directory. Queries read every document, which
 * is fine for the number of scans a single deployment pipeline produces.
 */
public class FileMetadataStore implements MetadataStore {

  private static final Logger LOGGER = LoggerFactory.getLogger(FileMetadataStore.class);

  private final Path directory;
  private final ObjectMapper objectMapper;

  public FileMetadataStore(Path directory, ObjectMapper objectMapper) {
    this.directory = directory;
    this.objectMapper = objectMapper;
  }

  /**
   * Writes the entry. The document is written to a temporary file first and then moved into place, so readers never
   * see a partial document.
   */
  @Override
  public void put(ScanIndexEntry entry) throws IOException {
    Files.createDirectories(directory);
    Path target = directory.resolve(NameSanitizer.sanitize(entry.scanId()) + ".json");
    Path temp = Files.createTempFile(directory, ".scan-", ".tmp");
    try {
      Files.writeString(temp, objectMapper.writeValueAsString(entry), StandardCharsets.UTF_8);
      Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE);
    } finally {
      Files.deleteIfExists(temp);
    }
  }

  @Override
  public List<ScanIndexEntry> findRecent(String sanitizedImageName, Instant since, int limit) throws IOException {
    if (Files.notExists(directory)) {
      return List.of();
    }

    List<ScanIndexEntry> matches = new ArrayList<>();
    try (Stream<Path> files = Files.list(directory)) {
      for (Path file : (Iterable<Path>) files::iterator) {
        if (!file.getFileName().toString().endsWith(".json")) {
          continue;
        }
        Optional<ScanIndexEntry> read = read(file);
        if (read.isEmpty()) {
          continue;
        }
        ScanIndexEntry entry = read.get();
        if (!sanitizedImageName.equals(entry.sanitizedImageName())) {
          continue;
        }
        if (entry.timestamp() == null || entry.timestamp().isBefore(since)) {
          continue;
        }
        matches.add(entry);
      }
    } catch (UncheckedIOException e) {
      throw e.getCause();
    }

    return matches.stream()
      .sorted(Comparator.comparing(ScanIndexEntry::timestamp).reversed())
      .limit(limit)
      .toList();
  }

  private Optional<ScanIndexEntry> read(Path file) throws IOException {
    try {
      return Optional.of(objectMapper.readValue(Files.readString(file, StandardCharsets.UTF_8), ScanIndexEntry.class));
    } catch (JsonProcessingException | CharacterCodingException e) {
      LOGGER.warn("Skipping unreadable scan metadata {}", file, e);
      return Optional.empty();
    } catch (NoSuchFileException e) {
      LOGGER.debug("Scan metadata {} vanished while reading", file);
      return Optional.empty();
    }
  }
}
