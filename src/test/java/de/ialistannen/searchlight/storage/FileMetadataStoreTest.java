package de.ialistannen.searchlight.storage;

import static org.assertj.core.api.Assertions.assertThat;

import de.ialistannen.searchlight.result.ScanStatus;
import de.ialistannen.searchlight.util.JsonMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileMetadataStoreTest {

  private static final Instant NOW = Instant.parse("2026-10-19T10:00:00Z");

  @TempDir
  Path tempDir;

  private FileMetadataStore store;

  @BeforeEach
  void setUp() {
    store = new FileMetadataStore(tempDir, JsonMapper.create());
  }

  @Test
  void unreadableSiblingIsSkipped() throws IOException {
    store.put(entry("scan-1", "docker.io_library_nginx_latest", NOW));
    Files.writeString(tempDir.resolve("other-scan.json"), "{\"scan_id\": \"other-scan\", \"sanitized_im");

    List<ScanIndexEntry> recent = store.findRecent("docker.io_library_nginx_latest", NOW.minusSeconds(60), 1);

    assertThat(recent).extracting(ScanIndexEntry::scanId).containsExactly("scan-1");
  }

  @Test
  void newestMatchesComeFirst() throws IOException {
    store.put(entry("old", "img", NOW.minusSeconds(30)));
    store.put(entry("new", "img", NOW));
    store.put(entry("other", "other-img", NOW));

    assertThat(store.findRecent("img", NOW.minusSeconds(60), 5))
      .extracting(ScanIndexEntry::scanId)
      .containsExactly("new", "old");
  }

  @Test
  void writesLeaveNoTemporaryFiles() throws IOException {
    store.put(entry("scan-1", "img", NOW));
    store.put(entry("scan-1", "img", NOW.plusSeconds(1)));

    try (Stream<Path> files = Files.list(tempDir)) {
      assertThat(files).extracting(it -> it.getFileName().toString()).containsExactly("scan-1.json");
    }
    assertThat(store.findRecent("img", NOW, 1)).extracting(ScanIndexEntry::timestamp)
      .containsExactly(NOW.plusSeconds(1));
  }

  private static ScanIndexEntry entry(String scanId, String sanitizedName, Instant timestamp) {
    return new ScanIndexEntry(
      scanId,
      "nginx",
      "docker.io/library/nginx:latest",
      timestamp,
      ScanStatus.COMPLETED,
      "cloudrun",
      0,
      0,
      0,
      0,
      0,
      0,
      0,
      sanitizedName + "/" + scanId + ".json",
      sanitizedName
    );
  }
}
