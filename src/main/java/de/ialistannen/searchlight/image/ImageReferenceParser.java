package de.ialistannen.searchlight.image;

import java.util.Arrays;
import java.util.Optional;

/**
 * Splits raw image strings (as found in deployment requests) into registry, repository, tag and digest. Unqualified
 * names are resolved against Docker Hub, mirroring what the docker CLI does.
 */
public final class ImageReferenceParser {

  public static final String DEFAULT_REGISTRY = "docker.io";
  public static final String DEFAULT_TAG = "latest";

  private static final String DIGEST_MARKER = "@sha256:";

  private ImageReferenceParser() {
    throw new UnsupportedOperationException("No instantiation");
  }

  /**
   * Parses an image string. Never fails: shapes that are not understood are passed through as the repository.
   *
   * <ul>
   *   <li>{@code nginx} -> {@code docker.io/library/nginx:latest}</li>
   *   <li>{@code myuser/app:1} -> {@code docker.io/myuser/app:1}</li>
   *   <li>{@code gcr.io/project/app:v1} -> {@code gcr.io/project/app:v1}</li>
   *   <li>{@code nginx@sha256:abc} -> {@code docker.io/library/nginx@sha256:abc}</li>
   * </ul>
   *
   * @param raw the raw image string
   * @return the parsed reference
   */
  public static ImageReference parse(String raw) {
    String name = raw;
    Optional<String> digest = Optional.empty();

    int digestStart = name.indexOf(DIGEST_MARKER);
    if (digestStart >= 0) {
      digest = Optional.of("sha256:" + name.substring(digestStart + DIGEST_MARKER.length()));
      name = name.substring(0, digestStart);
    }

    // A colon before the last slash belongs to a registry port, not a tag
    String tag = DEFAULT_TAG;
    int tagStart = name.lastIndexOf(':');
    if (tagStart > name.lastIndexOf('/')) {
      tag = name.substring(tagStart + 1);
      name = name.substring(0, tagStart);
    }

    String[] parts = name.split("/", -1);
    String registry;
    String repository;

    if (parts.length == 1) {
      registry = DEFAULT_REGISTRY;
      repository = "library/" + parts[0];
    } else if (parts.length == 2) {
      if (looksLikeHost(parts[0])) {
        registry = parts[0];
        repository = parts[1];
      } else {
        registry = DEFAULT_REGISTRY;
        repository = parts[0] + "/" + parts[1];
      }
    } else {
      registry = parts[0];
      repository = String.join("/", Arrays.copyOfRange(parts, 1, parts.length));
    }

    return new ImageReference(registry, repository, tag, digest);
  }

  private static boolean looksLikeHost(String segment) {
    return segment.contains(".") || segment.contains(":");
  }
}
