package de.ialistannen.searchlight.image;

import java.util.Optional;

/**
 * A normalized container image reference.
 *
 * @param registry the registry host, e.g. {@code docker.io} or {@code us-docker.pkg.dev}
 * @param repository the repository path inside the registry, e.g. {@code library/nginx}
 * @param tag the tag, {@code latest} if none was given
 * @param digest the digest including its {@code sha256:} prefix, if the reference was pinned
 */
public record ImageReference(String registry, String repository, String tag, Optional<String> digest) {

  /**
   * The canonical name of the image. Digest references use the {@code @} form and drop the tag.
   *
   * @return the canonical name
   */
  public String fullName() {
    if (digest().isPresent()) {
      return registry() + "/" + repository() + "@" + digest().get();
    }
    return registry() + "/" + repository() + ":" + tag();
  }

  @Override
  public String toString() {
    return fullName();
  }
}
