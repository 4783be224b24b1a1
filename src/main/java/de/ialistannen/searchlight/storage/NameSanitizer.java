package de.ialistannen.searchlight.storage;

import java.util.regex.Pattern;

public final class NameSanitizer {

  private static final Pattern SEPARATORS = Pattern.compile("[/:@]");
  private static final Pattern INVALID = Pattern.compile("[^A-Za-z0-9._-]");

  private NameSanitizer() {
    throw new UnsupportedOperationException("No instantiation");
  }

  /**
   * Makes a name safe for use as a storage key. The result only contains {@code [A-Za-z0-9._-]}.
   *
   * @param name the name, e.g. an image name
   * @return the sanitized name
   */
  public static String sanitize(String name) {
    String result = SEPARATORS.matcher(name).replaceAll("_");
    return INVALID.matcher(result).replaceAll("_");
  }
}
