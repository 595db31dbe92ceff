package com.scholary.video.splitter.service;

import java.text.Normalizer;
import java.util.Locale;

/**
 * Reduces caller-supplied filenames to a safe, portable form.
 *
 * <p>The result holds only ASCII letters, digits, {@code .}, {@code _} and {@code -}, has no
 * directory components, and never starts with a dot. It may be empty.
 */
public final class FilenameSanitizer {

  private FilenameSanitizer() {}

  public static String sanitize(String filename) {
    if (filename == null) {
      return "";
    }
    String name = filename.replace('\\', '/');
    name = name.substring(name.lastIndexOf('/') + 1);
    name = Normalizer.normalize(name, Normalizer.Form.NFKD).replaceAll("[^\\p{ASCII}]", "");
    name = name.strip().replaceAll("\\s+", "_");
    name = name.replaceAll("[^A-Za-z0-9._-]", "");
    return name.replaceAll("^[._]+", "");
  }

  /** Lower-cased extension without the dot, or an empty string if there is none. */
  public static String extensionOf(String filename) {
    if (filename == null) {
      return "";
    }
    int dot = filename.lastIndexOf('.');
    if (dot <= 0 || dot == filename.length() - 1) {
      return "";
    }
    return filename.substring(dot + 1).toLowerCase(Locale.ROOT);
  }
}
