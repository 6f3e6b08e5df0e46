package io.webber.domain.archive;

import java.nio.file.Path;
import java.util.Objects;

/**
 * One member of the outer package container: a staged file and the name it is stored under.
 *
 * @param source file whose bytes become the member body
 * @param name member name; ASCII without {@code '/'} and at most 16 bytes
 * @since 0.1.0
 */
public record ArchiveMember(Path source, String name) {
  /** Longest member name the container format stores inline. */
  public static final int MAX_NAME_LENGTH = 16;

  public ArchiveMember {
    Objects.requireNonNull(source, "source");
    Objects.requireNonNull(name, "name");
    if (name.isEmpty() || name.length() > MAX_NAME_LENGTH) {
      throw new IllegalArgumentException("member name must be 1.." + MAX_NAME_LENGTH + " chars: " + name);
    }
    for (int i = 0; i < name.length(); i++) {
      char c = name.charAt(i);
      if (c < 0x21 || c > 0x7E || c == '/') {
        throw new IllegalArgumentException("member name contains unsupported character: " + name);
      }
    }
  }
}
