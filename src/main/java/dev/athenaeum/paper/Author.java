package dev.athenaeum.paper;

import org.jspecify.annotations.Nullable;

/**
 * A paper author as reported by a source. Vendors that omit the name yield {@link #UNKNOWN_NAME}.
 *
 * @param name display name, never blank
 */
public record Author(String name) {

  /** Placeholder used when a vendor author object carries no usable name. */
  public static final String UNKNOWN_NAME = "N/A";

  public Author {
    if (name == null || name.isBlank()) {
      name = UNKNOWN_NAME;
    } else {
      name = name.trim();
    }
  }

  public static Author of(@Nullable String name) {
    return new Author(name);
  }
}
