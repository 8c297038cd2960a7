package dev.athenaeum.paper;

import java.util.Locale;
import java.util.Optional;
import org.jspecify.annotations.Nullable;

/** Bibliographic backends a {@link RawResult} can originate from, with their wire tags. */
public enum PaperSource {
  OPENALEX("openalex", true),
  CROSSREF("crossref", true),
  SEMANTIC_SCHOLAR("semantic_scholar", true),
  ARXIV("arxiv", true),
  CORE("core", true),
  INTERNAL("internal", false);

  private final String tag;
  private final boolean external;

  PaperSource(String tag, boolean external) {
    this.tag = tag;
    this.external = external;
  }

  public String tag() {
    return tag;
  }

  /** Whether the source is a third-party API (as opposed to the internal content store). */
  public boolean isExternal() {
    return external;
  }

  /**
   * Resolves a wire tag, case-insensitively. Hyphenated and compact spellings of {@code
   * semantic_scholar} are accepted.
   *
   * @param tag the tag supplied by a caller
   * @return the matching source, or empty for unknown or blank tags
   */
  public static Optional<PaperSource> fromTag(@Nullable String tag) {
    if (tag == null || tag.isBlank()) {
      return Optional.empty();
    }
    String normalized = tag.trim().toLowerCase(Locale.ROOT).replace('-', '_');
    if ("semanticscholar".equals(normalized)) {
      normalized = SEMANTIC_SCHOLAR.tag;
    }
    for (PaperSource source : values()) {
      if (source.tag.equals(normalized)) {
        return Optional.of(source);
      }
    }
    return Optional.empty();
  }
}
