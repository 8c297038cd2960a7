package dev.athenaeum.paper;

import java.util.Locale;
import java.util.regex.Pattern;
import org.jspecify.annotations.Nullable;

/**
 * Static normalisation helpers shared by identifier generation, deduplication and caching.
 *
 * <p>All functions are idempotent: applying them twice yields the same value as applying them
 * once.
 */
public final class PaperNormalizer {

  private static final Pattern NON_WORD = Pattern.compile("[^\\p{L}\\p{N}\\s]");
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");
  private static final Pattern DOI_URL_PREFIX =
      Pattern.compile("^https?://(dx\\.)?doi\\.org/", Pattern.CASE_INSENSITIVE);
  private static final Pattern DOI_SCHEME_PREFIX =
      Pattern.compile("^doi:\\s*", Pattern.CASE_INSENSITIVE);
  private static final Pattern ARXIV_URL =
      Pattern.compile("^https?://(www\\.|export\\.)?arxiv\\.org/(abs|pdf)/", Pattern.CASE_INSENSITIVE);

  private PaperNormalizer() {}

  /**
   * Lowercases, strips punctuation and collapses whitespace.
   *
   * @param title raw title, may be null
   * @return normalised title, empty string for null input
   */
  public static String normalizeTitle(@Nullable String title) {
    if (title == null) {
      return "";
    }
    String lower = title.toLowerCase(Locale.ROOT);
    String stripped = NON_WORD.matcher(lower).replaceAll("");
    return WHITESPACE.matcher(stripped).replaceAll(" ").trim();
  }

  /**
   * Lowercases a DOI and strips {@code https://doi.org/}, {@code http://dx.doi.org/} and {@code
   * doi:} prefixes.
   *
   * @param doi raw DOI as reported by a vendor
   * @return the bare DOI, or null when the input is null or blank
   */
  public static @Nullable String normalizeDoi(@Nullable String doi) {
    if (doi == null) {
      return null;
    }
    String value = doi.trim();
    value = DOI_URL_PREFIX.matcher(value).replaceFirst("");
    value = DOI_SCHEME_PREFIX.matcher(value).replaceFirst("");
    value = value.trim().toLowerCase(Locale.ROOT);
    return value.isEmpty() ? null : value;
  }

  /** Author names compare like titles: case, punctuation and spacing are ignored. */
  public static String normalizeAuthor(@Nullable String name) {
    if (name == null || Author.UNKNOWN_NAME.equals(name)) {
      return "";
    }
    return normalizeTitle(name);
  }

  /** Whether a URL points at an arXiv abstract or PDF page. */
  public static boolean isArxivUrl(@Nullable String url) {
    return url != null && ARXIV_URL.matcher(url.trim()).find();
  }
}
