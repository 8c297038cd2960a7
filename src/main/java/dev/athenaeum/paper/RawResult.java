package dev.athenaeum.paper;

import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * One paper as reported by one source, before ranking and deduplication.
 *
 * <p>{@code canonicalId} is derived from the normalised DOI when present, else from {@code
 * normalizedTitle|normalizedFirstAuthor|year} (see {@link CanonicalIds}). Use {@link #builder()}
 * to have it computed; the canonical constructor accepts an explicit id for callers that already
 * hold one.
 *
 * @param title paper title, never blank
 * @param authors ordered author list, possibly empty
 * @param year publication year, null when the source gives no date
 * @param abstractText abstract, null when the source gives none
 * @param venue journal, conference or repository name
 * @param doi DOI as reported by the vendor (not normalised)
 * @param url landing page
 * @param pdfUrl direct link to a full-text PDF
 * @param citationCount citation count, null when the source does not report one
 * @param source originating backend
 * @param canonicalId deterministic identifier of the logical paper
 */
public record RawResult(
    String title,
    List<Author> authors,
    @Nullable Integer year,
    @Nullable String abstractText,
    @Nullable String venue,
    @Nullable String doi,
    @Nullable String url,
    @Nullable String pdfUrl,
    @Nullable Integer citationCount,
    PaperSource source,
    String canonicalId) {

  /** Compact constructor validating input. */
  public RawResult {
    if (title == null || title.isBlank()) {
      throw new IllegalArgumentException("Title must not be blank");
    }
    if (source == null) {
      throw new IllegalArgumentException("Source must not be null");
    }
    if (canonicalId == null || canonicalId.isBlank()) {
      throw new IllegalArgumentException("canonicalId must not be blank");
    }
    title = title.trim();
    authors = authors == null ? List.of() : List.copyOf(authors);
  }

  /** Name of the first listed author, or null when the author list is empty. */
  public @Nullable String firstAuthorName() {
    return authors.isEmpty() ? null : authors.get(0).name();
  }

  /** Citation count with absent values read as zero. */
  public int citationsOrZero() {
    return citationCount == null ? 0 : citationCount;
  }

  /** Whether the vendor reported a non-blank DOI. */
  public boolean hasDoi() {
    return PaperNormalizer.normalizeDoi(doi) != null;
  }

  /** Whether this record is an arXiv preprint, either by source or by landing page. */
  public boolean isArxiv() {
    return source == PaperSource.ARXIV || PaperNormalizer.isArxivUrl(url);
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Assembles a {@link RawResult}, computing {@code canonicalId} when none is given. */
  public static final class Builder {

    private @Nullable String title;
    private final List<Author> authors = new ArrayList<>();
    private @Nullable Integer year;
    private @Nullable String abstractText;
    private @Nullable String venue;
    private @Nullable String doi;
    private @Nullable String url;
    private @Nullable String pdfUrl;
    private @Nullable Integer citationCount;
    private @Nullable PaperSource source;
    private @Nullable String canonicalId;

    private Builder() {}

    public Builder title(@Nullable String title) {
      this.title = title;
      return this;
    }

    public Builder author(@Nullable String name) {
      this.authors.add(Author.of(name));
      return this;
    }

    public Builder authors(List<Author> authors) {
      this.authors.clear();
      this.authors.addAll(authors);
      return this;
    }

    public Builder year(@Nullable Integer year) {
      this.year = year;
      return this;
    }

    public Builder abstractText(@Nullable String abstractText) {
      this.abstractText = blankToNull(abstractText);
      return this;
    }

    public Builder venue(@Nullable String venue) {
      this.venue = blankToNull(venue);
      return this;
    }

    public Builder doi(@Nullable String doi) {
      this.doi = blankToNull(doi);
      return this;
    }

    public Builder url(@Nullable String url) {
      this.url = blankToNull(url);
      return this;
    }

    public Builder pdfUrl(@Nullable String pdfUrl) {
      this.pdfUrl = blankToNull(pdfUrl);
      return this;
    }

    public Builder citationCount(@Nullable Integer citationCount) {
      this.citationCount = citationCount;
      return this;
    }

    public Builder source(PaperSource source) {
      this.source = source;
      return this;
    }

    public Builder canonicalId(@Nullable String canonicalId) {
      this.canonicalId = canonicalId;
      return this;
    }

    public RawResult build() {
      if (title == null || title.isBlank()) {
        throw new IllegalArgumentException("Title must not be blank");
      }
      String firstAuthor = authors.isEmpty() ? null : authors.get(0).name();
      String id =
          canonicalId != null ? canonicalId : CanonicalIds.forPaper(doi, title, firstAuthor, year);
      return new RawResult(
          title, authors, year, abstractText, venue, doi, url, pdfUrl, citationCount, source, id);
    }

    private static @Nullable String blankToNull(@Nullable String value) {
      return value == null || value.isBlank() ? null : value.trim();
    }
  }
}
