package dev.athenaeum.paper;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * A deduplicated paper: the representative record of a cluster plus the ids it absorbed.
 *
 * @param title representative title
 * @param authors representative authors
 * @param year publication year
 * @param abstractText abstract
 * @param venue venue
 * @param doi DOI as reported by the representative's source
 * @param url landing page
 * @param pdfUrl full-text link
 * @param citationCount citation count
 * @param source source of the representative record
 * @param canonicalId representative's canonical id
 * @param siblings canonical ids of the other cluster members, in encounter order, never containing
 *     {@code canonicalId}
 * @param preprintId arXiv URL (or id) of a linked preprint version
 * @param region detected region of origin
 * @param combinedScore best combined score among the cluster members
 */
public record CanonicalPaper(
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
    String canonicalId,
    Set<String> siblings,
    @Nullable String preprintId,
    @Nullable String region,
    double combinedScore) {

  public CanonicalPaper {
    authors = authors == null ? List.of() : List.copyOf(authors);
    LinkedHashSet<String> ordered = new LinkedHashSet<>(siblings == null ? Set.of() : siblings);
    ordered.remove(canonicalId);
    siblings = Collections.unmodifiableSet(ordered);
  }

  /** Builds a canonical paper from the winning representative of a cluster. */
  public static CanonicalPaper from(
      RawResult representative,
      Set<String> siblings,
      @Nullable String preprintId,
      double combinedScore) {
    return new CanonicalPaper(
        representative.title(),
        representative.authors(),
        representative.year(),
        representative.abstractText(),
        representative.venue(),
        representative.doi(),
        representative.url(),
        representative.pdfUrl(),
        representative.citationCount(),
        representative.source(),
        representative.canonicalId(),
        siblings,
        preprintId,
        null,
        combinedScore);
  }

  /** Returns a copy carrying the given region. */
  public CanonicalPaper withRegion(@Nullable String region) {
    return new CanonicalPaper(
        title,
        authors,
        year,
        abstractText,
        venue,
        doi,
        url,
        pdfUrl,
        citationCount,
        source,
        canonicalId,
        siblings,
        preprintId,
        region,
        combinedScore);
  }
}
