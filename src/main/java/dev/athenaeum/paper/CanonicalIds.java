package dev.athenaeum.paper;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.UUID;
import org.jspecify.annotations.Nullable;

/**
 * Deterministic paper identifiers: name-based (version 5, SHA-1) UUIDs in a fixed paper namespace.
 *
 * <p>The DOI is used when one is present; otherwise the key is {@code
 * normalizedTitle|normalizedFirstAuthor|year}. The same logical paper therefore gets the same id on
 * every run and from every source that reports the same metadata.
 */
public final class CanonicalIds {

  static final UUID PAPER_NAMESPACE = UUID.fromString("6ba7b810-9dad-11d1-80b4-00c04fd430c8");

  private CanonicalIds() {}

  /**
   * Computes the canonical id for a paper.
   *
   * @param doi raw DOI (normalised internally), may be null
   * @param title paper title
   * @param firstAuthor name of the first listed author, may be null
   * @param year publication year, may be null
   * @return UUID string
   */
  public static String forPaper(
      @Nullable String doi, String title, @Nullable String firstAuthor, @Nullable Integer year) {
    String normalizedDoi = PaperNormalizer.normalizeDoi(doi);
    if (normalizedDoi != null) {
      return nameUuid(PAPER_NAMESPACE, normalizedDoi).toString();
    }
    String key =
        PaperNormalizer.normalizeTitle(title)
            + "|"
            + PaperNormalizer.normalizeAuthor(firstAuthor)
            + "|"
            + (year == null ? "" : year.toString());
    return nameUuid(PAPER_NAMESPACE, key).toString();
  }

  static UUID nameUuid(UUID namespace, String name) {
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-1");
      ByteBuffer ns = ByteBuffer.allocate(16);
      ns.putLong(namespace.getMostSignificantBits());
      ns.putLong(namespace.getLeastSignificantBits());
      digest.update(ns.array());
      byte[] hash = digest.digest(name.getBytes(StandardCharsets.UTF_8));
      hash[6] &= 0x0f;
      hash[6] |= 0x50;
      hash[8] &= 0x3f;
      hash[8] |= (byte) 0x80;
      ByteBuffer bytes = ByteBuffer.wrap(hash, 0, 16);
      return new UUID(bytes.getLong(), bytes.getLong());
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-1 algorithm not available", e);
    }
  }
}
