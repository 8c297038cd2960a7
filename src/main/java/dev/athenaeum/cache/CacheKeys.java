package dev.athenaeum.cache;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;
import org.jspecify.annotations.Nullable;

/** Static utility for building SHA-256 cache keys for source lookups. */
public final class CacheKeys {

  private CacheKeys() {
    // utility class
  }

  /**
   * Key for one source lookup. The query is lowercased and whitespace-collapsed so trivially
   * different spellings share an entry.
   *
   * @param sourceTag wire tag of the source
   * @param query raw query text
   * @param limit requested result count
   * @param fromYear optional lower year bound
   * @return lowercase hex SHA-256
   */
  public static String forSourceQuery(
      String sourceTag, String query, int limit, @Nullable Integer fromYear) {
    String normalizedQuery = query.trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");
    return sha256(
        sourceTag + "\n" + normalizedQuery + "\n" + limit + "\n" + (fromYear == null ? "" : fromYear));
  }

  static String sha256(String content) {
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      byte[] hash = digest.digest(content.getBytes(StandardCharsets.UTF_8));
      return HexFormat.of().formatHex(hash);
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 algorithm not available", e);
    }
  }
}
