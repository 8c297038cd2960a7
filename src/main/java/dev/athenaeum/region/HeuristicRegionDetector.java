package dev.athenaeum.region;

import dev.athenaeum.paper.CanonicalPaper;
import java.net.URI;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import org.jspecify.annotations.Nullable;
import org.springframework.stereotype.Component;

/**
 * Region detection from paper metadata, in decreasing order of confidence:
 *
 * <ol>
 *   <li>country-code top-level domain of the landing page URL ({@link Confidence#HIGH})
 *   <li>country name or alias in the venue ({@link Confidence#MEDIUM})
 *   <li>country name or alias in the title ({@link Confidence#LOW})
 * </ol>
 *
 * <p>Country names are the English display names of the ISO 3166 codes known to the JDK. Longer
 * names are tried first so that "Papua New Guinea" wins over "Guinea".
 */
@Component
public class HeuristicRegionDetector implements RegionDetector {

  /** ccTLDs mostly registered for their letters rather than their country. */
  private static final Set<String> VANITY_TLDS =
      Set.of("ai", "cc", "co", "fm", "io", "ly", "me", "to", "tv", "ws");

  private final Map<String, String> countryByTld = new HashMap<>();
  private final Map<String, String> countryByLowerName = new HashMap<>();
  private final Map<String, String> aliases = new LinkedHashMap<>();
  private final List<NamePattern> patterns = new ArrayList<>();

  private record NamePattern(Pattern pattern, String country) {}

  public HeuristicRegionDetector() {
    for (String code : Locale.getISOCountries()) {
      String name = new Locale("", code).getDisplayCountry(Locale.ENGLISH);
      if (name.isBlank() || name.equalsIgnoreCase(code)) {
        continue;
      }
      countryByTld.put(code.toLowerCase(Locale.ROOT), name);
      countryByLowerName.put(name.toLowerCase(Locale.ROOT), name);
      patterns.add(
          new NamePattern(
              Pattern.compile(
                  "\\b" + Pattern.quote(name).replace(" ", "\\E\\s+\\Q") + "\\b",
                  Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE),
              name));
    }
    countryByTld.put("uk", "United Kingdom");

    aliases.put("America", "United States");
    aliases.put("Britain", "United Kingdom");
    aliases.put("England", "United Kingdom");
    aliases.put("Korea", "South Korea");
    for (Map.Entry<String, String> alias : aliases.entrySet()) {
      patterns.add(
          new NamePattern(
              Pattern.compile(
                  "\\b" + Pattern.quote(alias.getKey()) + "\\b",
                  Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE),
              alias.getValue()));
    }
    // Upper-case acronyms only; "us" is an English word.
    aliases.put("USA", "United States");
    aliases.put("US", "United States");
    aliases.put("UK", "United Kingdom");
    patterns.add(new NamePattern(Pattern.compile("\\b(USA|U\\.S\\.A\\.|US)\\b"), "United States"));
    patterns.add(new NamePattern(Pattern.compile("\\bUK\\b"), "United Kingdom"));

    patterns.sort(
        Comparator.comparingInt((NamePattern p) -> p.pattern().pattern().length()).reversed());
  }

  @Override
  public Optional<RegionDetection> detect(CanonicalPaper paper) {
    String fromUrl = fromUrl(paper.url());
    if (fromUrl != null) {
      return Optional.of(new RegionDetection(fromUrl, Confidence.HIGH, RegionSignal.URL));
    }
    String fromVenue = fromText(paper.venue());
    if (fromVenue != null) {
      return Optional.of(new RegionDetection(fromVenue, Confidence.MEDIUM, RegionSignal.VENUE));
    }
    String fromTitle = fromText(paper.title());
    if (fromTitle != null) {
      return Optional.of(new RegionDetection(fromTitle, Confidence.LOW, RegionSignal.TITLE));
    }
    return Optional.empty();
  }

  @Override
  public String canonicalRegion(String region) {
    String trimmed = region.trim();
    for (Map.Entry<String, String> alias : aliases.entrySet()) {
      if (alias.getKey().equalsIgnoreCase(trimmed)) {
        return alias.getValue();
      }
    }
    String lower = trimmed.toLowerCase(Locale.ROOT);
    if (lower.length() == 2 && countryByTld.containsKey(lower)) {
      return countryByTld.get(lower);
    }
    return countryByLowerName.getOrDefault(lower, trimmed);
  }

  @Nullable String fromUrl(@Nullable String url) {
    if (url == null || url.isBlank()) {
      return null;
    }
    String host;
    try {
      host = URI.create(url.trim()).getHost();
    } catch (IllegalArgumentException e) {
      return null;
    }
    if (host == null) {
      return null;
    }
    int dot = host.lastIndexOf('.');
    if (dot < 0) {
      return null;
    }
    String tld = host.substring(dot + 1).toLowerCase(Locale.ROOT);
    if (tld.length() != 2 || VANITY_TLDS.contains(tld)) {
      return null;
    }
    return countryByTld.get(tld);
  }

  @Nullable String fromText(@Nullable String text) {
    if (text == null || text.isBlank()) {
      return null;
    }
    for (NamePattern namePattern : patterns) {
      if (namePattern.pattern().matcher(text).find()) {
        return namePattern.country();
      }
    }
    return null;
  }
}
