package dev.athenaeum.paper;

import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.jspecify.annotations.Nullable;

/** Extracts a four-digit publication year from the date strings vendors return. */
public final class PublicationYears {

  private static final Pattern YEAR_TOKEN = Pattern.compile("(?<!\\d)(1[5-9]\\d{2}|20\\d{2})(?!\\d)");

  private PublicationYears() {}

  /**
   * Finds the first plausible {@code YYYY} token, e.g. {@code 2021} in {@code "2021-03-04"} or
   * {@code "Published March 2021"}.
   *
   * @param date free-form date text, may be null
   * @return the year, or null when none is found
   */
  public static @Nullable Integer fromDateString(@Nullable String date) {
    if (date == null || date.isBlank()) {
      return null;
    }
    Matcher matcher = YEAR_TOKEN.matcher(date);
    return matcher.find() ? Integer.valueOf(matcher.group(1)) : null;
  }

  /** Prefers an explicit year; falls back to the year token of a date string. */
  public static @Nullable Integer resolve(@Nullable Integer explicitYear, @Nullable String date) {
    if (explicitYear != null && explicitYear > 0) {
      return explicitYear;
    }
    return fromDateString(date);
  }
}
