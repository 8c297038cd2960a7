package dev.athenaeum.search;

/**
 * Rejected search options. Thrown while a {@link SearchRequest} is constructed, before any source is
 * contacted; the REST layer maps it to HTTP 400.
 */
public class InvalidSearchRequestException extends IllegalArgumentException {

  public InvalidSearchRequestException(String message) {
    super(message);
  }

  public InvalidSearchRequestException(String message, Throwable cause) {
    super(message, cause);
  }
}
