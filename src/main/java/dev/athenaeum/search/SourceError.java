package dev.athenaeum.search;

/**
 * A source that failed, timed out or was skipped during a search.
 *
 * @param source wire tag of the source
 * @param message failure reason
 */
public record SourceError(String source, String message) {}
