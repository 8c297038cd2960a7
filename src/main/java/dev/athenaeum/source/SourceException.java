package dev.athenaeum.source;

import dev.athenaeum.paper.PaperSource;
import org.jspecify.annotations.Nullable;

/**
 * Base type for failures talking to a bibliographic source. Adapters catch these internally and
 * report them through {@link SourceFetchResult#error()}; they never reach the orchestrator as
 * exceptions.
 */
public class SourceException extends RuntimeException {

  private final PaperSource source;

  public SourceException(PaperSource source, String message) {
    this(source, message, null);
  }

  public SourceException(PaperSource source, String message, @Nullable Throwable cause) {
    super(message, cause);
    this.source = source;
  }

  public PaperSource getSource() {
    return source;
  }
}
