package dev.athenaeum.source;

import dev.athenaeum.paper.PaperSource;
import org.jspecify.annotations.Nullable;

/** Connection, DNS, read-timeout or interruption failure before a response was received. */
public class SourceNetworkException extends SourceException {

  public SourceNetworkException(PaperSource source, String message, @Nullable Throwable cause) {
    super(source, message, cause);
  }
}
