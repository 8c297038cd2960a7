package dev.athenaeum.source;

import dev.athenaeum.paper.PaperSource;
import org.jspecify.annotations.Nullable;

/** The source answered with a body that could not be read as the expected JSON or XML. */
public class SourceParseException extends SourceException {

  public SourceParseException(PaperSource source, String message, @Nullable Throwable cause) {
    super(source, message, cause);
  }
}
