package dev.athenaeum.source;

import dev.athenaeum.paper.PaperSource;

/** 5xx response; retried with backoff. */
public class TransientSourceException extends SourceHttpException {

  public TransientSourceException(PaperSource source, int statusCode, String message) {
    super(source, statusCode, message);
  }
}
