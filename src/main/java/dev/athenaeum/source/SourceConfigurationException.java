package dev.athenaeum.source;

/** Invalid source configuration detected at startup, such as CORE enabled without an API key. */
public class SourceConfigurationException extends IllegalStateException {

  public SourceConfigurationException(String message) {
    super(message);
  }
}
