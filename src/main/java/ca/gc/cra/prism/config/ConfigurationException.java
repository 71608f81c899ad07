package ca.gc.cra.prism.config;

/**
 * Fatal startup error caused by missing or invalid configuration.
 *
 * <p>The message is shown to operators verbatim; it must say what is missing and how to supply it.</p>
 *
 * @since 0.1.0
 */
public final class ConfigurationException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  public ConfigurationException(String message) {
    super(message);
  }

  public ConfigurationException(String message, Throwable cause) {
    super(message, cause);
  }
}
