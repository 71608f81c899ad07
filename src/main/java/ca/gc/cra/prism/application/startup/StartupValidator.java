package ca.gc.cra.prism.application.startup;

import ca.gc.cra.prism.application.port.BinaryLocator;
import ca.gc.cra.prism.config.ConfigurationException;
import ca.gc.cra.prism.config.PrismConfig;
import ca.gc.cra.prism.config.ServerParameters;
import ca.gc.cra.prism.config.Settings;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Pre-flight checks run before the server accepts traffic.
 * <p><strong>Why:</strong> A server without a signing key, or configured for gifsicle without the binary,
 * would fail every request; both are reported once at startup instead.</p>
 * <p><strong>Role:</strong> Bootstrap step after component resolution. Returns a {@link ValidationResult}
 * rather than mutating its inputs.</p>
 * <p><strong>Thread-safety:</strong> Stateless apart from the locator.</p>
 *
 * @since 0.1.0
 */
public final class StartupValidator {
  private static final Logger log = LoggerFactory.getLogger(StartupValidator.class);

  static final String MISSING_SECURITY_KEY =
      "No security key was found for this instance of prism. "
          + "Please provide one using the conf file or a security key file.";
  static final String MISSING_GIFSICLE =
      "If using USE_GIFSICLE_ENGINE configuration to True, the `gifsicle` binary must be in the PATH "
          + "and must be an executable.";
  static final String GIFSICLE = "gifsicle";

  private final BinaryLocator binaries;

  public StartupValidator(BinaryLocator binaries) {
    this.binaries = Objects.requireNonNull(binaries, "binaries");
  }

  /**
   * Validates the credential and, when enabled, the gifsicle binary.
   *
   * <p>The key given through the command line or key file wins over {@code SECURITY_KEY}. The binary
   * lookup runs only when {@code USE_GIFSICLE_ENGINE} is set.</p>
   *
   * @param config effective configuration
   * @param params server parameters from the command line
   * @return credential and binary location to merge into the parameters
   * @throws ConfigurationException if no credential is available or the required binary is missing
   */
  public ValidationResult validate(PrismConfig config, ServerParameters params) {
    Objects.requireNonNull(config, "config");
    Objects.requireNonNull(params, "params");

    String key = params.securityKey();
    if (key == null || key.isBlank()) {
      key = config.getString(Settings.SECURITY_KEY);
    }
    if (key == null || key.isBlank()) {
      throw new ConfigurationException(MISSING_SECURITY_KEY);
    }

    Optional<Path> gifsicle = Optional.empty();
    if (config.getBoolean(Settings.USE_GIFSICLE_ENGINE)) {
      gifsicle = binaries.which(GIFSICLE);
      if (gifsicle.isEmpty()) {
        throw new ConfigurationException(MISSING_GIFSICLE);
      }
      log.info("Using gifsicle at {}", gifsicle.get());
    }
    return new ValidationResult(key, gifsicle);
  }
}
