package ca.gc.cra.prism.application.startup;

import ca.gc.cra.prism.config.ServerParameters;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of {@link StartupValidator#validate}: the credential to use and the located gifsicle binary.
 *
 * @param securityKey non-blank credential
 * @param gifsiclePath located binary, empty when gifsicle processing is disabled
 * @since 0.1.0
 */
public record ValidationResult(String securityKey, Optional<Path> gifsiclePath) {

  public ValidationResult {
    Objects.requireNonNull(securityKey, "securityKey");
    Objects.requireNonNull(gifsiclePath, "gifsiclePath");
  }

  /**
   * Merges this result into {@code params}.
   *
   * @param params parameters that were validated
   * @return copy carrying the credential and binary location
   */
  public ServerParameters applyTo(ServerParameters params) {
    return params.withValidation(securityKey, gifsiclePath.orElse(null));
  }

  @Override
  public String toString() {
    return "ValidationResult[securityKey=<redacted>, gifsiclePath=" + gifsiclePath + "]";
  }
}
