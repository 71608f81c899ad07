package ca.gc.cra.prism.application.port;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Locates executables the way a shell resolves commands.
 *
 * @since 0.1.0
 */
public interface BinaryLocator {
  /**
   * Finds an executable.
   *
   * @param name command name such as {@code gifsicle}
   * @return absolute path of the first executable match, or empty
   */
  Optional<Path> which(String name);
}
