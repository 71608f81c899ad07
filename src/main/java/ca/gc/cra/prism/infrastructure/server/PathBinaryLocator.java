package ca.gc.cra.prism.infrastructure.server;

import ca.gc.cra.prism.application.port.BinaryLocator;
import java.io.File;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves executables by scanning the entries of a {@code PATH}-style search list.
 */
public final class PathBinaryLocator implements BinaryLocator {
  private static final Logger log = LoggerFactory.getLogger(PathBinaryLocator.class);

  private final String searchPath;

  /** Creates a locator over the process {@code PATH}. */
  public PathBinaryLocator() {
    this(Objects.requireNonNullElse(System.getenv("PATH"), ""));
  }

  public PathBinaryLocator(String searchPath) {
    this.searchPath = Objects.requireNonNull(searchPath, "searchPath");
  }

  @Override
  public Optional<Path> which(String name) {
    if (name == null || name.isBlank() || name.contains(File.separator)) {
      return Optional.empty();
    }
    for (String entry : searchPath.split(File.pathSeparator)) {
      if (entry.isBlank()) {
        continue;
      }
      try {
        Path candidate = Path.of(entry, name);
        if (Files.isRegularFile(candidate) && Files.isExecutable(candidate)) {
          return Optional.of(candidate.toAbsolutePath());
        }
      } catch (InvalidPathException ex) {
        log.debug("Skipping invalid PATH entry {}", entry, ex);
      }
    }
    return Optional.empty();
  }
}
