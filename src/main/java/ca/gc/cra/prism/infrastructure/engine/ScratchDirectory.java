package ca.gc.cra.prism.infrastructure.engine;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lazily created temporary directory owned by an engine factory.
 */
final class ScratchDirectory {
  private static final Logger log = LoggerFactory.getLogger(ScratchDirectory.class);

  private final String prefix;
  private Path path;

  ScratchDirectory(String prefix) {
    this.prefix = prefix;
  }

  synchronized Path path() throws IOException {
    if (path == null) {
      path = Files.createTempDirectory(prefix);
      log.debug("Created scratch directory {}", path);
    }
    return path;
  }

  synchronized Path existing() {
    return path;
  }

  /** Deletes the directory and its contents; later calls to {@link #path()} create a fresh one. */
  synchronized void delete() {
    if (path == null) {
      return;
    }
    try {
      Files.walkFileTree(path, new SimpleFileVisitor<>() {
        @Override
        public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
          Files.deleteIfExists(file);
          return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult postVisitDirectory(Path dir, IOException exc) throws IOException {
          Files.deleteIfExists(dir);
          return FileVisitResult.CONTINUE;
        }
      });
    } catch (IOException ex) {
      log.warn("Unable to delete scratch directory {}", path, ex);
    }
    path = null;
  }
}
