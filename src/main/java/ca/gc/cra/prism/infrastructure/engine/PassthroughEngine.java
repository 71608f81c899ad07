package ca.gc.cra.prism.infrastructure.engine;

import ca.gc.cra.prism.application.port.ImagingEngine;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;

/**
 * Engine that spools the source into its factory's scratch directory and returns it unchanged.
 *
 * <p>One spool file per loaded image; it lives until the factory's cleanup removes the directory.</p>
 */
final class PassthroughEngine implements ImagingEngine {
  private final Path scratch;
  private Path spooled;

  PassthroughEngine(Path scratch) {
    this.scratch = Objects.requireNonNull(scratch, "scratch");
  }

  @Override
  public void load(byte[] buffer, String extension) throws IOException {
    Objects.requireNonNull(buffer, "buffer");
    spooled = Files.createTempFile(scratch, "source-", suffix(extension));
    Files.write(spooled, buffer);
  }

  @Override
  public byte[] read() throws IOException {
    if (spooled == null) {
      throw new IllegalStateException("No image loaded");
    }
    return Files.readAllBytes(spooled);
  }

  Path spooled() {
    return spooled;
  }

  private static String suffix(String extension) {
    if (extension == null || extension.isBlank()) {
      return ".bin";
    }
    String trimmed = extension.trim().toLowerCase(Locale.ROOT);
    if (!trimmed.matches("\\.?[a-z0-9]{1,8}")) {
      return ".bin";
    }
    return trimmed.startsWith(".") ? trimmed : "." + trimmed;
  }
}
