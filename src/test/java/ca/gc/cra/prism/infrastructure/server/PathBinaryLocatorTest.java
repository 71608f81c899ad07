package ca.gc.cra.prism.infrastructure.server;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

@DisabledOnOs(OS.WINDOWS)
class PathBinaryLocatorTest {

  @TempDir Path tempDir;

  @Test
  void findsExecutableInLaterEntry() throws IOException {
    Path empty = Files.createDirectory(tempDir.resolve("empty"));
    Path bin = Files.createDirectory(tempDir.resolve("bin"));
    Path gifsicle = Files.writeString(bin.resolve("gifsicle"), "#!/bin/sh\n");
    Files.setPosixFilePermissions(gifsicle, PosixFilePermissions.fromString("rwxr-xr-x"));

    PathBinaryLocator locator = new PathBinaryLocator(empty + File.pathSeparator + bin);

    assertEquals(Optional.of(gifsicle.toAbsolutePath()), locator.which("gifsicle"));
  }

  @Test
  void ignoresNonExecutableFiles() throws IOException {
    Path gifsicle = Files.writeString(tempDir.resolve("gifsicle"), "data");
    Files.setPosixFilePermissions(gifsicle, PosixFilePermissions.fromString("rw-r--r--"));

    assertTrue(new PathBinaryLocator(tempDir.toString()).which("gifsicle").isEmpty());
  }

  @Test
  void ignoresDirectoriesAndEmptyPath() throws IOException {
    Files.createDirectory(tempDir.resolve("gifsicle"));

    assertTrue(new PathBinaryLocator(tempDir.toString()).which("gifsicle").isEmpty());
    assertTrue(new PathBinaryLocator("").which("gifsicle").isEmpty());
  }

  @Test
  void rejectsNamesWithSeparators() {
    assertTrue(new PathBinaryLocator(tempDir.toString()).which("../gifsicle").isEmpty());
  }
}
