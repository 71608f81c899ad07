package ca.gc.cra.prism.infrastructure.engine;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.prism.application.port.ImagingEngine;
import ca.gc.cra.prism.config.PrismConfig;
import ca.gc.cra.prism.config.ServerParameters;
import ca.gc.cra.prism.testutil.Contexts;
import ca.gc.cra.prism.testutil.RecordingMetrics;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class GifsicleEngineFactoryTest {
  private final GifsicleEngineFactory factory = new GifsicleEngineFactory();

  @AfterEach
  void tearDown() {
    factory.cleanup();
  }

  @Test
  void createRequiresResolvedBinary() {
    var context = Contexts.of(Map.of(), new RecordingMetrics());

    assertThrows(IllegalStateException.class, () -> factory.create(context));
    assertNull(factory.scratchIfCreated());
  }

  @Test
  void createSpoolsIntoOwnScratchDirectory() throws IOException {
    ServerParameters params = ServerParameters.builder()
        .securityKey("test-key")
        .gifsiclePath(Path.of("/usr/bin/gifsicle"))
        .build();
    var context = Contexts.of(params, PrismConfig.of(Map.of()), new RecordingMetrics());
    byte[] gif = {'G', 'I', 'F', '8', '9', 'a'};

    ImagingEngine engine = factory.create(context);
    engine.load(gif, ".gif");

    Path scratch = factory.scratchIfCreated();
    assertTrue(scratch.getFileName().toString().startsWith("prism-gifsicle-"));
    assertArrayEquals(gif, engine.read());

    factory.cleanup();
    assertTrue(Files.notExists(scratch));
  }
}
