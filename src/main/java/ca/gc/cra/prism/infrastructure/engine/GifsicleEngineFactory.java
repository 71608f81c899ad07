package ca.gc.cra.prism.infrastructure.engine;

import ca.gc.cra.prism.application.port.ComponentFactory;
import ca.gc.cra.prism.application.port.ImagingEngine;
import ca.gc.cra.prism.application.startup.ExecutionContext;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Animated-image engine factory, registered as {@code prism.engines.gifsicle}.
 *
 * <p>Requires the binary location resolved by startup validation ({@code ServerParameters.gifsiclePath});
 * frames are spooled to a separate scratch directory and returned unchanged.</p>
 */
public final class GifsicleEngineFactory implements ComponentFactory<ImagingEngine> {
  private static final Logger log = LoggerFactory.getLogger(GifsicleEngineFactory.class);

  public static final String NAME = "prism.engines.gifsicle";

  private final ScratchDirectory scratch = new ScratchDirectory("prism-gifsicle-");

  @Override
  public ImagingEngine create(ExecutionContext context) {
    Path binary = context.server().gifsiclePath();
    if (binary == null) {
      throw new IllegalStateException("gifsicle path was not resolved during startup validation");
    }
    try {
      return new PassthroughEngine(scratch.path());
    } catch (IOException ex) {
      throw new UncheckedIOException("Unable to create gifsicle scratch directory", ex);
    }
  }

  @Override
  public void cleanup() {
    log.debug("Cleaning up {}", NAME);
    scratch.delete();
  }

  Path scratchIfCreated() {
    return scratch.existing();
  }
}
