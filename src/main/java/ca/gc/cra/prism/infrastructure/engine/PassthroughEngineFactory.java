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
 * Default engine factory, registered as {@code prism.engines.passthrough}.
 *
 * <p>Engines share one scratch directory; it is created on first use and removed by
 * {@link #cleanup()}.</p>
 */
public final class PassthroughEngineFactory implements ComponentFactory<ImagingEngine> {
  private static final Logger log = LoggerFactory.getLogger(PassthroughEngineFactory.class);

  public static final String NAME = "prism.engines.passthrough";

  private final ScratchDirectory scratch = new ScratchDirectory("prism-engine-");

  @Override
  public ImagingEngine create(ExecutionContext context) {
    try {
      return new PassthroughEngine(scratch.path());
    } catch (IOException ex) {
      throw new UncheckedIOException("Unable to create engine scratch directory", ex);
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
