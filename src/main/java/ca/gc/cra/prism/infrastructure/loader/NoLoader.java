package ca.gc.cra.prism.infrastructure.loader;

import ca.gc.cra.prism.application.port.ImageLoader;
import java.io.FileNotFoundException;
import java.io.IOException;

/**
 * Loader that finds nothing, registered as {@code prism.loaders.none}.
 *
 * <p>Every source reports as missing until a real loader is configured through {@code LOADER}.</p>
 */
public final class NoLoader implements ImageLoader {
  public static final String NAME = "prism.loaders.none";

  @Override
  public byte[] load(String url) throws IOException {
    throw new FileNotFoundException("No loader configured; cannot load " + url);
  }
}
