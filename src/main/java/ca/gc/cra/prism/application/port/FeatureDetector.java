package ca.gc.cra.prism.application.port;

import ca.gc.cra.prism.domain.image.FocalPoint;
import java.util.List;

/**
 * Finds focal points in the image held by an engine.
 *
 * @since 0.1.0
 */
public interface FeatureDetector {
  /**
   * Detects focal points.
   *
   * @param engine engine holding the loaded image
   * @return focal points, possibly empty
   */
  List<FocalPoint> detect(ImagingEngine engine);
}
