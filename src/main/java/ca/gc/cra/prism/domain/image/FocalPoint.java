package ca.gc.cra.prism.domain.image;

import java.util.Objects;

/**
 * Point of interest reported by a feature detector, used to centre smart crops.
 *
 * @param x horizontal coordinate in pixels
 * @param y vertical coordinate in pixels
 * @param weight relative importance; higher wins
 * @param origin name of the detector that produced the point
 * @since 0.1.0
 */
public record FocalPoint(double x, double y, double weight, String origin) {
  public FocalPoint {
    if (x < 0 || y < 0) {
      throw new IllegalArgumentException("focal point coordinates must not be negative");
    }
    if (weight < 0) {
      throw new IllegalArgumentException("weight must not be negative");
    }
    Objects.requireNonNull(origin, "origin");
  }
}
