package ca.gc.cra.prism.application.port;

import java.util.List;

/**
 * Named image filter applied to an engine with URL-supplied arguments.
 *
 * <p>Filters are instantiated once at startup and shared; implementations must be stateless.</p>
 *
 * @since 0.1.0
 */
public interface ImageFilter {
  /**
   * Returns the name used in filter expressions, such as {@code brightness}.
   *
   * @return filter name
   */
  String filterName();

  /**
   * Applies the filter.
   *
   * @param engine engine holding the current image
   * @param arguments raw arguments in expression order
   * @throws IllegalArgumentException if the arguments are invalid
   */
  void apply(ImagingEngine engine, List<String> arguments);
}
