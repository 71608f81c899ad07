/**
 * Image value types shared by engines, filters and detectors.
 */
package ca.gc.cra.prism.domain.image;
