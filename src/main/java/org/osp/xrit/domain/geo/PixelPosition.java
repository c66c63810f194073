package org.osp.xrit.domain.geo;

/**
 * Sub-pixel location in a frame's scan grid, used when overlays need more precision than a
 * {@link PixelCoordinate} offers.
 *
 * @param x fractional column
 * @param y fractional line
 * @since 0.1.0
 */
public record PixelPosition(double x, double y) {

  /**
   * Rounds to the nearest integer pixel.
   *
   * @return nearest pixel coordinate
   */
  public PixelCoordinate rounded() {
    return new PixelCoordinate((int) Math.round(x), (int) Math.round(y));
  }
}
