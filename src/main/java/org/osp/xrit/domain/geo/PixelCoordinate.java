package org.osp.xrit.domain.geo;

/**
 * Integer pixel location in a frame's scan grid.
 *
 * @param x column index
 * @param y line index
 * @since 0.1.0
 */
public record PixelCoordinate(int x, int y) {}
