package com.flamingo.ai.visualchunker.service.rag.model;

/**
 * Axis-aligned rectangle in page coordinates (PDF points, origin top-left).
 *
 * @param x left edge
 * @param y top edge
 * @param width horizontal extent
 * @param height vertical extent
 */
public record BoundingBox(double x, double y, double width, double height) {

  /** Page region of an A4 page in points, used as the position of paginated chunks. */
  public static final BoundingBox A4_PAGE = new BoundingBox(0, 0, 595, 842);

  public double centerX() {
    return x + width / 2;
  }

  public double centerY() {
    return y + height / 2;
  }

  public double area() {
    return width * height;
  }

  /**
   * Euclidean distance between the centres of this box and {@code other}.
   *
   * @param other the other box
   * @return centre-to-centre distance
   */
  public double centerDistanceTo(BoundingBox other) {
    double dx = centerX() - other.centerX();
    double dy = centerY() - other.centerY();
    return Math.sqrt(dx * dx + dy * dy);
  }

  /**
   * Returns {@code true} if every coordinate is finite and the extents are non-negative.
   *
   * @return whether this box can take part in distance and area calculations
   */
  public boolean isWellFormed() {
    return Double.isFinite(x)
        && Double.isFinite(y)
        && Double.isFinite(width)
        && Double.isFinite(height)
        && width >= 0
        && height >= 0;
  }
}
