package com.studysnap.layout.model;

/**
 * Position of a fragment in page coordinates (origin at the top-left corner, y grows downwards).
 *
 * @param page 1-based page number
 */
public record BoundingBox(double x, double y, double width, double height, int page) {

  public static final BoundingBox EMPTY = new BoundingBox(0, 0, 0, 0, 1);

  public BoundingBox {
    width = Math.max(0, width);
    height = Math.max(0, height);
    page = Math.max(1, page);
  }

  public double right() {
    return x + width;
  }

  public double bottom() {
    return y + height;
  }

  public double area() {
    return width * height;
  }

  /**
   * Returns {@code true} when the share of this box covered by {@code other} exceeds {@code
   * threshold}. Boxes on different pages never overlap.
   */
  public boolean overlapsWith(BoundingBox other, double threshold) {
    if (other == null || other.page != page) {
      return false;
    }
    double ownArea = area();
    if (ownArea <= 0) {
      return false;
    }
    double xOverlap = Math.max(0, Math.min(right(), other.right()) - Math.max(x, other.x));
    double yOverlap = Math.max(0, Math.min(bottom(), other.bottom()) - Math.max(y, other.y));
    return (xOverlap * yOverlap) / ownArea > threshold;
  }

  public BoundingBox union(BoundingBox other) {
    if (other == null) {
      return this;
    }
    double minX = Math.min(x, other.x);
    double minY = Math.min(y, other.y);
    double maxX = Math.max(right(), other.right());
    double maxY = Math.max(bottom(), other.bottom());
    return new BoundingBox(minX, minY, maxX - minX, maxY - minY, page);
  }
}
