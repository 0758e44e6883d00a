package ca.siteguard.domain.hazard;

/**
 * <strong>What:</strong> Axis-aligned box locating a detection, in coordinates normalized to the image size.
 * <p><strong>Why:</strong> Backends report boxes at different input resolutions; normalized coordinates let fusion
 * compare them directly.</p>
 * <p><strong>Role:</strong> Domain value object carried by {@link HazardDetection} and {@link FusedHazard}.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param left x of the left edge in {@code [0, 1]}
 * @param top y of the top edge in {@code [0, 1]}
 * @param width box width; {@code left + width <= 1}
 * @param height box height; {@code top + height <= 1}
 * @since SiteGuard 0.1
 */
public record BoundingRegion(double left, double top, double width, double height)
    implements Comparable<BoundingRegion> {
  private static final double EPSILON = 1e-9;

  /** Region covering the whole frame, used by backends that classify without localizing. */
  public static final BoundingRegion FULL_FRAME = new BoundingRegion(0d, 0d, 1d, 1d);

  /**
   * Validates the box lies inside the unit square.
   *
   * @throws IllegalArgumentException when any coordinate is out of range or not finite
   */
  public BoundingRegion {
    requireUnit("left", left);
    requireUnit("top", top);
    requireUnit("width", width);
    requireUnit("height", height);
    if (left + width > 1d + EPSILON || top + height > 1d + EPSILON) {
      throw new IllegalArgumentException("region extends outside the frame: " + left + "," + top
          + " " + width + "x" + height);
    }
  }

  /**
   * Builds a region from pixel coordinates, clamping to the frame.
   *
   * @param x left edge in pixels
   * @param y top edge in pixels
   * @param w width in pixels
   * @param h height in pixels
   * @param imageWidth frame width in pixels; must be positive
   * @param imageHeight frame height in pixels; must be positive
   * @return normalized region
   */
  public static BoundingRegion fromPixels(
      double x, double y, double w, double h, int imageWidth, int imageHeight) {
    if (imageWidth <= 0 || imageHeight <= 0) {
      throw new IllegalArgumentException("image dimensions must be positive");
    }
    double left = clamp(x / imageWidth);
    double top = clamp(y / imageHeight);
    double width = Math.min(clamp(w / imageWidth), 1d - left);
    double height = Math.min(clamp(h / imageHeight), 1d - top);
    return new BoundingRegion(left, top, width, height);
  }

  /**
   * Returns the box area as a fraction of the frame.
   *
   * @return area in {@code [0, 1]}
   */
  public double area() {
    return width * height;
  }

  /**
   * Computes intersection-over-union with another region.
   *
   * @param other region to compare
   * @return IoU in {@code [0, 1]}; {@code 0} when both boxes are degenerate
   */
  public double intersectionOverUnion(BoundingRegion other) {
    double ix = Math.max(0d, Math.min(left + width, other.left + other.width) - Math.max(left, other.left));
    double iy = Math.max(0d, Math.min(top + height, other.top + other.height) - Math.max(top, other.top));
    double intersection = ix * iy;
    double union = area() + other.area() - intersection;
    if (union <= 0d) {
      return 0d;
    }
    return Math.min(1d, intersection / union);
  }

  @Override
  public int compareTo(BoundingRegion other) {
    int cmp = Double.compare(left, other.left);
    if (cmp != 0) {
      return cmp;
    }
    cmp = Double.compare(top, other.top);
    if (cmp != 0) {
      return cmp;
    }
    cmp = Double.compare(width, other.width);
    if (cmp != 0) {
      return cmp;
    }
    return Double.compare(height, other.height);
  }

  private static void requireUnit(String name, double value) {
    if (!Double.isFinite(value) || value < 0d || value > 1d + EPSILON) {
      throw new IllegalArgumentException(name + " must be within [0, 1] (was " + value + ")");
    }
  }

  private static double clamp(double value) {
    if (!Double.isFinite(value)) {
      return 0d;
    }
    return Math.max(0d, Math.min(1d, value));
  }
}
