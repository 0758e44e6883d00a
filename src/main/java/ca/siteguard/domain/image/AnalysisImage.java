package ca.siteguard.domain.image;

import java.util.Arrays;
import java.util.Objects;

/**
 * <strong>What:</strong> Encoded image handed to the analysis pipeline by the capture subsystem.
 * <p><strong>Why:</strong> Backends run concurrently on the same image; an immutable snapshot keeps them isolated.</p>
 * <p><strong>Role:</strong> Domain value object passed unchanged to every backend in a session.</p>
 * <p><strong>Thread-safety:</strong> Immutable; the byte payload is copied on construction and on access.</p>
 *
 * @param bytes encoded image bytes (JPEG or PNG); defensively copied. May be empty, in which case backends
 *     report malformed input.
 * @param width pixel width; must be positive
 * @param height pixel height; must be positive
 * @param metadata capture metadata
 * @since SiteGuard 0.1
 */
public record AnalysisImage(byte[] bytes, int width, int height, CaptureMetadata metadata) {

  /**
   * Copies the payload and validates dimensions.
   *
   * @throws IllegalArgumentException if either dimension is not positive
   */
  public AnalysisImage {
    bytes = bytes != null ? bytes.clone() : new byte[0];
    if (width <= 0 || height <= 0) {
      throw new IllegalArgumentException("image dimensions must be positive (was " + width + "x" + height + ")");
    }
    Objects.requireNonNull(metadata, "metadata");
  }

  @Override
  public byte[] bytes() {
    return bytes.clone();
  }

  /**
   * Returns the payload length without copying.
   *
   * @return byte count
   */
  public int byteCount() {
    return bytes.length;
  }

  public boolean isEmpty() {
    return bytes.length == 0;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof AnalysisImage that)) {
      return false;
    }
    return width == that.width
        && height == that.height
        && metadata.equals(that.metadata)
        && Arrays.equals(bytes, that.bytes);
  }

  @Override
  public int hashCode() {
    int result = Arrays.hashCode(bytes);
    result = 31 * result + width;
    result = 31 * result + height;
    result = 31 * result + metadata.hashCode();
    return result;
  }

  @Override
  public String toString() {
    return "AnalysisImage{"
        + "bytes=" + bytes.length
        + ", width=" + width
        + ", height=" + height
        + ", metadata=" + metadata
        + '}';
  }
}
