package ca.siteguard.application.port;

import java.util.Objects;

/**
 * Detection as reported by an inference engine, before label mapping.
 *
 * @param label engine label such as {@code "no_hard_hat"}
 * @param confidence engine confidence; adapters drop values outside {@code [0, 1]}
 * @param x left edge in pixels of the analyzed image
 * @param y top edge in pixels
 * @param width box width in pixels; {@code 0} when the engine does not localize
 * @param height box height in pixels; {@code 0} when the engine does not localize
 * @since SiteGuard 0.1
 */
public record RawDetection(String label, double confidence, double x, double y, double width, double height) {
  public RawDetection {
    Objects.requireNonNull(label, "label");
  }

  /**
   * Creates an unlocalized detection that covers the whole frame.
   *
   * @param label engine label
   * @param confidence engine confidence
   * @return detection without a box
   */
  public static RawDetection unlocalized(String label, double confidence) {
    return new RawDetection(label, confidence, 0d, 0d, 0d, 0d);
  }

  public boolean localized() {
    return width > 0d && height > 0d;
  }
}
