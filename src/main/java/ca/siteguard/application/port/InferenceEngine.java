package ca.siteguard.application.port;

import ca.siteguard.domain.image.AnalysisImage;
import java.util.List;

/**
 * <strong>What:</strong> Black-box on-device model runtime (multimodal model or lightweight detector).
 * <p><strong>Why:</strong> Model internals are out of scope; the local backend adapters only need load state and
 * labelled boxes.</p>
 * <p><strong>Thread-safety:</strong> Callers serialize {@link #infer} through the local inference slot;
 * {@link #isLoaded()} must be safe to call from any thread.</p>
 *
 * @since SiteGuard 0.1
 */
public interface InferenceEngine {
  /**
   * Reports whether the model is resident and ready.
   *
   * @return {@code true} when {@link #infer} can run
   */
  boolean isLoaded();

  /**
   * Loads the model, blocking until done.
   *
   * @throws InferenceException with {@link InferenceException.Reason#MODEL_NOT_LOADED} when loading fails
   */
  void load() throws InferenceException;

  /**
   * Runs inference on one image.
   *
   * @param image image to analyze
   * @return raw detections; may be empty
   * @throws InferenceException when the engine cannot produce a result
   * @throws InterruptedException when the calling thread is interrupted
   */
  List<RawDetection> infer(AnalysisImage image) throws InferenceException, InterruptedException;
}
