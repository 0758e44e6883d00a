package ca.siteguard.application.port;

import java.io.IOException;
import java.util.List;

/**
 * <strong>What:</strong> Optional persistence for backend reliability across restarts.
 * <p><strong>Thread-safety:</strong> Implementations must tolerate a save racing a load; writes should be atomic.</p>
 *
 * @since SiteGuard 0.1
 * @see ca.siteguard.infrastructure.health.JsonFileBackendHealthStore
 */
public interface BackendHealthStore {
  /**
   * Loads persisted records.
   *
   * @return records; empty when nothing has been saved yet
   * @throws IOException when the store exists but cannot be read
   */
  List<PersistedHealth> load() throws IOException;

  /**
   * Replaces the persisted records.
   *
   * @param records records to save
   * @throws IOException when the store cannot be written
   */
  void save(List<PersistedHealth> records) throws IOException;

  /** Store that remembers nothing. */
  BackendHealthStore NO_OP = new BackendHealthStore() {
    @Override public List<PersistedHealth> load() {
      return List.of();
    }

    @Override public void save(List<PersistedHealth> records) {}
  };
}
