package ca.siteguard.infrastructure.health;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.siteguard.application.port.PersistedHealth;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class JsonFileBackendHealthStoreTest {
  @TempDir Path dir;

  @Test
  void savedRecordsLoadBack() throws IOException {
    JsonFileBackendHealthStore store = new JsonFileBackendHealthStore(dir.resolve("state/health.json"));
    List<PersistedHealth> records = List.of(
        new PersistedHealth("on-device", 0.95d, 0L),
        new PersistedHealth("remote-vision", 0.4d, 1_714_573_800_000L));

    store.save(records);

    assertEquals(records, store.load());
    try (Stream<Path> files = Files.list(store.file().getParent())) {
      assertEquals(1L, files.count(), "temporary file must not be left behind");
    }
  }

  @Test
  void saveReplacesPreviousContent() throws IOException {
    JsonFileBackendHealthStore store = new JsonFileBackendHealthStore(dir.resolve("health.json"));
    store.save(List.of(new PersistedHealth("a", 1d, 0L), new PersistedHealth("b", 0.5d, 10L)));

    store.save(List.of(new PersistedHealth("b", 0.75d, 20L)));

    assertEquals(List.of(new PersistedHealth("b", 0.75d, 20L)), store.load());
  }

  @Test
  void missingOrEmptyFileLoadsNothing() throws IOException {
    Path file = dir.resolve("health.json");
    JsonFileBackendHealthStore store = new JsonFileBackendHealthStore(file);
    assertTrue(store.load().isEmpty());

    Files.writeString(file, "", StandardCharsets.UTF_8);
    assertTrue(store.load().isEmpty());
  }

  @Test
  void unknownFieldsAreIgnored() throws IOException {
    Path file = dir.resolve("health.json");
    Files.writeString(file,
        "[{\"backendId\":\"remote-vision\",\"note\":{\"x\":[1]},\"rollingSuccessRate\":0.5}]",
        StandardCharsets.UTF_8);

    assertEquals(List.of(new PersistedHealth("remote-vision", 0.5d, 0L)),
        new JsonFileBackendHealthStore(file).load());
  }

  @Test
  void corruptContentIsIoFailure() throws IOException {
    Path file = dir.resolve("health.json");
    JsonFileBackendHealthStore store = new JsonFileBackendHealthStore(file);

    Files.writeString(file, "{\"backendId\":\"x\"}", StandardCharsets.UTF_8);
    assertThrows(IOException.class, store::load);

    Files.writeString(file, "[{\"backendId\":\"x\",\"rollingSuccessRate\":\"high\"}]", StandardCharsets.UTF_8);
    assertThrows(IOException.class, store::load);

    Files.writeString(file, "[{\"backendId\":\"x\",\"rollingSuccessRate\":1.7}]", StandardCharsets.UTF_8);
    assertThrows(IOException.class, store::load);

    Files.writeString(file, "[{\"backendId\":\"x\",", StandardCharsets.UTF_8);
    assertThrows(IOException.class, store::load);
  }
}
