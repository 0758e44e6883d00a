package ca.siteguard.infrastructure.health;

import ca.siteguard.application.port.BackendHealthStore;
import ca.siteguard.application.port.PersistedHealth;
import com.fasterxml.jackson.core.JsonEncoding;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link BackendHealthStore} that keeps one JSON array of backend records in a file.
 * <p><strong>Format:</strong> {@code [{"backendId": "...", "rollingSuccessRate": 0.9, "lastFailureAtMillis": 0}]}.</p>
 * <p><strong>Durability:</strong> Writes go to a sibling temp file that is then moved over the target, atomically
 * where the file system supports it, so readers never observe a partial document.</p>
 * <p><strong>Thread-safety:</strong> {@link #save(List)} is synchronized; loads read whatever file is current.</p>
 *
 * @since SiteGuard 0.1
 */
public final class JsonFileBackendHealthStore implements BackendHealthStore {
  private static final Logger log = LoggerFactory.getLogger(JsonFileBackendHealthStore.class);

  private final Path file;
  private final JsonFactory factory = new JsonFactory();

  /**
   * Creates a store backed by {@code file}.
   *
   * @param file target JSON file; parent directories are created on first save
   */
  public JsonFileBackendHealthStore(Path file) {
    this.file = Objects.requireNonNull(file, "file").toAbsolutePath();
  }

  public Path file() {
    return file;
  }

  @Override
  public List<PersistedHealth> load() throws IOException {
    if (!Files.exists(file)) {
      return List.of();
    }
    List<PersistedHealth> records = new ArrayList<>();
    try (JsonParser parser = factory.createParser(file.toFile())) {
      JsonToken token = parser.nextToken();
      if (token == null) {
        return List.of();
      }
      if (token != JsonToken.START_ARRAY) {
        throw new IOException("Health store " + file + " must contain a JSON array");
      }
      while (parser.nextToken() == JsonToken.START_OBJECT) {
        records.add(readRecord(parser));
      }
    } catch (IllegalArgumentException ex) {
      throw new IOException("Health store " + file + " contains an invalid record", ex);
    }
    log.debug("Loaded {} backend health records from {}", records.size(), file);
    return List.copyOf(records);
  }

  @Override
  public synchronized void save(List<PersistedHealth> records) throws IOException {
    Objects.requireNonNull(records, "records");
    Path parent = file.getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    Path temp = Files.createTempFile(parent, file.getFileName().toString(), ".tmp");
    try {
      try (OutputStream out = Files.newOutputStream(temp);
          JsonGenerator gen = factory.createGenerator(out, JsonEncoding.UTF8)) {
        gen.useDefaultPrettyPrinter();
        gen.writeStartArray();
        for (PersistedHealth record : records) {
          gen.writeStartObject();
          gen.writeStringField("backendId", record.backendId());
          gen.writeNumberField("rollingSuccessRate", record.rollingSuccessRate());
          gen.writeNumberField("lastFailureAtMillis", record.lastFailureAtMillis());
          gen.writeEndObject();
        }
        gen.writeEndArray();
      }
      move(temp);
    } finally {
      Files.deleteIfExists(temp);
    }
    log.debug("Saved {} backend health records to {}", records.size(), file);
  }

  private void move(Path temp) throws IOException {
    try {
      Files.move(temp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    } catch (AtomicMoveNotSupportedException ex) {
      log.debug("Atomic move unsupported for {}; falling back to replace", file);
      Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
    }
  }

  private PersistedHealth readRecord(JsonParser parser) throws IOException {
    String backendId = null;
    double rate = Double.NaN;
    long lastFailure = 0L;
    while (parser.nextToken() == JsonToken.FIELD_NAME) {
      String field = parser.getCurrentName();
      JsonToken value = parser.nextToken();
      switch (field) {
        case "backendId" -> backendId = parser.getValueAsString();
        case "rollingSuccessRate" -> rate = requireNumber(parser, value, field).getDoubleValue();
        case "lastFailureAtMillis" -> lastFailure = requireNumber(parser, value, field).getLongValue();
        default -> parser.skipChildren();
      }
    }
    if (backendId == null || Double.isNaN(rate)) {
      throw new IllegalArgumentException("record requires backendId and rollingSuccessRate");
    }
    return new PersistedHealth(backendId, rate, lastFailure);
  }

  private static JsonParser requireNumber(JsonParser parser, JsonToken token, String field) {
    if (token != JsonToken.VALUE_NUMBER_INT && token != JsonToken.VALUE_NUMBER_FLOAT) {
      throw new IllegalArgumentException(field + " must be numeric");
    }
    return parser;
  }
}
