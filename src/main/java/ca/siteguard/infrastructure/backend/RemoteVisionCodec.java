package ca.siteguard.infrastructure.backend;

import ca.siteguard.application.port.RawDetection;
import ca.siteguard.domain.image.AnalysisContext;
import ca.siteguard.domain.image.AnalysisImage;
import ca.siteguard.domain.image.GeoLocation;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * <strong>What:</strong> JSON codec for the remote vision service, built on Jackson streaming.
 * <p><strong>Request:</strong> {@code {"image": base64, "width": int, "height": int, "capturedAt": iso8601,
 * "location": {...}?, "workType": string, "attributes": {...}}}.</p>
 * <p><strong>Response:</strong> {@code {"detections": [{"label": string, "confidence": number,
 * "box": {"x", "y", "width", "height"}?}]}}; box values are pixels of the submitted image. Unknown fields are
 * ignored.</p>
 * <p><strong>Thread-safety:</strong> {@link JsonFactory} is thread-safe; the codec is stateless otherwise.</p>
 *
 * @since SiteGuard 0.1
 */
final class RemoteVisionCodec {
  private final JsonFactory factory = new JsonFactory();

  byte[] encodeRequest(AnalysisImage image, AnalysisContext context) throws IOException {
    ByteArrayOutputStream out = new ByteArrayOutputStream(image.byteCount() * 4 / 3 + 256);
    try (JsonGenerator gen = factory.createGenerator(out)) {
      gen.writeStartObject();
      gen.writeStringField("image", Base64.getEncoder().encodeToString(image.bytes()));
      gen.writeNumberField("width", image.width());
      gen.writeNumberField("height", image.height());
      gen.writeStringField("capturedAt", image.metadata().capturedAt().toString());
      GeoLocation location = image.metadata().location();
      if (location != null) {
        gen.writeObjectFieldStart("location");
        gen.writeNumberField("latitude", location.latitude());
        gen.writeNumberField("longitude", location.longitude());
        gen.writeNumberField("accuracyMeters", location.accuracyMeters());
        gen.writeEndObject();
      }
      gen.writeStringField("workType", context.workType());
      gen.writeObjectFieldStart("attributes");
      for (Map.Entry<String, String> entry : new TreeMap<>(context.attributes()).entrySet()) {
        gen.writeStringField(entry.getKey(), entry.getValue());
      }
      gen.writeEndObject();
      gen.writeEndObject();
    }
    return out.toByteArray();
  }

  /**
   * Decodes a response body.
   *
   * @param body response JSON
   * @return raw detections
   * @throws IOException when the body is not valid JSON
   * @throws IllegalArgumentException when the JSON does not have the expected shape
   */
  List<RawDetection> decodeResponse(String body) throws IOException {
    List<RawDetection> detections = new ArrayList<>();
    try (JsonParser parser = factory.createParser(body)) {
      expect(parser.nextToken(), JsonToken.START_OBJECT);
      while (parser.nextToken() == JsonToken.FIELD_NAME) {
        String field = parser.getCurrentName();
        JsonToken value = parser.nextToken();
        if ("detections".equals(field)) {
          expect(value, JsonToken.START_ARRAY);
          while (parser.nextToken() != JsonToken.END_ARRAY) {
            expect(parser.currentToken(), JsonToken.START_OBJECT);
            detections.add(readDetection(parser));
          }
        } else {
          parser.skipChildren();
        }
      }
      expect(parser.currentToken(), JsonToken.END_OBJECT);
    }
    return detections;
  }

  private RawDetection readDetection(JsonParser parser) throws IOException {
    String label = null;
    double confidence = Double.NaN;
    double[] box = {0d, 0d, 0d, 0d};
    while (parser.nextToken() == JsonToken.FIELD_NAME) {
      String field = parser.getCurrentName();
      JsonToken value = parser.nextToken();
      switch (field) {
        case "label" -> {
          expect(value, JsonToken.VALUE_STRING);
          label = parser.getText();
        }
        case "confidence" -> confidence = readNumber(parser, value);
        case "box" -> readBox(parser, value, box);
        default -> parser.skipChildren();
      }
    }
    if (label == null || Double.isNaN(confidence)) {
      throw new IllegalArgumentException("detection requires label and confidence");
    }
    return new RawDetection(label, confidence, box[0], box[1], box[2], box[3]);
  }

  private void readBox(JsonParser parser, JsonToken value, double[] box) throws IOException {
    if (value == JsonToken.VALUE_NULL) {
      return;
    }
    expect(value, JsonToken.START_OBJECT);
    while (parser.nextToken() == JsonToken.FIELD_NAME) {
      String field = parser.getCurrentName();
      JsonToken token = parser.nextToken();
      switch (field) {
        case "x" -> box[0] = readNumber(parser, token);
        case "y" -> box[1] = readNumber(parser, token);
        case "width" -> box[2] = readNumber(parser, token);
        case "height" -> box[3] = readNumber(parser, token);
        default -> parser.skipChildren();
      }
    }
  }

  private static double readNumber(JsonParser parser, JsonToken token) throws IOException {
    if (token != JsonToken.VALUE_NUMBER_INT && token != JsonToken.VALUE_NUMBER_FLOAT) {
      throw new IllegalArgumentException("Expected number but found " + token);
    }
    return parser.getDoubleValue();
  }

  private static void expect(JsonToken actual, JsonToken expected) {
    if (actual != expected) {
      throw new IllegalArgumentException("Expected " + expected + " but found " + actual);
    }
  }
}
