package ca.siteguard.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class StringsTest {

  @Test
  void requireNonBlankStripsWhitespace() {
    assertEquals("value", Strings.requireNonBlank("test", "  value  "));
  }

  @Test
  void requireNonBlankRejectsControlCharacters() {
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("test", "bad\u0001"));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("test", "   "));
    assertThrows(NullPointerException.class, () -> Strings.requireNonBlank("test", null));
  }

  @Test
  void requireIdentifierAllowsBackendIds() {
    assertEquals("remote-vision.v2_eu", Strings.requireIdentifier("backendId", " remote-vision.v2_eu "));
  }

  @Test
  void requireIdentifierRejectsSpaces() {
    assertThrows(IllegalArgumentException.class, () -> Strings.requireIdentifier("backendId", "remote vision"));
  }

  @Test
  void requirePrintableAsciiRejectsNonAscii() {
    assertThrows(IllegalArgumentException.class,
        () -> Strings.requirePrintableAscii("attributes", "site=café", 64));
  }

  @Test
  void requirePrintableAsciiRejectsExcessLength() {
    assertThrows(IllegalArgumentException.class, () -> Strings.requirePrintableAscii("attributes", "abc", 2));
  }
}
