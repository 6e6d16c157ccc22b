package ca.gc.cra.mergeflow.validation;

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
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("test", "\u0001bad"));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("test", "b\u0007ad"));
  }

  @Test
  void requireDelimiterAcceptsSingleCharacter() {
    assertEquals('\t', Strings.requireDelimiter("delimiter", "\t"));
    assertEquals('|', Strings.requireDelimiter("delimiter", '|'));
  }

  @Test
  void requireDelimiterRejectsQuotesAndLineTerminators() {
    assertThrows(IllegalArgumentException.class, () -> Strings.requireDelimiter("delimiter", '"'));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireDelimiter("delimiter", '\n'));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireDelimiter("delimiter", "\r"));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireDelimiter("delimiter", ",,"));
  }
}
