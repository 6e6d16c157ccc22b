package ca.gc.cra.mergeflow.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class LogsTest {

  @Test
  void shortValuesAreUnchanged() {
    assertEquals("abc", Logs.truncate("abc", 8));
    assertEquals("<null>", Logs.truncate(null, 8));
  }

  @Test
  void longValuesAreCutOnCharacterBoundary() {
    String truncated = Logs.truncate("ééééé", 3);
    assertTrue(truncated.startsWith("é... (truncated, 3 of 10)"), truncated);
  }

  @Test
  void rowSnippetIsBounded() {
    String row = Logs.row(List.of("x".repeat(1000)));
    assertTrue(row.length() < 400, row);
    assertEquals("[a, b]", Logs.row(List.of("a", "b")));
  }

  @Test
  void rejectsNonPositiveLimit() {
    assertThrows(IllegalArgumentException.class, () -> Logs.truncate("abc", 0));
  }
}
