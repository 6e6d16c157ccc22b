package ca.gc.cra.mergeflow.domain.record;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.mergeflow.domain.source.SourceMeta;
import java.util.List;
import java.util.OptionalInt;
import org.junit.jupiter.api.Test;

class HeaderTest {

  @Test
  void indexesNamesByPosition() throws Exception {
    Header header = Header.of(List.of("id", "name", "amount"));
    assertEquals(3, header.size());
    assertEquals(OptionalInt.of(1), header.indexOf("name"));
    assertEquals(OptionalInt.empty(), header.indexOf("missing"));
    assertEquals(OptionalInt.empty(), header.indexOf(null));
  }

  @Test
  void matchesOnlyIdenticalRows() throws Exception {
    Header header = Header.of(List.of("a", "b"));
    assertTrue(header.matches(List.of("a", "b")));
    assertFalse(header.matches(List.of("a", "B")));
    assertFalse(header.matches(List.of("a")));
    assertFalse(header.matches(null));
  }

  @Test
  void rejectsDuplicateNames() {
    HeaderConfigurationException ex =
        assertThrows(HeaderConfigurationException.class, () -> Header.of(List.of("a", "b", "a")));
    assertEquals("malformed header: duplicate entry a in header", ex.getMessage());
  }

  @Test
  void rejectsEmptyHeader() {
    assertThrows(HeaderConfigurationException.class, () -> Header.of(List.of()));
  }

  @Test
  void recordRejectsFieldCountThatDiffersFromHeader() throws Exception {
    Header header = Header.of(List.of("a", "b"));
    assertThrows(IllegalArgumentException.class,
        () -> new DelimitedRecord(header, List.of("1"), SourceMeta.boundary("x"), 1));
  }
}
