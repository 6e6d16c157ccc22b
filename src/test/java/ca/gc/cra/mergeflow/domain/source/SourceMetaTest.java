package ca.gc.cra.mergeflow.domain.source;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import org.junit.jupiter.api.Test;

class SourceMetaTest {

  @Test
  void advanceAccumulatesOffset() {
    SourceMeta start = SourceMeta.boundary("a.csv");
    assertTrue(start.isBoundary());

    SourceMeta moved = start.advance(10).advance(5);
    assertEquals(new SourceMeta("a.csv", 15), moved);
    assertFalse(moved.isBoundary());
    assertSame(moved, moved.advance(0));
    assertEquals("a.csv@15", moved.toString());
  }

  @Test
  void noneIsNotABoundary() {
    assertFalse(SourceMeta.NONE.isBoundary());
  }

  @Test
  void rejectsNegativeValues() {
    assertThrows(IllegalArgumentException.class, () -> new SourceMeta("a", -1));
    assertThrows(IllegalArgumentException.class, () -> SourceMeta.boundary("a").advance(-1));
  }

  @Test
  void sourceErrorsNameTheSource() {
    SourceOpenException open = new SourceOpenException("a.csv", new IOException("denied"));
    assertEquals("open a.csv: denied", open.getMessage());

    SourceReadException read = new SourceReadException("b.csv", 42, new IOException());
    assertEquals("read b.csv: IOException", read.getMessage());
    assertEquals(42L, read.bytesDelivered());
  }
}
