package ca.gc.cra.mergeflow.infrastructure.csv;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class QuoteTrackingReaderTest {

  @Test
  void dropsLeadingWhitespaceOutsideQuotesOnly() throws IOException {
    QuoteTrackingReader reader = new QuoteTrackingReader(new StringReader("a,  \"b, c\",\t d\n"), ',', true);
    assertEquals("a,\"b, c\",d\n", readAll(reader));
    assertTrue(reader.firstFault().isEmpty());
  }

  @Test
  void passesTextThroughWhenTrimmingDisabled() throws IOException {
    QuoteTrackingReader reader = new QuoteTrackingReader(new StringReader("a, b\n"), ',', false);
    assertEquals("a, b\n", readAll(reader));
  }

  @Test
  void tabDelimiterIsNotTreatedAsWhitespace() throws IOException {
    QuoteTrackingReader reader = new QuoteTrackingReader(new StringReader("a\t\tb\n"), '\t', true);
    assertEquals("a\t\tb\n", readAll(reader));
  }

  @Test
  void recordsFaultLinesAcrossLineEndings() throws IOException {
    QuoteTrackingReader reader =
        new QuoteTrackingReader(new StringReader("h\r\nok\rx\"y\n\"a\"b\n"), ',', true);
    readAll(reader);

    Optional<QuoteTrackingReader.Fault> bare = reader.faultWithin(3, 3);
    assertEquals(3L, bare.orElseThrow().line());
    assertEquals("bare quote in unquoted field", bare.orElseThrow().reason());

    Optional<QuoteTrackingReader.Fault> afterQuote = reader.faultWithin(4, 4);
    assertEquals(4L, afterQuote.orElseThrow().line());
    assertEquals("unexpected character after closing quote", afterQuote.orElseThrow().reason());
  }

  @Test
  void openQuoteAtEndIsReportedOnTheLineItOpened() throws IOException {
    QuoteTrackingReader reader = new QuoteTrackingReader(new StringReader("h\n1,\"abc\nmore\n"), ',', true);
    readAll(reader);

    assertTrue(reader.faultWithin(1, 1).isEmpty());
    QuoteTrackingReader.Fault fault = reader.faultWithin(2, 4).orElseThrow();
    assertEquals(2L, fault.line());
    assertEquals("quoted field is not terminated", fault.reason());
  }

  private static String readAll(Reader reader) throws IOException {
    StringBuilder out = new StringBuilder();
    char[] buffer = new char[3];
    int n;
    while ((n = reader.read(buffer, 0, buffer.length)) >= 0) {
      out.append(buffer, 0, n);
    }
    return out.toString();
  }
}
