package ca.gc.cra.mergeflow.infrastructure.csv;

import java.io.FilterReader;
import java.io.IOException;
import java.io.Reader;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.Optional;

/**
 * Character filter placed in front of the row parser for one source segment.
 *
 * <p>Follows the quoting state of every field. When trimming is enabled, whitespace at the start of a field is
 * dropped before the parser sees it, so a field such as {@code  "a,b"} still opens a quoted field; text inside
 * quotes is never touched. The filter also records the lines holding quoting faults the parser tolerates: a
 * quote inside an unquoted field, text after a closing quote, and a quoted field still open when the source
 * ends.</p>
 *
 * <p>Line numbers are 1-based and count CRLF, LF and a lone CR as one line break each, matching the parser's
 * starting line numbers.</p>
 *
 * <p>Not thread-safe; owned by one decode session.</p>
 */
final class QuoteTrackingReader extends FilterReader {
  private enum FieldState {
    FIELD_START,
    UNQUOTED,
    QUOTED,
    QUOTE_SEEN
  }

  /** A quoting fault and the line it was found on. */
  record Fault(long line, String reason) {}

  private final char delimiter;
  private final boolean trimLeading;
  private final Deque<Fault> faults = new ArrayDeque<>();
  private FieldState state = FieldState.FIELD_START;
  private long line = 1;
  private long quoteOpenedAt;
  private boolean afterCr;
  private boolean ended;

  QuoteTrackingReader(Reader in, char delimiter, boolean trimLeading) {
    super(Objects.requireNonNull(in, "in"));
    this.delimiter = delimiter;
    this.trimLeading = trimLeading;
  }

  @Override
  public int read() throws IOException {
    char[] one = new char[1];
    int n;
    do {
      n = read(one, 0, 1);
    } while (n == 0);
    return n < 0 ? -1 : one[0];
  }

  @Override
  public int read(char[] target, int offset, int length) throws IOException {
    Objects.checkFromIndexSize(offset, length, target.length);
    if (length == 0) {
      return 0;
    }
    while (true) {
      int n = in.read(target, offset, length);
      if (n < 0) {
        finish();
        return -1;
      }
      int kept = offset;
      for (int i = offset; i < offset + n; i++) {
        char c = target[i];
        if (accept(c)) {
          target[kept++] = c;
        }
      }
      if (kept > offset) {
        return kept - offset;
      }
    }
  }

  @Override
  public long skip(long count) throws IOException {
    if (count < 0) {
      throw new IllegalArgumentException("skip count must not be negative");
    }
    char[] scratch = new char[(int) Math.min(count, 1024)];
    long skipped = 0;
    while (skipped < count) {
      int n = read(scratch, 0, (int) Math.min(scratch.length, count - skipped));
      if (n < 0) {
        break;
      }
      skipped += n;
    }
    return skipped;
  }

  @Override
  public boolean markSupported() {
    return false;
  }

  @Override
  public void mark(int readAheadLimit) throws IOException {
    throw new IOException("mark not supported");
  }

  @Override
  public void reset() throws IOException {
    throw new IOException("reset not supported");
  }

  /**
   * Returns the first fault on lines {@code first} to {@code last}, forgetting faults on earlier lines.
   *
   * @param first line a row started on
   * @param last line the row ended on
   * @return first fault within the row, if any
   */
  Optional<Fault> faultWithin(long first, long last) {
    while (!faults.isEmpty() && faults.peekFirst().line() < first) {
      faults.pollFirst();
    }
    Fault head = faults.peekFirst();
    return head != null && head.line() <= last ? Optional.of(head) : Optional.empty();
  }

  Optional<Fault> firstFault() {
    return Optional.ofNullable(faults.peekFirst());
  }

  private boolean accept(char c) {
    if (c == '\n' || c == '\r') {
      if (c == '\r' || !afterCr) {
        line++;
      }
      afterCr = c == '\r';
      if (state != FieldState.QUOTED) {
        state = FieldState.FIELD_START;
      }
      return true;
    }
    afterCr = false;
    switch (state) {
      case FIELD_START -> {
        if (c == delimiter) {
          return true;
        }
        if (c == '"') {
          state = FieldState.QUOTED;
          quoteOpenedAt = line;
          return true;
        }
        if (trimLeading && Character.isWhitespace(c)) {
          return false;
        }
        state = FieldState.UNQUOTED;
        return true;
      }
      case UNQUOTED -> {
        if (c == delimiter) {
          state = FieldState.FIELD_START;
        } else if (c == '"') {
          fault(line, "bare quote in unquoted field");
        }
        return true;
      }
      case QUOTED -> {
        if (c == '"') {
          state = FieldState.QUOTE_SEEN;
        }
        return true;
      }
      default -> {
        if (c == '"') {
          state = FieldState.QUOTED;
        } else if (c == delimiter) {
          state = FieldState.FIELD_START;
        } else {
          state = FieldState.UNQUOTED;
          fault(line, "unexpected character after closing quote");
        }
        return true;
      }
    }
  }

  private void finish() {
    if (ended) {
      return;
    }
    ended = true;
    if (state == FieldState.QUOTED) {
      fault(quoteOpenedAt, "quoted field is not terminated");
    }
  }

  private void fault(long at, String reason) {
    Fault last = faults.peekLast();
    if (last == null || last.line() != at) {
      faults.addLast(new Fault(at, reason));
    }
  }
}
