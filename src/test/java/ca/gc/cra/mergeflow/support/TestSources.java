package ca.gc.cra.mergeflow.support;

import ca.gc.cra.mergeflow.application.port.Source;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.CountDownLatch;

/**
 * Sources with scripted failures for multiplexer and decoder tests.
 */
public final class TestSources {
  private TestSources() {}

  /** Source whose {@code open()} fails. */
  public static Source failingOpen(String name) {
    return new Source() {
      @Override
      public String name() {
        return name;
      }

      @Override
      public InputStream open() throws IOException {
        throw new IOException("permission denied");
      }
    };
  }

  /** Source that yields {@code prefix} and then fails the next read. */
  public static Source failingAfter(String name, String prefix) {
    byte[] data = prefix.getBytes(StandardCharsets.UTF_8);
    return new Source() {
      @Override
      public String name() {
        return name;
      }

      @Override
      public InputStream open() {
        return new InputStream() {
          private final ByteArrayInputStream delegate = new ByteArrayInputStream(data);

          @Override
          public int read() throws IOException {
            byte[] one = new byte[1];
            return read(one, 0, 1) < 0 ? -1 : one[0] & 0xFF;
          }

          @Override
          public int read(byte[] b, int off, int len) throws IOException {
            int n = delegate.read(b, off, len);
            if (n < 0) {
              throw new IOException("device error");
            }
            return n;
          }
        };
      }
    };
  }

  /** Source whose stream blocks until {@code release} opens; used to hold the producer mid-source. */
  public static Source blocking(String name, CountDownLatch release) {
    return new Source() {
      @Override
      public String name() {
        return name;
      }

      @Override
      public InputStream open() {
        return new InputStream() {
          @Override
          public int read() throws IOException {
            try {
              release.await();
            } catch (InterruptedException ex) {
              Thread.currentThread().interrupt();
              throw new IOException("interrupted", ex);
            }
            return -1;
          }

          @Override
          public int read(byte[] b, int off, int len) throws IOException {
            return read();
          }
        };
      }
    };
  }
}
