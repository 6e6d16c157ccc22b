package ca.gc.cra.mergeflow.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.mergeflow.application.port.MappedIterator;
import ca.gc.cra.mergeflow.application.port.Source;
import ca.gc.cra.mergeflow.application.port.SourceResolver;
import ca.gc.cra.mergeflow.application.port.SourceStreamFactory;
import ca.gc.cra.mergeflow.domain.record.RecordParseException;
import ca.gc.cra.mergeflow.infrastructure.csv.DelimitedRecordDecoder;
import ca.gc.cra.mergeflow.infrastructure.mux.MultiplexerSettings;
import ca.gc.cra.mergeflow.infrastructure.mux.SourceMultiplexer;
import ca.gc.cra.mergeflow.infrastructure.source.InMemorySource;
import ca.gc.cra.mergeflow.support.RecordingMetricsPort;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

class MergeUseCaseTest {
  private final RecordingMetricsPort metrics = new RecordingMetricsPort();

  private final Map<String, List<Source>> catalogue = Map.of(
      "jan", List.of(InMemorySource.ofText("jan-1", "id,total\n1,10\n"), InMemorySource.ofText("jan-2", "id,total\n2,20\n")),
      "feb", List.of(InMemorySource.ofText("feb-1", "id,total\n3,30\n")),
      "bad", List.of(InMemorySource.ofText("bad-1", "id,total\n4\n")));

  private final SourceResolver resolver = spec -> {
    List<Source> sources = catalogue.get(spec);
    if (sources == null) {
      throw new IOException("no files matched: \"" + spec + "\"");
    }
    return sources;
  };

  private final SourceStreamFactory streams =
      sources -> SourceMultiplexer.start(sources, MultiplexerSettings.defaults(), metrics);

  @Test
  void runDeliversRecordsInSpecificationOrderWithSourceInMdc() throws Exception {
    MergeUseCase useCase = useCase(List.of("feb", "jan"));
    List<String> seen = new ArrayList<>();

    long delivered = useCase.run(record ->
        seen.add(record.byName("id").orElseThrow() + "@" + MDC.get(MergeUseCase.MDC_SOURCE)));

    assertEquals(3, delivered);
    assertEquals(List.of("3@feb-1", "1@jan-1", "2@jan-2"), seen);
    assertNull(MDC.get(MergeUseCase.MDC_SOURCE));
    assertEquals(1, metrics.count("merge.runs"));
    assertEquals(List.of(3L), metrics.observed("merge.records"));
  }

  @Test
  void runRestoresCallerMdc() throws Exception {
    MDC.put(MergeUseCase.MDC_SOURCE, "caller");
    try {
      useCase(List.of("feb")).run(record -> assertEquals("feb-1", MDC.get(MergeUseCase.MDC_SOURCE)));
      assertEquals("caller", MDC.get(MergeUseCase.MDC_SOURCE));
    } finally {
      MDC.remove(MergeUseCase.MDC_SOURCE);
    }
  }

  @Test
  void runRethrowsDecodeErrorAndLogsIt() {
    Logger logger = (Logger) LoggerFactory.getLogger(MergeUseCase.class);
    ListAppender<ILoggingEvent> appender = new ListAppender<>();
    boolean originalAdditive = logger.isAdditive();
    logger.setAdditive(false);
    appender.start();
    logger.addAppender(appender);
    try {
      MergeUseCase useCase = useCase(List.of("jan", "bad"));
      List<String> seen = new ArrayList<>();

      assertThrows(RecordParseException.class, () -> useCase.run(record -> seen.add(record.byIndex(0).orElseThrow())));

      assertEquals(List.of("1", "2"), seen);
      assertEquals(1, metrics.count("merge.failures"));
      assertTrue(appender.list.stream().anyMatch(event ->
          event.getLevel() == Level.ERROR && event.getFormattedMessage().equals("Merge failed after 2 records")));
    } finally {
      logger.detachAppender(appender);
      logger.setAdditive(originalAdditive);
    }
  }

  @Test
  void sinkFailureStopsTheRun() {
    IllegalStateException boom = new IllegalStateException("sink full");
    Exception thrown = assertThrows(Exception.class, () -> useCase(List.of("jan")).run(record -> {
      throw boom;
    }));
    assertSame(boom, thrown);
  }

  @Test
  void unresolvableSpecificationFailsBeforeStreaming() {
    IOException ex = assertThrows(IOException.class, () -> useCase(List.of("jan", "mar")).open());
    assertTrue(ex.getMessage().contains("mar"));
    assertEquals(0, metrics.count("merge.runs"));
  }

  @Test
  void openWithMapperProducesTypedValues() throws Exception {
    List<Integer> totals = new ArrayList<>();
    try (MappedIterator<Integer> values = useCase(List.of("jan", "feb"))
        .open(record -> Integer.parseInt(record.byName("total").orElseThrow()))) {
      while (values.next()) {
        totals.add(values.value());
      }
      assertTrue(values.error().isEmpty());
    }
    assertEquals(List.of(10, 20, 30), totals);
  }

  @Test
  void resolveSourcesConcatenatesInOrder() throws Exception {
    List<Source> sources = useCase(List.of("feb", "jan")).resolveSources();
    assertEquals(3, sources.size());
    assertInstanceOf(InMemorySource.class, sources.get(0));
    assertEquals("feb-1", sources.get(0).name());
  }

  private MergeUseCase useCase(List<String> specs) {
    return new MergeUseCase(specs, resolver, streams, new DelimitedRecordDecoder(), metrics);
  }
}
