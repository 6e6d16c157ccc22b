package ca.gc.cra.mergeflow.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;

import ca.gc.cra.mergeflow.application.pipeline.MergeUseCase;
import ca.gc.cra.mergeflow.domain.record.RecordView;
import ca.gc.cra.mergeflow.infrastructure.csv.DelimitedRecordDecoder;
import ca.gc.cra.mergeflow.infrastructure.metrics.NoOpMetricsAdapter;
import ca.gc.cra.mergeflow.support.RecordingMetricsPort;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CompositionRootTest {

  @TempDir Path tempDir;

  @Test
  void metricsDisabledUsesNoOpAdapter() {
    try (CompositionRoot root = new CompositionRoot(MergeConfig.defaults(), tempDir)) {
      assertInstanceOf(NoOpMetricsAdapter.class, root.metrics());
      assertInstanceOf(DelimitedRecordDecoder.class, root.recordDecoder());
    }
  }

  @Test
  void mergeUseCaseReadsConfiguredFilesEndToEnd() throws Exception {
    Files.createDirectories(tempDir.resolve("in"));
    Files.writeString(tempDir.resolve("in/01.psv"), "id|city\n1|Ottawa\n");
    Files.writeString(tempDir.resolve("in/02.psv"), "id|city\n2|Gatineau\n");
    Path yaml = tempDir.resolve("mergeflow.yaml");
    Files.writeString(yaml, """
        sources:
          - in/*.psv
        decoder:
          delimiter: "|"
        multiplexer:
          chunkBytes: 5
        """);
    RecordingMetricsPort metrics = new RecordingMetricsPort();

    List<String> cities = new ArrayList<>();
    try (CompositionRoot root = new CompositionRoot(MergeConfig.load(yaml), tempDir, metrics)) {
      MergeUseCase useCase = root.mergeUseCase();
      long delivered = useCase.run((RecordView record) -> cities.add(record.byName("city").orElseThrow()));
      assertEquals(2, delivered);
    }
    assertEquals(List.of("Ottawa", "Gatineau"), cities);
    assertEquals(2, metrics.count("mux.source.opened"));
    assertEquals(1, metrics.count("decode.headers.skipped"));
  }
}
