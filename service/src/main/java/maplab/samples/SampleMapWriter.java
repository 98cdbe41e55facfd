package maplab.samples;

import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import maplab.config.MapLabProperties;
import maplab.grid.ColumnLabels;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.core.env.Environment;
import org.springframework.core.env.Profiles;
import org.springframework.stereotype.Component;

/**
 * Writes a stock and a tuned ignition timing map for trying the parser out. Off unless
 * {@code maplab.samples.enabled=true}, and never under the {@code prod} profile.
 */
@Component
public class SampleMapWriter implements CommandLineRunner {

  private static final Logger log = LoggerFactory.getLogger(SampleMapWriter.class);

  static final int[] RPM_BREAKPOINTS = {1000, 2000, 3000, 4000, 5000, 6000};
  static final int[] LOAD_BREAKPOINTS = {20, 40, 60, 80, 100};
  static final String STOCK_FILE = "stock_map.csv";
  static final String TUNED_FILE = "tuned_map.csv";
  static final double TUNED_ADVANCE = 1.0;

  private final MapLabProperties.Samples samples;
  private final ColumnLabels labels;
  private final Environment environment;

  public SampleMapWriter(MapLabProperties properties, Environment environment) {
    this.samples = properties.samples();
    this.labels = properties.columns().labels();
    this.environment = environment;
  }

  @Override
  public void run(String... args) throws IOException {
    if (!samples.enabled()) {
      log.info("Sample map generation disabled via property maplab.samples.enabled=false");
      return;
    }
    if (environment.acceptsProfiles(Profiles.of("prod"))) {
      log.info("Skipping sample map generation because active profile includes prod");
      return;
    }
    writeSamples(Path.of(samples.directory()));
  }

  public List<Path> writeSamples(Path directory) throws IOException {
    Files.createDirectories(directory);
    Path stock = writeMap(directory.resolve(STOCK_FILE), 0.0);
    Path tuned = writeMap(directory.resolve(TUNED_FILE), TUNED_ADVANCE);
    log.info("Wrote sample maps {} and {} ({}x{} cells each)", stock, tuned,
        LOAD_BREAKPOINTS.length, RPM_BREAKPOINTS.length);
    return List.of(stock, tuned);
  }

  static double timing(int rpm, int load, double advance) {
    return rpm / 1000.0 + load / 10.0 + advance;
  }

  private Path writeMap(Path file, double advance) throws IOException {
    CsvSchema schema = CsvSchema.builder()
        .addColumn(labels.a())
        .addColumn(labels.b())
        .addColumn(labels.c())
        .setUseHeader(true)
        .build();
    try (Writer out = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
        SequenceWriter rows = new CsvMapper().writer(schema).writeValues(out)) {
      for (int rpm : RPM_BREAKPOINTS) {
        for (int load : LOAD_BREAKPOINTS) {
          Map<String, Object> row = new LinkedHashMap<>();
          row.put(labels.a(), rpm);
          row.put(labels.b(), load);
          row.put(labels.c(), timing(rpm, load, advance));
          rows.write(row);
        }
      }
    }
    return file;
  }
}
