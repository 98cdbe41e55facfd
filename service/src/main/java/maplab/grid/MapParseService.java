package maplab.grid;

import java.io.InputStream;
import java.nio.file.Path;
import java.util.List;
import java.util.function.Supplier;
import maplab.config.MapLabProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Turns a map table into a dense grid: load, coerce, aggregate duplicates, pivot, fill gaps.
 *
 * <p>Holds configuration only, so one instance serves concurrent calls. Every failure surfaces
 * as a {@link MapParseException}; anything the stages do not classify is wrapped in an
 * {@link UnexpectedParseException} with the original cause.
 */
@Service
public class MapParseService {
  private static final Logger log = LoggerFactory.getLogger(MapParseService.class);

  private final ColumnLabels labels;
  private final char delimiter;
  private final Integer coordinateScale;
  private final double maxInvalidRowFraction;
  private final boolean rescale;

  public MapParseService(MapLabProperties properties) {
    this.labels = properties.columns().labels();
    this.delimiter = properties.parser().delimiterChar();
    this.coordinateScale = properties.parser().coordinateScale();
    this.maxInvalidRowFraction = properties.parser().maxInvalidRowFraction();
    this.rescale = properties.interpolation().rescale();
  }

  public ColumnLabels labels() {
    return labels;
  }

  public ParsedMap parse(Path path) {
    return run(path.toString(), () -> RecordLoader.load(path, labels, delimiter));
  }

  public ParsedMap parse(InputStream in, String source) {
    return run(source, () -> RecordLoader.load(in, source, labels, delimiter));
  }

  private ParsedMap run(String source, Supplier<RawTable> loader) {
    try {
      RawTable table = loader.get();
      FieldCoercer.Result coerced = FieldCoercer.coerce(table, labels, maxInvalidRowFraction);
      List<AggregatedPoint> points = Aggregator.aggregate(coerced.records(), coordinateScale);
      SparseGrid sparse = GridBuilder.build(points);
      GapFiller.Result filled = GapFiller.fill(sparse, rescale);

      ParseReport report = new ParseReport(
          coerced.rowsRead(),
          coerced.rowsDropped(),
          points.size(),
          coerced.records().size() - points.size(),
          filled.interpolated(),
          filled.nearest());
      log.info("Parsed map {}: {} rows ({} dropped), grid {}x{}, {} gaps filled"
              + " ({} interpolated, {} nearest)",
          source, report.rowsRead(), report.rowsDropped(), sparse.rows(), sparse.cols(),
          report.gapsFilled(), report.gapsInterpolated(), report.gapsNearest());
      return new ParsedMap(filled.grid(), report);
    } catch (MapParseException ex) {
      log.debug("Parsing {} failed ({}): {}", source, ex.kind(), ex.getMessage());
      throw ex;
    } catch (RuntimeException ex) {
      throw new UnexpectedParseException("Unexpected error parsing map: " + ex.getMessage(), ex);
    }
  }
}
