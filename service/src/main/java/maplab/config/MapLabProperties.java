package maplab.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.util.List;
import maplab.grid.ColumnLabels;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Settings under the {@code maplab} prefix. Every nested block falls back to its defaults when
 * left out, so the record can also be built directly in tests.
 */
@ConfigurationProperties(prefix = "maplab")
@Validated
public record MapLabProperties(
    @Valid Columns columns,
    @Valid Parser parser,
    @Valid Interpolation interpolation,
    @Valid Api api,
    @Valid Samples samples) {

  public MapLabProperties {
    columns = columns != null ? columns : new Columns(null, null, null);
    parser = parser != null ? parser : new Parser(null, null, null);
    interpolation = interpolation != null ? interpolation : new Interpolation(false);
    api = api != null ? api : new Api(null, null);
    samples = samples != null ? samples : new Samples(false, null);
  }

  public static MapLabProperties defaults() {
    return new MapLabProperties(null, null, null, null, null);
  }

  /** Header names of the A axis, the B axis and the value column. */
  public record Columns(
      @NotBlank(message = "A axis column label is required") String a,
      @NotBlank(message = "B axis column label is required") String b,
      @NotBlank(message = "Value column label is required") String c) {

    public Columns {
      a = a != null ? a : ColumnLabels.DEFAULT.a();
      b = b != null ? b : ColumnLabels.DEFAULT.b();
      c = c != null ? c : ColumnLabels.DEFAULT.c();
    }

    public ColumnLabels labels() {
      return new ColumnLabels(a, b, c);
    }
  }

  public record Parser(
      /** Single field separator character. */
      @Size(min = 1, max = 1, message = "Delimiter must be a single character") String delimiter,

      /** Decimal places A and B are rounded to before grouping; unset keeps exact equality. */
      @Min(value = 0, message = "Coordinate scale cannot be negative")
          @Max(value = 12, message = "Coordinate scale cannot exceed 12 decimal places")
          Integer coordinateScale,

      /** Largest tolerated share of dropped rows; 1.0 never fails. */
      @DecimalMin(value = "0.0", message = "Invalid row fraction must be at least 0")
          @DecimalMax(value = "1.0", message = "Invalid row fraction cannot exceed 1")
          Double maxInvalidRowFraction) {

    public Parser {
      delimiter = delimiter != null ? delimiter : ",";
      maxInvalidRowFraction = maxInvalidRowFraction != null ? maxInvalidRowFraction : 1.0;
    }

    public char delimiterChar() {
      return delimiter.charAt(0);
    }
  }

  /** Normalise both axes to [0, 1] before triangulating and measuring distances. */
  public record Interpolation(boolean rescale) {}

  public record Api(@Valid LocalFiles localFiles, @Valid Cors cors) {

    public Api {
      localFiles = localFiles != null ? localFiles : new LocalFiles(null, null);
      cors = cors != null ? cors : new Cors(null);
    }
  }

  /** Whether {@code file_path} requests may read server-local files, and from where. */
  public record LocalFiles(Boolean enabled, String root) {

    public LocalFiles {
      enabled = enabled != null ? enabled : Boolean.TRUE;
    }
  }

  public record Cors(List<String> allowedOrigins) {

    public Cors {
      allowedOrigins = allowedOrigins != null
          ? List.copyOf(allowedOrigins)
          : List.of("http://localhost:5173", "http://localhost:3000");
    }
  }

  public record Samples(boolean enabled, @NotBlank String directory) {

    public Samples {
      directory = directory != null ? directory : "sample_data";
    }
  }
}
