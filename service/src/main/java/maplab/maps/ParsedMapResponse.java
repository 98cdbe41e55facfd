package maplab.maps;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import maplab.grid.ColumnLabels;
import maplab.grid.MapGrid;
import maplab.grid.ParseReport;
import maplab.grid.ParsedMap;

// Field names are the ones the map viewer front end reads
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ParsedMapResponse(
    @JsonProperty("rpm_axis") List<Double> aAxis,
    @JsonProperty("load_axis") List<Double> bAxis,
    @JsonProperty("z_grid_flat") List<Double> zGridFlat,
    Shape shape,
    @JsonProperty("total_points") int totalPoints,
    Map<String, String> labels,
    ParseReport diagnostics
) {

  public record Shape(int rows, int cols) {}

  public static ParsedMapResponse from(ParsedMap parsed, ColumnLabels labels) {
    MapGrid grid = parsed.grid();
    List<Double> flat = boxed(grid.flatten());
    Map<String, String> axisLabels = new LinkedHashMap<>();
    axisLabels.put("x", labels.a());
    axisLabels.put("y", labels.b());
    axisLabels.put("z", labels.c());
    return new ParsedMapResponse(
        boxed(grid.aAxis().toArray()),
        boxed(grid.bAxis().toArray()),
        flat,
        new Shape(grid.rows(), grid.cols()),
        flat.size(),
        axisLabels,
        parsed.report());
  }

  private static List<Double> boxed(double[] values) {
    return Arrays.stream(values).boxed().toList();
  }
}
