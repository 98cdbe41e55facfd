package maplab.grid;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ParseReport(
    @JsonProperty("rows_read") int rowsRead,
    @JsonProperty("rows_dropped") int rowsDropped,
    @JsonProperty("distinct_points") int distinctPoints,
    @JsonProperty("duplicates_merged") int duplicatesMerged,
    @JsonProperty("gaps_interpolated") int gapsInterpolated,
    @JsonProperty("gaps_nearest") int gapsNearest
) {

  public int gapsFilled() {
    return gapsInterpolated + gapsNearest;
  }
}
