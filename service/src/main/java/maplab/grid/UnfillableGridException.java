package maplab.grid;

public class UnfillableGridException extends MapParseException {
  private final int remainingGaps;

  public UnfillableGridException(int remainingGaps) {
    super(MapParseErrorKind.UNFILLABLE_GRID,
        "Unable to completely fill all gaps in grid (" + remainingGaps + " remaining)");
    this.remainingGaps = remainingGaps;
  }

  public int remainingGaps() {
    return remainingGaps;
  }
}
