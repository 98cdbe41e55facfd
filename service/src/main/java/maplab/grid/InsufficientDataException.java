package maplab.grid;

public class InsufficientDataException extends MapParseException {
  private final int knownCount;

  public InsufficientDataException(int knownCount) {
    super(MapParseErrorKind.INSUFFICIENT_DATA,
        "Insufficient valid data points (" + knownCount + ") for interpolation");
    this.knownCount = knownCount;
  }

  public int knownCount() {
    return knownCount;
  }
}
