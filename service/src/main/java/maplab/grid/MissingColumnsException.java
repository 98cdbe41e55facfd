package maplab.grid;

import java.util.List;

public class MissingColumnsException extends MapParseException {
  private final List<String> missing;
  private final List<String> found;

  public MissingColumnsException(List<String> missing, List<String> found) {
    super(MapParseErrorKind.MISSING_COLUMNS,
        "Missing required columns: " + missing + ". Found columns: " + found);
    this.missing = List.copyOf(missing);
    this.found = List.copyOf(found);
  }

  public List<String> missing() {
    return missing;
  }

  public List<String> found() {
    return found;
  }
}
