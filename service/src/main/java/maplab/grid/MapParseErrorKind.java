package maplab.grid;

import java.util.Locale;

public enum MapParseErrorKind {
  NOT_FOUND,
  EMPTY_INPUT,
  MISSING_COLUMNS,
  NO_VALID_DATA,
  INSUFFICIENT_DATA,
  UNFILLABLE_GRID,
  UNEXPECTED;

  public String slug() {
    return name().toLowerCase(Locale.ROOT).replace('_', '-');
  }
}
