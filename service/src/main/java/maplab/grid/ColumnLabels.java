package maplab.grid;

import java.util.List;

/** Header names of the two independent axes and the dependent value. */
public record ColumnLabels(String a, String b, String c) {

  public static final ColumnLabels DEFAULT = new ColumnLabels("RPM", "Load", "Timing");

  public ColumnLabels {
    if (a == null || a.isBlank() || b == null || b.isBlank() || c == null || c.isBlank()) {
      throw new IllegalArgumentException("column labels must not be blank");
    }
  }

  public List<String> required() {
    return List.of(a, b, c);
  }
}
