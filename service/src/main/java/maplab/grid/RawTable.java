package maplab.grid;

import java.util.List;

/**
 * Rows exactly as read from the source, every row holding one string per header column.
 */
public record RawTable(String source, List<String> header, List<List<String>> rows) {

  public RawTable {
    header = List.copyOf(header);
    rows = List.copyOf(rows);
  }

  public int columnIndex(String label) {
    return header.indexOf(label);
  }
}
