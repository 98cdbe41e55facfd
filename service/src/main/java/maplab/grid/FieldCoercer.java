package maplab.grid;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.OptionalDouble;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns the three required fields of every row into numbers. Cells that do not parse are treated
 * as missing and the row is dropped; only a table with no usable row fails.
 */
public final class FieldCoercer {
  private static final Logger log = LoggerFactory.getLogger(FieldCoercer.class);

  private static final Pattern DECIMAL =
      Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?");

  private FieldCoercer() {
  }

  public record Result(List<MapRecord> records, int rowsRead, int rowsDropped) {

    public Result {
      records = List.copyOf(records);
    }
  }

  public static Result coerce(RawTable table, ColumnLabels labels, double maxInvalidFraction) {
    int ia = table.columnIndex(labels.a());
    int ib = table.columnIndex(labels.b());
    int ic = table.columnIndex(labels.c());

    List<MapRecord> records = new ArrayList<>(table.rows().size());
    for (List<String> row : table.rows()) {
      OptionalDouble a = parseNumber(row.get(ia));
      OptionalDouble b = parseNumber(row.get(ib));
      OptionalDouble c = parseNumber(row.get(ic));
      if (a.isPresent() && b.isPresent() && c.isPresent()) {
        records.add(new MapRecord(a.getAsDouble(), b.getAsDouble(), c.getAsDouble()));
      }
    }

    int rowsRead = table.rows().size();
    int dropped = rowsRead - records.size();
    if (records.isEmpty()) {
      throw new NoValidDataException("No valid numeric data found in CSV after parsing");
    }
    if (dropped > 0) {
      log.debug("Dropped {} of {} rows from {} with missing or non-numeric fields",
          dropped, rowsRead, table.source());
      double fraction = (double) dropped / rowsRead;
      if (fraction > maxInvalidFraction) {
        throw new NoValidDataException(String.format(Locale.ROOT,
            "%d of %d rows have missing or non-numeric fields, above the allowed fraction %.3f",
            dropped, rowsRead, maxInvalidFraction));
      }
    }
    return new Result(records, rowsRead, dropped);
  }

  /**
   * Parses a plain decimal number. Blank, textual, non-finite, hexadecimal or suffixed values are
   * reported as absent rather than thrown.
   */
  public static OptionalDouble parseNumber(String raw) {
    if (raw == null) {
      return OptionalDouble.empty();
    }
    String text = raw.trim();
    if (text.isEmpty() || !DECIMAL.matcher(text).matches()) {
      return OptionalDouble.empty();
    }
    double value = Double.parseDouble(text);
    return Double.isFinite(value) ? OptionalDouble.of(value) : OptionalDouble.empty();
  }
}
