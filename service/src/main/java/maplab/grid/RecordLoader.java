package maplab.grid;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Reads a delimited table with a header row and checks that the required columns are present.
 * Rows must carry exactly as many fields as the header; anything else is a structural failure.
 */
public final class RecordLoader {
  private static final String BYTE_ORDER_MARK = "\uFEFF";

  private RecordLoader() {
  }

  public static RawTable load(Path path, ColumnLabels labels, char delimiter) {
    if (!Files.isRegularFile(path)) {
      throw new MapFileNotFoundException(path);
    }
    try {
      if (Files.size(path) == 0) {
        throw new EmptyInputException("File is empty: " + path);
      }
      try (InputStream in = Files.newInputStream(path)) {
        return load(in, path.toString(), labels, delimiter);
      }
    } catch (IOException ex) {
      throw new UnexpectedParseException("Unable to read " + path + ": " + ex.getMessage(), ex);
    }
  }

  public static RawTable load(InputStream in, String source, ColumnLabels labels, char delimiter) {
    List<String[]> lines = readLines(in, source, delimiter);
    if (lines.isEmpty()) {
      throw new EmptyInputException("CSV file is empty or has no data rows: " + source);
    }

    List<String> header = header(lines.get(0));
    List<String> missing = labels.required().stream()
        .filter(label -> !header.contains(label))
        .toList();
    if (!missing.isEmpty()) {
      throw new MissingColumnsException(missing, header);
    }

    if (lines.size() == 1) {
      throw new EmptyInputException("CSV file is empty or has no data rows: " + source);
    }

    List<List<String>> rows = new ArrayList<>(lines.size() - 1);
    for (int i = 1; i < lines.size(); i++) {
      String[] fields = lines.get(i);
      if (fields.length != header.size()) {
        // header is line 1, so data row i sits on line i + 1
        throw new UnexpectedParseException("CSV parsing error: expected " + header.size()
            + " fields in line " + (i + 1) + ", saw " + fields.length);
      }
      rows.add(Arrays.asList(fields));
    }
    return new RawTable(source, header, rows);
  }

  private static List<String[]> readLines(InputStream in, String source, char delimiter) {
    CsvSchema schema = CsvSchema.emptySchema().withColumnSeparator(delimiter);
    ObjectReader reader = new CsvMapper().readerFor(String[].class)
        .with(schema)
        .with(CsvParser.Feature.WRAP_AS_ARRAY)
        .with(CsvParser.Feature.SKIP_EMPTY_LINES)
        .with(CsvParser.Feature.TRIM_SPACES);

    List<String[]> lines = new ArrayList<>();
    try (Reader text = new InputStreamReader(in, StandardCharsets.UTF_8);
        MappingIterator<String[]> it = reader.readValues(text)) {
      while (it.hasNextValue()) {
        lines.add(it.nextValue());
      }
    } catch (IOException ex) {
      throw new UnexpectedParseException("CSV parsing error in " + source + ": " + ex.getMessage(),
          ex);
    }
    return lines;
  }

  private static List<String> header(String[] fields) {
    List<String> header = new ArrayList<>(fields.length);
    for (int i = 0; i < fields.length; i++) {
      String name = fields[i] == null ? "" : fields[i];
      if (i == 0 && name.startsWith(BYTE_ORDER_MARK)) {
        name = name.substring(BYTE_ORDER_MARK.length()).trim();
      }
      header.add(name);
    }
    return header;
  }
}
