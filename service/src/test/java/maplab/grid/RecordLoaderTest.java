package maplab.grid;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class RecordLoaderTest {

  @TempDir
  Path dir;

  private static RawTable load(String text) {
    return load(text, ',');
  }

  private static RawTable load(String text, char delimiter) {
    return RecordLoader.load(new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8)),
        "inline", ColumnLabels.DEFAULT, delimiter);
  }

  @Test
  void readsHeaderAndRows() {
    RawTable table = load("RPM,Load,Timing\n1000,20,3.0\n2000,20,4.0\n");

    assertThat(table.header()).containsExactly("RPM", "Load", "Timing");
    assertThat(table.rows()).hasSize(2);
    assertThat(table.rows().get(1)).containsExactly("2000", "20", "4.0");
  }

  @Test
  void keepsEmptyFieldsAsEmptyStrings() {
    RawTable table = load("RPM,Load,Timing\n1000,20,\n");

    assertThat(table.rows().get(0)).containsExactly("1000", "20", "");
  }

  @Test
  void acceptsExtraColumnsInAnyOrder() {
    RawTable table = load("Timing,Note,Load,RPM\n3.0,idle,20,1000\n");

    assertThat(table.columnIndex("RPM")).isEqualTo(3);
    assertThat(table.columnIndex("Timing")).isZero();
  }

  @Test
  void stripsByteOrderMarkFromFirstHeader() {
    RawTable table = load("\uFEFFRPM,Load,Timing\n1000,20,3.0\n");

    assertThat(table.header()).containsExactly("RPM", "Load", "Timing");
  }

  @Test
  void honoursConfiguredDelimiter() {
    RawTable table = load("RPM;Load;Timing\n1000;20;3.0\n", ';');

    assertThat(table.rows().get(0)).containsExactly("1000", "20", "3.0");
  }

  @Test
  void skipsBlankLines() {
    RawTable table = load("RPM,Load,Timing\n\n1000,20,3.0\n\n");

    assertThat(table.rows()).hasSize(1);
  }

  @Test
  void missingFileIsNotFound() {
    Path missing = dir.resolve("nope.csv");

    assertThatThrownBy(() -> RecordLoader.load(missing, ColumnLabels.DEFAULT, ','))
        .isInstanceOf(MapFileNotFoundException.class)
        .hasMessageContaining("File not found")
        .extracting(ex -> ((MapParseException) ex).kind())
        .isEqualTo(MapParseErrorKind.NOT_FOUND);
  }

  @Test
  void directoryIsNotFound() {
    assertThatThrownBy(() -> RecordLoader.load(dir, ColumnLabels.DEFAULT, ','))
        .isInstanceOf(MapFileNotFoundException.class);
  }

  @Test
  void zeroByteFileIsEmptyInput() throws IOException {
    Path empty = Files.createFile(dir.resolve("empty.csv"));

    assertThatThrownBy(() -> RecordLoader.load(empty, ColumnLabels.DEFAULT, ','))
        .isInstanceOf(EmptyInputException.class);
  }

  @Test
  void headerWithoutRowsIsEmptyInput() {
    assertThatThrownBy(() -> load("RPM,Load,Timing\n"))
        .isInstanceOf(EmptyInputException.class)
        .hasMessageContaining("no data rows");
  }

  @Test
  void blankContentIsEmptyInput() {
    assertThatThrownBy(() -> load("\n\n"))
        .isInstanceOf(EmptyInputException.class);
  }

  @Test
  void reportsExactlyTheMissingColumns() {
    assertThatThrownBy(() -> load("RPM,Throttle,Value\n1000,20,3.0\n"))
        .isInstanceOfSatisfying(MissingColumnsException.class, ex -> {
          assertThat(ex.missing()).containsExactly("Load", "Timing");
          assertThat(ex.found()).containsExactly("RPM", "Throttle", "Value");
          assertThat(ex.getMessage()).startsWith("Missing required columns");
        });
  }

  @Test
  void missingColumnsWinOverEmptyBody() {
    assertThatThrownBy(() -> load("X,Y,Z\n"))
        .isInstanceOf(MissingColumnsException.class);
  }

  @Test
  void shortRowIsStructuralFailure() {
    assertThatThrownBy(() -> load("RPM,Load,Timing\n1000,20\n2000"))
        .isInstanceOf(UnexpectedParseException.class)
        .hasMessageContaining("line 2");
  }

  @Test
  void longRowIsStructuralFailure() {
    assertThatThrownBy(() -> load("RPM,Load,Timing\n1000,20,3.0\n2000,20,4.0,9\n"))
        .isInstanceOf(UnexpectedParseException.class)
        .hasMessageContaining("expected 3 fields in line 3, saw 4");
  }

  @Test
  void readsFromDisk() throws IOException {
    Path file = dir.resolve("map.csv");
    Files.write(file, List.of("RPM,Load,Timing", "1000,20,3.0"));

    RawTable table = RecordLoader.load(file, ColumnLabels.DEFAULT, ',');

    assertThat(table.source()).isEqualTo(file.toString());
    assertThat(table.rows()).hasSize(1);
  }
}
