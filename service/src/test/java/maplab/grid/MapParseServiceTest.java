package maplab.grid;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import maplab.config.MapLabProperties;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class MapParseServiceTest {

  @TempDir
  Path dir;

  private final MapParseService service = new MapParseService(MapLabProperties.defaults());

  private Path csv(String name, String... lines) throws IOException {
    Path file = dir.resolve(name);
    Files.write(file, Arrays.asList(lines), StandardCharsets.UTF_8);
    return file;
  }

  @Test
  void parsesCompleteMap() throws IOException {
    Path file = csv("valid.csv",
        "RPM,Load,Timing",
        "1000,20,3.0", "2000,20,4.0", "3000,20,5.0",
        "1000,40,5.0", "2000,40,6.0", "3000,40,7.0");

    ParsedMap parsed = service.parse(file);
    MapGrid grid = parsed.grid();

    assertThat(grid.aAxis().toArray()).containsExactly(1000, 2000, 3000);
    assertThat(grid.bAxis().toArray()).containsExactly(20, 40);
    assertThat(grid.x()).hasDimensions(2, 3);
    assertThat(grid.y()).hasDimensions(2, 3);
    assertThat(grid.z()).hasDimensions(2, 3);
    assertThat(grid.flatten()).containsExactly(3, 4, 5, 5, 6, 7);
    assertThat(grid.x()[1]).containsExactly(1000, 2000, 3000);
    assertThat(grid.y()[1]).containsExactly(40, 40, 40);
    assertThat(parsed.report().gapsFilled()).isZero();
    assertThat(parsed.report().rowsRead()).isEqualTo(6);
  }

  @Test
  void averagesDuplicatePoints() throws IOException {
    Path file = csv("dup.csv",
        "RPM,Load,Timing",
        "1000,20,3.0", "1000,20,5.0", "1000,20,7.0",
        "2000,30,4.0", "2000,30,6.0",
        "1000,30,8.0", "2000,20,9.0");

    ParsedMap parsed = service.parse(file);

    assertThat(parsed.grid().value(0, 0)).isEqualTo(5.0);
    assertThat(parsed.grid().value(1, 1)).isEqualTo(5.0);
    assertThat(parsed.report().distinctPoints()).isEqualTo(4);
    assertThat(parsed.report().duplicatesMerged()).isEqualTo(3);
  }

  @Test
  void fillsCellsLostToBlankValues() throws IOException {
    Path file = csv("gaps.csv",
        "RPM,Load,Timing",
        "1000,20,3.0", "2000,20,4.0", "3000,20,", "4000,20,6.0",
        "1000,40,5.0", "2000,40,", "3000,40,7.0", "4000,40,8.0");

    ParsedMap parsed = service.parse(file);
    MapGrid grid = parsed.grid();

    assertThat(grid.rows()).isEqualTo(2);
    assertThat(grid.cols()).isEqualTo(4);
    assertThat(grid.value(0, 2)).isCloseTo(5.0, within(1e-9));
    assertThat(grid.value(1, 1)).isCloseTo(6.0, within(1e-9));
    assertThat(parsed.report().rowsDropped()).isEqualTo(2);
    assertThat(parsed.report().gapsInterpolated()).isEqualTo(2);
  }

  @Test
  void sparseCoverageStillYieldsDenseGrid() throws IOException {
    Path file = csv("sparse.csv",
        "RPM,Load,Timing",
        "1000,20,3.0", "5000,20,7.0", "3000,40,8.0",
        "1000,60,7.0", "5000,60,11.0");

    MapGrid grid = service.parse(file).grid();

    assertThat(grid.rows()).isEqualTo(3);
    assertThat(grid.cols()).isEqualTo(3);
    // linear blends and nearest values stay inside the measured range
    for (double v : grid.flatten()) {
      assertThat(v).isFinite().isBetween(3.0, 11.0);
    }
  }

  @Test
  void singleRowGivesOneCell() throws IOException {
    Path file = csv("single.csv", "RPM,Load,Timing", "1000,20,3.0");

    MapGrid grid = service.parse(file).grid();

    assertThat(grid.rows()).isEqualTo(1);
    assertThat(grid.cols()).isEqualTo(1);
    assertThat(grid.value(0, 0)).isEqualTo(3.0);
  }

  @Test
  void largeDuplicateValuesAreNotMistakenForGaps() throws IOException {
    Path file = csv("large.csv", "RPM,Load,Timing", "1,1,1e308", "1,1,1e308");

    MapGrid grid = service.parse(file).grid();

    assertThat(grid.value(0, 0)).isEqualTo(1e308);
  }

  @Test
  void extraColumnsDoNotChangeTheGrid() throws IOException {
    Path plain = csv("plain.csv",
        "RPM,Load,Timing",
        "1000,20,3.0", "2000,20,4.0", "1000,40,5.0", "2000,40,6.0");
    Path extra = csv("extra.csv",
        "Note,RPM,Load,Timing,Extra",
        "a,1000,20,3.0,x", "b,2000,20,4.0,y", "c,1000,40,5.0,z", "d,2000,40,6.0,w");

    assertThat(service.parse(extra).grid().flatten())
        .containsExactly(service.parse(plain).grid().flatten());
  }

  @Test
  void rowOrderDoesNotChangeTheGrid() throws IOException {
    List<String> rows = new ArrayList<>();
    for (int rpm = 1000; rpm <= 5000; rpm += 1000) {
      for (int load = 20; load <= 80; load += 20) {
        if ((rpm / 1000 + load / 20) % 3 != 0) {
          rows.add(rpm + "," + load + "," + (rpm / 1000.0 + load / 7.0));
        }
      }
    }
    rows.add("3000,40,1.5");
    List<String> lines = new ArrayList<>(rows);
    lines.add(0, "RPM,Load,Timing");
    double[] expected = service.parse(csv("ordered.csv", lines.toArray(String[]::new)))
        .grid().flatten();

    Random random = new Random(11);
    for (int i = 0; i < 5; i++) {
      Collections.shuffle(rows, random);
      List<String> shuffled = new ArrayList<>(rows);
      shuffled.add(0, "RPM,Load,Timing");
      double[] actual = service.parse(csv("shuffled" + i + ".csv", shuffled.toArray(String[]::new)))
          .grid().flatten();
      assertThat(actual).containsExactly(expected);
    }
  }

  @Test
  void missingFileIsNotFound() {
    assertThatThrownBy(() -> service.parse(dir.resolve("nonexistent_file.csv")))
        .isInstanceOf(MapFileNotFoundException.class)
        .hasMessageContaining("File not found");
  }

  @Test
  void emptyFileIsEmptyInput() throws IOException {
    Path file = Files.createFile(dir.resolve("empty.csv"));

    assertThatThrownBy(() -> service.parse(file)).isInstanceOf(EmptyInputException.class);
  }

  @Test
  void wrongColumnsAreMissingColumns() throws IOException {
    Path file = csv("wrong.csv", "X,Y,Z", "1,4,7", "2,5,8", "3,6,9");

    assertThatThrownBy(() -> service.parse(file))
        .isInstanceOf(MissingColumnsException.class)
        .hasMessageContaining("Missing required columns");
  }

  @Test
  void nonNumericTableHasNoValidData() throws IOException {
    Path file = csv("text.csv", "RPM,Load,Timing", "abc,xyz,one", "def,uvw,two", "ghi,rst,three");

    assertThatThrownBy(() -> service.parse(file))
        .isInstanceOf(NoValidDataException.class)
        .hasMessageContaining("No valid numeric data");
  }

  @Test
  void raggedRowsAreUnexpected() throws IOException {
    Path file = dir.resolve("malformed.csv");
    Files.writeString(file, "RPM,Load,Timing\n1000,20\n2000");

    assertThatThrownBy(() -> service.parse(file))
        .isInstanceOf(UnexpectedParseException.class)
        .extracting(ex -> ((MapParseException) ex).kind())
        .isEqualTo(MapParseErrorKind.UNEXPECTED);
  }

  @Test
  void twoDiagonalPointsAreInsufficient() throws IOException {
    Path file = csv("two.csv", "RPM,Load,Timing", "1000,20,3.0", "2000,40,5.0");

    assertThatThrownBy(() -> service.parse(file))
        .isInstanceOfSatisfying(InsufficientDataException.class,
            ex -> assertThat(ex.knownCount()).isEqualTo(2));
  }

  @Test
  void parsesFromStreamWithCustomColumns() {
    MapLabProperties properties = new MapLabProperties(
        new MapLabProperties.Columns("Speed", "Pressure", "Fuel"),
        new MapLabProperties.Parser(";", null, null),
        null, null, null);
    MapParseService custom = new MapParseService(properties);
    String text = "Speed;Pressure;Fuel\n800;30;1.2\n1600;30;1.4\n800;60;2.2\n1600;60;2.4\n";

    MapGrid grid = custom.parse(
        new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8)), "upload").grid();

    assertThat(custom.labels()).isEqualTo(new ColumnLabels("Speed", "Pressure", "Fuel"));
    assertThat(grid.flatten()).containsExactly(1.2, 1.4, 2.2, 2.4);
  }

  @Test
  void concurrentCallsAgree() throws Exception {
    Path file = csv("shared.csv",
        "RPM,Load,Timing",
        "1000,20,3.0", "2000,20,4.0", "3000,20,5.0",
        "1000,40,5.0", "3000,40,7.0",
        "1000,60,7.0", "2000,60,8.0");
    double[] expected = service.parse(file).grid().flatten();

    ExecutorService pool = Executors.newFixedThreadPool(4);
    try {
      List<Future<double[]>> results = new ArrayList<>();
      for (int i = 0; i < 16; i++) {
        results.add(pool.submit(() -> service.parse(file).grid().flatten()));
      }
      for (Future<double[]> result : results) {
        assertThat(result.get()).containsExactly(expected);
      }
    } finally {
      pool.shutdownNow();
    }
  }
}
