package maplab.grid;

import java.nio.file.Path;

public class MapFileNotFoundException extends MapParseException {
  private final Path path;

  public MapFileNotFoundException(Path path) {
    super(MapParseErrorKind.NOT_FOUND, "File not found: " + path);
    this.path = path;
  }

  public Path path() {
    return path;
  }
}
