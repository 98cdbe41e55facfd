package maplab.grid;

/**
 * Base type for every failure of the map transform. The {@link #kind()} stays machine-readable
 * so callers can map failures without inspecting messages.
 */
public abstract class MapParseException extends RuntimeException {
  private final MapParseErrorKind kind;

  protected MapParseException(MapParseErrorKind kind, String message) {
    super(message);
    this.kind = kind;
  }

  protected MapParseException(MapParseErrorKind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = kind;
  }

  public MapParseErrorKind kind() {
    return kind;
  }
}
