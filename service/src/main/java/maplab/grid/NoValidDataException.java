package maplab.grid;

public class NoValidDataException extends MapParseException {

  public NoValidDataException(String message) {
    super(MapParseErrorKind.NO_VALID_DATA, message);
  }
}
