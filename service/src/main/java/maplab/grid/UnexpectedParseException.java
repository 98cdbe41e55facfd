package maplab.grid;

public class UnexpectedParseException extends MapParseException {

  public UnexpectedParseException(String message) {
    super(MapParseErrorKind.UNEXPECTED, message);
  }

  public UnexpectedParseException(String message, Throwable cause) {
    super(MapParseErrorKind.UNEXPECTED, message, cause);
  }
}
