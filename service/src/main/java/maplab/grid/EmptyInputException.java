package maplab.grid;

public class EmptyInputException extends MapParseException {

  public EmptyInputException(String message) {
    super(MapParseErrorKind.EMPTY_INPUT, message);
  }
}
