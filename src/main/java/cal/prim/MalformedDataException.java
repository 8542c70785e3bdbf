package cal.prim;

/**
 * Thrown when stored bytes cannot be decoded: a serialized index that is not
 * legal JSON, a pack trailer that is truncated, or an object whose contents do
 * not match its name.
 */
public class MalformedDataException extends Exception {

  public MalformedDataException(String message) {
    super(message);
  }

  public MalformedDataException(String message, Throwable cause) {
    super(message, cause);
  }

}
