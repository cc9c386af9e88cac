package hwprint.printable;

/**
 * Thrown when a printable message cannot be built or flattened: malformed directive syntax (a stray <code>%</code>),
 * a directive that does not fit the kind of its argument, or a template whose parts and arguments do not line up.
 */
@SuppressWarnings("serial")
public class FormatException extends IllegalArgumentException {

  public FormatException(String message) { super(message); }

  public FormatException(String message, Throwable cause) { super(message, cause); }
}
