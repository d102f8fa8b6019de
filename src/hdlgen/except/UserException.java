package hdlgen.except;

import java.util.List;

/** Misuse of the API where no particular node is to blame (unknown names, malformed input files, ...). */
public class UserException extends IRException {
  private static final long serialVersionUID = 1L;

  public UserException(String message) { super(ErrorKind.User, message, List.of()); }

  public UserException(String message, Throwable cause) {
    this(message);
    initCause(cause);
  }
}
