package hdlgen.except;

import java.util.List;

/** A defect inside the core, e.g. a node kind reaching a renderer that cannot handle it. */
public class InternalException extends IRException {
  private static final long serialVersionUID = 1L;

  public InternalException(String message) { super(ErrorKind.Internal, message, List.of()); }
}
