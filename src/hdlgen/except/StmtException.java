package hdlgen.except;

import hdlgen.ir.IRNode;
import java.util.List;

/**
 * Raised for statement-graph violations such as conflicting drivers or statements placed where they are not allowed.
 */
public class StmtException extends IRException {
  private static final long serialVersionUID = 1L;

  public StmtException(String message, List<? extends IRNode> nodes) { super(ErrorKind.Stmt, message, nodes); }
}
