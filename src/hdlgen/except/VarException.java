package hdlgen.except;

import hdlgen.ir.IRNode;
import java.util.List;

/**
 * Raised when a value-graph builder receives operands it cannot combine: width or sign mismatch, bad slice range,
 * values from unrelated generators, constants out of range.
 */
public class VarException extends IRException {
  private static final long serialVersionUID = 1L;

  public VarException(String message, List<? extends IRNode> nodes) { super(ErrorKind.Var, message, nodes); }
}
