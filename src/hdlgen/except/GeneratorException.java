package hdlgen.except;

import hdlgen.ir.IRNode;
import java.util.List;

/**
 * Raised for module container violations: name clashes, hierarchy cycles and unconnected mandatory ports.
 */
public class GeneratorException extends IRException {
  private static final long serialVersionUID = 1L;

  public GeneratorException(String message, List<? extends IRNode> nodes) { super(ErrorKind.Generator, message, nodes); }
}
