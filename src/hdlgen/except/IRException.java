package hdlgen.except;

import hdlgen.ir.IRNode;
import hdlgen.ir.NodePrinter;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Base of all diagnostics raised by the core. Carries the error kind and the ordered list of nodes responsible for the failure.
 */
public abstract class IRException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final ErrorKind kind;
  private final String plainMessage;
  private final transient List<IRNode> nodes;

  protected IRException(ErrorKind kind, String message, List<? extends IRNode> nodes) {
    super(message);
    this.kind = kind;
    this.plainMessage = message;
    this.nodes = List.copyOf(nodes);
  }

  public ErrorKind getKind() { return kind; }

  /** @return the implicated nodes, in the order given at the failure site */
  public List<IRNode> getNodes() { return nodes; }

  /** @return the message without the rendered node listing */
  public String getPlainMessage() { return plainMessage; }

  @Override
  public String getMessage() {
    if (nodes.isEmpty())
      return plainMessage;
    return plainMessage + "\n" + NodePrinter.printNodes(nodes);
  }

  public Diagnostic toDiagnostic() {
    return new Diagnostic(kind, plainMessage, nodes.stream().map(NodePrinter::print).collect(Collectors.toList()));
  }
}
