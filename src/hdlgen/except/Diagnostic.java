package hdlgen.except;

import java.util.List;

/**
 * Structured form of an {@link IRException}, for callers that want to format or compare diagnostics without the exception object.
 * @param kind the error kind
 * @param message the message without the node listing
 * @param nodes the implicated nodes, rendered by {@link hdlgen.ir.NodePrinter}
 */
public record Diagnostic(ErrorKind kind, String message, List<String> nodes) {
  public Diagnostic {
    nodes = List.copyOf(nodes);
  }

  @Override
  public String toString() {
    StringBuilder builder = new StringBuilder();
    builder.append(kind).append(": ").append(message);
    for (String node : nodes)
      builder.append("\n\t").append(node);
    return builder.toString();
  }
}
