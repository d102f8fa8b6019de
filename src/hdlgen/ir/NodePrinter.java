package hdlgen.ir;

import hdlgen.generator.Generator;
import java.util.Collection;
import java.util.stream.Collectors;

/**
 * Renders nodes for diagnostics. Used by every exception kind so that messages describe the offending nodes the same way.
 */
public class NodePrinter {
  private NodePrinter() {}

  /**
   * Renders a single node as {@code <text> (<class> in <generator>)}.
   * Falls back to the class name when the node has no textual rendering.
   */
  public static String print(IRNode node) {
    if (node == null)
      return "<null>";
    String text;
    try {
      text = node.toString();
    } catch (RuntimeException e) {
      text = "";
    }
    if (text == null || text.isEmpty())
      text = "<anonymous>";
    String kind = node.getClass().getSimpleName();
    if (node instanceof Generator)
      return String.format("%s (%s)", text, kind);
    Generator generator = node.getGenerator();
    if (generator == null)
      return String.format("%s (%s, unattached)", text, kind);
    return String.format("%s (%s in %s)", text, kind, generator.getName());
  }

  /** Renders each node on its own line, prefixed with a tab. */
  public static String printNodes(Collection<? extends IRNode> nodes) {
    return nodes.stream().map(node -> "\t" + print(node)).collect(Collectors.joining("\n"));
  }
}
