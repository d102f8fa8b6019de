package hdlgen.ir;

import hdlgen.except.InternalException;
import hdlgen.generator.Generator;

/**
 * Base of everything that lives in the design graph: generators, values and statements.
 * <p>
 * Nodes are compared by reference. Subclasses must not override {@link Object#equals(Object)} or {@link Object#hashCode()}, since
 * slice caches, sink sets and the serializer's reference table all key on node identity.
 * <p>
 * {@link #childCount()} and {@link #getChild(int)} expose the ordered structural children of a node;
 * {@code getChild} accepts exactly the indices {@code 0 .. childCount()-1}.
 */
public abstract class IRNode {

  /** @return the number of ordered structural children */
  public abstract int childCount();

  /**
   * Retrieves a structural child.
   * @param index child index in {@code [0, childCount())}
   * @return the child node
   * @throws InternalException if the index is out of range
   */
  public abstract IRNode getChild(int index);

  /** Double dispatch into the visitor method for the concrete node class. */
  public abstract void accept(IRVisitor visitor);

  /** @return the structural parent, or null for unattached nodes and nodes without one */
  public IRNode getParent() { return null; }

  /** @return the generator this node belongs to, or null if not (yet) attached to one */
  public abstract Generator getGenerator();

  protected InternalException childIndexError(int index) {
    return new InternalException(String.format("child index %d out of range for %s with %d children", index,
                                               getClass().getSimpleName(), childCount()));
  }
}
