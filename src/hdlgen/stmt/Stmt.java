package hdlgen.stmt;

import hdlgen.generator.Generator;
import hdlgen.ir.IRNode;

/**
 * Base of all statements. A statement is attached to at most one parent (a block, an if/switch or a generator) at a time.
 */
public abstract class Stmt extends IRNode {
  private final StatementType type;
  private IRNode parent;
  private String comment = "";

  protected Stmt(StatementType type) { this.type = type; }

  public StatementType getStatementType() { return type; }

  @Override
  public IRNode getParent() {
    return parent;
  }

  /** Maintained by the containers; {@code null} detaches the statement. */
  public void setParent(IRNode parent) { this.parent = parent; }

  public String getComment() { return comment; }

  public void setComment(String comment) { this.comment = comment == null ? "" : comment; }

  /** The generator of the enclosing container, or null while unattached. */
  @Override
  public Generator getGenerator() {
    return parent == null ? null : parent.getGenerator();
  }
}
