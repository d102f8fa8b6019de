package hdlgen.stmt;

import hdlgen.ir.IRNode;
import hdlgen.ir.IRVisitor;

/** Body of an if branch or a case item. Owned by its statement for its whole lifetime. */
public class ScopedStmtBlock extends StmtBlock {

  ScopedStmtBlock(IRNode owner) {
    super(StatementBlockType.Scope);
    setParent(owner);
  }

  @Override
  public void accept(IRVisitor visitor) {
    visitor.visit(this);
  }
}
