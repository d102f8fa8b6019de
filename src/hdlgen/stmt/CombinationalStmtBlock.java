package hdlgen.stmt;

import hdlgen.except.StmtException;
import hdlgen.ir.IRVisitor;
import java.util.List;

/** {@code always_comb}. A value may be the target of at most one unconditioned assignment in the block. */
public class CombinationalStmtBlock extends StmtBlock {

  public CombinationalStmtBlock() { super(StatementBlockType.Combinational); }

  @Override
  protected void checkConflicts(Stmt stmt) {
    if (!(stmt instanceof AssignStmt))
      return;
    AssignStmt assign = (AssignStmt)stmt;
    for (Stmt existing : getStmts()) {
      if (existing instanceof AssignStmt && ((AssignStmt)existing).getTarget() == assign.getTarget())
        throw new StmtException(assign.getTarget() + " is already driven in this block", List.of(existing, assign));
    }
  }

  @Override
  public void accept(IRVisitor visitor) {
    visitor.visit(this);
  }
}
