package hdlgen.stmt;

import hdlgen.except.StmtException;
import hdlgen.expr.EnumTyped;
import hdlgen.expr.InterfaceTyped;
import hdlgen.expr.Var;
import hdlgen.generator.Generator;
import hdlgen.ir.IRNode;
import hdlgen.ir.IRVisitor;
import java.util.List;

/** {@code if (predicate) ... else ...}. Both bodies always exist; an empty else body is not emitted. */
public class IfStmt extends Stmt {
  private final Var predicate;
  private final ScopedStmtBlock thenBody;
  private final ScopedStmtBlock elseBody;

  /** @throws StmtException if the predicate is not a single plain bit; enum values are tested with {@link Var#eq(Var)} */
  public IfStmt(Var predicate) {
    super(StatementType.If);
    if (predicate.getWidth() != 1 || predicate instanceof InterfaceTyped)
      throw new StmtException("if predicate " + predicate + " must be 1 bit wide", List.of(predicate));
    if (predicate instanceof EnumTyped)
      throw new StmtException("if predicate " + predicate + " is an enum value; compare it with a named value instead",
                              List.of(predicate));
    this.predicate = predicate;
    this.thenBody = new ScopedStmtBlock(this);
    this.elseBody = new ScopedStmtBlock(this);
  }

  public Var getPredicate() { return predicate; }

  public ScopedStmtBlock thenBody() { return thenBody; }

  public ScopedStmtBlock elseBody() { return elseBody; }

  /** @return this, for chaining */
  public IfStmt addThenStmt(Stmt stmt) {
    thenBody.addStmt(stmt);
    return this;
  }

  /** @return this, for chaining */
  public IfStmt addElseStmt(Stmt stmt) {
    elseBody.addStmt(stmt);
    return this;
  }

  /** True if the else body consists of exactly one if statement, which is emitted as {@code else if}. */
  public boolean hasElseIf() { return elseBody.size() == 1 && elseBody.getStmts().get(0) instanceof IfStmt; }

  @Override
  public Generator getGenerator() {
    Generator generator = super.getGenerator();
    return generator != null ? generator : predicate.getGenerator();
  }

  @Override
  public int childCount() {
    return 3;
  }

  @Override
  public IRNode getChild(int index) {
    switch (index) {
    case 0:
      return predicate;
    case 1:
      return thenBody;
    case 2:
      return elseBody;
    default:
      throw childIndexError(index);
    }
  }

  @Override
  public void accept(IRVisitor visitor) {
    visitor.visit(this);
  }

  @Override
  public String toString() {
    return "if (" + predicate + ")";
  }
}
