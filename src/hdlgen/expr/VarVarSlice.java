package hdlgen.expr;

import hdlgen.ir.IRNode;
import hdlgen.ir.IRVisitor;

/** A bit select by a run-time index: {@code parent[index]}. */
public class VarVarSlice extends Var {
  private final Var parent;
  private final Var index;

  VarVarSlice(Var parent, Var index) {
    super(parent.getGenerator(), "", 1, false, VarType.Slice);
    this.parent = parent;
    this.index = index;
  }

  public Var getParentVar() { return parent; }

  public Var getIndex() { return index; }

  @Override
  public Var getRootVar() {
    return parent.getRootVar();
  }

  @Override
  public IRNode getParent() {
    return parent;
  }

  @Override
  public int childCount() {
    return 2;
  }

  @Override
  public IRNode getChild(int i) {
    if (i == 0)
      return parent;
    if (i == 1)
      return index;
    throw childIndexError(i);
  }

  @Override
  public void accept(IRVisitor visitor) {
    visitor.visit(this);
  }

  @Override
  public String toString() {
    return parent + "[" + index + "]";
  }
}
