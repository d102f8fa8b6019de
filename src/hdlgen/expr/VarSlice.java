package hdlgen.expr;

import hdlgen.ir.IRNode;
import hdlgen.ir.IRVisitor;

/**
 * A constant part-select {@code parent[high:low]}. Always unsigned.
 * Slices of slices are rendered against the root value with absolute bounds.
 */
public class VarSlice extends Var {
  private final Var parent;
  private final int high;
  private final int low;

  VarSlice(Var parent, int high, int low) {
    super(parent.getGenerator(), "", high - low + 1, false, VarType.Slice);
    this.parent = parent;
    this.high = high;
    this.low = low;
  }

  public Var getParentVar() { return parent; }

  public int getHigh() { return high; }

  public int getLow() { return low; }

  @Override
  public Var getRootVar() {
    return parent.getRootVar();
  }

  @Override
  public IRNode getParent() {
    return parent;
  }

  /** Low bound relative to the closest parent that is not itself a {@code VarSlice}. */
  public int getAbsoluteLow() {
    return parent instanceof VarSlice ? ((VarSlice)parent).getAbsoluteLow() + low : low;
  }

  private Var getRenderBase() {
    return parent instanceof VarSlice ? ((VarSlice)parent).getRenderBase() : parent;
  }

  @Override
  public int childCount() {
    return 1;
  }

  @Override
  public IRNode getChild(int index) {
    if (index == 0)
      return parent;
    throw childIndexError(index);
  }

  @Override
  public void accept(IRVisitor visitor) {
    visitor.visit(this);
  }

  @Override
  public String toString() {
    Var base = getRenderBase();
    // a full select of a single bit value has no range in SystemVerilog
    if (base.getWidth() == 1)
      return base.toString();
    int absLow = getAbsoluteLow();
    int absHigh = absLow + width - 1;
    if (absHigh == absLow)
      return String.format("%s[%d]", base, absLow);
    return String.format("%s[%d:%d]", base, absHigh, absLow);
  }
}
