package hdlgen.expr;

import hdlgen.generator.Generator;
import hdlgen.ir.IRNode;
import hdlgen.ir.IRVisitor;
import java.util.List;

/**
 * An operator applied to one or two values. Width and sign follow {@link ExprOp}.
 * <p>
 * Use the builders on {@link Var}; they go through {@link Generator#expr(ExprOp, Var, Var)}, which returns the cached node when
 * the same operator is applied to the same operands again.
 */
public class Expr extends Var {
  private final ExprOp op;
  private final Var left;
  private final Var right;

  /**
   * @param right null for unary operators
   * @throws hdlgen.except.VarException if the operands violate the operator's rule
   */
  public Expr(ExprOp op, Var left, Var right) {
    super(checkedOwner(op, left, right), "", op.resultWidth(left, right), op.resultSigned(left, right), VarType.Expression);
    this.op = op;
    this.left = left;
    this.right = right;
  }

  private static Generator checkedOwner(ExprOp op, Var left, Var right) {
    op.checkOperands(left, right);
    return right == null ? left.getGenerator() : Var.ownerOf(List.of(left, right));
  }

  public ExprOp getOp() { return op; }

  public Var getLeft() { return left; }

  /** @return the right operand, null for unary operators */
  public Var getRight() { return right; }

  @Override
  public int childCount() {
    return right == null ? 1 : 2;
  }

  @Override
  public IRNode getChild(int index) {
    if (index == 0)
      return left;
    if (index == 1 && right != null)
      return right;
    throw childIndexError(index);
  }

  @Override
  public void accept(IRVisitor visitor) {
    visitor.visit(this);
  }

  /** Operands that are operator forms themselves are parenthesized. */
  static String operand(Var var) {
    if (var instanceof Expr || var instanceof ConditionalExpr)
      return "(" + var + ")";
    return var.toString();
  }

  @Override
  public String toString() {
    if (right == null)
      return op.symbol + operand(left);
    return operand(left) + " " + op.symbol + " " + operand(right);
  }
}
