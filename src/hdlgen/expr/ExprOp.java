package hdlgen.expr;

import hdlgen.except.VarException;
import java.util.List;

/**
 * Expression operators together with their width/sign promotion rules.
 * No operator widens or truncates implicitly; mismatching operands must be brought in line with
 * {@link Var#extend(int)}, {@link Var#castSigned()} or {@link Var#castUnsigned()} first.
 */
public enum ExprOp {
  /** {@code ~a}: width and sign of the operand. */
  UInvert("~", Category.Unary),
  /** {@code -a}: width and sign of the operand. */
  UMinus("-", Category.Unary),
  /** {@code +a}: width and sign of the operand. */
  UPlus("+", Category.Unary),
  /** {@code !a}: 1 bit, unsigned. */
  UNot("!", Category.Reduction),
  /** {@code &a}: 1 bit, unsigned. */
  UAnd("&", Category.Reduction),
  /** {@code |a}: 1 bit, unsigned. */
  UOr("|", Category.Reduction),
  /** {@code ^a}: 1 bit, unsigned. */
  UXor("^", Category.Reduction),

  /** {@code a + b}: operands of equal width and sign; result has the operand width and sign. */
  Add("+", Category.Arithmetic),
  /** {@code a - b}: operands of equal width and sign; result has the operand width and sign. */
  Minus("-", Category.Arithmetic),
  /** {@code a / b}: operands of equal width and sign; result has the operand width and sign. */
  Divide("/", Category.Arithmetic),
  /** {@code a * b}: operands of equal width and sign; result has the operand width and sign. */
  Multiply("*", Category.Arithmetic),
  /** {@code a % b}: operands of equal width and sign; result has the operand width and sign. */
  Mod("%", Category.Arithmetic),
  /** {@code a >> b}: shift amount unsigned and of any width; result has the width and sign of a. */
  LogicalShiftRight(">>", Category.Shift),
  /** {@code a >>> b}: shift amount unsigned and of any width; result has the width and sign of a. */
  SignedShiftRight(">>>", Category.Shift),
  /** {@code a << b}: shift amount unsigned and of any width; result has the width and sign of a. */
  ShiftLeft("<<", Category.Shift),
  /** {@code a | b}: operands of equal width and sign; result has the operand width and sign. */
  Or("|", Category.Bitwise),
  /** {@code a & b}: operands of equal width and sign; result has the operand width and sign. */
  And("&", Category.Bitwise),
  /** {@code a ^ b}: operands of equal width and sign; result has the operand width and sign. */
  Xor("^", Category.Bitwise),
  /** {@code a && b}: both operands 1 bit; 1 bit, unsigned. */
  LAnd("&&", Category.Logical),
  /** {@code a || b}: both operands 1 bit; 1 bit, unsigned. */
  LOr("||", Category.Logical),

  /** {@code a < b}: operands of equal width and sign; 1 bit, unsigned. */
  LessThan("<", Category.Relational),
  /** {@code a > b}: operands of equal width and sign; 1 bit, unsigned. */
  GreaterThan(">", Category.Relational),
  /** {@code a <= b}: operands of equal width and sign; 1 bit, unsigned. */
  LessEqThan("<=", Category.Relational),
  /** {@code a >= b}: operands of equal width and sign; 1 bit, unsigned. */
  GreaterEqThan(">=", Category.Relational),
  /** {@code a == b}: operands of equal width and sign; 1 bit, unsigned. */
  Eq("==", Category.Relational),
  /** {@code a != b}: operands of equal width and sign; 1 bit, unsigned. */
  Neq("!=", Category.Relational);

  public enum Category { Unary, Reduction, Arithmetic, Bitwise, Shift, Logical, Relational }

  public final String symbol;
  public final Category category;

  private ExprOp(String symbol, Category category) {
    this.symbol = symbol;
    this.category = category;
  }

  public boolean isUnary() { return category == Category.Unary || category == Category.Reduction; }

  public boolean isRelational() { return category == Category.Relational; }

  /**
   * Validates the operands against this operator's rule.
   * @param left the left (or only) operand
   * @param right the right operand, null for unary operators
   * @throws VarException bound to the operands on violation
   */
  public void checkOperands(Var left, Var right) {
    if (isUnary() != (right == null))
      throw new VarException(String.format("operator %s expects %s operand(s)", name(), isUnary() ? "one" : "two"),
                             right == null ? List.of(left) : List.of(left, right));
    List<Var> operands = right == null ? List.of(left) : List.of(left, right);
    for (Var operand : operands) {
      if (operand instanceof InterfaceTyped)
        throw new VarException("interface " + operand.getName() + " cannot be used as a value", operands);
    }
    boolean leftEnum = left instanceof EnumTyped;
    boolean rightEnum = right instanceof EnumTyped;
    if (leftEnum || rightEnum) {
      if (this != Eq && this != Neq)
        throw new VarException("enum values only support == and !=, got " + symbol, operands);
      if (!leftEnum || !rightEnum || ((EnumTyped)left).getEnumType() != ((EnumTyped)right).getEnumType())
        throw new VarException("enum comparison requires both sides of the same enum type", operands);
    }
    switch (category) {
    case Unary:
    case Reduction:
      break;
    case Arithmetic:
    case Bitwise:
    case Relational:
      if (left.getWidth() != right.getWidth())
        throw new VarException(String.format("left and right width mismatch for %s (%d vs %d)", symbol, left.getWidth(),
                                             right.getWidth()),
                               operands);
      if (left.isSigned() != right.isSigned())
        throw new VarException(String.format("left and right sign mismatch for %s; cast one side explicitly", symbol), operands);
      break;
    case Shift:
      if (right.isSigned())
        throw new VarException("shift amount must be unsigned", operands);
      break;
    case Logical:
      if (left.getWidth() != 1 || right.getWidth() != 1)
        throw new VarException(String.format("operands of %s must be 1 bit wide", symbol), operands);
      break;
    }
  }

  /** Result width for operands that passed {@link #checkOperands(Var, Var)}. */
  public int resultWidth(Var left, Var right) {
    switch (category) {
    case Reduction:
    case Logical:
    case Relational:
      return 1;
    default:
      return left.getWidth();
    }
  }

  /** Result signedness for operands that passed {@link #checkOperands(Var, Var)}. */
  public boolean resultSigned(Var left, Var right) {
    switch (category) {
    case Reduction:
    case Logical:
    case Relational:
      return false;
    default:
      return left.isSigned();
    }
  }
}
