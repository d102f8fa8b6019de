package hdlgen.expr;

import hdlgen.except.InternalException;
import hdlgen.except.UserException;
import hdlgen.except.VarException;
import hdlgen.generator.Generator;
import hdlgen.ir.IRNode;
import hdlgen.ir.IRVisitor;
import hdlgen.stmt.AssignStmt;
import hdlgen.stmt.AssignmentType;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A typed hardware value owned by exactly one {@link Generator}.
 * <p>
 * The builder methods ({@link #add(Var)}, {@link #slice(int, int)}, {@link #assign(Var)}, ...) only extend the graph with new or
 * cached nodes; nothing is evaluated. Assignments register themselves as sinks of their target.
 */
public class Var extends IRNode {
  protected final Generator generator;
  protected final String name;
  protected final int width;
  protected final boolean isSigned;
  private final VarType type;
  private String comment = "";

  private final LinkedHashSet<AssignStmt> sinks = new LinkedHashSet<>();
  private final HashMap<SliceRange, VarSlice> slices = new HashMap<>();
  private final HashMap<Var, VarVarSlice> indexSlices = new HashMap<>();

  private record SliceRange(int high, int low) {}

  /**
   * Creates a plain variable. Callers normally go through {@link Generator#var(String, int, boolean)}, which also registers the
   * name in the module. A value built directly stays undeclared and cannot be serialized.
   */
  public Var(Generator generator, String name, int width, boolean isSigned) { this(generator, name, width, isSigned, VarType.Base); }

  protected Var(Generator generator, String name, int width, boolean isSigned, VarType type) {
    if (generator == null)
      throw new InternalException("value " + name + " created without a generator");
    if (width < 1)
      throw new VarException(String.format("width of %s must be at least 1, got %d", name.isEmpty() ? "value" : name, width),
                             List.of(generator));
    this.generator = generator;
    this.name = name;
    this.width = width;
    this.isSigned = isSigned;
    this.type = type;
  }

  public String getName() { return name; }

  public int getWidth() { return width; }

  public boolean isSigned() { return isSigned; }

  public VarType getType() { return type; }

  @Override
  public Generator getGenerator() {
    return generator;
  }

  public String getComment() { return comment; }

  public void setComment(String comment) { this.comment = comment == null ? "" : comment; }

  /** @return the assignments whose target is this value, in registration order */
  public Set<AssignStmt> sinks() { return Collections.unmodifiableSet(sinks); }

  /** Called by {@link AssignStmt} and the statement containers. */
  public void addSink(AssignStmt stmt) { sinks.add(stmt); }

  public void removeSink(AssignStmt stmt) { sinks.remove(stmt); }

  /**
   * True for literals that can take part in expressions of any generator.
   * Parameters are bound to their module and return false.
   */
  public boolean isGeneratorIndependent() { return false; }

  /** The declared value this one selects from; the value itself unless it is a part-select. */
  public Var getRootVar() { return this; }

  /** True if the value may appear as an assignment target. */
  public boolean isAssignable() { return type != VarType.Expression && type != VarType.ConstValue; }

  // unary builders

  public Expr invert() { return generator.expr(ExprOp.UInvert, this, null); }
  public Expr negate() { return generator.expr(ExprOp.UMinus, this, null); }
  public Expr unaryPlus() { return generator.expr(ExprOp.UPlus, this, null); }
  public Expr logicalNot() { return generator.expr(ExprOp.UNot, this, null); }
  public Expr reduceAnd() { return generator.expr(ExprOp.UAnd, this, null); }
  public Expr reduceOr() { return generator.expr(ExprOp.UOr, this, null); }
  public Expr reduceXor() { return generator.expr(ExprOp.UXor, this, null); }

  // binary builders

  public Expr add(Var other) { return binary(ExprOp.Add, other); }
  public Expr sub(Var other) { return binary(ExprOp.Minus, other); }
  public Expr mul(Var other) { return binary(ExprOp.Multiply, other); }
  public Expr div(Var other) { return binary(ExprOp.Divide, other); }
  public Expr mod(Var other) { return binary(ExprOp.Mod, other); }
  public Expr shiftLeft(Var amount) { return binary(ExprOp.ShiftLeft, amount); }
  public Expr shiftRight(Var amount) { return binary(ExprOp.LogicalShiftRight, amount); }
  public Expr ashr(Var amount) { return binary(ExprOp.SignedShiftRight, amount); }
  public Expr bitwiseAnd(Var other) { return binary(ExprOp.And, other); }
  public Expr bitwiseOr(Var other) { return binary(ExprOp.Or, other); }
  public Expr bitwiseXor(Var other) { return binary(ExprOp.Xor, other); }
  public Expr logicalAnd(Var other) { return binary(ExprOp.LAnd, other); }
  public Expr logicalOr(Var other) { return binary(ExprOp.LOr, other); }
  public Expr lessThan(Var other) { return binary(ExprOp.LessThan, other); }
  public Expr greaterThan(Var other) { return binary(ExprOp.GreaterThan, other); }
  public Expr lessEqual(Var other) { return binary(ExprOp.LessEqThan, other); }
  public Expr greaterEqual(Var other) { return binary(ExprOp.GreaterEqThan, other); }
  public Expr eq(Var other) { return binary(ExprOp.Eq, other); }
  public Expr neq(Var other) { return binary(ExprOp.Neq, other); }

  private Expr binary(ExprOp op, Var other) {
    if (other == null)
      throw new UserException("missing right operand for " + op.name());
    return ownerOf(List.of(this, other)).expr(op, this, other);
  }

  // slicing

  /**
   * Part-select {@code [high:low]}. Requesting the same range again returns the identical node.
   * @throws VarException if the range is outside the value or the value cannot be sliced
   */
  public VarSlice slice(int high, int low) {
    checkSliceable();
    if (low < 0 || high < low || high >= width)
      throw new VarException(String.format("invalid slice [%d:%d] of %s (width %d)", high, low, this, width), List.of(this));
    return slices.computeIfAbsent(new SliceRange(high, low), range -> new VarSlice(this, high, low));
  }

  /** Single bit select, same as {@code slice(index, index)}. */
  public VarSlice bit(int index) { return slice(index, index); }

  /** Bit select by a run-time index value. Repeated calls with the same index node return the identical node. */
  public VarVarSlice slice(Var index) {
    checkSliceable();
    if (width == 1)
      throw new VarException("cannot index into single-bit value " + this, List.of(this));
    if (index instanceof InterfaceTyped || index.isSigned())
      throw new VarException("index must be an unsigned value", List.of(this, index));
    ownerOf(List.of(this, index));
    return indexSlices.computeIfAbsent(index, key -> new VarVarSlice(this, index));
  }

  protected void checkSliceable() {
    if (type == VarType.Expression || type == VarType.ConstValue)
      throw new VarException("cannot slice " + this + "; assign it to a variable first", List.of(this));
    if (this instanceof InterfaceTyped || this instanceof VarVarSlice)
      throw new VarException("cannot slice " + this, List.of(this));
  }

  // other expression builders

  /** Concatenation {@code {this, others...}}; unsigned, width is the sum of all widths. */
  public VarConcat concat(Var... others) {
    if (others.length == 0)
      throw new UserException("concat needs at least one more value");
    ArrayList<Var> operands = new ArrayList<>();
    operands.add(this);
    Collections.addAll(operands, others);
    return new VarConcat(operands);
  }

  /** Zero- or sign-extension (by this value's signedness) to a wider width. */
  public VarExtend extend(int newWidth) { return new VarExtend(this, newWidth); }

  public VarCasted castSigned() { return new VarCasted(this, true); }

  public VarCasted castUnsigned() { return new VarCasted(this, false); }

  // assignment

  /** Builds {@code this = source}; the assignment type is resolved when the statement is placed. */
  public AssignStmt assign(Var source) { return assign(source, AssignmentType.Undefined); }

  /**
   * Builds an assignment to this value and registers it as a sink. Does not insert the statement anywhere.
   * @throws VarException if the two values are not compatible
   */
  public AssignStmt assign(Var source, AssignmentType assignmentType) { return new AssignStmt(this, source, assignmentType); }

  /**
   * Determines the generator owning an expression over the given operands. Generator-independent literals adopt the generator of
   * the other operands.
   * @throws VarException if two operands belong to different generators
   */
  public static Generator ownerOf(List<? extends Var> operands) {
    Var owner = null;
    for (Var operand : operands) {
      if (operand.isGeneratorIndependent())
        continue;
      if (owner == null)
        owner = operand;
      else if (owner.getGenerator() != operand.getGenerator())
        throw new VarException(String.format("%s and %s belong to different generators (%s, %s)", owner, operand,
                                             owner.getGenerator().getName(), operand.getGenerator().getName()),
                               List.of(owner, operand));
    }
    return owner != null ? owner.getGenerator() : operands.get(0).getGenerator();
  }

  @Override
  public int childCount() {
    return 0;
  }

  @Override
  public IRNode getChild(int index) {
    throw childIndexError(index);
  }

  @Override
  public void accept(IRVisitor visitor) {
    visitor.visit(this);
  }

  @Override
  public String toString() {
    return name;
  }
}
