package hdlgen.stmt;

import hdlgen.except.StmtException;
import hdlgen.except.VarException;
import hdlgen.expr.EnumTyped;
import hdlgen.expr.InterfaceTyped;
import hdlgen.expr.Port;
import hdlgen.expr.PortDirection;
import hdlgen.expr.StructTyped;
import hdlgen.expr.Var;
import hdlgen.generator.Generator;
import hdlgen.ir.IRNode;
import hdlgen.ir.IRVisitor;
import java.util.List;

/**
 * {@code target = source} or {@code target <= source}.
 * <p>
 * All compatibility checks run on construction, and the new statement registers itself in {@link Var#sinks()} of its target.
 * It is not inserted anywhere; the caller adds it to a block or a generator.
 */
public class AssignStmt extends Stmt {
  private final Var target;
  private final Var source;
  private AssignmentType assignmentType;

  /** @throws VarException if source cannot drive target */
  public AssignStmt(Var target, Var source, AssignmentType assignmentType) {
    super(StatementType.Assign);
    checkCompatible(target, source);
    this.target = target;
    this.source = source;
    this.assignmentType = assignmentType == null ? AssignmentType.Undefined : assignmentType;
    target.addSink(this);
  }

  private static void checkCompatible(Var target, Var source) {
    List<Var> both = List.of(target, source);
    if (!target.isAssignable())
      throw new VarException("cannot assign to " + target, both);
    Var root = target.getRootVar();
    if (root instanceof Port && ((Port)root).getDirection() == PortDirection.In)
      throw new VarException("cannot assign to input port " + root.getName(), both);
    if (target instanceof InterfaceTyped || source instanceof InterfaceTyped)
      throw new VarException("interfaces are connected, not assigned", both);
    if (target.getWidth() != source.getWidth())
      throw new VarException(String.format("width mismatch in assignment: %d bits from %d bits", target.getWidth(), source.getWidth()),
                             both);
    if (target.isSigned() != source.isSigned())
      throw new VarException("sign mismatch in assignment; cast the source explicitly", both);
    if (!source.isGeneratorIndependent() && source.getGenerator() != target.getGenerator())
      throw new VarException(String.format("%s and %s belong to different generators", target, source), both);
    checkTypesCompatible(target, source, both);
  }

  /** Enum values only mix with the same enum; struct values only with the same struct or a plain vector. */
  static void checkTypesCompatible(Var target, Var source, List<? extends Var> nodes) {
    if (target instanceof EnumTyped || source instanceof EnumTyped) {
      if (!(target instanceof EnumTyped) || !(source instanceof EnumTyped) ||
          ((EnumTyped)target).getEnumType() != ((EnumTyped)source).getEnumType())
        throw new VarException("enum values can only be assigned from the same enum type", nodes);
    }
    if (target instanceof StructTyped && source instanceof StructTyped &&
        ((StructTyped)target).getStruct() != ((StructTyped)source).getStruct())
      throw new VarException("cannot assign between different struct types", nodes);
  }

  public Var getTarget() { return target; }

  public Var getSource() { return source; }

  public AssignmentType getAssignmentType() { return assignmentType; }

  /**
   * Fixes the assignment type required by the placement. An undefined type takes the required one.
   * @throws StmtException if the type was explicitly set to something else
   */
  public void resolveAssignmentType(AssignmentType required) {
    if (assignmentType == AssignmentType.Undefined)
      assignmentType = required;
    else if (assignmentType != required)
      throw new StmtException(String.format("%s assignment placed where %s is required", assignmentType, required), List.of(this));
  }

  @Override
  public Generator getGenerator() {
    return target.getGenerator();
  }

  @Override
  public int childCount() {
    return 2;
  }

  @Override
  public IRNode getChild(int index) {
    if (index == 0)
      return target;
    if (index == 1)
      return source;
    throw childIndexError(index);
  }

  @Override
  public void accept(IRVisitor visitor) {
    visitor.visit(this);
  }

  @Override
  public String toString() {
    return target + (assignmentType == AssignmentType.NonBlocking ? " <= " : " = ") + source;
  }
}
