package hdlgen.stmt;

import hdlgen.except.StmtException;
import hdlgen.expr.Const;
import hdlgen.expr.EnumConst;
import hdlgen.expr.EnumTyped;
import hdlgen.expr.InterfaceTyped;
import hdlgen.expr.Var;
import hdlgen.generator.Generator;
import hdlgen.ir.IRNode;
import hdlgen.ir.IRVisitor;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** {@code unique case (target)} with constant case items in insertion order and an optional default. */
public class SwitchStmt extends Stmt {
  private final Var target;
  private final LinkedHashMap<Const, ScopedStmtBlock> cases = new LinkedHashMap<>();
  private ScopedStmtBlock defaultBody;

  public SwitchStmt(Var target) {
    super(StatementType.Switch);
    if (target instanceof InterfaceTyped)
      throw new StmtException("cannot switch on interface " + target.getName(), List.of(target));
    this.target = target;
  }

  public Var getTarget() { return target; }

  /**
   * Adds a case item; the value must match the target's width and sign and must not repeat an existing item.
   * @return the body of the new case item
   * @throws StmtException on mismatch or duplicate
   */
  public ScopedStmtBlock addCase(Const value) {
    if (value.getWidth() != target.getWidth() || value.isSigned() != target.isSigned())
      throw new StmtException(String.format("case item %s does not match the %d bit target %s", value, target.getWidth(), target),
                              List.of(value, target));
    if (target instanceof EnumTyped &&
        (!(value instanceof EnumConst) || ((EnumConst)value).getEnumType() != ((EnumTyped)target).getEnumType()))
      throw new StmtException("case items of enum target " + target + " must be values of the same enum", List.of(value, target));
    for (Const existing : cases.keySet()) {
      if (existing.getValue() == value.getValue())
        throw new StmtException("duplicate case item " + value, List.of(existing, value));
    }
    ScopedStmtBlock body = new ScopedStmtBlock(this);
    cases.put(value, body);
    return body;
  }

  /** Adds a case item with the given statements. @return this, for chaining */
  public SwitchStmt addCase(Const value, Stmt... stmts) {
    ScopedStmtBlock body = addCase(value);
    for (Stmt stmt : stmts)
      body.addStmt(stmt);
    return this;
  }

  /** @return the body of the case item for value, if present */
  public Optional<ScopedStmtBlock> caseBody(Const value) { return Optional.ofNullable(cases.get(value)); }

  public Map<Const, ScopedStmtBlock> getCases() { return Collections.unmodifiableMap(cases); }

  /** @return the default body, created on first use */
  public ScopedStmtBlock defaultBody() {
    if (defaultBody == null)
      defaultBody = new ScopedStmtBlock(this);
    return defaultBody;
  }

  public Optional<ScopedStmtBlock> getDefault() { return Optional.ofNullable(defaultBody); }

  @Override
  public Generator getGenerator() {
    Generator generator = super.getGenerator();
    return generator != null ? generator : target.getGenerator();
  }

  private List<IRNode> children() {
    ArrayList<IRNode> children = new ArrayList<>();
    children.add(target);
    children.addAll(cases.values());
    if (defaultBody != null)
      children.add(defaultBody);
    return children;
  }

  @Override
  public int childCount() {
    return 1 + cases.size() + (defaultBody != null ? 1 : 0);
  }

  @Override
  public IRNode getChild(int index) {
    if (index < 0 || index >= childCount())
      throw childIndexError(index);
    return children().get(index);
  }

  @Override
  public void accept(IRVisitor visitor) {
    visitor.visit(this);
  }

  @Override
  public String toString() {
    return "case (" + target + ")";
  }
}
