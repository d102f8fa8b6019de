package hdlgen.stmt;

import hdlgen.except.StmtException;
import hdlgen.expr.Var;
import hdlgen.generator.Generator;
import hdlgen.ir.IRNode;
import hdlgen.ir.IRVisitor;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An ordered list of statements.
 * <p>
 * Adding a statement attaches it and, once the block is known to sit inside a combinational or sequential process, resolves the
 * assignment types of everything below it (blocking in {@code always_comb}, nonblocking in {@code always_ff}).
 */
public abstract class StmtBlock extends Stmt {
  private final StatementBlockType blockType;
  private final ArrayList<Stmt> stmts = new ArrayList<>();
  // generator of the contents while the block is not attached yet
  private Generator owner;

  protected StmtBlock(StatementBlockType blockType) {
    super(StatementType.Block);
    this.blockType = blockType;
  }

  public StatementBlockType getBlockType() { return blockType; }

  public List<Stmt> getStmts() { return Collections.unmodifiableList(stmts); }

  public int size() { return stmts.size(); }

  public boolean isEmpty() { return stmts.isEmpty(); }

  /**
   * Appends a statement.
   * @throws StmtException if the statement is already attached elsewhere, cannot be nested here or conflicts with an existing one
   */
  public void addStmt(Stmt stmt) {
    if (stmt.getParent() != null)
      throw new StmtException("statement is already attached to another container", List.of(stmt, stmt.getParent()));
    if (stmt instanceof SequentialStmtBlock || stmt instanceof CombinationalStmtBlock || stmt instanceof ModuleInstantiationStmt)
      throw new StmtException(stmt.getClass().getSimpleName() + " is only allowed at generator level", List.of(stmt));
    Generator generator = getGenerator();
    Generator stmtGenerator = stmt.getGenerator();
    if (generator != null && stmtGenerator != null && generator != stmtGenerator)
      throw new StmtException(String.format("statement of %s added to a block of %s", stmtGenerator.getName(), generator.getName()),
                              List.of(stmt, this));
    checkConflicts(stmt);
    StatementBlockType process = getProcessType();
    if (process != null)
      resolveAssignmentTypes(stmt, requiredAssignmentType(process));
    adopt(stmtGenerator);
    stmt.setParent(this);
    stmts.add(stmt);
  }

  /** Binds an unattached block to the generator of its first content, so that later content must match it. */
  protected void adopt(Generator generator) {
    if (owner == null)
      owner = generator;
  }

  /** The generator of the enclosing container; while unattached, the generator of the first statement added. */
  @Override
  public Generator getGenerator() {
    Generator generator = super.getGenerator();
    return generator != null ? generator : owner;
  }

  /** Shorthand for building {@code target = source} and appending it. */
  public AssignStmt assign(Var target, Var source) {
    AssignStmt stmt = new AssignStmt(target, source, AssignmentType.Undefined);
    addStmt(stmt);
    return stmt;
  }

  /** Shorthand for creating an if statement and appending it. */
  public IfStmt ifStmt(Var predicate) {
    IfStmt stmt = new IfStmt(predicate);
    addStmt(stmt);
    return stmt;
  }

  /** Shorthand for creating a case statement and appending it. */
  public SwitchStmt switchStmt(Var target) {
    SwitchStmt stmt = new SwitchStmt(target);
    addStmt(stmt);
    return stmt;
  }

  /** @return true if the statement was a direct child of this block */
  public boolean removeStmt(Stmt stmt) {
    boolean removed = stmts.remove(stmt);
    if (removed)
      stmt.setParent(null);
    return removed;
  }

  /** Hook for blocks that restrict what may be added next to their existing statements. */
  protected void checkConflicts(Stmt stmt) {}

  /**
   * The kind of process this block ends up in: {@link StatementBlockType#Combinational}, {@link StatementBlockType#Sequential},
   * or null while a scope is not nested in a process yet.
   */
  public StatementBlockType getProcessType() {
    if (blockType != StatementBlockType.Scope)
      return blockType;
    IRNode owner = getParent();
    IRNode container = owner == null ? null : owner.getParent();
    if (container instanceof StmtBlock)
      return ((StmtBlock)container).getProcessType();
    return null;
  }

  static AssignmentType requiredAssignmentType(StatementBlockType process) {
    return process == StatementBlockType.Sequential ? AssignmentType.NonBlocking : AssignmentType.Blocking;
  }

  /** Resolves every assignment at or below stmt; used for blocks and for continuous assignments at generator level. */
  public static void resolveAssignmentTypes(Stmt stmt, AssignmentType required) {
    if (stmt instanceof AssignStmt) {
      ((AssignStmt)stmt).resolveAssignmentType(required);
      return;
    }
    for (int i = 0; i < stmt.childCount(); ++i) {
      IRNode child = stmt.getChild(i);
      if (child instanceof Stmt)
        resolveAssignmentTypes((Stmt)child, required);
    }
  }

  @Override
  public int childCount() {
    return stmts.size();
  }

  @Override
  public IRNode getChild(int index) {
    if (index < 0 || index >= stmts.size())
      throw childIndexError(index);
    return stmts.get(index);
  }

  @Override
  public void accept(IRVisitor visitor) {
    visitor.visit(this);
  }
}
