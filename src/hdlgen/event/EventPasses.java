package hdlgen.event;

import hdlgen.expr.Const;
import hdlgen.expr.Var;
import hdlgen.generator.Generator;
import hdlgen.stmt.EventTracingStmt;
import hdlgen.stmt.IfStmt;
import hdlgen.stmt.ScopedStmtBlock;
import hdlgen.stmt.SequentialStmtBlock;
import hdlgen.stmt.Stmt;
import hdlgen.stmt.StmtBlock;
import hdlgen.stmt.SwitchStmt;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/** Passes over event tracing statements. */
public class EventPasses {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private EventPasses() {}

  /**
   * Collects every tracing statement in the generator tree below top, in pre-order (a generator's statements, then its children).
   * The condition of an event is the conjunction of the if predicates (negated on the else side) and case matches around it.
   */
  public static List<EventInfo> extractEventFireCondition(Generator top) {
    List<EventInfo> result = new ArrayList<>();
    collect(top, result);
    logger.debug("Extracted {} event(s) below {}", result.size(), top.getName());
    return result;
  }

  private static void collect(Generator generator, List<EventInfo> result) {
    for (Stmt stmt : generator.getStmts())
      visitStmt(generator, stmt, new ArrayList<>(), true, result);
    for (Generator child : generator.getChildGenerators())
      collect(child, result);
  }

  private static void visitStmt(Generator generator, Stmt stmt, List<Var> conditions, boolean combinational, List<EventInfo> result) {
    if (stmt instanceof EventTracingStmt) {
      EventTracingStmt event = (EventTracingStmt)stmt;
      result.add(new EventInfo(event.getEventName(), event.getTransaction(), combinational, event.getActionType(),
                               combine(generator, conditions), event.getFields(), generator));
    } else if (stmt instanceof IfStmt) {
      IfStmt ifStmt = (IfStmt)stmt;
      Var predicate = ifStmt.getPredicate();
      visitBlock(generator, ifStmt.thenBody(), with(conditions, predicate), combinational, result);
      visitBlock(generator, ifStmt.elseBody(), with(conditions, predicate.logicalNot()), combinational, result);
    } else if (stmt instanceof SwitchStmt) {
      SwitchStmt switchStmt = (SwitchStmt)stmt;
      Var target = switchStmt.getTarget();
      for (Map.Entry<Const, ScopedStmtBlock> item : switchStmt.getCases().entrySet())
        visitBlock(generator, item.getValue(), with(conditions, target.eq(item.getKey())), combinational, result);
      Optional<ScopedStmtBlock> defaultBody = switchStmt.getDefault();
      if (defaultBody.isPresent()) {
        List<Var> mismatches = new ArrayList<>();
        switchStmt.getCases().keySet().forEach(value -> mismatches.add(target.neq(value)));
        List<Var> defaultConditions = mismatches.isEmpty() ? conditions : with(conditions, and(mismatches));
        visitBlock(generator, defaultBody.get(), defaultConditions, combinational, result);
      }
    } else if (stmt instanceof StmtBlock) {
      visitBlock(generator, (StmtBlock)stmt, conditions, combinational && !(stmt instanceof SequentialStmtBlock), result);
    }
  }

  private static void visitBlock(Generator generator, StmtBlock block, List<Var> conditions, boolean combinational,
                                 List<EventInfo> result) {
    for (Stmt stmt : block.getStmts())
      visitStmt(generator, stmt, conditions, combinational, result);
  }

  private static List<Var> with(List<Var> conditions, Var condition) {
    List<Var> extended = new ArrayList<>(conditions);
    extended.add(condition);
    return extended;
  }

  private static Var and(List<Var> conditions) {
    Var result = conditions.get(0);
    for (int i = 1; i < conditions.size(); ++i)
      result = result.logicalAnd(conditions.get(i));
    return result;
  }

  private static Var combine(Generator generator, List<Var> conditions) {
    if (conditions.isEmpty())
      return generator.constant(1, 1, false);
    return and(conditions);
  }

  /**
   * Detaches every tracing statement below top.
   * @return the number of statements removed
   */
  public static int removeEventStmts(Generator top) {
    int removed = 0;
    for (Stmt stmt : top.getStmts()) {
      if (stmt instanceof StmtBlock)
        removed += removeFromBlock((StmtBlock)stmt);
    }
    for (Generator child : top.getChildGenerators())
      removed += removeEventStmts(child);
    return removed;
  }

  private static int removeFromBlock(StmtBlock block) {
    int removed = 0;
    for (Stmt stmt : new ArrayList<>(block.getStmts())) {
      if (stmt instanceof EventTracingStmt) {
        block.removeStmt(stmt);
        ++removed;
      } else if (stmt instanceof IfStmt) {
        removed += removeFromBlock(((IfStmt)stmt).thenBody());
        removed += removeFromBlock(((IfStmt)stmt).elseBody());
      } else if (stmt instanceof SwitchStmt) {
        for (ScopedStmtBlock body : ((SwitchStmt)stmt).getCases().values())
          removed += removeFromBlock(body);
        Optional<ScopedStmtBlock> defaultBody = ((SwitchStmt)stmt).getDefault();
        if (defaultBody.isPresent())
          removed += removeFromBlock(defaultBody.get());
      } else if (stmt instanceof StmtBlock) {
        removed += removeFromBlock((StmtBlock)stmt);
      }
    }
    return removed;
  }
}
