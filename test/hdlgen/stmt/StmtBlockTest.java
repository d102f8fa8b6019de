package hdlgen.stmt;

import hdlgen.except.StmtException;
import hdlgen.expr.Const;
import hdlgen.expr.EnumType;
import hdlgen.expr.EnumVar;
import hdlgen.expr.Port;
import hdlgen.expr.Var;
import hdlgen.generator.Generator;
import java.util.List;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class StmtBlockTest {
  Generator mod;
  Port clk;
  Var a;
  Var b;
  Var sel;

  @BeforeEach
  void setUp() {
    mod = new Generator("mod");
    clk = mod.clock("clk");
    a = mod.var("a", 8);
    b = mod.var("b", 8);
    sel = mod.var("sel", 1);
  }

  @Test
  void testCombinationalAssignmentsAreBlocking() {
    CombinationalStmtBlock comb = mod.combinational();
    AssignStmt stmt = comb.assign(a, b);
    Assertions.assertEquals(AssignmentType.Blocking, stmt.getAssignmentType());
    Assertions.assertSame(comb, stmt.getParent());
    Assertions.assertSame(mod, stmt.getGenerator());
    Assertions.assertEquals(StatementBlockType.Combinational, comb.getProcessType());
  }

  @Test
  void testSequentialAssignmentsAreNonBlocking() {
    SequentialStmtBlock seq = mod.sequential(BlockEdgeType.Posedge, clk);
    AssignStmt stmt = seq.assign(a, b);
    Assertions.assertEquals(AssignmentType.NonBlocking, stmt.getAssignmentType());
    Assertions.assertEquals("a <= b", stmt.toString());
  }

  @Test
  void testExplicitTypeMustMatchPlacement() {
    SequentialStmtBlock seq = mod.sequential(BlockEdgeType.Posedge, clk);
    AssignStmt blocking = a.assign(b, AssignmentType.Blocking);
    StmtException e = Assertions.assertThrows(StmtException.class, () -> seq.addStmt(blocking));
    Assertions.assertSame(blocking, e.getNodes().get(0));
    Assertions.assertNull(blocking.getParent());
    Assertions.assertTrue(seq.isEmpty());
    CombinationalStmtBlock comb = mod.combinational();
    Assertions.assertThrows(StmtException.class, () -> comb.addStmt(a.assign(b, AssignmentType.NonBlocking)));
    Assertions.assertThrows(StmtException.class, () -> mod.addStmt(a.assign(b, AssignmentType.NonBlocking)));
  }

  @Test
  void testNestedStatementsResolveWhenAttached() {
    // build the if first, then place it
    IfStmt ifStmt = new IfStmt(sel);
    AssignStmt inner = a.assign(b);
    ifStmt.addThenStmt(inner);
    Assertions.assertEquals(AssignmentType.Undefined, inner.getAssignmentType());
    Assertions.assertNull(ifStmt.thenBody().getProcessType());
    SequentialStmtBlock seq = mod.sequential(BlockEdgeType.Posedge, clk);
    seq.addStmt(ifStmt);
    Assertions.assertEquals(AssignmentType.NonBlocking, inner.getAssignmentType());
    Assertions.assertEquals(StatementBlockType.Sequential, ifStmt.elseBody().getProcessType());
    // statements added afterwards resolve directly
    AssignStmt late = ifStmt.elseBody().assign(a, mod.constant(0, 8, false));
    Assertions.assertEquals(AssignmentType.NonBlocking, late.getAssignmentType());
  }

  @Test
  void testCombinationalConflict() {
    CombinationalStmtBlock comb = mod.combinational();
    AssignStmt first = comb.assign(a, b);
    AssignStmt second = a.assign(mod.constant(1, 8, false));
    StmtException e = Assertions.assertThrows(StmtException.class, () -> comb.addStmt(second));
    Assertions.assertEquals(List.of(first, second), e.getNodes());
    // a different bit range is a different target
    comb.assign(a.slice(3, 0), b.slice(3, 0));
    // assignments in branches do not conflict
    IfStmt ifStmt = comb.ifStmt(sel);
    ifStmt.thenBody().assign(a, b);
    Assertions.assertEquals(3, comb.size());
  }

  @Test
  void testStatementAttachedOnce() {
    CombinationalStmtBlock comb = mod.combinational();
    AssignStmt stmt = comb.assign(a, b);
    CombinationalStmtBlock other = mod.combinational();
    Assertions.assertThrows(StmtException.class, () -> other.addStmt(stmt));
    Assertions.assertTrue(comb.removeStmt(stmt));
    Assertions.assertNull(stmt.getParent());
    other.addStmt(stmt);
    Assertions.assertSame(other, stmt.getParent());
  }

  @Test
  void testProcessBlocksAreNotNested() {
    CombinationalStmtBlock comb = mod.combinational();
    Assertions.assertThrows(StmtException.class, () -> comb.addStmt(new CombinationalStmtBlock()));
    Assertions.assertThrows(StmtException.class, () -> comb.addStmt(new SequentialStmtBlock()));
  }

  @Test
  void testForeignStatementIsRejected() {
    Generator other = new Generator("other");
    Var x = other.var("x", 8);
    Var y = other.var("y", 8);
    CombinationalStmtBlock comb = mod.combinational();
    Assertions.assertThrows(StmtException.class, () -> comb.addStmt(x.assign(y)));
  }

  @Test
  void testEnumPredicateNeedsComparison() {
    EnumType flagType = new EnumType("flag_t", 1).addValue("OFF", 0).addValue("ON", 1);
    EnumVar flag = mod.enumVar("flag", flagType);
    Assertions.assertThrows(StmtException.class, () -> new IfStmt(flag));
    Assertions.assertThrows(StmtException.class, () -> new IfStmt(mod.enumConst(flagType, "ON")));
    IfStmt ifStmt = mod.combinational().ifStmt(flag.eq(mod.enumConst(flagType, "ON")));
    Assertions.assertEquals("if (flag == ON)", ifStmt.toString());
  }

  @Test
  void testIfPredicate() {
    Assertions.assertThrows(StmtException.class, () -> new IfStmt(a));
    IfStmt ifStmt = new IfStmt(a.eq(b));
    Assertions.assertEquals("if (a == b)", ifStmt.toString());
    Assertions.assertEquals(3, ifStmt.childCount());
    Assertions.assertFalse(ifStmt.hasElseIf());
    ifStmt.addElseStmt(new IfStmt(sel));
    Assertions.assertTrue(ifStmt.hasElseIf());
    Assertions.assertSame(ifStmt, ifStmt.thenBody().getParent());
  }

  @Test
  void testSwitchCases() {
    Var state = mod.var("state", 2);
    SwitchStmt sw = mod.combinational().switchStmt(state);
    Const zero = mod.constant(0, 2, false);
    ScopedStmtBlock body = sw.addCase(zero);
    body.assign(a, b);
    Assertions.assertSame(body, sw.caseBody(zero).orElseThrow());
    Assertions.assertThrows(StmtException.class, () -> sw.addCase(zero));
    Assertions.assertThrows(StmtException.class, () -> sw.addCase(mod.constant(1, 3, false)));
    Assertions.assertThrows(StmtException.class, () -> sw.addCase(mod.constant(1, 2, true)));
    sw.addCase(mod.constant(1, 2, false), b.assign(a));
    Assertions.assertEquals(2, sw.getCases().size());
    Assertions.assertTrue(sw.getDefault().isEmpty());
    sw.defaultBody().assign(a, mod.constant(0, 8, false));
    Assertions.assertTrue(sw.getDefault().isPresent());
    Assertions.assertEquals(4, sw.childCount());
    Assertions.assertSame(state, sw.getChild(0));
    Assertions.assertSame(sw.defaultBody(), sw.getChild(3));
    Assertions.assertEquals(AssignmentType.Blocking, ((AssignStmt)body.getStmts().get(0)).getAssignmentType());
  }

  @Test
  void testSwitchOnEnum() {
    EnumType stateType = new EnumType("state_t", 2).addValue("IDLE", 0).addValue("BUSY", 1);
    EnumVar state = mod.enumVar("state", stateType);
    SwitchStmt sw = new SwitchStmt(state);
    Assertions.assertThrows(StmtException.class, () -> sw.addCase(mod.constant(0, 2, false)));
    sw.addCase(mod.enumConst(stateType, "IDLE"));
    Assertions.assertThrows(StmtException.class, () -> sw.addCase(mod.enumConst(stateType, "IDLE")));
  }

  @Test
  void testSensitivityList() {
    Assertions.assertThrows(StmtException.class, () -> mod.sequential(BlockEdgeType.Posedge, a));
    Assertions.assertThrows(StmtException.class, () -> mod.sequential(List.of()));
    Generator other = new Generator("other");
    Port otherClk = other.clock("clk");
    Assertions.assertThrows(StmtException.class, () -> mod.sequential(BlockEdgeType.Posedge, otherClk));
    Port rst = mod.reset("rst");
    SequentialStmtBlock seq = mod.sequential(List.of(new SequentialStmtBlock.Sensitivity(BlockEdgeType.Posedge, clk),
                                                     new SequentialStmtBlock.Sensitivity(BlockEdgeType.Negedge, rst)));
    Assertions.assertEquals(2, seq.getSensitivityList().size());
    Assertions.assertEquals(BlockEdgeType.Negedge, seq.getSensitivityList().get(1).edge());
  }
}
