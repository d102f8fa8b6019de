package hdlgen.event;

import hdlgen.except.VarException;
import hdlgen.expr.Const;
import hdlgen.expr.EnumConst;
import hdlgen.expr.EnumType;
import hdlgen.expr.EnumVar;
import hdlgen.expr.Port;
import hdlgen.expr.Var;
import hdlgen.generator.Generator;
import hdlgen.stmt.BlockEdgeType;
import hdlgen.stmt.CombinationalStmtBlock;
import hdlgen.stmt.EventActionType;
import hdlgen.stmt.EventTracingStmt;
import hdlgen.stmt.IfStmt;
import hdlgen.stmt.SequentialStmtBlock;
import hdlgen.stmt.SwitchStmt;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class EventTest {
  Generator mod;
  Var a;
  Var b;
  Var data;
  Event event;

  @BeforeEach
  void setUp() {
    mod = new Generator("mod");
    a = mod.var("a", 1);
    b = mod.var("b", 1);
    data = mod.var("data", 8);
    event = new Event("transfer");
  }

  @Test
  void testUnconditionalEvent() {
    CombinationalStmtBlock comb = mod.combinational();
    comb.addStmt(event.fire(Map.of("data", data)));
    List<EventInfo> infos = EventPasses.extractEventFireCondition(mod);
    Assertions.assertEquals(1, infos.size());
    EventInfo info = infos.get(0);
    Assertions.assertEquals("transfer", info.name());
    Assertions.assertTrue(info.combinational());
    Assertions.assertSame(mod.constant(1, 1, false), info.condition());
    Assertions.assertSame(data, info.fields().get("data"));
    Assertions.assertSame(mod, info.generator());
    Assertions.assertNull(info.transaction());
    Assertions.assertEquals(EventActionType.None, info.type());
  }

  @Test
  void testIfConditions() {
    CombinationalStmtBlock comb = mod.combinational();
    IfStmt outer = comb.ifStmt(a);
    IfStmt inner = outer.thenBody().ifStmt(b);
    inner.addThenStmt(event.fire(Map.of()));
    outer.addElseStmt(new Event("idle").fire(Map.of()));
    List<EventInfo> infos = EventPasses.extractEventFireCondition(mod);
    Assertions.assertEquals(2, infos.size());
    Assertions.assertSame(a.logicalAnd(b), infos.get(0).condition());
    Assertions.assertEquals("idle", infos.get(1).name());
    Assertions.assertSame(a.logicalNot(), infos.get(1).condition());
  }

  @Test
  void testEnumFlagConditions() {
    EnumType flagType = new EnumType("flag_t", 1).addValue("OFF", 0).addValue("ON", 1);
    EnumVar flag = mod.enumVar("flag", flagType);
    EnumConst on = mod.enumConst(flagType, "ON");
    CombinationalStmtBlock comb = mod.combinational();
    IfStmt outer = comb.ifStmt(flag.eq(on));
    outer.thenBody().ifStmt(a).addThenStmt(event.fire(Map.of()));
    outer.addElseStmt(new Event("idle").fire(Map.of()));
    List<EventInfo> infos = EventPasses.extractEventFireCondition(mod);
    Assertions.assertEquals(2, infos.size());
    Assertions.assertSame(flag.eq(on).logicalAnd(a), infos.get(0).condition());
    Assertions.assertSame(flag.eq(on).logicalNot(), infos.get(1).condition());
  }

  @Test
  void testSwitchConditions() {
    Var state = mod.var("state", 2);
    Const zero = mod.constant(0, 2, false);
    Const one = mod.constant(1, 2, false);
    SwitchStmt sw = mod.combinational().switchStmt(state);
    sw.addCase(one, event.fire(Map.of()));
    sw.addCase(zero);
    sw.defaultBody().addStmt(new Event("other").fire(Map.of()));
    List<EventInfo> infos = EventPasses.extractEventFireCondition(mod);
    Assertions.assertEquals(2, infos.size());
    Assertions.assertSame(state.eq(one), infos.get(0).condition());
    Assertions.assertSame(state.neq(one).logicalAnd(state.neq(zero)), infos.get(1).condition());
    Assertions.assertEquals("(state != 2'h1) && (state != 2'h0)", infos.get(1).condition().toString());
  }

  @Test
  void testSequentialEventAndTransaction() {
    Port clk = mod.clock("clk");
    SequentialStmtBlock seq = mod.sequential(BlockEdgeType.Posedge, clk);
    EventTracingStmt stmt = event.fire(Map.of("data", data)).belongsTo("tx").starts();
    seq.ifStmt(a).addThenStmt(stmt);
    EventInfo info = EventPasses.extractEventFireCondition(mod).get(0);
    Assertions.assertFalse(info.combinational());
    Assertions.assertEquals("tx", info.transaction());
    Assertions.assertEquals(EventActionType.Start, info.type());
    Assertions.assertSame(a, info.condition());
    stmt.terminates();
    Assertions.assertEquals(EventActionType.End, EventPasses.extractEventFireCondition(mod).get(0).type());
  }

  @Test
  void testChildGeneratorsAreVisited() {
    Generator child = new Generator("child");
    Var x = child.var("x", 1);
    child.combinational().addStmt(new Event("inner").fire(Map.of("x", x)));
    mod.combinational().addStmt(event.fire(Map.of()));
    mod.addChildGenerator("u_child", child);
    List<EventInfo> infos = EventPasses.extractEventFireCondition(mod);
    Assertions.assertEquals(2, infos.size());
    Assertions.assertEquals("transfer", infos.get(0).name());
    Assertions.assertSame(child, infos.get(1).generator());
  }

  @Test
  void testFieldsAreSnapshot() {
    Map<String, Var> fields = new HashMap<>();
    fields.put("data", data);
    EventTracingStmt stmt = event.fire(fields);
    fields.put("a", a);
    Assertions.assertEquals(1, stmt.getFields().size());
    Generator other = new Generator("other");
    fields.put("foreign", other.var("f", 1));
    Assertions.assertThrows(VarException.class, () -> event.fire(fields));
  }

  @Test
  void testRemoveEventStmts() {
    CombinationalStmtBlock comb = mod.combinational();
    comb.addStmt(event.fire(Map.of()));
    comb.assign(data, mod.constant(0, 8, false));
    IfStmt ifStmt = comb.ifStmt(a);
    ifStmt.addThenStmt(event.fire(Map.of("a", a)));
    ifStmt.addElseStmt(event.fire(Map.of("b", b)));
    Assertions.assertEquals(3, EventPasses.removeEventStmts(mod));
    Assertions.assertEquals(2, comb.size());
    Assertions.assertTrue(ifStmt.thenBody().isEmpty());
    Assertions.assertTrue(EventPasses.extractEventFireCondition(mod).isEmpty());
    Assertions.assertEquals(0, EventPasses.removeEventStmts(mod));
  }
}
