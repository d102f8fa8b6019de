package hdlgen.serialize;

import hdlgen.codegen.VerilogModule;
import hdlgen.event.Event;
import hdlgen.except.UserException;
import hdlgen.expr.EnumType;
import hdlgen.expr.EnumVar;
import hdlgen.expr.InterfaceDefinition;
import hdlgen.expr.InterfacePort;
import hdlgen.expr.PackedStruct;
import hdlgen.expr.Param;
import hdlgen.expr.Port;
import hdlgen.expr.PortDirection;
import hdlgen.expr.Var;
import hdlgen.expr.VarPackedStruct;
import hdlgen.generator.Context;
import hdlgen.generator.Generator;
import hdlgen.stmt.AssignStmt;
import hdlgen.stmt.BlockEdgeType;
import hdlgen.stmt.CombinationalStmtBlock;
import hdlgen.stmt.IfStmt;
import hdlgen.stmt.ModuleInstantiationStmt;
import hdlgen.stmt.SequentialStmtBlock;
import hdlgen.stmt.SwitchStmt;
import hdlgen.ui.HDLGenConfig;
import java.io.StringReader;
import java.io.StringWriter;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class GraphSerializerTest {

  /** A design touching every node kind. */
  static Context design() {
    Context context = new Context();
    EnumType state = new EnumType("state_t", 2).addValue("IDLE", 0).addValue("RUN", 1).addValue("STOP", 2);
    PackedStruct packet = new PackedStruct("packet_t").addMember("valid", 1).addMember("data", 8);
    Map<String, PortDirection> source = new LinkedHashMap<>();
    source.put("data", PortDirection.Out);
    source.put("ready", PortDirection.In);
    InterfaceDefinition bus = new InterfaceDefinition("bus_if").addSignal("data", 8).addSignal("ready", 1).addModport("source", source);

    Generator leaf = context.generator("leaf");
    Param depth = leaf.parameter("DEPTH", 8, false, 4);
    Port leafIn = leaf.input("in", 8);
    Port leafOut = leaf.output("out", 8);
    Port leafSpare = leaf.input("spare", 1);
    leaf.assign(leafOut, leafIn);
    leafSpare.setComment("unused");

    Generator top = context.generator("top");
    Port clk = top.clock("clk");
    Port rst = top.reset("rst");
    Port in = top.input("in", 8);
    Port sel = top.input("sel", 3);
    Port out = top.output("out", 8);
    InterfacePort busPort = top.interfacePort("bus", bus, "source");
    EnumVar current = top.enumVar("current", state);
    VarPackedStruct pkt = top.structVar("pkt", packet);
    Var acc = top.var("acc", 8);
    Var wide = top.var("wide", 16);
    Var fromLeaf = top.var("from_leaf", 8);
    Var signedAcc = top.var("signed_acc", 8, true);
    Var bits = top.var("bits", 4);
    acc.setComment("accumulator");

    Var sum = in.add(acc);
    top.assign(out, sum);
    top.assign(wide, in.concat(acc));
    top.assign(signedAcc, in.castSigned());
    top.assign(busPort.signal("data"), top.conditional(busPort.signal("ready"), sum, in));
    top.assign(bits.bit(0), in.slice(sel));
    top.assign(bits.slice(3, 1), top.call("f", 3, false, in, acc));
    top.assign(pkt.member("data"), acc);
    top.assign(pkt.member("valid"), in.slice(7, 4).bit(1));

    SequentialStmtBlock seq = top.sequential(List.of(new SequentialStmtBlock.Sensitivity(BlockEdgeType.Posedge, clk),
                                                     new SequentialStmtBlock.Sensitivity(BlockEdgeType.Negedge, rst)));
    IfStmt reset = seq.ifStmt(rst.logicalNot());
    reset.setComment("reset");
    reset.thenBody().assign(acc, top.constant(0, 8, false));
    reset.thenBody().assign(current, top.enumConst(state, "IDLE"));
    SwitchStmt sw = new SwitchStmt(current);
    reset.addElseStmt(sw);
    sw.addCase(top.enumConst(state, "IDLE")).assign(current, top.enumConst(state, "RUN"));
    sw.addCase(top.enumConst(state, "RUN"))
        .ifStmt(acc.eq(top.constant(255, 8, false)))
        .addThenStmt(current.assign(top.enumConst(state, "STOP")));
    sw.defaultBody().assign(acc, sum);

    CombinationalStmtBlock comb = top.combinational();
    comb.addStmt(new Event("tick").fire(Map.of("acc", acc)).belongsTo("t").starts());
    comb.assign(fromLeaf.slice(7, 0), wide.slice(15, 8));

    ModuleInstantiationStmt inst = top.addChildGenerator("u_leaf", leaf);
    inst.connect(leafIn, acc);
    inst.connect(leafOut, fromLeaf);
    inst.leaveUnconnected(leafSpare);
    inst.setComment("child instance");
    depth.setValue(6);

    // built but never placed
    acc.extend(16).castUnsigned();
    fromLeaf.assign(in);
    return context;
  }

  static Context roundTrip(Context context) {
    StringWriter writer = new StringWriter();
    GraphSerializer.serialize(writer, context);
    return GraphDeserializer.restore(new StringReader(writer.toString()));
  }

  @Test
  void testRoundTripGeneratesSameCode() {
    Context original = design();
    Context restored = roundTrip(original);
    Assertions.assertEquals(2, restored.getGenerators().size());
    Generator top = original.getGenerator("top");
    Generator restoredTop = restored.getGenerator("top");
    HDLGenConfig config = new HDLGenConfig();
    config.emit_event_comments = true;
    Assertions.assertEquals(VerilogModule.generate(top, config), VerilogModule.generate(restoredTop, config));
    Assertions.assertSame(restored.getGenerator("leaf"), restoredTop.getChildGenerator("u_leaf"));
    Assertions.assertEquals(6, restored.getGenerator("leaf").getParam("DEPTH").getValue());
    Assertions.assertEquals(4, restored.getGenerator("leaf").getParam("DEPTH").getInitialValue());
    Assertions.assertEquals(List.of("top"), restored.getRoots().stream().map(Generator::getName).toList());
  }

  @Test
  void testSharedNodesStayShared() {
    Context restored = roundTrip(design());
    Generator top = restored.getGenerator("top");
    AssignStmt first = (AssignStmt)top.getStmts().get(0);
    Assertions.assertEquals("out = in + acc", first.toString());
    Var acc = top.getVar("acc");
    Assertions.assertSame(first.getSource(), top.getPort("in").add(acc));
    Assertions.assertSame(top.getVar("bits").bit(0), ((AssignStmt)top.getStmts().get(4)).getTarget());
    Assertions.assertEquals("accumulator", acc.getComment());
  }

  @Test
  void testDanglingSinksSurvive() {
    Context restored = roundTrip(design());
    Var fromLeaf = restored.getGenerator("top").getVar("from_leaf");
    Assertions.assertEquals(1, fromLeaf.sinks().size());
    AssignStmt dangling = fromLeaf.sinks().iterator().next();
    Assertions.assertNull(dangling.getParent());
    Assertions.assertEquals("from_leaf = in", dangling.toString());
  }

  @Test
  void testReferencesPointBackwards() {
    Map<String, Object> document = GraphSerializer.document(design());
    Assertions.assertEquals(GraphSerializer.FORMAT, document.get("format"));
    List<String> references = List.of("parent", "index", "left", "right", "operand", "condition", "true", "false", "target", "source",
                                      "predicate");
    List<String> referenceLists = List.of("operands", "arguments", "stmts", "then", "else");
    Set<Integer> ids = new HashSet<>();
    for (Object item : (List<?>)document.get("nodes")) {
      Map<?, ?> node = (Map<?, ?>)item;
      int id = (Integer)node.get("id");
      for (String key : references) {
        if (node.containsKey(key))
          Assertions.assertTrue(ids.contains((Integer)node.get(key)), key + " of node " + id);
      }
      for (String key : referenceLists) {
        if (node.containsKey(key)) {
          for (Object reference : (List<?>)node.get(key))
            Assertions.assertTrue(ids.contains((Integer)reference), key + " of node " + id);
        }
      }
      Assertions.assertTrue(ids.add(id));
    }
  }

  @Test
  void testRejectsGeneratorsOutsideContext() {
    Context context = new Context();
    Generator top = context.generator("top");
    top.addChildGenerator("u_stray", new Generator("stray"));
    Assertions.assertThrows(UserException.class, () -> GraphSerializer.serialize(new StringWriter(), context));
  }

  @Test
  void testRejectsUndeclaredValues() {
    Context context = new Context();
    Generator mod = context.generator("mod");
    Var out = mod.output("out", 8);
    mod.assign(out, new Var(mod, "loose", 8, false));
    Assertions.assertThrows(UserException.class, () -> GraphSerializer.serialize(new StringWriter(), context));

    Generator clean = new Context().generator("mod");
    Var declared = clean.var("loose", 8);
    Assertions.assertTrue(clean.isDeclared(declared));
    Assertions.assertFalse(clean.isDeclared(new Var(clean, "loose", 8, false)));
  }

  @Test
  void testRejectsForeignDocuments() {
    Assertions.assertThrows(UserException.class, () -> GraphDeserializer.restore(new StringReader("format: other\nversion: 1\n")));
    Assertions.assertThrows(UserException.class,
                            () -> GraphDeserializer.restore(new StringReader("format: hdlgen-graph\nversion: 99\n")));
    Assertions.assertThrows(UserException.class, () -> GraphDeserializer.restore(new StringReader("- a\n- b\n")));
    Assertions.assertThrows(UserException.class, () -> GraphDeserializer.restore(new StringReader("format: [unclosed\n")));
  }

  @Test
  void testRejectsDanglingReferences() {
    String text = "format: hdlgen-graph\n"
                  + "version: 1\n"
                  + "types: []\n"
                  + "generators:\n"
                  + "- {id: 0, name: top, external: false, types: [], stmts: []}\n"
                  + "nodes:\n"
                  + "- {id: 0, kind: VarSlice, generator: 0, parent: 7, high: 1, low: 0}\n";
    Assertions.assertThrows(UserException.class, () -> GraphDeserializer.restore(new StringReader(text)));
  }

  @Test
  void testRegistryCoversEveryNodeClass() {
    Set<String> tags = new HashSet<>();
    for (NodeTypeRegistry.Entry entry : NodeTypeRegistry.entries()) {
      Assertions.assertTrue(tags.add(entry.tag()));
      if (entry.baseTag() != null)
        Assertions.assertTrue(NodeTypeRegistry.entryOf(entry.baseTag()).type().isAssignableFrom(entry.type()), entry.tag());
      Assertions.assertTrue(NodeTypeRegistry.isA(entry.tag(), "IRNode"));
    }
    Context context = design();
    Generator top = context.getGenerator("top");
    Assertions.assertEquals("InterfacePort", NodeTypeRegistry.tagOf(top.getPort("bus")));
    Assertions.assertEquals("Generator", NodeTypeRegistry.tagOf(top));
    Assertions.assertTrue(NodeTypeRegistry.isA("EnumPort", "Var"));
    Assertions.assertTrue(NodeTypeRegistry.isA("Param", "Const"));
    Assertions.assertFalse(NodeTypeRegistry.isA("Port", "Stmt"));
    Assertions.assertTrue(NodeTypeRegistry.entryOf("StmtBlock").isAbstract());
    Assertions.assertFalse(NodeTypeRegistry.entryOf("ScopedStmtBlock").isAbstract());
    Assertions.assertThrows(UserException.class, () -> NodeTypeRegistry.entryOf("Nope"));
    Assertions.assertTrue(NodeTypeRegistry.entryOf(String.class).isEmpty());
  }
}
