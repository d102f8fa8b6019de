package hdlgen.expr;

import hdlgen.except.GeneratorException;
import hdlgen.except.UserException;
import hdlgen.except.VarException;
import hdlgen.generator.Generator;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class TypedVarTest {

  static EnumType stateType() {
    return new EnumType("state_t", 2).addValue("IDLE", 0).addValue("BUSY", 1).addValue("DONE", 2);
  }

  static InterfaceDefinition busInterface() {
    Map<String, PortDirection> master = new LinkedHashMap<>();
    master.put("data", PortDirection.Out);
    master.put("valid", PortDirection.Out);
    master.put("ready", PortDirection.In);
    return new InterfaceDefinition("bus_if").addSignal("data", 8).addSignal("valid", 1).addSignal("ready", 1)
        .addModport("master", master);
  }

  @Test
  void testEnumDefinition() {
    EnumType state = stateType();
    Assertions.assertThrows(UserException.class, () -> state.addValue("IDLE", 3));
    Assertions.assertThrows(UserException.class, () -> state.addValue("OTHER", 1));
    Assertions.assertThrows(UserException.class, () -> state.addValue("BIG", 4));
    Assertions.assertEquals(3, state.getValues().size());
  }

  @Test
  void testEnumValues() {
    EnumType state = stateType();
    Generator mod = new Generator("mod");
    EnumVar s = mod.enumVar("s", state);
    EnumConst busy = mod.enumConst(state, "BUSY");
    Assertions.assertSame(busy, mod.enumConst(state, "BUSY"));
    Assertions.assertEquals("BUSY", busy.toString());
    Assertions.assertEquals(1, busy.getValue());
    Assertions.assertEquals(2, s.getWidth());
    Assertions.assertEquals("s == BUSY", s.eq(busy).toString());
    Assertions.assertEquals("s = BUSY", s.assign(busy).toString());
    Assertions.assertThrows(UserException.class, () -> mod.enumConst(state, "MISSING"));
    Assertions.assertTrue(mod.getTypeDefinitions().contains(state));
  }

  @Test
  void testEnumRestrictions() {
    EnumType state = stateType();
    EnumType other = new EnumType("mode_t", 2).addValue("OFF", 0);
    Generator mod = new Generator("mod");
    EnumVar s = mod.enumVar("s", state);
    Var plain = mod.var("p", 2);
    Assertions.assertThrows(VarException.class, () -> s.add(plain));
    Assertions.assertThrows(VarException.class, () -> s.eq(plain));
    Assertions.assertThrows(VarException.class, () -> s.eq(mod.enumConst(other, "OFF")));
    Assertions.assertThrows(VarException.class, () -> s.assign(plain));
    Assertions.assertThrows(VarException.class, () -> plain.assign(s));
    Assertions.assertThrows(VarException.class, () -> s.castSigned());
  }

  @Test
  void testStructMembers() {
    PackedStruct packet = new PackedStruct("packet_t").addMember("valid", 1).addMember("data", 8).addMember("tag", 3, true);
    Generator mod = new Generator("mod");
    VarPackedStruct p = mod.structVar("p", packet);
    Assertions.assertEquals(12, p.getWidth());
    PackedSlice data = p.member("data");
    Assertions.assertSame(data, p.member("data"));
    Assertions.assertEquals("p.data", data.toString());
    Assertions.assertEquals(8, data.getWidth());
    Assertions.assertEquals(3, data.getLow());
    Assertions.assertEquals(10, data.getHigh());
    Assertions.assertEquals(11, p.member("valid").getLow());
    Assertions.assertEquals(0, p.member("tag").getLow());
    Assertions.assertTrue(p.member("tag").isSigned());
    Assertions.assertSame(p, data.getRootVar());
    Assertions.assertThrows(VarException.class, () -> p.member("missing"));
    Var plain = mod.var("plain", 8);
    Assertions.assertEquals("p.data = plain", data.assign(plain).toString());
  }

  @Test
  void testStructPortOfInputIsReadOnly() {
    PackedStruct packet = new PackedStruct("packet_t").addMember("data", 8);
    Generator mod = new Generator("mod");
    PortPackedStruct in = mod.structPort(PortDirection.In, "in", packet);
    Var plain = mod.var("plain", 8);
    Assertions.assertThrows(VarException.class, () -> in.member("data").assign(plain));
    Assertions.assertEquals("plain = in.data", plain.assign(in.member("data")).toString());
    PackedStruct otherStruct = new PackedStruct("other_t").addMember("data", 8);
    VarPackedStruct other = mod.structVar("other", otherStruct);
    Assertions.assertThrows(VarException.class, () -> other.assign(in));
  }

  @Test
  void testInterfaceSignals() {
    InterfaceDefinition bus = busInterface();
    Generator mod = new Generator("mod");
    InterfacePort port = mod.interfacePort("bus", bus, "master");
    Assertions.assertEquals(PortDirection.InOut, port.getDirection());
    InterfaceSignal data = port.signal("data");
    Assertions.assertSame(data, port.signal("data"));
    Assertions.assertEquals("bus.data", data.toString());
    Assertions.assertEquals(PortDirection.Out, data.getModportDirection());
    Assertions.assertTrue(data.isAssignable());
    Assertions.assertFalse(port.signal("ready").isAssignable());
    Var x = mod.var("x", 8);
    Assertions.assertEquals("bus.data = x", data.assign(x).toString());
    Var ready = mod.var("ready_q", 1);
    Assertions.assertThrows(VarException.class, () -> port.signal("ready").assign(ready));
    Assertions.assertThrows(VarException.class, () -> port.signal("missing"));
    Assertions.assertThrows(VarException.class, () -> port.add(port));
    Assertions.assertThrows(VarException.class, () -> port.slice(1, 0));
  }

  @Test
  void testInterfaceVar() {
    InterfaceDefinition bus = busInterface();
    Generator mod = new Generator("mod");
    InterfaceVar inst = mod.interfaceVar("bus_inst", bus);
    Assertions.assertNull(inst.signal("ready").getModportDirection());
    Assertions.assertTrue(inst.signal("ready").isAssignable());
    Assertions.assertThrows(UserException.class, () -> mod.interfacePort("p", bus, "slave"));
  }

  @Test
  void testTypeNamesAreUnique() {
    Generator mod = new Generator("mod");
    mod.enumVar("s", stateType());
    Assertions.assertThrows(GeneratorException.class, () -> mod.enumVar("t", stateType()));
  }
}
