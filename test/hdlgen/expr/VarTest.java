package hdlgen.expr;

import hdlgen.except.InternalException;
import hdlgen.except.VarException;
import hdlgen.generator.Generator;
import hdlgen.stmt.AssignStmt;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class VarTest {
  Generator mod;
  Var a;
  Var b;

  @BeforeEach
  void setUp() {
    mod = new Generator("mod");
    a = mod.var("a", 8);
    b = mod.var("b", 8);
  }

  @Test
  void testSliceIsCached() {
    VarSlice slice = a.slice(3, 0);
    Assertions.assertSame(slice, a.slice(3, 0));
    Assertions.assertNotSame(slice, a.slice(4, 0));
    Assertions.assertEquals(4, slice.getWidth());
    Assertions.assertFalse(slice.isSigned());
    Assertions.assertEquals(VarType.Slice, slice.getType());
    Assertions.assertSame(a, slice.getRootVar());
    Assertions.assertSame(a.bit(2), a.slice(2, 2));
  }

  @Test
  void testSliceRendering() {
    Assertions.assertEquals("a[3:0]", a.slice(3, 0).toString());
    Assertions.assertEquals("a[3]", a.bit(3).toString());
    // nested slices render against the declared value
    Assertions.assertEquals("a[5:4]", a.slice(7, 4).slice(1, 0).toString());
    Assertions.assertEquals("a[6]", a.slice(7, 4).bit(2).toString());
    Var flag = mod.var("flag", 1);
    Assertions.assertEquals("flag", flag.slice(0, 0).toString());
    Var index = mod.var("i", 3);
    Assertions.assertEquals("a[i]", a.slice(index).toString());
    Assertions.assertSame(a.slice(index), a.slice(index));
  }

  @Test
  void testInvalidSlice() {
    VarException e = Assertions.assertThrows(VarException.class, () -> a.slice(8, 0));
    Assertions.assertSame(a, e.getNodes().get(0));
    Assertions.assertThrows(VarException.class, () -> a.slice(2, 3));
    Assertions.assertThrows(VarException.class, () -> a.slice(3, -1));
    // expressions and constants must be assigned to a variable first
    Assertions.assertThrows(VarException.class, () -> a.add(b).slice(1, 0));
    Assertions.assertThrows(VarException.class, () -> mod.constant(3, 8, false).bit(0));
    Assertions.assertThrows(VarException.class, () -> a.slice(mod.var("s", 3, true)));
  }

  @Test
  void testExprIsCached() {
    Expr sum = a.add(b);
    Assertions.assertSame(sum, a.add(b));
    Assertions.assertNotSame(sum, b.add(a));
    Assertions.assertSame(a.invert(), a.invert());
    Assertions.assertEquals(VarType.Expression, sum.getType());
    Assertions.assertSame(mod, sum.getGenerator());
  }

  @Test
  void testExprRendering() {
    Var c = mod.var("c", 8);
    Assertions.assertEquals("a + b", a.add(b).toString());
    Assertions.assertEquals("(a + b) * c", a.add(b).mul(c).toString());
    Assertions.assertEquals("~(a + b)", a.add(b).invert().toString());
    Assertions.assertEquals("a >> 3'h2", a.shiftRight(mod.constant(2, 3, false)).toString());
    Assertions.assertEquals("{a, b}", a.concat(b).toString());
    Assertions.assertEquals("16'(a)", a.extend(16).toString());
    Assertions.assertEquals("$signed(a)", a.castSigned().toString());
    Var sel = mod.var("sel", 1);
    Assertions.assertEquals("sel ? a : (b - c)", mod.conditional(sel, a, b.sub(c)).toString());
    Assertions.assertEquals("$clog2(a)", mod.call("$clog2", 32, false, a).toString());
  }

  @Test
  void testOtherBuilders() {
    Assertions.assertEquals(16, a.concat(b).getWidth());
    Assertions.assertThrows(VarException.class, () -> a.extend(4));
    Assertions.assertTrue(a.castSigned().isSigned());
    Assertions.assertEquals(8, a.castSigned().getWidth());
    Var sel = mod.var("sel", 2);
    Assertions.assertThrows(VarException.class, () -> mod.conditional(sel, a, b));
    Var sel1 = mod.var("sel1", 1);
    Assertions.assertThrows(VarException.class, () -> mod.conditional(sel1, a, mod.var("w", 4)));
  }

  @Test
  void testConstantsMixAcrossGenerators() {
    Generator other = new Generator("other");
    Const one = other.constant(1, 8, false);
    Expr sum = a.add(one);
    Assertions.assertSame(mod, sum.getGenerator());
    Var foreign = other.var("f", 8);
    VarException e = Assertions.assertThrows(VarException.class, () -> a.add(foreign));
    Assertions.assertEquals(2, e.getNodes().size());
    // parameters belong to their module
    Param p = other.parameter("P", 8, false, 3);
    Assertions.assertThrows(VarException.class, () -> a.add(p));
  }

  @Test
  void testAssignRegistersSink() {
    AssignStmt stmt = a.assign(b);
    Assertions.assertTrue(a.sinks().contains(stmt));
    Assertions.assertTrue(b.sinks().isEmpty());
    Assertions.assertNull(stmt.getParent());
    Assertions.assertSame(a, stmt.getTarget());
    Assertions.assertSame(b, stmt.getSource());
    AssignStmt second = a.slice(3, 0).assign(b.slice(3, 0));
    Assertions.assertTrue(a.slice(3, 0).sinks().contains(second));
  }

  @Test
  void testAssignChecks() {
    Var narrow = mod.var("n", 4);
    VarException e = Assertions.assertThrows(VarException.class, () -> a.assign(narrow));
    Assertions.assertEquals(2, e.getNodes().size());
    Assertions.assertSame(a, e.getNodes().get(0));
    Assertions.assertSame(narrow, e.getNodes().get(1));
    Assertions.assertThrows(VarException.class, () -> a.assign(mod.var("s", 8, true)));
    Assertions.assertThrows(VarException.class, () -> a.add(b).assign(a));
    Assertions.assertThrows(VarException.class, () -> mod.constant(1, 8, false).assign(a));
    Port in = mod.input("in", 8);
    Assertions.assertThrows(VarException.class, () -> in.assign(a));
    Assertions.assertThrows(VarException.class, () -> in.slice(1, 0).assign(a.slice(1, 0)));
    Generator other = new Generator("other");
    Assertions.assertThrows(VarException.class, () -> a.assign(other.var("x", 8)));
    Assertions.assertTrue(a.sinks().isEmpty());
  }

  @Test
  void testWidthMustBePositive() {
    Assertions.assertThrows(VarException.class, () -> mod.var("zero", 0));
  }

  @Test
  void testChildren() {
    Expr sum = a.add(b);
    Assertions.assertEquals(2, sum.childCount());
    Assertions.assertSame(a, sum.getChild(0));
    Assertions.assertSame(b, sum.getChild(1));
    Assertions.assertThrows(InternalException.class, () -> sum.getChild(2));
    Assertions.assertEquals(1, a.invert().childCount());
    Assertions.assertEquals(0, a.childCount());
    Assertions.assertThrows(InternalException.class, () -> a.getChild(0));
    Assertions.assertEquals(1, a.slice(1, 0).childCount());
    Assertions.assertSame(a, a.slice(1, 0).getParent());
  }
}
