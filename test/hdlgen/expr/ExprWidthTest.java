package hdlgen.expr;

import hdlgen.except.VarException;
import hdlgen.generator.Generator;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

class ExprWidthTest {

  @ParameterizedTest
  @EnumSource(ExprOp.class)
  void testResultWidthAndSign(ExprOp op) {
    Generator mod = new Generator("mod");
    Var wide = mod.var("a", 8, true);
    Var other = mod.var("b", 8, true);
    Var amount = mod.var("amount", 3);
    Var flag = mod.var("f", 1);
    Var flag2 = mod.var("g", 1);
    Expr expr;
    switch (op.category) {
    case Unary:
    case Reduction:
      expr = mod.expr(op, wide, null);
      break;
    case Shift:
      expr = mod.expr(op, wide, amount);
      break;
    case Logical:
      expr = mod.expr(op, flag, flag2);
      break;
    default:
      expr = mod.expr(op, wide, other);
      break;
    }
    switch (op.category) {
    case Unary:
    case Arithmetic:
    case Bitwise:
    case Shift:
      Assertions.assertEquals(8, expr.getWidth(), op.name());
      Assertions.assertTrue(expr.isSigned(), op.name());
      break;
    default:
      Assertions.assertEquals(1, expr.getWidth(), op.name());
      Assertions.assertFalse(expr.isSigned(), op.name());
      break;
    }
  }

  @ParameterizedTest
  @EnumSource(value = ExprOp.Category.class, names = {"Arithmetic", "Bitwise", "Relational"})
  void testOperandsMustMatch(ExprOp.Category category) {
    Generator mod = new Generator("mod");
    Var a = mod.var("a", 8);
    Var narrow = mod.var("n", 4);
    Var signed = mod.var("s", 8, true);
    for (ExprOp op : ExprOp.values()) {
      if (op.category != category)
        continue;
      Assertions.assertThrows(VarException.class, () -> mod.expr(op, a, narrow), op.name());
      Assertions.assertThrows(VarException.class, () -> mod.expr(op, a, signed), op.name());
    }
  }

  @Test
  void testShiftAmount() {
    Generator mod = new Generator("mod");
    Var a = mod.var("a", 16);
    Var amount = mod.var("amount", 4);
    Assertions.assertEquals(16, a.shiftLeft(amount).getWidth());
    Assertions.assertThrows(VarException.class, () -> a.shiftLeft(mod.var("neg", 4, true)));
  }

  @Test
  void testLogicalOperandsAreSingleBit() {
    Generator mod = new Generator("mod");
    Var a = mod.var("a", 2);
    Var f = mod.var("f", 1);
    Assertions.assertThrows(VarException.class, () -> a.logicalAnd(f));
    Assertions.assertEquals(1, f.logicalOr(f).getWidth());
  }

  @Test
  void testArity() {
    Generator mod = new Generator("mod");
    Var a = mod.var("a", 2);
    Assertions.assertThrows(VarException.class, () -> mod.expr(ExprOp.Add, a, null));
    Assertions.assertThrows(VarException.class, () -> mod.expr(ExprOp.UInvert, a, a));
  }

  @Test
  void testSignedConstantOperand() {
    Generator mod = new Generator("mod");
    Var a = mod.var("a", 8, true);
    Expr sum = a.add(mod.constant(-1, 8, true));
    Assertions.assertEquals("a + -8'sh1", sum.toString());
    Assertions.assertTrue(sum.isSigned());
    Assertions.assertThrows(VarException.class, () -> a.add(mod.constant(1, 8, false)));
  }
}
