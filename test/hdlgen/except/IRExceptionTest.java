package hdlgen.except;

import hdlgen.expr.Var;
import hdlgen.generator.Generator;
import hdlgen.stmt.AssignStmt;
import java.util.List;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class IRExceptionTest {

  @Test
  void testDiagnostic() {
    Generator mod = new Generator("mod");
    Var a = mod.var("a", 8);
    Var b = mod.var("b", 4);
    VarException e = Assertions.assertThrows(VarException.class, () -> a.assign(b));
    Assertions.assertEquals(ErrorKind.Var, e.getKind());
    Diagnostic diagnostic = e.toDiagnostic();
    Assertions.assertEquals(ErrorKind.Var, diagnostic.kind());
    Assertions.assertEquals(e.getPlainMessage(), diagnostic.message());
    Assertions.assertEquals(List.of("a (Var in mod)", "b (Var in mod)"), diagnostic.nodes());
    Assertions.assertTrue(e.getMessage().startsWith(e.getPlainMessage() + "\n\ta (Var in mod)"));
    Assertions.assertTrue(diagnostic.toString().startsWith("Var: "));
  }

  @Test
  void testKinds() {
    Generator mod = new Generator("mod");
    Var a = mod.var("a", 1);
    AssignStmt stmt = a.assign(mod.constant(1, 1, false));
    StmtException stmtError = new StmtException("conflict", List.of(stmt));
    Assertions.assertEquals(ErrorKind.Stmt, stmtError.getKind());
    Assertions.assertEquals("conflict\n\ta = 1'h1 (AssignStmt in mod)", stmtError.getMessage());
    Assertions.assertEquals(ErrorKind.Generator, new GeneratorException("clash", List.of(mod)).getKind());
    Assertions.assertEquals("clash\n\tmod (Generator)", new GeneratorException("clash", List.of(mod)).getMessage());
    Assertions.assertEquals(ErrorKind.Internal, new InternalException("broken").getKind());
    UserException user = new UserException("misuse");
    Assertions.assertEquals(ErrorKind.User, user.getKind());
    Assertions.assertEquals("misuse", user.getMessage());
    Assertions.assertTrue(user.getNodes().isEmpty());
  }
}
