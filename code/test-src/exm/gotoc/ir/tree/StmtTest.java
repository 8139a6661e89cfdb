package exm.gotoc.ir.tree;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Collections;

import org.junit.Test;

import exm.gotoc.common.exceptions.GotocRuntimeError;
import exm.gotoc.common.lang.Location;
import exm.gotoc.common.lang.Types;
import exm.gotoc.common.lang.Types.Parameter;
import exm.gotoc.common.lang.Types.Type;

public class StmtTest {

  private static final Location LOC = Location.loc("a.rs", "main", 7, 1L);
  private static final Expr X = Expr.symbol("main::1::x", Types.C_INT);

  @Test
  public void testAssertIsProperty() {
    Stmt s = Stmt.assertStmt(X.lt(Expr.one(Types.C_INT)), "assertion",
                             "x is small", LOC);
    assertTrue(s.location().isProperty());
    assertEquals("x is small", s.location().comment());
    assertEquals(Long.valueOf(7), s.location().line());
  }

  @Test(expected=GotocRuntimeError.class)
  public void testAssumeNeedsBool() {
    Stmt.assume(X, LOC);
  }

  @Test(expected=GotocRuntimeError.class)
  public void testAssignTypes() {
    Stmt.assign(X, Expr.trueExpr(), LOC);
  }

  @Test(expected=GotocRuntimeError.class)
  public void testDeclNeedsSymbol() {
    Stmt.decl(X.plus(X), null, LOC);
  }

  @Test
  public void testFunctionCallWithoutResult() {
    Type fnType = Types.code(Arrays.asList(new Parameter(Types.C_INT)),
                             Types.EMPTY);
    Stmt call = Stmt.functionCall(null, Expr.symbol("f", fnType),
                                  Arrays.asList(X), LOC);
    assertNull(call.callLhs());
    assertEquals(Arrays.asList(X), call.callArguments());
  }

  @Test
  public void testSwitch() {
    Stmt body = Stmt.breakStmt(LOC);
    Stmt sw = Stmt.switchStmt(X, Arrays.asList(
        Stmt.switchCase(Expr.one(Types.C_INT), body)),
        Stmt.skip(LOC), LOC);
    assertEquals(2, sw.body().size());
    assertFalse(sw.body().get(0).isDefaultCase());
    assertTrue(sw.body().get(1).isDefaultCase());
  }

  @Test(expected=GotocRuntimeError.class)
  public void testSwitchCaseType() {
    Stmt.switchStmt(X, Arrays.asList(
        Stmt.switchCase(Expr.trueExpr(), Stmt.skip(LOC))), null, LOC);
  }

  @Test
  public void testLoopInvariant() {
    Stmt loop = Stmt.whileLoop(Expr.trueExpr(), Stmt.skip(LOC), LOC)
                    .withLoopInvariant(X.lt(X));
    assertEquals(X.lt(X), loop.loopInvariant());
  }

  @Test(expected=GotocRuntimeError.class)
  public void testInvariantOnNonLoop() {
    Stmt.skip(LOC).withLoopInvariant(Expr.trueExpr());
  }

  @Test
  public void testLabels() {
    Stmt labelled = Stmt.skip(LOC).withLabel("bb0");
    assertEquals(Stmt.Kind.LABEL, labelled.kind());
    assertEquals("bb0", labelled.label());
    assertEquals("bb1", labelled.withLabelName("bb1").label());
    assertEquals("bb0", Stmt.gotoStmt("bb0", LOC).label());
  }

  @Test(expected=GotocRuntimeError.class)
  public void testStatementExpressionNotEmpty() {
    Expr.statementExpression(Collections.<Stmt>emptyList(), Types.C_INT);
  }
}
