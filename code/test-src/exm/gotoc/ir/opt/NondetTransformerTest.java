package exm.gotoc.ir.opt;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.fail;

import java.util.Arrays;
import java.util.Collections;

import org.junit.Test;

import exm.gotoc.common.Settings;
import exm.gotoc.common.exceptions.TransformException;
import exm.gotoc.common.lang.Location;
import exm.gotoc.common.lang.MachineModel;
import exm.gotoc.common.lang.Types;
import exm.gotoc.common.lang.Types.Parameter;
import exm.gotoc.common.lang.Types.Type;
import exm.gotoc.ir.tree.Expr;
import exm.gotoc.ir.tree.Stmt;
import exm.gotoc.ir.tree.Symbol;
import exm.gotoc.ir.tree.SymbolTable;

public class NondetTransformerTest {

  private static final Location LOC = Location.loc("main.rs", "main", 2,
                                                    null);

  /**
   * main declares a local initialized with a nondet value of type t
   */
  private static SymbolTable tableUsing(Type t) {
    SymbolTable st = new SymbolTable(MachineModel.x86_64());
    Type fnType = Types.code(Collections.<Parameter>emptyList(), t);
    Expr x = Expr.symbol("main::1::x", t);
    st.insert(Symbol.variable("main::1::x", "x", t, LOC));
    st.insert(Symbol.function("main", fnType, Stmt.block(Arrays.asList(
        Stmt.decl(x, Expr.nondet(t), LOC),
        Stmt.returnStmt(x, LOC)), LOC), "main", LOC));
    return st;
  }

  @Test
  public void testFunctionName() {
    assertEquals("non_det_signed_32_bit",
                 NondetTransformer.functionName(Types.signedInt(32)));
    assertEquals("non_det_int", NondetTransformer.functionName(Types.C_INT));
  }

  @Test
  public void testReplaceNondet() throws TransformException {
    SymbolTable result = new NondetTransformer().transform(
                                    tableUsing(Types.signedInt(32)));
    assertEquals(Arrays.asList("main::1::x", "main",
                               "non_det_signed_32_bit_ret",
                               "non_det_signed_32_bit"),
                 result.names());

    Stmt decl = result.lookup("main").body().body().get(0);
    Expr init = decl.exprs().get(1);
    assertEquals(Expr.Kind.FUNCTION_CALL, init.kind());
    assertEquals("non_det_signed_32_bit", init.operand(0).identifier());
    assertEquals(Types.signedInt(32), init.type());

    Symbol ret = result.lookup("non_det_signed_32_bit_ret");
    assertEquals("ret", ret.baseName());
    Symbol fn = result.lookup("non_det_signed_32_bit");
    assertEquals(Types.signedInt(32), fn.type().returnType());
    assertEquals(Stmt.Kind.RETURN, fn.body().body().get(1).kind());
  }

  @Test
  public void testOneFunctionPerType() throws TransformException {
    SymbolTable st = tableUsing(Types.C_INT);
    Expr y = Expr.symbol("g::1::y", Types.C_INT);
    st.insert(Symbol.variable("g::1::y", "y", Types.C_INT, LOC));
    st.insert(Symbol.function("g",
        Types.code(Collections.<Parameter>emptyList(), Types.EMPTY),
        Stmt.block(Arrays.asList(
            Stmt.assign(y, Expr.nondet(Types.C_INT), LOC),
            Stmt.assign(y, Expr.nondet(Types.C_INT), LOC)), LOC),
        "g", LOC));
    SymbolTable result = new NondetTransformer().transform(st);
    assertEquals(st.size() + 2, result.size());
  }

  @Test
  public void testNoNondet() throws TransformException {
    SymbolTable st = new SymbolTable(MachineModel.x86_64());
    st.insert(Symbol.variable("v", "v", Types.C_INT, LOC));
    SymbolTable result = new NondetTransformer().transform(st);
    assertEquals(Arrays.asList("v"), result.names());
  }

  @Test
  public void testVoidRejected() {
    SymbolTable st = new SymbolTable(MachineModel.x86_64());
    st.insert(Symbol.function("f",
        Types.code(Collections.<Parameter>emptyList(), Types.EMPTY),
        Stmt.expression(Expr.nondet(Types.EMPTY), LOC), "f", LOC));
    try {
      new NondetTransformer().transform(st);
      fail("Expected void nondet to be rejected");
    } catch (TransformException e) {
      assertEquals("non_det_empty", e.getSymbolName());
    }
  }

  @Test(expected=TransformException.class)
  public void testNameCollision() throws TransformException {
    SymbolTable st = tableUsing(Types.C_INT);
    st.insert(Symbol.variable("non_det_int", "non_det_int", Types.C_INT,
                              LOC));
    new NondetTransformer().transform(st);
  }

  @Test
  public void testDisabledByDefault() {
    TransformPipeline pipeline = new TransformPipeline();
    NondetTransformer pass = new NondetTransformer();
    pipeline.addPass(pass);
    assertEquals(Settings.NONDET_FUNCTIONS, pass.getConfigEnabledKey());
    assertFalse(pipeline.passEnabled(pass));
  }
}
