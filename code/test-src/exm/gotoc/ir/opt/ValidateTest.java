package exm.gotoc.ir.opt;

import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Arrays;

import org.junit.Test;

import exm.gotoc.common.exceptions.TransformException;
import exm.gotoc.common.lang.Location;
import exm.gotoc.common.lang.MachineModel;
import exm.gotoc.common.lang.Types;
import exm.gotoc.common.lang.Types.DatatypeComponent;
import exm.gotoc.common.lang.Types.Type;
import exm.gotoc.ir.tree.Expr;
import exm.gotoc.ir.tree.Symbol;
import exm.gotoc.ir.tree.SymbolTable;

public class ValidateTest {

  private static final Location LOC = Location.loc("lib.rs", null, 1, null);

  private static SymbolTable tableWithPair() {
    SymbolTable st = SymbolTable.withEnvironment(MachineModel.x86_64());
    st.insert(Symbol.structType("Pair", "Pair", Arrays.asList(
        DatatypeComponent.field("a", Types.C_INT),
        DatatypeComponent.field("b", Types.C_CHAR)), LOC));
    return st;
  }

  private static void expectProblem(SymbolTable st, String fragment) {
    try {
      Validate.check(st);
      fail("Expected validation to fail with " + fragment);
    } catch (TransformException e) {
      assertTrue(e.getMessage(), e.getMessage().contains(fragment));
    }
  }

  @Test
  public void testEnvironmentValid() throws TransformException {
    Validate.check(SymbolTable.withEnvironment(MachineModel.x86_64()));
    Validate.check(SymbolTable.withEnvironment(MachineModel.aarch64()));
  }

  @Test
  public void testStructLiteral() throws TransformException {
    SymbolTable st = tableWithPair();
    Type pair = Types.structTag("Pair");
    st.insert(Symbol.staticVariable("good", "good", pair, LOC)
        .setValue(Expr.struct(pair, Arrays.asList(
            Expr.intConstant(1, Types.C_INT),
            Expr.intConstant(2, Types.C_CHAR)))));
    Validate.check(st);

    st.insert(Symbol.staticVariable("short", "short", pair, LOC)
        .setValue(Expr.struct(pair, Arrays.asList(
            Expr.intConstant(1, Types.C_INT)))));
    expectProblem(st, "symbol short");
  }

  @Test
  public void testStructLiteralTypes() {
    SymbolTable st = tableWithPair();
    Type pair = Types.structTag("Pair");
    st.insert(Symbol.staticVariable("swapped", "swapped", pair, LOC)
        .setValue(Expr.struct(pair, Arrays.asList(
            Expr.intConstant(2, Types.C_CHAR),
            Expr.intConstant(1, Types.C_INT)))));
    expectProblem(st, "component a");
  }

  @Test
  public void testUnresolvedTag() {
    SymbolTable st = tableWithPair();
    st.insert(Symbol.staticVariable("m", "m", Types.structTag("Missing"),
                                    LOC));
    expectProblem(st, "symbol m");
  }

  @Test
  public void testMemberThroughTag() throws TransformException {
    SymbolTable st = tableWithPair();
    Type pair = Types.structTag("Pair");
    st.insert(Symbol.staticVariable("p", "p", pair, LOC));
    st.insert(Symbol.staticVariable("q", "q", Types.C_CHAR, LOC)
        .setValue(Expr.symbol("p", pair).member("b", Types.C_CHAR)));
    Validate.check(st);

    st.insert(Symbol.staticVariable("r", "r", Types.C_INT, LOC)
        .setValue(Expr.symbol("p", pair).member("c", Types.C_INT)));
    expectProblem(st, "no field c");
  }
}
