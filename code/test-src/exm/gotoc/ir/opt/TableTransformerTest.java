package exm.gotoc.ir.opt;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Test;

import exm.gotoc.common.exceptions.GotocRuntimeError;
import exm.gotoc.common.exceptions.TransformException;
import exm.gotoc.common.lang.Location;
import exm.gotoc.common.lang.MachineModel;
import exm.gotoc.common.lang.StringPool;
import exm.gotoc.common.lang.Types;
import exm.gotoc.common.lang.Types.DatatypeComponent;
import exm.gotoc.common.lang.Types.Parameter;
import exm.gotoc.common.lang.Types.Type;
import exm.gotoc.ir.tree.Expr;
import exm.gotoc.ir.tree.Operators.BinaryOp;
import exm.gotoc.ir.tree.Stmt;
import exm.gotoc.ir.tree.Symbol;
import exm.gotoc.ir.tree.SymbolTable;
import exm.gotoc.irep.IrepJson;

public class TableTransformerTest {

  static SymbolTable sampleTable() {
    SymbolTable st = new SymbolTable(MachineModel.x86_64());
    Location loc = Location.loc("lib.rs", "f", 3, 1L);
    Type pairTag = Types.structTag("Pair");
    Type fnType = Types.code(Collections.<Parameter>emptyList(), pairTag);
    Expr p = Expr.symbol("f::1::p", pairTag);

    // Function defined before the type it uses
    st.insert(Symbol.function("f", fnType, Stmt.block(Arrays.asList(
        Stmt.decl(p, Expr.struct(pairTag, Arrays.asList(
            Expr.intConstant(1, Types.C_INT),
            Expr.intConstant(2, Types.C_INT))), loc),
        Stmt.returnStmt(p, loc)), loc), "f", loc));
    st.insert(Symbol.variable("f::1::p", "p", pairTag, loc));
    st.insert(Symbol.structType("Pair", "Pair", Arrays.asList(
        DatatypeComponent.field("a", Types.C_INT),
        DatatypeComponent.field("b", Types.C_INT)), loc));
    return st;
  }

  @Test
  public void testIdentityIsFixedPoint() throws TransformException {
    SymbolTable st = sampleTable();
    SymbolTable result = new IdentityTransformer().transform(st);
    assertNotSame(st, result);
    assertEquals(st.names(), result.names());
    assertEquals(IrepJson.toJson(st, false), IrepJson.toJson(result, false));
  }

  @Test
  public void testEnvironmentIsFixedPoint() throws TransformException {
    SymbolTable st = SymbolTable.withEnvironment(MachineModel.aarch64());
    SymbolTable result = new IdentityTransformer().transform(st);
    assertEquals(IrepJson.toJson(st, true), IrepJson.toJson(result, true));
  }

  @Test(expected=GotocRuntimeError.class)
  public void testSingleUse() throws TransformException {
    IdentityTransformer t = new IdentityTransformer();
    t.transform(sampleTable());
    t.transform(sampleTable());
  }

  @Test
  public void testPreprocessSymbolsLast() throws TransformException {
    final Symbol extra = Symbol.variable("extra", "extra", Types.C_INT,
                                         Location.none());
    TableTransformer t = new TableTransformer() {
      @Override
      public String getPassName() {
        return "add extra";
      }

      @Override
      protected void preprocess(SymbolTable source) {
        targetTable().insert(extra);
      }
    };
    SymbolTable st = sampleTable();
    SymbolTable result = t.transform(st);
    List<String> expected = new ArrayList<String>(st.names());
    expected.add("extra");
    assertEquals(expected, result.names());
  }

  @Test
  public void testRewriteConstants() throws TransformException {
    // Add one to every integer constant
    TableTransformer t = new TableTransformer() {
      @Override
      public String getPassName() {
        return "increment";
      }

      @Override
      public Expr transformExpr(Expr e) {
        Expr r = super.transformExpr(e);
        if (r.kind() == Expr.Kind.INT_CONSTANT) {
          return r.plus(Expr.one(r.type()));
        }
        return r;
      }
    };
    SymbolTable result = t.transform(sampleTable());
    Stmt decl = result.lookup("f").body().body().get(0);
    Expr literal = decl.exprs().get(1);
    assertEquals(Expr.Kind.STRUCT, literal.kind());
    for (Expr op: literal.operands()) {
      assertEquals(Expr.Kind.BINARY, op.kind());
      assertEquals(BinaryOp.PLUS, op.binaryOp());
    }
    assertTrue(result.lookup("tag-Pair").isType());
  }

  @Test
  public void testNamesStayInTablePool() throws TransformException {
    StringPool pool = new StringPool();
    SymbolTable st = new SymbolTable(MachineModel.x86_64(), pool);
    StringPool.Scope scope = pool.enter();
    try {
      st.insert(Symbol.staticVariable("pooled.only", "pooled.only",
                                      Types.C_INT, Location.none()));
    } finally {
      scope.close();
    }

    SymbolTable result = new NameTransformer().transform(st);
    assertSame(pool, result.stringPool());
    assertNotNull(pool.lookup("pooled_only"));
    assertTrue(result.contains("pooled_only"));
  }
}
