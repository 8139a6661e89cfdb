package exm.gotoc.ir.opt;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Collections;

import org.junit.Test;

import exm.gotoc.common.exceptions.GotocRuntimeError;
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

public class NameTransformerTest {

  @Test
  public void testFixName() {
    assertEquals("_1abc", NameTransformer.fixName("1abc"));
    assertEquals("a_b", NameTransformer.fixName("a.b"));
    assertEquals("std__mem_take_", NameTransformer.fixName("std::mem<take>"));
    assertEquals("case_", NameTransformer.fixName("case"));
    assertEquals("default_", NameTransformer.fixName("default"));
    assertEquals("ok_name$1", NameTransformer.fixName("ok_name$1"));
  }

  @Test
  public void testConsistentAndInjective() {
    NameTransformer t = new NameTransformer();
    assertEquals("a_b", t.normalize("a.b"));
    assertEquals("a_b_0", t.normalize("a_b"));
    assertEquals("a_b_1", t.normalize("a-b"));
    assertEquals("a_b", t.normalize("a.b"));
    assertEquals("a_b_0", t.normalize("a_b"));
  }

  @Test
  public void testPrefixAndLocals() {
    NameTransformer t = new NameTransformer();
    assertEquals("tag-My_Struct", t.normalize("tag-My.Struct"));
    assertEquals("f::x", t.normalize("f::1::x"));
    assertEquals("my_fn::tmp_1", t.normalize("my.fn::1::tmp.1"));
    // Disambiguated before the variable name
    assertEquals("my_fn_0::tmp_1", t.normalize("my-fn::1::tmp.1"));
  }

  @Test(expected=GotocRuntimeError.class)
  public void testRepeatedSeparator() {
    new NameTransformer().normalize("f::1::g::1::x");
  }

  @Test(expected=GotocRuntimeError.class)
  public void testEmptyName() {
    new NameTransformer().normalize("");
  }

  @Test
  public void testTableRenamedConsistently() throws TransformException {
    SymbolTable st = new SymbolTable(MachineModel.x86_64());
    Location loc = Location.loc("lib.rs", "my.fn", 7, null);
    Type fnType = Types.code(Collections.<Parameter>emptyList(),
                             Types.C_INT);
    Expr x = Expr.symbol("my.fn::1::x", Types.C_INT);
    st.insert(Symbol.variable("my.fn::1::x", "x", Types.C_INT, loc));
    st.insert(Symbol.function("my.fn", fnType, Stmt.block(Arrays.asList(
        Stmt.decl(x, Expr.intConstant(3, Types.C_INT), loc),
        Stmt.label("loop.head", Stmt.skip(loc), loc),
        Stmt.gotoStmt("loop.head", loc),
        Stmt.returnStmt(x, loc)), loc), "my.fn", loc));

    SymbolTable result = new NameTransformer().transform(st);
    assertEquals(Arrays.asList("my_fn::x", "my_fn"), result.names());

    Symbol local = result.lookup("my_fn::x");
    assertEquals("x", local.baseName());

    Symbol fn = result.lookup("my_fn");
    assertNotNull(fn.body());
    assertEquals("my_fn", fn.prettyName());
    Stmt decl = fn.body().body().get(0);
    assertEquals("my_fn::x", decl.exprs().get(0).identifier());
    assertEquals("loop_head", fn.body().body().get(1).label());
    assertEquals("loop_head", fn.body().body().get(2).label());
    assertEquals("my_fn::x",
                 fn.body().body().get(3).exprs().get(0).identifier());
    assertFalse(result.contains("my.fn"));
    assertTrue(st.contains("my.fn"));
  }
}
