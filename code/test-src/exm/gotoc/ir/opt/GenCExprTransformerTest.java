package exm.gotoc.ir.opt;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Test;

import exm.gotoc.common.lang.Location;
import exm.gotoc.common.lang.MachineModel;
import exm.gotoc.common.lang.Types;
import exm.gotoc.common.lang.Types.Parameter;
import exm.gotoc.common.lang.Types.Type;
import exm.gotoc.ir.tree.Expr;
import exm.gotoc.ir.tree.Operators.BinaryOp;
import exm.gotoc.ir.tree.Operators.UnaryOp;
import exm.gotoc.ir.tree.Stmt;
import exm.gotoc.ir.tree.Symbol;
import exm.gotoc.ir.tree.Symbol.Attribute;
import exm.gotoc.ir.tree.SymbolTable;

public class GenCExprTransformerTest {

  private static final Location LOC = Location.loc("main.rs", "main", 3,
                                                    null);

  private static final Type VOID_FN =
        Types.code(Collections.<Parameter>emptyList(), Types.EMPTY);

  /**
   * main with body: r = a => c;
   */
  private static SymbolTable impliesTable() {
    SymbolTable st = new SymbolTable(MachineModel.x86_64());
    Expr a = Expr.symbol("main::1::a", Types.BOOL);
    Expr c = Expr.symbol("main::1::c", Types.BOOL);
    Expr r = Expr.symbol("main::1::r", Types.BOOL);
    st.insert(Symbol.variable("main::1::a", "a", Types.BOOL, LOC));
    st.insert(Symbol.variable("main::1::c", "c", Types.BOOL, LOC));
    st.insert(Symbol.variable("main::1::r", "r", Types.BOOL, LOC));
    st.insert(Symbol.function("main", VOID_FN, Stmt.block(Arrays.asList(
        Stmt.assign(r, a.binop(BinaryOp.IMPLIES, c), LOC)), LOC),
        "main", LOC));
    return st;
  }

  @Test
  public void testImpliesRewritten() throws Exception {
    SymbolTable result = new GenCExprTransformer().transform(impliesTable());
    Stmt assign = result.lookup("main_").body().body().get(0);
    Expr rhs = assign.exprs().get(1);
    assertEquals(Expr.Kind.BINARY, rhs.kind());
    assertEquals(BinaryOp.BITOR, rhs.binaryOp());
    assertEquals(Types.BOOL, rhs.type());

    Expr notA = rhs.operand(0);
    assertEquals(Expr.Kind.UNARY, notA.kind());
    assertEquals(UnaryOp.NOT, notA.unaryOp());
    assertEquals("main::1::a", notA.operand(0).identifier());
    assertEquals("main::1::c", rhs.operand(1).identifier());
  }

  @Test
  public void testMainWrapper() throws Exception {
    SymbolTable result = new GenCExprTransformer().transform(impliesTable());
    Symbol renamed = result.lookup("main_");
    assertNotNull(renamed);
    assertEquals("main_", renamed.baseName());
    assertEquals("main_", renamed.prettyName());

    Symbol main = result.lookup("main");
    assertEquals(Types.C_INT, main.type().returnType());
    assertTrue(main.type().parameters().isEmpty());
    List<Stmt> body = main.body().body();
    assertEquals(2, body.size());

    Expr call = body.get(0).exprs().get(0);
    assertEquals(Expr.Kind.FUNCTION_CALL, call.kind());
    assertEquals("main_", call.operand(0).identifier());

    Stmt ret = body.get(1);
    assertEquals(Stmt.Kind.RETURN, ret.kind());
    assertEquals(BigInteger.ZERO, ret.exprs().get(0).value());
  }

  @Test
  public void testWrapperWithoutMain() throws Exception {
    SymbolTable st = new SymbolTable(MachineModel.x86_64());
    st.insert(Symbol.staticVariable("g", "g", Types.C_INT, LOC));
    SymbolTable result = new GenCExprTransformer().transform(st);
    assertFalse(result.contains("main_"));
    // Only return 0
    assertEquals(1, result.lookup("main").body().body().size());
  }

  @Test
  public void testExternStaticInitializedInMain() throws Exception {
    SymbolTable st = impliesTable();
    st.insert(Symbol.staticVariable("ext_count", "ext_count", Types.C_INT,
                                    LOC).setExtern(true));
    SymbolTable result = new GenCExprTransformer().transform(st);

    Symbol count = result.lookup("ext_count");
    assertFalse(count.is(Attribute.IS_EXTERN));
    assertTrue(count.location().isNone());
    assertFalse(count.hasValue());

    Stmt init = result.lookup("main").body().body().get(0);
    assertEquals(Stmt.Kind.ASSIGN, init.kind());
    assertEquals("ext_count", init.exprs().get(0).identifier());
    assertEquals(Expr.Kind.NONDET, init.exprs().get(1).kind());
  }

  @Test
  public void testExternFunctionReturnsNondet() throws Exception {
    SymbolTable st = new SymbolTable(MachineModel.x86_64());
    Type fnType = Types.code(Arrays.asList(new Parameter(Types.C_INT)),
                             Types.C_INT);
    st.insert(Symbol.function("ext", fnType, null, "ext", LOC)
                    .setExtern(true));
    SymbolTable result = new GenCExprTransformer().transform(st);

    Symbol ext = result.lookup("ext");
    assertFalse(ext.is(Attribute.IS_EXTERN));
    assertEquals("__int", ext.type().parameters().get(0).identifier());
    assertTrue(result.contains("__int"));

    Stmt ret = ext.body();
    assertEquals(Stmt.Kind.RETURN, ret.kind());
    assertEquals(Expr.Kind.NONDET, ret.exprs().get(0).kind());
    assertEquals(Types.C_INT, ret.exprs().get(0).type());
  }

  @Test
  public void testVoidExternFunction() throws Exception {
    SymbolTable st = new SymbolTable(MachineModel.x86_64());
    st.insert(Symbol.function("ext_log", VOID_FN, null, "ext_log", LOC)
                    .setExtern(true));
    SymbolTable result = new GenCExprTransformer().transform(st);
    Stmt ret = result.lookup("ext_log").body();
    assertEquals(Stmt.Kind.RETURN, ret.kind());
    assertTrue(ret.exprs().isEmpty());
  }

  private static Expr transformedValue(Expr value) throws Exception {
    SymbolTable st = new SymbolTable(MachineModel.x86_64());
    st.insert(Symbol.staticVariable("v", "v", value.type(), LOC)
                    .setValue(value));
    return new GenCExprTransformer().transform(st).lookup("v").value();
  }

  @Test
  public void testWideConstantSplit() throws Exception {
    Type u128 = Types.unsignedInt(128);
    BigInteger big = BigInteger.ONE.shiftLeft(100).add(BigInteger.valueOf(5));
    Expr e = transformedValue(Expr.intConstant(big, u128));

    assertEquals(BinaryOp.BITOR, e.binaryOp());
    Expr shifted = e.operand(0);
    assertEquals(BinaryOp.SHL, shifted.binaryOp());
    assertEquals(BigInteger.ONE.shiftLeft(36), shifted.operand(0).value());
    assertEquals(BigInteger.valueOf(64), shifted.operand(1).value());
    assertEquals(BigInteger.valueOf(5), e.operand(1).value());
  }

  @Test
  public void testNegativeWideConstant() throws Exception {
    Type i128 = Types.signedInt(128);
    Expr e = transformedValue(Expr.intConstant(-1, i128));
    assertEquals(Expr.Kind.TYPECAST, e.kind());
    assertEquals(i128, e.type());

    BigInteger allOnes = BigInteger.ONE.shiftLeft(64)
                                   .subtract(BigInteger.ONE);
    Expr or = e.operand(0);
    assertEquals(allOnes, or.operand(0).operand(0).value());
    assertEquals(allOnes, or.operand(1).value());
  }

  @Test
  public void testNarrowConstantKept() throws Exception {
    Expr e = transformedValue(Expr.intConstant(7, Types.unsignedInt(64)));
    assertEquals(Expr.Kind.INT_CONSTANT, e.kind());
    assertEquals(BigInteger.valueOf(7), e.value());
  }

  @Test
  public void testVectorIndexThroughPointer() throws Exception {
    SymbolTable st = new SymbolTable(MachineModel.x86_64());
    Type vec = Types.vector(Types.C_INT, 4);
    st.insert(Symbol.staticVariable("vec", "vec", vec, LOC));
    Expr elem = Expr.symbol("vec", vec)
                    .index(Expr.intConstant(1, Types.SIZE_T));
    st.insert(Symbol.staticVariable("elem", "elem", Types.C_INT, LOC)
                    .setValue(elem));
    Expr e = new GenCExprTransformer().transform(st).lookup("elem").value();

    assertEquals(Expr.Kind.DEREFERENCE, e.kind());
    assertEquals(Types.C_INT, e.type());
    Expr sum = e.operand(0);
    assertEquals(BinaryOp.PLUS, sum.binaryOp());
    Expr cast = sum.operand(0);
    assertEquals(Expr.Kind.TYPECAST, cast.kind());
    assertEquals(Types.pointer(Types.C_INT), cast.type());
    assertEquals(Expr.Kind.ADDRESS_OF, cast.operand(0).kind());
  }

  @Test
  public void testArrayIndexKept() throws Exception {
    Type arr = Types.array(Types.C_INT, 4);
    Expr e = transformedValue(Expr.arrayOf(arr, Expr.intConstant(0,
        Types.C_INT)).index(Expr.intConstant(2, Types.SIZE_T)));
    assertEquals(Expr.Kind.INDEX, e.kind());
  }

  @Test
  public void testDisabledByDefault() {
    assertFalse(new TransformPipeline().passEnabled(
                                        new GenCExprTransformer()));
    assertNull(new IdentityTransformer().getConfigEnabledKey());
  }
}
