package exm.gotoc.irep;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;

import org.junit.Test;

import exm.gotoc.common.exceptions.GotocRuntimeError;
import exm.gotoc.common.lang.Location;
import exm.gotoc.common.lang.MachineModel;
import exm.gotoc.common.lang.Types;
import exm.gotoc.common.lang.Types.DatatypeComponent;
import exm.gotoc.common.lang.Types.Parameter;
import exm.gotoc.common.lang.Types.Type;
import exm.gotoc.ir.tree.Contracts.FunctionContract;
import exm.gotoc.ir.tree.Contracts.Spec;
import exm.gotoc.ir.tree.Expr;
import exm.gotoc.ir.tree.Operators.UnaryOp;
import exm.gotoc.ir.tree.Stmt;
import exm.gotoc.ir.tree.Symbol;

public class IrepConverterTest {

  private final IrepConverter x86 = new IrepConverter(MachineModel.x86_64());
  private final IrepConverter arm = new IrepConverter(MachineModel.aarch64());

  private String constantValue(Expr e) {
    Irep irep = x86.toIrep(e);
    assertEquals("constant", irep.id());
    return irep.namedSub("value").id();
  }

  @Test
  public void testConstants() {
    assertEquals("FFFFFFFF", constantValue(Expr.intConstant(-1,
                                                          Types.C_INT)));
    assertEquals("2A", constantValue(Expr.intConstant(42, Types.C_INT)));
    assertEquals("0", constantValue(Expr.zero(Types.C_LONG_INT)));
    assertEquals("true", constantValue(Expr.trueExpr()));
    assertEquals("false", constantValue(Expr.falseExpr()));
    assertEquals("1", constantValue(Expr.cBoolConstant(true)));
    assertEquals("3F800000", constantValue(Expr.floatConstant(1.0f)));
    assertEquals("3FF0000000000000",
                 constantValue(Expr.doubleConstant(1.0)));
    assertEquals("8000000000000000",
                 constantValue(Expr.doubleConstant(-0.0)));
    assertEquals("NULL",
        constantValue(Expr.nullPointer(Types.pointer(Types.C_INT))));
    assertEquals("1000", constantValue(
        Expr.pointerConstant(4096, Types.pointer(Types.C_INT))));
  }

  @Test
  public void testConstantFitsMachine() {
    Expr c = Expr.intConstant(200, Types.C_CHAR);
    // char is unsigned on aarch64 and signed on x86_64
    assertEquals("C8", arm.toIrep(c).namedSub("value").id());
    try {
      x86.toIrep(c);
      fail("Expected 200 not to fit in a signed char");
    } catch (GotocRuntimeError e) {
      assertTrue(e.getMessage().contains("x86_64"));
    }
  }

  @Test
  public void testIntegerTypes() {
    Irep intIrep = x86.toIrep(Types.C_INT);
    assertEquals("signedbv", intIrep.id());
    assertEquals("32", intIrep.namedSub("width").id());
    assertEquals("signedbv", x86.toIrep(Types.C_CHAR).id());
    assertEquals("unsignedbv", arm.toIrep(Types.C_CHAR).id());
    assertEquals("unsignedbv", x86.toIrep(Types.SIZE_T).id());
    assertEquals("c_bool", x86.toIrep(Types.C_BOOL).id());
    assertEquals("64", x86.toIrep(Types.SSIZE_T).namedSub("width").id());
  }

  @Test
  public void testFloatTypes() {
    Irep d = x86.toIrep(Types.DOUBLE);
    assertEquals("floatbv", d.id());
    assertEquals(Arrays.asList("f", "width", "#c_type"),
                 new ArrayList<String>(d.namedSub().keySet()));
    assertEquals("52", d.namedSub("f").id());
    assertEquals("float", x86.toIrep(Types.FLOAT).namedSub("#c_type").id());
  }

  @Test
  public void testArrayTypes() {
    Irep arr = x86.toIrep(Types.array(Types.C_CHAR, 3));
    assertEquals("array", arr.id());
    assertEquals(1, arr.sub().size());
    assertEquals("3", arr.namedSub("size").namedSub("value").id());
    Irep flex = x86.toIrep(Types.flexibleArray(Types.C_CHAR));
    assertEquals("0", flex.namedSub("size").namedSub("value").id());
    Irep inf = x86.toIrep(Types.infiniteArray(Types.C_CHAR));
    assertEquals("infinity", inf.namedSub("size").id());
  }

  @Test
  public void testStructType() {
    Type s = Types.structType("S", Arrays.asList(
        DatatypeComponent.field("a", Types.C_INT),
        DatatypeComponent.padding("$pad", 32)));
    Irep irep = x86.toIrep(s);
    assertEquals("struct", irep.id());
    assertEquals("S", irep.namedSub("tag").id());
    Irep comps = irep.namedSub("components");
    assertEquals(2, comps.sub().size());
    Irep field = comps.sub().get(0);
    assertEquals(Arrays.asList("name", "#pretty_name", "type"),
                 new ArrayList<String>(field.namedSub().keySet()));
    Irep pad = comps.sub().get(1);
    assertEquals("1", pad.namedSub("#is_padding").id());
    assertEquals("unsignedbv", pad.namedSub("type").id());

    Irep incomplete = x86.toIrep(Types.incompleteUnion("U"));
    assertEquals("union", incomplete.id());
    assertEquals("1", incomplete.namedSub("incomplete").id());

    Irep tag = x86.toIrep(Types.structTag("S"));
    assertEquals("struct_tag", tag.id());
    assertEquals("tag-S", tag.namedSub("identifier").id());
  }

  @Test
  public void testCodeType() {
    Type fn = Types.variadicCode(Arrays.asList(
        new Parameter(Types.C_INT, "f::x", "x")), Types.EMPTY);
    Irep irep = x86.toIrep(fn);
    assertEquals("code", irep.id());
    Irep params = irep.namedSub("parameters");
    assertEquals("1", params.namedSub("ellipsis").id());
    Irep p = params.sub().get(0);
    assertEquals("parameter", p.id());
    assertEquals("f::x", p.namedSub("#identifier").id());
    assertEquals("x", p.namedSub("#base_name").id());
    assertEquals("empty", irep.namedSub("return_type").id());
  }

  @Test
  public void testLocation() {
    assertTrue(x86.toIrep(Location.none()).isNil());
    Irep loc = x86.toIrep(Location.loc("a.rs", "f", 10, 2L));
    assertEquals("", loc.id());
    assertEquals(Arrays.asList("file", "line", "column", "function"),
                 new ArrayList<String>(loc.namedSub().keySet()));
    assertEquals("10", loc.namedSub("line").id());

    Irep builtin = x86.toIrep(Location.builtinFunction("memcpy", null));
    assertEquals("<builtin-library-memcpy>",
                 builtin.namedSub("file").id());
    assertNull(builtin.namedSub("line"));
  }

  @Test
  public void testExprNamedSubOrder() {
    Expr x = Expr.symbol("x", Types.C_INT)
                 .withLocation(Location.loc("a.rs", "f", 1, null));
    Irep irep = x86.toIrep(x);
    assertEquals("symbol", irep.id());
    assertEquals(Arrays.asList("identifier", "#source_location", "type"),
                 new ArrayList<String>(irep.namedSub().keySet()));
    // No location key when there is no location
    assertEquals(Arrays.asList("identifier", "type"), new ArrayList<String>(
        x86.toIrep(Expr.symbol("x", Types.C_INT)).namedSub().keySet()));
  }

  @Test
  public void testOperators() {
    Expr x = Expr.symbol("x", Types.C_INT);
    assertEquals("+", x86.toIrep(x.plus(x)).id());
    Irep bswap = x86.toIrep(x.unop(UnaryOp.BSWAP));
    assertEquals("8", bswap.namedSub("bits_per_byte").id());
    // Bounds check unless zero is allowed
    Irep clz = x86.toIrep(x.countLeadingZeros(false));
    assertEquals("1", clz.namedSub("#bounds_check").id());
    Irep ctz = x86.toIrep(x.countTrailingZeros(true));
    assertEquals("count_trailing_zeros", ctz.id());
    assertEquals("0", ctz.namedSub("#bounds_check").id());
    Irep member = x86.toIrep(Expr.symbol("s", Types.structTag("S"))
                                 .member("a", Types.C_INT));
    assertEquals("1", member.namedSub("#lvalue").id());
    assertEquals("a", member.namedSub("component_name").id());
  }

  @Test
  public void testSideEffects() {
    Type fnType = Types.code(Collections.<Parameter>emptyList(),
                             Types.C_INT);
    Irep call = x86.toIrep(Expr.symbol("f", fnType)
                     .call(Collections.<Expr>emptyList()));
    assertEquals("side_effect", call.id());
    assertEquals("function_call", call.namedSub("statement").id());
    assertEquals(2, call.sub().size());
    assertEquals("arguments", call.sub().get(1).id());
    assertTrue(call.sub().get(1).sub().isEmpty());

    Type unary = Types.code(Arrays.asList(new Parameter(Types.C_INT)),
                            Types.C_INT);
    Expr f = Expr.symbol("f", unary);
    Irep withArg = x86.toIrep(
        f.call(Arrays.asList(Expr.intConstant(1, Types.C_INT))));
    Irep args = withArg.sub().get(1);
    assertEquals("arguments", args.id());
    assertEquals(1, args.sub().size());
    assertEquals("constant", args.sub().get(0).id());

    Irep stmt = x86.toIrep(Stmt.functionCall(null, f,
        Arrays.asList(Expr.intConstant(2, Types.C_INT)), Location.none()));
    assertEquals("function_call", stmt.namedSub("statement").id());
    assertTrue(stmt.sub().get(0).isNil());
    assertEquals("arguments", stmt.sub().get(2).id());

    Irep nondet = x86.toIrep(Expr.nondet(Types.C_INT));
    assertEquals("nondet", nondet.namedSub("statement").id());
  }

  @Test
  public void testStatements() {
    Expr x = Expr.symbol("x", Types.C_INT);
    Irep ret = x86.toIrep(Stmt.returnStmt(null, Location.none()));
    assertEquals("code", ret.id());
    assertEquals("return", ret.namedSub("statement").id());
    assertTrue(ret.sub().get(0).isNil());

    Irep sw = x86.toIrep(Stmt.switchStmt(x, Arrays.asList(
        Stmt.switchCase(Expr.zero(Types.C_INT), Stmt.skip(Location.none()))),
        Stmt.skip(Location.none()), Location.none()));
    Irep cases = sw.sub().get(1);
    assertEquals("block", cases.namedSub("statement").id());
    Irep dflt = cases.sub().get(1);
    assertEquals("1", dflt.namedSub("default").id());
    assertTrue(dflt.sub().get(0).isNil());

    Irep atomic = x86.toIrep(Stmt.atomicBlock(Arrays.asList(
        Stmt.skip(Location.none())), Location.none()));
    assertEquals(3, atomic.sub().size());
    assertEquals("atomic_begin",
                 atomic.sub().get(0).namedSub("statement").id());

    Irep loop = x86.toIrep(Stmt.whileLoop(Expr.trueExpr(),
        Stmt.skip(Location.none()), Location.loc("a.rs", "f", 3, null))
        .withLoopInvariant(x.lt(x)));
    assertEquals(Arrays.asList("statement", "#source_location",
                               "#spec_loop_invariant"),
                 new ArrayList<String>(loop.namedSub().keySet()));
  }

  @Test
  public void testContract() {
    Type fnType = Types.code(Arrays.asList(new Parameter(Types.C_INT)),
                             Types.C_INT);
    Expr arg = Expr.symbol("x", Types.C_INT);
    Spec pre = new Spec(Arrays.asList(arg), arg.lt(Expr.one(Types.C_INT)));
    Symbol f = Symbol.function("f", fnType, null, "f", Location.none())
        .attachContract(new FunctionContract(Arrays.asList(pre),
                                             Collections.<Spec>emptyList()));
    Irep typ = x86.symbolTypeIrep(f);
    assertEquals("code", typ.id());
    assertNull(typ.namedSub("#spec_ensures"));
    Irep lambda = typ.namedSub("#spec_requires").sub().get(0);
    assertEquals("lambda", lambda.id());
    assertEquals("tuple", lambda.sub().get(0).id());
    assertEquals("code", lambda.namedSub("type").id());
    assertTrue(x86.valueIrep(f).isNil());
  }
}
