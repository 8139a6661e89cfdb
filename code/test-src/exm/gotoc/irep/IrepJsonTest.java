package exm.gotoc.irep;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.io.StringReader;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Test;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;

import exm.gotoc.common.exceptions.IRException;
import exm.gotoc.common.lang.Location;
import exm.gotoc.common.lang.MachineModel;
import exm.gotoc.common.lang.Types;
import exm.gotoc.common.lang.Types.Parameter;
import exm.gotoc.common.lang.Types.Type;
import exm.gotoc.ir.tree.Expr;
import exm.gotoc.ir.tree.Stmt;
import exm.gotoc.ir.tree.Symbol;
import exm.gotoc.ir.tree.SymbolTable;

public class IrepJsonTest {

  private static SymbolTable sampleTable() {
    SymbolTable st = SymbolTable.withEnvironment(MachineModel.x86_64());
    Type fnType = Types.code(Collections.<Parameter>emptyList(),
                             Types.C_INT);
    Location loc = Location.loc("main.rs", "main", 4, 5L);
    Expr x = Expr.symbol("main::1::x", Types.C_INT);
    st.insert(Symbol.variable("main::1::x", "x", Types.C_INT, loc));
    st.insert(Symbol.function("main", fnType, Stmt.block(Arrays.asList(
        Stmt.decl(x, Expr.intConstant(1, Types.C_INT), loc),
        Stmt.assertStmt(x.eq(Expr.one(Types.C_INT)), "assertion",
                        "x is one <&>", loc),
        Stmt.returnStmt(x, loc)), loc), "main", loc));
    return st;
  }

  @Test
  public void testOmitEmpty() {
    assertEquals("{\"id\":\"nil\"}", IrepJson.toJson(Irep.nil()));
    Irep width = new IrepConverter(MachineModel.x86_64())
                        .toIrep(Types.signedInt(32));
    assertEquals("{\"id\":\"signedbv\",\"namedSub\":{\"width\":{\"id\":\"32\"}}}",
                 IrepJson.toJson(width));
    Irep list = Irep.justSub(Arrays.asList(Irep.one(), Irep.zero()));
    assertEquals("{\"id\":\"\",\"sub\":[{\"id\":\"1\"},{\"id\":\"0\"}]}",
                 IrepJson.toJson(list));
  }

  @Test
  public void testReadBack() throws IRException {
    SymbolTable st = sampleTable();
    IrepConverter conv = new IrepConverter(st.machineModel());
    Irep body = conv.valueIrep(st.lookup("main"));
    assertEquals(body, IrepJson.fromJson(IrepJson.toJson(body)));
  }

  @Test
  public void testRejectMalformed() {
    String[] bad = {
      "[]",
      "{}",
      "{\"id\":1}",
      "{\"id\":\"x\",\"sub\":[]}",
      "{\"id\":\"x\",\"namedSub\":{}}",
      "{\"id\":\"x\",\"extra\":{\"id\":\"y\"}}",
      "{\"id\":\"x\",\"sub\":[{\"id\":\"y\"}",
    };
    for (String json: bad) {
      try {
        IrepJson.fromJson(json);
        fail("Expected rejection of " + json);
      } catch (IRException e) {
        // expected
      }
    }
  }

  @Test
  public void testDeterministic() {
    assertEquals(IrepJson.toJson(sampleTable(), false),
                 IrepJson.toJson(sampleTable(), false));
    assertEquals(IrepJson.toJson(sampleTable(), true),
                 IrepJson.toJson(sampleTable(), true));
  }

  @Test
  public void testSymbolLayout() {
    String json = IrepJson.toJson(sampleTable(), true);
    assertTrue(json.contains("\n  "));
    // Not escaped for HTML
    assertTrue(json.contains("x is one <&>"));

    JsonObject table = JsonParser.parseString(json).getAsJsonObject()
                                 .getAsJsonObject("symbolTable");
    JsonObject x = table.getAsJsonObject("main::1::x");
    assertEquals("x", x.get("baseName").getAsString());
    assertEquals("", x.get("module").getAsString());
    assertEquals("C", x.get("mode").getAsString());
    assertTrue(x.get("isLvalue").getAsBoolean());
    assertFalse(x.get("isType").getAsBoolean());
    assertEquals("nil", x.getAsJsonObject("value").get("id").getAsString());
  }

  @Test
  public void testCheckSymbolTable() throws Exception {
    SymbolTable st = sampleTable();
    List<String> names = IrepJson.checkSymbolTable(
              new StringReader(IrepJson.toJson(st, false)));
    assertEquals(st.names(), names);
  }

  @Test
  public void testCheckRejectsKeyOrder() throws Exception {
    JsonObject sym = JsonParser.parseString(
        IrepJson.toJson(sampleTable(), false)).getAsJsonObject()
        .getAsJsonObject("symbolTable").getAsJsonObject("main");
    JsonObject reordered = new JsonObject();
    reordered.add("value", sym.get("value"));
    for (String key: sym.keySet()) {
      if (!key.equals("value")) {
        reordered.add(key, sym.get(key));
      }
    }
    JsonObject table = new JsonObject();
    table.add("main", reordered);
    JsonObject root = new JsonObject();
    root.add("symbolTable", table);
    try {
      IrepJson.checkSymbolTable(new StringReader(root.toString()));
      fail("Expected key order to be checked");
    } catch (IRException e) {
      assertEquals("main", e.getSymbolName());
    }
  }

  @Test(expected=IRException.class)
  public void testCheckRejectsBadJson() throws Exception {
    IrepJson.checkSymbolTable(new StringReader("{\"symbolTable\": {"));
  }

  @Test(expected=IRException.class)
  public void testCheckRejectsWrongRoot() throws Exception {
    IrepJson.checkSymbolTable(new StringReader("{\"symbols\": {}}"));
  }
}
