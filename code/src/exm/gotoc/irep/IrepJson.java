/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */
package exm.gotoc.irep;

import java.io.IOException;
import java.io.Reader;
import java.io.StringWriter;
import java.io.Writer;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.log4j.Logger;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonIOException;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.stream.JsonWriter;

import exm.gotoc.common.Logging;
import exm.gotoc.common.exceptions.IRException;
import exm.gotoc.ir.tree.Symbol;
import exm.gotoc.ir.tree.Symbol.Attribute;
import exm.gotoc.ir.tree.SymbolTable;

/**
 * Read and write ireps and symbol tables in the JSON format the
 * model checker's symbol table loader accepts.
 *
 * An irep is an object with an "id" string, a "sub" array if it has
 * unnamed children and a "namedSub" object if it has named children.
 * Empty arrays and objects are left out.  A symbol table is an object
 * with a single "symbolTable" key mapping names to symbols.
 */
public class IrepJson {

  public static final String ID = "id";
  public static final String SUB = "sub";
  public static final String NAMED_SUB = "namedSub";
  public static final String SYMBOL_TABLE = "symbolTable";

  /** Symbol keys before the attribute flags, in output order */
  private static final String[] SYMBOL_KEYS = {
    "type", "value", "location", "name", "module", "baseName",
    "prettyName", "mode",
  };

  private static final Logger logger = Logging.getGotocLogger();

  /*
   * Writing
   */

  public static void write(Irep irep, JsonWriter out) throws IOException {
    out.beginObject();
    out.name(ID).value(irep.id());
    if (!irep.sub().isEmpty()) {
      out.name(SUB);
      out.beginArray();
      for (Irep s: irep.sub()) {
        write(s, out);
      }
      out.endArray();
    }
    if (!irep.namedSub().isEmpty()) {
      out.name(NAMED_SUB);
      out.beginObject();
      for (Map.Entry<String, Irep> e: irep.namedSub().entrySet()) {
        out.name(e.getKey());
        write(e.getValue(), out);
      }
      out.endObject();
    }
    out.endObject();
  }

  public static void write(Symbol s, IrepConverter conv, JsonWriter out)
      throws IOException {
    out.beginObject();
    out.name("type");
    write(conv.symbolTypeIrep(s), out);
    out.name("value");
    write(conv.valueIrep(s), out);
    out.name("location");
    write(conv.toIrep(s.location()), out);
    out.name("name").value(s.name());
    out.name("module").value(orEmpty(s.module()));
    out.name("baseName").value(orEmpty(s.baseName()));
    out.name("prettyName").value(orEmpty(s.prettyName()));
    out.name("mode").value(s.mode().toString());
    for (Attribute attr: Attribute.values()) {
      out.name(attr.jsonKey()).value(s.is(attr));
    }
    out.endObject();
  }

  private static String orEmpty(String s) {
    return s == null ? "" : s;
  }

  /**
   * Write whole symbol table.  Symbols are written in table order.
   */
  public static void write(SymbolTable st, Writer w, boolean pretty)
      throws IOException {
    IrepConverter conv = new IrepConverter(st.machineModel());
    JsonWriter out = new JsonWriter(w);
    if (pretty) {
      out.setIndent("  ");
    }
    out.setHtmlSafe(false);
    out.beginObject();
    out.name(SYMBOL_TABLE);
    out.beginObject();
    int count = 0;
    for (Symbol s: st.symbols()) {
      out.name(s.name());
      write(s, conv, out);
      count++;
    }
    out.endObject();
    out.endObject();
    out.flush();
    logger.debug("Wrote " + count + " symbols");
  }

  public static String toJson(Irep irep) {
    StringWriter sw = new StringWriter();
    try {
      JsonWriter out = new JsonWriter(sw);
      out.setHtmlSafe(false);
      write(irep, out);
      out.flush();
    } catch (IOException e) {
      // StringWriter does not throw
      throw new AssertionError(e);
    }
    return sw.toString();
  }

  public static String toJson(SymbolTable st, boolean pretty) {
    StringWriter sw = new StringWriter();
    try {
      write(st, sw, pretty);
    } catch (IOException e) {
      throw new AssertionError(e);
    }
    return sw.toString();
  }

  /*
   * Reading
   */

  public static Irep fromJson(String json) throws IRException {
    return fromJson(parse(json));
  }

  public static Irep fromJson(JsonElement elem) throws IRException {
    if (!elem.isJsonObject()) {
      throw new IRException("Irep must be a JSON object: " + elem);
    }
    JsonObject o = elem.getAsJsonObject();
    JsonElement id = o.get(ID);
    if (id == null || !id.isJsonPrimitive() ||
        !id.getAsJsonPrimitive().isString()) {
      throw new IRException("Irep without string id: " + elem);
    }
    List<Irep> sub = new ArrayList<Irep>();
    Map<String, Irep> namedSub = new LinkedHashMap<String, Irep>();
    for (Map.Entry<String, JsonElement> e: o.entrySet()) {
      String key = e.getKey();
      if (key.equals(ID)) {
        continue;
      } else if (key.equals(SUB)) {
        if (!e.getValue().isJsonArray()) {
          throw new IRException("Irep sub must be an array: " + elem);
        }
        JsonArray a = e.getValue().getAsJsonArray();
        if (a.size() == 0) {
          throw new IRException("Empty sub array should be omitted: " +
                                elem);
        }
        for (JsonElement s: a) {
          sub.add(fromJson(s));
        }
      } else if (key.equals(NAMED_SUB)) {
        if (!e.getValue().isJsonObject()) {
          throw new IRException("Irep namedSub must be an object: " + elem);
        }
        JsonObject ns = e.getValue().getAsJsonObject();
        if (ns.size() == 0) {
          throw new IRException("Empty namedSub should be omitted: " +
                                elem);
        }
        for (Map.Entry<String, JsonElement> n: ns.entrySet()) {
          namedSub.put(n.getKey(), fromJson(n.getValue()));
        }
      } else {
        throw new IRException("Unexpected irep key " + key);
      }
    }
    return new Irep(id.getAsString(), sub, namedSub);
  }

  /**
   * Check that input is a well-formed symbol table
   * @return names of symbols, in file order
   */
  public static List<String> checkSymbolTable(Reader in)
      throws IOException, IRException {
    JsonElement root;
    try {
      root = JsonParser.parseReader(in);
    } catch (JsonIOException e) {
      throw new IOException(e.getMessage(), e);
    } catch (JsonParseException e) {
      throw new IRException("Malformed JSON: " + e.getMessage());
    }
    if (!root.isJsonObject() ||
        !root.getAsJsonObject().has(SYMBOL_TABLE) ||
        !root.getAsJsonObject().get(SYMBOL_TABLE).isJsonObject()) {
      throw new IRException("Expected object with key " + SYMBOL_TABLE);
    }
    JsonObject table = root.getAsJsonObject().getAsJsonObject(SYMBOL_TABLE);
    List<String> names = new ArrayList<String>();
    for (Map.Entry<String, JsonElement> e: table.entrySet()) {
      checkSymbol(e.getKey(), e.getValue());
      names.add(e.getKey());
    }
    logger.debug("Checked " + names.size() + " symbols");
    return names;
  }

  private static void checkSymbol(String name, JsonElement elem)
      throws IRException {
    if (!elem.isJsonObject()) {
      throw new IRException(name, null, "symbol is not an object");
    }
    JsonObject o = elem.getAsJsonObject();
    List<String> expected = new ArrayList<String>();
    for (String k: SYMBOL_KEYS) {
      expected.add(k);
    }
    for (Attribute attr: Attribute.values()) {
      expected.add(attr.jsonKey());
    }
    List<String> actual = new ArrayList<String>(o.keySet());
    if (!actual.equals(expected)) {
      throw new IRException(name, null, "symbol keys " + actual +
                            " should be " + expected);
    }
    fromJson(o.get("type"));
    fromJson(o.get("value"));
    fromJson(o.get("location"));
    if (!o.get("name").getAsString().equals(name)) {
      throw new IRException(name, null, "name does not match key");
    }
    for (Attribute attr: Attribute.values()) {
      JsonElement flag = o.get(attr.jsonKey());
      if (!flag.isJsonPrimitive() || !flag.getAsJsonPrimitive().isBoolean()) {
        throw new IRException(name, null, attr.jsonKey() +
                              " should be a boolean");
      }
    }
  }

  private static JsonElement parse(String json) throws IRException {
    try {
      return JsonParser.parseString(json);
    } catch (JsonParseException e) {
      throw new IRException("Malformed JSON: " + e.getMessage());
    }
  }
}
