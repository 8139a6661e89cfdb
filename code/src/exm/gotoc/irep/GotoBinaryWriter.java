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
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.BitSet;

import org.apache.log4j.Logger;

import exm.gotoc.common.Logging;
import exm.gotoc.ir.tree.Symbol;
import exm.gotoc.ir.tree.Symbol.Attribute;
import exm.gotoc.ir.tree.SymbolTable;

/**
 * Writes a symbol table in the model checker's goto binary format,
 * version 5.
 *
 * Strings and ireps are written by reference: each is identified by
 * its number in an {@link IrepNumbering}, and its contents follow the
 * number only the first time it is written.  Structurally equal ireps
 * are therefore stored once.
 *
 * <pre>
 *   file    := 0x7f 'G' 'B' 'F' varint(5) table varint(0)
 *   table   := varint(#symbols) symbol...
 *   symbol  := irep(type) irep(value) irep(location)
 *              string(name) string(module) string(baseName)
 *              string(mode) string(prettyName) 0x00 varint(flags)
 *   irep    := varint(n) [string(id) ('S' irep)* ('N' string irep)* 0x00]
 *   string  := varint(n) [bytes 0x00]
 * </pre>
 *
 * Varints hold 7 bits per byte, low bits first, with the high bit set
 * on all but the last byte.  In string bytes, NUL and backslash are
 * preceded by a backslash.
 */
public class GotoBinaryWriter {

  static final byte[] MAGIC = { 0x7f, 'G', 'B', 'F' };
  static final int VERSION = 5;

  static final int SUB_MARKER = 'S';
  static final int NAMED_SUB_MARKER = 'N';
  static final int ESCAPE = '\\';

  /**
   * Symbol flags, most significant first.  Null marks the unused
   * binding flag, always written as zero.
   */
  static final Attribute[] FLAGS = {
    Attribute.IS_WEAK,
    Attribute.IS_TYPE,
    Attribute.IS_PROPERTY,
    Attribute.IS_MACRO,
    Attribute.IS_EXPORTED,
    Attribute.IS_INPUT,
    Attribute.IS_OUTPUT,
    Attribute.IS_STATE_VAR,
    Attribute.IS_PARAMETER,
    Attribute.IS_AUXILIARY,
    null,
    Attribute.IS_LVALUE,
    Attribute.IS_STATIC_LIFETIME,
    Attribute.IS_THREAD_LOCAL,
    Attribute.IS_FILE_LOCAL,
    Attribute.IS_EXTERN,
    Attribute.IS_VOLATILE,
  };

  private static final Logger logger = Logging.getGotocLogger();

  private final OutputStream out;
  private final IrepNumbering numbering = new IrepNumbering();
  private final BitSet writtenStrings = new BitSet();
  private final BitSet writtenIreps = new BitSet();

  private long irepRefs = 0;

  public GotoBinaryWriter(OutputStream out) {
    this.out = out;
  }

  /**
   * Write whole file: header, symbols in table order and an empty
   * function map.
   */
  public static void write(SymbolTable st, OutputStream out)
      throws IOException {
    GotoBinaryWriter w = new GotoBinaryWriter(out);
    w.writeHeader();
    w.writeSymbolTable(st);
    // Functions are symbol values, not goto programs
    w.writeVarint(0);
    out.flush();
    logger.debug("Wrote goto binary: " + st.size() + " symbols, " +
                 w.numbering.irepCount() + " distinct ireps for " +
                 w.irepRefs + " references");
  }

  void writeHeader() throws IOException {
    out.write(MAGIC);
    writeVarint(VERSION);
  }

  void writeSymbolTable(SymbolTable st) throws IOException {
    IrepConverter conv = new IrepConverter(st.machineModel());
    writeVarint(st.size());
    for (Symbol s: st.symbols()) {
      writeSymbol(s, conv);
    }
  }

  void writeSymbol(Symbol s, IrepConverter conv) throws IOException {
    writeIrep(conv.symbolTypeIrep(s));
    writeIrep(conv.valueIrep(s));
    writeIrep(conv.toIrep(s.location()));
    writeString(s.name());
    writeString(orEmpty(s.module()));
    writeString(orEmpty(s.baseName()));
    writeString(s.mode().toString());
    writeString(orEmpty(s.prettyName()));
    // Obsolete symbol ordering
    out.write(0);
    writeVarint(flags(s));
  }

  static long flags(Symbol s) {
    long flags = 0;
    for (Attribute attr: FLAGS) {
      flags <<= 1;
      if (attr != null && s.is(attr)) {
        flags |= 1;
      }
    }
    return flags;
  }

  private static String orEmpty(String s) {
    return s == null ? "" : s;
  }

  void writeVarint(long value) throws IOException {
    if (value < 0) {
      throw new IllegalArgumentException("Negative varint: " + value);
    }
    long u = value;
    while (true) {
      int b = (int)(u & 0x7f);
      u >>>= 7;
      if (u == 0) {
        out.write(b);
        return;
      }
      out.write(b | 0x80);
    }
  }

  void writeString(String s) throws IOException {
    writeStringRef(numbering.numberString(s));
  }

  private void writeStringRef(int n) throws IOException {
    writeVarint(n);
    if (writtenStrings.get(n)) {
      return;
    }
    writtenStrings.set(n);
    for (byte b: numbering.string(n).getBytes(StandardCharsets.UTF_8)) {
      if (b == 0 || b == ESCAPE) {
        out.write(ESCAPE);
      }
      out.write(b);
    }
    out.write(0);
  }

  void writeIrep(Irep irep) throws IOException {
    writeIrepRef(numbering.numberIrep(irep));
  }

  private void writeIrepRef(int n) throws IOException {
    irepRefs++;
    writeVarint(n);
    if (writtenIreps.get(n)) {
      return;
    }
    writtenIreps.set(n);
    writeStringRef(numbering.id(n));
    for (int i = 0; i < numbering.subCount(n); i++) {
      out.write(SUB_MARKER);
      writeIrepRef(numbering.sub(n, i));
    }
    for (int i = 0; i < numbering.namedSubCount(n); i++) {
      out.write(NAMED_SUB_MARKER);
      writeStringRef(numbering.namedSubName(n, i));
      writeIrepRef(numbering.namedSubValue(n, i));
    }
    out.write(0);
  }
}
