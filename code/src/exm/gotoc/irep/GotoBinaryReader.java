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

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import exm.gotoc.common.exceptions.IRException;
import exm.gotoc.ir.tree.Symbol.Attribute;

/**
 * Reads files written by {@link GotoBinaryWriter}.  Symbols are
 * returned as ireps and strings, since a goto binary does not hold
 * enough information to rebuild typed expressions.
 */
public class GotoBinaryReader {

  /**
   * One symbol as stored in the file
   */
  public static class SymbolRecord {
    public final Irep type;
    public final Irep value;
    public final Irep location;
    public final String name;
    public final String module;
    public final String baseName;
    public final String mode;
    public final String prettyName;
    public final Set<Attribute> attributes;

    SymbolRecord(Irep type, Irep value, Irep location, String name,
                 String module, String baseName, String mode,
                 String prettyName, Set<Attribute> attributes) {
      this.type = type;
      this.value = value;
      this.location = location;
      this.name = name;
      this.module = module;
      this.baseName = baseName;
      this.mode = mode;
      this.prettyName = prettyName;
      this.attributes = Collections.unmodifiableSet(attributes);
    }

    public boolean is(Attribute attr) {
      return attributes.contains(attr);
    }

    @Override
    public String toString() {
      return name;
    }
  }

  private final InputStream in;

  /** Stream numbers of strings and ireps read so far */
  private final Map<Integer, String> strings = new HashMap<Integer, String>();
  private final Map<Integer, Irep> ireps = new HashMap<Integer, Irep>();

  public GotoBinaryReader(InputStream in) {
    this.in = in;
  }

  /**
   * Read whole file
   * @return symbols in file order
   * @throws IRException if input is not a version 5 goto binary
   */
  public static List<SymbolRecord> read(InputStream in)
      throws IOException, IRException {
    GotoBinaryReader r = new GotoBinaryReader(in);
    r.readHeader();
    List<SymbolRecord> symbols = r.readSymbolTable();
    long functions = r.readVarint();
    if (functions != 0) {
      throw new IRException("Expected empty function map but found " +
                            functions + " functions");
    }
    if (in.read() != -1) {
      throw new IRException("Trailing bytes after function map");
    }
    return symbols;
  }

  void readHeader() throws IOException, IRException {
    for (byte expected: GotoBinaryWriter.MAGIC) {
      int b = readByte();
      if (b != (expected & 0xff)) {
        throw new IRException("Not a goto binary: bad header byte " + b);
      }
    }
    long version = readVarint();
    if (version != GotoBinaryWriter.VERSION) {
      throw new IRException("Unsupported goto binary version: " + version +
                            ", supported version: " +
                            GotoBinaryWriter.VERSION);
    }
  }

  List<SymbolRecord> readSymbolTable() throws IOException, IRException {
    long count = readVarint();
    List<SymbolRecord> result = new ArrayList<SymbolRecord>();
    for (long i = 0; i < count; i++) {
      result.add(readSymbol());
    }
    return result;
  }

  SymbolRecord readSymbol() throws IOException, IRException {
    Irep type = readIrep();
    Irep value = readIrep();
    Irep location = readIrep();
    String name = readString();
    String module = readString();
    String baseName = readString();
    String mode = readString();
    String prettyName = readString();
    int ordering = readByte();
    if (ordering != 0) {
      throw new IRException(name, null, "expected 0 for symbol ordering " +
                            "but found " + ordering);
    }
    long flags = readVarint();
    Attribute[] layout = GotoBinaryWriter.FLAGS;
    if ((flags >>> layout.length) != 0) {
      throw new IRException(name, null, "unknown bits set in symbol " +
                            "flags " + Long.toHexString(flags));
    }
    Set<Attribute> attrs = EnumSet.noneOf(Attribute.class);
    for (int i = 0; i < layout.length; i++) {
      long bit = 1L << (layout.length - 1 - i);
      if (layout[i] != null && (flags & bit) != 0) {
        attrs.add(layout[i]);
      }
    }
    return new SymbolRecord(type, value, location, name, module, baseName,
                            mode, prettyName, attrs);
  }

  private int readByte() throws IOException, IRException {
    int b = in.read();
    if (b < 0) {
      throw new IRException("Unexpected end of goto binary input");
    }
    return b;
  }

  long readVarint() throws IOException, IRException {
    long result = 0;
    int shift = 0;
    while (true) {
      int b = readByte();
      if (shift > 63 || (shift == 63 && (b & 0x7f) > 1)) {
        throw new IRException("Varint too large for 64 bits");
      }
      result |= ((long)(b & 0x7f)) << shift;
      shift += 7;
      if ((b & 0x80) == 0) {
        return result;
      }
    }
  }

  private int readNumber() throws IOException, IRException {
    long n = readVarint();
    if (n < 0 || n > Integer.MAX_VALUE) {
      throw new IRException("Reference number too large: " + n);
    }
    return (int)n;
  }

  String readString() throws IOException, IRException {
    int n = readNumber();
    String s = strings.get(n);
    if (s != null) {
      return s;
    }
    ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    while (true) {
      int b = readByte();
      if (b == 0) {
        break;
      }
      if (b == GotoBinaryWriter.ESCAPE) {
        b = readByte();
      }
      bytes.write(b);
    }
    try {
      s = StandardCharsets.UTF_8.newDecoder()
                .decode(ByteBuffer.wrap(bytes.toByteArray())).toString();
    } catch (CharacterCodingException e) {
      throw new IRException("String " + n + " is not valid UTF-8");
    }
    strings.put(n, s);
    return s;
  }

  Irep readIrep() throws IOException, IRException {
    int n = readNumber();
    if (ireps.containsKey(n)) {
      Irep done = ireps.get(n);
      if (done == null) {
        throw new IRException("Irep " + n + " contains itself");
      }
      return done;
    }
    // Mark as in progress
    ireps.put(n, null);
    String id = readString();
    List<Irep> sub = new ArrayList<Irep>();
    Map<String, Irep> namedSub = new LinkedHashMap<String, Irep>();
    while (true) {
      int marker = readByte();
      if (marker == 0) {
        break;
      } else if (marker == GotoBinaryWriter.SUB_MARKER) {
        if (!namedSub.isEmpty()) {
          throw new IRException("Irep " + n + ": sub after named sub");
        }
        sub.add(readIrep());
      } else if (marker == GotoBinaryWriter.NAMED_SUB_MARKER) {
        String key = readString();
        namedSub.put(key, readIrep());
      } else {
        throw new IRException("Irep " + n + ": unexpected byte " + marker);
      }
    }
    Irep result = new Irep(id, sub, namedSub);
    ireps.put(n, result);
    return result;
  }
}
