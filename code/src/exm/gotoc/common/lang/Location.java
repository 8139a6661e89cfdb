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
package exm.gotoc.common.lang;

import java.util.Objects;

import exm.gotoc.common.Settings;
import exm.gotoc.common.exceptions.GotocRuntimeError;

/**
 * Source location of a symbol, expression or statement.  Immutable.
 *
 * A location is one of: no location; a position inside a builtin
 * function with no real source file; a position in a source file;
 * or a property location, which is a source position annotated with
 * the description and class of a verification property.
 */
public final class Location {

  public static enum Kind {
    NONE,
    BUILTIN_FUNCTION,
    LOC,
    PROPERTY,
  }

  private static final Location NONE = new Location(Kind.NONE, null, null,
                                  null, null, null, null, null, null);

  private final Kind kind;
  private final InternedString file;
  private final InternedString function;
  private final Long line;
  private final Long col;
  private final Long endLine;
  private final Long endCol;
  private final InternedString comment;
  private final InternedString propertyClass;

  private Location(Kind kind, InternedString file, InternedString function,
      Long line, Long col, Long endLine, Long endCol,
      InternedString comment, InternedString propertyClass) {
    this.kind = kind;
    this.file = file;
    this.function = function;
    this.line = line;
    this.col = col;
    this.endLine = endLine;
    this.endCol = endCol;
    this.comment = comment;
    this.propertyClass = propertyClass;
  }

  public static Location none() {
    return NONE;
  }

  /**
   * @param functionName name of builtin
   * @param line line within builtin, or null
   */
  public static Location builtinFunction(String functionName, Long line) {
    return new Location(Kind.BUILTIN_FUNCTION, null,
        InternedString.of(functionName), checkNumber(line, "line"),
        null, null, null, null, null);
  }

  public static Location loc(String file, String function, long line,
                             Long col) {
    return loc(file, function, line, col, null, null);
  }

  public static Location loc(String file, String function, long line,
                  Long col, Long endLine, Long endCol) {
    if (file == null) {
      throw new GotocRuntimeError("Source location needs file name");
    }
    return new Location(Kind.LOC, InternedString.of(file),
        InternedString.ofNullable(function), checkNumber(line, "line"),
        checkNumber(col, "column"), checkNumber(endLine, "end line"),
        checkNumber(endCol, "end column"), null, null);
  }

  /**
   * Location of a verification property.  Position fields are optional.
   */
  public static Location property(String file, String function, Long line,
      Long col, String comment, String propertyClass) {
    if (comment == null || propertyClass == null) {
      throw new GotocRuntimeError("Property location needs comment and " +
                                  "property class");
    }
    return new Location(Kind.PROPERTY, InternedString.ofNullable(file),
        InternedString.ofNullable(function), checkNumber(line, "line"),
        checkNumber(col, "column"), null, null,
        InternedString.of(comment), InternedString.of(propertyClass));
  }

  /**
   * Property location at the same position as this location
   */
  public Location toProperty(String comment, String propertyClass) {
    switch (kind) {
      case NONE:
        return property(null, null, null, null, comment, propertyClass);
      case BUILTIN_FUNCTION:
        return property(builtinFile(function.toString()), function.toString(),
                        line, null, comment, propertyClass);
      case LOC:
      case PROPERTY:
        return property(file.toString(), str(function), line, col,
                        comment, propertyClass);
      default:
        throw new GotocRuntimeError("Unexpected location kind " + kind);
    }
  }

  /**
   * File name used for code in builtin function
   */
  public static String builtinFile(String functionName) {
    return "<builtin-library-" + functionName + ">";
  }

  private static Long checkNumber(Long val, String what) {
    if (val == null || val >= 0) {
      return val;
    }
    if (Settings.clampLocations()) {
      return 0L;
    }
    throw new GotocRuntimeError("Location " + what +
                                " out of range: " + val);
  }

  private static String str(InternedString s) {
    return s == null ? null : s.toString();
  }

  public Kind kind() {
    return kind;
  }

  public boolean isNone() {
    return kind == Kind.NONE;
  }

  public boolean isBuiltin() {
    return kind == Kind.BUILTIN_FUNCTION;
  }

  public boolean isProperty() {
    return kind == Kind.PROPERTY;
  }

  /**
   * @return source file name, or null if not a source location
   */
  public String filename() {
    return str(file);
  }

  /**
   * @return enclosing function name, or null
   */
  public String function() {
    return str(function);
  }

  /**
   * @return line number, or null if none
   */
  public Long line() {
    return line;
  }

  public Long column() {
    return col;
  }

  public Long endLine() {
    return endLine;
  }

  public Long endColumn() {
    return endCol;
  }

  public String comment() {
    return str(comment);
  }

  public String propertyClass() {
    return str(propertyClass);
  }

  /**
   * Brief description for diagnostics
   */
  public String shortString() {
    switch (kind) {
      case NONE:
        return "<none>";
      case BUILTIN_FUNCTION:
        if (line != null) {
          return "<" + function + ">:" + line;
        } else {
          return "<" + function + ">";
        }
      case LOC:
        return file + ":" + line;
      case PROPERTY:
        if (file != null && line != null) {
          return file + ":" + line;
        } else {
          return "<" + propertyClass + ">";
        }
      default:
        throw new GotocRuntimeError("Unexpected location kind " + kind);
    }
  }

  @Override
  public String toString() {
    return shortString();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Location)) {
      return false;
    }
    Location other = (Location) o;
    return kind == other.kind &&
        file == other.file &&
        function == other.function &&
        Objects.equals(line, other.line) &&
        Objects.equals(col, other.col) &&
        Objects.equals(endLine, other.endLine) &&
        Objects.equals(endCol, other.endCol) &&
        comment == other.comment &&
        propertyClass == other.propertyClass;
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, file, function, line, col, endLine, endCol,
                        comment, propertyClass);
  }
}
