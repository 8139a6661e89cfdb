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
package exm.gotoc.ir.opt;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

import exm.gotoc.common.Settings;
import exm.gotoc.common.exceptions.GotocRuntimeError;
import exm.gotoc.common.lang.Types;
import exm.gotoc.common.lang.Types.DatatypeComponent;
import exm.gotoc.common.lang.Types.Parameter;
import exm.gotoc.common.lang.Types.TagType;
import exm.gotoc.common.lang.Types.Type;
import exm.gotoc.common.lang.Types.TypeKind;
import exm.gotoc.ir.tree.Expr;
import exm.gotoc.ir.tree.Stmt;
import exm.gotoc.ir.tree.Symbol;

/**
 * Rename every identifier in a table to a valid C identifier, so that
 * the model checker can dump the program as compilable C.
 *
 * Renaming is consistent (the same name always maps to the same
 * result) and injective (distinct names never map to the same
 * result).  The "tag-" prefix of aggregate symbols is kept, and a
 * local variable named "function::1::var" keeps its variable name as
 * a suffix so that its base name remains valid.
 */
public class NameTransformer extends TableTransformer {

  /** Separates function from local variable name */
  public static final String LOCAL_SEPARATOR = "::1::";

  private static final String[][] RESERVED = {
    {"case", "case_"},
    {"default", "default_"},
  };

  private final Map<String, String> mappedNames =
                                  new HashMap<String, String>();
  private final Set<String> usedNames = new HashSet<String>();

  @Override
  public String getPassName() {
    return "normalize names";
  }

  @Override
  public String getConfigEnabledKey() {
    return Settings.NORMALIZE_NAMES;
  }

  /**
   * @return valid C identifier for name, same each time name is given
   */
  public String normalize(String origName) {
    if (origName.isEmpty()) {
      throw new GotocRuntimeError("Cannot normalize empty identifier");
    }
    String result = mappedNames.get(origName);
    if (result != null) {
      return result;
    }

    String prefix = "";
    String name = origName;
    if (name.startsWith(Types.TAG_PREFIX)) {
      prefix = Types.TAG_PREFIX;
      name = name.substring(Types.TAG_PREFIX.length());
    }

    String suffix = null;
    int sep = name.indexOf(LOCAL_SEPARATOR);
    if (sep >= 0) {
      suffix = name.substring(sep + LOCAL_SEPARATOR.length());
      name = name.substring(0, sep);
      if (suffix.contains(LOCAL_SEPARATOR)) {
        throw new GotocRuntimeError("Multiple occurrences of " +
                          LOCAL_SEPARATOR + " in identifier " + origName);
      }
    }

    String main = prefix + fixName(name);
    String tail = suffix == null ? "" : "::" + fixName(suffix);
    result = main + tail;
    // Disambiguate before the variable name, so it stays a suffix
    int counter = 0;
    while (usedNames.contains(result)) {
      result = main + "_" + counter + tail;
      counter++;
    }

    usedNames.add(result);
    mappedNames.put(origName, result);
    if (logger.isTraceEnabled() && !result.equals(origName)) {
      logger.trace("Renamed " + origName + " to " + result);
    }
    return result;
  }

  private String normalizeNullable(String name) {
    return name == null ? null : normalize(name);
  }

  /**
   * Replace characters not allowed in identifiers and avoid
   * leading digits and reserved words
   */
  static String fixName(String name) {
    StringBuilder sb = new StringBuilder(name.length() + 1);
    if (!name.isEmpty() && Character.isDigit(name.charAt(0))) {
      sb.append('_');
    }
    for (int i = 0; i < name.length(); i++) {
      char c = name.charAt(i);
      if (Character.isLetterOrDigit(c) || c == '_' || c == '$') {
        sb.append(c);
      } else {
        sb.append('_');
      }
    }
    String fixed = sb.toString();
    for (String[] r: RESERVED) {
      if (fixed.endsWith(r[0])) {
        return fixed.substring(0, fixed.length() - r[0].length()) + r[1];
      }
    }
    return fixed;
  }

  @Override
  protected Symbol transformSymbol(Symbol s) {
    Symbol t = super.transformSymbol(s);
    String newName = normalize(s.name());
    Symbol renamed = t.copyWithName(newName);
    String newBase = null;
    if (s.baseName() != null) {
      newBase = fixName(s.baseName());
      if (!newName.endsWith(newBase)) {
        newBase = null;
      }
    }
    renamed.setBaseName(newBase);
    renamed.setPrettyName(normalizeNullable(s.prettyName()));
    return renamed;
  }

  @Override
  protected Parameter transformParameter(Parameter p) {
    return super.transformParameter(p).withNames(
          normalizeNullable(p.identifier()), normalizeNullable(p.baseName()));
  }

  @Override
  protected DatatypeComponent transformComponent(DatatypeComponent c) {
    return super.transformComponent(c).withName(normalize(c.name()));
  }

  @Override
  protected String transformTag(String tag) {
    return normalize(tag);
  }

  @Override
  protected Type transformTypeIncomplete(TagType t) {
    if (t.kind() == TypeKind.INCOMPLETE_STRUCT) {
      return Types.incompleteStruct(normalize(t.tag()));
    }
    return Types.incompleteUnion(normalize(t.tag()));
  }

  @Override
  protected Type transformTypeTag(TagType t) {
    if (t.isStructLike()) {
      return Types.structTagRaw(normalize(t.identifier()));
    }
    return Types.unionTagRaw(normalize(t.identifier()));
  }

  @Override
  protected Expr transformExprSymbol(Expr e) {
    return transformExprDefault(e).withIdentifier(normalize(e.identifier()));
  }

  @Override
  protected Expr transformExprMember(Expr e) {
    return transformExprDefault(e).withIdentifier(normalize(e.identifier()));
  }

  @Override
  protected Expr transformExprUnion(Expr e) {
    return transformExprDefault(e).withIdentifier(normalize(e.identifier()));
  }

  @Override
  protected Stmt transformStmtGoto(Stmt s) {
    return s.withLabelName(normalize(s.label()));
  }

  @Override
  protected Stmt transformStmtLabel(Stmt s) {
    return transformStmtDefault(s).withLabelName(normalize(s.label()));
  }
}
