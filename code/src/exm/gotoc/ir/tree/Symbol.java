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
package exm.gotoc.ir.tree;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;

import exm.gotoc.common.exceptions.GotocRuntimeError;
import exm.gotoc.common.lang.InternedString;
import exm.gotoc.common.lang.Location;
import exm.gotoc.common.lang.Types;
import exm.gotoc.common.lang.Types.DatatypeComponent;
import exm.gotoc.common.lang.Types.Parameter;
import exm.gotoc.common.lang.Types.Type;
import exm.gotoc.ir.tree.Contracts.FunctionContract;

/**
 * A named entity in a goto program: function, variable, constant or
 * type declaration.
 *
 * Symbols are built up with setters that return this.  Once inserted
 * into a {@link SymbolTable} a symbol is frozen: further changes must
 * be made on a {@link #copy()} which is then put back in the table.
 */
public class Symbol {

  /**
   * Boolean attributes, in the order they are written out
   */
  public static enum Attribute {
    IS_TYPE("isType"),
    IS_MACRO("isMacro"),
    IS_EXPORTED("isExported"),
    IS_INPUT("isInput"),
    IS_OUTPUT("isOutput"),
    IS_STATE_VAR("isStateVar"),
    IS_PROPERTY("isProperty"),
    IS_STATIC_LIFETIME("isStaticLifetime"),
    IS_THREAD_LOCAL("isThreadLocal"),
    IS_LVALUE("isLvalue"),
    IS_FILE_LOCAL("isFileLocal"),
    IS_EXTERN("isExtern"),
    IS_VOLATILE("isVolatile"),
    IS_PARAMETER("isParameter"),
    IS_AUXILIARY("isAuxiliary"),
    IS_WEAK("isWeak");

    private final String jsonKey;

    private Attribute(String jsonKey) {
      this.jsonKey = jsonKey;
    }

    public String jsonKey() {
      return jsonKey;
    }
  }

  public static enum SymbolMode {
    C("C");

    private final String name;

    private SymbolMode(String name) {
      this.name = name;
    }

    @Override
    public String toString() {
      return name;
    }
  }

  private final InternedString name;
  private InternedString baseName;
  private InternedString prettyName;
  private InternedString module;
  private SymbolMode mode = SymbolMode.C;
  private Type type;
  private Expr value;
  private Stmt body;
  private FunctionContract contract;
  private Location location;
  private final EnumSet<Attribute> attributes;
  private boolean frozen = false;

  public Symbol(String name, Location location, Type type) {
    this(InternedString.of(name), location, type);
  }

  private Symbol(InternedString name, Location location, Type type) {
    if (name.isEmpty()) {
      throw new GotocRuntimeError("Symbol name cannot be empty");
    }
    if (type == null) {
      throw new GotocRuntimeError("Symbol " + name + " needs a type");
    }
    this.name = name;
    this.location = location;
    this.type = type;
    this.attributes = EnumSet.of(Attribute.IS_AUXILIARY);
  }

  /*
   * Factories for common kinds of symbol
   */

  /**
   * Local variable
   */
  public static Symbol variable(String name, String baseName, Type type,
                                Location loc) {
    return new Symbol(name, loc, type)
          .setBaseName(baseName)
          .set(Attribute.IS_THREAD_LOCAL, true)
          .set(Attribute.IS_LVALUE, true)
          .set(Attribute.IS_STATE_VAR, true);
  }

  public static Symbol staticVariable(String name, String baseName,
                                      Type type, Location loc) {
    return variable(name, baseName, type, loc)
          .set(Attribute.IS_THREAD_LOCAL, false)
          .set(Attribute.IS_STATIC_LIFETIME, true);
  }

  /**
   * @param body function body, or null for a declaration
   * @param prettyName name for display, or null
   */
  public static Symbol function(String name, Type type, Stmt body,
                                String prettyName, Location loc) {
    if (!type.isCode()) {
      throw new GotocRuntimeError("Function " + name +
                                  " needs a code type, not " + type);
    }
    Symbol s = new Symbol(name, loc, type)
                  .setBaseName(name)
                  .setPrettyName(prettyName)
                  .set(Attribute.IS_LVALUE, true);
    if (body != null) {
      s.setBody(body);
    }
    return s;
  }

  /**
   * Declaration of a function provided by the model checker
   */
  public static Symbol builtinFunction(String name, List<Type> paramTypes,
                                       Type returnType) {
    return function(name, Types.codeWithUnnamedParameters(paramTypes,
                                                          returnType),
                    null, null, Location.builtinFunction(name, null));
  }

  public static Symbol constant(String name, String prettyName,
                                String baseName, Expr value, Location loc) {
    return new Symbol(name, loc, value.type())
              .setBaseName(baseName)
              .setPrettyName(prettyName)
              .set(Attribute.IS_STATIC_LIFETIME, true)
              .setValue(value);
  }

  public static Symbol typedef(String name, String baseName, Type type,
                               Location loc) {
    return new Symbol(name, loc, type)
              .setBaseName(baseName)
              .set(Attribute.IS_TYPE, true)
              .set(Attribute.IS_FILE_LOCAL, true)
              .set(Attribute.IS_STATIC_LIFETIME, true);
  }

  /**
   * Declaration of a struct or union type.  The symbol is named after
   * the tag with the tag prefix, so tag references resolve to it.
   */
  public static Symbol aggregateType(String tag, String prettyName,
                                     Type type, Location loc) {
    return new Symbol(Types.aggrTagName(tag), loc, type)
              .setBaseName(tag)
              .setPrettyName(prettyName)
              .set(Attribute.IS_TYPE, true);
  }

  public static Symbol structType(String tag, String prettyName,
                    List<DatatypeComponent> components, Location loc) {
    return aggregateType(tag, prettyName,
                         Types.structType(tag, components), loc);
  }

  public static Symbol unionType(String tag, String prettyName,
                    List<DatatypeComponent> components, Location loc) {
    return aggregateType(tag, prettyName,
                         Types.unionType(tag, components), loc);
  }

  public static Symbol emptyStruct(String tag, Location loc) {
    return structType(tag, tag, Arrays.<DatatypeComponent>asList(), loc);
  }

  public static Symbol emptyUnion(String tag, Location loc) {
    return unionType(tag, tag, Arrays.<DatatypeComponent>asList(), loc);
  }

  public static Symbol incompleteStruct(String tag, String prettyName,
                                        Location loc) {
    return aggregateType(tag, prettyName, Types.incompleteStruct(tag), loc);
  }

  public static Symbol incompleteUnion(String tag, String prettyName,
                                       Location loc) {
    return aggregateType(tag, prettyName, Types.incompleteUnion(tag), loc);
  }

  /**
   * Unfrozen copy of this symbol
   */
  public Symbol copy() {
    return copyWithName(name.toString());
  }

  /**
   * Unfrozen copy of this symbol under another name.  The base name
   * is dropped if it would no longer be a suffix.
   */
  public Symbol copyWithName(String newName) {
    Symbol s = new Symbol(InternedString.of(newName), location, type);
    if (baseName != null && newName.endsWith(baseName.toString())) {
      s.baseName = baseName;
    }
    s.prettyName = prettyName;
    s.module = module;
    s.mode = mode;
    s.value = value;
    s.body = body;
    s.contract = contract;
    s.attributes.clear();
    s.attributes.addAll(attributes);
    return s;
  }

  void freeze() {
    frozen = true;
  }

  public boolean isFrozen() {
    return frozen;
  }

  private void checkMutable() {
    if (frozen) {
      throw new GotocRuntimeError("Symbol " + name + " is in a symbol " +
          "table and cannot be modified: replace it with a copy instead");
    }
  }

  /*
   * Accessors
   */

  public String name() {
    return name.toString();
  }

  public InternedString internedName() {
    return name;
  }

  /** @return base name, or null */
  public String baseName() {
    return baseName == null ? null : baseName.toString();
  }

  /** @return pretty name, or null */
  public String prettyName() {
    return prettyName == null ? null : prettyName.toString();
  }

  /** @return module name, or null */
  public String module() {
    return module == null ? null : module.toString();
  }

  public SymbolMode mode() {
    return mode;
  }

  public Type type() {
    return type;
  }

  public Location location() {
    return location;
  }

  public boolean hasValue() {
    return value != null || body != null;
  }

  /**
   * @return value if it is an expression, else null
   */
  public Expr value() {
    return value;
  }

  /**
   * @return value if it is a statement (function body), else null
   */
  public Stmt body() {
    return body;
  }

  public FunctionContract contract() {
    return contract;
  }

  public boolean is(Attribute attr) {
    return attributes.contains(attr);
  }

  public boolean isType() {
    return is(Attribute.IS_TYPE);
  }

  public boolean isFunction() {
    return type.isCode() && !isType();
  }

  /**
   * Whether this is a better version of old: a complete definition of
   * an incomplete type, or a definition of a declared function
   */
  public boolean completes(Symbol old) {
    if (!name.equals(old.name)) {
      return false;
    }
    if (type.completes(old.type)) {
      return true;
    }
    return type.equals(old.type) && hasValue() && !old.hasValue();
  }

  public Expr toExpr() {
    return Expr.symbol(name.toString(), type);
  }

  public Parameter toFunctionParameter() {
    return new Parameter(type, name.toString(), baseName());
  }

  /*
   * Setters.  All check invariants and return this.
   */

  public Symbol set(Attribute attr, boolean val) {
    checkMutable();
    if (attr == Attribute.IS_TYPE && val && hasValue()) {
      throw new GotocRuntimeError("Type symbol " + name +
                                  " cannot have a value");
    }
    if (val) {
      attributes.add(attr);
    } else {
      attributes.remove(attr);
    }
    return this;
  }

  /**
   * @param newBaseName a suffix of the name, or null
   */
  public Symbol setBaseName(String newBaseName) {
    checkMutable();
    if (newBaseName != null && !name.endsWith(newBaseName)) {
      throw new GotocRuntimeError("Base name " + newBaseName +
                                  " is not a suffix of " + name);
    }
    baseName = InternedString.ofNullable(newBaseName);
    return this;
  }

  public Symbol setPrettyName(String newPrettyName) {
    checkMutable();
    prettyName = InternedString.ofNullable(newPrettyName);
    return this;
  }

  public Symbol setModule(String newModule) {
    checkMutable();
    module = InternedString.ofNullable(newModule);
    return this;
  }

  public Symbol setLocation(Location loc) {
    checkMutable();
    location = loc;
    return this;
  }

  public Symbol setType(Type newType) {
    checkMutable();
    if (contract != null && !newType.isCode()) {
      throw new GotocRuntimeError("Symbol " + name + " has a contract " +
                                  "and needs a code type");
    }
    type = newType;
    return this;
  }

  public Symbol setValue(Expr newValue) {
    checkMutable();
    checkCanHaveValue();
    value = newValue;
    body = null;
    return this;
  }

  public Symbol setBody(Stmt newBody) {
    checkMutable();
    checkCanHaveValue();
    body = newBody;
    value = null;
    return this;
  }

  public Symbol clearValue() {
    checkMutable();
    value = null;
    body = null;
    return this;
  }

  private void checkCanHaveValue() {
    if (isType()) {
      throw new GotocRuntimeError("Type symbol " + name +
                                  " cannot have a value");
    }
  }

  /**
   * Attach contract.  Clauses are added after any existing ones.
   */
  public Symbol attachContract(FunctionContract newContract) {
    checkMutable();
    if (!type.isCode()) {
      throw new GotocRuntimeError("Contract on non-function " + name);
    }
    if (contract == null) {
      contract = newContract;
    } else {
      contract = contract.append(newContract);
    }
    return this;
  }

  public Symbol setContract(FunctionContract newContract) {
    checkMutable();
    if (newContract != null && !type.isCode()) {
      throw new GotocRuntimeError("Contract on non-function " + name);
    }
    contract = newContract;
    return this;
  }

  public Symbol setExtern(boolean val) {
    return set(Attribute.IS_EXTERN, val);
  }

  public Symbol setStaticLifetime(boolean val) {
    return set(Attribute.IS_STATIC_LIFETIME, val);
  }

  public Symbol setParameter(boolean val) {
    return set(Attribute.IS_PARAMETER, val);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Symbol)) {
      return false;
    }
    Symbol s = (Symbol)o;
    return name == s.name && baseName == s.baseName &&
           prettyName == s.prettyName && module == s.module &&
           mode == s.mode && type.equals(s.type) &&
           Objects.equals(value, s.value) && Objects.equals(body, s.body) &&
           Objects.equals(contract, s.contract) &&
           location.equals(s.location) && attributes.equals(s.attributes);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, type, attributes);
  }

  @Override
  public String toString() {
    return name + ": " + type;
  }
}
