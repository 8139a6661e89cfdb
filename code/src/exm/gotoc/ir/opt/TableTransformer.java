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

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.log4j.Logger;

import exm.gotoc.common.Logging;
import exm.gotoc.common.exceptions.GotocRuntimeError;
import exm.gotoc.common.exceptions.TransformException;
import exm.gotoc.common.lang.StringPool;
import exm.gotoc.common.lang.Types;
import exm.gotoc.common.lang.Types.ArrayType;
import exm.gotoc.common.lang.Types.BitFieldType;
import exm.gotoc.common.lang.Types.DatatypeComponent;
import exm.gotoc.common.lang.Types.Parameter;
import exm.gotoc.common.lang.Types.TagType;
import exm.gotoc.common.lang.Types.Type;
import exm.gotoc.ir.tree.Contracts.FunctionContract;
import exm.gotoc.ir.tree.Contracts.Spec;
import exm.gotoc.ir.tree.Expr;
import exm.gotoc.ir.tree.Stmt;
import exm.gotoc.ir.tree.Symbol;
import exm.gotoc.ir.tree.SymbolTable;

/**
 * A pass that builds a new symbol table from an existing one.
 *
 * Every symbol's type, value and contract is rebuilt bottom-up.
 * Subclasses override the methods for the node kinds they care about;
 * everything else is copied through structurally.  Symbols without a
 * value (types and declarations) are transformed first, so that
 * tags already resolve in the new table when values are transformed.
 * The new table lists symbols in the same order as the old one.
 *
 * Each instance transforms one table.
 */
public abstract class TableTransformer {

  private static enum State {
    BUILDING,
    DONE,
  }

  protected static final Logger logger = Logging.getGotocLogger();

  private State state = State.BUILDING;
  private SymbolTable target = null;

  public abstract String getPassName();

  /**
   * @return Key indicating whether pass is enabled.  If null, always enabled
   */
  public String getConfigEnabledKey() {
    return null;
  }

  /**
   * Names created by the pass are interned in the source table's pool
   */
  public final SymbolTable transform(SymbolTable source)
      throws TransformException {
    if (state != State.BUILDING || target != null) {
      throw new GotocRuntimeError("Pass " + getPassName() +
                                  " has already been run");
    }
    StringPool.Scope scope = source.stringPool().enter();
    try {
      return doTransform(source);
    } finally {
      scope.close();
    }
  }

  private SymbolTable doTransform(SymbolTable source)
      throws TransformException {
    target = source.newEmpty();
    logger.debug("Pass " + getPassName() + ": start with " + source.size() +
                 " symbols");
    preprocess(source);

    List<Symbol> symbols = source.symbols();
    Map<String, Symbol> transformed = new LinkedHashMap<String, Symbol>();
    Set<String> preexisting = new HashSet<String>(target.names());

    for (Symbol s: symbols) {
      if (!s.hasValue() && !preexisting.contains(s.name())) {
        Symbol t = traceTransform(s);
        target.insert(t);
        transformed.put(s.name(), t);
      }
    }
    for (Symbol s: symbols) {
      if (s.hasValue() && !preexisting.contains(s.name())) {
        Symbol t = traceTransform(s);
        target.insert(t);
        transformed.put(s.name(), t);
      }
    }

    SymbolTable result = source.newEmpty();
    for (Symbol s: symbols) {
      Symbol t = transformed.get(s.name());
      if (t != null) {
        result.insert(t);
      }
    }
    // Symbols added by preprocess, after the transformed ones
    for (Symbol s: target.symbols()) {
      if (!result.contains(s.name())) {
        result.insert(s);
      }
    }
    target = result;

    postprocess(result);
    state = State.DONE;
    logger.debug("Pass " + getPassName() + ": done with " + result.size() +
                 " symbols");
    return result;
  }

  private Symbol traceTransform(Symbol s) {
    Symbol t = transformSymbol(s);
    if (logger.isTraceEnabled()) {
      logger.trace(getPassName() + ": " + s.name() + " => " + t.name());
    }
    return t;
  }

  /**
   * Table being built.  Only valid while the pass runs.
   */
  protected SymbolTable targetTable() {
    if (state != State.BUILDING || target == null) {
      throw new GotocRuntimeError("Pass " + getPassName() +
                                  " is not running");
    }
    return target;
  }

  /**
   * Called before any symbols are transformed.  Symbols inserted into
   * {@link #targetTable()} here are not overwritten.
   */
  protected void preprocess(SymbolTable source) throws TransformException {
    // Nothing by default
  }

  /**
   * Called once with the complete new table
   */
  protected void postprocess(SymbolTable result) throws TransformException {
    // Nothing by default
  }

  /*
   * Symbols
   */

  protected Symbol transformSymbol(Symbol s) {
    Symbol result = s.copy();
    result.setType(transformType(s.type()));
    if (s.value() != null) {
      result.setValue(transformExpr(s.value()));
    } else if (s.body() != null) {
      result.setBody(transformStmt(s.body()));
    }
    if (s.contract() != null) {
      result.setContract(transformContract(s.contract()));
    }
    return result;
  }

  protected FunctionContract transformContract(FunctionContract c) {
    return new FunctionContract(transformSpecs(c.requires()),
                                transformSpecs(c.ensures()));
  }

  private List<Spec> transformSpecs(List<Spec> specs) {
    List<Spec> result = new ArrayList<Spec>(specs.size());
    for (Spec spec: specs) {
      result.add(spec.withClause(transformExprs(spec.temporaries()),
                                 transformExpr(spec.clause())));
    }
    return result;
  }

  /*
   * Types
   */

  public Type transformType(Type t) {
    switch (t.kind()) {
      case ARRAY:
      case FLEXIBLE_ARRAY:
      case INFINITE_ARRAY:
      case VECTOR:
        return transformTypeArray((ArrayType)t);
      case C_BIT_FIELD:
        return transformTypeBitField((BitFieldType)t);
      case POINTER:
        return transformTypePointer(t);
      case CODE:
      case VARIADIC_CODE:
        return transformTypeCode(t);
      case STRUCT:
      case UNION:
        return transformTypeStructUnion(t);
      case INCOMPLETE_STRUCT:
      case INCOMPLETE_UNION:
        return transformTypeIncomplete((TagType)t);
      case STRUCT_TAG:
      case UNION_TAG:
        return transformTypeTag((TagType)t);
      default:
        return transformTypeLeaf(t);
    }
  }

  /**
   * Types without children: bool, C integers, bit-vectors, floats,
   * empty and constructor
   */
  protected Type transformTypeLeaf(Type t) {
    return t;
  }

  protected Type transformTypeArray(ArrayType t) {
    Type elem = transformType(t.baseType());
    switch (t.kind()) {
      case ARRAY:
        return Types.array(elem, t.size());
      case FLEXIBLE_ARRAY:
        return Types.flexibleArray(elem);
      case INFINITE_ARRAY:
        return Types.infiniteArray(elem);
      default:
        return Types.vector(elem, t.size());
    }
  }

  protected Type transformTypeBitField(BitFieldType t) {
    return transformType(t.baseType()).asBitfield(t.width());
  }

  protected Type transformTypePointer(Type t) {
    return Types.pointer(transformType(t.baseType()));
  }

  protected Type transformTypeCode(Type t) {
    List<Parameter> params = new ArrayList<Parameter>();
    for (Parameter p: t.parameters()) {
      params.add(transformParameter(p));
    }
    Type ret = transformType(t.returnType());
    if (t.isVariadicCode()) {
      return Types.variadicCode(params, ret);
    }
    return Types.code(params, ret);
  }

  protected Parameter transformParameter(Parameter p) {
    return p.withType(transformType(p.type()));
  }

  protected Type transformTypeStructUnion(Type t) {
    List<DatatypeComponent> comps = new ArrayList<DatatypeComponent>();
    for (DatatypeComponent c: t.components()) {
      comps.add(transformComponent(c));
    }
    String tag = transformTag(t.tag());
    if (t.isStruct()) {
      return Types.structType(tag, comps);
    }
    return Types.unionType(tag, comps);
  }

  protected DatatypeComponent transformComponent(DatatypeComponent c) {
    if (c.isPadding()) {
      return c;
    }
    return c.withType(transformType(c.type()));
  }

  protected Type transformTypeIncomplete(TagType t) {
    return t;
  }

  protected Type transformTypeTag(TagType t) {
    return t;
  }

  /**
   * Source tag of struct or union definition
   */
  protected String transformTag(String tag) {
    return tag;
  }

  /*
   * Expressions
   */

  public Expr transformExpr(Expr e) {
    switch (e.kind()) {
      case SYMBOL:
        return transformExprSymbol(e);
      case MEMBER:
        return transformExprMember(e);
      case UNION:
        return transformExprUnion(e);
      case NONDET:
        return transformExprNondet(e);
      case FUNCTION_CALL:
        return transformExprFunctionCall(e);
      case STRUCT:
        return transformExprStruct(e);
      case BINARY:
        return transformExprBinary(e);
      case INT_CONSTANT:
        return transformExprIntConstant(e);
      case INDEX:
        return transformExprIndex(e);
      default:
        return transformExprDefault(e);
    }
  }

  /**
   * Rebuild with transformed type and children, keeping kind and
   * payload
   */
  protected Expr transformExprDefault(Expr e) {
    List<Stmt> stmts = e.statements() == null ? null
                                    : transformStmts(e.statements());
    return e.rebuild(transformType(e.type()), transformExprs(e.operands()),
                     stmts);
  }

  protected Expr transformExprSymbol(Expr e) {
    return transformExprDefault(e);
  }

  protected Expr transformExprMember(Expr e) {
    return transformExprDefault(e);
  }

  protected Expr transformExprUnion(Expr e) {
    return transformExprDefault(e);
  }

  protected Expr transformExprNondet(Expr e) {
    return transformExprDefault(e);
  }

  protected Expr transformExprFunctionCall(Expr e) {
    return transformExprDefault(e);
  }

  protected Expr transformExprStruct(Expr e) {
    return transformExprDefault(e);
  }

  protected Expr transformExprBinary(Expr e) {
    return transformExprDefault(e);
  }

  protected Expr transformExprIntConstant(Expr e) {
    return transformExprDefault(e);
  }

  protected Expr transformExprIndex(Expr e) {
    return transformExprDefault(e);
  }

  protected List<Expr> transformExprs(List<Expr> exprs) {
    List<Expr> result = new ArrayList<Expr>(exprs.size());
    for (Expr e: exprs) {
      // Absent lhs of function call statement
      result.add(e == null ? null : transformExpr(e));
    }
    return result;
  }

  /*
   * Statements
   */

  public Stmt transformStmt(Stmt s) {
    switch (s.kind()) {
      case GOTO:
        return transformStmtGoto(s);
      case LABEL:
        return transformStmtLabel(s);
      case FUNCTION_CALL:
        return transformStmtFunctionCall(s);
      default:
        return transformStmtDefault(s);
    }
  }

  protected Stmt transformStmtDefault(Stmt s) {
    Expr inv = s.loopInvariant() == null ? null
                              : transformExpr(s.loopInvariant());
    return s.rebuild(transformExprs(s.exprs()), transformStmts(s.body()),
                     inv);
  }

  protected Stmt transformStmtGoto(Stmt s) {
    return transformStmtDefault(s);
  }

  protected Stmt transformStmtLabel(Stmt s) {
    return transformStmtDefault(s);
  }

  protected Stmt transformStmtFunctionCall(Stmt s) {
    return transformStmtDefault(s);
  }

  protected List<Stmt> transformStmts(List<Stmt> stmts) {
    List<Stmt> result = new ArrayList<Stmt>(stmts.size());
    for (Stmt s: stmts) {
      result.add(transformStmt(s));
    }
    return result;
  }
}
