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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import exm.gotoc.common.exceptions.GotocRuntimeError;
import exm.gotoc.common.lang.InternedString;
import exm.gotoc.common.lang.Location;

/**
 * A statement of a goto program.  Immutable.
 *
 * Layout of children by kind:
 * <ul>
 * <li>ASSIGN: exprs = [lhs, rhs]</li>
 * <li>ASSERT, ASSUME, EXPRESSION: exprs = [e]</li>
 * <li>BLOCK, ATOMIC_BLOCK: body = statements</li>
 * <li>DEAD: exprs = [symbol]</li>
 * <li>DECL: exprs = [symbol] or [symbol, initial value]</li>
 * <li>FOR: exprs = [cond], body = [init, update, body]</li>
 * <li>FUNCTION_CALL: exprs = [lhs or null, function, args...]</li>
 * <li>GOTO: label = destination</li>
 * <li>IF_THEN_ELSE: exprs = [cond], body = [then] or [then, else]</li>
 * <li>LABEL: label, body = [stmt]</li>
 * <li>RETURN: exprs = [] or [value]</li>
 * <li>SWITCH: exprs = [control], body = switch cases</li>
 * <li>SWITCH_CASE: exprs = [case value], or [] for default; body = [stmt]</li>
 * <li>WHILE: exprs = [cond], body = [body]</li>
 * </ul>
 */
public final class Stmt {

  public static enum Kind {
    ASSIGN,
    ASSERT,
    ASSUME,
    ATOMIC_BLOCK,
    BLOCK,
    BREAK,
    CONTINUE,
    DEAD,
    DECL,
    EXPRESSION,
    FOR,
    FUNCTION_CALL,
    GOTO,
    IF_THEN_ELSE,
    LABEL,
    RETURN,
    SKIP,
    SWITCH,
    SWITCH_CASE,
    WHILE,
  }

  private final Kind kind;
  private final Location location;
  private final List<Expr> exprs;
  private final List<Stmt> body;
  private final InternedString label;
  /** Loop invariant for loops, or null */
  private final Expr invariant;

  private Stmt(Kind kind, Location location, List<Expr> exprs,
               List<Stmt> body, InternedString label, Expr invariant) {
    for (int i = 0; i < exprs.size(); i++) {
      if (exprs.get(i) == null &&
          !(kind == Kind.FUNCTION_CALL && i == 0)) {
        throw new GotocRuntimeError("Null expression in " + kind);
      }
    }
    for (Stmt s: body) {
      if (s == null) {
        throw new GotocRuntimeError("Null statement in " + kind);
      }
    }
    this.kind = kind;
    this.location = location;
    // ArrayList to allow absent lhs of function call
    this.exprs = Collections.unmodifiableList(new ArrayList<Expr>(exprs));
    this.body = Collections.unmodifiableList(new ArrayList<Stmt>(body));
    this.label = label;
    this.invariant = invariant;
  }

  private static Stmt make(Kind kind, Location loc, List<Expr> exprs,
                           List<Stmt> body) {
    return new Stmt(kind, loc, exprs, body, null, null);
  }

  private static List<Expr> noExprs() {
    return Collections.emptyList();
  }

  private static List<Stmt> noStmts() {
    return Collections.emptyList();
  }

  public Kind kind() {
    return kind;
  }

  public Location location() {
    return location;
  }

  public List<Expr> exprs() {
    return exprs;
  }

  public List<Stmt> body() {
    return body;
  }

  /**
   * @return label name for LABEL, destination for GOTO, otherwise null
   */
  public String label() {
    return label == null ? null : label.toString();
  }

  public Expr loopInvariant() {
    return invariant;
  }

  /*
   * Factories
   */

  public static Stmt assign(Expr lhs, Expr rhs, Location loc) {
    if (!lhs.type().equals(rhs.type())) {
      throw new GotocRuntimeError("Assignment of " + rhs.type() + " to " +
                                  lhs + " of type " + lhs.type());
    }
    return make(Kind.ASSIGN, loc, Arrays.asList(lhs, rhs), noStmts());
  }

  /**
   * Assertion of a named property
   * @param propertyClass category of property, e.g. "assertion"
   * @param message description shown when the property fails
   */
  public static Stmt assertStmt(Expr cond, String propertyClass,
                                String message, Location loc) {
    checkBool(cond, "Assertion");
    return make(Kind.ASSERT, loc.toProperty(message, propertyClass),
                Arrays.asList(cond), noStmts());
  }

  public static Stmt assertFalse(String propertyClass, String message,
                                 Location loc) {
    return assertStmt(Expr.falseExpr(), propertyClass, message, loc);
  }

  public static Stmt assume(Expr cond, Location loc) {
    checkBool(cond, "Assumption");
    return make(Kind.ASSUME, loc, Arrays.asList(cond), noStmts());
  }

  private static void checkBool(Expr cond, String what) {
    if (!cond.type().isBool()) {
      throw new GotocRuntimeError(what + " must be boolean: " + cond);
    }
  }

  public static Stmt atomicBlock(List<Stmt> stmts, Location loc) {
    return make(Kind.ATOMIC_BLOCK, loc, noExprs(), stmts);
  }

  public static Stmt block(List<Stmt> stmts, Location loc) {
    return make(Kind.BLOCK, loc, noExprs(), stmts);
  }

  public static Stmt breakStmt(Location loc) {
    return make(Kind.BREAK, loc, noExprs(), noStmts());
  }

  public static Stmt continueStmt(Location loc) {
    return make(Kind.CONTINUE, loc, noExprs(), noStmts());
  }

  public static Stmt dead(Expr symbol, Location loc) {
    checkSymbol(symbol, "dead");
    return make(Kind.DEAD, loc, Arrays.asList(symbol), noStmts());
  }

  /**
   * @param value initial value, or null
   */
  public static Stmt decl(Expr symbol, Expr value, Location loc) {
    checkSymbol(symbol, "decl");
    if (value == null) {
      return make(Kind.DECL, loc, Arrays.asList(symbol), noStmts());
    }
    if (!value.type().equals(symbol.type())) {
      throw new GotocRuntimeError("Initial value of type " + value.type() +
          " for " + symbol + " of type " + symbol.type());
    }
    return make(Kind.DECL, loc, Arrays.asList(symbol, value), noStmts());
  }

  private static void checkSymbol(Expr e, String what) {
    if (e.kind() != Expr.Kind.SYMBOL) {
      throw new GotocRuntimeError("Operand of " + what +
                                  " must be a symbol: " + e);
    }
  }

  public static Stmt expression(Expr e, Location loc) {
    return make(Kind.EXPRESSION, loc, Arrays.asList(e), noStmts());
  }

  public static Stmt forLoop(Stmt init, Expr cond, Stmt update, Stmt body,
                             Location loc) {
    checkBool(cond, "Loop condition");
    return make(Kind.FOR, loc, Arrays.asList(cond),
                Arrays.asList(init, update, body));
  }

  /**
   * @param lhs variable receiving the result, or null
   */
  public static Stmt functionCall(Expr lhs, Expr function,
                                  List<Expr> arguments, Location loc) {
    Expr.checkCall(function.type(), arguments);
    if (lhs != null && !lhs.type().equals(function.type().returnType())) {
      throw new GotocRuntimeError("Result of " + function + " has type " +
          function.type().returnType() + " but assigned to " + lhs.type());
    }
    List<Expr> exprs = new ArrayList<Expr>(arguments.size() + 2);
    exprs.add(lhs);
    exprs.add(function);
    exprs.addAll(arguments);
    return make(Kind.FUNCTION_CALL, loc, exprs, noStmts());
  }

  public Expr callLhs() {
    return exprs.get(0);
  }

  public Expr callFunction() {
    return exprs.get(1);
  }

  public List<Expr> callArguments() {
    return exprs.subList(2, exprs.size());
  }

  public static Stmt gotoStmt(String dest, Location loc) {
    return new Stmt(Kind.GOTO, loc, noExprs(), noStmts(),
                    InternedString.of(dest), null);
  }

  /**
   * @param elseStmt else branch, or null
   */
  public static Stmt ifThenElse(Expr cond, Stmt thenStmt, Stmt elseStmt,
                                Location loc) {
    checkBool(cond, "If condition");
    List<Stmt> branches = elseStmt == null ? Arrays.asList(thenStmt)
                                         : Arrays.asList(thenStmt, elseStmt);
    return make(Kind.IF_THEN_ELSE, loc, Arrays.asList(cond), branches);
  }

  public static Stmt label(String label, Stmt body, Location loc) {
    return new Stmt(Kind.LABEL, loc, noExprs(), Arrays.asList(body),
                    InternedString.of(label), null);
  }

  /**
   * Label this statement
   */
  public Stmt withLabel(String label) {
    return label(label, this, location);
  }

  /**
   * @param value return value, or null for none
   */
  public static Stmt returnStmt(Expr value, Location loc) {
    List<Expr> exprs = value == null ? noExprs() : Arrays.asList(value);
    return make(Kind.RETURN, loc, exprs, noStmts());
  }

  public static Stmt skip(Location loc) {
    return make(Kind.SKIP, loc, noExprs(), noStmts());
  }

  /**
   * @param cases cases built with {@link #switchCase}
   * @param defaultBody body for default case, or null
   */
  public static Stmt switchStmt(Expr control, List<Stmt> cases,
                                Stmt defaultBody, Location loc) {
    if (!control.type().isInteger()) {
      throw new GotocRuntimeError("Switch on non-integer " + control);
    }
    List<Stmt> all = new ArrayList<Stmt>(cases);
    for (Stmt c: cases) {
      if (c.kind != Kind.SWITCH_CASE || c.exprs.isEmpty()) {
        throw new GotocRuntimeError("Expected switch case, got " + c);
      }
      if (!c.exprs.get(0).type().equals(control.type())) {
        throw new GotocRuntimeError("Case value " + c.exprs.get(0) +
                        " does not match switch type " + control.type());
      }
    }
    if (defaultBody != null) {
      all.add(make(Kind.SWITCH_CASE, defaultBody.location, noExprs(),
                   Arrays.asList(defaultBody)));
    }
    return make(Kind.SWITCH, loc, Arrays.asList(control), all);
  }

  public static Stmt switchCase(Expr value, Stmt body) {
    return make(Kind.SWITCH_CASE, body.location, Arrays.asList(value),
                Arrays.asList(body));
  }

  public boolean isDefaultCase() {
    return kind == Kind.SWITCH_CASE && exprs.isEmpty();
  }

  public static Stmt whileLoop(Expr cond, Stmt body, Location loc) {
    checkBool(cond, "Loop condition");
    return make(Kind.WHILE, loc, Arrays.asList(cond), Arrays.asList(body));
  }

  /**
   * Attach a loop invariant to a loop
   */
  public Stmt withLoopInvariant(Expr inv) {
    if (kind != Kind.WHILE && kind != Kind.FOR) {
      throw new GotocRuntimeError("Loop invariant on non-loop " + kind);
    }
    checkBool(inv, "Loop invariant");
    return new Stmt(kind, location, exprs, body, label, inv);
  }

  /**
   * Same kind and label with new children.  Used by transformations.
   */
  public Stmt rebuild(List<Expr> newExprs, List<Stmt> newBody,
                      Expr newInvariant) {
    return new Stmt(kind, location, newExprs, newBody, label, newInvariant);
  }

  public Stmt withLabelName(String newLabel) {
    if (label == null) {
      throw new GotocRuntimeError(kind + " statement has no label");
    }
    return new Stmt(kind, location, exprs, body, InternedString.of(newLabel),
                    invariant);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Stmt)) {
      return false;
    }
    Stmt other = (Stmt)o;
    return kind == other.kind && location.equals(other.location) &&
           exprs.equals(other.exprs) && body.equals(other.body) &&
           label == other.label && Objects.equals(invariant, other.invariant);
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, exprs, body, label);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append(kind.toString().toLowerCase());
    if (label != null) {
      sb.append(" ").append(label);
    }
    for (Expr e: exprs) {
      sb.append(" ").append(e);
    }
    if (!body.isEmpty()) {
      sb.append(" { ");
      for (Stmt s: body) {
        sb.append(s).append("; ");
      }
      sb.append("}");
    }
    return sb.toString();
  }
}
