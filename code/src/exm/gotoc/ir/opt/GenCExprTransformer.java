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

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import exm.gotoc.common.Settings;
import exm.gotoc.common.exceptions.GotocRuntimeError;
import exm.gotoc.common.exceptions.TransformException;
import exm.gotoc.common.lang.Location;
import exm.gotoc.common.lang.Types;
import exm.gotoc.common.lang.Types.Parameter;
import exm.gotoc.common.lang.Types.Type;
import exm.gotoc.ir.tree.Expr;
import exm.gotoc.ir.tree.Operators.BinaryOp;
import exm.gotoc.ir.tree.Stmt;
import exm.gotoc.ir.tree.Symbol;
import exm.gotoc.ir.tree.Symbol.Attribute;
import exm.gotoc.ir.tree.SymbolTable;
import exm.gotoc.ir.tree.SymbolTable.SymbolFactory;

/**
 * Replace expressions that a C compiler would reject, so that the
 * table can be emitted as a runnable C program.
 *
 * <ul>
 * <li>{@code a => b} becomes {@code !a | b}</li>
 * <li>128-bit constants are built from two 64-bit halves</li>
 * <li>{@code v[i]} on a vector becomes {@code *((T*)&v + i)}</li>
 * <li>extern functions get a body returning a nondet value</li>
 * <li>extern statics are assigned nondet values in {@code main}</li>
 * <li>{@code main} is renamed to {@code main_} and called from a
 *     new {@code int main()} wrapper</li>
 * </ul>
 */
public class GenCExprTransformer extends TableTransformer {

  public static final String MAIN = "main";
  public static final String RENAMED_MAIN = "main_";

  private static final BigInteger LOW_MASK =
          BigInteger.ONE.shiftLeft(64).subtract(BigInteger.ONE);

  /** Extern statics => initial value, in order seen */
  private final Map<String, Expr> externStatics =
                                  new LinkedHashMap<String, Expr>();

  @Override
  public String getPassName() {
    return "generate C";
  }

  @Override
  public String getConfigEnabledKey() {
    return Settings.GEN_C;
  }

  @Override
  protected Expr transformExprBinary(Expr e) {
    if (e.binaryOp() != BinaryOp.IMPLIES) {
      return transformExprDefault(e);
    }
    Expr lhs = transformExpr(e.operand(0));
    Expr rhs = transformExpr(e.operand(1));
    return lhs.not().binop(BinaryOp.BITOR, rhs).castTo(Types.BOOL)
              .withLocation(e.location());
  }

  @Override
  protected Expr transformExprIntConstant(Expr e) {
    return splitWideConstant(e.value(), transformType(e.type()))
              .withLocation(e.location());
  }

  /**
   * C has 128-bit integer variables but no 128-bit literals:
   * build {@code (T)((hi << 64) | lo)} from unsigned halves.
   */
  private Expr splitWideConstant(BigInteger value, Type t) {
    if (t.isCInteger()) {
      return Expr.intConstant(value, t);
    }
    Integer width = t.nativeWidth(targetTable().machineModel());
    if (width != null && width <= 64) {
      return Expr.intConstant(value, t);
    }
    if (width == null || width != 128) {
      throw new GotocRuntimeError("Unexpected constant width " + width +
                                  " for " + t);
    }
    Type u128 = Types.unsignedInt(128);
    BigInteger high = value.and(LOW_MASK.shiftLeft(64)).shiftRight(64);
    BigInteger low = value.and(LOW_MASK);
    return Expr.intConstant(high, u128)
               .binop(BinaryOp.SHL, Expr.intConstant(64, Types.C_INT))
               .binop(BinaryOp.BITOR, Expr.intConstant(low, u128))
               .castTo(t);
  }

  @Override
  protected Expr transformExprIndex(Expr e) {
    Expr array = transformExpr(e.operand(0));
    Expr index = transformExpr(e.operand(1));
    if (!array.type().isVector()) {
      return array.index(index).withLocation(e.location());
    }
    Type elemPtr = Types.pointer(array.type().baseType());
    return array.addressOf().castTo(elemPtr).binop(BinaryOp.PLUS, index)
                .dereference().withLocation(e.location());
  }

  @Override
  protected Symbol transformSymbol(Symbol s) {
    if (s.is(Attribute.IS_EXTERN)) {
      if (s.type().isCode()) {
        return nondetFunction(s);
      }
      return externStatic(s);
    }
    Symbol result = super.transformSymbol(s);
    if (s.name().equals(MAIN)) {
      // Wrong return type for a C main
      result = result.copyWithName(RENAMED_MAIN)
                     .setBaseName(RENAMED_MAIN)
                     .setPrettyName(RENAMED_MAIN);
    }
    return result;
  }

  private Symbol nondetFunction(Symbol s) {
    if (s.hasValue()) {
      throw new GotocRuntimeError("Extern function " + s.name() +
                                  " has a body");
    }
    Type t = transformType(s.type());
    List<Parameter> params = new ArrayList<Parameter>();
    for (Parameter p: t.parameters()) {
      params.add(nameParameter(p));
    }
    Type ret = t.returnType();
    Type newType = t.isVariadicCode() ? Types.variadicCode(params, ret)
                                      : Types.code(params, ret);
    Expr retVal = ret.isEmpty() ? null : Expr.nondet(ret);

    Symbol result = s.copy();
    result.setExtern(false);
    result.setType(newType);
    result.setBody(Stmt.returnStmt(retVal, Location.none()));
    return result;
  }

  /**
   * Body needs named parameters.  Unnamed ones share a symbol per type.
   */
  private Parameter nameParameter(final Parameter p) {
    if (p.identifier() != null) {
      return p;
    }
    String name = "__" + p.type().toIdentifier();
    Symbol sym = targetTable().ensure(name, new SymbolFactory() {
      @Override
      public Symbol create(String n) {
        return Symbol.variable(n, n, p.type(), Location.none());
      }
    });
    return sym.toFunctionParameter();
  }

  private Symbol externStatic(Symbol s) {
    if (!s.is(Attribute.IS_STATIC_LIFETIME)) {
      throw new GotocRuntimeError("Extern object " + s.name() +
                                  " is not a static variable");
    }
    Type t = transformType(s.type());
    externStatics.put(s.name(), Expr.nondet(t));

    Symbol result = s.copy();
    result.setExtern(false);
    // Global, not tied to the declaring file
    result.setLocation(Location.none());
    result.setType(t);
    result.clearValue();
    return result;
  }

  @Override
  protected void postprocess(SymbolTable result) throws TransformException {
    List<Stmt> body = new ArrayList<Stmt>();
    for (Map.Entry<String, Expr> e: externStatics.entrySet()) {
      Expr value = e.getValue();
      body.add(Stmt.assign(Expr.symbol(e.getKey(), value.type()), value,
                           Location.none()));
    }

    Symbol renamed = result.lookup(RENAMED_MAIN);
    if (renamed != null) {
      List<Expr> args = new ArrayList<Expr>();
      for (Parameter p: renamed.type().parameters()) {
        args.add(Expr.nondet(p.type()));
      }
      body.add(Stmt.expression(renamed.toExpr().call(args),
                               Location.none()));
    }
    body.add(Stmt.returnStmt(Expr.intConstant(0, Types.C_INT),
                             Location.none()));

    if (result.contains(MAIN)) {
      throw new TransformException(MAIN, null,
                                   "wrapper main already defined");
    }
    result.insert(Symbol.function(MAIN,
        Types.code(Collections.<Parameter>emptyList(), Types.C_INT),
        Stmt.block(body, Location.none()), MAIN, Location.none()));
    logger.debug("Wrapped main with " + externStatics.size() +
                 " extern statics");
  }
}
