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

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import exm.gotoc.common.Settings;
import exm.gotoc.common.exceptions.TransformException;
import exm.gotoc.common.lang.Location;
import exm.gotoc.common.lang.Types;
import exm.gotoc.common.lang.Types.Parameter;
import exm.gotoc.common.lang.Types.Type;
import exm.gotoc.ir.tree.Expr;
import exm.gotoc.ir.tree.Stmt;
import exm.gotoc.ir.tree.Symbol;
import exm.gotoc.ir.tree.SymbolTable;

/**
 * Replace nondeterministic values with calls to generated functions,
 * one per type, whose bodies return an uninitialized variable.
 *
 * <pre>
 *   x = nondet();              x = non_det_signed_32_bit();
 *                      =>      ...
 *                              int non_det_signed_32_bit() {
 *                                int non_det_signed_32_bit_ret;
 *                                return non_det_signed_32_bit_ret;
 *                              }
 * </pre>
 */
public class NondetTransformer extends TableTransformer {

  public static final String FUNCTION_PREFIX = "non_det_";

  /** Generated function name => function type, in order of first use */
  private final Map<String, Type> nondetFunctions =
                                  new LinkedHashMap<String, Type>();

  @Override
  public String getPassName() {
    return "nondet functions";
  }

  @Override
  public String getConfigEnabledKey() {
    return Settings.NONDET_FUNCTIONS;
  }

  public static String functionName(Type t) {
    return FUNCTION_PREFIX + t.toIdentifier();
  }

  @Override
  protected Expr transformExprNondet(Expr e) {
    Type t = transformType(e.type());
    String name = functionName(t);
    Type fnType = Types.code(Collections.<Parameter>emptyList(), t);
    nondetFunctions.put(name, fnType);
    return Expr.symbol(name, fnType).call(Collections.<Expr>emptyList())
               .withLocation(e.location());
  }

  @Override
  protected void postprocess(SymbolTable result) throws TransformException {
    for (Map.Entry<String, Type> e: nondetFunctions.entrySet()) {
      String name = e.getKey();
      Type retType = e.getValue().returnType();
      if (retType.isEmpty()) {
        throw new TransformException(name, null,
                            "cannot generate nondeterministic void value");
      }
      if (result.contains(name)) {
        throw new TransformException(name, null,
            "generated function name already used in symbol table");
      }
      String retName = name + "_ret";
      Expr ret = Expr.symbol(retName, retType);
      Stmt body = Stmt.block(Arrays.asList(
          Stmt.decl(ret, null, Location.none()),
          Stmt.returnStmt(ret, Location.none())), Location.none());

      result.insert(Symbol.variable(retName, "ret", retType,
                                    Location.none()));
      result.insert(Symbol.function(name, e.getValue(), body, name,
                                    Location.none()));
    }
    logger.debug("Generated " + nondetFunctions.size() +
                 " nondet functions");
  }
}
