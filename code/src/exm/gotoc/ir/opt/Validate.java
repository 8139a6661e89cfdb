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
import java.util.List;

import org.apache.log4j.Logger;

import exm.gotoc.common.Logging;
import exm.gotoc.common.exceptions.LayoutException;
import exm.gotoc.common.exceptions.TransformException;
import exm.gotoc.common.lang.Location;
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
 * Consistency checks on a complete symbol table, for things that
 * can't be checked while the table is under construction: tags must
 * resolve, and struct literals and member accesses through tags must
 * agree with the definitions.
 */
public class Validate {

  private static final Logger logger = Logging.getGotocLogger();

  private final SymbolTable table;
  private final List<String> errors = new ArrayList<String>();

  /** Symbol currently being checked */
  private Symbol current;

  private Validate(SymbolTable table) {
    this.table = table;
  }

  /**
   * @throws TransformException describing every problem found
   */
  public static void check(SymbolTable table) throws TransformException {
    Validate v = new Validate(table);
    for (Symbol s: table) {
      v.checkSymbol(s);
    }
    if (!v.errors.isEmpty()) {
      StringBuilder sb = new StringBuilder();
      sb.append(v.errors.size()).append(" problem(s) in symbol table:");
      for (String err: v.errors) {
        logger.error(err);
        sb.append("\n  ").append(err);
      }
      throw new TransformException(sb.toString());
    }
    logger.debug("Validated " + table.size() + " symbols");
  }

  private void error(Location loc, String msg) {
    StringBuilder sb = new StringBuilder();
    if (loc != null && !loc.isNone()) {
      sb.append(loc.shortString()).append(": ");
    }
    sb.append("symbol ").append(current.name()).append(": ").append(msg);
    errors.add(sb.toString());
  }

  private void checkSymbol(Symbol s) {
    current = s;
    if (s.isType() && s.hasValue()) {
      error(s.location(), "type symbol has a value");
    }
    checkType(s.type(), s.location());
    FunctionContract contract = s.contract();
    if (contract != null) {
      if (!s.type().isCode()) {
        error(s.location(), "contract on non-function type " + s.type());
      }
      checkSpecs(contract.requires());
      checkSpecs(contract.ensures());
    }
    if (s.value() != null) {
      checkExpr(s.value());
    } else if (s.body() != null) {
      checkStmt(s.body());
    }
  }

  private void checkSpecs(List<Spec> specs) {
    for (Spec spec: specs) {
      checkExpr(spec.clause());
    }
  }

  private void checkType(Type t, Location loc) {
    switch (t.kind()) {
      case STRUCT_TAG:
      case UNION_TAG:
        try {
          ((TagType)t).resolve(table);
        } catch (LayoutException e) {
          error(loc, e.getMessage());
        }
        break;
      case STRUCT:
      case UNION:
        for (DatatypeComponent c: t.components()) {
          checkType(c.type(), loc);
        }
        break;
      case CODE:
      case VARIADIC_CODE:
        for (Parameter p: t.parameters()) {
          checkType(p.type(), loc);
        }
        checkType(t.returnType(), loc);
        break;
      default:
        if (t.baseType() != null) {
          checkType(t.baseType(), loc);
        }
    }
  }

  private void checkExpr(Expr e) {
    checkType(e.type(), e.location());
    for (Expr op: e.operands()) {
      checkExpr(op);
    }
    if (e.statements() != null) {
      for (Stmt s: e.statements()) {
        checkStmt(s);
      }
    }
    try {
      switch (e.kind()) {
        case STRUCT:
          checkStructLiteral(e);
          break;
        case MEMBER: {
          Type aggr = e.operand(0).type();
          Type field = aggr.lookupFieldType(e.identifier(), table);
          if (field == null) {
            error(e.location(), "no field " + e.identifier() + " in " + aggr);
          } else if (!field.equals(e.type())) {
            error(e.location(), "field " + e.identifier() + " has type " +
                  field + " but is used as " + e.type());
          }
          break;
        }
        default:
          break;
      }
    } catch (LayoutException ex) {
      error(e.location(), ex.getMessage());
    }
  }

  private void checkStructLiteral(Expr e) throws LayoutException {
    if (!e.type().isAggregateTag()) {
      return;
    }
    List<DatatypeComponent> comps = e.type().lookupComponents(table);
    if (comps.size() != e.operands().size()) {
      error(e.location(), "struct literal for " + e.type() + " has " +
            e.operands().size() + " values but " + comps.size() +
            " components");
      return;
    }
    for (int i = 0; i < comps.size(); i++) {
      Type valType = e.operand(i).type();
      if (!comps.get(i).type().equals(valType)) {
        error(e.location(), "component " + comps.get(i).name() + " of " +
              e.type() + " has type " + comps.get(i).type() +
              " but value has type " + valType);
      }
    }
  }

  private void checkStmt(Stmt s) {
    for (Expr e: s.exprs()) {
      if (e != null) {
        checkExpr(e);
      }
    }
    for (Stmt child: s.body()) {
      checkStmt(child);
    }
    if (s.loopInvariant() != null) {
      checkExpr(s.loopInvariant());
    }
  }
}
