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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import exm.gotoc.common.exceptions.GotocRuntimeError;
import exm.gotoc.common.lang.Location;
import exm.gotoc.common.lang.MachineModel;
import exm.gotoc.common.lang.Types;
import exm.gotoc.common.lang.Types.ArrayType;
import exm.gotoc.common.lang.Types.BitFieldType;
import exm.gotoc.common.lang.Types.BitVectorType;
import exm.gotoc.common.lang.Types.CIntegerType;
import exm.gotoc.common.lang.Types.DatatypeComponent;
import exm.gotoc.common.lang.Types.Parameter;
import exm.gotoc.common.lang.Types.TagType;
import exm.gotoc.common.lang.Types.Type;
import exm.gotoc.common.util.BitUtil;
import exm.gotoc.ir.tree.Contracts.FunctionContract;
import exm.gotoc.ir.tree.Contracts.Spec;
import exm.gotoc.ir.tree.Expr;
import exm.gotoc.ir.tree.Stmt;
import exm.gotoc.ir.tree.Symbol;

/**
 * Lower typed program trees to ireps for one machine.  Widths of C
 * types, byte order and the bit patterns of constants all depend on
 * the machine model.
 */
public class IrepConverter {

  private final MachineModel mm;

  public IrepConverter(MachineModel mm) {
    this.mm = mm;
  }

  public MachineModel machineModel() {
    return mm;
  }

  /*
   * Locations
   */

  public Irep toIrep(Location loc) {
    Map<String, Irep> m = new LinkedHashMap<String, Irep>();
    switch (loc.kind()) {
      case NONE:
        return Irep.nil();
      case BUILTIN_FUNCTION:
        m.put(IrepId.FILE, Irep.justStringId(
                              Location.builtinFile(loc.function())));
        m.put(IrepId.FUNCTION, Irep.justStringId(loc.function()));
        putInt(m, IrepId.LINE, loc.line());
        break;
      case LOC:
        m.put(IrepId.FILE, Irep.justStringId(loc.filename()));
        m.put(IrepId.LINE, Irep.justIntId(loc.line()));
        putInt(m, IrepId.COLUMN, loc.column());
        putString(m, IrepId.FUNCTION, loc.function());
        break;
      case PROPERTY:
        putString(m, IrepId.FILE, loc.filename());
        putInt(m, IrepId.LINE, loc.line());
        putInt(m, IrepId.COLUMN, loc.column());
        putString(m, IrepId.FUNCTION, loc.function());
        m.put(IrepId.COMMENT, Irep.justStringId(loc.comment()));
        m.put(IrepId.PROPERTY_CLASS, Irep.justStringId(loc.propertyClass()));
        break;
      default:
        throw new GotocRuntimeError("Unexpected location kind " + loc.kind());
    }
    return Irep.justNamedSub(m);
  }

  private static void putInt(Map<String, Irep> m, String key, Long val) {
    if (val != null) {
      m.put(key, Irep.justIntId(val));
    }
  }

  private static void putString(Map<String, Irep> m, String key,
                                String val) {
    if (val != null) {
      m.put(key, Irep.justStringId(val));
    }
  }

  /*
   * Types
   */

  public Irep toIrep(Type t) {
    switch (t.kind()) {
      case ARRAY:
        return arrayIrep(IrepId.ARRAY, t.baseType(),
                         sizeIrep(((ArrayType)t).size()));
      case FLEXIBLE_ARRAY:
        return arrayIrep(IrepId.ARRAY, t.baseType(), sizeIrep(0));
      case INFINITE_ARRAY:
        return arrayIrep(IrepId.ARRAY, t.baseType(),
            Irep.justId(IrepId.INFINITY).withType(toIrep(Types.SSIZE_T)));
      case VECTOR:
        return arrayIrep(IrepId.VECTOR, t.baseType(),
                         sizeIrep(((ArrayType)t).size()));
      case BOOL:
        return Irep.justId(IrepId.BOOL);
      case CONSTRUCTOR:
        return Irep.justId(IrepId.CONSTRUCTOR);
      case EMPTY:
        return Irep.justId(IrepId.EMPTY);
      case C_BIT_FIELD:
        return new Irep(IrepId.C_BIT_FIELD,
            Arrays.asList(toIrep(t.baseType())),
            single(IrepId.WIDTH,
                   Irep.justIntId(((BitFieldType)t).width())));
      case C_INTEGER:
        return cIntegerIrep((CIntegerType)t);
      case SIGNEDBV:
        return bitVectorIrep(IrepId.SIGNEDBV, ((BitVectorType)t).width());
      case UNSIGNEDBV:
        return bitVectorIrep(IrepId.UNSIGNEDBV, ((BitVectorType)t).width());
      case DOUBLE:
        return floatIrep(52, 64, "double");
      case FLOAT:
        return floatIrep(23, 32, "float");
      case POINTER:
        return new Irep(IrepId.POINTER,
            Arrays.asList(toIrep(t.baseType())),
            single(IrepId.WIDTH, Irep.justIntId(mm.pointerWidth())));
      case CODE:
      case VARIADIC_CODE:
        return codeIrep(t);
      case STRUCT:
      case UNION: {
        List<Irep> comps = new ArrayList<Irep>();
        for (DatatypeComponent c: t.components()) {
          comps.add(toIrep(c));
        }
        Map<String, Irep> m = new LinkedHashMap<String, Irep>();
        m.put(IrepId.TAG, Irep.justStringId(t.tag()));
        m.put(IrepId.COMPONENTS, Irep.justSub(comps));
        return new Irep(t.isStruct() ? IrepId.STRUCT : IrepId.UNION,
                        noSub(), m);
      }
      case INCOMPLETE_STRUCT:
      case INCOMPLETE_UNION: {
        Map<String, Irep> m = new LinkedHashMap<String, Irep>();
        m.put(IrepId.TAG, Irep.justStringId(t.tag()));
        m.put(IrepId.INCOMPLETE, Irep.one());
        return new Irep(t.kind() == Types.TypeKind.INCOMPLETE_STRUCT ?
                        IrepId.STRUCT : IrepId.UNION, noSub(), m);
      }
      case STRUCT_TAG:
      case UNION_TAG:
        return new Irep(t.kind() == Types.TypeKind.STRUCT_TAG ?
                        IrepId.STRUCT_TAG : IrepId.UNION_TAG, noSub(),
            single(IrepId.IDENTIFIER,
                   Irep.justStringId(((TagType)t).identifier())));
      default:
        throw new GotocRuntimeError("Unknown type kind " + t.kind());
    }
  }

  private Irep arrayIrep(String id, Type elem, Irep size) {
    return new Irep(id, Arrays.asList(toIrep(elem)),
                    single(IrepId.SIZE, size));
  }

  private Irep sizeIrep(long size) {
    return toIrep(Expr.intConstant(size, Types.SSIZE_T));
  }

  private Irep cIntegerIrep(CIntegerType t) {
    int width = t.intKind().width(mm);
    switch (t.intKind()) {
      case BOOL:
        return bitVectorIrep(IrepId.C_BOOL, width);
      case CHAR:
        return bitVectorIrep(mm.charIsUnsigned() ? IrepId.UNSIGNEDBV
                                                 : IrepId.SIGNEDBV, width);
      case SIZE_T:
        return bitVectorIrep(IrepId.UNSIGNEDBV, width);
      case INT:
      case LONG_INT:
      case SSIZE_T:
        return bitVectorIrep(IrepId.SIGNEDBV, width);
      default:
        throw new GotocRuntimeError("Unknown int kind " + t.intKind());
    }
  }

  private static Irep bitVectorIrep(String id, int width) {
    return new Irep(id, noSub(), single(IrepId.WIDTH,
                                        Irep.justIntId(width)));
  }

  private static Irep floatIrep(int fraction, int width, String cType) {
    Map<String, Irep> m = new LinkedHashMap<String, Irep>();
    m.put(IrepId.F, Irep.justIntId(fraction));
    m.put(IrepId.WIDTH, Irep.justIntId(width));
    m.put(IrepId.C_C_TYPE, Irep.justId(cType));
    return new Irep(IrepId.FLOATBV, noSub(), m);
  }

  private Irep codeIrep(Type t) {
    List<Irep> params = new ArrayList<Irep>();
    for (Parameter p: t.parameters()) {
      params.add(toIrep(p));
    }
    Irep paramsIrep = Irep.justSub(params);
    if (t.isVariadicCode()) {
      paramsIrep = paramsIrep.withNamedSub(IrepId.ELLIPSIS, Irep.one());
    }
    Map<String, Irep> m = new LinkedHashMap<String, Irep>();
    m.put(IrepId.PARAMETERS, paramsIrep);
    m.put(IrepId.RETURN_TYPE, toIrep(t.returnType()));
    return new Irep(IrepId.CODE, noSub(), m);
  }

  public Irep toIrep(Parameter p) {
    Irep result = new Irep(IrepId.PARAMETER, noSub(),
                           single(IrepId.TYPE, toIrep(p.type())));
    if (p.identifier() != null) {
      result = result.withNamedSub(IrepId.C_IDENTIFIER,
                                   Irep.justStringId(p.identifier()));
    }
    if (p.baseName() != null) {
      result = result.withNamedSub(IrepId.C_BASE_NAME,
                                   Irep.justStringId(p.baseName()));
    }
    return result;
  }

  public Irep toIrep(DatatypeComponent c) {
    Map<String, Irep> m = new LinkedHashMap<String, Irep>();
    if (c.isPadding()) {
      m.put(IrepId.C_IS_PADDING, Irep.one());
      m.put(IrepId.NAME, Irep.justStringId(c.name()));
    } else {
      m.put(IrepId.NAME, Irep.justStringId(c.name()));
      m.put(IrepId.C_PRETTY_NAME, Irep.justStringId(c.name()));
    }
    m.put(IrepId.TYPE, toIrep(c.type()));
    return Irep.justNamedSub(m);
  }

  /**
   * Type of symbol, annotated with its contract if it has one
   */
  public Irep symbolTypeIrep(Symbol s) {
    Irep typ = toIrep(s.type());
    FunctionContract contract = s.contract();
    if (contract == null) {
      return typ;
    }
    if (!contract.requires().isEmpty()) {
      typ = typ.withNamedSub(IrepId.C_SPEC_REQUIRES,
                             specsIrep(contract.requires()));
    }
    if (!contract.ensures().isEmpty()) {
      typ = typ.withNamedSub(IrepId.C_SPEC_ENSURES,
                             specsIrep(contract.ensures()));
    }
    return typ;
  }

  private Irep specsIrep(List<Spec> specs) {
    List<Irep> l = new ArrayList<Irep>(specs.size());
    for (Spec spec: specs) {
      l.add(toIrep(spec));
    }
    return Irep.justSub(l);
  }

  /**
   * A contract clause is a lambda binding the temporaries
   */
  public Irep toIrep(Spec spec) {
    List<Type> argTypes = new ArrayList<Type>();
    List<Irep> temps = new ArrayList<Irep>();
    for (Expr t: spec.temporaries()) {
      argTypes.add(t.type());
      temps.add(toIrep(t));
    }
    Type fnType = Types.codeWithUnnamedParameters(argTypes,
                                                  spec.clause().type());
    Irep tuple = new Irep(IrepId.TUPLE, temps, noNamed());
    return new Irep(IrepId.LAMBDA, Arrays.asList(tuple,
                                                 toIrep(spec.clause())),
                    noNamed())
              .withLocation(spec.location(), this)
              .withType(toIrep(fnType));
  }

  /*
   * Expressions
   */

  public Irep toIrep(Expr e) {
    return exprValueIrep(e)
              .withLocation(e.location(), this)
              .withType(toIrep(e.type()));
  }

  private Irep exprValueIrep(Expr e) {
    switch (e.kind()) {
      case ADDRESS_OF:
        return opIrep(IrepId.ADDRESS_OF, e);
      case ARRAY:
        return opIrep(IrepId.ARRAY, e);
      case ARRAY_OF:
        return opIrep(IrepId.ARRAY_OF, e);
      case VECTOR:
        return opIrep(IrepId.VECTOR, e);
      case STRUCT:
        return opIrep(IrepId.STRUCT, e);
      case DEREFERENCE:
        return opIrep(IrepId.DEREFERENCE, e);
      case INDEX:
        return opIrep(IrepId.INDEX, e);
      case IF:
        return opIrep(IrepId.IF, e);
      case TYPECAST:
        return opIrep(IrepId.TYPECAST, e);
      case EMPTY_UNION:
        return Irep.justId(IrepId.EMPTY_UNION);
      case ASSIGN:
        return sideEffectIrep(IrepId.ASSIGN, exprIreps(e.operands()));
      case NONDET:
        return sideEffectIrep(IrepId.NONDET, noSub());
      case SELF_OP:
        return sideEffectIrep(e.selfOp().irepId(), exprIreps(e.operands()));
      case FUNCTION_CALL:
        return sideEffectIrep(IrepId.FUNCTION_CALL, Arrays.asList(
            toIrep(e.operand(0)),
            argumentsIrep(e.callArguments())));
      case STATEMENT_EXPRESSION:
        return sideEffectIrep(IrepId.STATEMENT_EXPRESSION, Arrays.asList(
            toIrep(Stmt.block(e.statements(), Location.none()))));
      case BINARY:
        return opIrep(e.binaryOp().irepId(), e);
      case UNARY:
        return unaryIrep(e);
      case MEMBER: {
        Map<String, Irep> m = new LinkedHashMap<String, Irep>();
        m.put(IrepId.C_LVALUE, Irep.one());
        m.put(IrepId.COMPONENT_NAME, Irep.justStringId(e.identifier()));
        return new Irep(IrepId.MEMBER, exprIreps(e.operands()), m);
      }
      case UNION:
        return new Irep(IrepId.UNION, exprIreps(e.operands()),
            single(IrepId.COMPONENT_NAME, Irep.justStringId(e.identifier())));
      case SYMBOL:
        return new Irep(IrepId.SYMBOL, noSub(),
            single(IrepId.IDENTIFIER, Irep.justStringId(e.identifier())));
      case BYTE_EXTRACT: {
        String id = mm.isBigEndian() ? IrepId.BYTE_EXTRACT_BIG_ENDIAN
                                     : IrepId.BYTE_EXTRACT_LITTLE_ENDIAN;
        return new Irep(id, Arrays.asList(toIrep(e.operand(0)),
            toIrep(Expr.intConstant(e.value(), Types.SSIZE_T))), noNamed());
      }
      case STRING_CONSTANT:
        return new Irep(IrepId.STRING_CONSTANT, noSub(),
            single(IrepId.VALUE, Irep.justStringId(e.stringValue())));
      case BOOL_CONSTANT:
        return constantIrep(Irep.justId(e.boolValue() ? IrepId.TRUE
                                                      : IrepId.FALSE));
      case C_BOOL_CONSTANT:
        return constantIrep(Irep.justBitPatternId(e.value(),
                                                  mm.boolWidth()));
      case INT_CONSTANT: {
        // C integer widths are only known once the machine is
        int width = e.type().nativeWidth(mm);
        if (!BitUtil.fits(e.value(), width, e.type().isSigned(mm))) {
          throw new GotocRuntimeError("Constant " + e.value() +
              " does not fit in " + e.type() + " on " + mm.architecture());
        }
        return constantIrep(Irep.justBitPatternId(e.value(), width));
      }
      case FLOAT_CONSTANT:
        return constantIrep(Irep.justBitPatternId(e.value(), 32));
      case DOUBLE_CONSTANT:
        return constantIrep(Irep.justBitPatternId(e.value(), 64));
      case POINTER_CONSTANT:
        if (e.value().signum() == 0) {
          return constantIrep(Irep.justId(IrepId.NULL));
        }
        return constantIrep(Irep.justBitPatternId(e.value(),
                                                  mm.pointerWidth()));
      default:
        throw new GotocRuntimeError("Unknown expression kind " + e.kind());
    }
  }

  private Irep unaryIrep(Expr e) {
    List<Irep> ops = exprIreps(e.operands());
    switch (e.unaryOp()) {
      case COUNT_LEADING_ZEROS:
      case COUNT_TRAILING_ZEROS:
        return new Irep(e.unaryOp().irepId(), ops,
            single(IrepId.C_BOUNDS_CHECK, Irep.bool(!e.zeroPermitted())));
      case BSWAP:
        return new Irep(e.unaryOp().irepId(), ops,
            single(IrepId.BITS_PER_BYTE, Irep.justIntId(mm.charWidth())));
      default:
        return new Irep(e.unaryOp().irepId(), ops, noNamed());
    }
  }

  private Irep argumentsIrep(List<Expr> args) {
    return new Irep(IrepId.ARGUMENTS, exprIreps(args), noNamed());
  }

  private Irep opIrep(String id, Expr e) {
    return new Irep(id, exprIreps(e.operands()), noNamed());
  }

  private static Irep constantIrep(Irep value) {
    return new Irep(IrepId.CONSTANT, noSub(), single(IrepId.VALUE, value));
  }

  private static Irep sideEffectIrep(String statement, List<Irep> ops) {
    return new Irep(IrepId.SIDE_EFFECT, ops,
                    single(IrepId.STATEMENT, Irep.justId(statement)));
  }

  private List<Irep> exprIreps(List<Expr> exprs) {
    List<Irep> result = new ArrayList<Irep>(exprs.size());
    for (Expr e: exprs) {
      result.add(toIrep(e));
    }
    return result;
  }

  /*
   * Statements
   */

  public Irep toIrep(Stmt s) {
    Irep result = stmtBodyIrep(s).withLocation(s.location(), this);
    if (s.loopInvariant() != null) {
      result = result.withNamedSub(IrepId.C_SPEC_LOOP_INVARIANT,
                                   toIrep(s.loopInvariant()));
    }
    return result;
  }

  private Irep stmtBodyIrep(Stmt s) {
    List<Expr> exprs = s.exprs();
    List<Stmt> body = s.body();
    switch (s.kind()) {
      case ASSIGN:
        return codeIrep(IrepId.ASSIGN, exprIreps(exprs));
      case ASSERT:
        return codeIrep(IrepId.ASSERT, exprIreps(exprs));
      case ASSUME:
        return codeIrep(IrepId.ASSUME, exprIreps(exprs));
      case EXPRESSION:
        return codeIrep(IrepId.EXPRESSION, exprIreps(exprs));
      case DEAD:
        return codeIrep(IrepId.DEAD, exprIreps(exprs));
      case DECL:
        return codeIrep(IrepId.DECL, exprIreps(exprs));
      case ATOMIC_BLOCK: {
        List<Irep> stmts = new ArrayList<Irep>();
        stmts.add(codeIrep(IrepId.ATOMIC_BEGIN, noSub()));
        stmts.addAll(stmtIreps(body));
        stmts.add(codeIrep(IrepId.ATOMIC_END, noSub()));
        return codeIrep(IrepId.BLOCK, stmts);
      }
      case BLOCK:
        return codeIrep(IrepId.BLOCK, stmtIreps(body));
      case BREAK:
        return codeIrep(IrepId.BREAK, noSub());
      case CONTINUE:
        return codeIrep(IrepId.CONTINUE, noSub());
      case SKIP:
        return codeIrep(IrepId.SKIP, noSub());
      case FOR:
        return codeIrep(IrepId.FOR, Arrays.asList(toIrep(body.get(0)),
            toIrep(exprs.get(0)), toIrep(body.get(1)),
            toIrep(body.get(2))));
      case WHILE:
        return codeIrep(IrepId.WHILE, Arrays.asList(toIrep(exprs.get(0)),
                                                    toIrep(body.get(0))));
      case FUNCTION_CALL: {
        Expr lhs = s.callLhs();
        return codeIrep(IrepId.FUNCTION_CALL, Arrays.asList(
            lhs == null ? Irep.nil() : toIrep(lhs),
            toIrep(s.callFunction()),
            argumentsIrep(s.callArguments())));
      }
      case GOTO:
        return codeIrep(IrepId.GOTO, noSub()).withNamedSub(
            IrepId.DESTINATION, Irep.justStringId(s.label()));
      case IF_THEN_ELSE:
        return codeIrep(IrepId.IFTHENELSE, Arrays.asList(
            toIrep(exprs.get(0)), toIrep(body.get(0)),
            body.size() > 1 ? toIrep(body.get(1)) : Irep.nil()));
      case LABEL:
        return codeIrep(IrepId.LABEL, Arrays.asList(toIrep(body.get(0))))
            .withNamedSub(IrepId.LABEL, Irep.justStringId(s.label()));
      case RETURN:
        return codeIrep(IrepId.RETURN, Arrays.asList(
            exprs.isEmpty() ? Irep.nil() : toIrep(exprs.get(0))));
      case SWITCH: {
        Irep cases = codeIrep(IrepId.BLOCK, stmtIreps(body));
        return codeIrep(IrepId.SWITCH, Arrays.asList(toIrep(exprs.get(0)),
                                                     cases));
      }
      case SWITCH_CASE:
        if (s.isDefaultCase()) {
          return codeIrep(IrepId.SWITCH_CASE, Arrays.asList(Irep.nil(),
                                                  toIrep(body.get(0))))
                     .withNamedSub(IrepId.DEFAULT, Irep.one());
        }
        return codeIrep(IrepId.SWITCH_CASE, Arrays.asList(
                            toIrep(exprs.get(0)), toIrep(body.get(0))));
      default:
        throw new GotocRuntimeError("Unknown statement kind " + s.kind());
    }
  }

  private static Irep codeIrep(String statement, List<Irep> ops) {
    return new Irep(IrepId.CODE, ops,
                    single(IrepId.STATEMENT, Irep.justId(statement)));
  }

  private List<Irep> stmtIreps(List<Stmt> stmts) {
    List<Irep> result = new ArrayList<Irep>(stmts.size());
    for (Stmt s: stmts) {
      result.add(toIrep(s));
    }
    return result;
  }

  /*
   * Symbols
   */

  /**
   * Value of symbol as an irep, or nil if it has none
   */
  public Irep valueIrep(Symbol s) {
    if (s.value() != null) {
      return toIrep(s.value());
    } else if (s.body() != null) {
      return toIrep(s.body());
    } else {
      return Irep.nil();
    }
  }

  private static List<Irep> noSub() {
    return Collections.emptyList();
  }

  private static Map<String, Irep> noNamed() {
    return Collections.emptyMap();
  }

  private static Map<String, Irep> single(String key, Irep value) {
    Map<String, Irep> m = new LinkedHashMap<String, Irep>();
    m.put(key, value);
    return m;
  }
}
