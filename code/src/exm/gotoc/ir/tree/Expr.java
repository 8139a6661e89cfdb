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

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import org.apache.commons.lang3.StringUtils;

import exm.gotoc.common.exceptions.GotocRuntimeError;
import exm.gotoc.common.lang.InternedString;
import exm.gotoc.common.lang.Location;
import exm.gotoc.common.lang.MachineModel;
import exm.gotoc.common.lang.Types;
import exm.gotoc.common.lang.Types.ArrayType;
import exm.gotoc.common.lang.Types.BitVectorType;
import exm.gotoc.common.lang.Types.DatatypeComponent;
import exm.gotoc.common.lang.Types.Parameter;
import exm.gotoc.common.lang.Types.Type;
import exm.gotoc.common.lang.Types.TypeKind;
import exm.gotoc.common.util.BitUtil;
import exm.gotoc.ir.tree.Operators.BinaryOp;
import exm.gotoc.ir.tree.Operators.SelfOp;
import exm.gotoc.ir.tree.Operators.UnaryOp;

/**
 * A typed expression.  Immutable.
 *
 * Each expression has a kind, operands (number fixed by kind for most
 * kinds), a result type and a source location, plus a payload for
 * kinds that need one (operator, identifier, constant value).
 *
 * Expressions are built with the static factories and instance
 * methods below, which check arity and operand types.  Symbol
 * references are by name and are not checked against any table.
 */
public final class Expr {

  public static enum Kind {
    ADDRESS_OF(1),
    ARRAY(-1),
    ARRAY_OF(1),
    ASSIGN(2),
    BINARY(2),
    BOOL_CONSTANT(0),
    BYTE_EXTRACT(1),
    C_BOOL_CONSTANT(0),
    DEREFERENCE(1),
    DOUBLE_CONSTANT(0),
    EMPTY_UNION(0),
    FLOAT_CONSTANT(0),
    FUNCTION_CALL(-1),
    IF(3),
    INDEX(2),
    INT_CONSTANT(0),
    MEMBER(1),
    NONDET(0),
    POINTER_CONSTANT(0),
    SELF_OP(1),
    STATEMENT_EXPRESSION(0),
    STRING_CONSTANT(0),
    STRUCT(-1),
    SYMBOL(0),
    TYPECAST(1),
    UNARY(1),
    UNION(1),
    VECTOR(-1);

    /** Number of operands, or -1 if variable */
    public final int arity;

    private Kind(int arity) {
      this.arity = arity;
    }
  }

  private final Kind kind;
  private final Type type;
  private final Location location;
  private final List<Expr> operands;

  /** BinaryOp, UnaryOp or SelfOp */
  private final Enum<?> op;
  /** Symbol identifier, or component name for member/union */
  private final InternedString name;
  /** Constant value or bit pattern, byte extract offset */
  private final BigInteger value;
  private final String text;
  private final List<Stmt> statements;

  private Expr(Kind kind, Type type, Location location, List<Expr> operands,
               Enum<?> op, InternedString name, BigInteger value,
               String text, List<Stmt> statements) {
    if (type == null) {
      throw new GotocRuntimeError("Null type for " + kind + " expression");
    }
    if (kind.arity >= 0 && operands.size() != kind.arity) {
      throw new GotocRuntimeError(kind + " expects " + kind.arity +
          " operands but got " + operands.size());
    }
    for (Expr e: operands) {
      if (e == null) {
        throw new GotocRuntimeError("Null operand for " + kind);
      }
    }
    this.kind = kind;
    this.type = type;
    this.location = location;
    this.operands = Collections.unmodifiableList(
                                new ArrayList<Expr>(operands));
    this.op = op;
    this.name = name;
    this.value = value;
    this.text = text;
    this.statements = statements == null ? null :
          Collections.unmodifiableList(new ArrayList<Stmt>(statements));
  }

  private static Expr make(Kind kind, Type type, Expr... operands) {
    return new Expr(kind, type, Location.none(), Arrays.asList(operands),
                    null, null, null, null, null);
  }

  private static Expr makeList(Kind kind, Type type, List<Expr> operands) {
    return new Expr(kind, type, Location.none(), operands,
                    null, null, null, null, null);
  }

  private static Expr makeConstant(Kind kind, Type type, BigInteger value) {
    return new Expr(kind, type, Location.none(), Collections.<Expr>emptyList(),
                    null, null, value, null, null);
  }

  private static Expr makeOp(Kind kind, Type type, Enum<?> op,
                             Expr... operands) {
    return new Expr(kind, type, Location.none(), Arrays.asList(operands),
                    op, null, null, null, null);
  }

  /*
   * Accessors
   */

  public Kind kind() {
    return kind;
  }

  public Type type() {
    return type;
  }

  public Location location() {
    return location;
  }

  public List<Expr> operands() {
    return operands;
  }

  public Expr operand(int i) {
    return operands.get(i);
  }

  public BinaryOp binaryOp() {
    return (BinaryOp)op;
  }

  public UnaryOp unaryOp() {
    return (UnaryOp)op;
  }

  public SelfOp selfOp() {
    return (SelfOp)op;
  }

  /**
   * @return identifier of symbol, or component name of member/union
   *         expression
   */
  public String identifier() {
    return name == null ? null : name.toString();
  }

  /**
   * @return integer or pointer constant value, bit pattern of float
   *         constant, offset of byte extract
   */
  public BigInteger value() {
    return value;
  }

  public String stringValue() {
    return text;
  }

  public boolean boolValue() {
    return value.signum() != 0;
  }

  public float floatValue() {
    return Float.intBitsToFloat(value.intValue());
  }

  public double doubleValue() {
    return Double.longBitsToDouble(value.longValue());
  }

  /**
   * For count leading/trailing zeros: whether zero input is allowed
   */
  public boolean zeroPermitted() {
    return value != null && value.signum() != 0;
  }

  public List<Stmt> statements() {
    return statements;
  }

  /*
   * Copying
   */

  public Expr withLocation(Location loc) {
    return new Expr(kind, type, loc, operands, op, name, value, text,
                    statements);
  }

  /**
   * Same expression with new identifier (symbol) or component name
   * (member or union)
   */
  public Expr withIdentifier(String newName) {
    if (name == null) {
      throw new GotocRuntimeError(kind + " expression has no identifier");
    }
    return new Expr(kind, type, location, operands, op,
                    InternedString.of(newName), value, text, statements);
  }

  /**
   * Same kind and payload with different type and children.  Used by
   * transformations, which are responsible for keeping types
   * consistent.
   */
  public Expr rebuild(Type newType, List<Expr> newOperands,
                      List<Stmt> newStatements) {
    return new Expr(kind, newType, location, newOperands, op, name, value,
                    text, newStatements);
  }

  /*
   * Leaves
   */

  public static Expr symbol(String identifier, Type type) {
    return new Expr(Kind.SYMBOL, type, Location.none(),
              Collections.<Expr>emptyList(), null,
              InternedString.of(identifier), null, null, null);
  }

  public static Expr intConstant(long value, Type type) {
    return intConstant(BigInteger.valueOf(value), type);
  }

  public static Expr intConstant(BigInteger value, Type type) {
    if (!type.isInteger() && !type.isBitField()) {
      throw new GotocRuntimeError("Integer constant of non-integer type " +
                                  type);
    }
    if (type instanceof BitVectorType) {
      int w = ((BitVectorType)type).width();
      boolean signed = type.kind() == TypeKind.SIGNEDBV;
      if (!BitUtil.fits(value, w, signed)) {
        throw new GotocRuntimeError("Constant " + value +
                                    " does not fit in " + type);
      }
    }
    return makeConstant(Kind.INT_CONSTANT, type, value);
  }

  public static Expr boolConstant(boolean b) {
    return makeConstant(Kind.BOOL_CONSTANT, Types.BOOL,
                        b ? BigInteger.ONE : BigInteger.ZERO);
  }

  public static Expr trueExpr() {
    return boolConstant(true);
  }

  public static Expr falseExpr() {
    return boolConstant(false);
  }

  public static Expr cBoolConstant(boolean b) {
    return makeConstant(Kind.C_BOOL_CONSTANT, Types.C_BOOL,
                        b ? BigInteger.ONE : BigInteger.ZERO);
  }

  public static Expr floatConstant(float f) {
    long bits = Float.floatToRawIntBits(f) & 0xFFFFFFFFL;
    return makeConstant(Kind.FLOAT_CONSTANT, Types.FLOAT,
                        BigInteger.valueOf(bits));
  }

  public static Expr doubleConstant(double d) {
    long bits = Double.doubleToRawLongBits(d);
    return makeConstant(Kind.DOUBLE_CONSTANT, Types.DOUBLE,
              BitUtil.twosComplement(BigInteger.valueOf(bits), 64));
  }

  public static Expr pointerConstant(long value, Type pointerType) {
    if (!pointerType.isPointer()) {
      throw new GotocRuntimeError("Pointer constant of non-pointer type " +
                                  pointerType);
    }
    return makeConstant(Kind.POINTER_CONSTANT, pointerType,
                        BigInteger.valueOf(value));
  }

  public static Expr nullPointer(Type pointerType) {
    return pointerConstant(0, pointerType);
  }

  /**
   * Null-terminated C string.  Type is array of char including the
   * terminator.
   */
  public static Expr stringConstant(String s) {
    return new Expr(Kind.STRING_CONSTANT,
        Types.array(Types.C_CHAR, s.length() + 1), Location.none(),
        Collections.<Expr>emptyList(), null, null, null, s, null);
  }

  public static Expr nondet(Type type) {
    return make(Kind.NONDET, type);
  }

  /**
   * Zero of a numeric, pointer or boolean type
   */
  public static Expr zero(Type type) {
    switch (type.kind()) {
      case BOOL:
        return falseExpr();
      case FLOAT:
        return floatConstant(0.0f);
      case DOUBLE:
        return doubleConstant(0.0);
      case POINTER:
        return nullPointer(type);
      case C_INTEGER:
        if (type.equals(Types.C_BOOL)) {
          return cBoolConstant(false);
        }
        return intConstant(0, type);
      case SIGNEDBV:
      case UNSIGNEDBV:
        return intConstant(0, type);
      default:
        throw new GotocRuntimeError("No zero value for type " + type);
    }
  }

  public static Expr one(Type type) {
    switch (type.kind()) {
      case BOOL:
        return trueExpr();
      case FLOAT:
        return floatConstant(1.0f);
      case DOUBLE:
        return doubleConstant(1.0);
      case C_INTEGER:
        if (type.equals(Types.C_BOOL)) {
          return cBoolConstant(true);
        }
        return intConstant(1, type);
      case SIGNEDBV:
      case UNSIGNEDBV:
        return intConstant(1, type);
      default:
        throw new GotocRuntimeError("No one value for type " + type);
    }
  }

  public static Expr maxInt(Type type, MachineModel mm) {
    checkInteger(type, "maximum");
    return intConstant(BitUtil.maxValue(type.nativeWidth(mm),
                                        type.isSigned(mm)), type);
  }

  public static Expr minInt(Type type, MachineModel mm) {
    checkInteger(type, "minimum");
    return intConstant(BitUtil.minValue(type.nativeWidth(mm),
                                        type.isSigned(mm)), type);
  }

  private static void checkInteger(Type type, String what) {
    if (!type.isInteger()) {
      throw new GotocRuntimeError("No " + what + " value for " + type);
    }
  }

  /*
   * Aggregates
   */

  public static Expr array(Type arrayType, List<Expr> elems) {
    if (arrayType.kind() != TypeKind.ARRAY ||
        ((ArrayType)arrayType).size() != elems.size()) {
      throw new GotocRuntimeError("Array literal with " + elems.size() +
                                  " elements of type " + arrayType);
    }
    checkElems(arrayType.baseType(), elems);
    return makeList(Kind.ARRAY, arrayType, elems);
  }

  /**
   * Array with every element equal to elem
   */
  public static Expr arrayOf(Type arrayType, Expr elem) {
    if (!arrayType.isArrayLike() || !arrayType.baseType().equals(elem.type)) {
      throw new GotocRuntimeError("Cannot fill " + arrayType + " with " +
                                  elem.type);
    }
    return make(Kind.ARRAY_OF, arrayType, elem);
  }

  public static Expr vector(Type vectorType, List<Expr> elems) {
    if (!vectorType.isVector() ||
        ((ArrayType)vectorType).size() != elems.size()) {
      throw new GotocRuntimeError("Vector literal with " + elems.size() +
                                  " elements of type " + vectorType);
    }
    checkElems(vectorType.baseType(), elems);
    return makeList(Kind.VECTOR, vectorType, elems);
  }

  private static void checkElems(Type elemType, List<Expr> elems) {
    for (Expr e: elems) {
      if (!e.type.equals(elemType)) {
        throw new GotocRuntimeError("Element " + e + " should have type " +
                                    elemType);
      }
    }
  }

  /**
   * Struct literal.  If given the struct definition, values are checked
   * against its components, padding included.  Values for a struct tag
   * are checked when the table is validated.
   */
  public static Expr struct(Type structType, List<Expr> values) {
    if (!structType.isStructLike()) {
      throw new GotocRuntimeError("Struct literal of non-struct type " +
                                  structType);
    }
    if (structType.isStruct()) {
      List<DatatypeComponent> comps = structType.components();
      if (comps.size() != values.size()) {
        throw new GotocRuntimeError("Struct " + structType.tag() + " has " +
            comps.size() + " components but got " + values.size());
      }
      for (int i = 0; i < comps.size(); i++) {
        Type compType = comps.get(i).type();
        if (!compType.equals(values.get(i).type)) {
          throw new GotocRuntimeError("Component " + comps.get(i).name() +
              " has type " + compType + " but value has type " +
              values.get(i).type);
        }
      }
    }
    return makeList(Kind.STRUCT, structType, values);
  }

  public static Expr union(Type unionType, String field, Expr value) {
    if (!unionType.isUnionLike()) {
      throw new GotocRuntimeError("Union literal of non-union type " +
                                  unionType);
    }
    if (unionType.isUnion()) {
      Type fieldType = findComponent(unionType, field);
      if (!fieldType.equals(value.type)) {
        throw new GotocRuntimeError("Field " + field + " of " + unionType +
                                    " has type " + fieldType);
      }
    }
    return new Expr(Kind.UNION, unionType, Location.none(),
                    Arrays.asList(value), null, InternedString.of(field),
                    null, null, null);
  }

  public static Expr emptyUnion(Type unionType) {
    if (!unionType.isUnionLike()) {
      throw new GotocRuntimeError("Empty union of non-union type " +
                                  unionType);
    }
    return make(Kind.EMPTY_UNION, unionType);
  }

  private static Type findComponent(Type aggr, String field) {
    for (DatatypeComponent c: aggr.components()) {
      if (c.name().equals(field)) {
        return c.type();
      }
    }
    throw new GotocRuntimeError("No field " + field + " in " + aggr);
  }

  /**
   * Block of statements with a value: the value of the last
   * statement, which should be an expression statement
   */
  public static Expr statementExpression(List<Stmt> stmts, Type type) {
    if (stmts.isEmpty()) {
      throw new GotocRuntimeError("Statement expression cannot be empty");
    }
    return new Expr(Kind.STATEMENT_EXPRESSION, type, Location.none(),
        Collections.<Expr>emptyList(), null, null, null, null, stmts);
  }

  public static Expr ifThenElse(Expr cond, Expr t, Expr e) {
    if (!cond.type.isBool()) {
      throw new GotocRuntimeError("Condition must be boolean: " + cond);
    }
    if (!t.type.equals(e.type)) {
      throw new GotocRuntimeError("Branches have different types: " +
                                  t.type + " and " + e.type);
    }
    return make(Kind.IF, t.type, cond, t, e);
  }

  /*
   * Memory access
   */

  public boolean canTakeAddressOf() {
    switch (kind) {
      case SYMBOL:
      case DEREFERENCE:
      case STRING_CONSTANT:
        return true;
      case MEMBER:
      case INDEX:
        return operands.get(0).canTakeAddressOf();
      default:
        return false;
    }
  }

  public Expr addressOf() {
    if (!canTakeAddressOf()) {
      throw new GotocRuntimeError("Cannot take address of " + this);
    }
    return make(Kind.ADDRESS_OF, type.toPointer(), this);
  }

  public Expr dereference() {
    if (!type.isPointer()) {
      throw new GotocRuntimeError("Dereference of non-pointer " + this);
    }
    return make(Kind.DEREFERENCE, type.baseType(), this);
  }

  /**
   * Field of a struct or union.  If this has a struct or union
   * definition type the field is checked, otherwise the field type is
   * taken on trust.
   */
  public Expr member(String field, Type fieldType) {
    if (!type.isStructLike() && !type.isUnionLike()) {
      throw new GotocRuntimeError("Member access " + field +
                                  " on non-aggregate " + type);
    }
    if (type.components() != null) {
      Type actual = findComponent(type, field);
      if (!actual.equals(fieldType)) {
        throw new GotocRuntimeError("Field " + field + " has type " + actual
                                    + " not " + fieldType);
      }
    }
    return new Expr(Kind.MEMBER, fieldType, Location.none(),
                    Arrays.asList(this), null, InternedString.of(field),
                    null, null, null);
  }

  public Expr index(Expr idx) {
    if (!type.isArrayLike()) {
      throw new GotocRuntimeError("Index into non-array " + this);
    }
    if (!idx.type.isInteger()) {
      throw new GotocRuntimeError("Non-integer index " + idx);
    }
    return make(Kind.INDEX, type.baseType(), this, idx);
  }

  /**
   * Reinterpret the bytes of this at offset as type t
   */
  public Expr byteExtract(Type t, long offset) {
    if (offset < 0) {
      throw new GotocRuntimeError("Negative byte offset " + offset);
    }
    return new Expr(Kind.BYTE_EXTRACT, t, Location.none(),
                    Arrays.asList(this), null, null,
                    BigInteger.valueOf(offset), null, null);
  }

  /*
   * Calls and side effects
   */

  /**
   * Call this, which must have code type, with arguments.
   * Non-variadic functions need one argument per parameter; variadic
   * functions need at least one per declared parameter.
   */
  public Expr call(List<Expr> arguments) {
    checkCall(type, arguments);
    List<Expr> ops = new ArrayList<Expr>(arguments.size() + 1);
    ops.add(this);
    ops.addAll(arguments);
    return makeList(Kind.FUNCTION_CALL, type.returnType(), ops);
  }

  static void checkCall(Type fnType, List<Expr> arguments) {
    if (!fnType.isCode()) {
      throw new GotocRuntimeError("Callee is not a function: " + fnType);
    }
    List<Parameter> params = fnType.parameters();
    if (fnType.isVariadicCode() ? arguments.size() < params.size()
                                : arguments.size() != params.size()) {
      throw new GotocRuntimeError("Function of type " + fnType +
                        " called with " + arguments.size() + " arguments");
    }
    for (int i = 0; i < params.size(); i++) {
      Type argType = arguments.get(i).type;
      if (!params.get(i).type().equals(argType)) {
        throw new GotocRuntimeError("Argument " + i + " has type " + argType
                            + " but parameter has " + params.get(i).type());
      }
    }
  }

  public List<Expr> callArguments() {
    return operands.subList(1, operands.size());
  }

  /**
   * Assignment as a side effect expression, valued as the rhs
   */
  public Expr assign(Expr rhs) {
    if (!type.equals(rhs.type)) {
      throw new GotocRuntimeError("Assignment of " + rhs.type + " to " +
                                  type);
    }
    return make(Kind.ASSIGN, type, this, rhs);
  }

  public Expr selfOp(SelfOp selfOp) {
    if (!type.isInteger() && !type.isPointer() && !type.isFloatingPoint()) {
      throw new GotocRuntimeError(selfOp + " on " + type);
    }
    return makeOp(Kind.SELF_OP, type, selfOp, this);
  }

  public boolean isSideEffect() {
    switch (kind) {
      case ASSIGN:
      case FUNCTION_CALL:
      case NONDET:
      case SELF_OP:
      case STATEMENT_EXPRESSION:
        return true;
      default:
        for (Expr e: operands) {
          if (e.isSideEffect()) {
            return true;
          }
        }
        return false;
    }
  }

  /*
   * Casts
   */

  /**
   * Raw typecast.  Destination may not be a function type.
   */
  public Expr typecast(Type t) {
    if (t.isCode()) {
      throw new GotocRuntimeError("Cannot cast " + this + " to code type "
                                  + t);
    }
    return make(Kind.TYPECAST, t, this);
  }

  /**
   * C-style cast: no-op if types match; comparison with zero for
   * cast to bool.
   */
  public Expr castTo(Type t) {
    if (type.equals(t)) {
      return this;
    }
    if (!canCast(type, t)) {
      throw new GotocRuntimeError("Illegal cast from " + type + " to " + t);
    }
    if (t.isBool() && !type.isBool()) {
      return neq(zero(type));
    }
    return typecast(t);
  }

  private static boolean isScalar(Type t) {
    return t.isNumeric() || t.isBool() || t.isPointer() || t.isBitField();
  }

  private static boolean canCast(Type from, Type to) {
    if (to.isEmpty()) {
      return true;
    }
    return isScalar(from) && isScalar(to);
  }

  /*
   * Operators
   */

  public Expr binop(BinaryOp bop, Expr rhs) {
    Type result = binopResultType(bop, type, rhs.type);
    return makeOp(Kind.BINARY, result, bop, this, rhs);
  }

  private static Type binopResultType(BinaryOp bop, Type lt, Type rt) {
    boolean same = lt.equals(rt);
    boolean arith = same && (lt.isNumeric() || lt.isVector());
    boolean ptrInt = lt.isPointer() && rt.isInteger();
    switch (bop) {
      case AND:
      case OR:
      case XOR:
      case IMPLIES:
        if (lt.isBool() && rt.isBool()) {
          return Types.BOOL;
        }
        break;
      case EQUAL:
      case NOTEQUAL:
        if (same) {
          return Types.BOOL;
        }
        break;
      case LT:
      case LE:
      case GT:
      case GE:
        if (same && (lt.isNumeric() || lt.isPointer())) {
          return Types.BOOL;
        }
        break;
      case IEEE_FLOAT_EQUAL:
      case IEEE_FLOAT_NOTEQUAL:
        if (same && lt.isFloatingPoint()) {
          return Types.BOOL;
        }
        break;
      case BITAND:
      case BITNAND:
      case BITOR:
      case BITXOR:
        if (same && (lt.isInteger() || lt.isBool() || lt.isVector())) {
          return lt;
        }
        break;
      case ASHR:
      case LSHR:
      case SHL:
      case ROL:
      case ROR:
        if ((lt.isInteger() || lt.isVector()) && rt.isInteger()) {
          return lt;
        }
        break;
      case PLUS:
        if (arith || ptrInt) {
          return lt;
        }
        break;
      case MINUS:
        if (arith || ptrInt) {
          return lt;
        }
        if (same && lt.isPointer()) {
          return Types.SSIZE_T;
        }
        break;
      case MULT:
      case DIV:
      case MOD:
        if (arith) {
          return lt;
        }
        break;
      case OVERFLOW_PLUS:
      case OVERFLOW_MINUS:
        if ((same && lt.isInteger()) || ptrInt) {
          return Types.BOOL;
        }
        break;
      case OVERFLOW_MULT:
        if (same && lt.isInteger()) {
          return Types.BOOL;
        }
        break;
      case OVERFLOW_RESULT_PLUS:
      case OVERFLOW_RESULT_MINUS:
      case OVERFLOW_RESULT_MULT:
        if (same && lt.isInteger()) {
          return overflowResultType(lt);
        }
        break;
      case R_OK:
        if (lt.isPointer() && rt.isInteger()) {
          return Types.BOOL;
        }
        break;
      default:
        throw new GotocRuntimeError("Unknown operator " + bop);
    }
    throw new GotocRuntimeError("Operator " + bop + " not defined for " +
                                lt + " and " + rt);
  }

  /**
   * Struct holding an arithmetic result and whether it overflowed
   */
  public static Type overflowResultType(Type operandType) {
    return Types.structType("overflow_result_" + operandType.toIdentifier(),
        Arrays.asList(DatatypeComponent.field("result", operandType),
                      DatatypeComponent.field("overflowed", Types.BOOL)));
  }

  public Expr unop(UnaryOp uop) {
    return makeOp(Kind.UNARY, unopResultType(uop, type), uop, this);
  }

  public Expr countLeadingZeros(boolean allowZero) {
    return countZeros(UnaryOp.COUNT_LEADING_ZEROS, allowZero);
  }

  public Expr countTrailingZeros(boolean allowZero) {
    return countZeros(UnaryOp.COUNT_TRAILING_ZEROS, allowZero);
  }

  private Expr countZeros(UnaryOp uop, boolean allowZero) {
    return new Expr(Kind.UNARY, unopResultType(uop, type), Location.none(),
        Arrays.asList(this), uop, null,
        allowZero ? BigInteger.ONE : BigInteger.ZERO, null, null);
  }

  private static Type unopResultType(UnaryOp uop, Type t) {
    switch (uop) {
      case NOT:
        if (t.isBool()) {
          return t;
        }
        break;
      case BITNOT:
        if (t.isInteger() || t.isBool()) {
          return t;
        }
        break;
      case UNARY_MINUS:
        if (t.isNumeric() || t.isVector()) {
          return t;
        }
        break;
      case BIT_REVERSE:
      case BSWAP:
      case POPCOUNT:
      case COUNT_LEADING_ZEROS:
      case COUNT_TRAILING_ZEROS:
        if (t.isInteger()) {
          return t;
        }
        break;
      case IS_FINITE:
        if (t.isFloatingPoint()) {
          return Types.BOOL;
        }
        break;
      case IS_DYNAMIC_OBJECT:
        if (t.isPointer()) {
          return Types.BOOL;
        }
        break;
      case OBJECT_SIZE:
      case POINTER_OBJECT:
        if (t.isPointer()) {
          return Types.SIZE_T;
        }
        break;
      case POINTER_OFFSET:
        if (t.isPointer()) {
          return Types.SSIZE_T;
        }
        break;
      default:
        throw new GotocRuntimeError("Unknown operator " + uop);
    }
    throw new GotocRuntimeError("Operator " + uop + " not defined for " + t);
  }

  public Expr plus(Expr e) {
    return binop(BinaryOp.PLUS, e);
  }

  public Expr minus(Expr e) {
    return binop(BinaryOp.MINUS, e);
  }

  public Expr mul(Expr e) {
    return binop(BinaryOp.MULT, e);
  }

  public Expr eq(Expr e) {
    return binop(BinaryOp.EQUAL, e);
  }

  public Expr neq(Expr e) {
    return binop(BinaryOp.NOTEQUAL, e);
  }

  public Expr lt(Expr e) {
    return binop(BinaryOp.LT, e);
  }

  public Expr le(Expr e) {
    return binop(BinaryOp.LE, e);
  }

  public Expr and(Expr e) {
    return binop(BinaryOp.AND, e);
  }

  public Expr or(Expr e) {
    return binop(BinaryOp.OR, e);
  }

  public Expr not() {
    return unop(UnaryOp.NOT);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Expr)) {
      return false;
    }
    Expr other = (Expr)o;
    return kind == other.kind && type.equals(other.type) &&
           location.equals(other.location) &&
           operands.equals(other.operands) && op == other.op &&
           name == other.name && Objects.equals(value, other.value) &&
           Objects.equals(text, other.text) &&
           Objects.equals(statements, other.statements);
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, type, operands, op, name, value, text);
  }

  @Override
  public String toString() {
    switch (kind) {
      case SYMBOL:
        return name.toString();
      case INT_CONSTANT:
      case POINTER_CONSTANT:
        return value.toString();
      case BOOL_CONSTANT:
      case C_BOOL_CONSTANT:
        return Boolean.toString(boolValue());
      case FLOAT_CONSTANT:
        return floatValue() + "f";
      case DOUBLE_CONSTANT:
        return Double.toString(doubleValue());
      case STRING_CONSTANT:
        return "\"" + text + "\"";
      case MEMBER:
        return operands.get(0) + "." + name;
      default:
        StringBuilder sb = new StringBuilder();
        sb.append(op != null ? op.toString().toLowerCase()
                             : kind.toString().toLowerCase());
        sb.append("(").append(StringUtils.join(operands, ", "));
        sb.append(")");
        return sb.toString();
    }
  }
}
