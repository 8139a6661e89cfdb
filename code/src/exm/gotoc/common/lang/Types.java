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

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import exm.gotoc.common.exceptions.GotocRuntimeError;
import exm.gotoc.common.exceptions.LayoutException;
import exm.gotoc.ir.tree.Symbol;
import exm.gotoc.ir.tree.SymbolTable;

/**
 * This module provides the type definitions used for goto programs,
 * along with convenience functions for creating, checking and
 * querying types.
 *
 * The base class for all types is Type.  Types are immutable values
 * compared structurally.  Struct and union types are referred to
 * elsewhere by tag (see {@link TagType}), which is resolved by name
 * against a symbol table whenever the full definition is needed.
 */
public class Types {

  /** Prefix of symbol names for struct and union type declarations */
  public static final String TAG_PREFIX = "tag-";

  public static enum TypeKind {
    ARRAY,
    BOOL,
    C_BIT_FIELD,
    C_INTEGER,
    CODE,
    CONSTRUCTOR,
    DOUBLE,
    EMPTY,
    FLEXIBLE_ARRAY,
    FLOAT,
    INCOMPLETE_STRUCT,
    INCOMPLETE_UNION,
    INFINITE_ARRAY,
    POINTER,
    SIGNEDBV,
    STRUCT,
    STRUCT_TAG,
    UNION,
    UNION_TAG,
    UNSIGNEDBV,
    VARIADIC_CODE,
    VECTOR,
  }

  /**
   * C integer types whose width depends on the machine
   */
  public static enum CIntKind {
    BOOL("c_bool", "_Bool"),
    CHAR("char", "char"),
    INT("int", "int"),
    LONG_INT("long_int", "long int"),
    SIZE_T("size_t", "size_t"),
    SSIZE_T("ssize_t", "ssize_t");

    private final String identifier;
    private final String cName;

    private CIntKind(String identifier, String cName) {
      this.identifier = identifier;
      this.cName = cName;
    }

    public int width(MachineModel mm) {
      switch (this) {
        case BOOL:
          return mm.boolWidth();
        case CHAR:
          return mm.charWidth();
        case INT:
          return mm.intWidth();
        case LONG_INT:
          return mm.longIntWidth();
        case SIZE_T:
        case SSIZE_T:
          return mm.pointerWidth();
        default:
          throw new GotocRuntimeError("Unknown int kind " + this);
      }
    }

    public boolean isSigned(MachineModel mm) {
      switch (this) {
        case BOOL:
        case SIZE_T:
          return false;
        case CHAR:
          return !mm.charIsUnsigned();
        case INT:
        case LONG_INT:
        case SSIZE_T:
          return true;
        default:
          throw new GotocRuntimeError("Unknown int kind " + this);
      }
    }
  }

  public abstract static class Type {
    private final TypeKind kind;

    protected Type(TypeKind kind) {
      this.kind = kind;
    }

    public TypeKind kind() {
      return kind;
    }

    /**
     * @return element, pointee or bit-field base type, or null
     *         if this type does not wrap another
     */
    public Type baseType() {
      return null;
    }

    /**
     * Size of a value of this type.
     * @param st table to resolve struct and union tags in
     * @param mm machine to take widths from
     * @throws LayoutException if a tag can't be resolved, or the type
     *              has no size
     */
    public abstract long sizeInBits(SymbolTable st, MachineModel mm)
        throws LayoutException;

    public long sizeInBits(SymbolTable st) throws LayoutException {
      return sizeInBits(st, st.machineModel());
    }

    /**
     * Size in bytes
     */
    public long sizeOf(SymbolTable st) throws LayoutException {
      long bits = sizeInBits(st);
      int charWidth = st.machineModel().charWidth();
      if (bits % charWidth != 0) {
        throw new LayoutException("Size of " + this + " is " + bits +
                        " bits, not a whole number of bytes");
      }
      return bits / charWidth;
    }

    /**
     * @return width of scalar value on the given machine, or null if
     *         not a scalar with a fixed width
     */
    public Integer nativeWidth(MachineModel mm) {
      return null;
    }

    /**
     * Struct or union tag name as written in source, or null
     */
    public String tag() {
      return null;
    }

    /**
     * Name of symbol declaring this aggregate type, or null if
     * this is not a struct or union
     */
    public String aggrTag() {
      return null;
    }

    /**
     * Fields of a struct or union definition, null otherwise
     */
    public List<DatatypeComponent> components() {
      return null;
    }

    public List<Parameter> parameters() {
      return null;
    }

    public Type returnType() {
      return null;
    }

    /**
     * Short name of type if it has one (C integer name or aggregate tag)
     */
    public String typeName() {
      return null;
    }

    /**
     * A string usable as part of a C identifier, unique per type
     */
    public abstract String toIdentifier();

    public boolean isSigned(MachineModel mm) {
      return false;
    }

    public boolean isUnsigned(MachineModel mm) {
      return isInteger() && !isSigned(mm);
    }

    /**
     * Check if this completes an incomplete declaration of the same
     * aggregate, e.g. a struct definition for an incomplete struct
     */
    public boolean completes(Type other) {
      return false;
    }

    public boolean isBool() {
      return kind == TypeKind.BOOL;
    }

    public boolean isCInteger() {
      return kind == TypeKind.C_INTEGER;
    }

    public boolean isInteger() {
      return kind == TypeKind.C_INTEGER || kind == TypeKind.SIGNEDBV ||
             kind == TypeKind.UNSIGNEDBV;
    }

    public boolean isFloatingPoint() {
      return kind == TypeKind.FLOAT || kind == TypeKind.DOUBLE;
    }

    public boolean isNumeric() {
      return isInteger() || isFloatingPoint();
    }

    public boolean isPointer() {
      return kind == TypeKind.POINTER;
    }

    public boolean isCode() {
      return kind == TypeKind.CODE || kind == TypeKind.VARIADIC_CODE;
    }

    public boolean isVariadicCode() {
      return kind == TypeKind.VARIADIC_CODE;
    }

    public boolean isBitField() {
      return kind == TypeKind.C_BIT_FIELD;
    }

    public boolean isVector() {
      return kind == TypeKind.VECTOR;
    }

    public boolean isArray() {
      return kind == TypeKind.ARRAY;
    }

    public boolean isArrayLike() {
      return kind == TypeKind.ARRAY || kind == TypeKind.FLEXIBLE_ARRAY ||
             kind == TypeKind.INFINITE_ARRAY || kind == TypeKind.VECTOR;
    }

    public boolean isStruct() {
      return kind == TypeKind.STRUCT;
    }

    public boolean isUnion() {
      return kind == TypeKind.UNION;
    }

    public boolean isStructLike() {
      return kind == TypeKind.STRUCT || kind == TypeKind.STRUCT_TAG;
    }

    public boolean isUnionLike() {
      return kind == TypeKind.UNION || kind == TypeKind.UNION_TAG;
    }

    public boolean isAggregateTag() {
      return kind == TypeKind.STRUCT_TAG || kind == TypeKind.UNION_TAG;
    }

    public boolean isIncomplete() {
      return kind == TypeKind.INCOMPLETE_STRUCT ||
             kind == TypeKind.INCOMPLETE_UNION;
    }

    public boolean isEmpty() {
      return kind == TypeKind.EMPTY;
    }

    /**
     * Whether values of this type can appear on the left of an assignment
     */
    public boolean isLvalue() {
      return !isCode() && kind != TypeKind.EMPTY &&
             kind != TypeKind.CONSTRUCTOR;
    }

    public boolean isPointerWidth(MachineModel mm) {
      Integer w = nativeWidth(mm);
      return w != null && w == mm.pointerWidth();
    }

    /**
     * Equal, or integers of identical width and signedness on this
     * machine
     */
    public boolean isEqualOnMachine(Type other, MachineModel mm) {
      if (this.equals(other)) {
        return true;
      }
      if (isInteger() && other.isInteger()) {
        return nativeWidth(mm).equals(other.nativeWidth(mm)) &&
               isSigned(mm) == other.isSigned(mm);
      }
      return false;
    }

    /**
     * Fields of struct or union, resolving tags through table
     * @throws LayoutException if the tag doesn't resolve, or this is
     *                    not a struct or union
     */
    public List<DatatypeComponent> lookupComponents(SymbolTable st)
        throws LayoutException {
      if (components() != null) {
        return components();
      }
      throw new LayoutException("Type " + this + " has no components");
    }

    /**
     * Type of named field of a struct or union
     * @return the field type, or null if no such field
     */
    public Type lookupFieldType(String field, SymbolTable st)
        throws LayoutException {
      for (DatatypeComponent c: lookupComponents(st)) {
        if (c.name().equals(field)) {
          return c.type();
        }
      }
      return null;
    }

    public PointerType toPointer() {
      return new PointerType(this);
    }

    public ArrayType arrayOf(long size) {
      return array(this, size);
    }

    public BitFieldType asBitfield(int width) {
      return new BitFieldType(this, width);
    }

    public ArrayType toVector(long size) {
      return vector(this, size);
    }

    @Override
    public abstract boolean equals(Object other);

    @Override
    public abstract int hashCode();

    /** Prints out a C-like description of the type */
    @Override
    public abstract String toString();
  }

  /**
   * Types with no parameters
   */
  public static class PrimType extends Type {
    private PrimType(TypeKind kind) {
      super(kind);
    }

    @Override
    public long sizeInBits(SymbolTable st, MachineModel mm)
        throws LayoutException {
      switch (kind()) {
        case DOUBLE:
          return mm.doubleWidth();
        case FLOAT:
          return mm.floatWidth();
        case EMPTY:
          return 0;
        default:
          throw new LayoutException("Type " + this + " has no size");
      }
    }

    @Override
    public Integer nativeWidth(MachineModel mm) {
      switch (kind()) {
        case DOUBLE:
          return mm.doubleWidth();
        case FLOAT:
          return mm.floatWidth();
        default:
          return null;
      }
    }

    @Override
    public boolean isSigned(MachineModel mm) {
      return isFloatingPoint();
    }

    @Override
    public String toIdentifier() {
      return kind().name().toLowerCase();
    }

    @Override
    public boolean equals(Object other) {
      return other instanceof PrimType &&
             ((PrimType)other).kind() == kind();
    }

    @Override
    public int hashCode() {
      return kind().hashCode();
    }

    @Override
    public String toString() {
      switch (kind()) {
        case EMPTY:
          return "void";
        default:
          return kind().name().toLowerCase();
      }
    }
  }

  public static class CIntegerType extends Type {
    private final CIntKind intKind;

    private CIntegerType(CIntKind intKind) {
      super(TypeKind.C_INTEGER);
      this.intKind = intKind;
    }

    public CIntKind intKind() {
      return intKind;
    }

    @Override
    public long sizeInBits(SymbolTable st, MachineModel mm) {
      return intKind.width(mm);
    }

    @Override
    public Integer nativeWidth(MachineModel mm) {
      return intKind.width(mm);
    }

    @Override
    public boolean isSigned(MachineModel mm) {
      return intKind.isSigned(mm);
    }

    @Override
    public String typeName() {
      return intKind.cName;
    }

    @Override
    public String toIdentifier() {
      return intKind.identifier;
    }

    @Override
    public boolean equals(Object other) {
      return other instanceof CIntegerType &&
             ((CIntegerType)other).intKind == intKind;
    }

    @Override
    public int hashCode() {
      return intKind.hashCode() * 7 + 1;
    }

    @Override
    public String toString() {
      return intKind.cName;
    }
  }

  /**
   * Signed or unsigned bit-vector of fixed width
   */
  public static class BitVectorType extends Type {
    private final int width;

    private BitVectorType(boolean signed, int width) {
      super(signed ? TypeKind.SIGNEDBV : TypeKind.UNSIGNEDBV);
      if (width <= 0) {
        throw new GotocRuntimeError("Bit-vector width must be positive: "
                                    + width);
      }
      this.width = width;
    }

    public int width() {
      return width;
    }

    @Override
    public long sizeInBits(SymbolTable st, MachineModel mm) {
      return width;
    }

    @Override
    public Integer nativeWidth(MachineModel mm) {
      return width;
    }

    @Override
    public boolean isSigned(MachineModel mm) {
      return kind() == TypeKind.SIGNEDBV;
    }

    @Override
    public String toIdentifier() {
      return (kind() == TypeKind.SIGNEDBV ? "signed_" : "unsigned_") +
             width + "_bit";
    }

    @Override
    public boolean equals(Object other) {
      if (!(other instanceof BitVectorType)) {
        return false;
      }
      BitVectorType o = (BitVectorType)other;
      return o.kind() == kind() && o.width == width;
    }

    @Override
    public int hashCode() {
      return kind().hashCode() * 31 + width;
    }

    @Override
    public String toString() {
      return (kind() == TypeKind.SIGNEDBV ? "int" : "uint") + width;
    }
  }

  public static class BitFieldType extends Type {
    private final Type base;
    private final int width;

    private BitFieldType(Type base, int width) {
      super(TypeKind.C_BIT_FIELD);
      if (width <= 0) {
        throw new GotocRuntimeError("Bit-field width must be positive: " +
                                    width);
      }
      if (!base.isInteger()) {
        throw new GotocRuntimeError("Bit-field base must be an integer: " +
                                    base);
      }
      if (base instanceof BitVectorType &&
          ((BitVectorType)base).width() < width) {
        throw new GotocRuntimeError("Bit-field of width " + width +
                                    " wider than base type " + base);
      }
      this.base = base;
      this.width = width;
    }

    public int width() {
      return width;
    }

    @Override
    public Type baseType() {
      return base;
    }

    @Override
    public long sizeInBits(SymbolTable st, MachineModel mm)
        throws LayoutException {
      throw new LayoutException("Bit-field " + this +
                                " has no size outside a struct");
    }

    @Override
    public Integer nativeWidth(MachineModel mm) {
      return width;
    }

    @Override
    public boolean isSigned(MachineModel mm) {
      return base.isSigned(mm);
    }

    @Override
    public String toIdentifier() {
      return "cbitfield_of_" + width + "_" + base.toIdentifier();
    }

    @Override
    public boolean equals(Object other) {
      if (!(other instanceof BitFieldType)) {
        return false;
      }
      BitFieldType o = (BitFieldType)other;
      return o.width == width && o.base.equals(base);
    }

    @Override
    public int hashCode() {
      return base.hashCode() * 17 + width;
    }

    @Override
    public String toString() {
      return base + ":" + width;
    }
  }

  /**
   * Array, flexible array, infinite array or vector
   */
  public static class ArrayType extends Type {
    private final Type elem;
    private final long size; // -1 if no size

    private ArrayType(TypeKind kind, Type elem, long size) {
      super(kind);
      this.elem = elem;
      this.size = size;
    }

    /**
     * @return number of elements, or -1 if flexible or infinite
     */
    public long size() {
      return size;
    }

    @Override
    public Type baseType() {
      return elem;
    }

    @Override
    public long sizeInBits(SymbolTable st, MachineModel mm)
        throws LayoutException {
      switch (kind()) {
        case ARRAY:
        case VECTOR:
          try {
            return Math.multiplyExact(elem.sizeInBits(st, mm), size);
          } catch (ArithmeticException e) {
            throw new LayoutException("Size of " + this +
                                      " overflows 64 bits");
          }
        case FLEXIBLE_ARRAY:
          return 0;
        default:
          throw new LayoutException("Type " + this + " has no size");
      }
    }

    @Override
    public String toIdentifier() {
      switch (kind()) {
        case ARRAY:
          return "array_of_" + size + "_" + elem.toIdentifier();
        case VECTOR:
          return "vec_of_" + size + "_" + elem.toIdentifier();
        case FLEXIBLE_ARRAY:
          return "flexarray_of_" + elem.toIdentifier();
        default:
          return "infinite_array_of_" + elem.toIdentifier();
      }
    }

    @Override
    public boolean equals(Object other) {
      if (!(other instanceof ArrayType)) {
        return false;
      }
      ArrayType o = (ArrayType)other;
      return o.kind() == kind() && o.size == size && o.elem.equals(elem);
    }

    @Override
    public int hashCode() {
      return Objects.hash(kind(), elem, size);
    }

    @Override
    public String toString() {
      switch (kind()) {
        case ARRAY:
          return elem + "[" + size + "]";
        case VECTOR:
          return "vector(" + elem + ", " + size + ")";
        case FLEXIBLE_ARRAY:
          return elem + "[]";
        default:
          return elem + "[inf]";
      }
    }
  }

  public static class PointerType extends Type {
    private final Type pointee;

    private PointerType(Type pointee) {
      super(TypeKind.POINTER);
      this.pointee = pointee;
    }

    @Override
    public Type baseType() {
      return pointee;
    }

    @Override
    public long sizeInBits(SymbolTable st, MachineModel mm) {
      return mm.pointerWidth();
    }

    @Override
    public Integer nativeWidth(MachineModel mm) {
      return mm.pointerWidth();
    }

    @Override
    public String toIdentifier() {
      return "pointer_to_" + pointee.toIdentifier();
    }

    @Override
    public boolean equals(Object other) {
      return other instanceof PointerType &&
             ((PointerType)other).pointee.equals(pointee);
    }

    @Override
    public int hashCode() {
      return pointee.hashCode() * 13 + 5;
    }

    @Override
    public String toString() {
      return pointee + "*";
    }
  }

  /**
   * Full definition of a struct or union
   */
  public static class StructUnionType extends Type {
    private final InternedString tag;
    private final List<DatatypeComponent> components;

    private StructUnionType(TypeKind kind, String tag,
                            List<DatatypeComponent> components) {
      super(kind);
      Set<String> names = new HashSet<String>();
      for (DatatypeComponent c: components) {
        if (!names.add(c.name())) {
          throw new GotocRuntimeError("Duplicate component name " + c.name()
                                      + " in " + kind + " " + tag);
        }
      }
      this.tag = InternedString.of(tag);
      this.components = Collections.unmodifiableList(
                          new ArrayList<DatatypeComponent>(components));
    }

    @Override
    public String tag() {
      return tag.toString();
    }

    @Override
    public String aggrTag() {
      return aggrTagName(tag.toString());
    }

    @Override
    public List<DatatypeComponent> components() {
      return components;
    }

    @Override
    public String typeName() {
      return aggrTag();
    }

    @Override
    public long sizeInBits(SymbolTable st, MachineModel mm)
        throws LayoutException {
      long result = 0;
      for (DatatypeComponent c: components) {
        long size = c.sizeInBits(st, mm);
        if (kind() == TypeKind.STRUCT) {
          try {
            result = Math.addExact(result, size);
          } catch (ArithmeticException e) {
            throw new LayoutException(aggrTag(), null, "size of " + this +
                                      " overflows 64 bits");
          }
        } else {
          result = Math.max(result, size);
        }
      }
      return result;
    }

    @Override
    public boolean completes(Type other) {
      if (kind() == TypeKind.STRUCT) {
        return other.kind() == TypeKind.INCOMPLETE_STRUCT &&
               tag().equals(other.tag());
      } else {
        return other.kind() == TypeKind.INCOMPLETE_UNION &&
               tag().equals(other.tag());
      }
    }

    @Override
    public String toIdentifier() {
      return identifierChars(tag.toString());
    }

    @Override
    public boolean equals(Object other) {
      if (!(other instanceof StructUnionType)) {
        return false;
      }
      StructUnionType o = (StructUnionType)other;
      return o.kind() == kind() && o.tag == tag &&
             o.components.equals(components);
    }

    @Override
    public int hashCode() {
      return Objects.hash(kind(), tag, components);
    }

    @Override
    public String toString() {
      StringBuilder sb = new StringBuilder();
      sb.append(kind() == TypeKind.STRUCT ? "struct " : "union ");
      sb.append(tag).append(" {");
      boolean first = true;
      for (DatatypeComponent c: components) {
        if (!first) {
          sb.append(",");
        }
        first = false;
        sb.append(" ").append(c);
      }
      sb.append(" }");
      return sb.toString();
    }
  }

  /**
   * Reference to an aggregate by tag, or an incomplete aggregate
   * declaration.
   */
  public static class TagType extends Type {
    /** For tag refs, name of the declaring symbol; otherwise source tag */
    private final InternedString tag;

    private TagType(TypeKind kind, String tag) {
      super(kind);
      this.tag = InternedString.of(tag);
    }

    /**
     * For a struct or union tag reference, the name of the symbol
     * declaring the type.
     */
    public String identifier() {
      return tag.toString();
    }

    @Override
    public String tag() {
      if (isAggregateTag()) {
        return stripTagPrefix(tag.toString());
      }
      return tag.toString();
    }

    @Override
    public String aggrTag() {
      if (isAggregateTag()) {
        return tag.toString();
      }
      return aggrTagName(tag.toString());
    }

    @Override
    public String typeName() {
      return aggrTag();
    }

    /**
     * Look up the declaration this tag refers to
     * @throws LayoutException if missing or of the wrong kind
     */
    public Type resolve(SymbolTable st) throws LayoutException {
      if (!isAggregateTag()) {
        return this;
      }
      Symbol sym = st.lookup(tag.toString());
      if (sym == null) {
        throw new LayoutException(tag.toString(), null,
                              "tag " + tag + " not found in symbol table");
      }
      Type decl = sym.type();
      boolean structRef = kind() == TypeKind.STRUCT_TAG;
      boolean ok;
      if (structRef) {
        ok = decl.kind() == TypeKind.STRUCT ||
             decl.kind() == TypeKind.INCOMPLETE_STRUCT;
      } else {
        ok = decl.kind() == TypeKind.UNION ||
             decl.kind() == TypeKind.INCOMPLETE_UNION;
      }
      if (!ok) {
        throw new LayoutException(tag.toString(), sym.location(),
            (structRef ? "struct" : "union") + " tag " + tag +
            " refers to " + decl);
      }
      return decl;
    }

    @Override
    public long sizeInBits(SymbolTable st, MachineModel mm)
        throws LayoutException {
      if (isIncomplete()) {
        throw new LayoutException("Incomplete type " + this +
                                  " has no size");
      }
      return resolve(st).sizeInBits(st, mm);
    }

    @Override
    public List<DatatypeComponent> lookupComponents(SymbolTable st)
        throws LayoutException {
      Type decl = resolve(st);
      if (decl.isIncomplete()) {
        throw new LayoutException("Incomplete type " + decl +
                                  " has no components");
      }
      return decl.lookupComponents(st);
    }

    @Override
    public boolean completes(Type other) {
      return false;
    }

    @Override
    public String toIdentifier() {
      return identifierChars(tag.toString());
    }

    @Override
    public boolean equals(Object other) {
      if (!(other instanceof TagType)) {
        return false;
      }
      TagType o = (TagType)other;
      return o.kind() == kind() && o.tag == tag;
    }

    @Override
    public int hashCode() {
      return kind().hashCode() * 37 + tag.hashCode();
    }

    @Override
    public String toString() {
      switch (kind()) {
        case STRUCT_TAG:
          return "struct " + tag();
        case UNION_TAG:
          return "union " + tag();
        case INCOMPLETE_STRUCT:
          return "struct " + tag + " (incomplete)";
        default:
          return "union " + tag + " (incomplete)";
      }
    }
  }

  public static class CodeType extends Type {
    private final List<Parameter> parameters;
    private final Type returnType;

    private CodeType(boolean variadic, List<Parameter> parameters,
                     Type returnType) {
      super(variadic ? TypeKind.VARIADIC_CODE : TypeKind.CODE);
      this.parameters = Collections.unmodifiableList(
                            new ArrayList<Parameter>(parameters));
      this.returnType = returnType;
    }

    @Override
    public List<Parameter> parameters() {
      return parameters;
    }

    @Override
    public Type returnType() {
      return returnType;
    }

    @Override
    public long sizeInBits(SymbolTable st, MachineModel mm)
        throws LayoutException {
      if (isVariadicCode()) {
        throw new LayoutException("Variadic code type has no size");
      }
      return 0;
    }

    @Override
    public String toIdentifier() {
      StringBuilder sb = new StringBuilder();
      sb.append(isVariadicCode() ? "variadic_code_from_" : "code_from_");
      for (Parameter p: parameters) {
        sb.append(p.type().toIdentifier()).append("_");
      }
      sb.append("to_").append(returnType.toIdentifier());
      return sb.toString();
    }

    @Override
    public boolean equals(Object other) {
      if (!(other instanceof CodeType)) {
        return false;
      }
      CodeType o = (CodeType)other;
      return o.kind() == kind() && o.parameters.equals(parameters) &&
             o.returnType.equals(returnType);
    }

    @Override
    public int hashCode() {
      return Objects.hash(kind(), parameters, returnType);
    }

    @Override
    public String toString() {
      StringBuilder sb = new StringBuilder();
      sb.append(returnType).append("(");
      boolean first = true;
      for (Parameter p: parameters) {
        if (!first) {
          sb.append(", ");
        }
        first = false;
        sb.append(p.type());
      }
      if (isVariadicCode()) {
        sb.append(first ? "..." : ", ...");
      }
      sb.append(")");
      return sb.toString();
    }
  }

  /**
   * A field or explicit padding in a struct or union.
   */
  public static class DatatypeComponent {
    private final InternedString name;
    private final Type type; // null for padding
    private final int paddingBits;

    private DatatypeComponent(String name, Type type, int paddingBits) {
      this.name = InternedString.of(name);
      this.type = type;
      this.paddingBits = paddingBits;
    }

    public static DatatypeComponent field(String name, Type type) {
      if (type.isCode() || type.isEmpty()) {
        throw new GotocRuntimeError("Invalid type for field " + name +
                                    ": " + type);
      }
      return new DatatypeComponent(name, type, 0);
    }

    public static DatatypeComponent padding(String name, int bits) {
      if (bits <= 0) {
        throw new GotocRuntimeError("Padding must be positive: " + bits);
      }
      return new DatatypeComponent(name, null, bits);
    }

    public String name() {
      return name.toString();
    }

    public boolean isPadding() {
      return type == null;
    }

    /**
     * @return field type, or for padding an unsigned bit-vector of
     *         the padding width
     */
    public Type type() {
      if (type == null) {
        return unsignedInt(paddingBits);
      }
      return type;
    }

    public int paddingBits() {
      return paddingBits;
    }

    public long sizeInBits(SymbolTable st, MachineModel mm)
        throws LayoutException {
      if (type == null) {
        return paddingBits;
      } else if (type.isBitField()) {
        return ((BitFieldType)type).width();
      } else {
        return type.sizeInBits(st, mm);
      }
    }

    public DatatypeComponent withType(Type newType) {
      if (type == null) {
        return this;
      }
      return field(name.toString(), newType);
    }

    public DatatypeComponent withName(String newName) {
      return new DatatypeComponent(newName, type, paddingBits);
    }

    @Override
    public boolean equals(Object other) {
      if (!(other instanceof DatatypeComponent)) {
        return false;
      }
      DatatypeComponent o = (DatatypeComponent)other;
      return o.name == name && Objects.equals(o.type, type) &&
             o.paddingBits == paddingBits;
    }

    @Override
    public int hashCode() {
      return Objects.hash(name, type, paddingBits);
    }

    @Override
    public String toString() {
      if (type == null) {
        return name + ": padding(" + paddingBits + ")";
      }
      return name + ": " + type;
    }
  }

  /**
   * Function parameter.  Identifier and base name are optional and
   * do not take part in equality, so that function types compare
   * by signature.
   */
  public static class Parameter {
    private final Type type;
    private final InternedString identifier;
    private final InternedString baseName;

    public Parameter(Type type, String identifier, String baseName) {
      if (type.isCode() || type.isEmpty()) {
        throw new GotocRuntimeError("Invalid parameter type: " + type);
      }
      this.type = type;
      this.identifier = InternedString.ofNullable(identifier);
      this.baseName = InternedString.ofNullable(baseName);
    }

    public Parameter(Type type) {
      this(type, null, null);
    }

    public Type type() {
      return type;
    }

    /** @return full name of parameter symbol, or null */
    public String identifier() {
      return identifier == null ? null : identifier.toString();
    }

    /** @return source name of parameter, or null */
    public String baseName() {
      return baseName == null ? null : baseName.toString();
    }

    public Parameter withType(Type newType) {
      return new Parameter(newType, identifier(), baseName());
    }

    public Parameter withNames(String newIdentifier, String newBaseName) {
      return new Parameter(type, newIdentifier, newBaseName);
    }

    @Override
    public boolean equals(Object other) {
      return other instanceof Parameter &&
             ((Parameter)other).type.equals(type);
    }

    @Override
    public int hashCode() {
      return type.hashCode();
    }

    @Override
    public String toString() {
      return identifier == null ? type.toString() : identifier + ": " + type;
    }
  }

  public static final Type BOOL = new PrimType(TypeKind.BOOL);
  public static final Type CONSTRUCTOR = new PrimType(TypeKind.CONSTRUCTOR);
  public static final Type DOUBLE = new PrimType(TypeKind.DOUBLE);
  public static final Type EMPTY = new PrimType(TypeKind.EMPTY);
  public static final Type FLOAT = new PrimType(TypeKind.FLOAT);

  public static final Type C_BOOL = new CIntegerType(CIntKind.BOOL);
  public static final Type C_CHAR = new CIntegerType(CIntKind.CHAR);
  public static final Type C_INT = new CIntegerType(CIntKind.INT);
  public static final Type C_LONG_INT = new CIntegerType(CIntKind.LONG_INT);
  public static final Type SIZE_T = new CIntegerType(CIntKind.SIZE_T);
  public static final Type SSIZE_T = new CIntegerType(CIntKind.SSIZE_T);

  public static Type cInteger(CIntKind kind) {
    switch (kind) {
      case BOOL:
        return C_BOOL;
      case CHAR:
        return C_CHAR;
      case INT:
        return C_INT;
      case LONG_INT:
        return C_LONG_INT;
      case SIZE_T:
        return SIZE_T;
      case SSIZE_T:
        return SSIZE_T;
      default:
        throw new GotocRuntimeError("Unknown int kind " + kind);
    }
  }

  public static BitVectorType signedInt(int width) {
    return new BitVectorType(true, width);
  }

  public static BitVectorType unsignedInt(int width) {
    return new BitVectorType(false, width);
  }

  public static ArrayType array(Type elem, long size) {
    checkSize(size);
    return new ArrayType(TypeKind.ARRAY, elem, size);
  }

  public static ArrayType flexibleArray(Type elem) {
    return new ArrayType(TypeKind.FLEXIBLE_ARRAY, elem, -1);
  }

  public static ArrayType infiniteArray(Type elem) {
    return new ArrayType(TypeKind.INFINITE_ARRAY, elem, -1);
  }

  public static ArrayType vector(Type elem, long size) {
    checkSize(size);
    if (!elem.isNumeric()) {
      throw new GotocRuntimeError("Vector element type must be numeric: "
                                  + elem);
    }
    return new ArrayType(TypeKind.VECTOR, elem, size);
  }

  private static void checkSize(long size) {
    if (size < 0) {
      throw new GotocRuntimeError("Negative array size: " + size);
    }
  }

  public static PointerType pointer(Type pointee) {
    return new PointerType(pointee);
  }

  public static PointerType voidPointer() {
    return new PointerType(EMPTY);
  }

  /**
   * @param tag source tag, without prefix
   */
  public static StructUnionType structType(String tag,
                              List<DatatypeComponent> components) {
    return new StructUnionType(TypeKind.STRUCT, tag, components);
  }

  public static StructUnionType unionType(String tag,
                              List<DatatypeComponent> components) {
    return new StructUnionType(TypeKind.UNION, tag, components);
  }

  public static TagType incompleteStruct(String tag) {
    return new TagType(TypeKind.INCOMPLETE_STRUCT, tag);
  }

  public static TagType incompleteUnion(String tag) {
    return new TagType(TypeKind.INCOMPLETE_UNION, tag);
  }

  /**
   * Reference to struct by source tag
   */
  public static TagType structTag(String tag) {
    return structTagRaw(aggrTagName(tag));
  }

  /**
   * Reference to struct by name of declaring symbol
   */
  public static TagType structTagRaw(String identifier) {
    return new TagType(TypeKind.STRUCT_TAG, identifier);
  }

  public static TagType unionTag(String tag) {
    return unionTagRaw(aggrTagName(tag));
  }

  public static TagType unionTagRaw(String identifier) {
    return new TagType(TypeKind.UNION_TAG, identifier);
  }

  public static CodeType code(List<Parameter> parameters, Type returnType) {
    return new CodeType(false, parameters, returnType);
  }

  public static CodeType variadicCode(List<Parameter> parameters,
                                      Type returnType) {
    return new CodeType(true, parameters, returnType);
  }

  /**
   * Code type taking parameters of the given types, without names
   */
  public static CodeType codeWithUnnamedParameters(List<Type> paramTypes,
                                                   Type returnType) {
    List<Parameter> params = new ArrayList<Parameter>(paramTypes.size());
    for (Type t: paramTypes) {
      params.add(new Parameter(t));
    }
    return code(params, returnType);
  }

  /**
   * Name of the symbol declaring a struct or union with this tag
   */
  public static String aggrTagName(String tag) {
    return TAG_PREFIX + tag;
  }

  public static String stripTagPrefix(String name) {
    if (name.startsWith(TAG_PREFIX)) {
      return name.substring(TAG_PREFIX.length());
    }
    return name;
  }

  /**
   * Replace characters that can't appear in a C identifier
   */
  static String identifierChars(String s) {
    StringBuilder sb = new StringBuilder(s.length());
    for (int i = 0; i < s.length(); i++) {
      char c = s.charAt(i);
      if ((c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') ||
          (c >= '0' && c <= '9') || c == '_') {
        sb.append(c);
      } else {
        sb.append('_');
      }
    }
    return sb.toString();
  }
}
