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

/**
 * Identifiers used in ireps, spelled as the model checker expects
 * them.  Ids starting with '#' are annotations that do not affect
 * the meaning of a node.
 */
public class IrepId {
  public static final String EMPTY_STRING = "";
  public static final String NIL = "nil";
  public static final String ONE = "1";
  public static final String ZERO = "0";
  public static final String TRUE = "true";
  public static final String FALSE = "false";
  public static final String NULL = "NULL";
  public static final String INFINITY = "infinity";

  /* Named sub keys */
  public static final String C_SOURCE_LOCATION = "#source_location";
  public static final String TYPE = "type";
  public static final String VALUE = "value";
  public static final String WIDTH = "width";
  public static final String F = "f";
  public static final String C_C_TYPE = "#c_type";
  public static final String SIZE = "size";
  public static final String TAG = "tag";
  public static final String INCOMPLETE = "incomplete";
  public static final String COMPONENTS = "components";
  public static final String NAME = "name";
  public static final String C_PRETTY_NAME = "#pretty_name";
  public static final String C_IS_PADDING = "#is_padding";
  public static final String IDENTIFIER = "identifier";
  public static final String PARAMETERS = "parameters";
  public static final String RETURN_TYPE = "return_type";
  public static final String ELLIPSIS = "ellipsis";
  public static final String C_IDENTIFIER = "#identifier";
  public static final String C_BASE_NAME = "#base_name";
  public static final String COMPONENT_NAME = "component_name";
  public static final String C_LVALUE = "#lvalue";
  public static final String STATEMENT = "statement";
  public static final String DESTINATION = "destination";
  public static final String LABEL = "label";
  public static final String DEFAULT = "default";
  public static final String C_BOUNDS_CHECK = "#bounds_check";
  public static final String ARGUMENTS = "arguments";
  public static final String BITS_PER_BYTE = "bits_per_byte";
  public static final String C_SPEC_REQUIRES = "#spec_requires";
  public static final String C_SPEC_ENSURES = "#spec_ensures";
  public static final String C_SPEC_LOOP_INVARIANT = "#spec_loop_invariant";

  /* Location keys */
  public static final String FILE = "file";
  public static final String LINE = "line";
  public static final String COLUMN = "column";
  public static final String FUNCTION = "function";
  public static final String COMMENT = "comment";
  public static final String PROPERTY_CLASS = "property_class";

  /* Types */
  public static final String ARRAY = "array";
  public static final String BOOL = "bool";
  public static final String C_BIT_FIELD = "c_bit_field";
  public static final String C_BOOL = "c_bool";
  public static final String CODE = "code";
  public static final String CONSTRUCTOR = "constructor";
  public static final String EMPTY = "empty";
  public static final String FLOATBV = "floatbv";
  public static final String POINTER = "pointer";
  public static final String SIGNEDBV = "signedbv";
  public static final String UNSIGNEDBV = "unsignedbv";
  public static final String STRUCT = "struct";
  public static final String UNION = "union";
  public static final String STRUCT_TAG = "struct_tag";
  public static final String UNION_TAG = "union_tag";
  public static final String VECTOR = "vector";
  public static final String PARAMETER = "parameter";

  /* Expressions */
  public static final String ADDRESS_OF = "address_of";
  public static final String ARRAY_OF = "array_of";
  public static final String BYTE_EXTRACT_BIG_ENDIAN =
                                          "byte_extract_big_endian";
  public static final String BYTE_EXTRACT_LITTLE_ENDIAN =
                                          "byte_extract_little_endian";
  public static final String CONSTANT = "constant";
  public static final String DEREFERENCE = "dereference";
  public static final String EMPTY_UNION = "empty_union";
  public static final String IF = "if";
  public static final String INDEX = "index";
  public static final String LAMBDA = "lambda";
  public static final String MEMBER = "member";
  public static final String SIDE_EFFECT = "side_effect";
  public static final String STRING_CONSTANT = "string_constant";
  public static final String SYMBOL = "symbol";
  public static final String TUPLE = "tuple";
  public static final String TYPECAST = "typecast";

  /* Side effect and code statements */
  public static final String ASSIGN = "assign";
  public static final String FUNCTION_CALL = "function_call";
  public static final String NONDET = "nondet";
  public static final String STATEMENT_EXPRESSION = "statement_expression";
  public static final String ASSERT = "assert";
  public static final String ASSUME = "assume";
  public static final String ATOMIC_BEGIN = "atomic_begin";
  public static final String ATOMIC_END = "atomic_end";
  public static final String BLOCK = "block";
  public static final String BREAK = "break";
  public static final String CONTINUE = "continue";
  public static final String DEAD = "dead";
  public static final String DECL = "decl";
  public static final String EXPRESSION = "expression";
  public static final String FOR = "for";
  public static final String GOTO = "goto";
  public static final String IFTHENELSE = "ifthenelse";
  public static final String RETURN = "return";
  public static final String SKIP = "skip";
  public static final String SWITCH = "switch";
  public static final String SWITCH_CASE = "switch_case";
  public static final String WHILE = "while";
}
