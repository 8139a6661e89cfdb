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

/**
 * Operators usable in expressions, with the identifiers the model
 * checker knows them by.
 */
public class Operators {

  public static enum BinaryOp {
    AND("and"),
    ASHR("ashr"),
    BITAND("bitand"),
    BITNAND("bitnand"),
    BITOR("bitor"),
    BITXOR("bitxor"),
    DIV("/"),
    EQUAL("="),
    GE(">="),
    GT(">"),
    IEEE_FLOAT_EQUAL("ieee_float_equal"),
    IEEE_FLOAT_NOTEQUAL("ieee_float_notequal"),
    IMPLIES("=>"),
    LE("<="),
    LSHR("lshr"),
    LT("<"),
    MINUS("-"),
    MOD("mod"),
    MULT("*"),
    NOTEQUAL("notequal"),
    OR("or"),
    OVERFLOW_MINUS("overflow--"),
    OVERFLOW_MULT("overflow-*"),
    OVERFLOW_PLUS("overflow-+"),
    OVERFLOW_RESULT_MINUS("overflow_result--"),
    OVERFLOW_RESULT_MULT("overflow_result-*"),
    OVERFLOW_RESULT_PLUS("overflow_result-+"),
    PLUS("+"),
    R_OK("r_ok"),
    ROL("rol"),
    ROR("ror"),
    SHL("shl"),
    XOR("xor");

    private final String irepId;

    private BinaryOp(String irepId) {
      this.irepId = irepId;
    }

    public String irepId() {
      return irepId;
    }

    public boolean isLogical() {
      return this == AND || this == OR || this == XOR || this == IMPLIES;
    }

    public boolean isComparison() {
      switch (this) {
        case EQUAL:
        case NOTEQUAL:
        case LT:
        case LE:
        case GT:
        case GE:
          return true;
        default:
          return false;
      }
    }

    public boolean isBitwise() {
      return this == BITAND || this == BITNAND || this == BITOR ||
             this == BITXOR;
    }

    public boolean isShift() {
      return this == ASHR || this == LSHR || this == SHL ||
             this == ROL || this == ROR;
    }

    public boolean isOverflowCheck() {
      return this == OVERFLOW_MINUS || this == OVERFLOW_MULT ||
             this == OVERFLOW_PLUS;
    }

    public boolean isOverflowResult() {
      return this == OVERFLOW_RESULT_MINUS || this == OVERFLOW_RESULT_MULT ||
             this == OVERFLOW_RESULT_PLUS;
    }
  }

  public static enum UnaryOp {
    BITNOT("bitnot"),
    BIT_REVERSE("bitreverse"),
    BSWAP("bswap"),
    COUNT_LEADING_ZEROS("count_leading_zeros"),
    COUNT_TRAILING_ZEROS("count_trailing_zeros"),
    IS_DYNAMIC_OBJECT("is_dynamic_object"),
    IS_FINITE("isfinite"),
    NOT("not"),
    OBJECT_SIZE("object_size"),
    POINTER_OBJECT("pointer_object"),
    POINTER_OFFSET("pointer_offset"),
    POPCOUNT("popcount"),
    UNARY_MINUS("unary-");

    private final String irepId;

    private UnaryOp(String irepId) {
      this.irepId = irepId;
    }

    public String irepId() {
      return irepId;
    }
  }

  /**
   * Increment/decrement side effects
   */
  public static enum SelfOp {
    POSTDECREMENT("postdecrement"),
    POSTINCREMENT("postincrement"),
    PREDECREMENT("predecrement"),
    PREINCREMENT("preincrement");

    private final String irepId;

    private SelfOp(String irepId) {
      this.irepId = irepId;
    }

    public String irepId() {
      return irepId;
    }
  }
}
