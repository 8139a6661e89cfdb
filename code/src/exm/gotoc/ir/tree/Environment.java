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
import java.util.List;

import exm.gotoc.common.lang.Location;
import exm.gotoc.common.lang.MachineModel;
import exm.gotoc.common.lang.Types;

/**
 * Symbols the model checker reads to learn about the target machine.
 */
public class Environment {

  private static final String ARCH_PREFIX = "__CPROVER_architecture_";
  public static final String ROUNDING_MODE = "__CPROVER_rounding_mode";

  /** Endianness codes used by the model checker */
  private static final int LITTLE_ENDIAN = 1;
  private static final int BIG_ENDIAN = 2;

  public static List<Symbol> machineModelSymbols(MachineModel mm) {
    List<Symbol> result = new ArrayList<Symbol>();
    result.add(stringConstant(ARCH_PREFIX + "arch", mm.architecture()));
    result.add(intConstant(ARCH_PREFIX + "NULL_is_zero", mm.nullIsZero()));
    result.add(intConstant(ARCH_PREFIX + "alignment", mm.alignment()));
    result.add(intConstant(ARCH_PREFIX + "bool_width", mm.boolWidth()));
    result.add(intConstant(ARCH_PREFIX + "char_is_unsigned",
                           mm.charIsUnsigned()));
    result.add(intConstant(ARCH_PREFIX + "char_width", mm.charWidth()));
    result.add(intConstant(ARCH_PREFIX + "double_width", mm.doubleWidth()));
    result.add(intConstant(ARCH_PREFIX + "endianness",
                           mm.isBigEndian() ? BIG_ENDIAN : LITTLE_ENDIAN));
    result.add(intConstant(ARCH_PREFIX + "int_width", mm.intWidth()));
    result.add(intConstant(ARCH_PREFIX + "long_double_width",
                           mm.longDoubleWidth()));
    result.add(intConstant(ARCH_PREFIX + "long_int_width",
                           mm.longIntWidth()));
    result.add(intConstant(ARCH_PREFIX + "long_long_int_width",
                           mm.longLongIntWidth()));
    result.add(intConstant(ARCH_PREFIX + "memory_operand_size",
                           mm.memoryOperandSize()));
    result.add(stringConstant(ARCH_PREFIX + "os", "none"));
    result.add(intConstant(ARCH_PREFIX + "pointer_width",
                           mm.pointerWidth()));
    result.add(intConstant(ARCH_PREFIX + "short_int_width",
                           mm.shortIntWidth()));
    result.add(intConstant(ARCH_PREFIX + "single_width", mm.singleWidth()));
    result.add(intConstant(ARCH_PREFIX + "wchar_t_is_unsigned",
                           mm.wcharTIsUnsigned()));
    result.add(intConstant(ARCH_PREFIX + "wchar_t_width",
                           mm.wcharTWidth()));
    result.add(intConstant(ARCH_PREFIX + "word_size", mm.wordSize()));
    result.add(intConstant(ROUNDING_MODE, mm.roundingMode().code()));
    return result;
  }

  private static Symbol intConstant(String name, long value) {
    return Symbol.constant(name, name, name,
                           Expr.intConstant(value, Types.C_INT),
                           Location.none());
  }

  private static Symbol intConstant(String name, boolean value) {
    return intConstant(name, value ? 1 : 0);
  }

  private static Symbol stringConstant(String name, String value) {
    return Symbol.constant(name, name, name, Expr.stringConstant(value),
                           Location.none());
  }
}
