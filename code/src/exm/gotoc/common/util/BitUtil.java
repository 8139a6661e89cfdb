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
package exm.gotoc.common.util;

import java.math.BigInteger;

import exm.gotoc.common.exceptions.GotocRuntimeError;

/**
 * Helpers for the fixed-width bit-vector encodings used in
 * constant values.
 */
public class BitUtil {

  /**
   * Two's complement bit pattern of value truncated to width bits,
   * as an unsigned number.
   */
  public static BigInteger twosComplement(BigInteger value, int width) {
    if (width <= 0) {
      throw new GotocRuntimeError("Bit width must be positive: " + width);
    }
    BigInteger mask = BigInteger.ONE.shiftLeft(width).subtract(BigInteger.ONE);
    return value.and(mask);
  }

  /**
   * Upper case hex rendering of the bit pattern, with no leading zeros
   */
  public static String hexBitPattern(BigInteger value, int width) {
    return twosComplement(value, width).toString(16).toUpperCase();
  }

  /**
   * Check value is representable in a bit-vector of the given width
   * @param signed whether the bit-vector is signed
   */
  public static boolean fits(BigInteger value, int width, boolean signed) {
    BigInteger min, max;
    if (signed) {
      min = BigInteger.ONE.shiftLeft(width - 1).negate();
      max = BigInteger.ONE.shiftLeft(width - 1).subtract(BigInteger.ONE);
    } else {
      min = BigInteger.ZERO;
      max = BigInteger.ONE.shiftLeft(width).subtract(BigInteger.ONE);
    }
    return value.compareTo(min) >= 0 && value.compareTo(max) <= 0;
  }

  public static BigInteger maxValue(int width, boolean signed) {
    int bits = signed ? width - 1 : width;
    return BigInteger.ONE.shiftLeft(bits).subtract(BigInteger.ONE);
  }

  public static BigInteger minValue(int width, boolean signed) {
    if (!signed) {
      return BigInteger.ZERO;
    }
    return BigInteger.ONE.shiftLeft(width - 1).negate();
  }
}
