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

import exm.gotoc.common.exceptions.GotocRuntimeError;
import exm.gotoc.common.exceptions.InvalidOptionException;

/**
 * Facts about the target architecture needed to lay out data.
 * All widths are in bits.  Immutable once built.
 */
public class MachineModel {

  /**
   * Floating point rounding mode, numbered as the model checker
   * expects.
   */
  public static enum RoundingMode {
    TO_NEAREST(0),
    DOWNWARD(1),
    UPWARD(2),
    TOWARDS_ZERO(3);

    private final int code;

    private RoundingMode(int code) {
      this.code = code;
    }

    public int code() {
      return code;
    }
  }

  private final int alignment;
  private final String architecture;
  private final int boolWidth;
  private final boolean charIsUnsigned;
  private final int charWidth;
  private final int doubleWidth;
  private final int floatWidth;
  private final int intWidth;
  private final boolean isBigEndian;
  private final int longDoubleWidth;
  private final int longIntWidth;
  private final int longLongIntWidth;
  private final int memoryOperandSize;
  private final boolean nullIsZero;
  private final int pointerWidth;
  private final RoundingMode roundingMode;
  private final int shortIntWidth;
  private final int singleWidth;
  private final boolean wcharTIsUnsigned;
  private final int wcharTWidth;
  private final int wordSize;

  private MachineModel(Builder b) {
    this.alignment = b.alignment;
    this.architecture = b.architecture;
    this.boolWidth = b.boolWidth;
    this.charIsUnsigned = b.charIsUnsigned;
    this.charWidth = b.charWidth;
    this.doubleWidth = b.doubleWidth;
    this.floatWidth = b.floatWidth;
    this.intWidth = b.intWidth;
    this.isBigEndian = b.isBigEndian;
    this.longDoubleWidth = b.longDoubleWidth;
    this.longIntWidth = b.longIntWidth;
    this.longLongIntWidth = b.longLongIntWidth;
    this.memoryOperandSize = b.memoryOperandSize;
    this.nullIsZero = b.nullIsZero;
    this.pointerWidth = b.pointerWidth;
    this.roundingMode = b.roundingMode;
    this.shortIntWidth = b.shortIntWidth;
    this.singleWidth = b.singleWidth;
    this.wcharTIsUnsigned = b.wcharTIsUnsigned;
    this.wcharTWidth = b.wcharTWidth;
    this.wordSize = b.wordSize;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * 64-bit x86, as targeted on Linux and macOS
   */
  public static MachineModel x86_64() {
    return builder().architecture("x86_64")
                    .alignment(1)
                    .boolWidth(8)
                    .charIsUnsigned(false)
                    .charWidth(8)
                    .doubleWidth(64)
                    .floatWidth(32)
                    .intWidth(32)
                    .isBigEndian(false)
                    .longDoubleWidth(128)
                    .longIntWidth(64)
                    .longLongIntWidth(64)
                    .memoryOperandSize(4)
                    .nullIsZero(true)
                    .pointerWidth(64)
                    .roundingMode(RoundingMode.TO_NEAREST)
                    .shortIntWidth(16)
                    .singleWidth(32)
                    .wcharTIsUnsigned(false)
                    .wcharTWidth(32)
                    .wordSize(32)
                    .build();
  }

  /**
   * 64-bit ARM
   */
  public static MachineModel aarch64() {
    return builder().architecture("aarch64")
                    .alignment(1)
                    .boolWidth(8)
                    .charIsUnsigned(true)
                    .charWidth(8)
                    .doubleWidth(64)
                    .floatWidth(32)
                    .intWidth(32)
                    .isBigEndian(false)
                    .longDoubleWidth(64)
                    .longIntWidth(64)
                    .longLongIntWidth(64)
                    .memoryOperandSize(4)
                    .nullIsZero(true)
                    .pointerWidth(64)
                    .roundingMode(RoundingMode.TO_NEAREST)
                    .shortIntWidth(16)
                    .singleWidth(32)
                    .wcharTIsUnsigned(false)
                    .wcharTWidth(32)
                    .wordSize(32)
                    .build();
  }

  public static MachineModel fromName(String name)
        throws InvalidOptionException {
    if (name.equalsIgnoreCase("x86_64")) {
      return x86_64();
    } else if (name.equalsIgnoreCase("aarch64")) {
      return aarch64();
    } else {
      throw new InvalidOptionException("Unknown machine: " + name);
    }
  }

  public int pointerWidthInBytes() {
    return pointerWidth / 8;
  }

  public int alignment() {
    return alignment;
  }

  public String architecture() {
    return architecture;
  }

  public int boolWidth() {
    return boolWidth;
  }

  public boolean charIsUnsigned() {
    return charIsUnsigned;
  }

  public int charWidth() {
    return charWidth;
  }

  public int doubleWidth() {
    return doubleWidth;
  }

  public int floatWidth() {
    return floatWidth;
  }

  public int intWidth() {
    return intWidth;
  }

  public boolean isBigEndian() {
    return isBigEndian;
  }

  public int longDoubleWidth() {
    return longDoubleWidth;
  }

  public int longIntWidth() {
    return longIntWidth;
  }

  public int longLongIntWidth() {
    return longLongIntWidth;
  }

  public int memoryOperandSize() {
    return memoryOperandSize;
  }

  public boolean nullIsZero() {
    return nullIsZero;
  }

  public int pointerWidth() {
    return pointerWidth;
  }

  public RoundingMode roundingMode() {
    return roundingMode;
  }

  public int shortIntWidth() {
    return shortIntWidth;
  }

  public int singleWidth() {
    return singleWidth;
  }

  public boolean wcharTIsUnsigned() {
    return wcharTIsUnsigned;
  }

  public int wcharTWidth() {
    return wcharTWidth;
  }

  public int wordSize() {
    return wordSize;
  }

  @Override
  public String toString() {
    return "MachineModel(" + architecture + ", pointer_width=" +
           pointerWidth + ")";
  }

  public static class Builder {
    private int alignment = 1;
    private String architecture = null;
    private int boolWidth = 8;
    private boolean charIsUnsigned = false;
    private int charWidth = 8;
    private int doubleWidth = 64;
    private int floatWidth = 32;
    private int intWidth = 32;
    private boolean isBigEndian = false;
    private int longDoubleWidth = 128;
    private int longIntWidth = 64;
    private int longLongIntWidth = 64;
    private int memoryOperandSize = 4;
    private boolean nullIsZero = true;
    private int pointerWidth = 64;
    private RoundingMode roundingMode = RoundingMode.TO_NEAREST;
    private int shortIntWidth = 16;
    private int singleWidth = 32;
    private boolean wcharTIsUnsigned = false;
    private int wcharTWidth = 32;
    private int wordSize = 32;

    private Builder() {
    }

    public Builder alignment(int v) { alignment = v; return this; }
    public Builder architecture(String v) { architecture = v; return this; }
    public Builder boolWidth(int v) { boolWidth = v; return this; }
    public Builder charIsUnsigned(boolean v) { charIsUnsigned = v; return this; }
    public Builder charWidth(int v) { charWidth = v; return this; }
    public Builder doubleWidth(int v) { doubleWidth = v; return this; }
    public Builder floatWidth(int v) { floatWidth = v; return this; }
    public Builder intWidth(int v) { intWidth = v; return this; }
    public Builder isBigEndian(boolean v) { isBigEndian = v; return this; }
    public Builder longDoubleWidth(int v) { longDoubleWidth = v; return this; }
    public Builder longIntWidth(int v) { longIntWidth = v; return this; }
    public Builder longLongIntWidth(int v) { longLongIntWidth = v; return this; }
    public Builder memoryOperandSize(int v) { memoryOperandSize = v; return this; }
    public Builder nullIsZero(boolean v) { nullIsZero = v; return this; }
    public Builder pointerWidth(int v) { pointerWidth = v; return this; }
    public Builder roundingMode(RoundingMode v) { roundingMode = v; return this; }
    public Builder shortIntWidth(int v) { shortIntWidth = v; return this; }
    public Builder singleWidth(int v) { singleWidth = v; return this; }
    public Builder wcharTIsUnsigned(boolean v) { wcharTIsUnsigned = v; return this; }
    public Builder wcharTWidth(int v) { wcharTWidth = v; return this; }
    public Builder wordSize(int v) { wordSize = v; return this; }

    public MachineModel build() {
      if (architecture == null) {
        throw new GotocRuntimeError("Machine model needs architecture name");
      }
      if (pointerWidth <= 0 || pointerWidth % 8 != 0) {
        throw new GotocRuntimeError("Bad pointer width: " + pointerWidth);
      }
      return new MachineModel(this);
    }
  }
}
