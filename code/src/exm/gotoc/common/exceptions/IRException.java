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
package exm.gotoc.common.exceptions;

import exm.gotoc.common.lang.Location;

/**
 * Base class for deferred consistency errors in the IR.  Unlike
 * {@link GotocRuntimeError} these can legitimately occur while a
 * symbol table is still being built, so callers may catch them.
 */
public class IRException
extends Exception
{
  private final Location location;
  private final String symbolName;

  public IRException(String symbolName, Location location, String message)
  {
    super(prefix(symbolName, location) + message);
    this.symbolName = symbolName;
    this.location = location;
  }

  public IRException(String message) {
    this(null, null, message);
  }

  private static String prefix(String symbolName, Location location) {
    StringBuilder sb = new StringBuilder();
    if (location != null && !location.isNone()) {
      sb.append(location.shortString()).append(": ");
    }
    if (symbolName != null) {
      sb.append("symbol ").append(symbolName).append(": ");
    }
    return sb.toString();
  }

  /**
   * @return location of offending construct, or null if unknown
   */
  public Location getLocation() {
    return location;
  }

  /**
   * @return name of offending symbol, or null if unknown
   */
  public String getSymbolName() {
    return symbolName;
  }

  private static final long serialVersionUID = 1L;
}
