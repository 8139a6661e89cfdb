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

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import exm.gotoc.common.exceptions.GotocRuntimeError;
import exm.gotoc.common.lang.Location;
import exm.gotoc.common.util.BitUtil;

/**
 * Generic tree node of the model checker's exchange format: an id,
 * ordered unnamed children and ordered named children.  Immutable;
 * the with* methods return modified copies.
 */
public final class Irep {
  private static final Irep NIL = justId(IrepId.NIL);
  private static final Irep ONE = justId(IrepId.ONE);
  private static final Irep ZERO = justId(IrepId.ZERO);

  private final String id;
  private final List<Irep> sub;
  private final Map<String, Irep> namedSub;

  public Irep(String id, List<Irep> sub, Map<String, Irep> namedSub) {
    if (id == null) {
      throw new GotocRuntimeError("Irep id cannot be null");
    }
    this.id = id;
    this.sub = Collections.unmodifiableList(new ArrayList<Irep>(sub));
    this.namedSub = Collections.unmodifiableMap(
                          new LinkedHashMap<String, Irep>(namedSub));
  }

  public static Irep justId(String id) {
    return new Irep(id, Collections.<Irep>emptyList(),
                    Collections.<String, Irep>emptyMap());
  }

  /**
   * Decimal integer id
   */
  public static Irep justIntId(long i) {
    return justId(Long.toString(i));
  }

  public static Irep justIntId(BigInteger i) {
    return justId(i.toString());
  }

  /**
   * Id holding the hex bit pattern of value as a bit-vector of width
   */
  public static Irep justBitPatternId(BigInteger value, int width) {
    return justId(BitUtil.hexBitPattern(value, width));
  }

  public static Irep justStringId(String s) {
    return justId(s);
  }

  public static Irep justSub(List<Irep> sub) {
    return new Irep(IrepId.EMPTY_STRING, sub,
                    Collections.<String, Irep>emptyMap());
  }

  public static Irep justNamedSub(Map<String, Irep> namedSub) {
    return new Irep(IrepId.EMPTY_STRING, Collections.<Irep>emptyList(),
                    namedSub);
  }

  public static Irep nil() {
    return NIL;
  }

  public static Irep one() {
    return ONE;
  }

  public static Irep zero() {
    return ZERO;
  }

  public static Irep bool(boolean b) {
    return b ? ONE : ZERO;
  }

  public String id() {
    return id;
  }

  public List<Irep> sub() {
    return sub;
  }

  public Map<String, Irep> namedSub() {
    return namedSub;
  }

  public Irep namedSub(String key) {
    return namedSub.get(key);
  }

  public boolean isNil() {
    return id.equals(IrepId.NIL) && sub.isEmpty() && namedSub.isEmpty();
  }

  /**
   * Add named child.  Nil values are skipped, since an absent key
   * means the same thing to the model checker.
   */
  public Irep withNamedSub(String key, Irep value) {
    if (value == null || value.isNil()) {
      return this;
    }
    Map<String, Irep> m = new LinkedHashMap<String, Irep>(namedSub);
    m.put(key, value);
    return new Irep(id, sub, m);
  }

  public Irep withLocation(Location loc, IrepConverter conv) {
    if (loc.isNone()) {
      return this;
    }
    return withNamedSub(IrepId.C_SOURCE_LOCATION, conv.toIrep(loc));
  }

  public Irep withType(Irep type) {
    return withNamedSub(IrepId.TYPE, type);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Irep)) {
      return false;
    }
    Irep other = (Irep)o;
    return id.equals(other.id) && sub.equals(other.sub) &&
           namedSub.equals(other.namedSub);
  }

  @Override
  public int hashCode() {
    return (id.hashCode() * 31 + sub.hashCode()) * 31 + namedSub.hashCode();
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append(id);
    if (!sub.isEmpty() || !namedSub.isEmpty()) {
      sb.append("(");
      boolean first = true;
      for (Irep i: sub) {
        if (!first) {
          sb.append(", ");
        }
        first = false;
        sb.append(i);
      }
      for (Map.Entry<String, Irep> e: namedSub.entrySet()) {
        if (!first) {
          sb.append(", ");
        }
        first = false;
        sb.append(e.getKey()).append("=").append(e.getValue());
      }
      sb.append(")");
    }
    return sb.toString();
  }
}
