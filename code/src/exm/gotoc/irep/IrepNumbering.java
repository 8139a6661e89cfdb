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
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.google.common.collect.ImmutableList;

/**
 * Numbers strings and ireps by content, so that structurally equal
 * ireps get the same number.  Numbers are dense and start at 0;
 * strings and ireps have separate number spaces.
 *
 * An irep is keyed by the numbers of its parts:
 * <pre>
 *   id, #sub, sub..., #namedSub, (name, namedSub)...
 * </pre>
 */
class IrepNumbering {

  private final Map<String, Integer> stringNumbers =
                                     new HashMap<String, Integer>();
  private final List<String> strings = new ArrayList<String>();

  private final Map<List<Integer>, Integer> irepNumbers =
                                     new HashMap<List<Integer>, Integer>();
  private final List<List<Integer>> keys = new ArrayList<List<Integer>>();

  int numberString(String s) {
    Integer n = stringNumbers.get(s);
    if (n == null) {
      n = strings.size();
      strings.add(s);
      stringNumbers.put(s, n);
    }
    return n;
  }

  /**
   * Number irep bottom-up
   */
  int numberIrep(Irep irep) {
    int id = numberString(irep.id());
    List<Integer> sub = new ArrayList<Integer>(irep.sub().size());
    for (Irep s: irep.sub()) {
      sub.add(numberIrep(s));
    }
    List<Integer> named = new ArrayList<Integer>(2 * irep.namedSub().size());
    for (Map.Entry<String, Irep> e: irep.namedSub().entrySet()) {
      named.add(numberString(e.getKey()));
      named.add(numberIrep(e.getValue()));
    }
    return numberKey(key(id, sub, named));
  }

  /**
   * @param named flattened (name, value) pairs
   */
  static List<Integer> key(int id, List<Integer> sub, List<Integer> named) {
    ImmutableList.Builder<Integer> b = ImmutableList.builder();
    b.add(id);
    b.add(sub.size());
    b.addAll(sub);
    b.add(named.size() / 2);
    b.addAll(named);
    return b.build();
  }

  int numberKey(List<Integer> key) {
    Integer n = irepNumbers.get(key);
    if (n == null) {
      n = keys.size();
      keys.add(key);
      irepNumbers.put(key, n);
    }
    return n;
  }

  int stringCount() {
    return strings.size();
  }

  int irepCount() {
    return keys.size();
  }

  String string(int number) {
    return strings.get(number);
  }

  int id(int irep) {
    return keys.get(irep).get(0);
  }

  int subCount(int irep) {
    return keys.get(irep).get(1);
  }

  int sub(int irep, int i) {
    return keys.get(irep).get(2 + i);
  }

  int namedSubCount(int irep) {
    return keys.get(irep).get(2 + subCount(irep));
  }

  int namedSubName(int irep, int i) {
    return keys.get(irep).get(3 + subCount(irep) + 2 * i);
  }

  int namedSubValue(int irep, int i) {
    return keys.get(irep).get(4 + subCount(irep) + 2 * i);
  }
}
