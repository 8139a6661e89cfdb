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

import java.util.concurrent.ConcurrentMap;

import com.google.common.collect.Maps;

/**
 * Pool of interned strings.  Entries live as long as the pool.
 *
 * {@link InternedString#of(String)} interns into the current pool of
 * the calling thread: the pool most recently entered with
 * {@link #enter()}, or the process-wide pool if none is.  A
 * {@link exm.gotoc.ir.tree.SymbolTable} keeps the pool it was created
 * in and only accepts symbols named from that pool.  Handles from
 * different pools never compare equal.  Interning is safe to call
 * from multiple threads.
 */
public class StringPool {
  private static final StringPool GLOBAL = new StringPool();

  private static final ThreadLocal<StringPool> CURRENT =
                                        new ThreadLocal<StringPool>();

  private final ConcurrentMap<String, InternedString> strings =
                                            Maps.newConcurrentMap();

  public static StringPool global() {
    return GLOBAL;
  }

  /**
   * @return pool that new handles go into on this thread
   */
  public static StringPool current() {
    StringPool p = CURRENT.get();
    return p != null ? p : GLOBAL;
  }

  /**
   * Make this the current pool of the calling thread until the
   * returned scope is closed.  Scopes nest.
   */
  public Scope enter() {
    Scope scope = new Scope(CURRENT.get());
    CURRENT.set(this);
    return scope;
  }

  /**
   * Restores the previously current pool when closed
   */
  public static class Scope {
    private final StringPool previous;
    private boolean closed = false;

    private Scope(StringPool previous) {
      this.previous = previous;
    }

    public void close() {
      if (closed) {
        return;
      }
      closed = true;
      if (previous == null) {
        CURRENT.remove();
      } else {
        CURRENT.set(previous);
      }
    }
  }

  public InternedString intern(String text) {
    if (text == null) {
      throw new NullPointerException("Cannot intern null");
    }
    InternedString s = strings.get(text);
    if (s != null) {
      return s;
    }
    InternedString fresh = new InternedString(text);
    InternedString prev = strings.putIfAbsent(text, fresh);
    return prev != null ? prev : fresh;
  }

  /**
   * @return the interned handle for text if it was already interned here
   */
  public InternedString lookup(String text) {
    return strings.get(text);
  }

  public boolean contains(InternedString s) {
    return strings.get(s.toString()) == s;
  }

  public String toString(InternedString s) {
    if (!contains(s)) {
      throw new IllegalArgumentException("String " + s +
                                         " not interned in this pool");
    }
    return s.toString();
  }

  public int size() {
    return strings.size();
  }
}
