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

/**
 * Handle for a string stored in a {@link StringPool}.  Handles are only
 * created by a pool, and a pool hands out one handle per distinct text,
 * so equality and hashing are by identity.
 */
public final class InternedString implements Comparable<InternedString> {
  private final String text;

  InternedString(String text) {
    this.text = text;
  }

  /**
   * Intern into the current pool of this thread
   */
  public static InternedString of(String text) {
    return StringPool.current().intern(text);
  }

  /**
   * Intern into the current pool, passing null through
   */
  public static InternedString ofNullable(String text) {
    return text == null ? null : of(text);
  }

  public boolean isEmpty() {
    return text.isEmpty();
  }

  public boolean startsWith(String prefix) {
    return text.startsWith(prefix);
  }

  public boolean endsWith(String suffix) {
    return text.endsWith(suffix);
  }

  @Override
  public String toString() {
    return text;
  }

  @Override
  public int compareTo(InternedString o) {
    return text.compareTo(o.text);
  }
}
