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
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.log4j.Logger;

import exm.gotoc.common.Logging;
import exm.gotoc.common.exceptions.GotocRuntimeError;
import exm.gotoc.common.exceptions.LayoutException;
import exm.gotoc.common.lang.InternedString;
import exm.gotoc.common.lang.MachineModel;
import exm.gotoc.common.lang.StringPool;
import exm.gotoc.common.lang.Types.DatatypeComponent;
import exm.gotoc.common.lang.Types.Type;

/**
 * All symbols of a goto program, keyed by name, for one machine.
 *
 * Iteration is in insertion order, so that output is deterministic.
 * Replacing a symbol keeps its original position.  Insertion and
 * removal are synchronized so that a table under construction can be
 * read from other threads.
 */
public class SymbolTable implements Iterable<Symbol> {

  /**
   * Create a symbol on demand
   */
  public static interface SymbolFactory {
    public Symbol create(String name);
  }

  /**
   * Check that an existing symbol can be replaced
   */
  public static interface ReplaceCheck {
    /**
     * @param old existing symbol, or null if none
     */
    public boolean canReplace(Symbol old);
  }

  private static final Logger logger = Logging.getGotocLogger();

  private final MachineModel machineModel;
  private final StringPool pool;
  private final Map<InternedString, Symbol> symbols =
                          new LinkedHashMap<InternedString, Symbol>();

  /**
   * Table whose names come from the current string pool
   */
  public SymbolTable(MachineModel machineModel) {
    this(machineModel, StringPool.current());
  }

  public SymbolTable(MachineModel machineModel, StringPool pool) {
    if (machineModel == null) {
      throw new GotocRuntimeError("Symbol table needs a machine model");
    }
    if (pool == null) {
      throw new GotocRuntimeError("Symbol table needs a string pool");
    }
    this.machineModel = machineModel;
    this.pool = pool;
  }

  /**
   * New table containing the symbols the model checker expects to
   * describe the machine
   */
  public static SymbolTable withEnvironment(MachineModel mm) {
    return withEnvironment(mm, StringPool.current());
  }

  public static SymbolTable withEnvironment(MachineModel mm,
                                            StringPool pool) {
    SymbolTable st = new SymbolTable(mm, pool);
    StringPool.Scope scope = pool.enter();
    try {
      for (Symbol s: Environment.machineModelSymbols(mm)) {
        st.insert(s);
      }
    } finally {
      scope.close();
    }
    return st;
  }

  /**
   * Empty table for the same machine and string pool
   */
  public SymbolTable newEmpty() {
    return new SymbolTable(machineModel, pool);
  }

  public MachineModel machineModel() {
    return machineModel;
  }

  /**
   * Pool that names of symbols in this table are interned in
   */
  public StringPool stringPool() {
    return pool;
  }

  /**
   * Add symbol, replacing any symbol of the same name.  The symbol is
   * frozen by insertion.
   * @return the replaced symbol, or null if none
   */
  public synchronized Symbol insert(Symbol symbol) {
    return doInsert(symbol, true);
  }

  private Symbol doInsert(Symbol symbol, boolean warnOnCollision) {
    if (!pool.contains(symbol.internedName())) {
      throw new GotocRuntimeError("Symbol " + symbol.name() +
          " was named in a different string pool than " + this);
    }
    symbol.freeze();
    Symbol prev = symbols.put(symbol.internedName(), symbol);
    if (prev != null) {
      if (warnOnCollision) {
        Logging.uniqueWarn("Symbol " + symbol.name() +
                           " replaced in symbol table");
      } else {
        logger.debug("Replaced symbol " + symbol.name());
      }
    } else if (logger.isTraceEnabled()) {
      logger.trace("Inserted symbol " + symbol.name());
    }
    return prev;
  }

  /**
   * Insert, failing if the name is already used
   */
  public void insertNew(Symbol symbol) {
    Symbol prev;
    synchronized (this) {
      prev = symbols.get(symbol.internedName());
      if (prev == null) {
        insert(symbol);
        return;
      }
    }
    throw new GotocRuntimeError("Symbol " + symbol.name() +
                                " already in symbol table: " + prev);
  }

  /**
   * Look up symbol, creating it with factory if not present
   */
  public synchronized Symbol ensure(String name, SymbolFactory factory) {
    Symbol existing = lookup(name);
    if (existing != null) {
      return existing;
    }
    Symbol created = factory.create(name);
    if (!created.name().equals(name)) {
      throw new GotocRuntimeError("Factory for " + name + " created " +
                                  created.name());
    }
    insert(created);
    return created;
  }

  /**
   * Replace symbol of the same name, if check accepts the existing one
   */
  public synchronized void replace(ReplaceCheck check, Symbol symbol) {
    Symbol old = lookup(symbol.name());
    if (!check.canReplace(old)) {
      throw new GotocRuntimeError("Cannot replace " + old + " with " +
                                  symbol);
    }
    doInsert(symbol, false);
  }

  /**
   * Insert symbol if it is new, or completes or repeats the existing
   * declaration of the same name
   */
  public void replaceWithCompletion(final Symbol symbol) {
    replace(new ReplaceCheck() {
      @Override
      public boolean canReplace(Symbol old) {
        return old == null || old.equals(symbol) || symbol.completes(old);
      }
    }, symbol);
  }

  /**
   * Add body to a function that was declared without one
   */
  public synchronized void updateFunctionDeclarationWithDefinition(
                                              String name, Stmt body) {
    Symbol old = lookup(name);
    if (old == null || !old.isFunction()) {
      throw new GotocRuntimeError("No function declaration for " + name);
    }
    if (old.hasValue()) {
      throw new GotocRuntimeError("Function " + name + " already defined");
    }
    doInsert(old.copy().setBody(body), false);
  }

  /**
   * @return the removed symbol, or null if not present
   */
  public synchronized Symbol remove(String name) {
    InternedString key = key(name);
    return key == null ? null : symbols.remove(key);
  }

  public synchronized boolean contains(String name) {
    InternedString key = key(name);
    return key != null && symbols.containsKey(key);
  }

  /**
   * @return symbol, or null if not present
   */
  public synchronized Symbol lookup(String name) {
    InternedString key = key(name);
    return key == null ? null : symbols.get(key);
  }

  /**
   * A name never interned in this table's pool can't be in the table
   */
  private InternedString key(String name) {
    return pool.lookup(name);
  }

  public List<DatatypeComponent> lookupComponents(Type type)
      throws LayoutException {
    return type.lookupComponents(this);
  }

  public Type lookupFieldType(Type type, String field)
      throws LayoutException {
    return type.lookupFieldType(field, this);
  }

  public synchronized int size() {
    return symbols.size();
  }

  /**
   * Snapshot of symbols in insertion order
   */
  public synchronized List<Symbol> symbols() {
    return Collections.unmodifiableList(
                    new ArrayList<Symbol>(symbols.values()));
  }

  public synchronized List<String> names() {
    List<String> names = new ArrayList<String>(symbols.size());
    for (InternedString s: symbols.keySet()) {
      names.add(s.toString());
    }
    return names;
  }

  @Override
  public Iterator<Symbol> iterator() {
    return symbols().iterator();
  }

  @Override
  public String toString() {
    return "SymbolTable(" + machineModel.architecture() + ", " + size() +
           " symbols)";
  }
}
