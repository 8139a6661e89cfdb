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
import java.util.List;

import exm.gotoc.common.exceptions.GotocRuntimeError;
import exm.gotoc.common.lang.Location;

/**
 * Function contracts.
 */
public class Contracts {

  /**
   * One contract clause.  The temporaries are the symbols bound inside
   * the clause, e.g. the return value or the arguments, so each must
   * be a plain symbol reference.
   */
  public static class Spec {
    private final List<Expr> temporaries;
    private final Expr clause;
    private final Location location;

    public Spec(List<Expr> temporaries, Expr clause) {
      this(temporaries, clause, Location.none());
    }

    private Spec(List<Expr> temporaries, Expr clause, Location location) {
      for (Expr t: temporaries) {
        if (t.kind() != Expr.Kind.SYMBOL) {
          throw new GotocRuntimeError("Contract temporary must be a " +
                                      "symbol reference: " + t);
        }
      }
      this.temporaries = Collections.unmodifiableList(
                                new ArrayList<Expr>(temporaries));
      this.clause = clause;
      this.location = location;
    }

    public List<Expr> temporaries() {
      return temporaries;
    }

    public Expr clause() {
      return clause;
    }

    public Location location() {
      return location;
    }

    public Spec withLocation(Location loc) {
      return new Spec(temporaries, clause, loc);
    }

    public Spec withClause(List<Expr> newTemporaries, Expr newClause) {
      return new Spec(newTemporaries, newClause, location);
    }

    @Override
    public boolean equals(Object o) {
      if (!(o instanceof Spec)) {
        return false;
      }
      Spec other = (Spec)o;
      return temporaries.equals(other.temporaries) &&
             clause.equals(other.clause) && location.equals(other.location);
    }

    @Override
    public int hashCode() {
      return temporaries.hashCode() * 31 + clause.hashCode();
    }

    @Override
    public String toString() {
      return "|" + temporaries + "| " + clause;
    }
  }

  /**
   * Preconditions and postconditions of a function, kept in the order
   * they were given.
   */
  public static class FunctionContract {
    private final List<Spec> requires;
    private final List<Spec> ensures;

    public FunctionContract(List<Spec> requires, List<Spec> ensures) {
      this.requires = Collections.unmodifiableList(
                                new ArrayList<Spec>(requires));
      this.ensures = Collections.unmodifiableList(
                                new ArrayList<Spec>(ensures));
    }

    public List<Spec> requires() {
      return requires;
    }

    public List<Spec> ensures() {
      return ensures;
    }

    /**
     * Contract with clauses of this followed by clauses of other
     */
    public FunctionContract append(FunctionContract other) {
      List<Spec> req = new ArrayList<Spec>(requires);
      req.addAll(other.requires);
      List<Spec> ens = new ArrayList<Spec>(ensures);
      ens.addAll(other.ensures);
      return new FunctionContract(req, ens);
    }

    @Override
    public boolean equals(Object o) {
      if (!(o instanceof FunctionContract)) {
        return false;
      }
      FunctionContract other = (FunctionContract)o;
      return requires.equals(other.requires) && ensures.equals(other.ensures);
    }

    @Override
    public int hashCode() {
      return requires.hashCode() * 31 + ensures.hashCode();
    }

    @Override
    public String toString() {
      return "requires " + requires + " ensures " + ensures;
    }
  }
}
