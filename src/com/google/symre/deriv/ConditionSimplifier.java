/*
 * Copyright 2024 The Closure Compiler Authors.
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
 * limitations under the License.
 */

package com.google.symre.deriv;

import com.google.common.collect.DiscreteDomain;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Range;
import com.google.common.collect.RangeSet;
import com.google.common.collect.TreeRangeSet;
import com.google.symre.term.BooleanSimplifier;
import com.google.symre.term.Term;
import com.google.symre.term.TermManager;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Decides and simplifies path conditions: conjunctions of predicates over the character a
 * derivative is taken by.
 *
 * <p>Range-shaped conjuncts ({@code lo <= v}, {@code v <= hi}, {@code v = c}, their conjunctions
 * and negations) are folded into a set of character intervals. Any other conjunct is kept as an
 * opaque residual. An equality between the variable and a value is used to substitute the value
 * into the residuals.
 */
public final class ConditionSimplifier {

  private final TermManager tm;
  private final BooleanSimplifier bs;
  private final Range<Integer> domain;

  public ConditionSimplifier(TermManager tm, BooleanSimplifier bs) {
    this.tm = tm;
    this.bs = bs;
    this.domain = Range.closed(0, tm.getMaxChar());
  }

  /**
   * Simplifies {@code cond} as a constraint on {@code elem}. Returns {@code false} when the
   * conjunction is unsatisfiable on the character domain.
   */
  public Term simplify(Term elem, Term cond) {
    if (cond.isTrue() || cond.isFalse() || elem.isCharLit()) {
      // Conditions on a literal character are folded when they are built.
      return cond;
    }
    List<Term> conjuncts = cond.isAnd() ? cond.getChildren() : ImmutableList.of(cond);
    RangeSet<Integer> chars = TreeRangeSet.create();
    chars.add(domain);
    List<Term> residual = new ArrayList<>();
    @Nullable Term solution = null;
    @Nullable Term solutionEq = null;
    for (Term e : conjuncts) {
      if (e.isTrue()) {
        continue;
      }
      if (e.isFalse()) {
        return e;
      }
      RangeSet<Integer> allowed = charsSatisfying(elem, e);
      if (allowed != null) {
        chars.removeAll(allowed.complement());
        if (e.isEq() && solution == null) {
          solution = otherSide(e, elem);
          solutionEq = e;
        }
        continue;
      }
      residual.add(e);
      if (e.isEq() && solution == null) {
        Term value = otherSide(e, elem);
        if (value != null && !mentions(value, elem)) {
          solution = value;
          solutionEq = e;
        }
      }
    }
    if (chars.isEmpty()) {
      return tm.mkFalse();
    }

    List<Term> result = new ArrayList<>();
    if (solution != null) {
      if (solution.isCharLit() && !chars.contains(solution.getCharCode())) {
        return tm.mkFalse();
      }
      result.add(solutionEq);
      if (!solution.isCharLit()) {
        result.add(rangePredicate(elem, chars));
      }
      for (Term r : residual) {
        if (r == solutionEq) {
          continue;
        }
        Term substituted = bs.substitute(r, elem, solution);
        if (substituted.isFalse()) {
          return substituted;
        }
        result.add(substituted);
      }
    } else {
      result.add(rangePredicate(elem, chars));
      result.addAll(residual);
    }
    return bs.mkAnd(result);
  }

  /**
   * Whether {@code a} implies {@code b}, decided for identical conditions, conjunctions
   * containing {@code b}, and range-shaped conditions over the same character.
   */
  public boolean implies(Term a, Term b) {
    if (a == b || b.isTrue() || a.isFalse()) {
      return true;
    }
    if (a.isAnd() && a.getChildren().contains(b)) {
      return true;
    }
    Term var = rangeVariable(a);
    if (var == null || var != rangeVariable(b)) {
      return false;
    }
    RangeSet<Integer> ra = charsSatisfying(var, a);
    RangeSet<Integer> rb = charsSatisfying(var, b);
    if (ra == null || rb == null) {
      return false;
    }
    RangeSet<Integer> outside = TreeRangeSet.create(ra);
    outside.removeAll(rb);
    return outside.isEmpty();
  }

  /**
   * The set of characters for which {@code cond} holds when {@code elem} is bound to them, or
   * null if {@code cond} is not built from range-shaped atoms over {@code elem}.
   */
  public @Nullable RangeSet<Integer> charsSatisfying(Term elem, Term cond) {
    RangeSet<Integer> result = TreeRangeSet.create();
    switch (cond.getToken()) {
      case TRUE:
        result.add(domain);
        return result;
      case FALSE:
        return result;
      case NOT:
        {
          RangeSet<Integer> inner = charsSatisfying(elem, cond.getFirstChild());
          if (inner == null) {
            return null;
          }
          result.add(domain);
          result.removeAll(inner);
          return result;
        }
      case AND:
        result.add(domain);
        for (Term child : cond.getChildren()) {
          RangeSet<Integer> inner = charsSatisfying(elem, child);
          if (inner == null) {
            return null;
          }
          result.removeAll(inner.complement());
        }
        return result;
      case OR:
        for (Term child : cond.getChildren()) {
          RangeSet<Integer> inner = charsSatisfying(elem, child);
          if (inner == null) {
            return null;
          }
          result.addAll(inner);
        }
        return result;
      default:
        Range<Integer> range = rangeOf(elem, cond);
        if (range == null) {
          return null;
        }
        result.add(range);
        return result;
    }
  }

  private static @Nullable Term rangeVariable(Term c) {
    while (c.isNot() || c.isAnd() || c.isOr()) {
      c = c.getFirstChild();
    }
    if (!c.isCharLe() && !c.isEq()) {
      return null;
    }
    Term a = c.getFirstChild();
    Term b = c.getSecondChild();
    if (a.isCharLit() && !b.isCharLit()) {
      return b;
    }
    if (b.isCharLit() && !a.isCharLit()) {
      return a;
    }
    return null;
  }

  /** The closed interval an atom restricts {@code elem} to, or null if not range-shaped. */
  private @Nullable Range<Integer> rangeOf(Term elem, Term atom) {
    switch (atom.getToken()) {
      case CHAR_LE:
        {
          Term a = atom.getFirstChild();
          Term b = atom.getSecondChild();
          if (a == elem && b.isCharLit()) {
            return Range.closed(0, b.getCharCode());
          }
          if (b == elem && a.isCharLit()) {
            return Range.closed(a.getCharCode(), tm.getMaxChar());
          }
          return null;
        }
      case EQ:
        {
          Term value = otherSide(atom, elem);
          if (value != null && value.isCharLit()) {
            return Range.singleton(value.getCharCode());
          }
          return null;
        }
      default:
        return null;
    }
  }

  private static @Nullable Term otherSide(Term eq, Term elem) {
    if (eq.getFirstChild() == elem) {
      return eq.getSecondChild();
    }
    if (eq.getSecondChild() == elem) {
      return eq.getFirstChild();
    }
    return null;
  }

  private static boolean mentions(Term t, Term sub) {
    if (t == sub) {
      return true;
    }
    for (Term child : t.getChildren()) {
      if (mentions(child, sub)) {
        return true;
      }
    }
    return false;
  }

  /** The canonical predicate for membership of {@code elem} in {@code chars}. */
  Term rangePredicate(Term elem, RangeSet<Integer> chars) {
    if (chars.encloses(domain)) {
      return tm.mkTrue();
    }
    List<Term> disjuncts = new ArrayList<>();
    for (Range<Integer> r : chars.asRanges()) {
      Range<Integer> closed = r.canonical(DiscreteDomain.integers());
      int lo = closed.lowerEndpoint();
      int hi = closed.upperEndpoint() - 1;
      if (lo > hi) {
        continue;
      }
      if (lo == hi) {
        disjuncts.add(bs.mkEq(elem, tm.mkChar(lo)));
      } else if (lo == 0) {
        disjuncts.add(bs.mkCharLe(elem, tm.mkChar(hi)));
      } else if (hi == tm.getMaxChar()) {
        disjuncts.add(bs.mkCharLe(tm.mkChar(lo), elem));
      } else {
        disjuncts.add(
            bs.mkAnd(bs.mkCharLe(tm.mkChar(lo), elem), bs.mkCharLe(elem, tm.mkChar(hi))));
      }
    }
    return bs.mkOr(disjuncts);
  }
}
