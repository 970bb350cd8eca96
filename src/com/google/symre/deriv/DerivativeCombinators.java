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

import com.google.symre.deriv.OpCache.OpTag;
import com.google.symre.term.BooleanSimplifier;
import com.google.symre.term.Term;
import com.google.symre.term.TermManager;
import java.util.function.BinaryOperator;
import org.jspecify.annotations.Nullable;

/**
 * Union, intersection, concatenation and negation of derivatives in normal form.
 *
 * <p>Every result is again in normal form: antimirov unions stay at the top, ITE trees keep
 * their conditions ordered (see {@link ConditionOrder}), and plain regex operations only happen
 * at the leaves. Intersections are pruned with the path condition so that no branch whose guard
 * contradicts the conditions above it survives.
 */
public final class DerivativeCombinators {

  private final TermManager tm;
  private final BooleanSimplifier bs;
  private final ConditionSimplifier conditions;
  private final RegexSimplifier re;
  private final OpCache cache;
  private final @Nullable NormalFormValidator validator;

  DerivativeCombinators(
      TermManager tm,
      BooleanSimplifier bs,
      ConditionSimplifier conditions,
      RegexSimplifier re,
      OpCache cache,
      @Nullable NormalFormValidator validator) {
    this.tm = tm;
    this.bs = bs;
    this.conditions = conditions;
    this.re = re;
    this.cache = cache;
    this.validator = validator;
  }

  private Term checked(Term result) {
    if (validator != null) {
      validator.validateDerivative(result);
    }
    return result;
  }

  /**
   * The guarded choice {@code c ? t : e} in normal form. Equal branches collapse, conditions
   * implied by {@code c} are resolved in the branches, and if a branch is guarded by a condition
   * that ranks above {@code c} that condition is hoisted to the root.
   */
  public Term mkIte(Term c, Term t, Term e) {
    if (c.isTrue() || t == e) {
      return t;
    }
    if (c.isFalse()) {
      return e;
    }
    if (c.isNot()) {
      return mkIte(c.getFirstChild(), e, t);
    }
    if (t.isAntimirovUnion() || e.isAntimirovUnion()) {
      return antimirovUnion(guard(c, t, true), guard(c, e, false));
    }
    t = cofactor(t, c, true);
    e = cofactor(e, c, false);
    if (t == e) {
      return t;
    }
    if (ConditionOrder.isOutside(c, t) && ConditionOrder.isOutside(c, e)) {
      return tm.mkIte(c, t, e);
    }
    Term d = topCondition(t, e);
    return mkIte(
        d,
        mkIte(c, cofactor(t, d, true), cofactor(e, d, true)),
        mkIte(c, cofactor(t, d, false), cofactor(e, d, false)));
  }

  /** Keeps {@code x} when {@code c} has the given polarity, and the empty language otherwise. */
  private Term guard(Term c, Term x, boolean polarity) {
    if (x.isAntimirovUnion()) {
      return antimirovUnion(
          guard(c, x.getFirstChild(), polarity), guard(c, x.getSecondChild(), polarity));
    }
    return polarity ? mkIte(c, x, tm.mkEmpty()) : mkIte(c, tm.mkEmpty(), x);
  }

  /** The larger of the root conditions of two terms, at least one of which is an ITE. */
  private static Term topCondition(Term a, Term b) {
    if (!a.isIte()) {
      return b.getFirstChild();
    }
    if (!b.isIte()) {
      return a.getFirstChild();
    }
    Term ca = a.getFirstChild();
    Term cb = b.getFirstChild();
    return ConditionOrder.compare(ca, cb) >= 0 ? ca : cb;
  }

  /** Resolves the root of {@code t} under the assumption that {@code c} has the given value. */
  private Term cofactor(Term t, Term c, boolean value) {
    if (!t.isIte()) {
      return t;
    }
    Term ct = t.getFirstChild();
    Term assumed = value ? c : bs.mkNot(c);
    if (ct == c) {
      return value ? t.getSecondChild() : t.getChildAtIndex(2);
    }
    if (conditions.implies(assumed, ct)) {
      return t.getSecondChild();
    }
    if (conditions.implies(assumed, bs.mkNot(ct))) {
      return t.getChildAtIndex(2);
    }
    return t;
  }

  /** Combines two terms through their ITE structure, applying {@code op} to the cofactors. */
  Term applyIte(Term a, Term b, BinaryOperator<Term> op) {
    Term c = topCondition(a, b);
    return mkIte(
        c,
        op.apply(cofactor(a, c, true), cofactor(b, c, true)),
        op.apply(cofactor(a, c, false), cofactor(b, c, false)));
  }

  /** The deferred union of two derivatives, kept right-nested and free of duplicates. */
  public Term antimirovUnion(Term a, Term b) {
    if (a.isEmptyRegex() || a == b) {
      return b;
    }
    if (b.isEmptyRegex()) {
      return a;
    }
    if (a.isAntimirovUnion()) {
      return antimirovUnion(a.getFirstChild(), antimirovUnion(a.getSecondChild(), b));
    }
    for (Term rest = b; ; rest = rest.getSecondChild()) {
      if (!rest.isAntimirovUnion()) {
        if (rest == a) {
          return b;
        }
        break;
      }
      if (rest.getFirstChild() == a) {
        return b;
      }
    }
    return tm.mkAntimirovUnion(a, b);
  }

  public Term union(Term a, Term b) {
    if (a == b || b.isEmptyRegex() || a.isFullSeq()) {
      return a;
    }
    if (a.isEmptyRegex() || b.isFullSeq()) {
      return b;
    }
    Term cached = cache.find(OpTag.UNION, a, b, null);
    if (cached != null) {
      return cached;
    }
    Term result;
    if (a.isAntimirovUnion() || b.isAntimirovUnion()) {
      result = antimirovUnion(a, b);
    } else if (a.isIte() || b.isIte()) {
      result = applyIte(a, b, this::union);
    } else {
      result = re.mkUnion(a, b);
    }
    cache.insert(OpTag.UNION, a, b, null, result);
    return checked(result);
  }

  /** The intersection of two derivatives by {@code elem}. */
  public Term intersect(Term elem, Term a, Term b) {
    if (a.isEmptyRegex() || b.isFullSeq() || a == b) {
      return a;
    }
    if (b.isEmptyRegex() || a.isFullSeq()) {
      return b;
    }
    Term cached = cache.find(OpTag.INTERSECT, a, b, elem);
    if (cached != null) {
      return cached;
    }
    Term result = intersect(elem, a, b, tm.mkTrue());
    cache.insert(OpTag.INTERSECT, a, b, elem, result);
    return checked(result);
  }

  /**
   * The intersection of two derivatives under the path condition {@code path}. Branches whose
   * guard contradicts the path are dropped.
   */
  Term intersect(Term elem, Term a, Term b, Term path) {
    if (a.isEmptyRegex()) {
      return a;
    }
    if (b.isEmptyRegex()) {
      return b;
    }
    if (a.isAntimirovUnion()) {
      return antimirovUnion(
          intersect(elem, a.getFirstChild(), b, path),
          intersect(elem, a.getSecondChild(), b, path));
    }
    if (b.isAntimirovUnion()) {
      return antimirovUnion(
          intersect(elem, a, b.getFirstChild(), path),
          intersect(elem, a, b.getSecondChild(), path));
    }
    if (a == b || b.isFullSeq()) {
      return restrict(elem, a, path);
    }
    if (a.isFullSeq()) {
      return restrict(elem, b, path);
    }
    if (a.isIte() || b.isIte()) {
      Term c = topCondition(a, b);
      Term thenPath = conditions.simplify(elem, bs.mkAnd(path, c));
      Term elsePath = conditions.simplify(elem, bs.mkAnd(path, bs.mkNot(c)));
      if (thenPath.isFalse()) {
        return intersect(elem, cofactor(a, c, false), cofactor(b, c, false), path);
      }
      if (elsePath.isFalse()) {
        return intersect(elem, cofactor(a, c, true), cofactor(b, c, true), path);
      }
      return mkIte(
          c,
          intersect(elem, cofactor(a, c, true), cofactor(b, c, true), thenPath),
          intersect(elem, cofactor(a, c, false), cofactor(b, c, false), elsePath));
    }
    if (a.isUnion()) {
      return union(
          intersect(elem, a.getFirstChild(), b, path),
          intersect(elem, a.getSecondChild(), b, path));
    }
    if (b.isUnion()) {
      return union(
          intersect(elem, a, b.getFirstChild(), path),
          intersect(elem, a, b.getSecondChild(), path));
    }
    return re.mkIntersect(a, b);
  }

  /** Appends the regex {@code r} to every leaf of the derivative {@code d}. */
  public Term concat(Term d, Term r) {
    if (d.isEmptyRegex() || r.isEpsilon()) {
      return d;
    }
    if (r.isEmptyRegex()) {
      return r;
    }
    Term cached = cache.find(OpTag.CONCAT, d, r, null);
    if (cached != null) {
      return cached;
    }
    Term result;
    if (d.isAntimirovUnion()) {
      result = antimirovUnion(concat(d.getFirstChild(), r), concat(d.getSecondChild(), r));
    } else if (d.isIte()) {
      result =
          mkIte(d.getFirstChild(), concat(d.getSecondChild(), r), concat(d.getChildAtIndex(2), r));
    } else if (d.isUnion()) {
      result = union(concat(d.getFirstChild(), r), concat(d.getSecondChild(), r));
    } else {
      result = normalizeLeaf(re.mkConcat(d, r));
    }
    cache.insert(OpTag.CONCAT, d, r, null, result);
    return checked(result);
  }

  /**
   * Brings a regex that may expose a surface conditional at its root or under its unions into
   * normal form.
   */
  private Term normalizeLeaf(Term x) {
    if (x.isIte()) {
      return mkIte(
          x.getFirstChild(),
          normalizeLeaf(x.getSecondChild()),
          normalizeLeaf(x.getChildAtIndex(2)));
    }
    if (x.isUnion() && containsIte(x)) {
      return union(normalizeLeaf(x.getFirstChild()), normalizeLeaf(x.getSecondChild()));
    }
    return x;
  }

  private static boolean containsIte(Term x) {
    if (x.isIte()) {
      return true;
    }
    return x.isUnion() && (containsIte(x.getFirstChild()) || containsIte(x.getSecondChild()));
  }

  /** The complement of the derivative {@code d} by {@code elem}. */
  public Term negate(Term elem, Term d) {
    switch (d.getToken()) {
      case RE_EMPTY:
        return tm.mkFullSeq();
      case RE_EPSILON:
        return tm.mkDotPlus();
      case RE_FULL_SEQ:
        return tm.mkEmpty();
      case RE_COMPLEMENT:
        return d.getFirstChild();
      default:
        break;
    }
    if (d.isDotPlus()) {
      return tm.mkEpsilon();
    }
    Term cached = cache.find(OpTag.NEGATE, d, elem, null);
    if (cached != null) {
      return cached;
    }
    Term result;
    switch (d.getToken()) {
      case RE_ANTIMIROV_UNION:
      case RE_UNION:
        result =
            intersect(elem, negate(elem, d.getFirstChild()), negate(elem, d.getSecondChild()));
        break;
      case RE_INTERSECT:
        result = union(negate(elem, d.getFirstChild()), negate(elem, d.getSecondChild()));
        break;
      case ITE:
        result =
            mkIte(
                d.getFirstChild(),
                negate(elem, d.getSecondChild()),
                negate(elem, d.getChildAtIndex(2)));
        break;
      default:
        result = tm.mkComplement(d);
        break;
    }
    cache.insert(OpTag.NEGATE, d, elem, null, result);
    return checked(result);
  }

  /** Restricts every guard of {@code d} by {@code cond}, dropping infeasible branches. */
  public Term restrict(Term elem, Term d, Term cond) {
    if (cond.isTrue()) {
      return d;
    }
    if (cond.isFalse()) {
      return tm.mkEmpty();
    }
    Term cached = cache.find(OpTag.RESTRICT, d, cond, elem);
    if (cached != null) {
      return cached;
    }
    Term result;
    if (d.isAntimirovUnion()) {
      result =
          antimirovUnion(
              restrict(elem, d.getFirstChild(), cond), restrict(elem, d.getSecondChild(), cond));
    } else if (d.isIte()) {
      Term c = d.getFirstChild();
      Term thenPath = conditions.simplify(elem, bs.mkAnd(cond, c));
      Term elsePath = conditions.simplify(elem, bs.mkAnd(cond, bs.mkNot(c)));
      if (thenPath.isFalse()) {
        result = restrict(elem, d.getChildAtIndex(2), cond);
      } else if (elsePath.isFalse()) {
        result = restrict(elem, d.getSecondChild(), cond);
      } else {
        result =
            mkIte(
                c,
                restrict(elem, d.getSecondChild(), thenPath),
                restrict(elem, d.getChildAtIndex(2), elsePath));
      }
    } else if (d.isUnion()) {
      result =
          union(restrict(elem, d.getFirstChild(), cond), restrict(elem, d.getSecondChild(), cond));
    } else {
      result = d;
    }
    cache.insert(OpTag.RESTRICT, d, cond, elem, result);
    return checked(result);
  }
}
