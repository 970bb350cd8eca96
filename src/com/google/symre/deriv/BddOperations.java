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

/**
 * Operations on derivatives viewed as binary decision diagrams over character conditions.
 *
 * <p>{@link #derCond} turns a character predicate into a diagram whose leaves are epsilon (the
 * predicate holds) and the empty language (it does not), splitting on upper bounds {@code ch <=
 * k} so that range predicates share structure with the rest of the derivative.
 */
final class BddOperations {

  private final TermManager tm;
  private final BooleanSimplifier bs;
  private final RegexSimplifier re;
  private final DerivativeCombinators combinators;
  private final OpCache cache;

  BddOperations(
      TermManager tm,
      BooleanSimplifier bs,
      RegexSimplifier re,
      DerivativeCombinators combinators,
      OpCache cache) {
    this.tm = tm;
    this.bs = bs;
    this.re = re;
    this.combinators = combinators;
    this.cache = cache;
  }

  Term derUnion(Term a, Term b) {
    return derOp(OpTag.BDD_UNION, a, b);
  }

  Term derIntersect(Term a, Term b) {
    return derOp(OpTag.BDD_INTERSECT, a, b);
  }

  private Term derOp(OpTag op, Term a, Term b) {
    switch (op) {
      case BDD_UNION:
        if (a == b || b.isEmptyRegex() || a.isFullSeq()) {
          return a;
        }
        if (a.isEmptyRegex() || b.isFullSeq()) {
          return b;
        }
        break;
      case BDD_INTERSECT:
        if (a == b || a.isEmptyRegex() || b.isFullSeq()) {
          return a;
        }
        if (b.isEmptyRegex() || a.isFullSeq()) {
          return b;
        }
        break;
      default:
        throw new IllegalArgumentException("not a binary diagram operation: " + op);
    }
    Term cached = cache.find(op, a, b, null);
    if (cached != null) {
      return cached;
    }
    Term result = derOpRec(op, a, b);
    cache.insert(op, a, b, null, result);
    return result;
  }

  private Term derOpRec(OpTag op, Term a, Term b) {
    if (op == OpTag.BDD_UNION && (a.isAntimirovUnion() || b.isAntimirovUnion())) {
      return combinators.antimirovUnion(a, b);
    }
    if (a.isAntimirovUnion()) {
      return combinators.antimirovUnion(
          derOp(op, a.getFirstChild(), b), derOp(op, a.getSecondChild(), b));
    }
    if (b.isAntimirovUnion()) {
      return combinators.antimirovUnion(
          derOp(op, a, b.getFirstChild()), derOp(op, a, b.getSecondChild()));
    }
    if (a.isIte() || b.isIte()) {
      return combinators.applyIte(a, b, (x, y) -> derOp(op, x, y));
    }
    return op == OpTag.BDD_UNION ? re.mkUnion(a, b) : re.mkIntersect(a, b);
  }

  /** The complement of a derivative, computed leafwise. */
  Term derComplement(Term r) {
    Term cached = cache.find(OpTag.BDD_COMPLEMENT, r, null, null);
    if (cached != null) {
      return cached;
    }
    Term result;
    if (r.isAntimirovUnion()) {
      result =
          derIntersect(derComplement(r.getFirstChild()), derComplement(r.getSecondChild()));
    } else if (r.isIte()) {
      result =
          combinators.mkIte(
              r.getFirstChild(),
              derComplement(r.getSecondChild()),
              derComplement(r.getChildAtIndex(2)));
    } else {
      result = re.mkComplement(r);
    }
    cache.insert(OpTag.BDD_COMPLEMENT, r, null, null, result);
    return result;
  }

  /** The diagram that accepts epsilon exactly when {@code cond} holds of {@code ch}. */
  Term derCond(Term cond, Term ch) {
    switch (cond.getToken()) {
      case TRUE:
        return tm.mkEpsilon();
      case FALSE:
        return tm.mkEmpty();
      case NOT:
        return predicateNot(derCond(cond.getFirstChild(), ch));
      case AND:
        {
          Term result = tm.mkEpsilon();
          for (Term child : cond.getChildren()) {
            result = derIntersect(result, derCond(child, ch));
          }
          return result;
        }
      case OR:
        {
          Term result = tm.mkEmpty();
          for (Term child : cond.getChildren()) {
            result = derUnion(result, derCond(child, ch));
          }
          return result;
        }
      case EQ:
        {
          Term a = cond.getFirstChild();
          Term b = cond.getSecondChild();
          if ((a == ch && b.isCharLit()) || (b == ch && a.isCharLit())) {
            return derIntersect(
                derCond(bs.mkCharLe(a, b), ch), derCond(bs.mkCharLe(b, a), ch));
          }
          return predicate(cond);
        }
      case CHAR_LE:
        {
          Term lo = cond.getFirstChild();
          if (lo.isCharLit() && cond.getSecondChild() == ch) {
            // k <= ch is the negation of ch <= k - 1.
            int k = lo.getCharCode();
            return k == 0
                ? tm.mkEpsilon()
                : predicateNot(predicate(bs.mkCharLe(ch, tm.mkChar(k - 1))));
          }
          return predicate(cond);
        }
      default:
        return predicate(cond);
    }
  }

  private Term predicate(Term cond) {
    return combinators.mkIte(cond, tm.mkEpsilon(), tm.mkEmpty());
  }

  /**
   * Negates a predicate diagram. Complementing leafwise and keeping only the empty sequence swaps
   * the epsilon and empty leaves.
   */
  private Term predicateNot(Term d) {
    return derIntersect(tm.mkEpsilon(), derComplement(d));
  }
}
