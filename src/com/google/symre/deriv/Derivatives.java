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

import com.google.common.collect.ImmutableList;
import com.google.symre.deriv.OpCache.OpTag;
import com.google.symre.term.BooleanSimplifier;
import com.google.symre.term.SeqTerms;
import com.google.symre.term.Term;
import com.google.symre.term.TermManager;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * Computes the derivative of a regex with respect to a character under a path condition. The
 * character may be a literal or symbolic; the result is in normal form (see {@link
 * NormalFormValidator}) and branches whose guard contradicts the path are pruned.
 */
public final class Derivatives {

  private static final Logger logger = Logger.getLogger(Derivatives.class.getName());

  private final TermManager tm;
  private final BooleanSimplifier bs;
  private final SeqTerms seqs;
  private final ConditionSimplifier conditions;
  private final RegexSimplifier re;
  private final DerivativeCombinators combinators;
  private final BddOperations bdd;
  private final NullabilityChecker nullability;
  private final RegexReverser reverser;
  private final OpCache cache;
  private final @Nullable NormalFormValidator validator;

  Derivatives(
      TermManager tm,
      BooleanSimplifier bs,
      SeqTerms seqs,
      ConditionSimplifier conditions,
      RegexSimplifier re,
      DerivativeCombinators combinators,
      BddOperations bdd,
      NullabilityChecker nullability,
      RegexReverser reverser,
      OpCache cache,
      @Nullable NormalFormValidator validator) {
    this.tm = tm;
    this.bs = bs;
    this.seqs = seqs;
    this.conditions = conditions;
    this.re = re;
    this.combinators = combinators;
    this.bdd = bdd;
    this.nullability = nullability;
    this.reverser = reverser;
    this.cache = cache;
    this.validator = validator;
  }

  /** The derivative of {@code r} by {@code elem} with a trivial path condition. */
  public Term derivative(Term elem, Term r) {
    return derivative(elem, r, tm.mkTrue());
  }

  public Term derivative(Term elem, Term r, Term path) {
    if (path.isFalse()) {
      return tm.mkEmpty();
    }
    Term cached = cache.find(OpTag.DERIVATIVE, elem, r, path);
    if (cached != null) {
      return cached;
    }
    Term result = derivativeRec(elem, r, path);
    if (validator != null) {
      validator.validateDerivative(result);
    }
    if (logger.isLoggable(Level.FINEST)) {
      logger.finest("D(" + elem + ", " + r + ") under " + path + " = " + result);
    }
    cache.insert(OpTag.DERIVATIVE, elem, r, path, result);
    return result;
  }

  /**
   * The derivative with antimirov unions replaced by plain unions, which is what callers outside
   * the engine see.
   */
  public Term plainDerivative(Term elem, Term r) {
    return withoutAntimirovUnions(derivative(elem, r));
  }

  private Term withoutAntimirovUnions(Term d) {
    if (!d.isAntimirovUnion()) {
      return d;
    }
    return combinators.union(d.getFirstChild(), withoutAntimirovUnions(d.getSecondChild()));
  }

  private Term derivativeRec(Term elem, Term r, Term path) {
    switch (r.getToken()) {
      case RE_EMPTY:
      case RE_EPSILON:
        return tm.mkEmpty();
      case RE_FULL_CHAR:
        return tm.mkEpsilon();
      case RE_FULL_SEQ:
        return r;
      case RE_TO_SEQ:
        return toSeqDerivative(elem, r.getFirstChild(), path);
      case RE_CONCAT:
        return concatDerivative(elem, r.getFirstChild(), r.getSecondChild(), path);
      case RE_UNION:
        return combinators.union(
            derivative(elem, r.getFirstChild(), path), derivative(elem, r.getSecondChild(), path));
      case RE_ANTIMIROV_UNION:
        return combinators.antimirovUnion(
            derivative(elem, r.getFirstChild(), path), derivative(elem, r.getSecondChild(), path));
      case RE_INTERSECT:
        return combinators.intersect(
            elem,
            derivative(elem, r.getFirstChild(), path),
            derivative(elem, r.getSecondChild(), path),
            path);
      case RE_DIFF:
        return combinators.intersect(
            elem,
            derivative(elem, r.getFirstChild(), path),
            combinators.negate(elem, derivative(elem, r.getSecondChild(), path)),
            path);
      case RE_COMPLEMENT:
        return combinators.negate(elem, derivative(elem, r.getFirstChild(), path));
      case RE_STAR:
        return combinators.concat(derivative(elem, r.getFirstChild(), path), r);
      case RE_PLUS:
        return combinators.concat(
            derivative(elem, r.getFirstChild(), path), re.mkStar(r.getFirstChild()));
      case RE_OPT:
        return derivative(elem, r.getFirstChild(), path);
      case RE_LOOP:
        return loopDerivative(elem, r, path);
      case ITE:
        return conditionalDerivative(elem, r, path);
      case RE_RANGE:
        return rangeDerivative(elem, r.getFirstChild(), r.getSecondChild(), path);
      case RE_OF_PREDICATE:
        {
          Term cond = bs.applyPredicate(r.getFirstChild(), elem);
          return combinators.restrict(elem, bdd.derCond(cond, elem), path);
        }
      case RE_REVERSE:
        return reverseDerivative(elem, r, path);
      default:
        // Regex variables and unevaluated derivatives.
        return tm.mkDerivative(elem, r);
    }
  }

  /** Keeps {@code then} when {@code cond} holds and the empty language otherwise. */
  private Term guarded(Term elem, Term cond, Term then, Term path) {
    if (cond.isTrue()) {
      return then;
    }
    if (cond.isFalse() || conditions.simplify(elem, bs.mkAnd(path, cond)).isFalse()) {
      return tm.mkEmpty();
    }
    if (conditions.simplify(elem, bs.mkAnd(path, bs.mkNot(cond))).isFalse()) {
      return then;
    }
    return combinators.mkIte(cond, then, tm.mkEmpty());
  }

  private Term toSeqDerivative(Term elem, Term s, Term path) {
    SeqTerms.Split split = seqs.headTail(s);
    if (split != null) {
      return guarded(elem, bs.mkEq(elem, split.head()), tm.mkToSeq(split.tail()), path);
    }
    Term cond = bs.mkAnd(bs.mkNot(seqs.mkIsEmpty(s)), bs.mkEq(seqs.mkFirst(s), elem));
    return guarded(elem, cond, tm.mkToSeq(seqs.mkRest(s)), path);
  }

  private Term concatDerivative(Term elem, Term r1, Term r2, Term path) {
    Term head = combinators.concat(derivative(elem, r1, path), r2);
    Term r1Nullable = nullability.nullable(r1);
    if (bs.mkAnd(path, r1Nullable).isFalse()) {
      return head;
    }
    Term tail = derivative(elem, r2, path);
    if (tail.isEmptyRegex()) {
      return head;
    }
    return combinators.antimirovUnion(head, combinators.mkIte(r1Nullable, tail, tm.mkEmpty()));
  }

  private Term loopDerivative(Term elem, Term r, Term path) {
    Term body = r.getFirstChild();
    int lo = r.getLoopLower();
    int hi = r.getLoopUpper();
    if (hi == 0 || lo > hi) {
      return tm.mkEmpty();
    }
    Term rest;
    if (!r.hasLoopUpper()) {
      rest = lo <= 1 ? re.mkStar(body) : re.mkLoop(body, lo - 1, Term.UNBOUNDED);
    } else {
      rest = re.mkLoop(body, Math.max(lo - 1, 0), hi - 1);
    }
    return combinators.concat(derivative(elem, body, path), rest);
  }

  private Term conditionalDerivative(Term elem, Term r, Term path) {
    Term c = r.getFirstChild();
    Term thenPath = conditions.simplify(elem, bs.mkAnd(path, c));
    Term elsePath = conditions.simplify(elem, bs.mkAnd(path, bs.mkNot(c)));
    if (thenPath.isFalse()) {
      return derivative(elem, r.getChildAtIndex(2), path);
    }
    if (elsePath.isFalse()) {
      return derivative(elem, r.getSecondChild(), path);
    }
    return combinators.mkIte(
        c,
        derivative(elem, r.getSecondChild(), thenPath),
        derivative(elem, r.getChildAtIndex(2), elsePath));
  }

  private Term rangeDerivative(Term elem, Term lo, Term hi, Term path) {
    SeqTerms.Split first = seqs.headTail(lo);
    SeqTerms.Split last = seqs.headTail(hi);
    Term cond;
    if (first != null
        && last != null
        && first.tail().isEmptyString()
        && last.tail().isEmptyString()) {
      cond = bs.mkAnd(bs.mkCharLe(first.head(), elem), bs.mkCharLe(elem, last.head()));
    } else {
      Term one = tm.mkInt(1);
      cond =
          bs.mkAnd(
              ImmutableList.of(
                  bs.mkEq(seqs.mkLength(lo), one),
                  bs.mkEq(seqs.mkLength(hi), one),
                  bs.mkCharLe(seqs.mkFirst(lo), elem),
                  bs.mkCharLe(elem, seqs.mkFirst(hi))));
    }
    return guarded(elem, cond, tm.mkEpsilon(), path);
  }

  private Term reverseDerivative(Term elem, Term r, Term path) {
    Term body = r.getFirstChild();
    if (body.isToSeq()) {
      Term s = body.getFirstChild();
      SeqTerms.Split split = seqs.headTailReversed(s);
      if (split != null) {
        return guarded(
            elem, bs.mkEq(elem, split.tail()), reverser.reverse(tm.mkToSeq(split.head())), path);
      }
      Term cond = bs.mkAnd(bs.mkNot(seqs.mkIsEmpty(s)), bs.mkEq(seqs.mkLast(s), elem));
      return guarded(elem, cond, reverser.reverse(tm.mkToSeq(seqs.mkButLast(s))), path);
    }
    Term reversed = reverser.reverse(body);
    if (reversed.isReverse()) {
      return tm.mkDerivative(elem, r);
    }
    return derivative(elem, reversed, path);
  }
}
