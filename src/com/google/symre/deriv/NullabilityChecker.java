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
import com.google.symre.term.SeqTerms;
import com.google.symre.term.Term;
import com.google.symre.term.TermManager;

/** Computes the condition under which a regex accepts the empty sequence. */
public final class NullabilityChecker {

  private final TermManager tm;
  private final BooleanSimplifier bs;
  private final SeqTerms seqs;
  private final OpCache cache;

  NullabilityChecker(TermManager tm, BooleanSimplifier bs, SeqTerms seqs, OpCache cache) {
    this.tm = tm;
    this.bs = bs;
    this.seqs = seqs;
    this.cache = cache;
  }

  /**
   * Returns a boolean term that holds exactly when {@code r} accepts the empty sequence. This is
   * {@code true} or {@code false} whenever that is known statically.
   */
  public Term nullable(Term r) {
    switch (r.getNullable()) {
      case TRUE:
        return tm.mkTrue();
      case FALSE:
        return tm.mkFalse();
      default:
        break;
    }
    Term cached = cache.find(OpTag.IS_NULLABLE, r, null, null);
    if (cached != null) {
      return cached;
    }
    Term result = nullableRec(r);
    cache.insert(OpTag.IS_NULLABLE, r, null, null, result);
    return result;
  }

  private Term nullableRec(Term r) {
    switch (r.getToken()) {
      case RE_CONCAT:
      case RE_INTERSECT:
        return bs.mkAnd(nullable(r.getFirstChild()), nullable(r.getSecondChild()));
      case RE_UNION:
      case RE_ANTIMIROV_UNION:
        return bs.mkOr(nullable(r.getFirstChild()), nullable(r.getSecondChild()));
      case RE_DIFF:
        return bs.mkAnd(nullable(r.getFirstChild()), bs.mkNot(nullable(r.getSecondChild())));
      case RE_STAR:
      case RE_OPT:
      case RE_FULL_SEQ:
      case RE_EPSILON:
        return tm.mkTrue();
      case RE_FULL_CHAR:
      case RE_EMPTY:
      case RE_OF_PREDICATE:
      case RE_RANGE:
        return tm.mkFalse();
      case RE_LOOP:
        if (r.getLoopLower() > r.getLoopUpper()) {
          return tm.mkFalse();
        }
        return r.getLoopLower() == 0 ? tm.mkTrue() : nullable(r.getFirstChild());
      case RE_PLUS:
      case RE_REVERSE:
        return nullable(r.getFirstChild());
      case RE_COMPLEMENT:
        return bs.mkNot(nullable(r.getFirstChild()));
      case RE_TO_SEQ:
        return seqs.mkIsEmpty(r.getFirstChild());
      case ITE:
        return bs.mkIte(
            r.getFirstChild(), nullable(r.getSecondChild()), nullable(r.getChildAtIndex(2)));
      default:
        return nullableSymbolic(r);
    }
  }

  /**
   * Nullability of a regex variable or a chain of unevaluated derivatives. A chain {@code
   * D(c1, D(c2, to_re(s)))} accepts the empty sequence iff {@code s = c2 c1}.
   */
  private Term nullableSymbolic(Term r) {
    Term elems = tm.mkString("");
    Term base = r;
    while (base.isDerivative()) {
      elems = seqs.mkConcat(seqs.mkUnit(base.getFirstChild()), elems);
      base = base.getSecondChild();
    }
    if (base != r && base.isToSeq()) {
      return bs.mkEq(elems, base.getFirstChild());
    }
    return tm.mkInRe(tm.mkString(""), r);
  }
}
