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
import com.google.symre.term.Term;
import com.google.symre.term.TermManager;

/**
 * Pushes reversal into a regex. The result accepts the reverses of the sequences {@code r}
 * accepts and has a reverse node only above operands that cannot be reversed syntactically
 * (regex variables, stuck derivatives and symbolic sequences).
 */
public final class RegexReverser {

  private final TermManager tm;
  private final RegexSimplifier re;
  private final OpCache cache;

  RegexReverser(TermManager tm, RegexSimplifier re, OpCache cache) {
    this.tm = tm;
    this.re = re;
    this.cache = cache;
  }

  public Term reverse(Term r) {
    switch (r.getToken()) {
      case RE_EMPTY:
      case RE_EPSILON:
      case RE_FULL_CHAR:
      case RE_FULL_SEQ:
      case RE_RANGE:
      case RE_OF_PREDICATE:
        return r;
      case RE_REVERSE:
        return r.getFirstChild();
      default:
        break;
    }
    Term cached = cache.find(OpTag.REVERSE, r, null, null);
    if (cached != null) {
      return cached;
    }
    return cache.insert(OpTag.REVERSE, r, null, null, reverseRec(r));
  }

  private Term reverseRec(Term r) {
    switch (r.getToken()) {
      case RE_TO_SEQ:
        return reverseSequence(r.getFirstChild());
      case RE_CONCAT:
        return re.mkConcat(reverse(r.getSecondChild()), reverse(r.getFirstChild()));
      case RE_UNION:
      case RE_ANTIMIROV_UNION:
        return re.mkUnion(reverse(r.getFirstChild()), reverse(r.getSecondChild()));
      case RE_INTERSECT:
        return re.mkIntersect(reverse(r.getFirstChild()), reverse(r.getSecondChild()));
      case RE_DIFF:
        return re.mkDiff(reverse(r.getFirstChild()), reverse(r.getSecondChild()));
      case RE_STAR:
        return re.mkStar(reverse(r.getFirstChild()));
      case RE_PLUS:
        return re.mkPlus(reverse(r.getFirstChild()));
      case RE_OPT:
        return re.mkOpt(reverse(r.getFirstChild()));
      case RE_COMPLEMENT:
        return re.mkComplement(reverse(r.getFirstChild()));
      case RE_LOOP:
        return re.mkLoop(reverse(r.getFirstChild()), r.getLoopLower(), r.getLoopUpper());
      case ITE:
        return re.mkIte(
            r.getFirstChild(), reverse(r.getSecondChild()), reverse(r.getChildAtIndex(2)));
      default:
        return tm.mkReverse(r);
    }
  }

  private Term reverseSequence(Term s) {
    switch (s.getToken()) {
      case STRING:
        return tm.mkToSeq(new StringBuilder(s.getString()).reverse().toString());
      case SEQ_UNIT:
        return tm.mkToSeq(s);
      case SEQ_CONCAT:
        return re.mkConcat(
            reverseSequence(s.getSecondChild()), reverseSequence(s.getFirstChild()));
      default:
        return tm.mkReverse(tm.mkToSeq(s));
    }
  }
}
