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

import com.google.symre.base.Tri;
import com.google.symre.term.SeqTerms;
import com.google.symre.term.Term;
import com.google.symre.term.TermManager;
import com.google.symre.term.Token;
import org.jspecify.annotations.Nullable;

/**
 * Simplifying constructors for plain regex terms: the leaves of derivatives and the operands the
 * combinators bottom out in. Unions and intersections are kept as sorted, duplicate-free chains
 * through {@link RegexSetMerger}.
 */
public final class RegexSimplifier {

  private final TermManager tm;
  private final SeqTerms seqs;

  public RegexSimplifier(TermManager tm, SeqTerms seqs) {
    this.tm = tm;
    this.seqs = seqs;
  }

  public Term mkConcat(Term a, Term b) {
    if (a.isFullSeq() && b.isFullSeq()) {
      return a;
    }
    if (a.isEmptyRegex() || b.isEpsilon()) {
      return a;
    }
    if (b.isEmptyRegex() || a.isEpsilon()) {
      return b;
    }
    if ((a.isFullChar() && b.isFullSeq()) || (a.isFullSeq() && b.isFullChar())) {
      return tm.mkDotPlus();
    }
    if (a.isToSeq() && b.isToSeq()) {
      return tm.mkToSeq(seqs.mkConcat(a.getFirstChild(), b.getFirstChild()));
    }
    Term fused = fuse(a, b);
    if (fused != null) {
      return fused;
    }
    if (a.isStar() && a.getFirstChild() == b) {
      return tm.mkConcat(b, a);
    }
    if (a.isConcat()) {
      return mkConcat(a.getFirstChild(), mkConcat(a.getSecondChild(), b));
    }
    if (b.isConcat()) {
      Term b1 = b.getFirstChild();
      Term head = fuse(a, b1);
      if (head == null && a.isToSeq() && b1.isToSeq()) {
        head = tm.mkToSeq(seqs.mkConcat(a.getFirstChild(), b1.getFirstChild()));
      }
      if (head != null) {
        return mkConcat(head, b.getSecondChild());
      }
    }
    return tm.mkConcat(a, b);
  }

  /** Combines adjacent repetitions of the same regex, or returns null. */
  private @Nullable Term fuse(Term a, Term b) {
    if (a.isStar() && b.isStar() && a.getFirstChild() == b.getFirstChild()) {
      return a;
    }
    if (a.isLoop() && b.isLoop() && a.getFirstChild() == b.getFirstChild()) {
      return mkLoop(
          a.getFirstChild(),
          a.getLoopLower() + b.getLoopLower(),
          addBounds(a.getLoopUpper(), b.getLoopUpper()));
    }
    if (a.isLoop() && b.isStar() && a.getFirstChild() == b.getFirstChild()) {
      return mkLoop(a.getFirstChild(), a.getLoopLower(), Term.UNBOUNDED);
    }
    if (a.isStar() && b.isLoop() && a.getFirstChild() == b.getFirstChild()) {
      return mkLoop(b.getFirstChild(), b.getLoopLower(), Term.UNBOUNDED);
    }
    if (a.isLoop() && a.getFirstChild() == b) {
      return mkLoop(b, a.getLoopLower() + 1, addBounds(a.getLoopUpper(), 1));
    }
    if (b.isLoop() && b.getFirstChild() == a) {
      return mkLoop(a, b.getLoopLower() + 1, addBounds(b.getLoopUpper(), 1));
    }
    return null;
  }

  private static int addBounds(int a, int b) {
    if (a == Term.UNBOUNDED || b == Term.UNBOUNDED) {
      return Term.UNBOUNDED;
    }
    long sum = (long) a + b;
    return sum >= Term.UNBOUNDED ? Term.UNBOUNDED : (int) sum;
  }

  public Term mkUnion(Term a, Term b) {
    if (a == b || b.isEmptyRegex() || a.isFullSeq()) {
      return a;
    }
    if (a.isEmptyRegex() || b.isFullSeq()) {
      return b;
    }
    if (a.isDotPlus() && b.getMinLength() > 0) {
      return a;
    }
    if (b.isDotPlus() && a.getMinLength() > 0) {
      return b;
    }
    if ((a.isDotPlus() && b.isEpsilon()) || (a.isEpsilon() && b.isDotPlus())) {
      return tm.mkFullSeq();
    }
    return RegexSetMerger.merge(a, b, tm.mkFullSeq(), Token.RE_UNION, this::composeUnion);
  }

  private Term composeUnion(Term a, Term b) {
    if (isSubset(a, b)) {
      return b;
    }
    if (isSubset(b, a)) {
      return a;
    }
    Term merged = mergeLoops(a, b);
    if (merged != null) {
      return merged;
    }
    if (b.isUnion()) {
      Term merged1 = mergeLoops(a, b.getFirstChild());
      if (merged1 != null) {
        return mkUnion(merged1, b.getSecondChild());
      }
    }
    return tm.mkUnion(a, b);
  }

  /**
   * Unions two repetitions of the same body (optionally followed by the same suffix) whose trip
   * counts overlap or touch, or returns null.
   */
  private @Nullable Term mergeLoops(Term a, Term b) {
    Term suffix = null;
    if (a.isConcat() && b.isConcat() && a.getSecondChild() == b.getSecondChild()) {
      suffix = a.getSecondChild();
      a = a.getFirstChild();
      b = b.getFirstChild();
    }
    if (!a.isLoop() || !b.isLoop() || a.getFirstChild() != b.getFirstChild()) {
      return null;
    }
    if (a.getLoopLower() > b.getLoopLower()) {
      Term t = a;
      a = b;
      b = t;
    }
    if (a.hasLoopUpper() && (long) a.getLoopUpper() + 1 < b.getLoopLower()) {
      return null;
    }
    int hi = Math.max(a.getLoopUpper(), b.getLoopUpper());
    Term loop = mkLoop(a.getFirstChild(), a.getLoopLower(), hi);
    return suffix == null ? loop : mkConcat(loop, suffix);
  }

  public Term mkIntersect(Term a, Term b) {
    if (a.isEpsilon()) {
      Term t = a;
      a = b;
      b = t;
    }
    if (a == b || a.isEmptyRegex() || b.isFullSeq()) {
      return a;
    }
    if (b.isEmptyRegex() || a.isFullSeq()) {
      return b;
    }
    if (b.isEpsilon()) {
      if (a.getNullable() == Tri.TRUE) {
        return b;
      }
      if (a.getNullable() == Tri.FALSE) {
        return tm.mkEmpty();
      }
    }
    if (a.isDotPlus() && b.getMinLength() > 0) {
      return b;
    }
    if (b.isDotPlus() && a.getMinLength() > 0) {
      return a;
    }
    if (a.getMinLength() > b.getMaxLength() || b.getMinLength() > a.getMaxLength()) {
      return tm.mkEmpty();
    }
    return RegexSetMerger.merge(a, b, tm.mkEmpty(), Token.RE_INTERSECT, this::composeIntersect);
  }

  private Term composeIntersect(Term a, Term b) {
    if (isSubset(a, b)) {
      return a;
    }
    if (isSubset(b, a)) {
      return b;
    }
    return tm.mkIntersect(a, b);
  }

  public Term mkDiff(Term a, Term b) {
    return mkIntersect(a, mkComplement(b));
  }

  public Term mkComplement(Term a) {
    switch (a.getToken()) {
      case RE_EMPTY:
        return tm.mkFullSeq();
      case RE_FULL_SEQ:
        return tm.mkEmpty();
      case RE_EPSILON:
        return tm.mkDotPlus();
      case RE_COMPLEMENT:
        return a.getFirstChild();
      case RE_INTERSECT:
        return mkUnion(mkComplement(a.getFirstChild()), mkComplement(a.getSecondChild()));
      case RE_UNION:
        return mkIntersect(mkComplement(a.getFirstChild()), mkComplement(a.getSecondChild()));
      default:
        if (a.isDotPlus()) {
          return tm.mkEpsilon();
        }
        return tm.mkComplement(a);
    }
  }

  public Term mkStar(Term a) {
    switch (a.getToken()) {
      case RE_STAR:
      case RE_FULL_SEQ:
        return a;
      case RE_FULL_CHAR:
        return tm.mkFullSeq();
      case RE_EMPTY:
      case RE_EPSILON:
        return tm.mkEpsilon();
      case RE_PLUS:
      case RE_OPT:
        return mkStar(a.getFirstChild());
      case RE_UNION:
        {
          Term a1 = a.getFirstChild();
          Term a2 = a.getSecondChild();
          if (a1.isEpsilon()) {
            return mkStar(a2);
          }
          if (a2.isEpsilon()) {
            return mkStar(a1);
          }
          if (a1.isStar() || a2.isStar()) {
            return mkStar(mkUnion(unstar(a1), unstar(a2)));
          }
          return tm.mkStar(a);
        }
      default:
        if (a.isDotPlus()) {
          return tm.mkFullSeq();
        }
        return tm.mkStar(a);
    }
  }

  private static Term unstar(Term a) {
    return a.isStar() ? a.getFirstChild() : a;
  }

  public Term mkPlus(Term a) {
    switch (a.getToken()) {
      case RE_EMPTY:
      case RE_EPSILON:
      case RE_FULL_SEQ:
      case RE_PLUS:
      case RE_STAR:
        return a;
      case RE_OPT:
        return mkStar(a.getFirstChild());
      default:
        return tm.mkPlus(a);
    }
  }

  public Term mkOpt(Term a) {
    if (a.isEmptyRegex() || a.isEpsilon()) {
      return tm.mkEpsilon();
    }
    if (a.getNullable() == Tri.TRUE) {
      return a;
    }
    return tm.mkOpt(a);
  }

  /** {@code a{lo,hi}}, where {@code hi} may be {@link Term#UNBOUNDED}. */
  public Term mkLoop(Term a, int lo, int hi) {
    if (lo > hi) {
      return tm.mkEmpty();
    }
    if (hi == 0 || a.isEpsilon()) {
      return tm.mkEpsilon();
    }
    if (a.isEmptyRegex()) {
      return lo == 0 ? tm.mkEpsilon() : a;
    }
    if (lo == 1 && hi == 1) {
      return a;
    }
    if (lo == 0 && hi == Term.UNBOUNDED) {
      return mkStar(a);
    }
    if (a.isLoop()) {
      Term body = a.getFirstChild();
      int innerLo = a.getLoopLower();
      if (a.hasLoopUpper() && innerLo == a.getLoopUpper() && lo == hi) {
        return mkLoop(body, innerLo * lo, innerLo * lo);
      }
      if (!a.hasLoopUpper() && hi == Term.UNBOUNDED && lo > 0) {
        return mkLoop(body, innerLo * lo, Term.UNBOUNDED);
      }
    }
    return tm.mkLoop(a, lo, hi);
  }

  /** A character range; empty unless both bounds may denote single characters in order. */
  public Term mkRange(Term lo, Term hi) {
    if (lo.getMinLength() > 1 || hi.getMinLength() > 1) {
      return tm.mkEmpty();
    }
    if (lo.getMaxLength() == 0 || hi.getMaxLength() == 0) {
      return tm.mkEmpty();
    }
    if (lo.isStringLit() && hi.isStringLit()) {
      String l = lo.getString();
      String h = hi.getString();
      if (l.codePointCount(0, l.length()) != 1 || h.codePointCount(0, h.length()) != 1) {
        return tm.mkEmpty();
      }
      if (l.codePointAt(0) > h.codePointAt(0)) {
        return tm.mkEmpty();
      }
    }
    return tm.mkRange(lo, hi);
  }

  /** A regex-valued if-then-else with constant folding of the condition. */
  public Term mkIte(Term c, Term t, Term e) {
    if (c.isTrue() || t == e) {
      return t;
    }
    if (c.isFalse()) {
      return e;
    }
    if (c.isNot()) {
      return tm.mkIte(c.getFirstChild(), e, t);
    }
    return tm.mkIte(c, t, e);
  }

  /**
   * A conservative language inclusion test: true only if {@code a} is known to be a subset of
   * {@code b}.
   */
  public boolean isSubset(Term a, Term b) {
    if (a.isComplement() && b.isComplement()) {
      return isSubset(b.getFirstChild(), a.getFirstChild());
    }
    while (true) {
      if (a == b || b.isFullSeq() || a.isEmptyRegex()) {
        return true;
      }
      if (a.isEpsilon() && b.getNullable() == Tri.TRUE) {
        return true;
      }
      if (b.isDotPlus() && a.getMinLength() > 0) {
        return true;
      }
      if (a.isConcat() && b.isConcat()) {
        Term a1 = a.getFirstChild();
        Term b1 = b.getFirstChild();
        Term a2 = a.getSecondChild();
        Term b2 = b.getSecondChild();
        if (a1 == b1) {
          a = a2;
          b = b2;
          continue;
        }
        if (b1.isFullSeq()) {
          a = a2;
          continue;
        }
        if (a2 == b2 && isLoopSubset(a1, b1)) {
          return true;
        }
        return false;
      }
      if (b.isStar() && (a == b.getFirstChild() || isLoopOf(a, b.getFirstChild()))) {
        return true;
      }
      return isLoopSubset(a, b);
    }
  }

  private static boolean isLoopOf(Term a, Term body) {
    return a.isLoop() && a.getFirstChild() == body;
  }

  private static boolean isLoopSubset(Term a, Term b) {
    if (!a.isLoop() || !b.isLoop() || a.getFirstChild() != b.getFirstChild()) {
      return false;
    }
    return b.getLoopLower() <= a.getLoopLower() && a.getLoopUpper() <= b.getLoopUpper();
  }

  /** Rebuilds {@code r} bottom-up through the simplifying constructors. */
  public Term simplify(Term r) {
    switch (r.getToken()) {
      case RE_CONCAT:
        return mkConcat(simplify(r.getFirstChild()), simplify(r.getSecondChild()));
      case RE_UNION:
      case RE_ANTIMIROV_UNION:
        return mkUnion(simplify(r.getFirstChild()), simplify(r.getSecondChild()));
      case RE_INTERSECT:
        return mkIntersect(simplify(r.getFirstChild()), simplify(r.getSecondChild()));
      case RE_DIFF:
        return mkDiff(simplify(r.getFirstChild()), simplify(r.getSecondChild()));
      case RE_STAR:
        return mkStar(simplify(r.getFirstChild()));
      case RE_PLUS:
        return mkPlus(simplify(r.getFirstChild()));
      case RE_OPT:
        return mkOpt(simplify(r.getFirstChild()));
      case RE_LOOP:
        return mkLoop(simplify(r.getFirstChild()), r.getLoopLower(), r.getLoopUpper());
      case RE_COMPLEMENT:
        return mkComplement(simplify(r.getFirstChild()));
      case RE_RANGE:
        return mkRange(r.getFirstChild(), r.getSecondChild());
      case RE_REVERSE:
        return tm.mkReverse(simplify(r.getFirstChild()));
      case ITE:
        return mkIte(
            r.getFirstChild(), simplify(r.getSecondChild()), simplify(r.getChildAtIndex(2)));
      default:
        return r;
    }
  }
}
