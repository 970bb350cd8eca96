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
import com.google.symre.term.BooleanSimplifier;
import com.google.symre.term.SeqTerms;
import com.google.symre.term.Term;
import com.google.symre.term.TermManager;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * Rewrites {@code s in r} into simpler constraints. Literal sequences against ground regexes are
 * decided outright; otherwise the sequence is split where its structure (or the structure of
 * the regex) allows and the regex is differentiated by the known part. What cannot be
 * decomposed is left as an {@code in_re} atom.
 */
public final class MembershipDecider {

  private static final Logger logger = Logger.getLogger(MembershipDecider.class.getName());

  private final TermManager tm;
  private final BooleanSimplifier bs;
  private final SeqTerms seqs;
  private final Derivatives derivatives;
  private final NullabilityChecker nullability;
  private final RegexReverser reverser;

  MembershipDecider(
      TermManager tm,
      BooleanSimplifier bs,
      SeqTerms seqs,
      Derivatives derivatives,
      NullabilityChecker nullability,
      RegexReverser reverser) {
    this.tm = tm;
    this.bs = bs;
    this.seqs = seqs;
    this.derivatives = derivatives;
    this.nullability = nullability;
    this.reverser = reverser;
  }

  public Term inRegex(Term a, Term b) {
    if (b.isEmptyRegex()) {
      return tm.mkFalse();
    }
    if (b.isFullSeq()) {
      return tm.mkTrue();
    }

    if (a.isStringLit() && b.isGround()) {
      Term decided = decideGround(a.getString(), b);
      if (decided != null) {
        return decided;
      }
    }

    Term lifted = liftSequence(b);
    if (lifted != null) {
      return bs.mkEq(a, lifted);
    }

    if (b.isConcat()) {
      Term b1 = b.getFirstChild();
      Term b2 = b.getSecondChild();
      if (b1.isToSeq() && b2.isFullSeq()) {
        return seqs.mkPrefixOf(b1.getFirstChild(), a);
      }
      if (b1.isFullSeq() && b2.isToSeq()) {
        return seqs.mkSuffixOf(b2.getFirstChild(), a);
      }
    }

    Term optional = optionalBody(b);
    if (optional != null) {
      return bs.mkOr(seqs.mkIsEmpty(a), inRegex(a, optional));
    }

    if (a.getMaxLength() == 0) {
      return nullability.nullable(b);
    }

    SeqTerms.Split split = seqs.headTail(a);
    if (split != null) {
      return inAntimirov(split.tail(), derivatives.derivative(split.head(), b));
    }

    split = seqs.headTailReversed(a);
    if (split != null) {
      Term reversed = reverser.reverse(b);
      if (!reversed.isReverse()) {
        Term d = derivatives.plainDerivative(split.tail(), reversed);
        return inRegex(split.head(), reverser.reverse(d));
      }
    }

    if (b.isConcat()) {
      Term result = splitAtFixedLength(a, b.getFirstChild(), b.getSecondChild());
      if (result != null) {
        return result;
      }
    }

    if (logger.isLoggable(Level.FINE)) {
      logger.fine("Leaving membership unresolved: " + a + " in " + b);
    }
    return tm.mkInRe(a, b);
  }

  /**
   * Runs a literal through a ground regex. Returns null if the final nullability is not known
   * statically.
   */
  private @Nullable Term decideGround(String literal, Term b) {
    for (int i = 0; i < literal.length(); ) {
      int ch = literal.codePointAt(i);
      i += Character.charCount(ch);
      b = derivatives.plainDerivative(tm.mkChar(ch), b);
      if (b.isEmptyRegex()) {
        return tm.mkFalse();
      }
    }
    Term result = nullability.nullable(b);
    if (result.isTrue() || result.isFalse()) {
      return result;
    }
    return null;
  }

  /** The sequence a regex denotes, if it denotes exactly one (possibly under conditionals). */
  private @Nullable Term liftSequence(Term b) {
    if (b.isToSeq()) {
      return b.getFirstChild();
    }
    if (b.isEpsilon()) {
      return tm.mkString("");
    }
    if (b.isIte()) {
      Term t = liftSequence(b.getSecondChild());
      Term e = t == null ? null : liftSequence(b.getChildAtIndex(2));
      if (e != null) {
        return bs.mkIte(b.getFirstChild(), t, e);
      }
    }
    return null;
  }

  /** The body of {@code r?} or {@code () | r}. */
  private static @Nullable Term optionalBody(Term b) {
    if (b.isOpt()) {
      return b.getFirstChild();
    }
    if (b.isUnion()) {
      if (b.getFirstChild().isEpsilon()) {
        return b.getSecondChild();
      }
      if (b.getSecondChild().isEpsilon()) {
        return b.getFirstChild();
      }
    }
    return null;
  }

  /**
   * Membership of {@code t} in the derivative {@code d}, distributing over its branches. The
   * boolean structure of the derivative carries over to the result.
   */
  private Term inAntimirov(Term t, Term d) {
    switch (d.getToken()) {
      case RE_FULL_SEQ:
        return tm.mkTrue();
      case RE_EMPTY:
        return tm.mkFalse();
      case RE_EPSILON:
        return seqs.mkIsEmpty(t);
      case ITE:
        return bs.mkIte(
            d.getFirstChild(),
            inAntimirov(t, d.getSecondChild()),
            inAntimirov(t, d.getChildAtIndex(2)));
      case RE_UNION:
      case RE_ANTIMIROV_UNION:
        return bs.mkOr(inAntimirov(t, d.getFirstChild()), inAntimirov(t, d.getSecondChild()));
      default:
        if (d.isDotPlus()) {
          return bs.mkNot(seqs.mkIsEmpty(t));
        }
        return inRegex(t, d);
    }
  }

  /**
   * Splits {@code a in b1 b2} where {@code b1} or {@code b2} accepts only sequences of one fixed
   * length {@code k}, into a length constraint and two memberships of sub-sequences.
   */
  private @Nullable Term splitAtFixedLength(Term a, Term b1, Term b2) {
    Term length = seqs.mkLength(a);
    if (hasFixedLength(b1)) {
      Term k = tm.mkInt(b1.getMinLength());
      return bs.mkAnd(
          ImmutableList.of(
              bs.mkIntGe(length, k),
              inRegex(seqs.mkSubstr(a, tm.mkInt(0), k), b1),
              inRegex(seqs.mkSubstr(a, k, seqs.mkIntSub(length, k)), b2)));
    }
    if (hasFixedLength(b2)) {
      Term k = tm.mkInt(b2.getMinLength());
      Term cut = seqs.mkIntSub(length, k);
      return bs.mkAnd(
          ImmutableList.of(
              bs.mkIntGe(length, k),
              inRegex(seqs.mkSubstr(a, tm.mkInt(0), cut), b1),
              inRegex(seqs.mkSubstr(a, cut, k), b2)));
    }
    return null;
  }

  private static boolean hasFixedLength(Term r) {
    return r.getMinLength() == r.getMaxLength() && r.getMaxLength() != Term.UNBOUNDED;
  }
}
