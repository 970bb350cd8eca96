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

package com.google.symre.term;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * Creates and interns terms. The {@code mk} methods here perform no simplification beyond sort
 * checking and the normalization of {@code to_re("")} to epsilon; simplifying constructors live in
 * {@link BooleanSimplifier}, {@link SeqTerms} and the regex simplifier of the derivative engine.
 *
 * <p>Not thread safe.
 */
public final class TermManager {

  /** Largest character code of the default (Unicode) character domain. */
  public static final int DEFAULT_MAX_CHAR = 0x2FFFF;

  private static final String BOUND_CHAR_NAME = "?x";

  @AutoValue
  abstract static class TermKey {
    abstract Token token();

    abstract @Nullable String text();

    abstract int value();

    abstract int upper();

    abstract ImmutableList<Term> children();

    static TermKey create(
        Token token, @Nullable String text, int value, int upper, ImmutableList<Term> children) {
      return new AutoValue_TermManager_TermKey(token, text, value, upper, children);
    }
  }

  private final Map<TermKey, Term> table = new HashMap<>();
  private final int maxChar;
  private int nextId = 0;

  public TermManager() {
    this(DEFAULT_MAX_CHAR);
  }

  public TermManager(int maxChar) {
    checkArgument(maxChar > 0, "bad character domain %s", maxChar);
    this.maxChar = maxChar;
  }

  /** Largest character code; the character domain is {@code [0, maxChar]}. */
  public int getMaxChar() {
    return maxChar;
  }

  /** Number of distinct terms created so far. */
  public int size() {
    return table.size();
  }

  private Term make(Token token, @Nullable String text, int value, int upper, Term... children) {
    ImmutableList<Term> kids = ImmutableList.copyOf(children);
    TermKey key = TermKey.create(token, text, value, upper, kids);
    Term existing = table.get(key);
    if (existing != null) {
      return existing;
    }
    Sort sort = token.getSort();
    if (sort == null) {
      sort = kids.get(1).getSort();
    }
    Term term =
        new Term(
            token,
            sort,
            kids,
            text,
            value,
            upper,
            nextId++,
            TermFacts.compute(token, kids, text, value, upper));
    table.put(key, term);
    return term;
  }

  /** Rebuilds {@code t} with new children and the same operator and payload, unsimplified. */
  public Term withChildren(Term t, List<Term> children) {
    checkArgument(children.size() == t.getChildCount(), "arity mismatch for %s", t);
    return make(
        t.getToken(),
        rawText(t),
        rawValue(t),
        t.isLoop() ? t.getLoopUpper() : 0,
        children.toArray(new Term[0]));
  }

  private static @Nullable String rawText(Term t) {
    switch (t.getToken()) {
      case STRING:
      case CHAR_VAR:
      case CHAR_BOUND_VAR:
      case SEQ_VAR:
      case BOOL_VAR:
      case RE_VAR:
      case PRED_VAR:
        return t.getString();
      default:
        return null;
    }
  }

  private static int rawValue(Term t) {
    switch (t.getToken()) {
      case CHAR_LIT:
        return t.getCharCode();
      case INT_LIT:
        return t.getIntValue();
      case RE_LOOP:
        return t.getLoopLower();
      default:
        return 0;
    }
  }

  private Term make(Token token, Term... children) {
    return make(token, null, 0, 0, children);
  }

  private static void checkSort(Term t, Sort sort) {
    checkState(t.getSort() == sort, "expected %s but was %s: %s", sort, t.getSort(), t);
  }

  // Booleans.

  public Term mkTrue() {
    return make(Token.TRUE);
  }

  public Term mkFalse() {
    return make(Token.FALSE);
  }

  public Term mkBool(boolean value) {
    return value ? mkTrue() : mkFalse();
  }

  public Term mkBoolVar(String name) {
    return make(Token.BOOL_VAR, name, 0, 0);
  }

  public Term mkNot(Term a) {
    checkSort(a, Sort.BOOL);
    return make(Token.NOT, a);
  }

  public Term mkAnd(List<Term> args) {
    checkArgument(args.size() >= 2, "and needs two operands: %s", args);
    for (Term arg : args) {
      checkSort(arg, Sort.BOOL);
    }
    return make(Token.AND, args.toArray(new Term[0]));
  }

  public Term mkOr(List<Term> args) {
    checkArgument(args.size() >= 2, "or needs two operands: %s", args);
    for (Term arg : args) {
      checkSort(arg, Sort.BOOL);
    }
    return make(Token.OR, args.toArray(new Term[0]));
  }

  public Term mkEq(Term a, Term b) {
    checkState(a.getSort() == b.getSort(), "eq over different sorts: %s %s", a, b);
    return make(Token.EQ, a, b);
  }

  /** {@code a <= b} on character codes. */
  public Term mkCharLe(Term a, Term b) {
    checkSort(a, Sort.CHAR);
    checkSort(b, Sort.CHAR);
    return make(Token.CHAR_LE, a, b);
  }

  public Term mkIntGe(Term a, Term b) {
    checkSort(a, Sort.INT);
    checkSort(b, Sort.INT);
    return make(Token.INT_GE, a, b);
  }

  public Term mkPredApply(Term pred, Term ch) {
    checkSort(pred, Sort.PREDICATE);
    checkSort(ch, Sort.CHAR);
    return make(Token.PRED_APPLY, pred, ch);
  }

  /** The membership atom {@code s in r}. */
  public Term mkInRe(Term s, Term r) {
    checkSort(s, Sort.SEQ);
    checkSort(r, Sort.REGEX);
    return make(Token.IN_RE, s, r);
  }

  /** {@code a} is a prefix of {@code b}. */
  public Term mkPrefixOf(Term a, Term b) {
    checkSort(a, Sort.SEQ);
    checkSort(b, Sort.SEQ);
    return make(Token.PREFIX_OF, a, b);
  }

  /** {@code a} is a suffix of {@code b}. */
  public Term mkSuffixOf(Term a, Term b) {
    checkSort(a, Sort.SEQ);
    checkSort(b, Sort.SEQ);
    return make(Token.SUFFIX_OF, a, b);
  }

  /**
   * If-then-else. Over regexes this is the conditional {@code c ? t : e}, which is also the
   * branching node of derivative terms.
   */
  public Term mkIte(Term c, Term t, Term e) {
    checkSort(c, Sort.BOOL);
    checkState(t.getSort() == e.getSort(), "ite branches of different sorts: %s %s", t, e);
    return make(Token.ITE, c, t, e);
  }

  // Characters.

  public Term mkChar(int code) {
    checkArgument(code >= 0 && code <= maxChar, "character out of range: %s", code);
    return make(Token.CHAR_LIT, null, code, 0);
  }

  public Term mkCharVar(String name) {
    return make(Token.CHAR_VAR, name, 0, 0);
  }

  /** The bound character variable that symbolic derivatives are taken with respect to. */
  public Term mkBoundChar() {
    return make(Token.CHAR_BOUND_VAR, BOUND_CHAR_NAME, 0, 0);
  }

  public Term mkSeqFirst(Term s) {
    checkSort(s, Sort.SEQ);
    return make(Token.SEQ_FIRST, s);
  }

  public Term mkSeqLast(Term s) {
    checkSort(s, Sort.SEQ);
    return make(Token.SEQ_LAST, s);
  }

  // Sequences.

  public Term mkString(String text) {
    return make(Token.STRING, text, 0, 0);
  }

  public Term mkUnit(Term ch) {
    checkSort(ch, Sort.CHAR);
    return make(Token.SEQ_UNIT, ch);
  }

  public Term mkSeqConcat(Term a, Term b) {
    checkSort(a, Sort.SEQ);
    checkSort(b, Sort.SEQ);
    return make(Token.SEQ_CONCAT, a, b);
  }

  public Term mkSeqVar(String name) {
    return make(Token.SEQ_VAR, name, 0, 0);
  }

  /** The sequence without its first element. */
  public Term mkSeqRest(Term s) {
    checkSort(s, Sort.SEQ);
    return make(Token.SEQ_REST, s);
  }

  /** The sequence without its last element. */
  public Term mkSeqButLast(Term s) {
    checkSort(s, Sort.SEQ);
    return make(Token.SEQ_BUTLAST, s);
  }

  public Term mkSubstr(Term s, Term offset, Term length) {
    checkSort(s, Sort.SEQ);
    checkSort(offset, Sort.INT);
    checkSort(length, Sort.INT);
    return make(Token.SEQ_SUBSTR, s, offset, length);
  }

  // Integers.

  public Term mkInt(int value) {
    return make(Token.INT_LIT, null, value, 0);
  }

  public Term mkLength(Term s) {
    checkSort(s, Sort.SEQ);
    return make(Token.SEQ_LENGTH, s);
  }

  public Term mkIntSub(Term a, Term b) {
    checkSort(a, Sort.INT);
    checkSort(b, Sort.INT);
    return make(Token.INT_SUB, a, b);
  }

  // Character predicates.

  public Term mkPredVar(String name) {
    return make(Token.PRED_VAR, name, 0, 0);
  }

  /** A predicate whose body is a boolean over {@link #mkBoundChar()}. */
  public Term mkPredLambda(Term body) {
    checkSort(body, Sort.BOOL);
    return make(Token.PRED_LAMBDA, body);
  }

  // Regular expressions.

  public Term mkEmpty() {
    return make(Token.RE_EMPTY);
  }

  public Term mkEpsilon() {
    return make(Token.RE_EPSILON);
  }

  public Term mkFullChar() {
    return make(Token.RE_FULL_CHAR);
  }

  public Term mkFullSeq() {
    return make(Token.RE_FULL_SEQ);
  }

  /** {@code .+} */
  public Term mkDotPlus() {
    return mkPlus(mkFullChar());
  }

  public Term mkToSeq(Term s) {
    checkSort(s, Sort.SEQ);
    if (s.isEmptyString()) {
      return mkEpsilon();
    }
    return make(Token.RE_TO_SEQ, s);
  }

  public Term mkToSeq(String literal) {
    return mkToSeq(mkString(literal));
  }

  public Term mkConcat(Term a, Term b) {
    checkSort(a, Sort.REGEX);
    checkSort(b, Sort.REGEX);
    return make(Token.RE_CONCAT, a, b);
  }

  public Term mkUnion(Term a, Term b) {
    checkSort(a, Sort.REGEX);
    checkSort(b, Sort.REGEX);
    return make(Token.RE_UNION, a, b);
  }

  public Term mkIntersect(Term a, Term b) {
    checkSort(a, Sort.REGEX);
    checkSort(b, Sort.REGEX);
    return make(Token.RE_INTERSECT, a, b);
  }

  public Term mkDiff(Term a, Term b) {
    checkSort(a, Sort.REGEX);
    checkSort(b, Sort.REGEX);
    return make(Token.RE_DIFF, a, b);
  }

  public Term mkStar(Term a) {
    checkSort(a, Sort.REGEX);
    return make(Token.RE_STAR, a);
  }

  public Term mkPlus(Term a) {
    checkSort(a, Sort.REGEX);
    return make(Token.RE_PLUS, a);
  }

  public Term mkOpt(Term a) {
    checkSort(a, Sort.REGEX);
    return make(Token.RE_OPT, a);
  }

  /** {@code a{lo,}} */
  public Term mkLoop(Term a, int lo) {
    return mkLoop(a, lo, Term.UNBOUNDED);
  }

  /** {@code a{lo,hi}}; {@code hi} may be {@link Term#UNBOUNDED}. */
  public Term mkLoop(Term a, int lo, int hi) {
    checkSort(a, Sort.REGEX);
    checkArgument(lo >= 0 && hi >= 0, "negative loop bound %s %s", lo, hi);
    return make(Token.RE_LOOP, null, lo, hi, a);
  }

  public Term mkComplement(Term a) {
    checkSort(a, Sort.REGEX);
    return make(Token.RE_COMPLEMENT, a);
  }

  /** Characters between the single-element sequences {@code lo} and {@code hi}, inclusive. */
  public Term mkRange(Term lo, Term hi) {
    checkSort(lo, Sort.SEQ);
    checkSort(hi, Sort.SEQ);
    return make(Token.RE_RANGE, lo, hi);
  }

  public Term mkRange(String lo, String hi) {
    return mkRange(mkString(lo), mkString(hi));
  }

  public Term mkReverse(Term a) {
    checkSort(a, Sort.REGEX);
    return make(Token.RE_REVERSE, a);
  }

  /** The single characters satisfying {@code pred}. */
  public Term mkOfPredicate(Term pred) {
    checkSort(pred, Sort.PREDICATE);
    return make(Token.RE_OF_PREDICATE, pred);
  }

  public Term mkReVar(String name) {
    return make(Token.RE_VAR, name, 0, 0);
  }

  /** The deferred union at the top of a derivative in normal form. */
  public Term mkAntimirovUnion(Term a, Term b) {
    checkSort(a, Sort.REGEX);
    checkSort(b, Sort.REGEX);
    return make(Token.RE_ANTIMIROV_UNION, a, b);
  }

  /** An unevaluated derivative of {@code r} by {@code ch}. */
  public Term mkDerivative(Term ch, Term r) {
    checkSort(ch, Sort.CHAR);
    checkSort(r, Sort.REGEX);
    return make(Token.RE_DERIVATIVE, ch, r);
  }
}
