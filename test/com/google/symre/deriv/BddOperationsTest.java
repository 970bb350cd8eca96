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

import static com.google.common.truth.Truth.assertThat;

import com.google.symre.term.BooleanSimplifier;
import com.google.symre.term.Term;
import com.google.symre.term.TermManager;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class BddOperationsTest {

  private TermManager tm;
  private BooleanSimplifier bs;
  private RegexSimplifier re;
  private DerivativeCombinators combinators;
  private BddOperations bdd;
  private Term x;
  private Term a;
  private Term b;

  @Before
  public void setUp() {
    tm = new TermManager();
    EngineOptions options = new EngineOptions();
    options.setCheckNormalForm(true);
    DerivativeEngine engine = new DerivativeEngine(tm, options);
    bs = engine.getBooleanSimplifier();
    re = engine.getRegexSimplifier();
    combinators = engine.getCombinators();
    bdd = engine.getBddOperations();
    x = tm.mkBoundChar();
    a = tm.mkToSeq("a");
    b = tm.mkToSeq("b");
  }

  private Term le(char ch) {
    return bs.mkCharLe(x, tm.mkChar(ch));
  }

  /** Evaluates a predicate diagram over upper-bound conditions at a concrete character. */
  private static boolean accepts(Term d, int ch) {
    while (d.isIte()) {
      Term c = d.getFirstChild();
      boolean negated = c.isNot();
      if (negated) {
        c = c.getFirstChild();
      }
      assertThat(c.isCharLe()).isTrue();
      boolean holds = ch <= c.getSecondChild().getCharCode();
      d = holds != negated ? d.getSecondChild() : d.getChildAtIndex(2);
    }
    if (d.isEpsilon()) {
      return true;
    }
    assertThat(d.isEmptyRegex()).isTrue();
    return false;
  }

  @Test
  public void testConstantConditions() {
    assertThat(bdd.derCond(tm.mkTrue(), x)).isSameInstanceAs(tm.mkEpsilon());
    assertThat(bdd.derCond(tm.mkFalse(), x)).isSameInstanceAs(tm.mkEmpty());
  }

  @Test
  public void testUpperBound() {
    Term d = bdd.derCond(le('m'), x);
    assertThat(d).isSameInstanceAs(combinators.mkIte(le('m'), tm.mkEpsilon(), tm.mkEmpty()));
  }

  @Test
  public void testNegatedUpperBoundSwapsLeaves() {
    Term d = bdd.derCond(bs.mkNot(le('m')), x);
    assertThat(d).isSameInstanceAs(combinators.mkIte(le('m'), tm.mkEmpty(), tm.mkEpsilon()));
  }

  @Test
  public void testLowerBound() {
    Term d = bdd.derCond(bs.mkCharLe(tm.mkChar('k'), x), x);
    assertThat(accepts(d, 'j')).isFalse();
    assertThat(accepts(d, 'k')).isTrue();
    assertThat(accepts(d, 'z')).isTrue();
    assertThat(bdd.derCond(bs.mkCharLe(tm.mkChar(0), x), x)).isSameInstanceAs(tm.mkEpsilon());
  }

  @Test
  public void testEqualitySplitsIntoTwoBounds() {
    Term d = bdd.derCond(bs.mkEq(x, tm.mkChar('c')), x);
    for (char ch = 'a'; ch <= 'e'; ch++) {
      assertThat(accepts(d, ch)).isEqualTo(ch == 'c');
    }
  }

  @Test
  public void testBooleanStructure() {
    // not (x = 'b' or 'd' <= x)
    Term cond = bs.mkNot(bs.mkOr(bs.mkEq(x, tm.mkChar('b')), bs.mkCharLe(tm.mkChar('d'), x)));
    Term d = bdd.derCond(cond, x);
    assertThat(accepts(d, 'a')).isTrue();
    assertThat(accepts(d, 'b')).isFalse();
    assertThat(accepts(d, 'c')).isTrue();
    assertThat(accepts(d, 'd')).isFalse();
    assertThat(accepts(d, 'q')).isFalse();
  }

  @Test
  public void testComplementIsLeafwise() {
    Term d = combinators.mkIte(le('m'), a, tm.mkEmpty());
    assertThat(bdd.derComplement(d))
        .isSameInstanceAs(combinators.mkIte(le('m'), re.mkComplement(a), tm.mkFullSeq()));
  }

  @Test
  public void testComplementOfAntimirovUnionIsIntersection() {
    Term d = combinators.antimirovUnion(a, b);
    assertThat(d.isAntimirovUnion()).isTrue();
    Term expected =
        re.mkIntersect(
            re.mkComplement(d.getFirstChild()), re.mkComplement(d.getSecondChild()));
    assertThat(bdd.derComplement(d)).isSameInstanceAs(expected);
  }
}
