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
import static org.junit.Assert.assertThrows;

import com.google.symre.term.BooleanSimplifier;
import com.google.symre.term.Term;
import com.google.symre.term.TermManager;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class DerivativeCombinatorsTest {

  private TermManager tm;
  private BooleanSimplifier bs;
  private DerivativeCombinators combinators;
  private Term x;
  private Term a;
  private Term b;
  private Term c;
  private Term empty;

  @Before
  public void setUp() {
    tm = new TermManager();
    EngineOptions options = new EngineOptions();
    options.setCheckNormalForm(true);
    DerivativeEngine engine = new DerivativeEngine(tm, options);
    bs = engine.getBooleanSimplifier();
    combinators = engine.getCombinators();
    x = tm.mkBoundChar();
    a = tm.mkToSeq("a");
    b = tm.mkToSeq("b");
    c = tm.mkToSeq("c");
    empty = tm.mkEmpty();
  }

  private Term eq(char ch) {
    return bs.mkEq(x, tm.mkChar(ch));
  }

  private Term le(char ch) {
    return bs.mkCharLe(x, tm.mkChar(ch));
  }

  @Test
  public void testConditionOrder() {
    assertThat(ConditionOrder.compare(le('m'), le('c'))).isGreaterThan(0);
    assertThat(ConditionOrder.compare(eq('a'), le('z'))).isGreaterThan(0);
    Term first = eq('a');
    Term second = eq('b');
    assertThat(ConditionOrder.compare(second, first)).isGreaterThan(0);
    assertThat(ConditionOrder.compare(bs.mkNot(first), first)).isEqualTo(0);
    assertThat(ConditionOrder.isOutside(le('c'), a)).isTrue();
  }

  @Test
  public void testIteCollapsesEqualBranches() {
    assertThat(combinators.mkIte(eq('a'), a, a)).isSameInstanceAs(a);
    assertThat(combinators.mkIte(tm.mkTrue(), a, b)).isSameInstanceAs(a);
    assertThat(combinators.mkIte(tm.mkFalse(), a, b)).isSameInstanceAs(b);
  }

  @Test
  public void testIteSwapsNegatedCondition() {
    Term cond = eq('a');
    assertThat(combinators.mkIte(bs.mkNot(cond), a, b)).isSameInstanceAs(tm.mkIte(cond, b, a));
  }

  @Test
  public void testIteResolvesImpliedCondition() {
    Term k1 = le('c');
    Term k2 = le('m');
    assertThat(combinators.mkIte(k1, tm.mkIte(k2, a, b), c)).isSameInstanceAs(tm.mkIte(k1, a, c));
  }

  @Test
  public void testIteHoistsLargerCondition() {
    Term k1 = le('c');
    Term k2 = le('m');
    Term result = combinators.mkIte(k1, a, tm.mkIte(k2, b, c));
    assertThat(result).isSameInstanceAs(tm.mkIte(k2, tm.mkIte(k1, a, b), c));
    new NormalFormValidator().validateDerivative(result);
  }

  @Test
  public void testIteDistributesOverAntimirovUnion() {
    Term cond = eq('a');
    Term result = combinators.mkIte(cond, tm.mkAntimirovUnion(a, b), empty);
    assertThat(result)
        .isSameInstanceAs(
            tm.mkAntimirovUnion(tm.mkIte(cond, a, empty), tm.mkIte(cond, b, empty)));
  }

  @Test
  public void testAntimirovUnion() {
    assertThat(combinators.antimirovUnion(empty, a)).isSameInstanceAs(a);
    assertThat(combinators.antimirovUnion(a, empty)).isSameInstanceAs(a);
    assertThat(combinators.antimirovUnion(a, a)).isSameInstanceAs(a);
    Term ab = tm.mkAntimirovUnion(a, b);
    assertThat(combinators.antimirovUnion(ab, c))
        .isSameInstanceAs(tm.mkAntimirovUnion(a, tm.mkAntimirovUnion(b, c)));
    assertThat(combinators.antimirovUnion(b, ab)).isSameInstanceAs(ab);
  }

  @Test
  public void testUnionOfGuardedLeaves() {
    Term cond = eq('a');
    Term result = combinators.union(tm.mkIte(cond, a, empty), tm.mkIte(cond, b, empty));
    assertThat(result).isSameInstanceAs(tm.mkIte(cond, tm.mkUnion(a, b), empty));
  }

  @Test
  public void testUnionWithAntimirovUnion() {
    assertThat(combinators.union(tm.mkAntimirovUnion(a, b), c))
        .isSameInstanceAs(tm.mkAntimirovUnion(a, tm.mkAntimirovUnion(b, c)));
    assertThat(combinators.union(a, tm.mkFullSeq())).isSameInstanceAs(tm.mkFullSeq());
  }

  @Test
  public void testIntersectPrunesDisjointGuards() {
    Term left = tm.mkIte(eq('a'), a, empty);
    Term right = tm.mkIte(eq('b'), b, empty);
    assertThat(combinators.intersect(x, left, right)).isSameInstanceAs(empty);
    assertThat(combinators.intersect(x, left, tm.mkFullSeq())).isSameInstanceAs(left);
  }

  @Test
  public void testConcatAppendsToLeaves() {
    Term cond = eq('a');
    assertThat(combinators.concat(tm.mkIte(cond, tm.mkEpsilon(), empty), b))
        .isSameInstanceAs(tm.mkIte(cond, b, empty));
    assertThat(combinators.concat(tm.mkAntimirovUnion(tm.mkEpsilon(), a), b))
        .isSameInstanceAs(tm.mkAntimirovUnion(b, tm.mkToSeq("ab")));
    assertThat(combinators.concat(empty, b)).isSameInstanceAs(empty);
    assertThat(combinators.concat(a, empty)).isSameInstanceAs(empty);
  }

  @Test
  public void testNegate() {
    assertThat(combinators.negate(x, tm.mkEpsilon())).isSameInstanceAs(tm.mkDotPlus());
    assertThat(combinators.negate(x, empty)).isSameInstanceAs(tm.mkFullSeq());
    assertThat(combinators.negate(x, tm.mkComplement(a))).isSameInstanceAs(a);
    assertThat(combinators.negate(x, a)).isSameInstanceAs(tm.mkComplement(a));
    Term cond = eq('a');
    assertThat(combinators.negate(x, tm.mkIte(cond, tm.mkEpsilon(), empty)))
        .isSameInstanceAs(tm.mkIte(cond, tm.mkDotPlus(), tm.mkFullSeq()));
  }

  @Test
  public void testRestrict() {
    Term cond = eq('a');
    assertThat(combinators.restrict(x, tm.mkIte(cond, a, b), cond)).isSameInstanceAs(a);
    assertThat(combinators.restrict(x, tm.mkIte(cond, a, b), bs.mkNot(cond)))
        .isSameInstanceAs(b);
    assertThat(combinators.restrict(x, a, tm.mkFalse())).isSameInstanceAs(empty);
    assertThat(combinators.restrict(x, a, tm.mkTrue())).isSameInstanceAs(a);
  }

  @Test
  public void testRestrictResultIsValidated() {
    Term malformed = tm.mkIntersect(tm.mkAntimirovUnion(a, b), c);
    assertThrows(
        IllegalStateException.class, () -> combinators.restrict(x, malformed, le('m')));
  }
}
