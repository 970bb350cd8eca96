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

import com.google.symre.base.Tri;
import com.google.symre.term.BooleanSimplifier;
import com.google.symre.term.Term;
import com.google.symre.term.TermManager;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class NullabilityCheckerTest {

  private TermManager tm;
  private BooleanSimplifier bs;
  private DerivativeEngine engine;
  private Term s;
  private Term isEmpty;

  @Before
  public void setUp() {
    tm = new TermManager();
    engine = new DerivativeEngine(tm);
    bs = engine.getBooleanSimplifier();
    s = tm.mkSeqVar("s");
    isEmpty = tm.mkEq(s, tm.mkString(""));
  }

  @Test
  public void testStaticallyKnown() {
    Term a = tm.mkToSeq("a");
    assertThat(engine.nullable(tm.mkStar(a))).isSameInstanceAs(tm.mkTrue());
    assertThat(engine.nullable(a)).isSameInstanceAs(tm.mkFalse());
    assertThat(engine.nullable(tm.mkConcat(tm.mkStar(a), a))).isSameInstanceAs(tm.mkFalse());
    assertThat(engine.nullable(tm.mkComplement(a))).isSameInstanceAs(tm.mkTrue());
    assertThat(engine.nullable(tm.mkLoop(a, 0, 3))).isSameInstanceAs(tm.mkTrue());
  }

  @Test
  public void testLoopWithReversedBoundsIsEmpty() {
    Term r = tm.mkLoop(tm.mkStar(tm.mkToSeq("a")), 3, 2);
    assertThat(r.getNullable()).isEqualTo(Tri.FALSE);
    assertThat(r.getMinLength()).isGreaterThan(r.getMaxLength());
    assertThat(engine.nullable(r)).isSameInstanceAs(tm.mkFalse());
    assertThat(engine.inRegex(tm.mkString(""), r)).isSameInstanceAs(tm.mkFalse());
    assertThat(engine.inRegex(tm.mkString("aaa"), r)).isSameInstanceAs(tm.mkFalse());
    assertThat(engine.nullable(tm.mkLoop(tm.mkToSeq(s), 2, 1))).isSameInstanceAs(tm.mkFalse());
    assertThat(engine.nullable(tm.mkComplement(r))).isSameInstanceAs(tm.mkTrue());
  }

  @Test
  public void testSymbolicSequence() {
    Term r = tm.mkToSeq(s);
    assertThat(engine.nullable(r)).isSameInstanceAs(isEmpty);
    assertThat(engine.nullable(tm.mkUnion(r, tm.mkToSeq("a")))).isSameInstanceAs(isEmpty);
    assertThat(engine.nullable(tm.mkComplement(r))).isSameInstanceAs(bs.mkNot(isEmpty));
    assertThat(engine.nullable(tm.mkLoop(r, 2, 3))).isSameInstanceAs(isEmpty);
  }

  @Test
  public void testConditional() {
    Term p = tm.mkBoolVar("p");
    Term r = tm.mkIte(p, tm.mkStar(tm.mkToSeq("a")), tm.mkToSeq(s));
    assertThat(engine.nullable(r)).isSameInstanceAs(bs.mkOr(p, isEmpty));
  }

  @Test
  public void testDerivativeChain() {
    Term chain = tm.mkDerivative(tm.mkChar('b'), tm.mkDerivative(tm.mkChar('a'), tm.mkToSeq(s)));
    assertThat(engine.nullable(chain)).isSameInstanceAs(tm.mkEq(s, tm.mkString("ab")));
  }

  @Test
  public void testRegexVariable() {
    Term r = tm.mkReVar("r");
    assertThat(engine.nullable(r)).isSameInstanceAs(tm.mkInRe(tm.mkString(""), r));
  }
}
