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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.symre.base.Tri;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class TermManagerTest {

  private TermManager tm;

  @Before
  public void setUp() {
    tm = new TermManager();
  }

  @Test
  public void testInterning() {
    Term abc = tm.mkToSeq("abc");
    assertThat(tm.mkToSeq("abc")).isSameInstanceAs(abc);
    assertThat(tm.mkConcat(abc, tm.mkFullSeq()))
        .isSameInstanceAs(tm.mkConcat(tm.mkToSeq("abc"), tm.mkFullSeq()));
    assertThat(tm.mkToSeq("abd")).isNotSameInstanceAs(abc);
    assertThat(tm.mkLoop(abc, 1, 2)).isNotSameInstanceAs(tm.mkLoop(abc, 1, 3));
  }

  @Test
  public void testEmptyLiteralIsEpsilon() {
    assertThat(tm.mkToSeq("")).isSameInstanceAs(tm.mkEpsilon());
  }

  @Test
  public void testIdsIncrease() {
    Term a = tm.mkChar('a');
    Term b = tm.mkChar('b');
    assertThat(b.getId()).isGreaterThan(a.getId());
    assertThat(tm.mkChar('a').getId()).isEqualTo(a.getId());
  }

  @Test
  public void testLengthAndNullabilityFacts() {
    Term ab = tm.mkToSeq("ab");
    Term loop = tm.mkLoop(ab, 2, 3);
    assertThat(loop.getMinLength()).isEqualTo(4);
    assertThat(loop.getMaxLength()).isEqualTo(6);
    assertThat(loop.getNullable()).isEqualTo(Tri.FALSE);

    Term star = tm.mkStar(ab);
    assertThat(star.getMinLength()).isEqualTo(0);
    assertThat(star.getMaxLength()).isEqualTo(Term.UNBOUNDED);
    assertThat(star.getNullable()).isEqualTo(Tri.TRUE);

    Term empty = tm.mkEmpty();
    assertThat(empty.getMinLength()).isEqualTo(Term.UNBOUNDED);
    assertThat(empty.getMaxLength()).isEqualTo(0);

    Term concat = tm.mkConcat(tm.mkToSeq("a"), tm.mkFullSeq());
    assertThat(concat.getMinLength()).isEqualTo(1);
    assertThat(concat.getMaxLength()).isEqualTo(Term.UNBOUNDED);
    assertThat(concat.getNullable()).isEqualTo(Tri.FALSE);

    assertThat(tm.mkComplement(tm.mkEpsilon()).getNullable()).isEqualTo(Tri.FALSE);
    assertThat(tm.mkToSeq(tm.mkSeqVar("s")).getNullable()).isEqualTo(Tri.UNKNOWN);
  }

  @Test
  public void testConcatWithEmptyHasEmptyLanguage() {
    Term concat = tm.mkConcat(tm.mkEmpty(), tm.mkToSeq("a"));
    assertThat(concat.getMinLength()).isEqualTo(Term.UNBOUNDED);
    assertThat(concat.getMaxLength()).isEqualTo(0);
    assertThat(concat.getNullable()).isEqualTo(Tri.FALSE);
  }

  @Test
  public void testGround() {
    assertThat(tm.mkToSeq("a").isGround()).isTrue();
    assertThat(tm.mkToSeq(tm.mkSeqVar("s")).isGround()).isFalse();
    assertThat(tm.mkStar(tm.mkReVar("r")).isGround()).isFalse();
    assertThat(tm.mkDerivative(tm.mkChar('a'), tm.mkToSeq("a")).isGround()).isFalse();
    Term digit =
        tm.mkPredLambda(tm.mkCharLe(tm.mkBoundChar(), tm.mkChar('9')));
    assertThat(tm.mkOfPredicate(digit).isGround()).isTrue();
  }

  @Test
  public void testSortChecks() {
    assertThrows(
        IllegalStateException.class, () -> tm.mkConcat(tm.mkString("a"), tm.mkEmpty()));
    assertThrows(IllegalStateException.class, () -> tm.mkUnit(tm.mkString("a")));
    assertThrows(
        IllegalStateException.class,
        () -> tm.mkIte(tm.mkTrue(), tm.mkEmpty(), tm.mkString("a")));
  }

  @Test
  public void testCharacterDomain() {
    assertThrows(IllegalArgumentException.class, () -> tm.mkChar(-1));
    TermManager ascii = new TermManager(0x7f);
    assertThat(ascii.getMaxChar()).isEqualTo(0x7f);
    assertThrows(IllegalArgumentException.class, () -> ascii.mkChar(0x80));
  }

  @Test
  public void testWithChildrenKeepsPayload() {
    Term loop = tm.mkLoop(tm.mkToSeq("a"), 2, 5);
    Term rebuilt = tm.withChildren(loop, ImmutableList.of(tm.mkToSeq("b")));
    assertThat(rebuilt).isSameInstanceAs(tm.mkLoop(tm.mkToSeq("b"), 2, 5));
    assertThat(tm.withChildren(loop, ImmutableList.of(tm.mkToSeq("a")))).isSameInstanceAs(loop);
  }

  @Test
  public void testToString() {
    Term r = tm.mkConcat(tm.mkToSeq("a"), tm.mkFullSeq());
    assertThat(r.toString()).isEqualTo("(re_concat (re_to_seq \"a\") re.all)");
    assertThat(tm.mkLoop(tm.mkFullChar(), 1).toString()).isEqualTo("(re_loop 1 inf re.allchar)");
    assertThat(tm.mkChar(0).toString()).isEqualTo("#x0");
  }

  @Test
  public void testToStringTree() {
    Term r = tm.mkUnion(tm.mkToSeq("a"), tm.mkEpsilon());
    assertThat(r.toStringTree())
        .isEqualTo("RE_UNION\n    RE_TO_SEQ\n        \"a\"\n    re.eps\n");
  }
}
