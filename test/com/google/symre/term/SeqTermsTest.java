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

import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class SeqTermsTest {

  private TermManager tm;
  private SeqTerms seqs;
  private Term s;
  private Term x;

  @Before
  public void setUp() {
    tm = new TermManager();
    seqs = new SeqTerms(tm, new BooleanSimplifier(tm));
    s = tm.mkSeqVar("s");
    x = tm.mkCharVar("x");
  }

  @Test
  public void testHeadTailOfLiteral() {
    SeqTerms.Split split = seqs.headTail(tm.mkString("abc"));
    assertThat(split.head()).isSameInstanceAs(tm.mkChar('a'));
    assertThat(split.tail()).isSameInstanceAs(tm.mkString("bc"));
    assertThat(seqs.headTail(tm.mkString(""))).isNull();
    assertThat(seqs.headTail(s)).isNull();
  }

  @Test
  public void testHeadTailOfConcat() {
    SeqTerms.Split split = seqs.headTail(seqs.mkConcat(seqs.mkUnit(x), s));
    assertThat(split.head()).isSameInstanceAs(x);
    assertThat(split.tail()).isSameInstanceAs(s);
    assertThat(seqs.headTail(seqs.mkConcat(s, tm.mkString("a")))).isNull();
  }

  @Test
  public void testHeadTailReversed() {
    SeqTerms.Split split = seqs.headTailReversed(tm.mkString("abc"));
    assertThat(split.head()).isSameInstanceAs(tm.mkString("ab"));
    assertThat(split.tail()).isSameInstanceAs(tm.mkChar('c'));

    split = seqs.headTailReversed(seqs.mkConcat(s, seqs.mkUnit(x)));
    assertThat(split.head()).isSameInstanceAs(s);
    assertThat(split.tail()).isSameInstanceAs(x);
  }

  @Test
  public void testConcatMergesLiterals() {
    assertThat(seqs.mkConcat(tm.mkString("ab"), tm.mkString("cd")))
        .isSameInstanceAs(tm.mkString("abcd"));
    assertThat(seqs.mkConcat(tm.mkString(""), s)).isSameInstanceAs(s);
    Term tail = seqs.mkConcat(tm.mkString("b"), s);
    assertThat(seqs.mkConcat(tm.mkString("a"), tail))
        .isSameInstanceAs(tm.mkSeqConcat(tm.mkString("ab"), s));
  }

  @Test
  public void testUnitOfLiteralIsString() {
    assertThat(seqs.mkUnit(tm.mkChar('q'))).isSameInstanceAs(tm.mkString("q"));
    assertThat(seqs.mkUnit(x).isSeqUnit()).isTrue();
  }

  @Test
  public void testFirstAndLast() {
    assertThat(seqs.mkFirst(tm.mkString("abc"))).isSameInstanceAs(tm.mkChar('a'));
    assertThat(seqs.mkRest(tm.mkString("abc"))).isSameInstanceAs(tm.mkString("bc"));
    assertThat(seqs.mkLast(tm.mkString("abc"))).isSameInstanceAs(tm.mkChar('c'));
    assertThat(seqs.mkButLast(tm.mkString("abc"))).isSameInstanceAs(tm.mkString("ab"));
    assertThat(seqs.mkFirst(s)).isSameInstanceAs(tm.mkSeqFirst(s));
    assertThat(seqs.mkLast(s)).isSameInstanceAs(tm.mkSeqLast(s));
  }

  @Test
  public void testSubstr() {
    Term hello = tm.mkString("hello");
    assertThat(seqs.mkSubstr(hello, tm.mkInt(1), tm.mkInt(3)))
        .isSameInstanceAs(tm.mkString("ell"));
    assertThat(seqs.mkSubstr(hello, tm.mkInt(3), tm.mkInt(10)))
        .isSameInstanceAs(tm.mkString("lo"));
    assertThat(seqs.mkSubstr(hello, tm.mkInt(7), tm.mkInt(1))).isSameInstanceAs(tm.mkString(""));
    assertThat(seqs.mkSubstr(s, tm.mkInt(0), tm.mkInt(1)).getToken())
        .isEqualTo(Token.SEQ_SUBSTR);
  }

  @Test
  public void testLength() {
    assertThat(seqs.mkLength(tm.mkString("abc"))).isSameInstanceAs(tm.mkInt(3));
    assertThat(seqs.mkLength(s)).isSameInstanceAs(tm.mkLength(s));
    assertThat(seqs.mkIntSub(tm.mkInt(5), tm.mkInt(2))).isSameInstanceAs(tm.mkInt(3));
  }

  @Test
  public void testPrefixAndSuffix() {
    assertThat(seqs.mkPrefixOf(tm.mkString("ab"), tm.mkString("abc")))
        .isSameInstanceAs(tm.mkTrue());
    assertThat(seqs.mkSuffixOf(tm.mkString("ab"), tm.mkString("abc")))
        .isSameInstanceAs(tm.mkFalse());
    assertThat(seqs.mkPrefixOf(tm.mkString(""), s)).isSameInstanceAs(tm.mkTrue());
    assertThat(seqs.mkPrefixOf(tm.mkString("ab"), s))
        .isSameInstanceAs(tm.mkPrefixOf(tm.mkString("ab"), s));
  }

  @Test
  public void testIsEmpty() {
    assertThat(seqs.mkIsEmpty(tm.mkString(""))).isSameInstanceAs(tm.mkTrue());
    assertThat(seqs.mkIsEmpty(tm.mkString("a"))).isSameInstanceAs(tm.mkFalse());
    assertThat(seqs.mkIsEmpty(s)).isSameInstanceAs(tm.mkEq(s, tm.mkString("")));
  }
}
