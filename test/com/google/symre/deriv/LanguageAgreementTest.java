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

import static com.google.common.truth.Truth.assertWithMessage;

import com.google.common.collect.ImmutableList;
import com.google.symre.term.Term;
import com.google.symre.term.TermManager;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/**
 * Checks membership, nullability and one-step derivatives against a direct matcher on every
 * word over {a, b} up to length four, for a fixed family of ground regexes.
 */
@RunWith(JUnit4.class)
public final class LanguageAgreementTest {

  private static final int MAX_WORD_LENGTH = 4;
  private static final int RANDOM_REGEXES = 400;

  private TermManager tm;
  private DerivativeEngine engine;
  private ImmutableList<Term> atoms;
  private List<String> words;

  @Before
  public void setUp() {
    tm = new TermManager();
    engine = new DerivativeEngine(tm);
    atoms =
        ImmutableList.of(
            tm.mkToSeq("a"),
            tm.mkToSeq("b"),
            tm.mkToSeq("ab"),
            tm.mkEpsilon(),
            tm.mkEmpty(),
            tm.mkFullChar(),
            tm.mkFullSeq(),
            tm.mkRange("a", "b"),
            tm.mkRange("b", "a"));
    words = new ArrayList<>();
    addWords("", words);
  }

  private static void addWords(String prefix, List<String> out) {
    out.add(prefix);
    if (prefix.length() < MAX_WORD_LENGTH) {
      addWords(prefix + "a", out);
      addWords(prefix + "b", out);
    }
  }

  private Term randomRegex(Random random, int depth) {
    if (depth == 0 || random.nextInt(4) == 0) {
      return atoms.get(random.nextInt(atoms.size()));
    }
    Term a = randomRegex(random, depth - 1);
    switch (random.nextInt(10)) {
      case 0:
        return tm.mkConcat(a, randomRegex(random, depth - 1));
      case 1:
        return tm.mkUnion(a, randomRegex(random, depth - 1));
      case 2:
        return tm.mkIntersect(a, randomRegex(random, depth - 1));
      case 3:
        return tm.mkDiff(a, randomRegex(random, depth - 1));
      case 4:
        return tm.mkStar(a);
      case 5:
        return tm.mkPlus(a);
      case 6:
        return tm.mkOpt(a);
      case 7:
        return tm.mkComplement(a);
      case 8:
        // Bounds may be reversed.
        return tm.mkLoop(a, random.nextInt(4), random.nextInt(4));
      default:
        return tm.mkLoop(a, random.nextInt(3));
    }
  }

  private List<Term> regexes() {
    Term a = tm.mkToSeq("a");
    Term b = tm.mkToSeq("b");
    List<Term> result = new ArrayList<>();
    result.add(tm.mkLoop(tm.mkStar(a), 3, 2));
    result.add(tm.mkComplement(tm.mkLoop(tm.mkStar(a), 3, 2)));
    result.add(tm.mkConcat(tm.mkLoop(a, 2, 1), tm.mkStar(b)));
    result.add(tm.mkLoop(tm.mkOpt(a), 2, 3));
    result.add(tm.mkComplement(tm.mkConcat(tm.mkFullSeq(), tm.mkToSeq("ab"))));
    result.add(tm.mkIntersect(tm.mkStar(tm.mkUnion(a, b)), tm.mkComplement(tm.mkStar(a))));
    Random random = new Random(20240117L);
    for (int i = 0; i < RANDOM_REGEXES; i++) {
      result.add(randomRegex(random, 3));
    }
    return result;
  }

  @Test
  public void testMembershipAgreesWithMatcher() {
    for (Term r : regexes()) {
      for (String w : words) {
        assertWithMessage("'%s' in %s", w, r)
            .that(engine.inRegex(tm.mkString(w), r))
            .isSameInstanceAs(tm.mkBool(matches(r, w)));
      }
    }
  }

  @Test
  public void testNullableAgreesWithEmptyWordMembership() {
    for (Term r : regexes()) {
      assertWithMessage("nullable %s", r)
          .that(engine.nullable(r))
          .isSameInstanceAs(engine.inRegex(tm.mkString(""), r));
      assertWithMessage("nullable %s", r)
          .that(engine.nullable(r))
          .isSameInstanceAs(tm.mkBool(matches(r, "")));
    }
  }

  @Test
  public void testDerivativeAcceptsTheRemainders() {
    for (Term r : regexes()) {
      for (char c : new char[] {'a', 'b'}) {
        Term d = engine.derivative(tm.mkChar(c), r);
        for (String w : words) {
          if (w.length() == MAX_WORD_LENGTH) {
            continue;
          }
          assertWithMessage("'%s' in D(%s, %s) = %s", w, c, r, d)
              .that(engine.inRegex(tm.mkString(w), d))
              .isSameInstanceAs(tm.mkBool(matches(r, c + w)));
        }
      }
    }
  }

  /** Direct backtracking matcher over ground regexes. */
  private static boolean matches(Term r, String w) {
    switch (r.getToken()) {
      case RE_EMPTY:
        return false;
      case RE_EPSILON:
        return w.isEmpty();
      case RE_FULL_CHAR:
        return w.length() == 1;
      case RE_FULL_SEQ:
        return true;
      case RE_TO_SEQ:
        return w.equals(r.getFirstChild().getString());
      case RE_RANGE:
        {
          if (w.length() != 1) {
            return false;
          }
          char c = w.charAt(0);
          return r.getFirstChild().getString().charAt(0) <= c
              && c <= r.getSecondChild().getString().charAt(0);
        }
      case RE_CONCAT:
        for (int i = 0; i <= w.length(); i++) {
          if (matches(r.getFirstChild(), w.substring(0, i))
              && matches(r.getSecondChild(), w.substring(i))) {
            return true;
          }
        }
        return false;
      case RE_UNION:
        return matches(r.getFirstChild(), w) || matches(r.getSecondChild(), w);
      case RE_INTERSECT:
        return matches(r.getFirstChild(), w) && matches(r.getSecondChild(), w);
      case RE_DIFF:
        return matches(r.getFirstChild(), w) && !matches(r.getSecondChild(), w);
      case RE_COMPLEMENT:
        return !matches(r.getFirstChild(), w);
      case RE_OPT:
        return w.isEmpty() || matches(r.getFirstChild(), w);
      case RE_STAR:
        return matchesLoop(r.getFirstChild(), 0, Term.UNBOUNDED, w);
      case RE_PLUS:
        return matchesLoop(r.getFirstChild(), 1, Term.UNBOUNDED, w);
      case RE_LOOP:
        return matchesLoop(r.getFirstChild(), r.getLoopLower(), r.getLoopUpper(), w);
      default:
        throw new IllegalArgumentException("unexpected regex: " + r);
    }
  }

  private static boolean matchesLoop(Term body, int lo, int hi, String w) {
    // Empty iterations beyond max(lo, |w|) never help.
    int most = Math.min(hi, Math.max(lo, w.length()));
    for (int n = lo; n <= most; n++) {
      if (matchesTimes(body, n, w)) {
        return true;
      }
    }
    return false;
  }

  private static boolean matchesTimes(Term body, int n, String w) {
    if (n == 0) {
      return w.isEmpty();
    }
    for (int i = 0; i <= w.length(); i++) {
      if (matches(body, w.substring(0, i)) && matchesTimes(body, n - 1, w.substring(i))) {
        return true;
      }
    }
    return false;
  }
}
