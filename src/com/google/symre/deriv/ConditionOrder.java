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

import com.google.symre.term.Term;
import java.util.Comparator;

/**
 * The order of conditions in a derivative's ITE tree. A bound {@code v <= k} on a literal
 * character ranks by {@code k}; every other condition ranks after all bounds, by the id of the
 * condition with any outer negation removed. Outer ITEs have the larger condition.
 */
final class ConditionOrder {

  static final Comparator<Term> ORDER =
      Comparator.comparingInt(ConditionOrder::category)
          .thenComparingInt(ConditionOrder::value)
          .thenComparingInt(c -> strip(c).getId());

  private ConditionOrder() {}

  static Term strip(Term c) {
    return c.isNot() ? c.getFirstChild() : c;
  }

  private static int category(Term c) {
    return isUpperBound(strip(c)) ? 0 : 1;
  }

  private static int value(Term c) {
    Term atom = strip(c);
    return isUpperBound(atom) ? atom.getSecondChild().getCharCode() : atom.getId();
  }

  private static boolean isUpperBound(Term c) {
    return c.isCharLe() && !c.getFirstChild().isCharLit() && c.getSecondChild().isCharLit();
  }

  /** Positive if {@code a} belongs outside {@code b}. */
  static int compare(Term a, Term b) {
    return ORDER.compare(a, b);
  }

  /** True if {@code c} ranks above the top condition of {@code t}, or {@code t} is no ITE. */
  static boolean isOutside(Term c, Term t) {
    return !t.isIte() || compare(c, t.getFirstChild()) > 0;
  }
}
