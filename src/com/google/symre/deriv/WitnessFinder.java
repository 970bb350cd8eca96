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

import com.google.common.collect.BoundType;
import com.google.common.collect.Range;
import com.google.common.collect.RangeSet;
import com.google.common.collect.TreeRangeSet;
import com.google.symre.base.Tri;
import com.google.symre.term.Term;
import com.google.symre.term.TermManager;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Searches for a sequence a regex accepts by exploring its symbolic derivatives depth first.
 * Each ITE in a derivative partitions the remaining characters; one representative character is
 * picked per reachable leaf.
 */
final class WitnessFinder {

  private static final Logger logger = Logger.getLogger(WitnessFinder.class.getName());

  /** A regex still to be explored and the characters consumed to reach it. */
  private static final class State {
    final Term regex;
    final String prefix;

    State(Term regex, String prefix) {
      this.regex = regex;
      this.prefix = prefix;
    }
  }

  private final TermManager tm;
  private final ConditionSimplifier conditions;
  private final Derivatives derivatives;
  private final NullabilityChecker nullability;
  private final int maxSteps;

  WitnessFinder(
      TermManager tm,
      ConditionSimplifier conditions,
      Derivatives derivatives,
      NullabilityChecker nullability,
      int maxSteps) {
    this.tm = tm;
    this.conditions = conditions;
    this.derivatives = derivatives;
    this.nullability = nullability;
    this.maxSteps = maxSteps;
  }

  /**
   * Looks for a member of {@code r}. On {@link Tri#TRUE} the member is appended to {@code
   * witness}. {@link Tri#FALSE} means {@code r} is empty; {@link Tri#UNKNOWN} means the search hit
   * a symbolic regex or ran out of steps.
   */
  Tri find(Term r, StringBuilder witness) {
    Term x = tm.mkBoundChar();
    Deque<State> todo = new ArrayDeque<>();
    Set<Term> visited = new HashSet<>();
    todo.push(new State(r, ""));
    boolean incomplete = false;
    int steps = 0;
    while (!todo.isEmpty()) {
      State state = todo.pop();
      Term regex = state.regex;
      if (regex.isEmptyRegex() || !visited.add(regex)) {
        continue;
      }
      if (++steps > maxSteps) {
        logger.fine("Witness search gave up after " + maxSteps + " steps");
        return Tri.UNKNOWN;
      }
      Term nullable = nullability.nullable(regex);
      if (nullable.isTrue()) {
        witness.append(state.prefix);
        return Tri.TRUE;
      }
      if (!nullable.isFalse()) {
        incomplete = true;
      }
      if (!regex.isGround()) {
        incomplete = true;
        continue;
      }
      RangeSet<Integer> all = TreeRangeSet.create();
      all.add(Range.closed(0, tm.getMaxChar()));
      incomplete |= !expand(x, derivatives.derivative(x, regex), all, state.prefix, todo);
    }
    if (incomplete && logger.isLoggable(Level.FINE)) {
      logger.fine("Witness search for " + r + " was inconclusive");
    }
    return incomplete ? Tri.UNKNOWN : Tri.FALSE;
  }

  /**
   * Pushes one successor state per leaf of {@code d} reachable with a character in {@code
   * chars}. Returns false if some branch could not be explored.
   */
  private boolean expand(
      Term x, Term d, RangeSet<Integer> chars, String prefix, Deque<State> todo) {
    if (chars.isEmpty() || d.isEmptyRegex()) {
      return true;
    }
    switch (d.getToken()) {
      case RE_ANTIMIROV_UNION:
      case RE_UNION:
        {
          boolean complete = expand(x, d.getSecondChild(), chars, prefix, todo);
          return expand(x, d.getFirstChild(), chars, prefix, todo) && complete;
        }
      case ITE:
        {
          RangeSet<Integer> satisfying = conditions.charsSatisfying(x, d.getFirstChild());
          if (satisfying == null) {
            return false;
          }
          RangeSet<Integer> elseChars = TreeRangeSet.create(chars);
          elseChars.removeAll(satisfying);
          RangeSet<Integer> thenChars = TreeRangeSet.create(chars);
          thenChars.removeAll(satisfying.complement());
          boolean complete = expand(x, d.getChildAtIndex(2), elseChars, prefix, todo);
          return expand(x, d.getSecondChild(), thenChars, prefix, todo) && complete;
        }
      default:
        todo.push(new State(d, prefix + new String(Character.toChars(pick(chars)))));
        return true;
    }
  }

  /** A representative character, preferring {@code 'a'}. */
  private static int pick(RangeSet<Integer> chars) {
    if (chars.contains((int) 'a')) {
      return 'a';
    }
    Range<Integer> first = chars.asRanges().iterator().next();
    return first.lowerBoundType() == BoundType.CLOSED
        ? first.lowerEndpoint()
        : first.lowerEndpoint() + 1;
  }
}
