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
import com.google.symre.term.Token;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.function.BinaryOperator;

/**
 * Merges two right-nested chains of unions (or intersections) into one chain sorted by term id,
 * sharing common elements. Elements are compared by id, where a complement is ordered by the id
 * of its operand so that {@code r} and {@code ~r} meet and cancel to the unit.
 */
final class RegexSetMerger {

  private RegexSetMerger() {}

  static int orderId(Term r) {
    return r.isComplement() ? r.getFirstChild().getId() : r.getId();
  }

  static boolean areComplements(Term a, Term b) {
    return (a.isComplement() && a.getFirstChild() == b)
        || (b.isComplement() && b.getFirstChild() == a);
  }

  /**
   * Merges {@code a} and {@code b}.
   *
   * @param unit the result when a pair of complementary elements is found: {@code .*} for unions
   *     and the empty language for intersections
   * @param op {@link Token#RE_UNION} or {@link Token#RE_INTERSECT}; the chain operator
   * @param compose conses an element onto an already merged chain
   */
  static Term merge(Term a, Term b, Term unit, Token op, BinaryOperator<Term> compose) {
    if (a == b) {
      return a;
    }
    Deque<Term> prefix = new ArrayDeque<>();
    Term ar = a;
    Term br = b;
    while (true) {
      if (ar == br) {
        return composeResult(prefix, ar, compose);
      }
      if (areComplements(ar, br)) {
        return unit;
      }
      boolean aChain = ar.getToken() == op;
      boolean bChain = br.getToken() == op;
      if (aChain && bChain) {
        Term a1 = ar.getFirstChild();
        Term b1 = br.getFirstChild();
        if (a1 == b1) {
          prefix.push(a1);
          ar = ar.getSecondChild();
          br = br.getSecondChild();
        } else if (areComplements(a1, b1)) {
          return unit;
        } else if (orderId(a1) < orderId(b1)) {
          prefix.push(a1);
          ar = ar.getSecondChild();
        } else {
          prefix.push(b1);
          br = br.getSecondChild();
        }
      } else if (aChain) {
        Term a1 = ar.getFirstChild();
        if (a1 == br) {
          return composeResult(prefix, ar, compose);
        } else if (areComplements(a1, br)) {
          return unit;
        } else if (orderId(a1) < orderId(br)) {
          prefix.push(a1);
          ar = ar.getSecondChild();
        } else {
          prefix.push(br);
          return composeResult(prefix, ar, compose);
        }
      } else if (bChain) {
        Term b1 = br.getFirstChild();
        if (b1 == ar) {
          return composeResult(prefix, br, compose);
        } else if (areComplements(b1, ar)) {
          return unit;
        } else if (orderId(b1) < orderId(ar)) {
          prefix.push(b1);
          br = br.getSecondChild();
        } else {
          prefix.push(ar);
          return composeResult(prefix, br, compose);
        }
      } else if (orderId(ar) < orderId(br)) {
        prefix.push(ar);
        return composeResult(prefix, br, compose);
      } else {
        prefix.push(br);
        return composeResult(prefix, ar, compose);
      }
    }
  }

  private static Term composeResult(Deque<Term> prefix, Term suffix, BinaryOperator<Term> compose) {
    Term result = suffix;
    while (!prefix.isEmpty()) {
      result = compose.apply(prefix.pop(), result);
    }
    return result;
  }
}
