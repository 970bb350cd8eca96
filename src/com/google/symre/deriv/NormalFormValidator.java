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
import org.jspecify.annotations.Nullable;

/**
 * Checks that a derivative is in normal form: a right-nested chain of antimirov unions, whose
 * elements are ITE trees with strictly decreasing conditions from the root, whose leaves are
 * plain regexes with no ITE or antimirov union under their unions and intersections.
 */
public final class NormalFormValidator {

  /** Violation handler */
  public interface ViolationHandler {
    void handleViolation(String message, Term t);
  }

  private final ViolationHandler violationHandler;

  public NormalFormValidator() {
    this(
        new ViolationHandler() {
          @Override
          public void handleViolation(String message, Term t) {
            throw new IllegalStateException(
                message + ". Reference term:\n" + t.toStringTree());
          }
        });
  }

  public NormalFormValidator(ViolationHandler handler) {
    this.violationHandler = handler;
  }

  public void validateDerivative(Term d) {
    while (d.isAntimirovUnion()) {
      Term first = d.getFirstChild();
      if (first.isAntimirovUnion()) {
        violation("Antimirov union is not right-nested", d);
      }
      validateIteTree(first, null);
      d = d.getSecondChild();
    }
    validateIteTree(d, null);
  }

  private void validateIteTree(Term d, @Nullable Term parentCondition) {
    if (d.isAntimirovUnion()) {
      violation("Antimirov union below the top level", d);
      return;
    }
    if (!d.isIte()) {
      validateLeaf(d);
      return;
    }
    Term c = d.getFirstChild();
    if (c.isNot()) {
      violation("Negated ITE condition", d);
    }
    if (c.isTrue() || c.isFalse()) {
      violation("Constant ITE condition", d);
    }
    if (parentCondition != null && ConditionOrder.compare(parentCondition, c) <= 0) {
      violation("ITE condition out of order under " + parentCondition, d);
    }
    if (d.getSecondChild() == d.getChildAtIndex(2)) {
      violation("ITE with identical branches", d);
    }
    validateIteTree(d.getSecondChild(), c);
    validateIteTree(d.getChildAtIndex(2), c);
  }

  private void validateLeaf(Term d) {
    switch (d.getToken()) {
      case ITE:
        violation("ITE inside a derivative leaf", d);
        break;
      case RE_ANTIMIROV_UNION:
        violation("Antimirov union inside a derivative leaf", d);
        break;
      case RE_UNION:
      case RE_INTERSECT:
        validateLeaf(d.getFirstChild());
        validateLeaf(d.getSecondChild());
        break;
      default:
        break;
    }
  }

  private void violation(String message, Term t) {
    violationHandler.handleViolation(message, t);
  }
}
