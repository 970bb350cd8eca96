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

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.symre.term.Term.UNBOUNDED;

import com.google.common.collect.ImmutableList;
import com.google.symre.base.Tri;
import org.jspecify.annotations.Nullable;

/** Structural facts cached on every term when it is created. */
final class TermFacts {
  final boolean ground;
  final int minLength;
  final int maxLength;
  final Tri nullable;

  private TermFacts(boolean ground, int minLength, int maxLength, Tri nullable) {
    this.ground = ground;
    this.minLength = minLength;
    this.maxLength = maxLength;
    this.nullable = nullable;
  }

  static TermFacts compute(
      Token token, ImmutableList<Term> children, @Nullable String text, int value, int upper) {
    boolean ground = isGround(token, children);
    switch (token) {
      case STRING:
        {
          String literal = checkNotNull(text);
          int length = literal.codePointCount(0, literal.length());
          return new TermFacts(ground, length, length, Tri.UNKNOWN);
        }
      case SEQ_UNIT:
        return new TermFacts(ground, 1, 1, Tri.UNKNOWN);
      case SEQ_CONCAT:
        return new TermFacts(
            ground,
            add(min(children, 0), min(children, 1)),
            add(max(children, 0), max(children, 1)),
            Tri.UNKNOWN);
      case SEQ_REST:
      case SEQ_BUTLAST:
        {
          Term s = children.get(0);
          int lo = Math.max(s.getMinLength() - 1, 0);
          int hi = s.getMaxLength() == UNBOUNDED ? UNBOUNDED : Math.max(s.getMaxLength() - 1, 0);
          return new TermFacts(ground, lo, hi, Tri.UNKNOWN);
        }
      case SEQ_SUBSTR:
        return new TermFacts(ground, 0, max(children, 0), Tri.UNKNOWN);

      case RE_EMPTY:
        return new TermFacts(ground, UNBOUNDED, 0, Tri.FALSE);
      case RE_EPSILON:
        return new TermFacts(ground, 0, 0, Tri.TRUE);
      case RE_FULL_CHAR:
      case RE_RANGE:
      case RE_OF_PREDICATE:
        return new TermFacts(ground, 1, 1, Tri.FALSE);
      case RE_FULL_SEQ:
        return new TermFacts(ground, 0, UNBOUNDED, Tri.TRUE);
      case RE_TO_SEQ:
        {
          Term s = children.get(0);
          Tri nullable =
              s.getMaxLength() == 0 || s.getMinLength() > 0
                  ? Tri.forBoolean(s.getMaxLength() == 0)
                  : Tri.UNKNOWN;
          return new TermFacts(ground, s.getMinLength(), s.getMaxLength(), nullable);
        }
      case RE_CONCAT:
        {
          Term a = children.get(0);
          Term b = children.get(1);
          if (a.getMinLength() == UNBOUNDED || b.getMinLength() == UNBOUNDED) {
            return new TermFacts(ground, UNBOUNDED, 0, Tri.FALSE);
          }
          return new TermFacts(
              ground,
              add(a.getMinLength(), b.getMinLength()),
              add(a.getMaxLength(), b.getMaxLength()),
              a.getNullable().and(b.getNullable()));
        }
      case RE_UNION:
      case RE_ANTIMIROV_UNION:
      case ITE:
        {
          Term a = children.get(children.size() - 2);
          Term b = children.get(children.size() - 1);
          if (a.getSort() != Sort.REGEX) {
            // A boolean, sequence or character ITE.
            return new TermFacts(
                ground,
                Math.min(a.getMinLength(), b.getMinLength()),
                Math.max(a.getMaxLength(), b.getMaxLength()),
                Tri.UNKNOWN);
          }
          Tri nullable;
          if (token == Token.ITE) {
            nullable = a.getNullable() == b.getNullable() ? a.getNullable() : Tri.UNKNOWN;
          } else {
            nullable = a.getNullable().or(b.getNullable());
          }
          return new TermFacts(
              ground,
              Math.min(a.getMinLength(), b.getMinLength()),
              Math.max(a.getMaxLength(), b.getMaxLength()),
              nullable);
        }
      case RE_INTERSECT:
        {
          Term a = children.get(0);
          Term b = children.get(1);
          return new TermFacts(
              ground,
              Math.max(a.getMinLength(), b.getMinLength()),
              Math.min(a.getMaxLength(), b.getMaxLength()),
              a.getNullable().and(b.getNullable()));
        }
      case RE_DIFF:
        {
          Term a = children.get(0);
          Term b = children.get(1);
          Tri nullable = a.getNullable().and(b.getNullable().not());
          return new TermFacts(ground, a.getMinLength(), a.getMaxLength(), nullable);
        }
      case RE_COMPLEMENT:
        return new TermFacts(ground, 0, UNBOUNDED, children.get(0).getNullable().not());
      case RE_STAR:
        return new TermFacts(
            ground, 0, children.get(0).getMaxLength() == 0 ? 0 : UNBOUNDED, Tri.TRUE);
      case RE_PLUS:
        {
          Term a = children.get(0);
          return new TermFacts(
              ground, a.getMinLength(), a.getMaxLength() == 0 ? 0 : UNBOUNDED, a.getNullable());
        }
      case RE_OPT:
        return new TermFacts(ground, 0, children.get(0).getMaxLength(), Tri.TRUE);
      case RE_LOOP:
        {
          if (value > upper) {
            return new TermFacts(ground, UNBOUNDED, 0, Tri.FALSE);
          }
          Term a = children.get(0);
          int lo = mul(a.getMinLength(), value);
          int hi;
          if (a.getMaxLength() == 0) {
            hi = 0;
          } else if (upper == UNBOUNDED) {
            hi = UNBOUNDED;
          } else {
            hi = mul(a.getMaxLength(), upper);
          }
          if (value == 0) {
            return new TermFacts(ground, 0, hi, Tri.TRUE);
          }
          return new TermFacts(ground, lo, hi, a.getNullable());
        }
      case RE_REVERSE:
        {
          Term a = children.get(0);
          return new TermFacts(ground, a.getMinLength(), a.getMaxLength(), a.getNullable());
        }
      default:
        return new TermFacts(ground, 0, UNBOUNDED, Tri.UNKNOWN);
    }
  }

  private static boolean isGround(Token token, ImmutableList<Term> children) {
    switch (token) {
      case CHAR_VAR:
      case CHAR_BOUND_VAR:
      case SEQ_VAR:
      case BOOL_VAR:
      case RE_VAR:
      case PRED_VAR:
      case RE_DERIVATIVE:
        return false;
      case PRED_LAMBDA:
        // The body only mentions the bound character.
        return true;
      default:
        break;
    }
    for (Term child : children) {
      if (!child.isGround()) {
        return false;
      }
    }
    return true;
  }

  private static int min(ImmutableList<Term> children, int i) {
    return children.get(i).getMinLength();
  }

  private static int max(ImmutableList<Term> children, int i) {
    return children.get(i).getMaxLength();
  }

  /** Saturating addition of length bounds. */
  static int add(int a, int b) {
    if (a == UNBOUNDED || b == UNBOUNDED) {
      return UNBOUNDED;
    }
    long sum = (long) a + b;
    return sum >= UNBOUNDED ? UNBOUNDED : (int) sum;
  }

  /** Saturating multiplication of length bounds. */
  static int mul(int a, int b) {
    if (a == 0 || b == 0) {
      return 0;
    }
    if (a == UNBOUNDED || b == UNBOUNDED) {
      return UNBOUNDED;
    }
    long product = (long) a * b;
    return product >= UNBOUNDED ? UNBOUNDED : (int) product;
  }
}
