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

import org.jspecify.annotations.Nullable;

/**
 * The operator of a {@link Term}. Each token fixes the sort of the terms it builds, except {@link
 * #ITE} whose sort is the sort of its branches.
 */
public enum Token {
  // Regular expressions.
  RE_EMPTY(Sort.REGEX),
  RE_EPSILON(Sort.REGEX),
  RE_FULL_CHAR(Sort.REGEX),
  RE_FULL_SEQ(Sort.REGEX),
  RE_TO_SEQ(Sort.REGEX),
  RE_CONCAT(Sort.REGEX),
  RE_UNION(Sort.REGEX),
  RE_INTERSECT(Sort.REGEX),
  RE_DIFF(Sort.REGEX),
  RE_STAR(Sort.REGEX),
  RE_PLUS(Sort.REGEX),
  RE_OPT(Sort.REGEX),
  RE_LOOP(Sort.REGEX),
  RE_COMPLEMENT(Sort.REGEX),
  RE_RANGE(Sort.REGEX),
  RE_REVERSE(Sort.REGEX),
  RE_OF_PREDICATE(Sort.REGEX),
  RE_VAR(Sort.REGEX),
  RE_ANTIMIROV_UNION(Sort.REGEX),
  RE_DERIVATIVE(Sort.REGEX),

  // If-then-else over any sort. Regex-sorted ITEs are both the surface conditional and the
  // branching node of derivatives.
  ITE(null),

  // Booleans.
  TRUE(Sort.BOOL),
  FALSE(Sort.BOOL),
  AND(Sort.BOOL),
  OR(Sort.BOOL),
  NOT(Sort.BOOL),
  EQ(Sort.BOOL),
  CHAR_LE(Sort.BOOL),
  INT_GE(Sort.BOOL),
  PRED_APPLY(Sort.BOOL),
  BOOL_VAR(Sort.BOOL),
  IN_RE(Sort.BOOL),
  PREFIX_OF(Sort.BOOL),
  SUFFIX_OF(Sort.BOOL),

  // Characters.
  CHAR_LIT(Sort.CHAR),
  CHAR_VAR(Sort.CHAR),
  CHAR_BOUND_VAR(Sort.CHAR),
  SEQ_FIRST(Sort.CHAR),
  SEQ_LAST(Sort.CHAR),

  // Sequences.
  STRING(Sort.SEQ),
  SEQ_UNIT(Sort.SEQ),
  SEQ_CONCAT(Sort.SEQ),
  SEQ_VAR(Sort.SEQ),
  SEQ_REST(Sort.SEQ),
  SEQ_BUTLAST(Sort.SEQ),
  SEQ_SUBSTR(Sort.SEQ),

  // Integers.
  INT_LIT(Sort.INT),
  SEQ_LENGTH(Sort.INT),
  INT_SUB(Sort.INT),

  // Character predicates.
  PRED_VAR(Sort.PREDICATE),
  PRED_LAMBDA(Sort.PREDICATE);

  private final @Nullable Sort sort;

  Token(@Nullable Sort sort) {
    this.sort = sort;
  }

  /** Returns the fixed sort of terms built with this token, or null for {@link #ITE}. */
  public @Nullable Sort getSort() {
    return sort;
  }
}
