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

import com.google.auto.value.AutoValue;
import com.google.common.annotations.VisibleForTesting;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.symre.term.Term;
import java.util.HashMap;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * Memo table for derivative and combinator results, keyed on an operation tag and up to three
 * operand terms. The table is bounded: once it holds the maximum number of entries it is cleared
 * entirely before the next insertion. Terms are interned, so a reset never changes what an
 * operation returns, only how long it takes.
 */
public final class OpCache {

  private static final Logger logger = Logger.getLogger(OpCache.class.getName());

  /** The cached operations. */
  public enum OpTag {
    DERIVATIVE,
    IS_NULLABLE,
    UNION,
    INTERSECT,
    CONCAT,
    NEGATE,
    RESTRICT,
    REVERSE,
    BDD_UNION,
    BDD_INTERSECT,
    BDD_COMPLEMENT
  }

  @AutoValue
  abstract static class Key {
    abstract OpTag op();

    abstract @Nullable Term a();

    abstract @Nullable Term b();

    abstract @Nullable Term c();

    static Key create(OpTag op, @Nullable Term a, @Nullable Term b, @Nullable Term c) {
      return new AutoValue_OpCache_Key(op, a, b, c);
    }
  }

  private final Map<Key, Term> table = new HashMap<>();
  private final int maxSize;

  private int hits;
  private int misses;
  private int resets;

  public OpCache(int maxSize) {
    this.maxSize = maxSize;
  }

  public @Nullable Term find(OpTag op, @Nullable Term a, @Nullable Term b, @Nullable Term c) {
    Term result = table.get(Key.create(op, a, b, c));
    if (result == null) {
      misses++;
    } else {
      hits++;
    }
    return result;
  }

  /** Records {@code result} for the given operation and returns it. */
  @CanIgnoreReturnValue
  public Term insert(
      OpTag op, @Nullable Term a, @Nullable Term b, @Nullable Term c, Term result) {
    if (table.size() >= maxSize) {
      resets++;
      if (logger.isLoggable(Level.FINE)) {
        logger.fine("Resetting operation cache after " + table.size() + " entries");
      }
      table.clear();
    }
    table.put(Key.create(op, a, b, c), result);
    return result;
  }

  public int size() {
    return table.size();
  }

  public void clear() {
    table.clear();
  }

  @VisibleForTesting
  int getHitCount() {
    return hits;
  }

  @VisibleForTesting
  int getMissCount() {
    return misses;
  }

  @VisibleForTesting
  int getResetCount() {
    return resets;
  }
}
