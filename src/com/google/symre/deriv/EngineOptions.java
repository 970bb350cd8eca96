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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.MoreObjects;

/** Options for a {@link DerivativeEngine}. */
public class EngineOptions {

  static final int DEFAULT_MAX_CACHE_SIZE = 10000;
  static final int DEFAULT_MAX_WITNESS_STEPS = 10000;

  /** Number of cached operation results kept before the cache is reset. */
  private int maxCacheSize = DEFAULT_MAX_CACHE_SIZE;

  /**
   * Validate every combinator result against the derivative normal form. Slow; meant for tests
   * and debugging.
   */
  private boolean checkNormalForm = false;

  /** Number of derivative states the witness search visits before giving up. */
  private int maxWitnessSteps = DEFAULT_MAX_WITNESS_STEPS;

  public EngineOptions() {}

  public void setMaxCacheSize(int maxCacheSize) {
    checkArgument(maxCacheSize > 0, "cache size must be positive: %s", maxCacheSize);
    this.maxCacheSize = maxCacheSize;
  }

  public int getMaxCacheSize() {
    return maxCacheSize;
  }

  public void setCheckNormalForm(boolean checkNormalForm) {
    this.checkNormalForm = checkNormalForm;
  }

  public boolean shouldCheckNormalForm() {
    return checkNormalForm;
  }

  public void setMaxWitnessSteps(int maxWitnessSteps) {
    checkArgument(maxWitnessSteps > 0);
    this.maxWitnessSteps = maxWitnessSteps;
  }

  public int getMaxWitnessSteps() {
    return maxWitnessSteps;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("maxCacheSize", maxCacheSize)
        .add("checkNormalForm", checkNormalForm)
        .add("maxWitnessSteps", maxWitnessSteps)
        .toString();
  }
}
