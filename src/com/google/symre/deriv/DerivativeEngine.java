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

import com.google.common.annotations.VisibleForTesting;
import com.google.symre.base.Tri;
import com.google.symre.term.BooleanSimplifier;
import com.google.symre.term.SeqTerms;
import com.google.symre.term.Sort;
import com.google.symre.term.Term;
import com.google.symre.term.TermManager;
import java.util.Optional;

/**
 * Symbolic derivatives of regular expressions over sequences, and the membership, nullability and
 * emptiness questions answered with them.
 *
 * <p>An engine owns an operation cache and is bound to one {@link TermManager}. It is not thread
 * safe.
 */
public final class DerivativeEngine {

  private final TermManager tm;
  private final EngineOptions options;
  private final OpCache cache;
  private final BooleanSimplifier bs;
  private final RegexSimplifier re;
  private final DerivativeCombinators combinators;
  private final BddOperations bdd;
  private final Derivatives derivatives;
  private final NullabilityChecker nullability;
  private final RegexReverser reverser;
  private final MembershipDecider membership;
  private final WitnessFinder witnesses;

  public DerivativeEngine(TermManager tm) {
    this(tm, new EngineOptions());
  }

  public DerivativeEngine(TermManager tm, EngineOptions options) {
    this.tm = tm;
    this.options = options;
    this.cache = new OpCache(options.getMaxCacheSize());
    this.bs = new BooleanSimplifier(tm);
    SeqTerms seqs = new SeqTerms(tm, bs);
    ConditionSimplifier conditions = new ConditionSimplifier(tm, bs);
    NormalFormValidator validator =
        options.shouldCheckNormalForm() ? new NormalFormValidator() : null;
    this.re = new RegexSimplifier(tm, seqs);
    this.combinators = new DerivativeCombinators(tm, bs, conditions, re, cache, validator);
    this.bdd = new BddOperations(tm, bs, re, combinators, cache);
    this.nullability = new NullabilityChecker(tm, bs, seqs, cache);
    this.reverser = new RegexReverser(tm, re, cache);
    this.derivatives =
        new Derivatives(
            tm,
            bs,
            seqs,
            conditions,
            re,
            combinators,
            bdd,
            nullability,
            reverser,
            cache,
            validator);
    this.membership = new MembershipDecider(tm, bs, seqs, derivatives, nullability, reverser);
    this.witnesses =
        new WitnessFinder(tm, conditions, derivatives, nullability, options.getMaxWitnessSteps());
  }

  private static void checkRegex(Term r) {
    checkArgument(r.getSort() == Sort.REGEX, "not a regex: %s", r);
  }

  /**
   * The derivative of {@code regex} by the character {@code ch}: a regex accepting {@code w}
   * exactly when {@code regex} accepts {@code ch w}. Conditions on a symbolic {@code ch} show up
   * as ITE terms; unresolvable parts as unevaluated derivative terms.
   */
  public Term derivative(Term ch, Term regex) {
    checkArgument(ch.getSort() == Sort.CHAR, "not a character: %s", ch);
    checkRegex(regex);
    return derivatives.plainDerivative(ch, regex);
  }

  /** The derivative of {@code regex} by the bound character variable. */
  public Term derivative(Term regex) {
    checkRegex(regex);
    return derivatives.plainDerivative(tm.mkBoundChar(), regex);
  }

  /** A boolean term that holds exactly when {@code regex} accepts the empty sequence. */
  public Term nullable(Term regex) {
    checkRegex(regex);
    return nullability.nullable(regex);
  }

  /** A boolean term equivalent to {@code sequence in regex}. */
  public Term inRegex(Term sequence, Term regex) {
    checkArgument(sequence.getSort() == Sort.SEQ, "not a sequence: %s", sequence);
    checkRegex(regex);
    return membership.inRegex(sequence, regex);
  }

  /** Whether {@code regex} accepts at least one sequence. */
  public Tri isNonEmpty(Term regex) {
    checkRegex(regex);
    return witnesses.find(regex, new StringBuilder());
  }

  /** A sequence {@code regex} accepts, if the search finds one. */
  public Optional<String> someString(Term regex) {
    checkRegex(regex);
    StringBuilder witness = new StringBuilder();
    if (witnesses.find(regex, witness).toBoolean(false)) {
      return Optional.of(witness.toString());
    }
    return Optional.empty();
  }

  /** A regex accepting the reverses of the sequences {@code regex} accepts. */
  public Term reverse(Term regex) {
    checkRegex(regex);
    return reverser.reverse(regex);
  }

  /** Rebuilds {@code regex} through the simplifying regex constructors. */
  public Term simplify(Term regex) {
    checkRegex(regex);
    return re.simplify(regex);
  }

  public TermManager getTermManager() {
    return tm;
  }

  public EngineOptions getOptions() {
    return options;
  }

  public OpCache getCache() {
    return cache;
  }

  @VisibleForTesting
  BooleanSimplifier getBooleanSimplifier() {
    return bs;
  }

  @VisibleForTesting
  RegexSimplifier getRegexSimplifier() {
    return re;
  }

  @VisibleForTesting
  DerivativeCombinators getCombinators() {
    return combinators;
  }

  @VisibleForTesting
  Derivatives getDerivatives() {
    return derivatives;
  }

  @VisibleForTesting
  BddOperations getBddOperations() {
    return bdd;
  }
}
