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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Simplifying constructors for boolean, character and integer terms. Constant operands are folded
 * and conjunctions and disjunctions are flattened, deduplicated and put in creation order, so that
 * equal conditions built in different orders intern to the same term.
 */
public final class BooleanSimplifier {

  private static final Comparator<Term> BY_ID = Comparator.comparingInt(Term::getId);

  private final TermManager tm;

  public BooleanSimplifier(TermManager tm) {
    this.tm = tm;
  }

  public TermManager getTermManager() {
    return tm;
  }

  public Term mkNot(Term a) {
    switch (a.getToken()) {
      case TRUE:
        return tm.mkFalse();
      case FALSE:
        return tm.mkTrue();
      case NOT:
        return a.getFirstChild();
      default:
        return tm.mkNot(a);
    }
  }

  public Term mkAnd(Term a, Term b) {
    return mkAnd(ImmutableList.of(a, b));
  }

  public Term mkAnd(List<Term> args) {
    Set<Term> conjuncts = new LinkedHashSet<>();
    for (Term arg : args) {
      if (arg.isAnd()) {
        conjuncts.addAll(arg.getChildren());
      } else if (arg.isFalse()) {
        return arg;
      } else if (!arg.isTrue()) {
        conjuncts.add(arg);
      }
    }
    for (Term c : conjuncts) {
      if (c.isFalse() || (c.isNot() && conjuncts.contains(c.getFirstChild()))) {
        return tm.mkFalse();
      }
    }
    return build(conjuncts, /* isAnd= */ true);
  }

  public Term mkOr(Term a, Term b) {
    return mkOr(ImmutableList.of(a, b));
  }

  public Term mkOr(List<Term> args) {
    Set<Term> disjuncts = new LinkedHashSet<>();
    for (Term arg : args) {
      if (arg.isOr()) {
        disjuncts.addAll(arg.getChildren());
      } else if (arg.isTrue()) {
        return arg;
      } else if (!arg.isFalse()) {
        disjuncts.add(arg);
      }
    }
    for (Term d : disjuncts) {
      if (d.isTrue() || (d.isNot() && disjuncts.contains(d.getFirstChild()))) {
        return tm.mkTrue();
      }
    }
    return build(disjuncts, /* isAnd= */ false);
  }

  private Term build(Set<Term> operands, boolean isAnd) {
    if (operands.isEmpty()) {
      return tm.mkBool(isAnd);
    }
    if (operands.size() == 1) {
      return operands.iterator().next();
    }
    List<Term> sorted = new ArrayList<>(operands);
    sorted.sort(BY_ID);
    return isAnd ? tm.mkAnd(sorted) : tm.mkOr(sorted);
  }

  /** If-then-else over any sort. Boolean branches are folded into connectives where possible. */
  public Term mkIte(Term c, Term t, Term e) {
    if (c.isTrue() || t == e) {
      return t;
    }
    if (c.isFalse()) {
      return e;
    }
    if (c.isNot()) {
      return mkIte(c.getFirstChild(), e, t);
    }
    if (t.getSort() == Sort.BOOL) {
      if (t.isTrue() && e.isFalse()) {
        return c;
      }
      if (t.isFalse() && e.isTrue()) {
        return mkNot(c);
      }
      if (t.isTrue()) {
        return mkOr(c, e);
      }
      if (e.isFalse()) {
        return mkAnd(c, t);
      }
      if (t.isFalse()) {
        return mkAnd(mkNot(c), e);
      }
      if (e.isTrue()) {
        return mkOr(mkNot(c), t);
      }
    }
    return tm.mkIte(c, t, e);
  }

  /** Equality over any sort, oriented so that a literal operand comes second. */
  public Term mkEq(Term a, Term b) {
    checkArgument(a.getSort() == b.getSort(), "eq over different sorts: %s %s", a, b);
    if (a == b) {
      return tm.mkTrue();
    }
    if (isLiteral(a) && isLiteral(b)) {
      return tm.mkFalse();
    }
    switch (a.getSort()) {
      case BOOL:
        if (a.isTrue() || a.isFalse()) {
          return a.isTrue() ? b : mkNot(b);
        }
        if (b.isTrue() || b.isFalse()) {
          return b.isTrue() ? a : mkNot(a);
        }
        break;
      case SEQ:
        if (a.getMaxLength() < b.getMinLength() || b.getMaxLength() < a.getMinLength()) {
          return tm.mkFalse();
        }
        if (a.isSeqUnit() && b.isSeqUnit()) {
          return mkEq(a.getFirstChild(), b.getFirstChild());
        }
        if (a.isSeqUnit() && b.isStringLit()) {
          return mkEq(a.getFirstChild(), tm.mkChar(b.getString().codePointAt(0)));
        }
        if (b.isSeqUnit() && a.isStringLit()) {
          return mkEq(b.getFirstChild(), tm.mkChar(a.getString().codePointAt(0)));
        }
        break;
      default:
        break;
    }
    if (isLiteral(a) || (!isLiteral(b) && b.getId() < a.getId())) {
      return tm.mkEq(b, a);
    }
    return tm.mkEq(a, b);
  }

  /** {@code a <= b} on character codes. */
  public Term mkCharLe(Term a, Term b) {
    if (a == b) {
      return tm.mkTrue();
    }
    if (a.isCharLit() && b.isCharLit()) {
      return tm.mkBool(a.getCharCode() <= b.getCharCode());
    }
    if (a.isCharLit() && a.getCharCode() == 0) {
      return tm.mkTrue();
    }
    if (b.isCharLit() && b.getCharCode() == tm.getMaxChar()) {
      return tm.mkTrue();
    }
    return tm.mkCharLe(a, b);
  }

  public Term mkIntGe(Term a, Term b) {
    if (a == b) {
      return tm.mkTrue();
    }
    if (a.isIntLit() && b.isIntLit()) {
      return tm.mkBool(a.getIntValue() >= b.getIntValue());
    }
    if (b.isIntLit() && b.getIntValue() <= 0 && a.getToken() == Token.SEQ_LENGTH) {
      return tm.mkTrue();
    }
    return tm.mkIntGe(a, b);
  }

  /** Applies a character predicate, substituting into the body of a lambda. */
  public Term applyPredicate(Term pred, Term ch) {
    if (pred.getToken() == Token.PRED_LAMBDA) {
      return substitute(pred.getFirstChild(), tm.mkBoundChar(), ch);
    }
    return tm.mkPredApply(pred, ch);
  }

  /**
   * Replaces every occurrence of {@code from} in {@code t} by {@code to}. Boolean structure is
   * rebuilt through the simplifying constructors, so substituting a literal folds what it can.
   */
  public Term substitute(Term t, Term from, Term to) {
    return substitute(t, from, to, new HashMap<>());
  }

  private Term substitute(Term t, Term from, Term to, Map<Term, Term> memo) {
    if (t == from) {
      return to;
    }
    if (t.getChildCount() == 0 || t.getToken() == Token.PRED_LAMBDA) {
      return t;
    }
    Term cached = memo.get(t);
    if (cached != null) {
      return cached;
    }
    List<Term> kids = new ArrayList<>(t.getChildCount());
    boolean changed = false;
    for (Term child : t.getChildren()) {
      Term replaced = substitute(child, from, to, memo);
      changed |= replaced != child;
      kids.add(replaced);
    }
    Term result = changed ? rebuild(t, kids) : t;
    memo.put(t, result);
    return result;
  }

  private Term rebuild(Term t, List<Term> kids) {
    switch (t.getToken()) {
      case NOT:
        return mkNot(kids.get(0));
      case AND:
        return mkAnd(kids);
      case OR:
        return mkOr(kids);
      case ITE:
        return mkIte(kids.get(0), kids.get(1), kids.get(2));
      case EQ:
        return mkEq(kids.get(0), kids.get(1));
      case CHAR_LE:
        return mkCharLe(kids.get(0), kids.get(1));
      case INT_GE:
        return mkIntGe(kids.get(0), kids.get(1));
      case PRED_APPLY:
        return applyPredicate(kids.get(0), kids.get(1));
      default:
        return tm.withChildren(t, kids);
    }
  }

  private static boolean isLiteral(Term t) {
    switch (t.getToken()) {
      case TRUE:
      case FALSE:
      case CHAR_LIT:
      case INT_LIT:
      case STRING:
        return true;
      default:
        return false;
    }
  }
}
