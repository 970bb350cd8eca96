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
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.google.symre.base.Tri;
import org.jspecify.annotations.Nullable;

/**
 * An immutable, hash-consed term. Terms are only created by a {@link TermManager}, which interns
 * them, so two terms built from the same operator, payload and children are the same object and
 * reference equality is structural equality.
 *
 * <p>Every term carries a creation id. Ids are unique within a manager and increase in creation
 * order; they give the canonical order used when sets of regexes are merged.
 */
public final class Term {

  /** Length bound meaning "no bound". Also the minimum length of the empty language. */
  public static final int UNBOUNDED = Integer.MAX_VALUE;

  private final Token token;
  private final Sort sort;
  private final ImmutableList<Term> children;
  private final @Nullable String text;
  private final int value;
  private final int upper;
  private final int id;

  private final boolean ground;
  private final int minLength;
  private final int maxLength;
  private final Tri nullable;

  Term(
      Token token,
      Sort sort,
      ImmutableList<Term> children,
      @Nullable String text,
      int value,
      int upper,
      int id,
      TermFacts facts) {
    this.token = token;
    this.sort = sort;
    this.children = children;
    this.text = text;
    this.value = value;
    this.upper = upper;
    this.id = id;
    this.ground = facts.ground;
    this.minLength = facts.minLength;
    this.maxLength = facts.maxLength;
    this.nullable = facts.nullable;
  }

  public Token getToken() {
    return token;
  }

  public Sort getSort() {
    return sort;
  }

  public int getId() {
    return id;
  }

  public ImmutableList<Term> getChildren() {
    return children;
  }

  public int getChildCount() {
    return children.size();
  }

  public Term getChildAtIndex(int i) {
    return children.get(i);
  }

  public Term getFirstChild() {
    return children.get(0);
  }

  public Term getSecondChild() {
    return children.get(1);
  }

  /** The literal text of a {@link Token#STRING}, or the name of a variable. */
  public String getString() {
    return checkNotNull(text, "no string payload on %s", token);
  }

  public int getCharCode() {
    checkState(token == Token.CHAR_LIT, token);
    return value;
  }

  public int getIntValue() {
    checkState(token == Token.INT_LIT, token);
    return value;
  }

  public int getLoopLower() {
    checkState(token == Token.RE_LOOP, token);
    return value;
  }

  /** The upper trip count of a loop, or {@link #UNBOUNDED}. */
  public int getLoopUpper() {
    checkState(token == Token.RE_LOOP, token);
    return upper;
  }

  public boolean hasLoopUpper() {
    return getLoopUpper() != UNBOUNDED;
  }

  /** True if the term mentions no variable of any kind and no stuck derivative. */
  public boolean isGround() {
    return ground;
  }

  /**
   * Lower bound on the length of the sequences this regex accepts (or this sequence has). {@link
   * #UNBOUNDED} for the empty language.
   */
  public int getMinLength() {
    return minLength;
  }

  /** Upper bound on accepted (or actual) length, {@link #UNBOUNDED} if unknown or infinite. */
  public int getMaxLength() {
    return maxLength;
  }

  /** Statically known nullability of a regex. */
  public Tri getNullable() {
    return nullable;
  }

  public boolean isRegex() {
    return sort == Sort.REGEX;
  }

  public boolean isEmptyRegex() {
    return this.token == Token.RE_EMPTY;
  }

  public boolean isEpsilon() {
    return this.token == Token.RE_EPSILON;
  }

  public boolean isFullChar() {
    return this.token == Token.RE_FULL_CHAR;
  }

  public boolean isFullSeq() {
    return this.token == Token.RE_FULL_SEQ;
  }

  public boolean isToSeq() {
    return this.token == Token.RE_TO_SEQ;
  }

  public boolean isConcat() {
    return this.token == Token.RE_CONCAT;
  }

  public boolean isUnion() {
    return this.token == Token.RE_UNION;
  }

  public boolean isIntersect() {
    return this.token == Token.RE_INTERSECT;
  }

  public boolean isDiff() {
    return this.token == Token.RE_DIFF;
  }

  public boolean isStar() {
    return this.token == Token.RE_STAR;
  }

  public boolean isPlus() {
    return this.token == Token.RE_PLUS;
  }

  public boolean isOpt() {
    return this.token == Token.RE_OPT;
  }

  public boolean isLoop() {
    return this.token == Token.RE_LOOP;
  }

  public boolean isComplement() {
    return this.token == Token.RE_COMPLEMENT;
  }

  public boolean isRange() {
    return this.token == Token.RE_RANGE;
  }

  public boolean isReverse() {
    return this.token == Token.RE_REVERSE;
  }

  public boolean isOfPredicate() {
    return this.token == Token.RE_OF_PREDICATE;
  }

  public boolean isAntimirovUnion() {
    return this.token == Token.RE_ANTIMIROV_UNION;
  }

  public boolean isDerivative() {
    return this.token == Token.RE_DERIVATIVE;
  }

  public boolean isIte() {
    return this.token == Token.ITE;
  }

  /** {@code .+}, written either as a plus of the full character class or as {@code . ++ .*}. */
  public boolean isDotPlus() {
    if (isPlus()) {
      return getFirstChild().isFullChar();
    }
    return isConcat() && getFirstChild().isFullChar() && getSecondChild().isFullSeq();
  }

  public boolean isTrue() {
    return this.token == Token.TRUE;
  }

  public boolean isFalse() {
    return this.token == Token.FALSE;
  }

  public boolean isAnd() {
    return this.token == Token.AND;
  }

  public boolean isOr() {
    return this.token == Token.OR;
  }

  public boolean isNot() {
    return this.token == Token.NOT;
  }

  public boolean isEq() {
    return this.token == Token.EQ;
  }

  public boolean isCharLe() {
    return this.token == Token.CHAR_LE;
  }

  public boolean isCharLit() {
    return this.token == Token.CHAR_LIT;
  }

  public boolean isStringLit() {
    return this.token == Token.STRING;
  }

  public boolean isEmptyString() {
    return isStringLit() && getString().isEmpty();
  }

  public boolean isSeqUnit() {
    return this.token == Token.SEQ_UNIT;
  }

  public boolean isSeqConcat() {
    return this.token == Token.SEQ_CONCAT;
  }

  public boolean isIntLit() {
    return this.token == Token.INT_LIT;
  }

  public boolean isInRe() {
    return this.token == Token.IN_RE;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    appendTo(sb);
    return sb.toString();
  }

  /** Renders the term as an indented tree, one operator per line. */
  public String toStringTree() {
    StringBuilder sb = new StringBuilder();
    appendTree(sb, 0);
    return sb.toString();
  }

  private void appendTree(StringBuilder sb, int indent) {
    for (int i = 0; i < indent; i++) {
      sb.append("    ");
    }
    if (children.isEmpty() || sort != Sort.REGEX) {
      appendTo(sb);
      sb.append('\n');
      return;
    }
    sb.append(token);
    if (isLoop()) {
      sb.append(' ').append(value).append(' ').append(upper == UNBOUNDED ? "inf" : upper);
    }
    sb.append('\n');
    for (Term child : children) {
      if (child.sort == Sort.REGEX) {
        child.appendTree(sb, indent + 1);
      } else {
        for (int i = 0; i <= indent; i++) {
          sb.append("    ");
        }
        child.appendTo(sb);
        sb.append('\n');
      }
    }
  }

  private void appendTo(StringBuilder sb) {
    switch (token) {
      case TRUE:
        sb.append("true");
        return;
      case FALSE:
        sb.append("false");
        return;
      case RE_EMPTY:
        sb.append("re.none");
        return;
      case RE_EPSILON:
        sb.append("re.eps");
        return;
      case RE_FULL_CHAR:
        sb.append("re.allchar");
        return;
      case RE_FULL_SEQ:
        sb.append("re.all");
        return;
      case STRING:
        sb.append('"').append(getString()).append('"');
        return;
      case CHAR_LIT:
        if (value >= 0x20 && value < 0x7f) {
          sb.append('\'').appendCodePoint(value).append('\'');
        } else {
          sb.append("#x").append(Integer.toHexString(value));
        }
        return;
      case INT_LIT:
        sb.append(value);
        return;
      case CHAR_VAR:
      case CHAR_BOUND_VAR:
      case SEQ_VAR:
      case BOOL_VAR:
      case RE_VAR:
      case PRED_VAR:
        sb.append(getString());
        return;
      default:
        break;
    }
    sb.append('(').append(token.name().toLowerCase());
    if (isLoop()) {
      sb.append(' ').append(value).append(' ').append(upper == UNBOUNDED ? "inf" : upper);
    }
    for (Term child : children) {
      sb.append(' ');
      child.appendTo(sb);
    }
    sb.append(')');
  }
}
