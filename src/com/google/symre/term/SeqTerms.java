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

import com.google.auto.value.AutoValue;
import org.jspecify.annotations.Nullable;

/** Simplifying constructors and decompositions for sequence terms. */
public final class SeqTerms {

  /** A sequence split into a leading part and a trailing part. */
  @AutoValue
  public abstract static class Split {
    /** The first element (for a head split) or everything but the last element. */
    public abstract Term head();

    /** Everything but the first element (for a head split) or the last element. */
    public abstract Term tail();

    static Split create(Term head, Term tail) {
      return new AutoValue_SeqTerms_Split(head, tail);
    }
  }

  private final TermManager tm;
  private final BooleanSimplifier bs;

  public SeqTerms(TermManager tm, BooleanSimplifier bs) {
    this.tm = tm;
    this.bs = bs;
  }

  /** The one-element sequence; a literal string when the element is a literal. */
  public Term mkUnit(Term ch) {
    if (ch.isCharLit()) {
      return tm.mkString(new String(Character.toChars(ch.getCharCode())));
    }
    return tm.mkUnit(ch);
  }

  public Term mkConcat(Term a, Term b) {
    if (a.isEmptyString()) {
      return b;
    }
    if (b.isEmptyString()) {
      return a;
    }
    if (a.isSeqConcat()) {
      return mkConcat(a.getFirstChild(), mkConcat(a.getSecondChild(), b));
    }
    if (a.isStringLit() && b.isStringLit()) {
      return tm.mkString(a.getString() + b.getString());
    }
    if (a.isStringLit() && b.isSeqConcat() && b.getFirstChild().isStringLit()) {
      return tm.mkSeqConcat(
          tm.mkString(a.getString() + b.getFirstChild().getString()), b.getSecondChild());
    }
    return tm.mkSeqConcat(a, b);
  }

  /**
   * Splits {@code s} into its first element and the rest, if the first element is syntactically
   * known.
   */
  public @Nullable Split headTail(Term s) {
    switch (s.getToken()) {
      case STRING:
        {
          String text = s.getString();
          if (text.isEmpty()) {
            return null;
          }
          int first = text.codePointAt(0);
          return Split.create(
              tm.mkChar(first), tm.mkString(text.substring(Character.charCount(first))));
        }
      case SEQ_UNIT:
        return Split.create(s.getFirstChild(), tm.mkString(""));
      case SEQ_CONCAT:
        {
          Split left = headTail(s.getFirstChild());
          if (left == null) {
            return null;
          }
          return Split.create(left.head(), mkConcat(left.tail(), s.getSecondChild()));
        }
      default:
        return null;
    }
  }

  /**
   * Splits {@code s} into everything but its last element and the last element, if the last
   * element is syntactically known.
   */
  public @Nullable Split headTailReversed(Term s) {
    switch (s.getToken()) {
      case STRING:
        {
          String text = s.getString();
          if (text.isEmpty()) {
            return null;
          }
          int last = text.codePointBefore(text.length());
          return Split.create(
              tm.mkString(text.substring(0, text.length() - Character.charCount(last))),
              tm.mkChar(last));
        }
      case SEQ_UNIT:
        return Split.create(tm.mkString(""), s.getFirstChild());
      case SEQ_CONCAT:
        {
          Split right = headTailReversed(s.getSecondChild());
          if (right == null) {
            return null;
          }
          return Split.create(mkConcat(s.getFirstChild(), right.head()), right.tail());
        }
      default:
        return null;
    }
  }

  public Term mkFirst(Term s) {
    Split split = headTail(s);
    return split != null ? split.head() : tm.mkSeqFirst(s);
  }

  public Term mkRest(Term s) {
    Split split = headTail(s);
    return split != null ? split.tail() : tm.mkSeqRest(s);
  }

  public Term mkLast(Term s) {
    Split split = headTailReversed(s);
    return split != null ? split.tail() : tm.mkSeqLast(s);
  }

  public Term mkButLast(Term s) {
    Split split = headTailReversed(s);
    return split != null ? split.head() : tm.mkSeqButLast(s);
  }

  public Term mkLength(Term s) {
    if (s.getMinLength() == s.getMaxLength()) {
      return tm.mkInt(s.getMinLength());
    }
    return tm.mkLength(s);
  }

  public Term mkIntSub(Term a, Term b) {
    if (b.isIntLit() && b.getIntValue() == 0) {
      return a;
    }
    if (a.isIntLit() && b.isIntLit()) {
      return tm.mkInt(a.getIntValue() - b.getIntValue());
    }
    return tm.mkIntSub(a, b);
  }

  /** At most {@code length} elements of {@code s} starting at {@code offset}. */
  public Term mkSubstr(Term s, Term offset, Term length) {
    if (s.isStringLit() && offset.isIntLit() && length.isIntLit()) {
      String text = s.getString();
      int size = text.codePointCount(0, text.length());
      int from = offset.getIntValue();
      int count = length.getIntValue();
      if (from < 0 || from >= size || count <= 0) {
        return tm.mkString("");
      }
      int to = (int) Math.min((long) from + count, size);
      return tm.mkString(
          text.substring(text.offsetByCodePoints(0, from), text.offsetByCodePoints(0, to)));
    }
    if (offset.isIntLit()
        && offset.getIntValue() == 0
        && length.isIntLit()
        && s.getMaxLength() <= length.getIntValue()) {
      return s;
    }
    return tm.mkSubstr(s, offset, length);
  }

  /** {@code a} is a prefix of {@code b}. */
  public Term mkPrefixOf(Term a, Term b) {
    if (a.isEmptyString() || a == b) {
      return tm.mkTrue();
    }
    if (a.isStringLit() && b.isStringLit()) {
      return tm.mkBool(b.getString().startsWith(a.getString()));
    }
    if (a.getMinLength() > b.getMaxLength()) {
      return tm.mkFalse();
    }
    return tm.mkPrefixOf(a, b);
  }

  /** {@code a} is a suffix of {@code b}. */
  public Term mkSuffixOf(Term a, Term b) {
    if (a.isEmptyString() || a == b) {
      return tm.mkTrue();
    }
    if (a.isStringLit() && b.isStringLit()) {
      return tm.mkBool(b.getString().endsWith(a.getString()));
    }
    if (a.getMinLength() > b.getMaxLength()) {
      return tm.mkFalse();
    }
    return tm.mkSuffixOf(a, b);
  }

  /** {@code s = ""}, folded when the length of {@code s} is known. */
  public Term mkIsEmpty(Term s) {
    if (s.getMaxLength() == 0) {
      return tm.mkTrue();
    }
    if (s.getMinLength() > 0) {
      return tm.mkFalse();
    }
    return bs.mkEq(s, tm.mkString(""));
  }
}
