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

package com.google.symre.base;

/**
 * A three-valued boolean. Used wherever a property of a term can be decided statically only some of
 * the time, for example whether a regex accepts the empty sequence.
 */
public enum Tri {
  TRUE,
  FALSE,
  UNKNOWN;

  public static Tri forBoolean(boolean value) {
    return value ? TRUE : FALSE;
  }

  public Tri and(Tri other) {
    if (this == FALSE || other == FALSE) {
      return FALSE;
    }
    if (this == TRUE && other == TRUE) {
      return TRUE;
    }
    return UNKNOWN;
  }

  public Tri or(Tri other) {
    if (this == TRUE || other == TRUE) {
      return TRUE;
    }
    if (this == FALSE && other == FALSE) {
      return FALSE;
    }
    return UNKNOWN;
  }

  public Tri not() {
    switch (this) {
      case TRUE:
        return FALSE;
      case FALSE:
        return TRUE;
      default:
        return UNKNOWN;
    }
  }

  public boolean toBoolean(boolean unknownValue) {
    switch (this) {
      case TRUE:
        return true;
      case FALSE:
        return false;
      default:
        return unknownValue;
    }
  }
}
