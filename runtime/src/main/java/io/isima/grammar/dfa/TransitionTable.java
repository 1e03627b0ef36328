/*
 * Copyright (C) 2025 Isima, Inc.
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
package io.isima.grammar.dfa;

import io.isima.grammar.common.GrammarConfig;
import java.util.Arrays;
import java.util.OptionalInt;

/**
 * Immutable transition tables of one DFA, one entry per state in each parallel array.
 *
 * <ul>
 *   <li>{@code min}, {@code max}: inclusive symbol range covered by the state's transition row
 *   <li>{@code transition}: next state per symbol in the range, starting at {@code min}
 *   <li>{@code eot}: state to go to when no normal transition applies
 *   <li>{@code eof}: state whose accept value is predicted at end of input
 *   <li>{@code accept}: predicted alternative (1..n) of an accepting state
 *   <li>{@code special}: index passed to the {@link SpecialStateTransition} resolver
 * </ul>
 *
 * <p>Storage uses -1 for "none", as produced by the grammar tool; accessors report absence with
 * {@link OptionalInt} instead. Tables are validated on construction.
 */
public final class TransitionTable {

  private static final short NONE = -1;

  private final short[] eot;
  private final short[] eof;
  private final char[] min;
  private final char[] max;
  private final short[] accept;
  private final short[] special;
  private final short[][] transition;

  public TransitionTable(
      short[] eot,
      short[] eof,
      char[] min,
      char[] max,
      short[] accept,
      short[] special,
      short[][] transition) {
    if (eot == null
        || eof == null
        || min == null
        || max == null
        || accept == null
        || special == null
        || transition == null) {
      throw new MalformedTableException("all tables are required");
    }
    this.eot = eot.clone();
    this.eof = eof.clone();
    this.min = min.clone();
    this.max = max.clone();
    this.accept = accept.clone();
    this.special = special.clone();
    this.transition = new short[transition.length][];
    for (int s = 0; s < transition.length; ++s) {
      this.transition[s] = transition[s] == null ? new short[0] : transition[s].clone();
    }
    validate();
  }

  /**
   * Builds a table from the run-length encoded strings emitted by the grammar tool.
   *
   * @param transitionS one encoded transition row per state
   * @throws MalformedTableException if a string cannot be decoded or the result is inconsistent
   */
  public static TransitionTable fromEncoded(
      String eotS,
      String eofS,
      String minS,
      String maxS,
      String acceptS,
      String specialS,
      String[] transitionS) {
    if (transitionS == null) {
      throw new MalformedTableException("transition rows are required");
    }
    final short[][] transition = new short[transitionS.length][];
    for (int s = 0; s < transitionS.length; ++s) {
      transition[s] = EncodedTables.unpackEncodedString(transitionS[s]);
    }
    return new TransitionTable(
        EncodedTables.unpackEncodedString(eotS),
        EncodedTables.unpackEncodedString(eofS),
        EncodedTables.unpackEncodedStringToUnsignedChars(minS),
        EncodedTables.unpackEncodedStringToUnsignedChars(maxS),
        EncodedTables.unpackEncodedString(acceptS),
        EncodedTables.unpackEncodedString(specialS),
        transition);
  }

  private void validate() {
    final int numStates = eot.length;
    if (numStates == 0) {
      throw new MalformedTableException("a DFA needs at least the start state");
    }
    final int maxStates = GrammarConfig.dfaMaxStates();
    if (numStates > maxStates) {
      throw new MalformedTableException(
          String.format("%d states exceed the limit of %d", numStates, maxStates));
    }
    checkLength("eof", eof.length, numStates);
    checkLength("min", min.length, numStates);
    checkLength("max", max.length, numStates);
    checkLength("accept", accept.length, numStates);
    checkLength("special", special.length, numStates);
    checkLength("transition", transition.length, numStates);
    for (int s = 0; s < numStates; ++s) {
      checkTarget("eot", s, eot[s]);
      checkTarget("eof", s, eof[s]);
      if (special[s] < NONE) {
        throw new MalformedTableException(
            String.format("special[%d]=%d is neither absent nor an index", s, special[s]));
      }
      boolean hasNormalTransition = false;
      for (final short target : transition[s]) {
        checkTarget("transition", s, target);
        hasNormalTransition |= target >= 0;
      }
      if (hasNormalTransition) {
        if (min[s] > max[s]) {
          throw new MalformedTableException(
              String.format(
                  "state %d has transitions but min %d > max %d", s, (int) min[s], (int) max[s]));
        }
        if (transition[s].length > max[s] - min[s] + 1) {
          throw new MalformedTableException(
              String.format(
                  "state %d has %d transitions for range [%d, %d]",
                  s, transition[s].length, (int) min[s], (int) max[s]));
        }
      }
    }
  }

  private void checkLength(String name, int length, int numStates) {
    if (length != numStates) {
      throw new MalformedTableException(
          String.format("%s table has %d entries, expected %d", name, length, numStates));
    }
  }

  private void checkTarget(String name, int s, short target) {
    if (target != NONE && (target < 0 || target >= eot.length)) {
      throw new MalformedTableException(
          String.format("%s target %d of state %d is not a state", name, target, s));
    }
  }

  /** Number of states. */
  public int size() {
    return eot.length;
  }

  /**
   * Checks a state number computed outside the tables, such as a special state resolution.
   *
   * @return the state
   * @throws MalformedTableException if the state does not exist
   */
  public int checkState(int s) {
    if (s < 0 || s >= eot.length) {
      throw new MalformedTableException(
          String.format("state %d out of range [0, %d)", s, eot.length));
    }
    return s;
  }

  public boolean isAccepting(int s) {
    return accept[s] >= 1;
  }

  /** Alternative predicted by state {@code s}, or 0 when the state does not accept. */
  public int accept(int s) {
    return Math.max(accept[s], 0);
  }

  public char min(int s) {
    return min[s];
  }

  public char max(int s) {
    return max[s];
  }

  public boolean inRange(int s, char c) {
    return c >= min[s] && c <= max[s];
  }

  /** Normal transition of {@code s} on {@code c}; {@code c} must be within the state's range. */
  public OptionalInt transition(int s, char c) {
    final int offset = c - min[s];
    final short[] row = transition[s];
    if (offset < 0 || offset >= row.length || row[offset] < 0) {
      return OptionalInt.empty();
    }
    return OptionalInt.of(row[offset]);
  }

  public OptionalInt eot(int s) {
    return eot[s] < 0 ? OptionalInt.empty() : OptionalInt.of(eot[s]);
  }

  public OptionalInt eof(int s) {
    return eof[s] < 0 ? OptionalInt.empty() : OptionalInt.of(eof[s]);
  }

  public OptionalInt special(int s) {
    return special[s] < 0 ? OptionalInt.empty() : OptionalInt.of(special[s]);
  }

  /** Human readable dump of one state, for diagnostics. */
  public String describeState(int s) {
    return String.format(
        "state %d: min=%d max=%d eot=%d eof=%d accept=%d special=%d transitions=%s",
        s,
        (int) min[s],
        (int) max[s],
        eot[s],
        eof[s],
        accept[s],
        special[s],
        Arrays.toString(transition[s]));
  }
}
