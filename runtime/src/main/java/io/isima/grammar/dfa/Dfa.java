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

import io.isima.grammar.recognizer.BaseRecognizer;
import io.isima.grammar.recognizer.NoViableAltException;
import io.isima.grammar.recognizer.RecognizerSharedState;
import io.isima.grammar.stream.IntStream;
import io.isima.grammar.stream.Token;
import java.util.Objects;
import java.util.function.Consumer;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A DFA implemented as a set of transition tables, predicting which alternative of a decision
 * will succeed from the upcoming input.
 *
 * <p>Any state that has a semantic predicate edge is special; transitions out of special states
 * are computed by the {@link SpecialStateTransition} given at construction.
 *
 * <p>Prediction only looks ahead: the input is always rewound to where it was, whether the
 * prediction succeeds, fails or throws. An instance is not safe for concurrent use.
 */
public class Dfa {
  private static final Logger logger = LoggerFactory.getLogger(Dfa.class);

  private static final String NO_DESCRIPTION = "n/a";

  /** Which decision of the grammar this DFA predicts. */
  @Getter private final int decisionNumber;

  @Getter private final TransitionTable table;

  private final String description;
  private final SpecialStateTransition specialStateTransition;
  private final Consumer<NoViableAltException> errorHook;

  /** The enclosing recognizer, needed to check whether it is backtracking; may be null. */
  private final BaseRecognizer recognizer;

  public Dfa(BaseRecognizer recognizer, int decisionNumber, TransitionTable table) {
    this(recognizer, decisionNumber, null, table, null, null);
  }

  /**
   * Creates a DFA.
   *
   * @param recognizer enclosing recognizer whose state {@link #predict(IntStream)} uses; may be
   *     null
   * @param decisionNumber decision number for diagnostics
   * @param description decision description for diagnostics; null for "n/a"
   * @param table transition tables
   * @param specialStateTransition resolver for special states; null when there are none
   * @param errorHook receives each no-viable-alternative failure before it is thrown; may be null
   */
  public Dfa(
      BaseRecognizer recognizer,
      int decisionNumber,
      String description,
      TransitionTable table,
      SpecialStateTransition specialStateTransition,
      Consumer<NoViableAltException> errorHook) {
    this.recognizer = recognizer;
    this.decisionNumber = decisionNumber;
    this.description = description != null ? description : NO_DESCRIPTION;
    this.table = Objects.requireNonNull(table, "'table' must not be null");
    this.specialStateTransition =
        specialStateTransition != null ? specialStateTransition : SpecialStateTransition.NONE;
    this.errorHook = errorHook != null ? errorHook : (nvae) -> {};
  }

  public String getDescription() {
    return description;
  }

  /**
   * Predicts the alternative using the state of the enclosing recognizer.
   *
   * @see #predict(IntStream, RecognizerSharedState)
   */
  public int predict(IntStream input) throws NoViableAltException {
    return predict(input, recognizer != null ? recognizer.getState() : null);
  }

  /**
   * From the input stream, predicts what alternative will succeed using this DFA, which represents
   * the covering regular approximation of the underlying grammar.
   *
   * @param input input positioned at the decision; restored before returning
   * @param state recognition state deciding how failures are handled; null means not backtracking
   * @return alternative number 1..n, or 0 when no alternative is viable while backtracking (the
   *     failed flag of {@code state} is then set)
   * @throws NoViableAltException when no alternative is viable and not backtracking
   */
  public int predict(IntStream input, RecognizerSharedState state) throws NoViableAltException {
    logger.trace("Enter Dfa.predict for decision {}", decisionNumber);
    final int mark = input.mark(); // remember where decision started in input
    int s = 0; // we always start at s0
    try {
      while (true) {
        if (logger.isTraceEnabled()) {
          logger.trace(
              "DFA {} state {} LA(1)={}({}), index={}",
              decisionNumber,
              s,
              (char) input.la(1),
              input.la(1),
              input.index());
        }
        final var specialState = table.special(s);
        if (specialState.isPresent()) {
          logger.trace(
              "DFA {} state {} is special state {}", decisionNumber, s, specialState.getAsInt());
          final var next = specialStateTransition.transition(this, specialState.getAsInt(), input);
          if (next.isEmpty()) {
            noViableAlt(s, input, state);
            return 0;
          }
          logger.trace(
              "DFA {} returns from special state {} to {}",
              decisionNumber,
              specialState.getAsInt(),
              next.getAsInt());
          s = table.checkState(next.getAsInt());
          input.consume();
          continue;
        }
        if (table.isAccepting(s)) {
          logger.trace("accept; predict {} from state {}", table.accept(s), s);
          return table.accept(s);
        }
        // look for a normal char transition
        final char c = (char) input.la(1); // EOF (-1) maps to 0xFFFF
        if (table.inRange(s, c)) {
          final var next = table.transition(s, c);
          if (next.isEmpty()) {
            // in range but not a normal transition; the EOT edge works like an else clause
            final var eot = table.eot(s);
            if (eot.isPresent()) {
              // Continues at the EOT target instead of returning its accept value. Predicated
              // edges leaving that target are not re-validated.
              logger.trace("EOT transition");
              s = eot.getAsInt();
              input.consume();
              continue;
            }
            noViableAlt(s, input, state);
            return 0;
          }
          s = next.getAsInt();
          input.consume();
          continue;
        }
        final var eot = table.eot(s);
        if (eot.isPresent()) {
          logger.trace("EOT transition");
          s = eot.getAsInt();
          input.consume();
          continue;
        }
        final var eof = table.eof(s);
        if (c == (char) Token.EOF && eof.isPresent()) {
          logger.trace(
              "accept via EOF; predict {} from {}", table.accept(eof.getAsInt()), eof.getAsInt());
          return table.accept(eof.getAsInt());
        }
        // not in range and not EOF/EOT, must be invalid symbol
        if (logger.isTraceEnabled()) {
          logger.trace("DFA {} no viable alternative at {}", decisionNumber, table.describeState(s));
        }
        noViableAlt(s, input, state);
        return 0;
      }
    } finally {
      input.rewind(mark);
    }
  }

  /**
   * Handles a state without an applicable transition: flags the failure while backtracking,
   * otherwise reports and throws.
   */
  protected void noViableAlt(int s, IntStream input, RecognizerSharedState state)
      throws NoViableAltException {
    if (state != null && state.isBacktracking()) {
      state.setFailed(true);
      return;
    }
    final var nvae = new NoViableAltException(getDescription(), decisionNumber, s, input);
    error(nvae);
    throw nvae;
  }

  /** A hook invoked with every no-viable-alternative failure before it is thrown. */
  protected void error(NoViableAltException nvae) {
    errorHook.accept(nvae);
  }
}
