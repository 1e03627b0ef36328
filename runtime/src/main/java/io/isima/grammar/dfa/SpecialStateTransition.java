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

import io.isima.grammar.recognizer.NoViableAltException;
import io.isima.grammar.stream.IntStream;
import java.util.OptionalInt;

/**
 * Resolves transitions out of special states, the states whose edges are guarded by semantic
 * predicates and therefore cannot be expressed in the flat tables.
 *
 * <p>A generated recognizer supplies one resolver per decision. The resolver may look at the input
 * but must leave it at the position it found it.
 */
@FunctionalInterface
public interface SpecialStateTransition {

  /** Resolver for decisions without special states; never finds a transition. */
  SpecialStateTransition NONE = (dfa, specialState, input) -> OptionalInt.empty();

  /**
   * Computes the next state.
   *
   * @param dfa the predictor asking
   * @param specialState the special state index from the table, not the DFA state number
   * @param input the input positioned at the symbol to decide on
   * @return the next DFA state, or empty when no edge applies
   * @throws NoViableAltException when the resolver decides to fail by itself
   */
  OptionalInt transition(Dfa dfa, int specialState, IntStream input) throws NoViableAltException;
}
