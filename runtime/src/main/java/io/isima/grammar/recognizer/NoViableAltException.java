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
package io.isima.grammar.recognizer;

import io.isima.grammar.errors.RuntimeError;
import io.isima.grammar.stream.IntStream;
import lombok.Getter;

/** Thrown when no alternative of a decision can match the input at the current position. */
public class NoViableAltException extends RecognitionException {

  private static final long serialVersionUID = 5389462950132486718L;

  @Getter private final String grammarDecisionDescription;
  @Getter private final int decisionNumber;
  @Getter private final int stateNumber;

  public NoViableAltException(
      String grammarDecisionDescription, int decisionNumber, int stateNumber, IntStream input) {
    super(
        RuntimeError.NO_VIABLE_ALTERNATIVE,
        String.format(
            "decision=%d state=%d (%s) at index %d",
            decisionNumber,
            stateNumber,
            grammarDecisionDescription,
            input == null ? -1 : input.index()),
        input);
    this.grammarDecisionDescription = grammarDecisionDescription;
    this.decisionNumber = decisionNumber;
    this.stateNumber = stateNumber;
  }
}
