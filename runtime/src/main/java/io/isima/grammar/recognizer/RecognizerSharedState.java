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

import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

/**
 * Mutable state of a recognition attempt.
 *
 * <p>While {@code backtracking} is above zero the recognizer is speculating: failures set the
 * sticky {@code failed} flag instead of raising, and callers are expected to check the flag and
 * unwind.
 */
@Getter
@Setter
@ToString
public class RecognizerSharedState {

  /** Nesting depth of speculative execution; 0 means not speculating. */
  private int backtracking = 0;

  /** Set when the current speculative attempt failed. */
  private boolean failed = false;

  /** Set after an error is reported; further reports are suppressed until a successful match. */
  private boolean errorRecovery = false;

  /** Number of errors reported so far. */
  private int syntaxErrors = 0;

  public RecognizerSharedState() {}

  public RecognizerSharedState(RecognizerSharedState state) {
    this.backtracking = state.backtracking;
    this.failed = state.failed;
    this.errorRecovery = state.errorRecovery;
    this.syntaxErrors = state.syntaxErrors;
  }

  public boolean isBacktracking() {
    return backtracking > 0;
  }
}
