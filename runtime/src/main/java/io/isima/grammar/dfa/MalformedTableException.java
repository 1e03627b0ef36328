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

import io.isima.grammar.errors.GrammarError;
import io.isima.grammar.errors.RuntimeError;

/**
 * Thrown when an encoded or decoded transition table breaks its structural invariants.
 *
 * <p>Tables are produced by the grammar tool, so this indicates a broken build artifact rather than
 * bad input.
 */
public class MalformedTableException extends IllegalArgumentException implements GrammarError {

  private static final long serialVersionUID = -6402953846102775281L;

  public MalformedTableException(String message) {
    super(RuntimeError.MALFORMED_TABLE.getErrorMessage() + ": " + message);
  }

  @Override
  public String getErrorCode() {
    return RuntimeError.MALFORMED_TABLE.getErrorCode();
  }

  @Override
  public String getErrorMessage() {
    return getMessage();
  }
}
