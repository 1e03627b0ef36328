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
package io.isima.grammar.errors;

public enum RuntimeError implements GrammarError {
  MALFORMED_TABLE("GRAMMAR00", "Malformed transition table"),
  NO_VIABLE_ALTERNATIVE("GRAMMAR01", "No viable alternative"),
  MISMATCHED_TREE_NODE("GRAMMAR02", "Mismatched tree node"),
  RECOGNITION_FAILURE("GRAMMAR03", "Recognition failed"),
  INVALID_CONFIGURATION("GRAMMAR04", "Invalid grammar runtime configuration"),
  ;

  private final String errorCode;
  private final String message;

  private RuntimeError(String errorCode, String message) {
    this.errorCode = errorCode;
    this.message = message;
  }

  @Override
  public String getErrorCode() {
    return errorCode;
  }

  @Override
  public String getErrorMessage() {
    return message;
  }
}
