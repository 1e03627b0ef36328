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
package io.isima.grammar.errors.exception;

import io.isima.grammar.errors.GrammarError;
import io.isima.grammar.errors.RuntimeError;

/** Exception thrown when a runtime configuration property has a value that cannot be used. */
public class InvalidConfigurationException extends RuntimeException implements GrammarError {

  private static final long serialVersionUID = 7255356423560979020L;

  private final GrammarError info = RuntimeError.INVALID_CONFIGURATION;

  public InvalidConfigurationException(String message) {
    super(RuntimeError.INVALID_CONFIGURATION.getErrorMessage() + ": " + message);
  }

  public InvalidConfigurationException(String message, Throwable t) {
    super(RuntimeError.INVALID_CONFIGURATION.getErrorMessage() + ": " + message, t);
  }

  @Override
  public String getErrorCode() {
    return info.getErrorCode();
  }

  @Override
  public String getErrorMessage() {
    return getMessage();
  }
}
