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

import io.isima.grammar.stream.IntStream;
import io.isima.grammar.stream.Token;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Common part of lexers, parsers and tree parsers: the shared state and error reporting.
 *
 * <p>Error reporting is suppressed while the recognizer is marked as recovering from a previous
 * error; a successful match clears the mark.
 */
public abstract class BaseRecognizer {
  private static final Logger logger = LoggerFactory.getLogger(BaseRecognizer.class);

  protected final RecognizerSharedState state;

  protected BaseRecognizer() {
    this(null);
  }

  protected BaseRecognizer(RecognizerSharedState state) {
    this.state = state != null ? state : new RecognizerSharedState();
  }

  public RecognizerSharedState getState() {
    return state;
  }

  /** The input this recognizer consumes. */
  public abstract IntStream getInput();

  public int getBacktrackingLevel() {
    return state.getBacktracking();
  }

  public void setBacktrackingLevel(int level) {
    state.setBacktracking(level);
  }

  public boolean isFailed() {
    return state.isFailed();
  }

  public int getNumberOfSyntaxErrors() {
    return state.getSyntaxErrors();
  }

  public String getSourceName() {
    final var input = getInput();
    return input == null ? null : input.getSourceName();
  }

  /** Token names indexed by token type, or null to display raw types. */
  public String[] getTokenNames() {
    return null;
  }

  /**
   * Reports a recognition error unless one was already reported and no input has been matched
   * since.
   */
  public void reportError(RecognitionException e) {
    if (state.isErrorRecovery()) {
      logger.trace("Suppressing error report while recovering: {}", e.getMessage());
      return;
    }
    state.setSyntaxErrors(state.getSyntaxErrors() + 1);
    state.setErrorRecovery(true);
    displayRecognitionError(e);
  }

  public void displayRecognitionError(RecognitionException e) {
    emitErrorMessage(getErrorHeader(e) + " " + getErrorMessage(e));
  }

  public String getErrorMessage(RecognitionException e) {
    if (e instanceof NoViableAltException) {
      return "no viable alternative at input " + getSymbolErrorDisplay(e);
    }
    if (e instanceof MismatchedTreeNodeException) {
      final var mismatch = (MismatchedTreeNodeException) e;
      return "mismatched tree node: "
          + getSymbolErrorDisplay(e)
          + " expecting "
          + getTokenName(mismatch.getExpecting());
    }
    return e.getMessage();
  }

  /** Where the error happened: source name plus line and column, or the input index. */
  public String getErrorHeader(RecognitionException e) {
    final var sb = new StringBuilder();
    final var sourceName = e.getSourceName() != null ? e.getSourceName() : getSourceName();
    if (sourceName != null) {
      sb.append(sourceName).append(' ');
    }
    final var token = e.getToken();
    if (token != null && token.getLine() > 0) {
      sb.append("line ").append(token.getLine()).append(':').append(token.getCharPositionInLine());
    } else {
      sb.append("index ").append(e.getIndex());
    }
    return sb.toString();
  }

  protected String getSymbolErrorDisplay(RecognitionException e) {
    final var token = e.getToken();
    if (token != null && token.getText() != null) {
      return "'" + token.getText().replace("\n", "\\n").replace("\t", "\\t") + "'";
    }
    if (e.getSymbol() == IntStream.EOF) {
      return "<EOF>";
    }
    if (e.getNode() == null && e.getToken() == null) {
      // character input
      return "'" + (char) e.getSymbol() + "'";
    }
    return getTokenName(e.getSymbol());
  }

  public String getTokenName(int tokenType) {
    if (tokenType == Token.EOF) {
      return "EOF";
    }
    final var tokenNames = getTokenNames();
    if (tokenNames != null && tokenType >= 0 && tokenType < tokenNames.length) {
      return tokenNames[tokenType];
    }
    return "<" + tokenType + ">";
  }

  /** Sends a formatted error message out; override to collect or redirect messages. */
  public void emitErrorMessage(String message) {
    logger.warn("{}", message);
  }
}
