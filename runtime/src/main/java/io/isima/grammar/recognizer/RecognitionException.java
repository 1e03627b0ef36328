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

import io.isima.grammar.errors.GrammarError;
import io.isima.grammar.errors.RuntimeError;
import io.isima.grammar.stream.IntStream;
import io.isima.grammar.stream.Token;
import io.isima.grammar.stream.TokenStream;
import io.isima.grammar.tree.TreeNodeStream;
import java.util.Objects;
import lombok.Getter;

/**
 * Base of the failures raised while recognizing input.
 *
 * <p>The exception records where recognition stood when it failed: the input index, the lookahead
 * symbol, and the lookahead token or tree node when the input provides one.
 */
public class RecognitionException extends Exception implements GrammarError {

  private static final long serialVersionUID = -3217734924617483941L;

  private final GrammarError info;

  /** Input index at the time of the failure. */
  @Getter private final int index;

  /** Lookahead symbol at the time of the failure. */
  @Getter private final int symbol;

  /** Lookahead token when the input is a token stream. */
  @Getter private final transient Token token;

  /** Lookahead node when the input is a tree node stream. */
  @Getter private final transient Object node;

  @Getter private final String sourceName;

  public RecognitionException(IntStream input) {
    this(RuntimeError.RECOGNITION_FAILURE, null, input);
  }

  protected RecognitionException(GrammarError info, String additionalMessage, IntStream input) {
    super(
        additionalMessage == null
            ? info.getErrorMessage()
            : info.getErrorMessage() + ": " + additionalMessage);
    this.info = Objects.requireNonNull(info, "'info' must not be null");
    if (input == null) {
      index = -1;
      symbol = Token.INVALID_TOKEN_TYPE;
      token = null;
      node = null;
      sourceName = null;
      return;
    }
    index = input.index();
    symbol = input.la(1);
    sourceName = input.getSourceName();
    if (input instanceof TokenStream) {
      token = ((TokenStream) input).lt(1);
      node = null;
    } else if (input instanceof TreeNodeStream) {
      final var nodeStream = (TreeNodeStream<?>) input;
      node = nodeStream.lt(1);
      token = getNodeToken(nodeStream, node);
    } else {
      token = null;
      node = null;
    }
  }

  @SuppressWarnings("unchecked")
  private static <T> Token getNodeToken(TreeNodeStream<T> input, Object node) {
    return node == null ? null : input.getTreeAdaptor().getToken((T) node);
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
