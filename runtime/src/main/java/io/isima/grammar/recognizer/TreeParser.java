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

import io.isima.grammar.stream.Token;
import io.isima.grammar.tree.TreeAdaptor;
import io.isima.grammar.tree.TreeNodeStream;
import java.util.Objects;

/**
 * Recognizer whose input is a flattened tree.
 *
 * <p>A tree pattern {@code ^(PLUS a b)} is matched as {@code match(PLUS); match(DOWN); ...;
 * match(UP)}.
 *
 * @param <T> tree node type
 */
public class TreeParser<T> extends BaseRecognizer {

  protected TreeNodeStream<T> input;

  public TreeParser(TreeNodeStream<T> input) {
    this(input, null);
  }

  public TreeParser(TreeNodeStream<T> input, RecognizerSharedState state) {
    super(state);
    this.input = Objects.requireNonNull(input, "'input' must not be null");
  }

  @Override
  public TreeNodeStream<T> getInput() {
    return input;
  }

  public void setTreeNodeStream(TreeNodeStream<T> input) {
    this.input = Objects.requireNonNull(input, "'input' must not be null");
  }

  public TreeAdaptor<T> getTreeAdaptor() {
    return input.getTreeAdaptor();
  }

  /** Lookahead node, see {@link TreeNodeStream#lt(int)}. */
  public T lt(int k) {
    return input.lt(k);
  }

  /**
   * Consumes the next node if it has type {@code ttype}.
   *
   * <p>On mismatch while backtracking, sets the failed flag and returns without consuming;
   * otherwise throws.
   *
   * @return the next node, matched or not
   * @throws MismatchedTreeNodeException on mismatch when not backtracking
   */
  public T match(int ttype) throws MismatchedTreeNodeException {
    final T matched = input.lt(1);
    if (input.la(1) == ttype) {
      input.consume();
      state.setErrorRecovery(false);
      state.setFailed(false);
      return matched;
    }
    if (state.isBacktracking()) {
      state.setFailed(true);
      return matched;
    }
    throw new MismatchedTreeNodeException(ttype, input);
  }

  /** Consumes the next node together with its whole subtree, whatever its type. */
  public void matchAny() {
    state.setErrorRecovery(false);
    state.setFailed(false);
    final var adaptor = input.getTreeAdaptor();
    T look = input.lt(1);
    if (adaptor.getChildCount(look) == 0) {
      input.consume();
      return;
    }
    int level = 0;
    int tokenType = adaptor.getType(look);
    while (tokenType != Token.EOF && !(tokenType == Token.UP && level == 0)) {
      input.consume();
      look = input.lt(1);
      tokenType = adaptor.getType(look);
      if (tokenType == Token.DOWN) {
        level++;
      } else if (tokenType == Token.UP) {
        level--;
      }
    }
    input.consume(); // UP
  }
}
