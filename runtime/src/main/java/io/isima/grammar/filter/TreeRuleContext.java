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
package io.isima.grammar.filter;

import io.isima.grammar.recognizer.RecognizerSharedState;
import io.isima.grammar.recognizer.TreeParser;
import io.isima.grammar.stream.TokenStream;
import io.isima.grammar.tree.TreeNodeStream;

/**
 * Tree parser bound to a single subtree for a single rule application.
 *
 * <p>Each application gets its own context, so its position and failure state never leak into
 * another application.
 *
 * @param <T> tree node type
 */
public class TreeRuleContext<T> extends TreeParser<T> {

  private T replacement;

  TreeRuleContext(TreeNodeStream<T> input, RecognizerSharedState state) {
    super(input, state);
  }

  /** Root of the subtree the rule is applied to. */
  public T getSubtree() {
    return input.getTreeSource();
  }

  /**
   * Replaces the subtree by {@code replacement} once the rule has matched. The traversal then
   * continues with the replacement and links it into the parent of the subtree.
   */
  public void replaceSubtree(T replacement) {
    this.replacement = replacement;
  }

  /** The replacement set by the rule, or null to keep the subtree. */
  public T getReplacement() {
    return replacement;
  }

  /** Token stream of the whole tree, for rules that need original token text or positions. */
  public TokenStream getTokenStream() {
    return input.getTokenStream();
  }
}
