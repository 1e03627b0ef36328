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

import io.isima.grammar.common.GrammarConfig;
import io.isima.grammar.recognizer.RecognitionException;
import io.isima.grammar.recognizer.RecognizerSharedState;
import io.isima.grammar.stream.TokenStream;
import io.isima.grammar.tree.CommonTreeNodeStream;
import io.isima.grammar.tree.TreeAdaptor;
import io.isima.grammar.tree.TreeNodeStream;
import io.isima.grammar.tree.TreeVisitor;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies tree pattern rules to every subtree of a tree in one pass, without parsing the whole
 * tree with a grammar.
 *
 * <p>Rules are applied with an "apply once" strategy: at each node every rule is tried once, in
 * speculative mode, so that a rule that does not match simply returns instead of reporting a
 * syntax error. The "down then up" traversal tries {@link #topdown} on the way down (preorder) and
 * {@link #bottomup} on the way up (postorder); top-down rewrites thus shape a subtree before the
 * bottom-up rules see its children.
 *
 * <p>Subclasses define the two rules; alternatively the rules can be passed to {@link
 * #downup(Object, FilterRule, FilterRule)}.
 *
 * @param <T> tree node type
 */
public class TreeFilter<T> {
  private static final Logger logger = LoggerFactory.getLogger(TreeFilter.class);

  protected final TreeAdaptor<T> originalAdaptor;
  protected final TokenStream originalTokenStream;

  public TreeFilter(TreeNodeStream<T> input) {
    this(input.getTreeAdaptor(), input.getTokenStream());
  }

  public TreeFilter(TreeAdaptor<T> adaptor, TokenStream tokenStream) {
    this.originalAdaptor = Objects.requireNonNull(adaptor, "'adaptor' must not be null");
    this.originalTokenStream = tokenStream;
  }

  /**
   * Tries {@code rule} once against the subtree rooted at {@code t}.
   *
   * <p>The rule runs with fresh recognition state at backtracking level 1 over a node stream
   * rooted at {@code t} that shares the original token stream. A {@link RecognitionException}
   * means the rule did not match and is discarded; any other exception propagates.
   *
   * @return true if the rule ran to completion without failing
   */
  public boolean applyOnce(T t, FilterRule<T> rule) {
    return applyRule(t, rule) != null;
  }

  /** Runs the rule and returns its context when it matched, null otherwise. */
  private TreeRuleContext<T> applyRule(T t, FilterRule<T> rule) {
    if (t == null) {
      return null;
    }
    // share the adaptor and token stream but no parsing related state
    final var input = new CommonTreeNodeStream<>(originalAdaptor, t, originalTokenStream);
    final var context = new TreeRuleContext<>(input, new RecognizerSharedState());
    try {
      context.setBacktrackingLevel(1);
      rule.apply(context);
      context.setBacktrackingLevel(0);
      return context.isFailed() ? null : context;
    } catch (RecognitionException e) {
      if (GrammarConfig.filterLogRuleFailures()) {
        logger.debug("Rule did not match {}: {}", t, e.getMessage());
      } else {
        logger.trace("Rule did not match {}: {}", t, e.getMessage());
      }
      return null;
    }
  }

  /** Applies the rule and returns the node the traversal continues with. */
  private T applyAndRewrite(T t, FilterRule<T> rule) {
    final var context = applyRule(t, rule);
    if (context == null || context.getReplacement() == null) {
      return t;
    }
    logger.trace("Rewrote {} to {}", t, context.getReplacement());
    return context.getReplacement();
  }

  /**
   * Walks the tree once, applying {@link #topdown} to each node before its children and {@link
   * #bottomup} after them.
   *
   * @return the root of the tree, which differs from {@code t} when a rule replaced the root
   */
  public T downup(T t) {
    return downup(t, this::topdown, this::bottomup);
  }

  /** Walks the tree once, applying the given rules on the way down and on the way up. */
  public T downup(T t, FilterRule<T> topdown, FilterRule<T> bottomup) {
    final var visitor = new TreeVisitor<>(originalAdaptor);
    return visitor.visit(
        t, (node) -> applyAndRewrite(node, topdown), (node) -> applyAndRewrite(node, bottomup));
  }

  /** Rule tried on every node on the way down; matches nothing by default. */
  protected void topdown(TreeRuleContext<T> context) throws RecognitionException {}

  /** Rule tried on every node on the way up; matches nothing by default. */
  protected void bottomup(TreeRuleContext<T> context) throws RecognitionException {}
}
