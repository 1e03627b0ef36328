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
package io.isima.grammar.tree;

import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Depth-first walker that runs a pre action before descending into a node and a post action after
 * its last child.
 *
 * <p>If the pre action returns a different node, the walk continues with the children of the
 * returned node. If visiting a child yields a different node, it is written back into the parent
 * at the same position. Nil nodes are walked through without running actions on them.
 */
public class TreeVisitor<T> {

  private final TreeAdaptor<T> adaptor;

  public TreeVisitor(TreeAdaptor<T> adaptor) {
    this.adaptor = Objects.requireNonNull(adaptor, "'adaptor' must not be null");
  }

  /**
   * Visits the tree rooted at {@code t}.
   *
   * @param t root of the tree
   * @param action actions to run; may be null to walk without running anything
   * @return the result of the post action on the root, which may be a new root
   */
  public T visit(T t, TreeVisitorAction<T> action) {
    if (t == null) {
      return null;
    }
    final boolean isNil = adaptor.isNil(t);
    if (action != null && !isNil) {
      t = action.pre(t);
    }
    for (int i = 0; i < adaptor.getChildCount(t); ++i) {
      final T child = adaptor.getChild(t, i);
      final T visitResult = visit(child, action);
      final T childAfterVisit = adaptor.getChild(t, i);
      if (visitResult != childAfterVisit) {
        adaptor.setChild(t, i, visitResult);
      }
    }
    if (action != null && !isNil) {
      t = action.post(t);
    }
    return t;
  }

  /**
   * Visits the tree rooted at {@code t} with separate pre and post functions; either may be null.
   */
  public T visit(T t, UnaryOperator<T> pre, UnaryOperator<T> post) {
    return visit(
        t,
        new TreeVisitorAction<T>() {
          @Override
          public T pre(T node) {
            return pre == null ? node : pre.apply(node);
          }

          @Override
          public T post(T node) {
            return post == null ? node : post.apply(node);
          }
        });
  }
}
