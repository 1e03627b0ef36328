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

import io.isima.grammar.stream.Token;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import lombok.Getter;

/** A tree node holding a token payload; a node without payload is nil. */
public class CommonTree {

  @Getter private final Token token;
  @Getter private CommonTree parent;
  @Getter private int childIndex = -1;
  private List<CommonTree> children;

  public CommonTree(Token token) {
    this.token = token;
  }

  public static CommonTree nil() {
    return new CommonTree(null);
  }

  public boolean isNil() {
    return token == null;
  }

  public int getType() {
    return token == null ? Token.INVALID_TOKEN_TYPE : token.getType();
  }

  public String getText() {
    return token == null ? null : token.getText();
  }

  public int getChildCount() {
    return children == null ? 0 : children.size();
  }

  public CommonTree getChild(int i) {
    if (children == null || i < 0 || i >= children.size()) {
      return null;
    }
    return children.get(i);
  }

  public List<CommonTree> getChildren() {
    return children == null ? Collections.emptyList() : Collections.unmodifiableList(children);
  }

  /**
   * Appends a child. When the child is nil, its children are moved here instead, so a nil node
   * never becomes a child.
   */
  public void addChild(CommonTree child) {
    if (child == null) {
      return;
    }
    if (children == null) {
      children = new ArrayList<>();
    }
    if (child.isNil()) {
      for (final var grandChild : child.getChildren()) {
        attach(grandChild, children.size());
        children.add(grandChild);
      }
      return;
    }
    attach(child, children.size());
    children.add(child);
  }

  public void setChild(int i, CommonTree child) {
    if (child == null) {
      return;
    }
    if (child.isNil()) {
      throw new IllegalArgumentException("Can't set single child to a list");
    }
    if (children == null || i < 0 || i >= children.size()) {
      throw new IndexOutOfBoundsException(
          String.format("Child index %d out of range [0, %d)", i, getChildCount()));
    }
    attach(child, i);
    children.set(i, child);
  }

  private void attach(CommonTree child, int index) {
    child.parent = this;
    child.childIndex = index;
  }

  /** Prints the tree in LISP notation, such as {@code (+ 1 (* 2 3))}. */
  public String toStringTree() {
    if (getChildCount() == 0) {
      return toString();
    }
    final var sb = new StringBuilder();
    if (!isNil()) {
      sb.append('(').append(this).append(' ');
    }
    String delimiter = "";
    for (final var child : children) {
      sb.append(delimiter).append(child.toStringTree());
      delimiter = " ";
    }
    if (!isNil()) {
      sb.append(')');
    }
    return sb.toString();
  }

  @Override
  public String toString() {
    if (isNil()) {
      return "nil";
    }
    return token.getText() != null ? token.getText() : "<" + token.getType() + ">";
  }
}
