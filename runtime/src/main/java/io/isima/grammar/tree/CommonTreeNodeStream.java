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

import io.isima.grammar.common.GrammarConfig;
import io.isima.grammar.stream.Token;
import io.isima.grammar.stream.TokenStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import lombok.Getter;
import lombok.Setter;

/**
 * Tree node stream that flattens the whole tree into a buffer on first access.
 *
 * <p>For the tree {@code (a b (c d))} the buffer is {@code a DOWN b c DOWN d UP UP}. A nil root is
 * not emitted; its children appear one after another.
 *
 * @param <T> tree node type
 */
public class CommonTreeNodeStream<T> implements TreeNodeStream<T> {

  private final TreeAdaptor<T> adaptor;
  private final T root;

  private final T down;
  private final T up;
  private final T eof;

  private final List<T> nodes;
  private boolean filled = false;
  private int p = 0;
  private int lastMarker;

  @Getter @Setter private TokenStream tokenStream;

  public CommonTreeNodeStream(TreeAdaptor<T> adaptor, T root) {
    this.adaptor = Objects.requireNonNull(adaptor, "'adaptor' must not be null");
    this.root = Objects.requireNonNull(root, "'root' must not be null");
    this.down = adaptor.create(new Token(Token.DOWN, "DOWN"));
    this.up = adaptor.create(new Token(Token.UP, "UP"));
    this.eof = adaptor.create(new Token(Token.EOF, "EOF"));
    this.nodes = new ArrayList<>(GrammarConfig.treeStreamInitialBufferSize());
  }

  public CommonTreeNodeStream(TreeAdaptor<T> adaptor, T root, TokenStream tokenStream) {
    this(adaptor, root);
    this.tokenStream = tokenStream;
  }

  private void fillBuffer() {
    if (!filled) {
      fillBuffer(root);
      filled = true;
    }
  }

  private void fillBuffer(T t) {
    final boolean nil = adaptor.isNil(t);
    if (!nil) {
      nodes.add(t);
    }
    final int n = adaptor.getChildCount(t);
    if (!nil && n > 0) {
      nodes.add(down);
    }
    for (int i = 0; i < n; ++i) {
      fillBuffer(adaptor.getChild(t, i));
    }
    if (!nil && n > 0) {
      nodes.add(up);
    }
  }

  @Override
  public T lt(int k) {
    fillBuffer();
    if (k == 0) {
      return null;
    }
    if (k < 0) {
      return p + k < 0 ? null : nodes.get(p + k);
    }
    if (p + k - 1 >= nodes.size()) {
      return eof;
    }
    return nodes.get(p + k - 1);
  }

  @Override
  public T get(int i) {
    fillBuffer();
    return nodes.get(i);
  }

  @Override
  public T getTreeSource() {
    return root;
  }

  @Override
  public TreeAdaptor<T> getTreeAdaptor() {
    return adaptor;
  }

  @Override
  public void consume() {
    fillBuffer();
    if (p < nodes.size()) {
      p++;
    }
  }

  @Override
  public int la(int i) {
    final T node = lt(i);
    return node == null ? Token.INVALID_TOKEN_TYPE : adaptor.getType(node);
  }

  @Override
  public int mark() {
    fillBuffer();
    lastMarker = index();
    return lastMarker;
  }

  @Override
  public int index() {
    return p;
  }

  @Override
  public void rewind(int marker) {
    seek(marker);
  }

  @Override
  public void rewind() {
    seek(lastMarker);
  }

  @Override
  public void release(int marker) {}

  @Override
  public void seek(int index) {
    fillBuffer();
    p = Math.max(0, Math.min(index, nodes.size()));
  }

  @Override
  public int size() {
    fillBuffer();
    return nodes.size();
  }

  @Override
  public String getSourceName() {
    return tokenStream == null ? null : tokenStream.getSourceName();
  }

  /** Node types of the whole buffer separated by spaces, for diagnostics. */
  public String toTokenTypeString() {
    fillBuffer();
    final var sb = new StringBuilder();
    String delimiter = "";
    for (final T node : nodes) {
      sb.append(delimiter).append(adaptor.getType(node));
      delimiter = " ";
    }
    return sb.toString();
  }
}
