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

/**
 * Creates and inspects tree nodes of type {@code T} on behalf of the runtime.
 *
 * <p>The runtime never assumes a node class; tree node streams, visitors and filters work on any
 * node type for which an adaptor exists.
 *
 * @param <T> tree node type
 */
public interface TreeAdaptor<T> {

  /** Creates a node carrying {@code payload}. */
  T create(Token payload);

  /** Creates a nil node, a list container whose children form a flat list of trees. */
  T nil();

  boolean isNil(T t);

  /** Appends {@code child}; the children of a nil child are appended instead of the nil node. */
  void addChild(T t, T child);

  int getChildCount(T t);

  T getChild(T t, int i);

  /** Replaces the i-th child of {@code t}. */
  void setChild(T t, int i, T child);

  int getType(T t);

  String getText(T t);

  Token getToken(T t);
}
