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

import io.isima.grammar.stream.IntStream;
import io.isima.grammar.stream.TokenStream;

/**
 * A cursor over the nodes of a tree in depth-first order, where {@link #la(int)} yields node types
 * and descending into or climbing out of a child list shows up as DOWN and UP nodes.
 *
 * @param <T> tree node type
 */
public interface TreeNodeStream<T> extends IntStream {

  /** Node at offset {@code k} from the current position; an EOF node past the end. */
  T lt(int k);

  /** Node at absolute index {@code i}, navigation nodes included. */
  T get(int i);

  /** Root of the tree this stream walks. */
  T getTreeSource();

  /** Token stream the tree was built from, or null when unknown. */
  TokenStream getTokenStream();

  void setTokenStream(TokenStream tokenStream);

  TreeAdaptor<T> getTreeAdaptor();
}
