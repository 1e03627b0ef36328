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

/**
 * Actions run by {@link TreeVisitor} around the children of each node. Both return the node to
 * continue with, which may replace the one passed in.
 */
public interface TreeVisitorAction<T> {

  /** Called before the children of {@code t} are visited. */
  T pre(T t);

  /** Called after all the children of {@code t} are visited. */
  T post(T t);
}
