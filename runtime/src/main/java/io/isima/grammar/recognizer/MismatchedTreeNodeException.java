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

import io.isima.grammar.errors.RuntimeError;
import io.isima.grammar.tree.TreeNodeStream;
import lombok.Getter;

/** Thrown when the next tree node does not have the expected type. */
public class MismatchedTreeNodeException extends RecognitionException {

  private static final long serialVersionUID = -1937518723468519530L;

  @Getter private final int expecting;

  public MismatchedTreeNodeException(int expecting, TreeNodeStream<?> input) {
    super(
        RuntimeError.MISMATCHED_TREE_NODE,
        String.format("expecting %d, found %d", expecting, input.la(1)),
        input);
    this.expecting = expecting;
  }
}
