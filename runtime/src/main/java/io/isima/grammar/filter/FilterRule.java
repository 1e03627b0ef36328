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

import io.isima.grammar.recognizer.RecognitionException;

/**
 * A tree grammar rule tried against one subtree by {@link TreeFilter}.
 *
 * <p>The rule matches through the context and may rewrite the subtree in place through the tree
 * adaptor. Not matching is signalled either by the failed flag of the context or by throwing a
 * {@link RecognitionException}.
 */
@FunctionalInterface
public interface FilterRule<T> {

  void apply(TreeRuleContext<T> context) throws RecognitionException;
}
