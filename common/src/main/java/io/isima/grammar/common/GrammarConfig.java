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
package io.isima.grammar.common;

import java.util.Properties;

/**
 * Grammar runtime static configurations.
 *
 * <p>The configuration is specified as properties. Values are looked up from the system properties
 * unless another property set is installed by {@link #setProperties(Properties)}.
 */
public class GrammarConfig {
  // io.isima.grammar.dfa ///////////////////////////////////////////////////////////////
  /** Upper bound of the number of states a transition table may have. */
  public static final String DFA_MAX_STATES = "io.isima.grammar.dfa.maxStates";

  /** States are indexed by 16-bit signed values in encoded tables. */
  public static final int DFA_MAX_STATES_LIMIT = Short.MAX_VALUE;

  // io.isima.grammar.tree //////////////////////////////////////////////////////////////
  public static final String TREE_STREAM_INITIAL_BUFFER_SIZE =
      "io.isima.grammar.tree.streamInitialBufferSize";

  // io.isima.grammar.filter ////////////////////////////////////////////////////////////
  public static final String FILTER_LOG_RULE_FAILURES = "io.isima.grammar.filter.logRuleFailures";

  public static void setProperties(Properties properties) {
    GrammarConfigBase.setProperties(properties);
  }

  ////////////////////////////////////////////////////////////////////////////////////////////////

  /** Maximum number of DFA states accepted by table validation, default=32767. */
  public static int dfaMaxStates() {
    return GrammarConfigBase.getInstance()
        .getInt(DFA_MAX_STATES, DFA_MAX_STATES_LIMIT, 1, DFA_MAX_STATES_LIMIT);
  }

  /** Initial capacity of the flattened node buffer of a tree node stream, default=100. */
  public static int treeStreamInitialBufferSize() {
    return GrammarConfigBase.getInstance()
        .getInt(TREE_STREAM_INITIAL_BUFFER_SIZE, 100, 1, Integer.MAX_VALUE);
  }

  /** Whether rule failures swallowed by a tree filter are logged at DEBUG, default=false. */
  public static boolean filterLogRuleFailures() {
    return GrammarConfigBase.getInstance().getBoolean(FILTER_LOG_RULE_FAILURES, false);
  }
}
