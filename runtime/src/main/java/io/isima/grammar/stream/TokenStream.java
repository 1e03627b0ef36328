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
package io.isima.grammar.stream;

/** A cursor over tokens; {@link #la(int)} yields token types. */
public interface TokenStream extends IntStream {

  /** Token at offset {@code k} from the current position; an EOF token past the end. */
  Token lt(int k);

  /** Token at absolute index {@code i}. */
  Token get(int i);

  /** Text of the tokens between {@code start} and {@code stop} inclusive. */
  String toString(int start, int stop);
}
