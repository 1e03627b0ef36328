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

/**
 * A cursor over a stream of integer symbols (characters, token types or tree node types).
 *
 * <p>Recognizers only peek with {@link #la(int)} and move forward with {@link #consume()}.
 * Speculative code brackets its work with {@link #mark()} and {@link #rewind(int)} so the caller
 * observes no consumed input.
 */
public interface IntStream {

  /** Symbol returned by {@link #la(int)} past the end of input. */
  int EOF = -1;

  /** Moves the cursor one symbol forward. Does nothing at end of input. */
  void consume();

  /**
   * Returns the symbol at offset {@code i} from the current position; {@code la(1)} is the next
   * symbol to be consumed, {@code la(-1)} is the previously consumed one.
   */
  int la(int i);

  /**
   * Remembers the current position so that {@link #rewind(int)} can return to it.
   *
   * @return an opaque marker to pass to {@link #rewind(int)} or {@link #release(int)}
   */
  int mark();

  /** Current position, zero-based. */
  int index();

  /** Resets the cursor to the position saved by {@code marker} and releases that marker. */
  void rewind(int marker);

  /** Rewinds to the most recently created marker. */
  void rewind();

  /** Drops {@code marker} and all markers created after it without moving the cursor. */
  void release(int marker);

  /** Moves the cursor to an absolute position. */
  void seek(int index);

  /** Number of symbols in the stream. */
  int size();

  /** Name of the input, such as a file name, used in diagnostics. */
  String getSourceName();
}
