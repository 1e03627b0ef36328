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

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Token cursor over an already tokenized input.
 *
 * <p>The stream holds its own copies of the given tokens, indexed in order when the stream is
 * created; the caller's tokens are left untouched. Markers are plain positions, so releasing a
 * marker is a no-op.
 */
public class ListTokenStream implements TokenStream {

  private final List<Token> tokens;
  private final Token eofToken = new Token(Token.EOF, "<EOF>");
  private final String sourceName;

  private int p = 0;
  private int lastMarker;

  public ListTokenStream(List<Token> tokens) {
    this(tokens, null);
  }

  public ListTokenStream(List<Token> tokens, String sourceName) {
    Objects.requireNonNull(tokens, "'tokens' must not be null");
    this.tokens = new ArrayList<>(tokens.size());
    for (final var token : tokens) {
      final var copy = new Token(token);
      copy.setTokenIndex(this.tokens.size());
      this.tokens.add(copy);
    }
    eofToken.setTokenIndex(this.tokens.size());
    this.sourceName = sourceName;
  }

  @Override
  public Token lt(int k) {
    if (k == 0) {
      return null;
    }
    final int i = k < 0 ? p + k : p + k - 1;
    if (i < 0) {
      return null;
    }
    if (i >= tokens.size()) {
      return eofToken;
    }
    return tokens.get(i);
  }

  @Override
  public Token get(int i) {
    return tokens.get(i);
  }

  @Override
  public String toString(int start, int stop) {
    final var sb = new StringBuilder();
    for (int i = Math.max(0, start); i <= stop && i < tokens.size(); ++i) {
      sb.append(tokens.get(i).getText());
    }
    return sb.toString();
  }

  @Override
  public void consume() {
    if (p < tokens.size()) {
      p++;
    }
  }

  @Override
  public int la(int i) {
    final var token = lt(i);
    return token == null ? Token.INVALID_TOKEN_TYPE : token.getType();
  }

  @Override
  public int mark() {
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
    p = Math.max(0, Math.min(index, tokens.size()));
  }

  @Override
  public int size() {
    return tokens.size();
  }

  @Override
  public String getSourceName() {
    return sourceName;
  }

  @Override
  public String toString() {
    return toString(0, tokens.size() - 1);
  }
}
