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

import lombok.Getter;
import lombok.Setter;

/** A lexical token: a type, its text and where it came from. */
@Getter
@Setter
public class Token {
  public static final int EOF = IntStream.EOF;
  public static final int INVALID_TOKEN_TYPE = 0;

  // imaginary navigation tokens of flattened trees
  public static final int DOWN = 2;
  public static final int UP = 3;

  public static final int MIN_TOKEN_TYPE = UP + 1;

  private int type;
  private String text;
  private int tokenIndex = -1;
  private int line;
  private int charPositionInLine = -1;

  public Token(int type) {
    this.type = type;
  }

  public Token(int type, String text) {
    this.type = type;
    this.text = text;
  }

  public Token(int type, String text, int line, int charPositionInLine) {
    this.type = type;
    this.text = text;
    this.line = line;
    this.charPositionInLine = charPositionInLine;
  }

  /** Copies every field of the given token, its index included. */
  public Token(Token other) {
    this.type = other.type;
    this.text = other.text;
    this.tokenIndex = other.tokenIndex;
    this.line = other.line;
    this.charPositionInLine = other.charPositionInLine;
  }

  @Override
  public String toString() {
    final var displayText =
        text == null
            ? "<no text>"
            : text.replace("\n", "\\n").replace("\r", "\\r").replace("\t", "\\t");
    return String.format(
        "[@%d,'%s',<%d>,%d:%d]", tokenIndex, displayText, type, line, charPositionInLine);
  }
}
