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
import lombok.Getter;

/** Character cursor over an in-memory string, tracking line and column. */
public class StringCharStream implements IntStream {

  private final char[] data;
  private final String sourceName;

  private int p = 0;
  @Getter private int line = 1;
  @Getter private int charPositionInLine = 0;

  // markers are 1-based; markers.get(m - 1) holds {p, line, charPositionInLine}
  private final List<int[]> markers = new ArrayList<>();
  private int markDepth = 0;
  private int lastMarker;

  public StringCharStream(String input) {
    this(input, null);
  }

  public StringCharStream(String input, String sourceName) {
    Objects.requireNonNull(input, "'input' must not be null");
    this.data = input.toCharArray();
    this.sourceName = sourceName;
  }

  @Override
  public void consume() {
    if (p < data.length) {
      charPositionInLine++;
      if (data[p] == '\n') {
        line++;
        charPositionInLine = 0;
      }
      p++;
    }
  }

  @Override
  public int la(int i) {
    if (i == 0) {
      return 0;
    }
    if (i < 0) {
      i++; // la(-1) is the previous char
      if (p + i - 1 < 0) {
        return EOF;
      }
    }
    if (p + i - 1 >= data.length) {
      return EOF;
    }
    return data[p + i - 1];
  }

  @Override
  public int mark() {
    markDepth++;
    final int[] state = new int[] {p, line, charPositionInLine};
    if (markDepth > markers.size()) {
      markers.add(state);
    } else {
      markers.set(markDepth - 1, state);
    }
    lastMarker = markDepth;
    return markDepth;
  }

  @Override
  public int index() {
    return p;
  }

  @Override
  public void rewind(int marker) {
    if (marker < 1 || marker > markers.size()) {
      throw new IllegalArgumentException("Unknown marker: " + marker);
    }
    final int[] state = markers.get(marker - 1);
    seek(state[0]);
    line = state[1];
    charPositionInLine = state[2];
    release(marker);
  }

  @Override
  public void rewind() {
    if (lastMarker == 0) {
      throw new IllegalStateException("rewind() called before any mark()");
    }
    rewind(lastMarker);
  }

  @Override
  public void release(int marker) {
    markDepth = marker - 1;
  }

  /** Moving backwards only resets the position; line information is restored by rewind. */
  @Override
  public void seek(int index) {
    if (index <= p) {
      p = index;
      return;
    }
    while (p < index && p < data.length) {
      consume();
    }
  }

  @Override
  public int size() {
    return data.length;
  }

  @Override
  public String getSourceName() {
    return sourceName;
  }

  public String substring(int start, int stop) {
    return new String(data, start, stop - start + 1);
  }

  @Override
  public String toString() {
    return new String(data);
  }
}
