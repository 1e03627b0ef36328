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
package io.isima.grammar.dfa;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import io.isima.grammar.common.GrammarConfig;
import java.util.OptionalInt;
import java.util.Properties;
import org.junit.After;
import org.junit.Test;

public class TransitionTableTest {

  private static final short N = -1;

  @After
  public void tearDown() throws Exception {
    GrammarConfig.setProperties(System.getProperties());
  }

  /** Two states: 0 --'a'--> 1, state 1 accepts alternative 1. */
  private static TransitionTable singleEdge() {
    return new TransitionTable(
        new short[] {N, N},
        new short[] {N, N},
        new char[] {'a', 0},
        new char[] {'a', 0},
        new short[] {N, 1},
        new short[] {N, N},
        new short[][] {{1}, {}});
  }

  @Test
  public void testAccessors() {
    final var table = singleEdge();
    assertEquals(2, table.size());
    assertFalse(table.isAccepting(0));
    assertTrue(table.isAccepting(1));
    assertEquals(0, table.accept(0));
    assertEquals(1, table.accept(1));
    assertEquals('a', table.min(0));
    assertEquals('a', table.max(0));
    assertTrue(table.inRange(0, 'a'));
    assertFalse(table.inRange(0, 'b'));
    assertEquals(OptionalInt.of(1), table.transition(0, 'a'));
    assertEquals(OptionalInt.empty(), table.eot(0));
    assertEquals(OptionalInt.empty(), table.eof(0));
    assertEquals(OptionalInt.empty(), table.special(0));
    assertThat(table.describeState(0), containsString("state 0: min=97 max=97"));
  }

  @Test
  public void testShortRowAndNegativeCells() {
    // range 'a'..'d' with only the first three cells present, the middle one empty
    final var table =
        new TransitionTable(
            new short[] {N, N},
            new short[] {N, N},
            new char[] {'a', 0},
            new char[] {'d', 0},
            new short[] {N, 2},
            new short[] {N, N},
            new short[][] {{1, N, 1}, null});
    assertEquals(OptionalInt.of(1), table.transition(0, 'a'));
    assertEquals(OptionalInt.empty(), table.transition(0, 'b'));
    assertEquals(OptionalInt.of(1), table.transition(0, 'c'));
    assertEquals(OptionalInt.empty(), table.transition(0, 'd'));
  }

  @Test
  public void testFromEncoded() {
    final var table =
        TransitionTable.fromEncoded(
            "\2\uffff",
            "\1\1\1\uffff",
            "\1\141\1\uffff",
            "\1\142\1\uffff",
            "\1\uffff\1\2",
            "\2\uffff",
            new String[] {"\2\1", ""});
    assertEquals(2, table.size());
    assertEquals(OptionalInt.of(1), table.transition(0, 'a'));
    assertEquals(OptionalInt.of(1), table.transition(0, 'b'));
    assertEquals(OptionalInt.of(1), table.eof(0));
    assertEquals(2, table.accept(1));
  }

  @Test
  public void testInputArraysAreCopied() {
    final short[] accept = new short[] {N, 1};
    final short[][] transition = new short[][] {{1}, {}};
    final var table =
        new TransitionTable(
            new short[] {N, N},
            new short[] {N, N},
            new char[] {'a', 0},
            new char[] {'a', 0},
            accept,
            new short[] {N, N},
            transition);
    accept[1] = 5;
    transition[0][0] = N;
    assertEquals(1, table.accept(1));
    assertEquals(OptionalInt.of(1), table.transition(0, 'a'));
  }

  @Test
  public void testNoStates() {
    final var e =
        assertThrows(
            MalformedTableException.class,
            () ->
                new TransitionTable(
                    new short[0],
                    new short[0],
                    new char[0],
                    new char[0],
                    new short[0],
                    new short[0],
                    new short[0][]));
    assertThat(e.getMessage(), containsString("at least the start state"));
  }

  @Test
  public void testMismatchedLengths() {
    final var e =
        assertThrows(
            MalformedTableException.class,
            () ->
                new TransitionTable(
                    new short[] {N, N},
                    new short[] {N},
                    new char[] {'a', 0},
                    new char[] {'a', 0},
                    new short[] {N, 1},
                    new short[] {N, N},
                    new short[][] {{1}, {}}));
    assertThat(e.getMessage(), containsString("eof table has 1 entries, expected 2"));
  }

  @Test
  public void testTargetOutOfRange() {
    final var e =
        assertThrows(
            MalformedTableException.class,
            () ->
                new TransitionTable(
                    new short[] {N, N},
                    new short[] {N, N},
                    new char[] {'a', 0},
                    new char[] {'a', 0},
                    new short[] {N, 1},
                    new short[] {N, N},
                    new short[][] {{2}, {}}));
    assertThat(e.getMessage(), containsString("transition target 2 of state 0"));

    assertThrows(
        MalformedTableException.class,
        () ->
            new TransitionTable(
                new short[] {7, N},
                new short[] {N, N},
                new char[] {'a', 0},
                new char[] {'a', 0},
                new short[] {N, 1},
                new short[] {N, N},
                new short[][] {{1}, {}}));
  }

  @Test
  public void testRowLongerThanRange() {
    final var e =
        assertThrows(
            MalformedTableException.class,
            () ->
                new TransitionTable(
                    new short[] {N, N},
                    new short[] {N, N},
                    new char[] {'a', 0},
                    new char[] {'a', 0},
                    new short[] {N, 1},
                    new short[] {N, N},
                    new short[][] {{1, 1}, {}}));
    assertThat(e.getMessage(), containsString("has 2 transitions for range"));
  }

  @Test
  public void testMinAboveMax() {
    assertThrows(
        MalformedTableException.class,
        () ->
            new TransitionTable(
                new short[] {N, N},
                new short[] {N, N},
                new char[] {'b', 0},
                new char[] {'a', 0},
                new short[] {N, 1},
                new short[] {N, N},
                new short[][] {{1}, {}}));
  }

  @Test
  public void testMissingTable() {
    assertThrows(
        MalformedTableException.class,
        () ->
            new TransitionTable(
                null,
                new short[] {N},
                new char[] {0},
                new char[] {0},
                new short[] {1},
                new short[] {N},
                new short[][] {{}}));
  }

  @Test
  public void testMaxStatesIsConfigurable() {
    final var properties = new Properties();
    properties.setProperty(GrammarConfig.DFA_MAX_STATES, "1");
    GrammarConfig.setProperties(properties);
    final var e = assertThrows(MalformedTableException.class, () -> singleEdge());
    assertThat(e.getMessage(), containsString("2 states exceed the limit of 1"));
  }

  @Test
  public void testCheckState() {
    final var table = singleEdge();
    assertEquals(1, table.checkState(1));
    assertThrows(MalformedTableException.class, () -> table.checkState(2));
    assertThrows(MalformedTableException.class, () -> table.checkState(-1));
  }
}
