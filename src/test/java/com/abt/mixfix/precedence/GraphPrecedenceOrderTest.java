package com.abt.mixfix.precedence;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for the graph-backed precedence order.
 */
class GraphPrecedenceOrderTest {

    private final CursorPosition times = CursorPosition.entry("Times");
    private final CursorPosition timesQ = CursorPosition.exit("Times", "q");
    private final CursorPosition plus = CursorPosition.entry("Plus");
    private final CursorPosition plusQ = CursorPosition.exit("Plus", "q");
    private final CursorPosition pow = CursorPosition.entry("Pow");

    private GraphPrecedenceOrder order;

    @BeforeEach
    void setUp() {
        order = new GraphPrecedenceOrder();
        order.addToken(times);
        order.addToken(timesQ);
        order.addToken(plus);
        order.addToken(plusQ);
        order.addToken(pow);
    }

    @Test
    void testReflexive() {
        assertThat(order.lessOrEqual(plus, plus)).isTrue();
    }

    @Test
    void testUnrelatedPositionsAreIncomparable() {
        assertThat(order.lessOrEqual(plus, times)).isFalse();
        assertThat(order.lessOrEqual(times, plus)).isFalse();
    }

    @Test
    void testTransitiveClosure() {
        order.add(pow, plus);
        order.add(plus, times);

        assertThat(order.lessOrEqual(pow, times)).isTrue();
        assertThat(order.lessOrEqual(times, pow)).isFalse();
    }

    @Test
    void testCyclesMakePositionsEquivalent() {
        order.add(plusQ, timesQ);
        order.add(timesQ, plusQ);

        assertThat(order.lessOrEqual(plusQ, timesQ)).isTrue();
        assertThat(order.lessOrEqual(timesQ, plusQ)).isTrue();
    }

    @Test
    void testBottomAndTopAreAlwaysPresent() {
        assertThat(order.contains(CursorPosition.BOTTOM)).isTrue();
        assertThat(order.contains(CursorPosition.TOP)).isTrue();
        assertThat(order.lessOrEqual(CursorPosition.BOTTOM, times)).isTrue();
        assertThat(order.lessOrEqual(plusQ, CursorPosition.TOP)).isTrue();
        assertThat(order.lessOrEqual(CursorPosition.TOP, CursorPosition.BOTTOM)).isFalse();
    }

    @Test
    void testDeclaredTopCoversLaterPositions() {
        CursorPosition top = CursorPosition.entry("Top");
        order.addTop(top);
        CursorPosition late = CursorPosition.entry("Late");
        order.addToken(late);

        assertThat(order.lessOrEqual(late, top)).isTrue();
        assertThat(order.lessOrEqual(top, late)).isFalse();
    }

    @Test
    void testAnythingAboveTopIsTop() {
        CursorPosition top = CursorPosition.entry("Top");
        order.addTop(top);
        order.add(top, pow);

        assertThat(order.lessOrEqual(times, pow)).isTrue();
    }

    @Test
    void testAnythingBelowBottomIsBottom() {
        CursorPosition bottom = CursorPosition.entry("Low");
        order.addBottom(bottom);
        order.add(pow, bottom);

        assertThat(order.lessOrEqual(pow, times)).isTrue();
    }

    @Test
    void testUnknownPositionsAreRejected() {
        CursorPosition unknown = CursorPosition.entry("Unknown");

        assertThatThrownBy(() -> order.add(unknown, plus))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown");
        assertThat(order.lessOrEqual(unknown, plus)).isFalse();
        assertThat(order.lessOrEqual(CursorPosition.BOTTOM, unknown)).isTrue();
    }

    @Test
    void testCursorPositionDisplay() {
        assertThat(times.toString()).isEqualTo("Times");
        assertThat(timesQ.toString()).isEqualTo("Times.q");
        assertThat(times.isEntry()).isTrue();
        assertThat(timesQ.isEntry()).isFalse();
    }
}
