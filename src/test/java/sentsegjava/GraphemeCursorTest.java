package sentsegjava;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class GraphemeCursorTest {

    @Test
    void combiningMarkBelongsToPreviousCluster() {
        GraphemeCursor cursor = GraphemeCursor.of("e\u0301a");

        assertThat(cursor.offsets()).containsExactly(0, 2);
        assertThat(cursor.nextGrapheme(0)).isEqualTo(2);
        assertThat(cursor.nextGrapheme(1)).isEqualTo(2);
        assertThat(cursor.nextGrapheme(2)).isEqualTo(GraphemeCursor.NONE);
        assertThat(cursor.graphemeAt(0)).isEqualTo("e\u0301");
    }

    @Test
    void emojiWithModifierIsOneCluster() {
        GraphemeCursor cursor = GraphemeCursor.of("a👍🏽b");

        assertThat(cursor.offsets()).containsExactly(0, 1, 5);
        assertThat(cursor.size()).isEqualTo(3);
        assertThat(cursor.isGraphemeStart(3)).isFalse();
        assertThat(cursor.ceilGrapheme(3)).isEqualTo(5);
    }

    @Test
    void regionalIndicatorPairIsOneCluster() {
        GraphemeCursor cursor = GraphemeCursor.of("🇩🇪.");

        assertThat(cursor.offsets()).containsExactly(0, 4);
    }

    @Test
    void prevGraphemeStepsBack() {
        GraphemeCursor cursor = GraphemeCursor.of("ab\u0301c");

        assertThat(cursor.prevGrapheme(3)).isEqualTo(1);
        assertThat(cursor.prevGrapheme(2)).isEqualTo(1);
        assertThat(cursor.prevGrapheme(0)).isEqualTo(GraphemeCursor.NONE);
    }

    @Test
    void ceilPastLastClusterIsTextLength() {
        GraphemeCursor cursor = GraphemeCursor.of("ab\u0301");

        assertThat(cursor.ceilGrapheme(1)).isEqualTo(1);
        assertThat(cursor.ceilGrapheme(2)).isEqualTo(3);
        assertThat(cursor.ceilGrapheme(3)).isEqualTo(3);
    }

    @Test
    void emptyTextHasNoClusters() {
        GraphemeCursor cursor = GraphemeCursor.of("");

        assertThat(cursor.size()).isZero();
        assertThat(cursor.nextGrapheme(0)).isEqualTo(GraphemeCursor.NONE);
    }

    @Test
    void graphemeAtInsideClusterReturnsRemainder() {
        GraphemeCursor cursor = GraphemeCursor.of("\u0600.\u0301 x");

        assertThat(cursor.isGraphemeStart(1)).isFalse();
        assertThat(cursor.graphemeAt(1)).isEqualTo(".\u0301");
        assertThat(cursor.graphemeAt(0)).isEqualTo("\u0600.\u0301");
    }
}
