package sentsegjava;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class SkipRangesTest {

    @Test
    void doubleQuotesFormOneRange() {
        String text = "He said \"Stop. Now.\" and left.";

        List<SkipRange> ranges = SkipRanges.compute(text);

        assertThat(ranges).containsExactly(new SkipRange(
                text.indexOf('"'), text.lastIndexOf('"') + 1, SkipRange.Kind.QUOTE));
    }

    @Test
    void quotesMaySpanNewlines() {
        assertThat(SkipRanges.compute("“a\nb”"))
                .containsExactly(new SkipRange(0, 5, SkipRange.Kind.QUOTE));
    }

    @Test
    void elisionApostrophesAreNotQuotes() {
        assertThat(SkipRanges.compute("l'un et l'autre")).isEmpty();
    }

    @Test
    void singleQuoteAfterSpaceOpensRange() {
        String text = "he said 'yes' twice";

        List<SkipRange> ranges = SkipRanges.compute(text);

        assertThat(ranges).hasSize(1);
        SkipRange range = ranges.get(0);
        assertThat(text.substring(range.start(), range.end())).isEqualTo(" 'yes'");
    }

    @Test
    void emailAddressIsRange() {
        String text = "mail me at jane_doe+x@mail.example.co.uk now";

        List<SkipRange> ranges = SkipRanges.compute(text);

        assertThat(ranges).hasSize(1);
        SkipRange range = ranges.get(0);
        assertThat(range.kind()).isEqualTo(SkipRange.Kind.EMAIL);
        assertThat(text.substring(range.start(), range.end())).isEqualTo("jane_doe+x@mail.example.co.uk");
    }

    @Test
    void categoriesAreReportedInOrder() {
        List<SkipRange> ranges = SkipRanges.compute("(x) \"y\" z@ab.cd");

        assertThat(ranges).extracting(SkipRange::kind).containsExactly(
                SkipRange.Kind.QUOTE, SkipRange.Kind.EMAIL, SkipRange.Kind.PARENTHESIS);
    }

    @Test
    void bracketEndsAtFirstCloserOfAnyFamily() {
        List<SkipRange> out = new ArrayList<>();
        SkipRanges.parentheses("[a) b]", out);

        assertThat(out).containsExactly(new SkipRange(0, 3, SkipRange.Kind.PARENTHESIS));
    }

    @Test
    void escapedOpenerIsOrdinaryText() {
        List<SkipRange> out = new ArrayList<>();
        SkipRanges.parentheses("(a \\( b) c", out);

        assertThat(out).containsExactly(new SkipRange(0, 8, SkipRange.Kind.PARENTHESIS));
    }

    @Test
    void openerWithoutCloserOnItsLineIsIgnored() {
        List<SkipRange> out = new ArrayList<>();
        SkipRanges.parentheses("(a\nb) c (d)", out);

        assertThat(out).containsExactly(new SkipRange(8, 11, SkipRange.Kind.PARENTHESIS));
    }

    @Test
    void unclosedBracketYieldsNothing() {
        List<SkipRange> out = new ArrayList<>();
        SkipRanges.parentheses("(no closer here", out);

        assertThat(out).isEmpty();
    }

    @Test
    void fullWidthParenthesesAreRecognized() {
        List<SkipRange> out = new ArrayList<>();
        SkipRanges.parentheses("a（b。c）d", out);

        assertThat(out).containsExactly(new SkipRange(1, 6, SkipRange.Kind.PARENTHESIS));
    }

    @Test
    void unclosedOpenersAreScannedInLinearTime() {
        String quotes = "«".repeat(200_000) + " Fin.";
        String brackets = "(".repeat(200_000) + " Fin.";
        String apostrophes = " '".repeat(100_000) + " Fin.";

        assertTimeoutPreemptively(Duration.ofSeconds(5), () -> {
            assertThat(SkipRanges.compute(quotes)).isEmpty();
            assertThat(SkipRanges.compute(brackets)).isEmpty();
            assertThat(SkipRanges.compute(apostrophes)).hasSize(50_000);
        });
    }

    @Test
    void openerAfterFailedLineStillMatchesOnNextLine() {
        List<SkipRange> out = new ArrayList<>();
        SkipRanges.parentheses("( ( (\n(x)", out);

        assertThat(out).containsExactly(new SkipRange(6, 9, SkipRange.Kind.PARENTHESIS));
    }

    @Test
    void strictContainmentExcludesEnds() {
        SkipRange range = new SkipRange(2, 6, SkipRange.Kind.QUOTE);

        assertThat(range.strictlyContains(2)).isFalse();
        assertThat(range.strictlyContains(3)).isTrue();
        assertThat(range.strictlyContains(6)).isFalse();
    }
}
