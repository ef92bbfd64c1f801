package ai.envlens.analyzer;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.Test;

class RangesTest {

    @Test
    void containsPositionIsHalfOpen() {
        var r = SourceRange.of(1, 4, 1, 8);
        assertTrue(Ranges.containsPosition(r, SourcePosition.of(1, 4)));
        assertTrue(Ranges.containsPosition(r, SourcePosition.of(1, 7)));
        assertFalse(Ranges.containsPosition(r, SourcePosition.of(1, 8)), "end is exclusive");
        assertFalse(Ranges.containsPosition(r, SourcePosition.of(1, 3)));
        assertFalse(Ranges.containsPosition(r, SourcePosition.of(0, 5)));
    }

    @Test
    void containsPositionAcrossLines() {
        var r = SourceRange.of(2, 10, 4, 2);
        assertTrue(Ranges.containsPosition(r, SourcePosition.of(3, 0)));
        assertTrue(Ranges.containsPosition(r, SourcePosition.of(2, 50)));
        assertFalse(Ranges.containsPosition(r, SourcePosition.of(2, 9)));
        assertFalse(Ranges.containsPosition(r, SourcePosition.of(4, 2)));
    }

    @Test
    void overlapIsSymmetricAndIgnoresTouchingRanges() {
        var a = SourceRange.of(0, 0, 0, 5);
        var b = SourceRange.of(0, 3, 0, 9);
        var touching = SourceRange.of(0, 5, 0, 7);
        assertTrue(Ranges.overlap(a, b));
        assertTrue(Ranges.overlap(b, a));
        assertFalse(Ranges.overlap(a, touching));
        assertFalse(Ranges.overlap(touching, a));
    }

    @Test
    void multiLineRangesRankBelowSingleLineRangesUpToTheLineWeight() {
        var wide = SourceRange.of(0, 0, 0, 9_000);
        var twoLines = SourceRange.of(0, 10, 1, 0);
        assertTrue(Ranges.sizeMetric(wide) < Ranges.sizeMetric(twoLines));
    }

    @Test
    void mostSpecificAtPrefersTheSmallestEnclosingRange() {
        var outer = SourceRange.of(0, 0, 0, 20);
        var inner = SourceRange.of(0, 12, 0, 16);
        var block = SourceRange.of(0, 0, 3, 0);
        var found = Ranges.mostSpecificAt(List.of(block, outer, inner), r -> r, SourcePosition.of(0, 13));
        assertEquals(inner, found.orElseThrow());
        assertTrue(Ranges.mostSpecificAt(List.of(inner), r -> r, SourcePosition.of(5, 0)).isEmpty());
    }

    @Test
    void mostSpecificAtExcludesThePositionJustPastARange() {
        var token = SourceRange.of(0, 22, 0, 28);
        assertEquals(token, Ranges.mostSpecificAt(List.of(token), r -> r, SourcePosition.of(0, 27)).orElseThrow());
        assertTrue(Ranges.mostSpecificAt(List.of(token), r -> r, SourcePosition.of(0, 28)).isEmpty());
    }

    @Test
    void dedupKeepsFirstSeenOrder() {
        var a = SourceRange.of(0, 0, 0, 1);
        var b = SourceRange.of(1, 0, 1, 1);
        assertEquals(List.of(b, a), Ranges.dedup(List.of(b, a, b, SourceRange.of(1, 0, 1, 1))));
    }

    @Test
    void invalidRangesAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> SourceRange.of(1, 0, 0, 5));
        assertThrows(IllegalArgumentException.class, () -> SourcePosition.of(-1, 0));
    }
}
