package ai.envlens.analyzer;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/** Interval arithmetic over {@link SourceRange}. */
public final class Ranges {

    /**
     * Weight applied to a range's line span. A multi-line range outranks every single-line range shorter than this
     * many characters.
     */
    public static final long LINE_WEIGHT = 10_000L;

    /** Orders ranges from most to least specific: smaller size first, then earlier start. */
    public static final Comparator<SourceRange> MOST_SPECIFIC_FIRST = Comparator.comparingLong(Ranges::sizeMetric)
            .thenComparing(SourceRange::start)
            .thenComparing(SourceRange::end);

    private Ranges() {}

    /**
     * True when {@code p} lies within {@code r}: the line is within {@code [start.line, end.line]}, the character is
     * at or after {@code start.character} on the first line and strictly before {@code end.character} on the last.
     */
    public static boolean containsPosition(SourceRange r, SourcePosition p) {
        if (p.line() < r.start().line() || p.line() > r.end().line()) {
            return false;
        }
        if (p.line() == r.start().line() && p.character() < r.start().character()) {
            return false;
        }
        return p.line() != r.end().line() || p.character() < r.end().character();
    }

    /** Symmetric; ranges that merely touch ({@code a.end == b.start}) do not overlap. */
    public static boolean overlap(SourceRange a, SourceRange b) {
        return a.start().isBefore(b.end()) && b.start().isBefore(a.end());
    }

    /** True when {@code outer} fully encloses {@code inner}. */
    public static boolean encloses(SourceRange outer, SourceRange inner) {
        return outer.start().compareTo(inner.start()) <= 0 && inner.end().compareTo(outer.end()) <= 0;
    }

    /**
     * Size used to pick the most specific of several overlapping ranges. Multi-line ranges are penalized by
     * {@link #LINE_WEIGHT} per spanned line; within a line the metric is the character span.
     */
    public static long sizeMetric(SourceRange r) {
        long lines = r.end().line() - r.start().line();
        if (lines == 0) {
            return r.end().character() - r.start().character();
        }
        return lines * LINE_WEIGHT + r.end().character();
    }

    /** Picks the most specific item whose half-open range contains {@code position}. */
    public static <T> Optional<T> mostSpecificAt(
            Collection<T> items, Function<T, SourceRange> rangeOf, SourcePosition position) {
        T best = null;
        SourceRange bestRange = null;
        for (T item : items) {
            var range = rangeOf.apply(item);
            if (!containsPosition(range, position)) {
                continue;
            }
            if (bestRange == null || MOST_SPECIFIC_FIRST.compare(range, bestRange) < 0) {
                best = item;
                bestRange = range;
            }
        }
        return Optional.ofNullable(best);
    }

    /** Removes duplicate ranges, keeping first-seen order. */
    public static List<SourceRange> dedup(Collection<SourceRange> ranges) {
        return new ArrayList<>(new LinkedHashSet<>(ranges));
    }
}
