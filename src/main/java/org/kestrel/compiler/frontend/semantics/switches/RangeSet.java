package org.kestrel.compiler.frontend.semantics.switches;

import org.kestrel.compiler.api.SourceInfo;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * A set of disjoint inclusive integer intervals.
 */
public final class RangeSet {

    /**
     * @param first  The inclusive lower bound.
     * @param last   The inclusive upper bound.
     * @param source Where the case value or range was written.
     */
    public record Range(BigInteger first, BigInteger last, SourceInfo source) {

        boolean overlaps(BigInteger otherFirst, BigInteger otherLast) {
            return first.compareTo(otherLast) <= 0 && otherFirst.compareTo(last) <= 0;
        }
    }

    private final List<Range> ranges = new ArrayList<>();

    /**
     * Inserts an interval unless it overlaps one already present.
     *
     * @return The overlapped range, or {@code null} if the interval was inserted.
     */
    public Range add(BigInteger first, BigInteger last, SourceInfo source) {
        for (Range range : ranges) {
            if (range.overlaps(first, last)) {
                return range;
            }
        }
        ranges.add(new Range(first, last, source));
        return null;
    }

    /**
     * @return {@code true} if the intervals together cover every integer in {@code [min, max]}.
     */
    public boolean spans(BigInteger min, BigInteger max) {
        if (ranges.isEmpty()) {
            return false;
        }
        ranges.sort(Comparator.comparing(Range::first));
        if (ranges.get(0).first().compareTo(min) != 0) {
            return false;
        }
        BigInteger covered = ranges.get(0).last();
        for (int i = 1; i < ranges.size(); i++) {
            Range next = ranges.get(i);
            if (!next.first().equals(covered.add(BigInteger.ONE))) {
                return false;
            }
            covered = next.last();
        }
        return covered.compareTo(max) == 0;
    }

    public int size() {
        return ranges.size();
    }
}
