package org.kestrel.compiler.frontend.semantics.switches;

import org.kestrel.compiler.api.SourceInfo;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
public class RangeSetTest {

    private static final SourceInfo FIRST = new SourceInfo("main.kes", 1, 1);
    private static final SourceInfo SECOND = new SourceInfo("main.kes", 2, 1);

    private static BigInteger big(long value) {
        return BigInteger.valueOf(value);
    }

    @Test
    void testOverlapReturnsExistingRange() {
        RangeSet set = new RangeSet();
        assertThat(set.add(big(0), big(10), FIRST)).isNull();

        RangeSet.Range overlapped = set.add(big(10), big(20), SECOND);

        assertThat(overlapped).isNotNull();
        assertThat(overlapped.source()).isEqualTo(FIRST);
        assertThat(set.size()).isEqualTo(1);
    }

    @Test
    void testSpansIgnoresInsertionOrder() {
        RangeSet set = new RangeSet();
        set.add(big(5), big(9), FIRST);
        set.add(big(-3), big(4), SECOND);

        assertThat(set.spans(big(-3), big(9))).isTrue();
        assertThat(set.spans(big(-4), big(9))).isFalse();
        assertThat(set.spans(big(-3), big(10))).isFalse();
    }

    @Test
    void testEmptySetSpansNothing() {
        assertThat(new RangeSet().spans(big(0), big(0))).isFalse();
    }
}
