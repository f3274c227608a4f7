package net.littleredcomputer.relnet.encode;

import net.littleredcomputer.relnet.EncodingOverflowException;
import org.junit.Test;

import java.math.BigDecimal;

import static org.hamcrest.Matchers.*;
import static org.junit.Assert.assertThat;

public class DyadicProbabilityTest {
    private static DyadicProbability exact(String p, int maxBits) {
        return DyadicProbability.exact(new BigDecimal(p), maxBits);
    }

    @Test
    public void expansions() {
        assertThat(exact("0.625", 32), is(DyadicProbability.of(5, 3)));
        assertThat(exact("0.5", 32).toString(), is("1/2^1"));
        assertThat(exact("0.75000", 2), is(DyadicProbability.of(3, 2)));
        assertThat(exact("0.0009765625", 10), is(DyadicProbability.of(1, 10)));
    }

    @Test
    public void zeroAndOneNeedNoBits() {
        assertThat(exact("0", 0), is(DyadicProbability.ZERO));
        assertThat(exact("0.000", 8), is(DyadicProbability.ZERO));
        assertThat(exact("1", 0), is(DyadicProbability.ONE));
        assertThat(exact("1.0", 8).isOne(), is(true));
        assertThat(DyadicProbability.ZERO.isZero(), is(true));
        assertThat(DyadicProbability.ONE.isZero(), is(false));
    }

    @Test
    public void lowestTerms() {
        DyadicProbability p = DyadicProbability.of(12, 5);
        assertThat(p.numerator(), is(3L));
        assertThat(p.bits(), is(3));
        assertThat(DyadicProbability.of(4, 2), is(DyadicProbability.ONE));
        assertThat(DyadicProbability.of(0, 7), is(DyadicProbability.ZERO));
    }

    @Test
    public void bitsMostSignificantFirst() {
        DyadicProbability p = DyadicProbability.of(5, 3);
        assertThat(p.bit(0), is(true));
        assertThat(p.bit(1), is(false));
        assertThat(p.bit(2), is(true));
        DyadicProbability q = DyadicProbability.of(3, 4);
        assertThat(q.bit(0), is(false));
        assertThat(q.bit(1), is(false));
        assertThat(q.bit(2), is(true));
        assertThat(q.bit(3), is(true));
    }

    @Test(expected = IndexOutOfBoundsException.class)
    public void bitOutOfRange() {
        DyadicProbability.of(5, 3).bit(3);
    }

    @Test(expected = EncodingOverflowException.class)
    public void oneTenthNeverTerminates() {
        exact("0.1", DyadicProbability.MAX_BITS);
    }

    @Test
    public void budgetExceeded() {
        try {
            exact("0.625", 2);
        } catch (EncodingOverflowException e) {
            assertThat(e.kind(), is("EncodingOverflow"));
            assertThat(e.getMessage(), containsString("0.625"));
            return;
        }
        throw new AssertionError("0.625 fits in 2 bits?");
    }

    @Test
    public void rounding() {
        assertThat(DyadicProbability.rounded(new BigDecimal("0.1"), 4), is(DyadicProbability.of(1, 3)));
        // ties go to even
        assertThat(DyadicProbability.rounded(new BigDecimal("0.625"), 2), is(DyadicProbability.of(1, 1)));
        assertThat(DyadicProbability.rounded(new BigDecimal("0.375"), 2), is(DyadicProbability.of(1, 1)));
        assertThat(DyadicProbability.rounded(new BigDecimal("0.625"), 3), is(DyadicProbability.of(5, 3)));
        assertThat(DyadicProbability.rounded(new BigDecimal("0.999"), 4), is(DyadicProbability.ONE));
        assertThat(DyadicProbability.rounded(new BigDecimal("0.01"), 4), is(DyadicProbability.ZERO));
    }

    @Test
    public void toBigDecimal() {
        assertThat(DyadicProbability.of(5, 3).toBigDecimal(), comparesEqualTo(new BigDecimal("0.625")));
        assertThat(DyadicProbability.of(1, 62).toBigDecimal().multiply(new BigDecimal(1L << 62)), comparesEqualTo(BigDecimal.ONE));
    }

    @Test(expected = IllegalArgumentException.class)
    public void notAProbability() {
        DyadicProbability.of(9, 3);
    }
}
