package net.littleredcomputer.relnet.encode;

import net.littleredcomputer.relnet.EncodingOverflowException;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;

/**
 * A probability of the form k/2^m with m as small as possible. A uniformly
 * random m-bit number is below k with exactly this probability.
 */
public final class DyadicProbability {
    /** Largest supported bit width; k always fits in a long. */
    public static final int MAX_BITS = 62;
    private static final BigDecimal TWO = BigDecimal.valueOf(2);

    public static final DyadicProbability ZERO = new DyadicProbability(0, 0);
    public static final DyadicProbability ONE = new DyadicProbability(1, 0);

    private final long numerator;
    private final int bits;

    private DyadicProbability(long numerator, int bits) {
        this.numerator = numerator;
        this.bits = bits;
    }

    /**
     * @param k numerator, in [0, 2^m]
     * @param m exponent of the denominator, in [0, {@link #MAX_BITS}]
     * @return k/2^m in lowest terms
     */
    public static DyadicProbability of(long k, int m) {
        checkBits(m);
        if (k < 0 || k > (1L << m)) throw new IllegalArgumentException(k + "/2^" + m + " is not a probability");
        while (m > 0 && (k & 1) == 0) {
            k >>= 1;
            --m;
        }
        return new DyadicProbability(k, m);
    }

    /**
     * Finds the exact binary expansion of p by repeated doubling.
     * @param p a probability
     * @param maxBits the most bits the expansion may take
     * @return p as k/2^m with m minimal
     * @throws EncodingOverflowException if p needs more than maxBits bits (or never terminates)
     */
    public static DyadicProbability exact(BigDecimal p, int maxBits) {
        checkProbability(p);
        checkBits(maxBits);
        BigDecimal x = p;
        for (int m = 0; m <= maxBits; ++m) {
            if (x.stripTrailingZeros().scale() <= 0) return of(x.longValueExact(), m);
            x = x.multiply(TWO);
        }
        throw new EncodingOverflowException(p, maxBits);
    }

    /**
     * @param p a probability
     * @param maxBits bit budget
     * @return p itself if it is exactly representable within maxBits bits, otherwise the
     * nearest multiple of 2^-maxBits (ties to even)
     */
    public static DyadicProbability rounded(BigDecimal p, int maxBits) {
        checkProbability(p);
        checkBits(maxBits);
        BigDecimal scaled = p.multiply(new BigDecimal(BigInteger.ONE.shiftLeft(maxBits)));
        return of(scaled.setScale(0, RoundingMode.HALF_EVEN).longValueExact(), maxBits);
    }

    private static void checkBits(int m) {
        if (m < 0 || m > MAX_BITS) throw new IllegalArgumentException("bit width " + m + " outside [0, " + MAX_BITS + "]");
    }

    private static void checkProbability(BigDecimal p) {
        if (p.signum() < 0 || p.compareTo(BigDecimal.ONE) > 0) throw new IllegalArgumentException(p + " is not a probability");
    }

    public long numerator() { return numerator; }
    public int bits() { return bits; }

    public boolean isZero() { return numerator == 0; }
    public boolean isOne() { return bits == 0 && numerator == 1; }

    /**
     * @param i bit position, 0 being the most significant
     * @return bit i of the m-bit numerator
     */
    public boolean bit(int i) {
        if (i < 0 || i >= bits) throw new IndexOutOfBoundsException("bit " + i + " of " + this);
        return ((numerator >> (bits - 1 - i)) & 1) != 0;
    }

    public BigDecimal toBigDecimal() {
        // Dividing by a power of two always terminates.
        return new BigDecimal(numerator).divide(new BigDecimal(BigInteger.ONE.shiftLeft(bits)));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        DyadicProbability that = (DyadicProbability) o;
        return numerator == that.numerator && bits == that.bits;
    }

    @Override
    public int hashCode() {
        return 31 * Long.hashCode(numerator) + bits;
    }

    @Override
    public String toString() {
        return numerator + "/2^" + bits;
    }
}
