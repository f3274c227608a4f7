package net.littleredcomputer.relnet.count;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Objects;

/**
 * A count of satisfying assignments, as mantissa * 2^exponent (the form
 * approximate counters report it in).
 */
public final class ModelCount {
    private final BigInteger mantissa;
    private final int exponent;
    private final boolean exact;

    private ModelCount(BigInteger mantissa, int exponent, boolean exact) {
        if (mantissa.signum() < 0) throw new IllegalArgumentException("negative count " + mantissa);
        if (exponent < 0) throw new IllegalArgumentException("negative exponent " + exponent);
        this.mantissa = mantissa;
        this.exponent = exponent;
        this.exact = exact;
    }

    public static ModelCount exact(BigInteger count) {
        return new ModelCount(count, 0, true);
    }

    public static ModelCount exact(long count) {
        return exact(BigInteger.valueOf(count));
    }

    public static ModelCount approximate(BigInteger mantissa, int exponent) {
        return new ModelCount(mantissa, exponent, false);
    }

    public BigInteger mantissa() { return mantissa; }
    public int exponent() { return exponent; }

    /** @return false if the count is an estimate */
    public boolean isExact() { return exact; }

    public BigInteger value() {
        return mantissa.shiftLeft(exponent);
    }

    /**
     * @param samplingSetSize number of variables the count was projected onto
     * @return the count as a fraction of all 2^samplingSetSize assignments (exact)
     */
    public BigDecimal fractionOf(int samplingSetSize) {
        return new BigDecimal(value()).divide(new BigDecimal(BigInteger.ONE.shiftLeft(samplingSetSize)));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ModelCount that = (ModelCount) o;
        return exact == that.exact && value().equals(that.value());
    }

    @Override
    public int hashCode() {
        return Objects.hash(value(), exact);
    }

    @Override
    public String toString() {
        return exponent == 0 ? mantissa.toString() : mantissa + "*2**" + exponent;
    }
}
