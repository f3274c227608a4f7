package net.littleredcomputer.relnet;

import java.math.BigDecimal;

/**
 * Thrown when a probability has no binary expansion that terminates within
 * the configured number of bits.
 */
public class EncodingOverflowException extends RelnetException {
    private final BigDecimal probability;
    private final int maxBits;

    public EncodingOverflowException(BigDecimal probability, int maxBits) {
        super(String.format("probability %s is not of the form k/2^m with m <= %d", probability.toPlainString(), maxBits));
        this.probability = probability;
        this.maxBits = maxBits;
    }

    public BigDecimal probability() {
        return probability;
    }

    public int maxBits() {
        return maxBits;
    }

    @Override
    public String kind() {
        return "EncodingOverflow";
    }
}
