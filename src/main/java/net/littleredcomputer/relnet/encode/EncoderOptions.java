package net.littleredcomputer.relnet.encode;

import java.util.Objects;

/**
 * Settings for {@link ReliabilityEncoder}. Instances are immutable; the
 * {@code with} methods return modified copies.
 */
public final class EncoderOptions {
    public static final int DEFAULT_MAX_BITS = 32;

    private final int maxBits;
    private final Polarity polarity;
    private final boolean round;

    private EncoderOptions(int maxBits, Polarity polarity, boolean round) {
        if (maxBits < 0 || maxBits > DyadicProbability.MAX_BITS) {
            throw new IllegalArgumentException("bit budget " + maxBits + " outside [0, " + DyadicProbability.MAX_BITS + "]");
        }
        this.maxBits = maxBits;
        this.polarity = Objects.requireNonNull(polarity);
        this.round = round;
    }

    public static EncoderOptions defaults() {
        return new EncoderOptions(DEFAULT_MAX_BITS, Polarity.DISCONNECTED, false);
    }

    public EncoderOptions withMaxBits(int maxBits) { return new EncoderOptions(maxBits, polarity, round); }
    public EncoderOptions withPolarity(Polarity polarity) { return new EncoderOptions(maxBits, polarity, round); }
    public EncoderOptions withRounding(boolean round) { return new EncoderOptions(maxBits, polarity, round); }

    /** @return the most coin variables any one edge may receive */
    public int maxBits() { return maxBits; }
    public Polarity polarity() { return polarity; }

    /** @return whether probabilities needing more than {@link #maxBits()} bits are rounded rather than refused */
    public boolean round() { return round; }

    @Override
    public String toString() {
        return String.format("EncoderOptions(maxBits=%d, polarity=%s, round=%s)", maxBits, polarity, round);
    }
}
