package io.github.chirino.speakercache.codec;

import java.util.Arrays;

/**
 * Speaker embedding computed from a user's voice sample. The vector is copied on the way in and
 * on the way out, so an instance never changes once it has been stored.
 */
public record SpeakerEmbedding(double[] values) {

    public SpeakerEmbedding {
        if (values == null) {
            throw new IllegalArgumentException("values must not be null");
        }
        values = values.clone();
    }

    public static SpeakerEmbedding of(double... values) {
        return new SpeakerEmbedding(values);
    }

    @Override
    public double[] values() {
        return values.clone();
    }

    public int dimension() {
        return values.length;
    }

    /**
     * Element-wise bit comparison: {@code NaN} equals {@code NaN}, {@code 0.0} differs from
     * {@code -0.0}.
     */
    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SpeakerEmbedding other)) {
            return false;
        }
        return Arrays.equals(values, other.values);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "SpeakerEmbedding[dimension=" + values.length + "]";
    }
}
