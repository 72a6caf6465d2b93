package io.github.chirino.speakercache.codec;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import org.eclipse.microprofile.config.inject.ConfigProperty;

/**
 * Binary codec for {@link SpeakerEmbedding} payloads.
 *
 * <p>Layout (big endian):
 *
 * <ul>
 *   <li>4 bytes magic {@code SPKE}
 *   <li>1 byte format version
 *   <li>4 bytes dimension {@code n}
 *   <li>{@code n} IEEE 754 doubles, written as raw long bits
 * </ul>
 *
 * Raw bits are written so NaN payloads and signed zeros survive a round trip unchanged.
 */
@ApplicationScoped
public class SpeakerEmbeddingCodec {

    static final int MAGIC = 0x53504B45;
    static final byte VERSION = 1;
    static final int HEADER_SIZE = 4 + 1 + 4;

    private final int expectedDimension;

    @Inject
    public SpeakerEmbeddingCodec(
            @ConfigProperty(name = "speaker-cache.codec.expected-dimension", defaultValue = "0")
                    int expectedDimension) {
        if (expectedDimension < 0) {
            throw new IllegalArgumentException(
                    "speaker-cache.codec.expected-dimension must be >= 0: " + expectedDimension);
        }
        this.expectedDimension = expectedDimension;
    }

    public byte[] encode(SpeakerEmbedding embedding) {
        double[] values = embedding.values();
        if (expectedDimension > 0 && values.length != expectedDimension) {
            throw new IllegalArgumentException(
                    "Embedding dimension "
                            + values.length
                            + " does not match expected dimension "
                            + expectedDimension);
        }
        ByteBuffer buffer =
                ByteBuffer.allocate(HEADER_SIZE + values.length * Double.BYTES)
                        .order(ByteOrder.BIG_ENDIAN);
        buffer.putInt(MAGIC);
        buffer.put(VERSION);
        buffer.putInt(values.length);
        for (double value : values) {
            buffer.putLong(Double.doubleToRawLongBits(value));
        }
        return buffer.array();
    }

    public SpeakerEmbedding decode(byte[] payload) {
        if (payload == null) {
            throw new CorruptPayloadException("Embedding payload is missing");
        }
        if (payload.length < HEADER_SIZE) {
            throw new CorruptPayloadException(
                    "Embedding payload too short: " + payload.length + " bytes");
        }
        ByteBuffer buffer = ByteBuffer.wrap(payload).order(ByteOrder.BIG_ENDIAN);
        try {
            int magic = buffer.getInt();
            if (magic != MAGIC) {
                throw new CorruptPayloadException(
                        String.format("Unexpected embedding magic 0x%08X", magic));
            }
            byte version = buffer.get();
            if (version != VERSION) {
                throw new CorruptPayloadException(
                        "Unsupported embedding format version " + version);
            }
            int dimension = buffer.getInt();
            if (dimension < 0) {
                throw new CorruptPayloadException("Negative embedding dimension " + dimension);
            }
            if (expectedDimension > 0 && dimension != expectedDimension) {
                throw new CorruptPayloadException(
                        "Embedding dimension "
                                + dimension
                                + " does not match expected dimension "
                                + expectedDimension);
            }
            long expectedLength = HEADER_SIZE + (long) dimension * Double.BYTES;
            if (payload.length != expectedLength) {
                throw new CorruptPayloadException(
                        "Embedding payload has "
                                + payload.length
                                + " bytes, expected "
                                + expectedLength
                                + " for dimension "
                                + dimension);
            }
            double[] values = new double[dimension];
            for (int i = 0; i < dimension; i++) {
                values[i] = Double.longBitsToDouble(buffer.getLong());
            }
            return new SpeakerEmbedding(values);
        } catch (BufferUnderflowException e) {
            throw new CorruptPayloadException("Embedding payload truncated", e);
        }
    }
}
