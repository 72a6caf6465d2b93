package io.github.chirino.speakercache.codec;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.ByteBuffer;
import java.util.Arrays;
import java.util.Random;
import org.junit.jupiter.api.Test;

class SpeakerEmbeddingCodecTest {

    private final SpeakerEmbeddingCodec codec = new SpeakerEmbeddingCodec(0);

    @Test
    void decodesExactlyWhatWasEncoded() {
        SpeakerEmbedding embedding = SpeakerEmbedding.of(0.1, 0.2, 0.3);

        SpeakerEmbedding decoded = codec.decode(codec.encode(embedding));

        assertEquals(embedding, decoded);
        assertArrayEquals(new double[] {0.1, 0.2, 0.3}, decoded.values());
    }

    @Test
    void preservesRawBitsOfSpecialValues() {
        double quietNaN = Double.longBitsToDouble(0x7ff8000000000abcL);
        double[] values = {
            -0.0,
            0.0,
            Double.MIN_VALUE,
            Double.MAX_VALUE,
            Double.NEGATIVE_INFINITY,
            Double.POSITIVE_INFINITY,
            quietNaN
        };

        double[] decoded = codec.decode(codec.encode(new SpeakerEmbedding(values))).values();

        for (int i = 0; i < values.length; i++) {
            assertEquals(
                    Double.doubleToRawLongBits(values[i]),
                    Double.doubleToRawLongBits(decoded[i]),
                    "value at index " + i);
        }
    }

    @Test
    void largeRandomEmbeddingSurvives() {
        Random random = new Random(42);
        double[] values = new double[512];
        for (int i = 0; i < values.length; i++) {
            values[i] = random.nextGaussian();
        }

        SpeakerEmbedding decoded = codec.decode(codec.encode(new SpeakerEmbedding(values)));

        assertTrue(Arrays.equals(values, decoded.values()));
        assertEquals(512, decoded.dimension());
    }

    @Test
    void encodingIsDeterministic() {
        SpeakerEmbedding embedding = SpeakerEmbedding.of(1.5, -2.25);
        assertArrayEquals(codec.encode(embedding), codec.encode(SpeakerEmbedding.of(1.5, -2.25)));
    }

    @Test
    void emptyEmbeddingIsAllowed() {
        SpeakerEmbedding decoded = codec.decode(codec.encode(SpeakerEmbedding.of()));
        assertEquals(0, decoded.dimension());
    }

    @Test
    void embeddingIsDefensivelyCopied() {
        double[] source = {1.0, 2.0};
        SpeakerEmbedding embedding = new SpeakerEmbedding(source);
        source[0] = 99.0;
        embedding.values()[1] = 99.0;

        assertArrayEquals(new double[] {1.0, 2.0}, embedding.values());
        assertNotSame(embedding.values(), embedding.values());
    }

    @Test
    void rejectsWrongMagic() {
        byte[] payload = codec.encode(SpeakerEmbedding.of(1.0));
        payload[0] = 'X';

        CorruptPayloadException e =
                assertThrows(CorruptPayloadException.class, () -> codec.decode(payload));
        assertTrue(e.getMessage().contains("magic"));
    }

    @Test
    void rejectsUnknownVersion() {
        byte[] payload = codec.encode(SpeakerEmbedding.of(1.0));
        payload[4] = 9;

        assertThrows(CorruptPayloadException.class, () -> codec.decode(payload));
    }

    @Test
    void rejectsTruncatedPayload() {
        byte[] payload = codec.encode(SpeakerEmbedding.of(1.0, 2.0, 3.0));
        byte[] truncated = Arrays.copyOf(payload, payload.length - 3);

        assertThrows(CorruptPayloadException.class, () -> codec.decode(truncated));
        assertThrows(CorruptPayloadException.class, () -> codec.decode(new byte[3]));
        assertThrows(CorruptPayloadException.class, () -> codec.decode(null));
    }

    @Test
    void rejectsTrailingBytes() {
        byte[] payload = codec.encode(SpeakerEmbedding.of(1.0));
        byte[] padded = Arrays.copyOf(payload, payload.length + 8);

        assertThrows(CorruptPayloadException.class, () -> codec.decode(padded));
    }

    @Test
    void rejectsNegativeDimension() {
        ByteBuffer buffer = ByteBuffer.allocate(SpeakerEmbeddingCodec.HEADER_SIZE);
        buffer.putInt(SpeakerEmbeddingCodec.MAGIC).put(SpeakerEmbeddingCodec.VERSION).putInt(-1);

        assertThrows(CorruptPayloadException.class, () -> codec.decode(buffer.array()));
    }

    @Test
    void enforcesConfiguredDimension() {
        SpeakerEmbeddingCodec strict = new SpeakerEmbeddingCodec(3);
        byte[] twoValues = codec.encode(SpeakerEmbedding.of(1.0, 2.0));

        assertThrows(CorruptPayloadException.class, () -> strict.decode(twoValues));
        assertThrows(
                IllegalArgumentException.class, () -> strict.encode(SpeakerEmbedding.of(1.0)));
        assertEquals(
                SpeakerEmbedding.of(1.0, 2.0, 3.0),
                strict.decode(strict.encode(SpeakerEmbedding.of(1.0, 2.0, 3.0))));
    }

    @Test
    void rejectsNegativeExpectedDimension() {
        assertThrows(IllegalArgumentException.class, () -> new SpeakerEmbeddingCodec(-1));
    }
}
