package com.sharedmodel.core.commitment;

import com.sharedmodel.core.error.ErrorReason;
import com.sharedmodel.core.error.ValidationException;

import java.util.Objects;

/**
 * Encodes {@code long[]} feature vectors as consecutive 32-byte two's-complement words,
 * the packed layout of a signed 64-bit array.
 *
 * <p>{@link #ofLength(int)} gives the fixed-width variant used by models with a known
 * input dimension; any other length is rejected.
 */
public final class Int64VectorCodec implements SampleCodec<long[]> {

    static final int WORD_SIZE = 32;

    private final int fixedLength;

    private Int64VectorCodec(int fixedLength) {
        this.fixedLength = fixedLength;
    }

    public static Int64VectorCodec anyLength() {
        return new Int64VectorCodec(-1);
    }

    public static Int64VectorCodec ofLength(int length) {
        if (length <= 0) {
            throw new IllegalArgumentException("Vector length must be positive");
        }
        return new Int64VectorCodec(length);
    }

    @Override
    public byte[] encode(long[] sample) {
        Objects.requireNonNull(sample, "Sample cannot be null");
        if (fixedLength >= 0 && sample.length != fixedLength) {
            throw new ValidationException(ErrorReason.MISMATCH,
                    "Expected a vector of length " + fixedLength + " but got " + sample.length);
        }
        byte[] out = new byte[sample.length * WORD_SIZE];
        for (int i = 0; i < sample.length; i++) {
            long value = sample[i];
            int offset = i * WORD_SIZE;
            byte fill = value < 0 ? (byte) 0xFF : 0;
            for (int j = 0; j < WORD_SIZE - Long.BYTES; j++) {
                out[offset + j] = fill;
            }
            for (int j = 0; j < Long.BYTES; j++) {
                out[offset + WORD_SIZE - 1 - j] = (byte) (value >>> (8 * j));
            }
        }
        return out;
    }
}
