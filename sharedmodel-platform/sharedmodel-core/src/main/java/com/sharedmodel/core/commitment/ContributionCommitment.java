package com.sharedmodel.core.commitment;

import com.sharedmodel.core.domain.Address;
import com.sharedmodel.core.domain.ContributionKey;
import org.web3j.crypto.Hash;
import org.web3j.utils.Numeric;

import java.io.ByteArrayOutputStream;
import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.util.Objects;

/**
 * Keccak-256 commitment of {@code (sample, label, submissionTime, submitter)}.
 *
 * <p>Layout before hashing: encoded sample, label as 8 big-endian bytes, submission time as a
 * 32-byte unsigned word, submitter as its 20 bytes.
 */
public final class ContributionCommitment<S> {

    private final SampleCodec<S> codec;

    public ContributionCommitment(SampleCodec<S> codec) {
        this.codec = Objects.requireNonNull(codec, "Codec cannot be null");
    }

    public ContributionKey compute(S sample, long label, long submissionTime, Address submitter) {
        Objects.requireNonNull(submitter, "Submitter cannot be null");
        if (submissionTime < 0) {
            throw new IllegalArgumentException("Submission time must not be negative");
        }
        ByteArrayOutputStream packed = new ByteArrayOutputStream();
        packed.writeBytes(codec.encode(sample));
        packed.writeBytes(ByteBuffer.allocate(Long.BYTES).putLong(label).array());
        packed.writeBytes(Numeric.toBytesPadded(BigInteger.valueOf(submissionTime), 32));
        packed.writeBytes(submitter.toBytes());
        return ContributionKey.of(Hash.sha3(packed.toByteArray()));
    }
}
