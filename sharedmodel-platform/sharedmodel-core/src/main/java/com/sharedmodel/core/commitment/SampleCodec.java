package com.sharedmodel.core.commitment;

/**
 * Deterministic byte encoding of a sample, the sample's share of a contribution commitment.
 *
 * @param <S> sample type
 */
@FunctionalInterface
public interface SampleCodec<S> {

    byte[] encode(S sample);
}
