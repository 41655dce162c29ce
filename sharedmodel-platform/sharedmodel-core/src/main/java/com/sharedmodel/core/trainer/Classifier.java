package com.sharedmodel.core.trainer;

/**
 * The model being trained. Both operations must be deterministic for a given history of updates.
 *
 * @param <S> sample type
 */
public interface Classifier<S> {

    void update(S sample, long label);

    long predict(S sample);
}
