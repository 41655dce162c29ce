package com.sharedmodel.api.classifier;

import com.sharedmodel.core.trainer.Classifier;

import java.util.Map;
import java.util.TreeMap;

/**
 * Baseline model: predicts the label seen most often so far, the smallest label on ties,
 * and 0 before any update. Stands in until a real model is plugged in.
 */
public class MajorityLabelClassifier implements Classifier<long[]> {

    private final Map<Long, Long> labelCounts = new TreeMap<>();

    @Override
    public synchronized void update(long[] sample, long label) {
        labelCounts.merge(label, 1L, Long::sum);
    }

    @Override
    public synchronized long predict(long[] sample) {
        long best = 0L;
        long bestCount = 0L;
        for (Map.Entry<Long, Long> entry : labelCounts.entrySet()) {
            if (entry.getValue() > bestCount) {
                best = entry.getKey();
                bestCount = entry.getValue();
            }
        }
        return best;
    }
}
