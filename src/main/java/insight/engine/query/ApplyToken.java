package insight.engine.query;

import insight.engine.exec.Accumulator;
import insight.engine.exec.Accumulators;

/**
 * Aggregations available in APPLY rules.
 */
public enum ApplyToken {
    MAX,
    MIN,
    AVG,
    SUM,
    COUNT;

    /** COUNT also accepts string fields; the others need numeric fields. */
    public boolean acceptsStringField() { return this == COUNT; }

    public Accumulator newAccumulator() {
        return switch (this) {
            case MAX -> Accumulators.max();
            case MIN -> Accumulators.min();
            case AVG -> Accumulators.avg();
            case SUM -> Accumulators.sum();
            case COUNT -> Accumulators.countDistinct();
        };
    }

    /** Returns the token with the given exact name, or null. */
    public static ApplyToken of(String name) {
        for (ApplyToken t : values()) {
            if (t.name().equals(name)) return t;
        }
        return null;
    }
}
