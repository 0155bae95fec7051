package insight.engine.exec;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.HashSet;
import java.util.Set;

/**
 * Factory for the APPLY aggregations.
 * MAX/MIN return the winning value as stored; SUM and AVG are rounded to 2 decimal places;
 * COUNT counts distinct values.
 */
public final class Accumulators {
    private static final int SCALE = 2;

    private Accumulators() {}

    public static Accumulator max() { return new Extreme(true); }

    public static Accumulator min() { return new Extreme(false); }

    public static Accumulator sum() { return new Sum(); }

    public static Accumulator avg() { return new Avg(); }

    public static Accumulator countDistinct() { return new CountDistinct(); }

    static double round(BigDecimal v) {
        return v.setScale(SCALE, RoundingMode.HALF_UP).doubleValue();
    }

    private static final class Extreme implements Accumulator {
        private final boolean max;
        private Number best;

        Extreme(boolean max) { this.max = max; }

        @Override
        public void add(Object value) {
            Number n = (Number) value;
            if (best == null) { best = n; return; }
            int cmp = Double.compare(n.doubleValue(), best.doubleValue());
            if (max ? cmp > 0 : cmp < 0) best = n;
        }

        @Override
        public Object result() { return best; }
    }

    private static final class Sum implements Accumulator {
        private double total;

        @Override
        public void add(Object value) { total += ((Number) value).doubleValue(); }

        @Override
        public Object result() { return round(BigDecimal.valueOf(total)); }
    }

    // Exact decimal accumulation; double addition drifts over many terms.
    private static final class Avg implements Accumulator {
        private BigDecimal total = BigDecimal.ZERO;
        private long count;

        @Override
        public void add(Object value) {
            total = total.add(BigDecimal.valueOf(((Number) value).doubleValue()));
            count++;
        }

        @Override
        public Object result() {
            if (count == 0) return null;
            return total.divide(BigDecimal.valueOf(count), SCALE, RoundingMode.HALF_UP).doubleValue();
        }
    }

    private static final class CountDistinct implements Accumulator {
        private final Set<Object> seen = new HashSet<>();

        @Override
        public void add(Object value) { seen.add(value); }

        @Override
        public Object result() { return seen.size(); }
    }
}
