package insight.engine.exec;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

public class AccumulatorsTest {

    private Object feed(Accumulator acc, Object... values) {
        for (Object v : values) acc.add(v);
        return acc.result();
    }

    @Test
    void avgUsesExactDecimalSum() {
        // 240.17 / 3 = 80.0566...
        assertEquals(80.06, feed(Accumulators.avg(), 71.07, 71.1, 98.0));
        assertEquals(0.3, feed(Accumulators.avg(), 0.1, 0.2, 0.3, 0.4, 0.5));
    }

    @Test
    void sumRoundsToTwoPlaces() {
        assertEquals(240.17, feed(Accumulators.sum(), 71.07, 71.1, 98.0));
        assertEquals(0.6, feed(Accumulators.sum(), 0.1, 0.2, 0.3));
        assertEquals(300.0, feed(Accumulators.sum(), 100, 200));
    }

    @Test
    void maxAndMinKeepStoredValue() {
        assertEquals(98.0, feed(Accumulators.max(), 71.07, 98.0, 71.1));
        assertEquals(71.07, feed(Accumulators.min(), 71.07, 98.0, 71.1));
        assertEquals(Integer.valueOf(300), feed(Accumulators.max(), 40, 300, 120));
    }

    @Test
    void countIsDistinctValues() {
        assertEquals(3, feed(Accumulators.countDistinct(), "cpsc", "crwr", "biol"));
        assertEquals(1, feed(Accumulators.countDistinct(), 2015, 2015, 2015));
        assertEquals(2, feed(Accumulators.countDistinct(), "a", "b", "a"));
    }
}
