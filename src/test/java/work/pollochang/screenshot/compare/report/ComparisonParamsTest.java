package work.pollochang.screenshot.compare.report;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ComparisonParamsTest {

    @Test
    void testDefaults() {
        ComparisonParams params = ComparisonParams.defaults();

        assertEquals(0.95, params.threshold());
        assertEquals(8, params.hashSize());
        assertEquals(11, params.ssimWindowSize());
        assertEquals(1.5, params.ssimSigma());
    }

    /**
     * 門檻的兩個端點都合法
     */
    @Test
    void testThresholdBounds_ShouldBeInclusive() {
        assertEquals(0.0, ComparisonParams.defaults().withThreshold(0.0).threshold());
        assertEquals(1.0, ComparisonParams.defaults().withThreshold(1.0).threshold());
        assertThrows(IllegalArgumentException.class, () -> ComparisonParams.requireThreshold(1.0000001));
        assertThrows(IllegalArgumentException.class, () -> ComparisonParams.requireThreshold(Double.NaN));
    }

    @Test
    void testInvalidParams_ShouldThrowIllegalArgumentException() {
        assertThrows(IllegalArgumentException.class, () -> new ComparisonParams(0.9, 1, 11, 1.5));
        assertThrows(IllegalArgumentException.class, () -> new ComparisonParams(0.9, 8, 10, 1.5));
        assertThrows(IllegalArgumentException.class, () -> new ComparisonParams(0.9, 8, -1, 1.5));
        assertThrows(IllegalArgumentException.class, () -> new ComparisonParams(0.9, 8, 11, 0.0));
        assertThrows(IllegalArgumentException.class, () -> new ComparisonParams(0.9, 8, 11, Double.NaN));
        assertThrows(IllegalArgumentException.class,
                () -> new ComparisonParams(0.9, 8, 11, Double.POSITIVE_INFINITY));
    }
}
