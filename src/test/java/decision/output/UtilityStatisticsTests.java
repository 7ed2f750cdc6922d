package decision.output;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class UtilityStatisticsTests {

    @Test
    @DisplayName("Moments of a two point distribution should match hand computed values")
    void testMoments() {
        UtilityStatistics statistics = new UtilityStatistics(
            new UtilityDistribution(new double[]{-100, 60}, new double[]{0.2, 0.8}));

        assertEquals(28, statistics.getMean(), 1e-9);
        assertEquals(64, statistics.getStandardDeviation(), 1e-9);
        assertEquals(-1.5, statistics.getSkewness(), 1e-9);
        assertEquals(0.25, statistics.getKurtosis(), 1e-9);
    }

    @Test
    @DisplayName("Degenerate distribution should have zero spread and shape")
    void testDegenerate() {
        UtilityStatistics statistics = new UtilityStatistics(
            new UtilityDistribution(new double[]{5}, new double[]{1.0}));

        assertEquals(5, statistics.getMean(), 1e-12);
        assertEquals(0, statistics.getStandardDeviation(), 1e-12);
        assertEquals(0, statistics.getSkewness(), 1e-12);
        assertEquals(0, statistics.getKurtosis(), 1e-12);
    }
}
