package decision.output;

import decision.utility.Enums;
import decision.utility.OptException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.TreeMap;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class RiskMeasuresTests {
    private final UtilityDistribution buy = new UtilityDistribution(new double[]{-100, 60}, new double[]{0.2, 0.8});

    @Test
    @DisplayName("Value-at-risk should be the first utility whose cumulative probability reaches alpha")
    void testValueAtRisk() throws OptException {
        assertEquals(-100, RiskMeasures.valueAtRisk(buy, 0.0), 1e-12);
        assertEquals(-100, RiskMeasures.valueAtRisk(buy, 0.2), 1e-12);
        assertEquals(60, RiskMeasures.valueAtRisk(buy, 0.5), 1e-12);
        assertEquals(60, RiskMeasures.valueAtRisk(buy, 1.0), 1e-12);
    }

    @Test
    @DisplayName("CVaR should average the worst alpha share of outcomes")
    void testConditionalValueAtRisk() throws OptException {
        assertEquals(-100, RiskMeasures.conditionalValueAtRisk(buy, 0.1), 1e-9);
        assertEquals(-4, RiskMeasures.conditionalValueAtRisk(buy, 0.5), 1e-9);
    }

    @Test
    @DisplayName("CVaR at 1 should equal the expected value and CVaR at 0 the value-at-risk")
    void testLimits() throws OptException {
        assertEquals(28, RiskMeasures.conditionalValueAtRisk(buy, 1.0), 1e-9);
        assertEquals(RiskMeasures.valueAtRisk(buy, 0.0), RiskMeasures.conditionalValueAtRisk(buy, 0.0), 1e-12);
        assertEquals(RiskMeasures.valueAtRisk(buy, 1e-9), RiskMeasures.conditionalValueAtRisk(buy, 1e-9), 1e-6);
    }

    @Test
    @DisplayName("CVaR should not lose precision at tiny risk levels")
    void testTinyRiskLevel() throws OptException {
        UtilityDistribution spread = new UtilityDistribution(
            new double[]{-100, 35, 60}, new double[]{0.1, 0.3, 0.6});
        assertEquals(-100, RiskMeasures.conditionalValueAtRisk(spread, 1e-12), 1e-12);
        assertEquals(-100, RiskMeasures.conditionalValueAtRisk(buy, 1e-9), 1e-12);
        assertEquals(35 - 0.1 * 135 / 0.25, RiskMeasures.conditionalValueAtRisk(spread, 0.25), 1e-9);
    }

    @Test
    @DisplayName("Risk level outside [0, 1] should be rejected")
    void testInvalidRiskLevel() {
        OptException ex = assertThrows(OptException.class, () -> RiskMeasures.valueAtRisk(buy, -0.1));
        assertEquals(Enums.ErrorKind.INVALID_RISK_LEVEL, ex.getKind());
        assertThrows(OptException.class, () -> RiskMeasures.conditionalValueAtRisk(buy, 1.1));
    }

    @Test
    @DisplayName("Risk table should hold both measures for every level")
    void testTable() throws OptException {
        TreeMap<Double, TreeMap<String, Double>> table = RiskMeasures.table(buy, new double[]{0.1, 1.0});
        assertEquals(2, table.size());
        assertEquals(-100, table.get(0.1).get("VaR"), 1e-12);
        assertEquals(28, table.get(1.0).get("CVaR"), 1e-9);
    }
}
