package decision.output;

import decision.utility.Enums;
import decision.utility.OptException;

import java.util.TreeMap;

/**
 * Value-at-risk and conditional value-at-risk of a utility distribution. Low utilities form the tail.
 */
public class RiskMeasures {
    private RiskMeasures() {}

    /**
     * @return smallest utility whose cumulative probability reaches alpha, the largest utility if none does.
     */
    public static double valueAtRisk(UtilityDistribution distribution, double alpha) throws OptException {
        checkRiskLevel(alpha);
        final double[] utilities = distribution.getUtilities();
        final double[] probabilities = distribution.getProbabilities();
        double cumulative = 0.0;
        for (int i = 0; i < utilities.length; ++i) {
            cumulative += probabilities[i];
            if (cumulative >= alpha)
                return utilities[i];
        }
        return distribution.getMaxUtility();
    }

    /**
     * @return expected utility of the alpha tail; the value-at-risk when alpha is 0.
     */
    public static double conditionalValueAtRisk(UtilityDistribution distribution, double alpha)
        throws OptException {
        final double var = valueAtRisk(distribution, alpha);
        if (alpha == 0.0)
            return var;

        final double[] utilities = distribution.getUtilities();
        final double[] probabilities = distribution.getProbabilities();
        // var + E[min(u - var, 0)] / alpha, so the result is exactly var when no mass lies below it.
        double shortfall = 0.0;
        for (int i = 0; i < utilities.length && utilities[i] < var; ++i)
            shortfall += probabilities[i] * (utilities[i] - var);
        return var + shortfall / alpha;
    }

    /**
     * @return for every alpha, a map with its value-at-risk and conditional value-at-risk.
     */
    public static TreeMap<Double, TreeMap<String, Double>> table(UtilityDistribution distribution, double[] alphas)
        throws OptException {
        TreeMap<Double, TreeMap<String, Double>> table = new TreeMap<>();
        for (double alpha : alphas) {
            TreeMap<String, Double> row = new TreeMap<>();
            row.put("VaR", valueAtRisk(distribution, alpha));
            row.put("CVaR", conditionalValueAtRisk(distribution, alpha));
            table.put(alpha, row);
        }
        return table;
    }

    private static void checkRiskLevel(double alpha) throws OptException {
        if (!(alpha >= 0.0 && alpha <= 1.0))
            throw new OptException(Enums.ErrorKind.INVALID_RISK_LEVEL, "risk level must be in [0, 1], got " + alpha);
    }
}
