package decision.output;

import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.Variance;

import java.util.TreeMap;

/**
 * Probability weighted moments of a utility distribution.
 */
public class UtilityStatistics {
    private final double mean;
    private final double variance;
    private final double skewness;
    private final double kurtosis;

    public UtilityStatistics(UtilityDistribution distribution) {
        final double[] utilities = distribution.getUtilities();
        final double[] probabilities = distribution.getProbabilities();

        mean = new Mean().evaluate(utilities, probabilities);
        variance = new Variance(false).evaluate(utilities, probabilities, mean);

        double m3 = 0.0;
        double m4 = 0.0;
        double totalMass = 0.0;
        for (int i = 0; i < utilities.length; ++i) {
            final double d = utilities[i] - mean;
            m3 += probabilities[i] * d * d * d;
            m4 += probabilities[i] * d * d * d * d;
            totalMass += probabilities[i];
        }
        m3 /= totalMass;
        m4 /= totalMass;

        if (variance > 0.0) {
            skewness = m3 / Math.pow(variance, 1.5);
            kurtosis = m4 / (variance * variance) - 3.0;
        } else {
            skewness = 0.0;
            kurtosis = 0.0;
        }
    }

    public double getMean() {
        return mean;
    }

    public double getStandardDeviation() {
        return Math.sqrt(variance);
    }

    public double getVariance() {
        return variance;
    }

    public double getSkewness() {
        return skewness;
    }

    /**
     * @return excess kurtosis.
     */
    public double getKurtosis() {
        return kurtosis;
    }

    public TreeMap<String, Object> asMap() {
        TreeMap<String, Object> map = new TreeMap<>();
        map.put("mean", mean);
        map.put("std", getStandardDeviation());
        map.put("skewness", skewness);
        map.put("kurtosis", kurtosis);
        return map;
    }
}
