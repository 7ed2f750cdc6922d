package decision.output;

import decision.domain.DecisionStrategy;
import decision.path.CompatiblePaths;
import decision.path.Path;
import decision.path.PathProbability;
import decision.path.PathUtility;
import decision.registry.InfluenceDiagram;
import decision.utility.OptException;

import java.util.Map;
import java.util.TreeMap;

/**
 * Distribution of path utilities under a fixed strategy: distinct utilities in increasing order, each
 * paired with the total probability of the compatible paths that reach it.
 */
public class UtilityDistribution {
    private final double[] utilities;
    private final double[] probabilities;

    public UtilityDistribution(double[] utilities, double[] probabilities) {
        if (utilities.length != probabilities.length)
            throw new IllegalArgumentException("utilities and probabilities differ in length");
        this.utilities = utilities.clone();
        this.probabilities = probabilities.clone();
    }

    public static UtilityDistribution of(InfluenceDiagram diagram, DecisionStrategy strategy) throws OptException {
        return of(diagram, strategy, diagram.getPathUtility());
    }

    public static UtilityDistribution of(InfluenceDiagram diagram, DecisionStrategy strategy, PathUtility utility)
        throws OptException {
        final PathProbability probability = diagram.getPathProbability();
        TreeMap<Double, Double> mass = new TreeMap<>();
        for (Path path : CompatiblePaths.of(diagram, strategy)) {
            final double p = probability.probability(path);
            if (p > 0.0)
                mass.merge(utility.utility(path), p, Double::sum);
        }

        double[] utilities = new double[mass.size()];
        double[] probabilities = new double[mass.size()];
        int i = 0;
        for (Map.Entry<Double, Double> entry : mass.entrySet()) {
            utilities[i] = entry.getKey();
            probabilities[i] = entry.getValue();
            ++i;
        }
        return new UtilityDistribution(utilities, probabilities);
    }

    public double[] getUtilities() {
        return utilities.clone();
    }

    public double[] getProbabilities() {
        return probabilities.clone();
    }

    public int size() {
        return utilities.length;
    }

    public double getMaxUtility() {
        return utilities[utilities.length - 1];
    }
}
