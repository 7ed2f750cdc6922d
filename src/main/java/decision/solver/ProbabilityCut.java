package decision.solver;

import decision.model.CandidateSolution;
import decision.model.DecisionModelBuilder;
import decision.model.LinearConstraint;
import decision.model.PathCompatibilityVariables;
import decision.path.Path;
import decision.utility.Constants;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Optional;

/**
 * Lazy form of the probability constraint sum_s x_s P(s) = 1.
 */
public class ProbabilityCut extends LazyCut {
    private final static Logger logger = LogManager.getLogger(ProbabilityCut.class);
    private final PathCompatibilityVariables x;
    private final double scale;

    public ProbabilityCut(PathCompatibilityVariables x, double scale) {
        this.x = x;
        this.scale = scale;
    }

    @Override
    protected Optional<LinearConstraint> separate(CandidateSolution candidate) {
        double total = 0.0;
        for (Path path : x.getPaths())
            total += candidate.getValue(x.get(path)) * x.getProbability(path);

        if (Math.abs(total - 1.0) <= Constants.PROBABILITY_TOLERANCE)
            return Optional.empty();

        logger.info("probability cut added, candidate probability sum " + total);
        return Optional.of(DecisionModelBuilder.buildProbabilityConstraint(x, scale));
    }
}
