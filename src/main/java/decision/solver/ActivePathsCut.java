package decision.solver;

import decision.model.CandidateSolution;
import decision.model.LinearConstraint;
import decision.model.LinearExpression;
import decision.model.PathCompatibilityVariables;
import decision.path.Path;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.ojalgo.optimisation.Variable;

import java.util.Optional;

/**
 * Lazily forces the number of active paths to the number of paths compatible with one strategy.
 * <p>
 * A path is counted as active when its candidate value reaches the smallest path probability. This is
 * only meaningful when every chance state has positive probability.
 */
public class ActivePathsCut extends LazyCut {
    private final static Logger logger = LogManager.getLogger(ActivePathsCut.class);
    private final PathCompatibilityVariables x;
    private final long numCompatiblePaths;
    private final double tolerance;
    private final double epsilon;

    public ActivePathsCut(PathCompatibilityVariables x, long numCompatiblePaths, double tolerance) {
        this.x = x;
        this.numCompatiblePaths = numCompatiblePaths;
        this.tolerance = tolerance;

        double minProbability = 1.0;
        for (Path path : x.getPaths())
            minProbability = Math.min(minProbability, x.getProbability(path));
        this.epsilon = minProbability;
    }

    @Override
    protected Optional<LinearConstraint> separate(CandidateSolution candidate) {
        int numActive = 0;
        for (Variable variable : x.asMap().values())
            if (candidate.getValue(variable) >= epsilon)
                ++numActive;

        if (Math.abs(numActive - numCompatiblePaths) <= tolerance)
            return Optional.empty();

        logger.info("active paths cut added, " + numActive + " active paths, expected " + numCompatiblePaths);
        LinearExpression expr = new LinearExpression();
        for (Variable variable : x.asMap().values())
            expr.addTerm(variable, 1.0);
        return Optional.of(LinearConstraint.equalTo("active_paths", expr, numCompatiblePaths));
    }

    public long getNumCompatiblePaths() {
        return numCompatiblePaths;
    }
}
