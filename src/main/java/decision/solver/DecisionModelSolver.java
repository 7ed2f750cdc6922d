package decision.solver;

import decision.model.CandidateSolution;
import decision.model.DecisionModel;
import decision.model.LinearExpression;
import decision.utility.Constants;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.ojalgo.optimisation.ExpressionsBasedModel;
import org.ojalgo.optimisation.Optimisation;

import java.time.Duration;
import java.time.Instant;

/**
 * Solves a decision model with the ojAlgo integer solver.
 * <p>
 * Lazy cuts are handled by re-solving: every incumbent is handed to the registered cuts and the model is
 * solved again whenever one of them adds a constraint. The loop stops when no cut fires or the round
 * limit is reached.
 */
public class DecisionModelSolver {
    private final static Logger logger = LogManager.getLogger(DecisionModelSolver.class);
    private final DecisionModel decisionModel;
    private final int maxCutRounds;
    private final Integer timeLimitInSeconds;

    public DecisionModelSolver(DecisionModel decisionModel) {
        this(decisionModel, Constants.DEFAULT_CUT_ROUNDS, null);
    }

    /**
     * @param maxCutRounds       maximum number of re-solves triggered by lazy cuts.
     * @param timeLimitInSeconds limit for each solver call, null for no limit.
     */
    public DecisionModelSolver(DecisionModel decisionModel, int maxCutRounds, Integer timeLimitInSeconds) {
        this.decisionModel = decisionModel;
        this.maxCutRounds = maxCutRounds;
        this.timeLimitInSeconds = timeLimitInSeconds;
    }

    public Solution solve() {
        ExpressionsBasedModel model = decisionModel.getModel();
        if (timeLimitInSeconds != null)
            model.options.time_abort = timeLimitInSeconds * 1000L;

        Instant start = Instant.now();
        logger.info("solver starts.");

        CandidateSolution candidate = solveOnce(model);
        int round = 0;
        int numCutsAdded = 0;
        while (candidate.isFeasible() && round < maxCutRounds) {
            int numAdded = submitLazyCuts(candidate);
            if (numAdded == 0)
                break;

            ++round;
            numCutsAdded += numAdded;
            logger.info("----- cut round: " + round);
            logger.info("----- cuts added: " + numAdded);
            candidate = solveOnce(model);
        }

        if (round == maxCutRounds && candidate.isFeasible() && hasPendingCuts())
            logger.warn("cut round limit " + maxCutRounds + " reached, remaining lazy cuts not checked");

        double solutionTime = Duration.between(start, Instant.now()).toMillis() / 1000.0;
        double objectiveValue = candidate.isFeasible() ? evaluateObjective(candidate) : Double.NaN;
        logger.info("solver state: " + candidate.getState());
        logger.info("objective value: " + objectiveValue);
        logger.info("solution time: " + solutionTime + " seconds");
        return new Solution(candidate, objectiveValue, round, numCutsAdded, solutionTime);
    }

    private CandidateSolution solveOnce(ExpressionsBasedModel model) {
        Optimisation.Result result = model.maximise();
        logger.debug("solver returned " + result.getState() + " with value " + result.getValue());
        return new CandidateSolution(model, result);
    }

    private int submitLazyCuts(CandidateSolution candidate) {
        int numAdded = 0;
        for (LazyCut cut : decisionModel.getLazyCuts())
            if (cut.submit(candidate, decisionModel))
                ++numAdded;
        return numAdded;
    }

    private boolean hasPendingCuts() {
        for (LazyCut cut : decisionModel.getLazyCuts())
            if (!cut.isAdded())
                return true;
        return false;
    }

    private double evaluateObjective(CandidateSolution candidate) {
        LinearExpression objective = decisionModel.getObjective();
        return objective != null ? objective.evaluate(candidate) : 0.0;
    }
}
