package decision.solver;

import decision.domain.DecisionStrategy;
import decision.domain.LocalDecisionStrategy;
import decision.model.CandidateSolution;
import decision.model.DecisionVariables;
import decision.utility.Enums;
import decision.utility.OptException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads the decision variables of a solved model into a validated deterministic strategy.
 */
public class StrategyExtractor {
    private final static Logger logger = LogManager.getLogger(StrategyExtractor.class);

    private StrategyExtractor() {}

    public static DecisionStrategy extract(List<DecisionVariables> decisionVariables, Solution solution)
        throws OptException {
        if (!solution.isFeasible())
            throw new OptException(Enums.ErrorKind.SOLVER_FAILURE,
                "no feasible solution to extract a strategy from, solver state " + solution.getState());
        return extract(decisionVariables, solution.getCandidate());
    }

    /**
     * Rounds every z value to the nearest integer and validates the resulting tables.
     *
     * @throws OptException with kind MALFORMED_STRATEGY if a rounded row does not select exactly one state.
     */
    public static DecisionStrategy extract(List<DecisionVariables> decisionVariables, CandidateSolution candidate)
        throws OptException {
        ArrayList<LocalDecisionStrategy> localStrategies = new ArrayList<>();
        for (DecisionVariables z : decisionVariables) {
            int[][] data = new int[z.getNumRows()][];
            for (int row = 0; row < data.length; ++row) {
                double[] values = candidate.getValues(z.getRow(row));
                data[row] = new int[values.length];
                for (int state = 0; state < values.length; ++state)
                    data[row][state] = (int) Math.round(values[state]);
            }
            LocalDecisionStrategy strategy = LocalDecisionStrategy.of(z.getNode(), z.getInformationDims(), data);
            logger.debug("extracted strategy " + strategy);
            localStrategies.add(strategy);
        }
        return new DecisionStrategy(localStrategies);
    }
}
