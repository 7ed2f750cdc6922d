package decision.domain;

import decision.path.StateSpace;
import decision.utility.Enums;
import decision.utility.OptException;

import java.util.Arrays;

/**
 * Deterministic policy of a single decision node.
 * <p>
 * The strategy is a 0/1 table with one row per information state (row-major over the information
 * set, last node fastest) and one column per state of the decision node. Every row has exactly one 1.
 */
public class LocalDecisionStrategy {
    private final DecisionNode node;
    private final int[] informationDims;
    private final int[][] data;
    private final int[] choices;

    private LocalDecisionStrategy(DecisionNode node, int[] informationDims, int[][] data, int[] choices) {
        this.node = node;
        this.informationDims = informationDims;
        this.data = data;
        this.choices = choices;
    }

    /**
     * Validates a 0/1 table and builds the strategy from it.
     *
     * @param node            decision node the strategy belongs to.
     * @param informationDims number of states of each node in the information set of the node.
     * @param data            data[row][state] with one row per information state.
     * @return validated strategy.
     * @throws OptException with kind MALFORMED_STRATEGY if the table has the wrong shape, an entry
     *                      other than 0 or 1, or a row that does not select exactly one state.
     */
    public static LocalDecisionStrategy of(DecisionNode node, int[] informationDims, int[][] data)
        throws OptException {
        final long numRows = StateSpace.product(informationDims);
        if (data.length != numRows)
            throw new OptException(Enums.ErrorKind.MALFORMED_STRATEGY,
                "expected " + numRows + " information states for " + node.getName() + ", got " + data.length);

        int[][] copy = new int[data.length][];
        int[] choices = new int[data.length];
        for (int row = 0; row < data.length; ++row) {
            if (data[row].length != node.getNumStates())
                throw new OptException(Enums.ErrorKind.MALFORMED_STRATEGY,
                    "row " + row + " of " + node.getName() + " has " + data[row].length + " states");

            int sum = 0;
            for (int state = 0; state < data[row].length; ++state) {
                int value = data[row][state];
                if (value != 0 && value != 1)
                    throw new OptException(Enums.ErrorKind.MALFORMED_STRATEGY,
                        "strategy entries of " + node.getName() + " must be 0 or 1, found " + value);
                sum += value;
                if (value == 1)
                    choices[row] = state;
            }
            if (sum != 1)
                throw new OptException(Enums.ErrorKind.MALFORMED_STRATEGY,
                    "row " + row + " of " + node.getName() + " selects " + sum + " states instead of one");
            copy[row] = data[row].clone();
        }
        return new LocalDecisionStrategy(node, informationDims.clone(), copy, choices);
    }

    /**
     * Builds the strategy from the chosen state of every information state.
     */
    public static LocalDecisionStrategy fromChoices(DecisionNode node, int[] informationDims, int[] choices)
        throws OptException {
        int[][] data = new int[choices.length][node.getNumStates()];
        for (int row = 0; row < choices.length; ++row) {
            if (choices[row] < 0 || choices[row] >= node.getNumStates())
                throw new OptException(Enums.ErrorKind.MALFORMED_STRATEGY,
                    "state " + choices[row] + " does not exist in " + node.getName());
            data[row][choices[row]] = 1;
        }
        return of(node, informationDims, data);
    }

    /**
     * @param informationStates states of the information set nodes, in information set order.
     * @return state chosen by the strategy.
     */
    public int decide(int[] informationStates) {
        return choices[StateSpace.linearIndex(informationDims, informationStates)];
    }

    public int getChoice(int row) {
        return choices[row];
    }

    public int getNumRows() {
        return data.length;
    }

    public int[][] getData() {
        int[][] copy = new int[data.length][];
        for (int row = 0; row < data.length; ++row)
            copy[row] = data[row].clone();
        return copy;
    }

    public DecisionNode getNode() {
        return node;
    }

    public int[] getInformationDims() {
        return informationDims.clone();
    }

    @Override
    public String toString() {
        return node.getName() + Arrays.toString(choices);
    }
}
