package decision.registry;

import decision.path.StateSpace;

/**
 * Utility table of a value node, stored row-major over the states of its information set.
 */
public class UtilityTable {
    private final int[] dims;
    private final double[] values;

    UtilityTable(int[] dims, double[] values) {
        this.dims = dims.clone();
        this.values = values.clone();
    }

    public double get(int[] informationStates) {
        return values[StateSpace.linearIndex(dims, informationStates)];
    }
}
