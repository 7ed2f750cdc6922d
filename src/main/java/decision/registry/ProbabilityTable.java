package decision.registry;

import decision.path.StateSpace;

/**
 * Conditional probability table of a chance node, stored row-major over (information states, own state).
 */
public class ProbabilityTable {
    private final int[] dims;
    private final double[] values;

    ProbabilityTable(int[] dims, double[] values) {
        this.dims = dims.clone();
        this.values = values.clone();
    }

    public double get(int[] informationStates, int state) {
        int[] index = new int[dims.length];
        System.arraycopy(informationStates, 0, index, 0, informationStates.length);
        index[dims.length - 1] = state;
        return values[StateSpace.linearIndex(dims, index)];
    }

    public boolean hasStructuralZeros() {
        for (double value : values)
            if (value == 0.0)
                return true;
        return false;
    }
}
