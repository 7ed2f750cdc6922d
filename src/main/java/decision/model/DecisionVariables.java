package decision.model;

import decision.domain.DecisionNode;
import org.ojalgo.optimisation.Variable;

/**
 * Binary variables z[row][state] of one decision node: z is 1 when the strategy picks state in the
 * information state with row-major index row.
 */
public class DecisionVariables {
    private final DecisionNode node;
    private final int[] informationDims;
    private final Variable[][] z;

    DecisionVariables(DecisionNode node, int[] informationDims, Variable[][] z) {
        this.node = node;
        this.informationDims = informationDims.clone();
        this.z = z;
    }

    public DecisionNode getNode() {
        return node;
    }

    public int[] getInformationDims() {
        return informationDims.clone();
    }

    public int getNumRows() {
        return z.length;
    }

    public Variable[] getRow(int row) {
        return z[row].clone();
    }

    public Variable get(int row, int state) {
        return z[row][state];
    }
}
