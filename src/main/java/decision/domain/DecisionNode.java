package decision.domain;

import decision.utility.Enums;

import java.util.List;

/**
 * A decision node. Its information set lists the nodes whose states are known when the decision
 * is made; it never contains the node itself.
 */
public class DecisionNode extends StateNode {
    public DecisionNode(int index, String name, int[] informationSet, List<String> states) {
        super(index, name, informationSet, states);
    }

    @Override
    public Enums.NodeRole getRole() {
        return Enums.NodeRole.DECISION;
    }
}
