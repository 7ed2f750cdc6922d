package decision.domain;

import decision.utility.Enums;

/**
 * A value node has no states of its own; its utility depends on the states of its information set.
 */
public class ValueNode extends Node {
    public ValueNode(String name, int[] informationSet) {
        super(name, informationSet);
    }

    @Override
    public Enums.NodeRole getRole() {
        return Enums.NodeRole.VALUE;
    }
}
