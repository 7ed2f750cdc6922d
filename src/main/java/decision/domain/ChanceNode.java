package decision.domain;

import decision.utility.Enums;

import java.util.List;

public class ChanceNode extends StateNode {
    public ChanceNode(int index, String name, int[] informationSet, List<String> states) {
        super(index, name, informationSet, states);
    }

    @Override
    public Enums.NodeRole getRole() {
        return Enums.NodeRole.CHANCE;
    }
}
