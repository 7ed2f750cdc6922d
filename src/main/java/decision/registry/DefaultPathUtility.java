package decision.registry;

import decision.domain.ValueNode;
import decision.path.Path;
import decision.path.PathUtility;

import java.util.List;

/**
 * Sum of the utilities of all value nodes, each read from the states of its information set.
 */
public class DefaultPathUtility implements PathUtility {
    private final List<ValueNode> valueNodes;
    private final List<UtilityTable> tables;

    DefaultPathUtility(List<ValueNode> valueNodes, List<UtilityTable> tables) {
        this.valueNodes = valueNodes;
        this.tables = tables;
    }

    @Override
    public double utility(Path path) {
        double utility = 0.0;
        for (int i = 0; i < valueNodes.size(); ++i)
            utility += tables.get(i).get(path.subStates(valueNodes.get(i).getInformationSet()));
        return utility;
    }
}
