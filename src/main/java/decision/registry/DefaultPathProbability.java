package decision.registry;

import decision.domain.ChanceNode;
import decision.path.Path;
import decision.path.PathProbability;

import java.util.List;

/**
 * Product of the conditional probabilities of the chance states on a path.
 */
public class DefaultPathProbability implements PathProbability {
    private final List<ChanceNode> chanceNodes;
    private final List<ProbabilityTable> tables;

    DefaultPathProbability(List<ChanceNode> chanceNodes, List<ProbabilityTable> tables) {
        this.chanceNodes = chanceNodes;
        this.tables = tables;
    }

    @Override
    public double probability(Path path) {
        double probability = 1.0;
        for (int i = 0; i < chanceNodes.size(); ++i) {
            ChanceNode node = chanceNodes.get(i);
            probability *= tables.get(i).get(path.subStates(node.getInformationSet()), path.get(node.getIndex()));
            if (probability == 0.0)
                return 0.0;
        }
        return probability;
    }

    /**
     * @return true if no probability table contains a zero entry.
     */
    public boolean allStatesActive() {
        for (ProbabilityTable table : tables)
            if (table.hasStructuralZeros())
                return false;
        return true;
    }
}
