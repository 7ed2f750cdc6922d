package decision.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * One local strategy per decision node, ordered by node index. Immutable.
 */
public class DecisionStrategy {
    private final List<LocalDecisionStrategy> localStrategies;

    public DecisionStrategy(List<LocalDecisionStrategy> localStrategies) {
        ArrayList<LocalDecisionStrategy> sorted = new ArrayList<>(localStrategies);
        sorted.sort(Comparator.comparingInt(z -> z.getNode().getIndex()));
        this.localStrategies = Collections.unmodifiableList(sorted);
    }

    public List<LocalDecisionStrategy> getLocalStrategies() {
        return localStrategies;
    }

    public LocalDecisionStrategy getLocalStrategy(DecisionNode node) {
        for (LocalDecisionStrategy z : localStrategies)
            if (z.getNode().equals(node))
                return z;
        throw new IllegalArgumentException("no strategy for " + node);
    }

    @Override
    public String toString() {
        return localStrategies.toString();
    }
}
