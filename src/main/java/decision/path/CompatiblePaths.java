package decision.path;

import decision.domain.DecisionStrategy;
import decision.domain.LocalDecisionStrategy;
import decision.registry.InfluenceDiagram;
import decision.utility.Enums;
import decision.utility.OptException;

import java.util.Arrays;
import java.util.Iterator;
import java.util.List;

/**
 * Lazy, restartable sequence of the paths that are compatible with a decision strategy.
 * <p>
 * Chance states are enumerated over the Cartesian product of the chance node domains in ascending node
 * order (last chance node fastest), with fixed chance nodes reduced to their fixed state. Decision states
 * are then filled in node order by evaluating each local strategy on the states of its information set.
 */
public class CompatiblePaths implements Iterable<Path> {
    private final StateSpace stateSpace;
    private final int[] chanceNodes;
    private final DecisionStrategy strategy;
    private final FixedPath fixed;

    private CompatiblePaths(StateSpace stateSpace, int[] chanceNodes, DecisionStrategy strategy, FixedPath fixed) {
        this.stateSpace = stateSpace;
        this.chanceNodes = chanceNodes;
        this.strategy = strategy;
        this.fixed = fixed;
    }

    /**
     * @param stateSpace  state counts of all chance and decision nodes.
     * @param chanceNodes indices of the chance nodes.
     * @param strategy    strategy that sets the decision states.
     * @param fixed       states of chance nodes to hold fixed.
     * @throws OptException with kind INVALID_FIXED_STATE if a fixed node is not a chance node.
     */
    public static CompatiblePaths of(StateSpace stateSpace, int[] chanceNodes, DecisionStrategy strategy,
                                     FixedPath fixed) throws OptException {
        int[] sorted = chanceNodes.clone();
        Arrays.sort(sorted);
        for (int node : fixed.getNodes())
            if (Arrays.binarySearch(sorted, node) < 0)
                throw new OptException(Enums.ErrorKind.INVALID_FIXED_STATE,
                    "only chance states can be fixed, node " + node + " is not a chance node");
        return new CompatiblePaths(stateSpace, sorted, strategy, fixed);
    }

    public static CompatiblePaths of(InfluenceDiagram diagram, DecisionStrategy strategy, FixedPath fixed)
        throws OptException {
        return of(diagram.getStateSpace(), diagram.getChanceIndices(), strategy, fixed);
    }

    public static CompatiblePaths of(InfluenceDiagram diagram, DecisionStrategy strategy) throws OptException {
        return of(diagram, strategy, FixedPath.empty());
    }

    /**
     * @return number of compatible paths, computed without enumerating them.
     */
    public long size() {
        long count = 1;
        for (int node : chanceNodes)
            if (!fixed.contains(node))
                count *= stateSpace.getNumStates(node);
        return count;
    }

    public FixedPath getFixed() {
        return fixed;
    }

    @Override
    public Iterator<Path> iterator() {
        final int[] dims = stateSpace.getNumStates(chanceNodes);
        final int[] pins = PathEnumerator.freePins(chanceNodes.length);
        for (int i = 0; i < chanceNodes.length; ++i)
            if (fixed.contains(chanceNodes[i]))
                pins[i] = fixed.getState(chanceNodes[i]);

        final PathEnumerator enumerator = new PathEnumerator(dims, pins);
        final List<LocalDecisionStrategy> localStrategies = strategy.getLocalStrategies();

        return new Iterator<Path>() {
            @Override
            public boolean hasNext() {
                return enumerator.hasNext();
            }

            @Override
            public Path next() {
                int[] chanceStates = enumerator.next();
                int[] states = new int[stateSpace.size()];
                for (int i = 0; i < chanceNodes.length; ++i)
                    states[chanceNodes[i]] = chanceStates[i];

                for (LocalDecisionStrategy z : localStrategies) {
                    int[] informationSet = z.getNode().getInformationSet();
                    int[] informationStates = new int[informationSet.length];
                    for (int i = 0; i < informationSet.length; ++i)
                        informationStates[i] = states[informationSet[i]];
                    states[z.getNode().getIndex()] = z.decide(informationStates);
                }
                return new Path(states);
            }
        };
    }
}
