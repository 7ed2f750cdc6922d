package decision.output;

import decision.domain.DecisionStrategy;
import decision.domain.StateNode;
import decision.path.CompatiblePaths;
import decision.path.FixedPath;
import decision.path.Path;
import decision.path.PathProbability;
import decision.registry.InfluenceDiagram;
import decision.utility.Enums;
import decision.utility.OptException;

import java.util.List;

/**
 * Marginal state probabilities of every node under a fixed strategy, optionally conditioned on fixed
 * chance states.
 */
public class StateProbabilities {
    private final double[][] probabilities;
    private final FixedPath fixed;
    private final double eventProbability;

    private StateProbabilities(double[][] probabilities, FixedPath fixed, double eventProbability) {
        this.probabilities = probabilities;
        this.fixed = fixed;
        this.eventProbability = eventProbability;
    }

    public static StateProbabilities of(InfluenceDiagram diagram, DecisionStrategy strategy) throws OptException {
        return accumulate(diagram, strategy, FixedPath.empty(), 1.0);
    }

    /**
     * Conditions a previous result on one more chance state. Chained calls condition on all fixed states.
     *
     * @param prior result that holds the probability of the new conditioning state.
     * @throws OptException with kind INVALID_FIXED_STATE if the node is not a chance node, the state
     *                      is out of range, or the conditioning event has zero probability.
     */
    public static StateProbabilities of(InfluenceDiagram diagram, DecisionStrategy strategy, int node, int state,
                                        StateProbabilities prior) throws OptException {
        FixedPath fixed = prior.fixed.with(diagram.getStateSpace(), node, state);
        final double eventProbability = prior.eventProbability * prior.get(node)[state];
        if (eventProbability <= 0.0)
            throw new OptException(Enums.ErrorKind.INVALID_FIXED_STATE,
                "cannot condition on state " + state + " of node " + node + " with zero probability");
        return accumulate(diagram, strategy, fixed, eventProbability);
    }

    public static StateProbabilities of(InfluenceDiagram diagram, DecisionStrategy strategy, int node, int state)
        throws OptException {
        return of(diagram, strategy, node, state, of(diagram, strategy));
    }

    public static StateProbabilities of(InfluenceDiagram diagram, DecisionStrategy strategy, String nodeName,
                                        String stateName, StateProbabilities prior) throws OptException {
        return of(diagram, strategy, diagram.getNode(nodeName).getIndex(),
            diagram.getStateIndex(nodeName, stateName), prior);
    }

    public static StateProbabilities of(InfluenceDiagram diagram, DecisionStrategy strategy, String nodeName,
                                        String stateName) throws OptException {
        return of(diagram, strategy, nodeName, stateName, of(diagram, strategy));
    }

    private static StateProbabilities accumulate(InfluenceDiagram diagram, DecisionStrategy strategy,
                                                 FixedPath fixed, double eventProbability) throws OptException {
        final List<StateNode> nodes = diagram.getStateNodes();
        final PathProbability probability = diagram.getPathProbability();
        double[][] probabilities = new double[nodes.size()][];
        for (StateNode node : nodes)
            probabilities[node.getIndex()] = new double[node.getNumStates()];

        for (Path path : CompatiblePaths.of(diagram, strategy, fixed)) {
            final double p = probability.probability(path) / eventProbability;
            for (int i = 0; i < path.length(); ++i)
                probabilities[i][path.get(i)] += p;
        }
        return new StateProbabilities(probabilities, fixed, eventProbability);
    }

    /**
     * @return probability of every state of the node.
     */
    public double[] get(int node) {
        return probabilities[node].clone();
    }

    public double get(int node, int state) {
        return probabilities[node][state];
    }

    public FixedPath getFixed() {
        return fixed;
    }

    /**
     * @return probability of the fixed states, 1 for the unconditional case.
     */
    public double getEventProbability() {
        return eventProbability;
    }
}
