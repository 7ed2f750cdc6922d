package decision.registry;

import decision.domain.ChanceNode;
import decision.domain.DecisionNode;
import decision.domain.StateNode;
import decision.domain.ValueNode;
import decision.path.PathUtility;
import decision.path.StateSpace;
import decision.utility.Enums;
import decision.utility.OptException;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;

public class InfluenceDiagram {
    /**
     * Holds the nodes, state space and path functions of an influence diagram.
     * Created once by InfluenceDiagramBuilder and read-only thereafter.
     */
    private final List<StateNode> stateNodes;
    private final List<ChanceNode> chanceNodes;
    private final List<DecisionNode> decisionNodes;
    private final List<ValueNode> valueNodes;
    private final HashMap<String, StateNode> nameNodeMap;
    private final StateSpace stateSpace;
    private final DefaultPathProbability pathProbability;
    private final DefaultPathUtility pathUtility;

    InfluenceDiagram(List<StateNode> stateNodes, List<ChanceNode> chanceNodes, List<DecisionNode> decisionNodes,
                     List<ValueNode> valueNodes, DefaultPathProbability pathProbability,
                     DefaultPathUtility pathUtility) {
        this.stateNodes = Collections.unmodifiableList(stateNodes);
        this.chanceNodes = Collections.unmodifiableList(chanceNodes);
        this.decisionNodes = Collections.unmodifiableList(decisionNodes);
        this.valueNodes = Collections.unmodifiableList(valueNodes);
        this.pathProbability = pathProbability;
        this.pathUtility = pathUtility;

        nameNodeMap = new HashMap<>();
        int[] numStates = new int[stateNodes.size()];
        for (StateNode node : stateNodes) {
            nameNodeMap.put(node.getName(), node);
            numStates[node.getIndex()] = node.getNumStates();
        }
        stateSpace = new StateSpace(numStates);
    }

    public StateSpace getStateSpace() {
        return stateSpace;
    }

    public List<StateNode> getStateNodes() {
        return stateNodes;
    }

    public List<ChanceNode> getChanceNodes() {
        return chanceNodes;
    }

    public List<DecisionNode> getDecisionNodes() {
        return decisionNodes;
    }

    public List<ValueNode> getValueNodes() {
        return valueNodes;
    }

    public int[] getChanceIndices() {
        return chanceNodes.stream().mapToInt(ChanceNode::getIndex).toArray();
    }

    public DefaultPathProbability getPathProbability() {
        return pathProbability;
    }

    public PathUtility getPathUtility() {
        return pathUtility;
    }

    public StateNode getNode(int index) {
        return stateNodes.get(index);
    }

    public StateNode getNode(String name) throws OptException {
        StateNode node = nameNodeMap.get(name);
        if (node == null)
            throw new OptException(Enums.ErrorKind.INVALID_DIAGRAM, "unknown node: " + name);
        return node;
    }

    public int getStateIndex(String nodeName, String stateName) throws OptException {
        StateNode node = getNode(nodeName);
        int state = node.indexOfState(stateName);
        if (state < 0)
            throw new OptException(Enums.ErrorKind.INVALID_DIAGRAM,
                "node " + nodeName + " has no state " + stateName);
        return state;
    }
}
