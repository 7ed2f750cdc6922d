package decision.registry;

import decision.domain.ChanceNode;
import decision.domain.DecisionNode;
import decision.domain.StateNode;
import decision.domain.ValueNode;
import decision.path.StateSpace;
import decision.utility.Constants;
import decision.utility.Enums;
import decision.utility.OptException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;

/**
 * Collects nodes and tables and builds an InfluenceDiagram.
 * <p>
 * Nodes must be added parents first. Chance and decision nodes are indexed in the order they are added.
 * Tables are flat arrays in row-major order over the information set, with the node's own state last
 * for chance nodes.
 */
public class InfluenceDiagramBuilder {
    private final static Logger logger = LogManager.getLogger(InfluenceDiagramBuilder.class);
    private final ArrayList<StateNode> stateNodes;
    private final ArrayList<ChanceNode> chanceNodes;
    private final ArrayList<DecisionNode> decisionNodes;
    private final ArrayList<ValueNode> valueNodes;
    private final HashMap<String, StateNode> nameNodeMap;
    private final HashMap<String, ValueNode> nameValueNodeMap;
    private final HashMap<String, double[]> probabilities;
    private final HashMap<String, double[]> utilities;

    public InfluenceDiagramBuilder() {
        stateNodes = new ArrayList<>();
        chanceNodes = new ArrayList<>();
        decisionNodes = new ArrayList<>();
        valueNodes = new ArrayList<>();
        nameNodeMap = new HashMap<>();
        nameValueNodeMap = new HashMap<>();
        probabilities = new HashMap<>();
        utilities = new HashMap<>();
    }

    public InfluenceDiagramBuilder addChanceNode(String name, List<String> parents, List<String> states)
        throws OptException {
        checkNewName(name, states);
        ChanceNode node = new ChanceNode(stateNodes.size(), name, resolveParents(name, parents), states);
        stateNodes.add(node);
        chanceNodes.add(node);
        nameNodeMap.put(name, node);
        return this;
    }

    public InfluenceDiagramBuilder addDecisionNode(String name, List<String> parents, List<String> states)
        throws OptException {
        checkNewName(name, states);
        DecisionNode node = new DecisionNode(stateNodes.size(), name, resolveParents(name, parents), states);
        stateNodes.add(node);
        decisionNodes.add(node);
        nameNodeMap.put(name, node);
        return this;
    }

    public InfluenceDiagramBuilder addValueNode(String name, List<String> parents) throws OptException {
        if (nameNodeMap.containsKey(name) || nameValueNodeMap.containsKey(name))
            throw new OptException(Enums.ErrorKind.INVALID_DIAGRAM, "duplicate node name: " + name);
        ValueNode node = new ValueNode(name, resolveParents(name, parents));
        valueNodes.add(node);
        nameValueNodeMap.put(name, node);
        return this;
    }

    public InfluenceDiagramBuilder setProbabilities(String name, double[] values) {
        probabilities.put(name, values.clone());
        return this;
    }

    public InfluenceDiagramBuilder setUtilities(String name, double[] values) {
        utilities.put(name, values.clone());
        return this;
    }

    public InfluenceDiagram build() throws OptException {
        ArrayList<ProbabilityTable> probabilityTables = new ArrayList<>();
        for (ChanceNode node : chanceNodes)
            probabilityTables.add(buildProbabilityTable(node));

        ArrayList<UtilityTable> utilityTables = new ArrayList<>();
        for (ValueNode node : valueNodes)
            utilityTables.add(buildUtilityTable(node));

        InfluenceDiagram diagram = new InfluenceDiagram(new ArrayList<>(stateNodes), new ArrayList<>(chanceNodes),
            new ArrayList<>(decisionNodes), new ArrayList<>(valueNodes),
            new DefaultPathProbability(new ArrayList<>(chanceNodes), probabilityTables),
            new DefaultPathUtility(new ArrayList<>(valueNodes), utilityTables));

        logger.debug("built diagram with " + chanceNodes.size() + " chance, " + decisionNodes.size()
            + " decision and " + valueNodes.size() + " value nodes");
        return diagram;
    }

    private ProbabilityTable buildProbabilityTable(ChanceNode node) throws OptException {
        double[] values = probabilities.get(node.getName());
        if (values == null)
            throw new OptException(Enums.ErrorKind.INVALID_DIAGRAM, "no probabilities for " + node.getName());

        int[] informationSet = node.getInformationSet();
        int[] dims = new int[informationSet.length + 1];
        for (int i = 0; i < informationSet.length; ++i)
            dims[i] = stateNodes.get(informationSet[i]).getNumStates();
        dims[informationSet.length] = node.getNumStates();
        checkSize(node.getName(), dims, values);

        final int numStates = node.getNumStates();
        for (int row = 0; row < values.length / numStates; ++row) {
            double sum = 0.0;
            for (int state = 0; state < numStates; ++state) {
                double value = values[row * numStates + state];
                if (value < 0.0 || value > 1.0)
                    throw new OptException(Enums.ErrorKind.INVALID_DIAGRAM,
                        "probability " + value + " of " + node.getName() + " outside [0,1]");
                sum += value;
            }
            if (Math.abs(sum - 1.0) > Constants.PROBABILITY_TOLERANCE)
                throw new OptException(Enums.ErrorKind.INVALID_DIAGRAM,
                    "probabilities of " + node.getName() + " sum to " + sum + " in row " + row);
        }
        return new ProbabilityTable(dims, values);
    }

    private UtilityTable buildUtilityTable(ValueNode node) throws OptException {
        double[] values = utilities.get(node.getName());
        if (values == null)
            throw new OptException(Enums.ErrorKind.INVALID_DIAGRAM, "no utilities for " + node.getName());

        int[] informationSet = node.getInformationSet();
        int[] dims = new int[informationSet.length];
        for (int i = 0; i < informationSet.length; ++i)
            dims[i] = stateNodes.get(informationSet[i]).getNumStates();
        checkSize(node.getName(), dims, values);
        return new UtilityTable(dims, values);
    }

    private void checkNewName(String name, List<String> states) throws OptException {
        if (nameNodeMap.containsKey(name) || nameValueNodeMap.containsKey(name))
            throw new OptException(Enums.ErrorKind.INVALID_DIAGRAM, "duplicate node name: " + name);
        if (states == null || states.isEmpty())
            throw new OptException(Enums.ErrorKind.INVALID_DIAGRAM, "node " + name + " has no states");
    }

    private int[] resolveParents(String name, List<String> parents) throws OptException {
        int[] informationSet = new int[parents.size()];
        for (int i = 0; i < parents.size(); ++i) {
            StateNode parent = nameNodeMap.get(parents.get(i));
            if (parent == null)
                throw new OptException(Enums.ErrorKind.INVALID_DIAGRAM,
                    "parent " + parents.get(i) + " of " + name + " must be a chance or decision node added before it");
            informationSet[i] = parent.getIndex();
        }
        return informationSet;
    }

    private static void checkSize(String name, int[] dims, double[] values) throws OptException {
        final long expected = StateSpace.product(dims);
        if (values.length != expected)
            throw new OptException(Enums.ErrorKind.INVALID_DIAGRAM,
                "table of " + name + " has " + values.length + " entries, expected " + expected);
    }
}
