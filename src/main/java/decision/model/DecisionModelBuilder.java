package decision.model;

import decision.domain.DecisionNode;
import decision.domain.StateNode;
import decision.path.FixedPath;
import decision.path.ForbiddenPath;
import decision.path.Path;
import decision.path.PathProbability;
import decision.path.StateSpace;
import decision.registry.InfluenceDiagram;
import decision.solver.ActivePathsCut;
import decision.solver.ProbabilityCut;
import decision.utility.Enums;
import decision.utility.OptException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.ojalgo.optimisation.ExpressionsBasedModel;
import org.ojalgo.optimisation.Variable;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;

/**
 * Builds the decision model of an influence diagram:
 * <ul>
 *     <li>binary decision variables z with one chosen state per information state,</li>
 *     <li>path compatibility variables x_s in [0,1] for paths with positive probability,</li>
 *     <li>linking constraints that force x_s to zero on paths the strategy does not choose,</li>
 *     <li>the probability constraint sum_s x_s P(s) = 1, either added directly or as a lazy cut.</li>
 * </ul>
 */
public class DecisionModelBuilder {
    private final static Logger logger = LogManager.getLogger(DecisionModelBuilder.class);
    private final InfluenceDiagram diagram;
    private final StateSpace stateSpace;
    private final List<ForbiddenPath> forbiddenPaths;
    private final FixedPath fixedStates;
    private final boolean useLazyProbabilityCut;
    private final double probabilityScaleFactor;

    private DecisionModel decisionModel;

    public DecisionModelBuilder(InfluenceDiagram diagram) {
        this(diagram, Collections.emptyList(), FixedPath.empty(), false, 1.0);
    }

    /**
     * @param diagram                influence diagram to model.
     * @param forbiddenPaths         paths that get no variable; experimental.
     * @param fixedStates            chance states to condition on. Only paths that agree with them get a
     *                               variable and path probabilities are divided by the probability of
     *                               the fixed states.
     * @param useLazyProbabilityCut  register the probability constraint as a lazy cut instead of adding it.
     * @param probabilityScaleFactor factor applied to both sides of the probability constraint.
     */
    public DecisionModelBuilder(InfluenceDiagram diagram, List<ForbiddenPath> forbiddenPaths, FixedPath fixedStates,
                                boolean useLazyProbabilityCut, double probabilityScaleFactor) {
        this.diagram = diagram;
        this.stateSpace = diagram.getStateSpace();
        this.forbiddenPaths = new ArrayList<>(forbiddenPaths);
        this.fixedStates = fixedStates;
        this.useLazyProbabilityCut = useLazyProbabilityCut;
        this.probabilityScaleFactor = probabilityScaleFactor;
    }

    public DecisionModel build() throws OptException {
        checkScaleFactor(probabilityScaleFactor);
        checkFixedStates();
        decisionModel = new DecisionModel(new ExpressionsBasedModel(), diagram, probabilityScaleFactor);
        decisionModel.setFixedStates(fixedStates);
        decisionModel.setForbiddenPaths(forbiddenPaths);

        List<DecisionVariables> decisionVariables = buildDecisionVariables();
        decisionModel.setDecisionVariables(decisionVariables);

        PathCompatibilityVariables pathVariables = buildPathCompatibilityVariables();
        decisionModel.setPathVariables(pathVariables);

        for (DecisionVariables z : decisionVariables)
            addDecisionStrategyConstraints(z, pathVariables);

        if (useLazyProbabilityCut)
            decisionModel.registerLazyCut(new ProbabilityCut(pathVariables, probabilityScaleFactor));
        else
            decisionModel.addConstraint(buildProbabilityConstraint(pathVariables, probabilityScaleFactor));

        logger.info("decision model built with " + decisionModel.getNumVariables() + " variables and "
            + decisionModel.getNumConstraints() + " constraints");
        return decisionModel;
    }

    /**
     * Registers the experimental active paths cut on a built model.
     *
     * @param tolerance deviation of the number of active paths from its target that triggers the cut.
     * @return the registered cut.
     * @throws OptException with kind INACTIVE_CHANCE_STATES if a probability table has a zero entry or
     *                      the model has forbidden paths.
     */
    public static ActivePathsCut addActivePathsCut(DecisionModel decisionModel, double tolerance)
        throws OptException {
        InfluenceDiagram diagram = decisionModel.getDiagram();
        if (!diagram.getPathProbability().allStatesActive())
            throw new OptException(Enums.ErrorKind.INACTIVE_CHANCE_STATES,
                "active paths cut requires that no chance state has zero probability");
        if (!decisionModel.getForbiddenPaths().isEmpty())
            throw new OptException(Enums.ErrorKind.INACTIVE_CHANCE_STATES,
                "active paths cut cannot be combined with forbidden paths");

        logger.warn("active paths cut is an experimental feature");
        final FixedPath fixed = decisionModel.getFixedStates();
        long numCompatiblePaths = 1;
        for (int node : diagram.getChanceIndices())
            if (!fixed.contains(node))
                numCompatiblePaths *= diagram.getStateSpace().getNumStates(node);
        ActivePathsCut cut = new ActivePathsCut(decisionModel.getPathVariables(), numCompatiblePaths, tolerance);
        decisionModel.registerLazyCut(cut);
        return cut;
    }

    /**
     * Builds sum_s x_s P(s) * scale = scale.
     */
    public static LinearConstraint buildProbabilityConstraint(PathCompatibilityVariables x, double scale) {
        LinearExpression expr = new LinearExpression();
        for (Path path : x.getPaths())
            expr.addTerm(x.get(path), x.getProbability(path) * scale);
        return LinearConstraint.equalTo("probability_sum", expr, scale);
    }

    public static void checkScaleFactor(double scale) throws OptException {
        if (!(scale > 0))
            throw new OptException(Enums.ErrorKind.INVALID_SCALE_FACTOR,
                "probability scale factor must be positive, got " + scale);
    }

    private List<DecisionVariables> buildDecisionVariables() {
        ArrayList<DecisionVariables> decisionVariables = new ArrayList<>();
        for (DecisionNode node : diagram.getDecisionNodes()) {
            final int[] informationDims = stateSpace.getNumStates(node.getInformationSet());
            final int numRows = (int) StateSpace.product(informationDims);
            final int numStates = node.getNumStates();

            Variable[][] z = new Variable[numRows][numStates];
            for (int row = 0; row < numRows; ++row) {
                LinearExpression oneStateExpr = new LinearExpression();
                for (int state = 0; state < numStates; ++state) {
                    z[row][state] = decisionModel.newVariable("z_" + node.getName() + "_" + row + "_" + state).binary();
                    oneStateExpr.addTerm(z[row][state], 1.0);
                }
                decisionModel.addConstraint(
                    LinearConstraint.equalTo("one_state_" + node.getName() + "_" + row, oneStateExpr, 1.0));
            }
            decisionVariables.add(new DecisionVariables(node, informationDims, z));
        }
        return decisionVariables;
    }

    private PathCompatibilityVariables buildPathCompatibilityVariables() throws OptException {
        if (!forbiddenPaths.isEmpty())
            logger.warn("forbidden paths is an experimental feature");

        final PathProbability probability = diagram.getPathProbability();
        final double eventProbability = fixedEventProbability();
        PathCompatibilityVariables x = new PathCompatibilityVariables();
        int numSkipped = 0;
        for (Path path : stateSpace.paths(fixedStates)) {
            final double p = probability.probability(path);
            if (p == 0.0 || ForbiddenPath.isForbidden(path, forbiddenPaths)) {
                ++numSkipped;
                continue;
            }
            x.put(path, decisionModel.newVariable("x" + path).lower(0.0).upper(1.0), p / eventProbability);
        }
        logger.info("added " + x.size() + " path compatibility variables, skipped " + numSkipped + " paths");
        return x;
    }

    /**
     * Fixed states must belong to chance nodes whose ancestors are all chance nodes, so that their
     * probability does not depend on the strategy.
     *
     * @throws OptException with kind INVALID_FIXED_STATE otherwise.
     */
    private void checkFixedStates() throws OptException {
        int[] chanceIndices = diagram.getChanceIndices().clone();
        Arrays.sort(chanceIndices);
        for (int node : fixedStates.getNodes()) {
            if (Arrays.binarySearch(chanceIndices, node) < 0)
                throw new OptException(Enums.ErrorKind.INVALID_FIXED_STATE,
                    "only chance states can be fixed, node " + node + " is not a chance node");

            ArrayDeque<Integer> queue = new ArrayDeque<>();
            queue.add(node);
            HashSet<Integer> visited = new HashSet<>();
            while (!queue.isEmpty()) {
                StateNode current = diagram.getNode(queue.poll());
                if (current.getRole() == Enums.NodeRole.DECISION)
                    throw new OptException(Enums.ErrorKind.INVALID_FIXED_STATE, "fixed node "
                        + diagram.getNode(node).getName() + " depends on decision " + current.getName());
                for (int parent : current.getInformationSet())
                    if (visited.add(parent))
                        queue.add(parent);
            }
        }
    }

    /**
     * Every combination of decision states splits the probability mass of the fixed chance states in the
     * same way, so the mass over all matching paths is the event probability times the number of
     * decision state combinations.
     */
    private double fixedEventProbability() throws OptException {
        if (fixedStates.isEmpty())
            return 1.0;

        final PathProbability probability = diagram.getPathProbability();
        double mass = 0.0;
        for (Path path : stateSpace.paths(fixedStates))
            mass += probability.probability(path);

        double numDecisionCombinations = 1.0;
        for (DecisionNode node : diagram.getDecisionNodes())
            numDecisionCombinations *= node.getNumStates();

        final double eventProbability = mass / numDecisionCombinations;
        if (eventProbability <= 0.0)
            throw new OptException(Enums.ErrorKind.INVALID_FIXED_STATE,
                "fixed states " + fixedStates + " have zero probability");
        logger.info("probability of fixed states " + fixedStates + ": " + eventProbability);
        return eventProbability;
    }

    /**
     * For every information state s_I and state s_d of the decision node, adds
     * sum of x_s over paths with (s_I, s_d) &lt;= z[s_I][s_d] * bound.
     * <p>
     * The bound is the smaller of the number of such paths that have a variable and the number of paths
     * that can be compatible with one strategy given (s_I, s_d).
     */
    private void addDecisionStrategyConstraints(DecisionVariables z, PathCompatibilityVariables x) {
        final DecisionNode node = z.getNode();
        final int[] informationSet = node.getInformationSet();
        final int[] nodes = new int[informationSet.length + 1];
        System.arraycopy(informationSet, 0, nodes, 0, informationSet.length);
        nodes[informationSet.length] = node.getIndex();
        final int[] dims = stateSpace.getNumStates(nodes);
        final int numStates = node.getNumStates();

        final double theoreticalBound = (double) stateSpace.countPaths() / StateSpace.product(dims)
            / countOtherDecisionStates(nodes);

        HashMap<Integer, LinearExpression> sumExprs = new HashMap<>();
        HashMap<Integer, Integer> numPaths = new HashMap<>();
        for (Map.Entry<Path, Variable> entry : x.asMap().entrySet()) {
            final int key = StateSpace.linearIndex(dims, entry.getKey().subStates(nodes));
            sumExprs.computeIfAbsent(key, k -> new LinearExpression()).addTerm(entry.getValue(), 1.0);
            numPaths.merge(key, 1, Integer::sum);
        }

        for (Map.Entry<Integer, LinearExpression> entry : sumExprs.entrySet()) {
            final int key = entry.getKey();
            final int row = key / numStates;
            final int state = key % numStates;
            final double bound = Math.min(numPaths.get(key), theoreticalBound);

            LinearExpression expr = entry.getValue().addTerm(z.get(row, state), -bound);
            decisionModel.addConstraint(
                LinearConstraint.lessThan("strategy_" + node.getName() + "_" + row + "_" + state, expr, 0.0));
        }
    }

    /**
     * @return product of the state counts of the decision nodes that are not among the given nodes.
     */
    private double countOtherDecisionStates(int[] nodes) {
        double product = 1.0;
        for (DecisionNode other : diagram.getDecisionNodes()) {
            boolean listed = false;
            for (int node : nodes)
                listed |= node == other.getIndex();
            if (!listed)
                product *= other.getNumStates();
        }
        return product;
    }
}
