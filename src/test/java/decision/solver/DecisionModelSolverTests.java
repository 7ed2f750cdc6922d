package decision.solver;

import decision.Diagrams;
import decision.domain.DecisionStrategy;
import decision.model.DecisionModel;
import decision.model.DecisionModelBuilder;
import decision.model.ObjectiveBuilder;
import decision.path.FixedPath;
import decision.path.ShiftedPathUtility;
import decision.registry.InfluenceDiagram;
import decision.utility.OptException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Collections;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DecisionModelSolverTests {
    private static final double TOLERANCE = 1e-4;

    private static int choice(DecisionStrategy strategy, int row) {
        return strategy.getLocalStrategies().get(0).getChoice(row);
    }

    @Test
    @DisplayName("Used car expected value should be 28 with the decision to buy")
    void testUsedCarExpectedValue() throws OptException {
        DecisionModel model = new DecisionModelBuilder(Diagrams.usedCar()).build();
        model.setObjective(new ObjectiveBuilder(model, model.getDiagram().getPathUtility()).expectedValue(1.0));
        Solution solution = new DecisionModelSolver(model).solve();

        assertTrue(solution.isFeasible());
        assertEquals(28.0, solution.getObjectiveValue(), TOLERANCE);
        DecisionStrategy strategy = StrategyExtractor.extract(model.getDecisionVariables(), solution);
        assertEquals(0, choice(strategy, 0));
    }

    @Test
    @DisplayName("Used car CVaR at 0.2 should prefer not buying")
    void testUsedCarConditionalValueAtRisk() throws OptException {
        DecisionModel model = new DecisionModelBuilder(Diagrams.usedCar()).build();
        model.setObjective(new ObjectiveBuilder(model, model.getDiagram().getPathUtility())
            .conditionalValueAtRisk(0.2, 1.0));
        Solution solution = new DecisionModelSolver(model).solve();

        assertEquals(0.0, solution.getObjectiveValue(), TOLERANCE);
        DecisionStrategy strategy = StrategyExtractor.extract(model.getDecisionVariables(), solution);
        assertEquals(1, choice(strategy, 0));
    }

    @Test
    @DisplayName("Used car CVaR at 1 should equal the expected value")
    void testUsedCarConditionalValueAtRiskOne() throws OptException {
        DecisionModel model = new DecisionModelBuilder(Diagrams.usedCar()).build();
        model.setObjective(new ObjectiveBuilder(model, model.getDiagram().getPathUtility())
            .conditionalValueAtRisk(1.0, 1.0));
        Solution solution = new DecisionModelSolver(model).solve();

        assertEquals(28.0, solution.getObjectiveValue(), TOLERANCE);
        DecisionStrategy strategy = StrategyExtractor.extract(model.getDecisionVariables(), solution);
        assertEquals(0, choice(strategy, 0));
    }

    @Test
    @DisplayName("Lazy probability cut should fire once on negative utilities")
    void testLazyProbabilityCut() throws OptException {
        InfluenceDiagram diagram = Diagrams.usedCar();
        DecisionModel model = new DecisionModelBuilder(diagram, Collections.emptyList(), FixedPath.empty(),
            true, 1.0).build();
        model.setObjective(new ObjectiveBuilder(model,
            ShiftedPathUtility.negative(diagram.getPathUtility(), diagram.getStateSpace())).expectedValue(1.0));
        Solution solution = new DecisionModelSolver(model).solve();

        assertEquals(1, solution.getNumCutsAdded());
        assertEquals(1, solution.getNumCutRounds());
        assertTrue(model.getLazyCuts().get(0).isAdded());
        assertEquals(0.2 * -161 + 0.8 * -1, solution.getObjectiveValue(), TOLERANCE);
        DecisionStrategy strategy = StrategyExtractor.extract(model.getDecisionVariables(), solution);
        assertEquals(0, choice(strategy, 0));
    }

    @Test
    @DisplayName("Health strategy should treat after a positive test and beat never treating")
    void testHealthExpectedValue() throws OptException {
        DecisionModel model = new DecisionModelBuilder(Diagrams.health()).build();
        model.setObjective(new ObjectiveBuilder(model, model.getDiagram().getPathUtility()).expectedValue(1.0));
        Solution solution = new DecisionModelSolver(model).solve();

        assertEquals(822.7, solution.getObjectiveValue(), TOLERANCE);
        assertTrue(solution.getObjectiveValue() > 811.0);
        DecisionStrategy strategy = StrategyExtractor.extract(model.getDecisionVariables(), solution);
        assertEquals(0, choice(strategy, 0));
        assertEquals(1, choice(strategy, 1));
    }

    @Test
    @DisplayName("Active paths cut should not fire on the optimal health strategy")
    void testActivePathsCut() throws OptException {
        DecisionModel model = new DecisionModelBuilder(Diagrams.health()).build();
        ActivePathsCut cut = DecisionModelBuilder.addActivePathsCut(model, 0.9);
        model.setObjective(new ObjectiveBuilder(model, model.getDiagram().getPathUtility()).expectedValue(1.0));
        Solution solution = new DecisionModelSolver(model).solve();

        assertFalse(cut.isAdded());
        assertEquals(0, solution.getNumCutRounds());
        assertEquals(822.7, solution.getObjectiveValue(), TOLERANCE);
    }

    @Test
    @DisplayName("Used car with a known peach should be solvable with eager and lazy probability constraints")
    void testUsedCarFixedPeach() throws OptException {
        for (boolean lazy : new boolean[]{false, true}) {
            InfluenceDiagram diagram = Diagrams.usedCar();
            FixedPath peach = FixedPath.of(diagram.getStateSpace(), Collections.singletonMap(0, 1));
            DecisionModel model = new DecisionModelBuilder(diagram, Collections.emptyList(), peach, lazy, 1.0)
                .build();
            model.setObjective(new ObjectiveBuilder(model, diagram.getPathUtility()).expectedValue(1.0));
            Solution solution = new DecisionModelSolver(model).solve();

            assertTrue(solution.isFeasible());
            assertEquals(60.0, solution.getObjectiveValue(), TOLERANCE);
            DecisionStrategy strategy = StrategyExtractor.extract(model.getDecisionVariables(), solution);
            assertEquals(0, choice(strategy, 0));
        }
    }

    @Test
    @DisplayName("Health with a known ill first period should treat after both test results")
    void testHealthFixedIll() throws OptException {
        InfluenceDiagram diagram = Diagrams.health();
        FixedPath ill = FixedPath.of(diagram.getStateSpace(), Collections.singletonMap(0, 0));
        DecisionModel model = new DecisionModelBuilder(diagram, Collections.emptyList(), ill, false, 1.0).build();
        model.setObjective(new ObjectiveBuilder(model, diagram.getPathUtility()).expectedValue(1.0));
        Solution solution = new DecisionModelSolver(model).solve();

        assertTrue(solution.isFeasible());
        assertEquals(-100 + 0.5 * 300 + 0.5 * 1000, solution.getObjectiveValue(), TOLERANCE);
        DecisionStrategy strategy = StrategyExtractor.extract(model.getDecisionVariables(), solution);
        assertEquals(0, choice(strategy, 0));
        assertEquals(0, choice(strategy, 1));
    }

    @Test
    @DisplayName("Active paths cut should stay quiet on a model with fixed states")
    void testActivePathsCutWithFixedStates() throws OptException {
        InfluenceDiagram diagram = Diagrams.health();
        FixedPath ill = FixedPath.of(diagram.getStateSpace(), Collections.singletonMap(0, 0));
        DecisionModel model = new DecisionModelBuilder(diagram, Collections.emptyList(), ill, false, 1.0).build();
        ActivePathsCut cut = DecisionModelBuilder.addActivePathsCut(model, 0.9);
        model.setObjective(new ObjectiveBuilder(model, diagram.getPathUtility()).expectedValue(1.0));
        Solution solution = new DecisionModelSolver(model).solve();

        assertTrue(solution.isFeasible());
        assertFalse(cut.isAdded());
        assertEquals(550.0, solution.getObjectiveValue(), TOLERANCE);
    }

    @Test
    @DisplayName("Inspection should let the buyer avoid lemons")
    void testInspectionExpectedValue() throws OptException {
        DecisionModel model = new DecisionModelBuilder(Diagrams.usedCarWithInspection()).build();
        model.setObjective(new ObjectiveBuilder(model, model.getDiagram().getPathUtility()).expectedValue(1.0));
        Solution solution = new DecisionModelSolver(model).solve();

        assertEquals(36.0, solution.getObjectiveValue(), TOLERANCE);
        DecisionStrategy strategy = StrategyExtractor.extract(model.getDecisionVariables(), solution);
        assertEquals(1, choice(strategy, 0));
        assertEquals(0, choice(strategy, 1));
    }

    @Test
    @DisplayName("Mixed objective with full expected value weight should equal the expected value")
    void testMixedObjective() throws OptException {
        DecisionModel model = new DecisionModelBuilder(Diagrams.usedCar()).build();
        model.setObjective(new ObjectiveBuilder(model, model.getDiagram().getPathUtility()).mixed(1.0, 0.2, 1.0));
        Solution solution = new DecisionModelSolver(model).solve();

        assertEquals(28.0, solution.getObjectiveValue(), TOLERANCE);
    }
}
