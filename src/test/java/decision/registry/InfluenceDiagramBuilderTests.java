package decision.registry;

import decision.Diagrams;
import decision.path.Path;
import decision.utility.Enums;
import decision.utility.OptException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InfluenceDiagramBuilderTests {

    @Test
    @DisplayName("Nodes should be indexed in the order they are added")
    void testIndices() throws OptException {
        InfluenceDiagram diagram = Diagrams.health();
        assertEquals(4, diagram.getStateSpace().size());
        assertArrayEquals(new int[]{0, 1, 3}, diagram.getChanceIndices());
        assertEquals(2, diagram.getNode("D1").getIndex());
        assertEquals(1, diagram.getStateIndex("T1", "negative"));
        assertEquals(2, diagram.getValueNodes().size());
        assertEquals(16, diagram.getStateSpace().countPaths());
    }

    @Test
    @DisplayName("Path probability should multiply the conditional probabilities of chance states")
    void testPathProbability() throws OptException {
        InfluenceDiagram diagram = Diagrams.health();
        DefaultPathProbability probability = diagram.getPathProbability();
        assertEquals(0.1 * 0.8 * 0.5, probability.probability(new Path(0, 0, 0, 1)), 1e-12);
        assertEquals(0.9 * 0.9 * 0.8, probability.probability(new Path(1, 1, 1, 1)), 1e-12);
        assertTrue(probability.allStatesActive());
    }

    @Test
    @DisplayName("Zero entry in a probability table should make some states inactive")
    void testInactiveStates() throws OptException {
        InfluenceDiagram diagram = Diagrams.usedCarWithInspection();
        assertFalse(diagram.getPathProbability().allStatesActive());
        assertEquals(0.0, diagram.getPathProbability().probability(new Path(0, 1, 0)), 0.0);
    }

    @Test
    @DisplayName("Probabilities that do not sum to one should be rejected")
    void testProbabilitySum() {
        InfluenceDiagramBuilder builder = new InfluenceDiagramBuilder();
        OptException ex = assertThrows(OptException.class, () -> builder
            .addChanceNode("O", Collections.emptyList(), Arrays.asList("a", "b"))
            .setProbabilities("O", new double[]{0.3, 0.3})
            .build());
        assertEquals(Enums.ErrorKind.INVALID_DIAGRAM, ex.getKind());
    }

    @Test
    @DisplayName("Parent that was not added before should be rejected")
    void testUnknownParent() {
        InfluenceDiagramBuilder builder = new InfluenceDiagramBuilder();
        OptException ex = assertThrows(OptException.class,
            () -> builder.addDecisionNode("A", Collections.singletonList("O"), Arrays.asList("a", "b")));
        assertEquals(Enums.ErrorKind.INVALID_DIAGRAM, ex.getKind());
    }

    @Test
    @DisplayName("Utility table of the wrong size should be rejected")
    void testUtilityTableSize() {
        InfluenceDiagramBuilder builder = new InfluenceDiagramBuilder();
        OptException ex = assertThrows(OptException.class, () -> builder
            .addDecisionNode("A", Collections.emptyList(), Arrays.asList("a", "b"))
            .addValueNode("V", Collections.singletonList("A"))
            .setUtilities("V", new double[]{1, 2, 3})
            .build());
        assertEquals(Enums.ErrorKind.INVALID_DIAGRAM, ex.getKind());
    }
}
