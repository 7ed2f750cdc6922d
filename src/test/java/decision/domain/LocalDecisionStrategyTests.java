package decision.domain;

import decision.utility.Enums;
import decision.utility.OptException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class LocalDecisionStrategyTests {
    private final DecisionNode node = new DecisionNode(2, "D", new int[]{0, 1}, Arrays.asList("a", "b", "c"));
    private final int[] informationDims = {2, 2};

    @Test
    @DisplayName("Strategy should pick the state marked in the row of the information state")
    void testDecide() throws OptException {
        int[][] data = {{1, 0, 0}, {0, 0, 1}, {0, 1, 0}, {1, 0, 0}};
        LocalDecisionStrategy strategy = LocalDecisionStrategy.of(node, informationDims, data);

        assertEquals(0, strategy.decide(new int[]{0, 0}));
        assertEquals(2, strategy.decide(new int[]{0, 1}));
        assertEquals(1, strategy.decide(new int[]{1, 0}));
        assertEquals(0, strategy.decide(new int[]{1, 1}));
        assertEquals(4, strategy.getNumRows());
    }

    @Test
    @DisplayName("Strategy built from choices should have one 1 per row")
    void testFromChoices() throws OptException {
        LocalDecisionStrategy strategy = LocalDecisionStrategy.fromChoices(node, informationDims,
            new int[]{2, 2, 0, 1});
        assertArrayEquals(new int[]{0, 0, 1}, strategy.getData()[0]);
        assertArrayEquals(new int[]{0, 1, 0}, strategy.getData()[3]);
    }

    @Test
    @DisplayName("Row selecting two states should be rejected")
    void testTwoStatesInRow() {
        int[][] data = {{1, 1, 0}, {0, 0, 1}, {0, 1, 0}, {1, 0, 0}};
        OptException ex = assertThrows(OptException.class,
            () -> LocalDecisionStrategy.of(node, informationDims, data));
        assertEquals(Enums.ErrorKind.MALFORMED_STRATEGY, ex.getKind());
    }

    @Test
    @DisplayName("Row selecting no state should be rejected")
    void testEmptyRow() {
        int[][] data = {{0, 0, 0}, {0, 0, 1}, {0, 1, 0}, {1, 0, 0}};
        OptException ex = assertThrows(OptException.class,
            () -> LocalDecisionStrategy.of(node, informationDims, data));
        assertEquals(Enums.ErrorKind.MALFORMED_STRATEGY, ex.getKind());
    }

    @Test
    @DisplayName("Table with the wrong number of rows should be rejected")
    void testWrongShape() {
        int[][] data = {{1, 0, 0}};
        OptException ex = assertThrows(OptException.class,
            () -> LocalDecisionStrategy.of(node, informationDims, data));
        assertEquals(Enums.ErrorKind.MALFORMED_STRATEGY, ex.getKind());
    }

    @Test
    @DisplayName("Decision strategy should order local strategies by node index")
    void testStrategyOrder() throws OptException {
        DecisionNode first = new DecisionNode(0, "A", new int[0], Arrays.asList("x", "y"));
        LocalDecisionStrategy late = LocalDecisionStrategy.fromChoices(node, informationDims, new int[]{0, 0, 0, 0});
        LocalDecisionStrategy early = LocalDecisionStrategy.fromChoices(first, new int[0], new int[]{1});
        DecisionStrategy strategy = new DecisionStrategy(Arrays.asList(late, early));

        assertEquals(first, strategy.getLocalStrategies().get(0).getNode());
        assertEquals(1, strategy.getLocalStrategy(first).decide(new int[0]));
        assertEquals(Collections.singletonList("x"), first.getStates().subList(0, 1));
    }
}
