package decision.path;

import decision.Diagrams;
import decision.domain.DecisionNode;
import decision.domain.DecisionStrategy;
import decision.domain.LocalDecisionStrategy;
import decision.registry.InfluenceDiagram;
import decision.utility.Enums;
import decision.utility.OptException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class CompatiblePathsTests {
    private final InfluenceDiagram diagram;
    private final DecisionStrategy treatIfPositive;

    CompatiblePathsTests() throws OptException {
        diagram = Diagrams.health();
        DecisionNode d1 = diagram.getDecisionNodes().get(0);
        treatIfPositive = new DecisionStrategy(Collections.singletonList(
            LocalDecisionStrategy.fromChoices(d1, new int[]{2}, new int[]{0, 1})));
    }

    private static List<Path> collect(CompatiblePaths compatiblePaths) {
        List<Path> paths = new ArrayList<>();
        for (Path path : compatiblePaths)
            paths.add(path);
        return paths;
    }

    @Test
    @DisplayName("Number of compatible paths should be the product of chance state counts")
    void testSize() throws OptException {
        CompatiblePaths compatiblePaths = CompatiblePaths.of(diagram, treatIfPositive);
        List<Path> paths = collect(compatiblePaths);

        assertEquals(8, compatiblePaths.size());
        assertEquals(8, paths.size());
        assertEquals(8, new HashSet<>(paths).size());
    }

    @Test
    @DisplayName("Decision states should follow the strategy")
    void testDecisionsFollowStrategy() throws OptException {
        for (Path path : CompatiblePaths.of(diagram, treatIfPositive))
            assertEquals(path.get(1), path.get(2));
    }

    @Test
    @DisplayName("Iterating twice should give the same sequence")
    void testRestartable() throws OptException {
        CompatiblePaths compatiblePaths = CompatiblePaths.of(diagram, treatIfPositive);
        List<Path> first = collect(compatiblePaths);
        assertEquals(first, collect(compatiblePaths));
        assertEquals(new Path(0, 0, 0, 0), first.get(0));
        assertEquals(new Path(0, 0, 0, 1), first.get(1));
        assertEquals(new Path(0, 1, 1, 0), first.get(2));
    }

    @Test
    @DisplayName("Fixed chance states should reduce the number of compatible paths")
    void testFixedChanceState() throws OptException {
        Map<Integer, Integer> fixed = new HashMap<>();
        fixed.put(0, 1);
        CompatiblePaths compatiblePaths = CompatiblePaths.of(diagram, treatIfPositive,
            FixedPath.of(diagram.getStateSpace(), fixed));

        assertEquals(4, compatiblePaths.size());
        List<Path> paths = collect(compatiblePaths);
        assertEquals(4, paths.size());
        for (Path path : paths)
            assertEquals(1, path.get(0));
    }

    @Test
    @DisplayName("Fixing a decision state should fail")
    void testFixedDecisionState() throws OptException {
        Map<Integer, Integer> fixed = new HashMap<>();
        fixed.put(2, 0);
        FixedPath fixedPath = FixedPath.of(diagram.getStateSpace(), fixed);
        OptException ex = assertThrows(OptException.class,
            () -> CompatiblePaths.of(diagram, treatIfPositive, fixedPath));
        assertEquals(Enums.ErrorKind.INVALID_FIXED_STATE, ex.getKind());
    }
}
