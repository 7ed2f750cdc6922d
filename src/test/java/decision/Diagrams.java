package decision;

import decision.registry.InfluenceDiagram;
import decision.registry.InfluenceDiagramBuilder;
import decision.utility.OptException;

import java.util.Arrays;
import java.util.Collections;

/**
 * Small diagrams shared by the tests.
 */
public class Diagrams {
    private Diagrams() {}

    /**
     * O (lemon, peach) -&gt; V &lt;- A (buy, dont_buy). Buying pays 60 for a peach and -100 for a lemon.
     */
    public static InfluenceDiagram usedCar() throws OptException {
        return new InfluenceDiagramBuilder()
            .addChanceNode("O", Collections.emptyList(), Arrays.asList("lemon", "peach"))
            .addDecisionNode("A", Collections.emptyList(), Arrays.asList("buy", "dont_buy"))
            .addValueNode("V", Arrays.asList("O", "A"))
            .setProbabilities("O", new double[]{0.2, 0.8})
            .setUtilities("V", new double[]{-100, 0, 60, 0})
            .build();
    }

    /**
     * Two period pig breeding style health problem: H1 -&gt; T1 -&gt; D1 -&gt; H2, treatment costs 100 and
     * the final health pays 300 (ill) or 1000 (healthy).
     */
    public static InfluenceDiagram health() throws OptException {
        return new InfluenceDiagramBuilder()
            .addChanceNode("H1", Collections.emptyList(), Arrays.asList("ill", "healthy"))
            .addChanceNode("T1", Collections.singletonList("H1"), Arrays.asList("positive", "negative"))
            .addDecisionNode("D1", Collections.singletonList("T1"), Arrays.asList("treat", "pass"))
            .addValueNode("C1", Collections.singletonList("D1"))
            .addChanceNode("H2", Arrays.asList("H1", "D1"), Arrays.asList("ill", "healthy"))
            .addValueNode("MP", Collections.singletonList("H2"))
            .setProbabilities("H1", new double[]{0.1, 0.9})
            .setProbabilities("T1", new double[]{0.8, 0.2, 0.1, 0.9})
            .setProbabilities("H2", new double[]{0.5, 0.5, 0.9, 0.1, 0.1, 0.9, 0.2, 0.8})
            .setUtilities("C1", new double[]{-100, 0})
            .setUtilities("MP", new double[]{300, 1000})
            .build();
    }

    /**
     * Used car diagram whose inspection never reports a lemon as a peach, so one probability entry is zero.
     */
    public static InfluenceDiagram usedCarWithInspection() throws OptException {
        return new InfluenceDiagramBuilder()
            .addChanceNode("O", Collections.emptyList(), Arrays.asList("lemon", "peach"))
            .addChanceNode("R", Collections.singletonList("O"), Arrays.asList("bad", "good"))
            .addDecisionNode("A", Collections.singletonList("R"), Arrays.asList("buy", "dont_buy"))
            .addValueNode("V", Arrays.asList("O", "A"))
            .setProbabilities("O", new double[]{0.2, 0.8})
            .setProbabilities("R", new double[]{1.0, 0.0, 0.25, 0.75})
            .setUtilities("V", new double[]{-100, 0, 60, 0})
            .build();
    }
}
