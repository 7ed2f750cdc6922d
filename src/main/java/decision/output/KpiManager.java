package decision.output;

import decision.domain.DecisionStrategy;
import decision.domain.LocalDecisionStrategy;
import decision.registry.InfluenceDiagram;
import decision.registry.Parameters;
import decision.utility.OptException;
import decision.utility.Util;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeMap;

/**
 * Used to write input and output KPIs of a single run.
 */
public class KpiManager {
    private final static Logger logger = LogManager.getLogger(KpiManager.class);
    private final InfluenceDiagram diagram;
    private final TreeMap<String, Object> kpis;

    public KpiManager(InfluenceDiagram diagram) {
        this.diagram = diagram;
        kpis = new TreeMap<>();
    }

    public void addKpi(String key, Object value) {
        kpis.put(key, value);
    }

    public void addStrategy(DecisionStrategy strategy) {
        TreeMap<String, Object> strategyKpis = new TreeMap<>();
        for (LocalDecisionStrategy z : strategy.getLocalStrategies()) {
            List<String> states = z.getNode().getStates();
            ArrayList<String> choices = new ArrayList<>();
            for (int row = 0; row < z.getNumRows(); ++row)
                choices.add(states.get(z.getChoice(row)));
            strategyKpis.put(z.getNode().getName(), choices);
        }
        kpis.put("strategy", strategyKpis);
    }

    public void addUtilityDistribution(UtilityDistribution distribution) {
        TreeMap<String, Object> distributionKpis = new TreeMap<>();
        distributionKpis.put("utilities", Util.toList(distribution.getUtilities()));
        distributionKpis.put("probabilities", Util.toList(distribution.getProbabilities()));
        kpis.put("utilityDistribution", distributionKpis);
        kpis.put("statistics", new UtilityStatistics(distribution).asMap());
    }

    public TreeMap<String, Object> getKpis() {
        TreeMap<String, Object> allKpis = new TreeMap<>();
        allKpis.put("input", getInputKpis());
        allKpis.put("output", new TreeMap<>(kpis));
        return allKpis;
    }

    public void writeOutput() throws OptException {
        Util.writeToYaml(getKpis(), Parameters.getOutputPath() + "/kpis.yaml");
        logger.info("solution processing completed.");
    }

    private TreeMap<String, Object> getInputKpis() {
        TreeMap<String, Object> inputKpis = new TreeMap<>(Parameters.asMap());
        inputKpis.put("number of chance nodes", diagram.getChanceNodes().size());
        inputKpis.put("number of decision nodes", diagram.getDecisionNodes().size());
        inputKpis.put("number of value nodes", diagram.getValueNodes().size());
        inputKpis.put("number of paths", diagram.getStateSpace().countPaths());
        return inputKpis;
    }
}
