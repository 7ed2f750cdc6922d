package decision.main;

import decision.dao.DiagramDAO;
import decision.domain.DecisionStrategy;
import decision.model.DecisionModel;
import decision.model.DecisionModelBuilder;
import decision.model.LinearExpression;
import decision.model.ObjectiveBuilder;
import decision.output.KpiManager;
import decision.output.RiskMeasures;
import decision.output.UtilityDistribution;
import decision.output.UtilityStatistics;
import decision.path.FixedPath;
import decision.path.PathUtility;
import decision.path.ShiftedPathUtility;
import decision.registry.InfluenceDiagram;
import decision.registry.Parameters;
import decision.solver.DecisionModelSolver;
import decision.solver.Solution;
import decision.solver.StrategyExtractor;
import decision.utility.OptException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;

class Controller {
    /**
     * Class that controls the entire solution process from reading the diagram to writing output.
     */
    private final static Logger logger = LogManager.getLogger(Controller.class);
    private static final double[] REPORTED_RISK_LEVELS = {0.01, 0.05, 0.1, 0.2, 0.5, 1.0};

    private final InfluenceDiagram diagram;
    private final KpiManager kpiManager;

    private DecisionModel decisionModel;
    private Solution solution;
    private DecisionStrategy strategy;

    Controller() throws OptException {
        logger.info("Started reading data...");
        diagram = new DiagramDAO(Parameters.getDiagramPath()).getDiagram();
        kpiManager = new KpiManager(diagram);
        logger.info("completed reading data.");
    }

    Controller(InfluenceDiagram diagram) {
        this.diagram = diagram;
        kpiManager = new KpiManager(diagram);
    }

    final void buildModel() throws OptException {
        final double scale = Parameters.getProbabilityScaleFactor();
        decisionModel = new DecisionModelBuilder(diagram, new ArrayList<>(), FixedPath.empty(),
            Parameters.isUseLazyProbabilityCut(), scale).build();
        if (Parameters.isUseActivePathsCut())
            DecisionModelBuilder.addActivePathsCut(decisionModel, Parameters.getActivePathsTolerance());

        PathUtility utility = ShiftedPathUtility.apply(Parameters.getUtilityShift(), diagram.getPathUtility(),
            diagram.getStateSpace());
        ObjectiveBuilder objectiveBuilder = new ObjectiveBuilder(decisionModel, utility);
        LinearExpression objective;
        switch (Parameters.getObjectiveType()) {
            case CVAR:
                objective = objectiveBuilder.conditionalValueAtRisk(Parameters.getRiskLevel(), scale);
                break;
            case MIXED:
                objective = objectiveBuilder.mixed(Parameters.getExpectedValueWeight(), Parameters.getRiskLevel(),
                    scale);
                break;
            default:
                objective = objectiveBuilder.expectedValue(scale);
                break;
        }
        decisionModel.setObjective(objective);

        kpiManager.addKpi("number of variables", decisionModel.getNumVariables());
        kpiManager.addKpi("number of constraints", decisionModel.getNumConstraints());
    }

    final void solve() throws OptException {
        final int timeLimit = Parameters.getSolverTimeLimitInSeconds();
        DecisionModelSolver solver = new DecisionModelSolver(decisionModel, Parameters.getNumCutRounds(),
            timeLimit > 0 ? timeLimit : null);
        if (Parameters.isDebugVerbose())
            logger.info("decision model:\n" + decisionModel.getModel());
        solution = solver.solve();
        kpiManager.addKpi("solver", solution.asMap(""));
        strategy = StrategyExtractor.extract(decisionModel.getDecisionVariables(), solution);
        kpiManager.addStrategy(strategy);
    }

    final void analyze() throws OptException {
        UtilityDistribution distribution = UtilityDistribution.of(diagram, strategy);
        kpiManager.addUtilityDistribution(distribution);
        kpiManager.addKpi("risk measures", RiskMeasures.table(distribution, REPORTED_RISK_LEVELS));
        logger.info("expected utility of strategy: " + new UtilityStatistics(distribution).getMean());
    }

    final void writeOutput() throws OptException {
        kpiManager.writeOutput();
    }

    DecisionStrategy getStrategy() {
        return strategy;
    }

    Solution getSolution() {
        return solution;
    }
}
