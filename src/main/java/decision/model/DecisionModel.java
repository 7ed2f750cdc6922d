package decision.model;

import decision.path.FixedPath;
import decision.path.ForbiddenPath;
import decision.registry.InfluenceDiagram;
import decision.solver.LazyCut;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.ojalgo.optimisation.Expression;
import org.ojalgo.optimisation.ExpressionsBasedModel;
import org.ojalgo.optimisation.Variable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Holds the solver model of an influence diagram together with its decision variables, path
 * compatibility variables, registered lazy cuts and objective.
 * <p>
 * Not thread-safe. A model is built and solved from a single thread.
 */
public class DecisionModel {
    private final static Logger logger = LogManager.getLogger(DecisionModel.class);
    private final ExpressionsBasedModel model;
    private final InfluenceDiagram diagram;
    private final double probabilityScaleFactor;
    private final ArrayList<LazyCut> lazyCuts;

    private FixedPath fixedStates = FixedPath.empty();
    private List<ForbiddenPath> forbiddenPaths = Collections.emptyList();
    private List<DecisionVariables> decisionVariables;
    private PathCompatibilityVariables pathVariables;
    private LinearExpression objective;
    private int numConstraints;

    DecisionModel(ExpressionsBasedModel model, InfluenceDiagram diagram, double probabilityScaleFactor) {
        this.model = model;
        this.diagram = diagram;
        this.probabilityScaleFactor = probabilityScaleFactor;
        lazyCuts = new ArrayList<>();
        numConstraints = 0;
    }

    void setDecisionVariables(List<DecisionVariables> decisionVariables) {
        this.decisionVariables = Collections.unmodifiableList(decisionVariables);
    }

    void setFixedStates(FixedPath fixedStates) {
        this.fixedStates = fixedStates;
    }

    void setForbiddenPaths(List<ForbiddenPath> forbiddenPaths) {
        this.forbiddenPaths = Collections.unmodifiableList(new ArrayList<>(forbiddenPaths));
    }

    void setPathVariables(PathCompatibilityVariables pathVariables) {
        this.pathVariables = pathVariables;
    }

    public ExpressionsBasedModel getModel() {
        return model;
    }

    public InfluenceDiagram getDiagram() {
        return diagram;
    }

    public double getProbabilityScaleFactor() {
        return probabilityScaleFactor;
    }

    public List<DecisionVariables> getDecisionVariables() {
        return decisionVariables;
    }

    /**
     * @return chance states the model is conditioned on.
     */
    public FixedPath getFixedStates() {
        return fixedStates;
    }

    public List<ForbiddenPath> getForbiddenPaths() {
        return forbiddenPaths;
    }

    public PathCompatibilityVariables getPathVariables() {
        return pathVariables;
    }

    Variable newVariable(String name) {
        return model.newVariable(name);
    }

    /**
     * Adds a constraint to the model. Also used by lazy cuts to submit the constraints they generate.
     */
    public void addConstraint(LinearConstraint constraint) {
        constraint.addTo(model);
        ++numConstraints;
    }

    public void registerLazyCut(LazyCut lazyCut) {
        lazyCuts.add(lazyCut);
    }

    public List<LazyCut> getLazyCuts() {
        return Collections.unmodifiableList(lazyCuts);
    }

    /**
     * Installs the expression to maximise. A model has exactly one objective.
     */
    public void setObjective(LinearExpression objective) {
        if (this.objective != null)
            throw new IllegalStateException("objective already set");
        this.objective = objective;

        Expression objectiveExpr = model.newExpression("objective");
        for (Map.Entry<Variable, Double> term : objective.getTerms().entrySet())
            objectiveExpr.set(term.getKey(), term.getValue());
        objectiveExpr.weight(1.0);
        logger.debug("objective set with " + objective.getTerms().size() + " terms");
    }

    public LinearExpression getObjective() {
        return objective;
    }

    public int getNumVariables() {
        return model.getVariables().size();
    }

    public int getNumConstraints() {
        return numConstraints;
    }
}
