package decision.model;

import decision.path.Path;
import decision.path.PathUtility;
import decision.utility.Enums;
import decision.utility.OptException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.ojalgo.optimisation.Variable;

import java.util.Arrays;
import java.util.Map;

/**
 * Builds objective expressions over the path compatibility variables of a decision model.
 */
public class ObjectiveBuilder {
    private final static Logger logger = LogManager.getLogger(ObjectiveBuilder.class);
    private final DecisionModel decisionModel;
    private final PathCompatibilityVariables x;
    private final PathUtility utility;

    private Variable eta;
    private int numRiskObjectives;

    public ObjectiveBuilder(DecisionModel decisionModel, PathUtility utility) {
        this.decisionModel = decisionModel;
        this.x = decisionModel.getPathVariables();
        this.utility = utility;
        numRiskObjectives = 0;
    }

    /**
     * @return sum_s P(s) x_s U(s) * scale.
     * @throws OptException with kind INVALID_SCALE_FACTOR if scale is not positive.
     */
    public LinearExpression expectedValue(double scale) throws OptException {
        DecisionModelBuilder.checkScaleFactor(scale);
        LinearExpression expr = new LinearExpression();
        for (Map.Entry<Path, Variable> entry : x.asMap().entrySet()) {
            final Path path = entry.getKey();
            expr.addTerm(entry.getValue(), x.getProbability(path) * utility.utility(path) * scale);
        }
        return expr;
    }

    /**
     * Adds the variables and constraints that select the alpha tail of the utility distribution and
     * returns the conditional value-at-risk expression.
     * <p>
     * eta is the value-at-risk candidate. For every path s with utility u, lambda_s is forced to 1 when
     * u &lt; eta and lambda'_s is forced to 1 when u &lt;= eta, the two separated by epsilon. rho'_s is the
     * probability mass of s taken into the tail and rho_s the part of it that lies strictly below eta.
     * Probability masses are multiplied by scale.
     *
     * @param alpha risk level in (0, 1].
     * @param scale positive probability scale factor.
     * @return (sum_s rho'_s u_s) / (alpha * scale).
     */
    public LinearExpression conditionalValueAtRisk(double alpha, double scale) throws OptException {
        if (!(alpha > 0.0 && alpha <= 1.0))
            throw new OptException(Enums.ErrorKind.INVALID_RISK_LEVEL,
                "risk level must be in (0, 1], got " + alpha);
        DecisionModelBuilder.checkScaleFactor(scale);

        final Path[] paths = x.getPaths().toArray(new Path[0]);
        final double[] utilities = new double[paths.length];
        for (int i = 0; i < paths.length; ++i)
            utilities[i] = utility.utility(paths[i]);

        final double[] sorted = utilities.clone();
        Arrays.sort(sorted);
        final double uMin = sorted.length > 0 ? sorted[0] : 0.0;
        final double uMax = sorted.length > 0 ? sorted[sorted.length - 1] : 0.0;
        final double bigM = uMax - uMin;
        final double epsilon = halfSmallestGap(sorted);
        logger.debug("cvar objective: M = " + bigM + ", epsilon = " + epsilon);

        final String prefix = "cvar" + numRiskObjectives + "_";
        ++numRiskObjectives;
        eta = decisionModel.newVariable(prefix + "eta").lower(uMin).upper(uMax);

        LinearExpression tailMass = new LinearExpression();
        LinearExpression cvar = new LinearExpression();
        for (int i = 0; i < paths.length; ++i) {
            final Path path = paths[i];
            final double u = utilities[i];
            final double p = x.getProbability(path);
            final Variable xs = x.get(path);
            final String suffix = "_" + path;

            Variable lambda = decisionModel.newVariable(prefix + "lambda" + suffix).binary();
            Variable lambdaBar = decisionModel.newVariable(prefix + "lambdabar" + suffix).binary();
            Variable rho = decisionModel.newVariable(prefix + "rho" + suffix).lower(0.0);
            Variable rhoBar = decisionModel.newVariable(prefix + "rhobar" + suffix).lower(0.0);

            add(LinearConstraint.lessThan(prefix + "eta_u_upper" + suffix,
                new LinearExpression().addTerm(eta, 1.0).addTerm(lambda, -bigM), u));
            add(LinearConstraint.greaterThan(prefix + "eta_u_lower" + suffix,
                new LinearExpression().addTerm(eta, 1.0).addTerm(lambda, -(bigM + epsilon)), u - bigM));
            add(LinearConstraint.lessThan(prefix + "eta_u_strict_upper" + suffix,
                new LinearExpression().addTerm(eta, 1.0).addTerm(lambdaBar, -(bigM + epsilon)), u - epsilon));
            add(LinearConstraint.greaterThan(prefix + "eta_u_strict_lower" + suffix,
                new LinearExpression().addTerm(eta, 1.0).addTerm(lambdaBar, -bigM), u - bigM));

            add(LinearConstraint.lessThan(prefix + "rho_lambda" + suffix,
                new LinearExpression().addTerm(rho, 1.0).addTerm(lambda, -scale), 0.0));
            add(LinearConstraint.lessThan(prefix + "rhobar_lambdabar" + suffix,
                new LinearExpression().addTerm(rhoBar, 1.0).addTerm(lambdaBar, -scale), 0.0));
            add(LinearConstraint.lessThan(prefix + "rho_rhobar" + suffix,
                new LinearExpression().addTerm(rho, 1.0).addTerm(rhoBar, -1.0), 0.0));
            add(LinearConstraint.lessThan(prefix + "rhobar_x" + suffix,
                new LinearExpression().addTerm(rhoBar, 1.0).addTerm(xs, -p * scale), 0.0));
            add(LinearConstraint.lessThan(prefix + "x_rho" + suffix,
                new LinearExpression().addTerm(xs, p * scale).addTerm(lambda, scale).addTerm(rho, -1.0), scale));

            tailMass.addTerm(rhoBar, 1.0);
            cvar.addTerm(rhoBar, u / (alpha * scale));
        }
        add(LinearConstraint.equalTo(prefix + "tail_mass", tailMass, alpha * scale));

        logger.info("cvar objective built for " + paths.length + " paths at risk level " + alpha);
        return cvar;
    }

    /**
     * @return weight * expected value + (1 - weight) * conditional value-at-risk.
     */
    public LinearExpression mixed(double weight, double alpha, double scale) throws OptException {
        if (!(weight >= 0.0 && weight <= 1.0))
            throw new IllegalArgumentException("expected value weight must be in [0, 1], got " + weight);
        LinearExpression ev = expectedValue(scale);
        LinearExpression cvar = conditionalValueAtRisk(alpha, scale);
        return ev.times(weight).plus(cvar.times(1.0 - weight));
    }

    /**
     * @return value-at-risk variable of the last CVaR objective, null if none was built.
     */
    public Variable getEta() {
        return eta;
    }

    private void add(LinearConstraint constraint) {
        decisionModel.addConstraint(constraint);
    }

    /**
     * @return half of the smallest positive difference between consecutive sorted values, 0 if all equal.
     */
    static double halfSmallestGap(double[] sorted) {
        double gap = Double.POSITIVE_INFINITY;
        for (int i = 1; i < sorted.length; ++i) {
            final double diff = sorted[i] - sorted[i - 1];
            if (diff > 0.0)
                gap = Math.min(gap, diff);
        }
        return gap == Double.POSITIVE_INFINITY ? 0.0 : gap / 2.0;
    }
}
