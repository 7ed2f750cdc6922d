package decision.model;

import org.ojalgo.optimisation.Expression;
import org.ojalgo.optimisation.ExpressionsBasedModel;
import org.ojalgo.optimisation.Variable;

import java.util.Map;

/**
 * lower &lt;= expression &lt;= upper, where a null bound is absent. Equalities have lower == upper.
 */
public class LinearConstraint {
    private final String name;
    private final LinearExpression expression;
    private final Double lower;
    private final Double upper;

    private LinearConstraint(String name, LinearExpression expression, Double lower, Double upper) {
        this.name = name;
        this.expression = expression;
        this.lower = lower;
        this.upper = upper;
    }

    public static LinearConstraint equalTo(String name, LinearExpression expression, double rhs) {
        return new LinearConstraint(name, expression, rhs, rhs);
    }

    public static LinearConstraint lessThan(String name, LinearExpression expression, double rhs) {
        return new LinearConstraint(name, expression, null, rhs);
    }

    public static LinearConstraint greaterThan(String name, LinearExpression expression, double rhs) {
        return new LinearConstraint(name, expression, rhs, null);
    }

    /**
     * Adds the constraint to the model, moving the constant of the expression to the bounds.
     */
    public Expression addTo(ExpressionsBasedModel model) {
        Expression modelExpression = model.newExpression(name);
        for (Map.Entry<Variable, Double> term : expression.getTerms().entrySet())
            modelExpression.set(term.getKey(), term.getValue());

        final double constant = expression.getConstant();
        if (lower != null && lower.equals(upper))
            modelExpression.level(lower - constant);
        else {
            if (lower != null)
                modelExpression.lower(lower - constant);
            if (upper != null)
                modelExpression.upper(upper - constant);
        }
        return modelExpression;
    }

    public String getName() {
        return name;
    }

    public LinearExpression getExpression() {
        return expression;
    }

    @Override
    public String toString() {
        return name + ": " + lower + " <= " + expression.getTerms().size() + " terms <= " + upper;
    }
}
