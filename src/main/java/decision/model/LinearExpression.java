package decision.model;

import org.ojalgo.optimisation.Variable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Linear expression over model variables plus a constant. Used both for objectives and for the
 * left-hand sides of constraints built outside the model (e.g. lazy cuts).
 */
public class LinearExpression {
    private final LinkedHashMap<Variable, Double> terms;
    private double constant;

    public LinearExpression() {
        terms = new LinkedHashMap<>();
        constant = 0.0;
    }

    public LinearExpression addTerm(Variable variable, double coefficient) {
        terms.merge(variable, coefficient, Double::sum);
        return this;
    }

    public LinearExpression addConstant(double value) {
        constant += value;
        return this;
    }

    /**
     * @return new expression this + other.
     */
    public LinearExpression plus(LinearExpression other) {
        LinearExpression sum = times(1.0);
        for (Map.Entry<Variable, Double> entry : other.terms.entrySet())
            sum.addTerm(entry.getKey(), entry.getValue());
        sum.constant += other.constant;
        return sum;
    }

    /**
     * @return new expression factor * this.
     */
    public LinearExpression times(double factor) {
        LinearExpression product = new LinearExpression();
        for (Map.Entry<Variable, Double> entry : terms.entrySet())
            product.terms.put(entry.getKey(), entry.getValue() * factor);
        product.constant = constant * factor;
        return product;
    }

    public double evaluate(CandidateSolution solution) {
        double value = constant;
        for (Map.Entry<Variable, Double> entry : terms.entrySet())
            value += entry.getValue() * solution.getValue(entry.getKey());
        return value;
    }

    public Map<Variable, Double> getTerms() {
        return Collections.unmodifiableMap(terms);
    }

    public double getConstant() {
        return constant;
    }
}
