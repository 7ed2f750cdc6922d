package decision.model;

import org.ojalgo.optimisation.ExpressionsBasedModel;
import org.ojalgo.optimisation.Optimisation;
import org.ojalgo.optimisation.Variable;

/**
 * Read-only snapshot of the variable values of a solver result.
 */
public class CandidateSolution {
    private final ExpressionsBasedModel model;
    private final Optimisation.State state;
    private final double[] values;

    public CandidateSolution(ExpressionsBasedModel model, Optimisation.Result result) {
        this(model, result.getState(), readValues(model, result));
    }

    /**
     * @param values one value per model variable, in model order.
     */
    public CandidateSolution(ExpressionsBasedModel model, Optimisation.State state, double[] values) {
        if (values.length != model.getVariables().size())
            throw new IllegalArgumentException("expected " + model.getVariables().size() + " values, got "
                + values.length);
        this.model = model;
        this.state = state;
        this.values = values.clone();
    }

    public double getValue(Variable variable) {
        return values[model.indexOf(variable)];
    }

    public double[] getValues(Variable[] variables) {
        double[] result = new double[variables.length];
        for (int i = 0; i < variables.length; ++i)
            result[i] = getValue(variables[i]);
        return result;
    }

    public Optimisation.State getState() {
        return state;
    }

    public boolean isFeasible() {
        return state.isFeasible();
    }

    private static double[] readValues(ExpressionsBasedModel model, Optimisation.Result result) {
        // an infeasible result may carry no values
        double[] values = new double[model.getVariables().size()];
        final long count = result.count();
        for (int i = 0; i < values.length && i < count; ++i)
            values[i] = result.doubleValue(i);
        return values;
    }
}
