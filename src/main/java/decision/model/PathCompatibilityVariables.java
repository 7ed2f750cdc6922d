package decision.model;

import decision.path.Path;
import org.ojalgo.optimisation.Variable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Path selection variables x_s, one per path with positive probability that is not forbidden.
 * Paths without a variable are implicitly zero.
 */
public class PathCompatibilityVariables {
    private final LinkedHashMap<Path, Variable> variables;
    private final LinkedHashMap<Path, Double> probabilities;

    PathCompatibilityVariables() {
        variables = new LinkedHashMap<>();
        probabilities = new LinkedHashMap<>();
    }

    void put(Path path, Variable variable, double probability) {
        variables.put(path, variable);
        probabilities.put(path, probability);
    }

    public boolean contains(Path path) {
        return variables.containsKey(path);
    }

    /**
     * @throws IllegalArgumentException if the path has no variable; check with contains first.
     */
    public Variable get(Path path) {
        Variable variable = variables.get(path);
        if (variable == null)
            throw new IllegalArgumentException("no path compatibility variable for path " + path);
        return variable;
    }

    /**
     * @return prior probability P(s) of a path that has a variable.
     */
    public double getProbability(Path path) {
        Double probability = probabilities.get(path);
        if (probability == null)
            throw new IllegalArgumentException("no path compatibility variable for path " + path);
        return probability;
    }

    public Set<Path> getPaths() {
        return Collections.unmodifiableSet(variables.keySet());
    }

    public Map<Path, Variable> asMap() {
        return Collections.unmodifiableMap(variables);
    }

    public int size() {
        return variables.size();
    }
}
