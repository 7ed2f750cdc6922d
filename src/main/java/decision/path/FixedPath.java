package decision.path;

import decision.utility.Enums;
import decision.utility.OptException;

import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Immutable map from node index to the state that node is held at.
 */
public final class FixedPath {
    private static final FixedPath EMPTY = new FixedPath(new TreeMap<>());

    private final TreeMap<Integer, Integer> states;

    private FixedPath(TreeMap<Integer, Integer> states) {
        this.states = states;
    }

    public static FixedPath empty() {
        return EMPTY;
    }

    /**
     * Validates node and state indices against the state space.
     *
     * @throws OptException with kind INVALID_FIXED_STATE if a node or state is out of range.
     */
    public static FixedPath of(StateSpace stateSpace, Map<Integer, Integer> fixed) throws OptException {
        TreeMap<Integer, Integer> states = new TreeMap<>();
        for (Map.Entry<Integer, Integer> entry : fixed.entrySet()) {
            int node = entry.getKey();
            int state = entry.getValue();
            if (node < 0 || node >= stateSpace.size())
                throw new OptException(Enums.ErrorKind.INVALID_FIXED_STATE, "unknown node " + node);
            if (state < 0 || state >= stateSpace.getNumStates(node))
                throw new OptException(Enums.ErrorKind.INVALID_FIXED_STATE,
                    "state " + state + " out of range for node " + node);
            states.put(node, state);
        }
        return new FixedPath(states);
    }

    public FixedPath with(StateSpace stateSpace, int node, int state) throws OptException {
        TreeMap<Integer, Integer> extended = new TreeMap<>(states);
        extended.put(node, state);
        return of(stateSpace, extended);
    }

    public boolean isEmpty() {
        return states.isEmpty();
    }

    public boolean contains(int node) {
        return states.containsKey(node);
    }

    public int getState(int node) {
        return states.get(node);
    }

    public Set<Integer> getNodes() {
        return Collections.unmodifiableSet(states.keySet());
    }

    public Map<Integer, Integer> asMap() {
        return Collections.unmodifiableMap(states);
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof FixedPath && states.equals(((FixedPath) obj).states);
    }

    @Override
    public int hashCode() {
        return states.hashCode();
    }

    @Override
    public String toString() {
        return states.toString();
    }
}
