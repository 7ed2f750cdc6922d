package decision.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Node that carries a state dimension on every path, i.e. a chance or a decision node.
 */
public abstract class StateNode extends Node {
    private final int index;
    private final List<String> states;

    StateNode(int index, String name, int[] informationSet, List<String> states) {
        super(name, informationSet);
        this.index = index;
        this.states = Collections.unmodifiableList(new ArrayList<>(states));
    }

    /**
     * @return position of the node (and of its state) on a path.
     */
    public int getIndex() {
        return index;
    }

    public List<String> getStates() {
        return states;
    }

    public int getNumStates() {
        return states.size();
    }

    public int indexOfState(String state) {
        return states.indexOf(state);
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(index);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (obj == null || getClass() != obj.getClass())
            return false;
        StateNode other = (StateNode) obj;
        return index == other.index && getName().equals(other.getName());
    }
}
