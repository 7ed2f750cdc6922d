package decision.path;

import java.util.Arrays;

/**
 * Represents one full assignment of states to the chance and decision nodes of a diagram.
 * Position i holds the state of the node with index i.
 */
public final class Path {
    private final int[] states;

    public Path(int... states) {
        this.states = states.clone();
    }

    public int get(int node) {
        return states[node];
    }

    public int length() {
        return states.length;
    }

    public int[] getStates() {
        return states.clone();
    }

    /**
     * @param nodes node indices, e.g. an information set.
     * @return states of the given nodes on this path, in the order of the nodes.
     */
    public int[] subStates(int[] nodes) {
        int[] sub = new int[nodes.length];
        for (int i = 0; i < nodes.length; ++i)
            sub[i] = states[nodes[i]];
        return sub;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (!(obj instanceof Path))
            return false;
        return Arrays.equals(states, ((Path) obj).states);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(states);
    }

    @Override
    public String toString() {
        StringBuilder pathStr = new StringBuilder("(");
        for (int i = 0; i < states.length; ++i) {
            if (i > 0)
                pathStr.append(", ");
            pathStr.append(states[i]);
        }
        return pathStr.append(")").toString();
    }
}
