package decision.path;

import java.util.Iterator;

/**
 * Number of states of every chance and decision node, indexed by node.
 */
public class StateSpace {
    private final int[] numStates;

    public StateSpace(int[] numStates) {
        this.numStates = numStates.clone();
    }

    /**
     * @return number of nodes that carry states, which is also the length of every path.
     */
    public int size() {
        return numStates.length;
    }

    public int getNumStates(int node) {
        return numStates[node];
    }

    public int[] getNumStates(int[] nodes) {
        int[] dims = new int[nodes.length];
        for (int i = 0; i < nodes.length; ++i)
            dims[i] = numStates[nodes[i]];
        return dims;
    }

    public long countPaths() {
        return product(numStates);
    }

    public Iterable<Path> paths() {
        return paths(numStates);
    }

    /**
     * @param fixed states that every generated path must take.
     * @return all paths of the state space that agree with the fixed states.
     */
    public Iterable<Path> paths(FixedPath fixed) {
        final int[] pins = PathEnumerator.freePins(numStates.length);
        for (int node : fixed.getNodes())
            pins[node] = fixed.getState(node);
        return () -> toPaths(new PathEnumerator(numStates, pins));
    }

    /**
     * Enumerates every state tuple of the given dimensions, e.g. all information states of a node.
     */
    public static Iterable<Path> paths(int[] dims) {
        final int[] copy = dims.clone();
        return () -> toPaths(new PathEnumerator(copy));
    }

    /**
     * Row-major position of a state tuple, with the last entry varying fastest.
     */
    public static int linearIndex(int[] dims, int[] states) {
        int index = 0;
        for (int i = 0; i < dims.length; ++i)
            index = index * dims[i] + states[i];
        return index;
    }

    public static long product(int[] dims) {
        long result = 1;
        for (int dim : dims)
            result *= dim;
        return result;
    }

    private static Iterator<Path> toPaths(PathEnumerator enumerator) {
        return new Iterator<Path>() {
            @Override
            public boolean hasNext() {
                return enumerator.hasNext();
            }

            @Override
            public Path next() {
                return new Path(enumerator.next());
            }
        };
    }
}
