package decision.path;

import java.util.Arrays;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Odometer over the Cartesian product of state domains.
 * <p>
 * Position i ranges over 0..dims[i]-1 unless it is pinned, in which case its domain is the single
 * pinned state. The last position varies fastest, so tuples come out in lexicographic order.
 */
class PathEnumerator implements Iterator<int[]> {
    static final int FREE = -1;

    private final int[] dims;
    private final int[] pinned;
    private final int[] current;
    private boolean hasNext;

    PathEnumerator(int[] dims) {
        this(dims, freePins(dims.length));
    }

    /**
     * @param dims   number of states of each position.
     * @param pinned pinned state of each position, or FREE.
     */
    PathEnumerator(int[] dims, int[] pinned) {
        this.dims = dims.clone();
        this.pinned = pinned.clone();
        current = new int[dims.length];
        hasNext = true;
        for (int i = 0; i < dims.length; ++i) {
            if (dims[i] <= 0)
                hasNext = false;
            current[i] = pinned[i] == FREE ? 0 : pinned[i];
        }
    }

    @Override
    public boolean hasNext() {
        return hasNext;
    }

    @Override
    public int[] next() {
        if (!hasNext)
            throw new NoSuchElementException();
        int[] result = current.clone();
        advance();
        return result;
    }

    private void advance() {
        for (int i = dims.length - 1; i >= 0; --i) {
            if (pinned[i] != FREE)
                continue;
            if (current[i] + 1 < dims[i]) {
                ++current[i];
                return;
            }
            current[i] = 0;
        }
        hasNext = false;
    }

    static int[] freePins(int length) {
        int[] pins = new int[length];
        Arrays.fill(pins, FREE);
        return pins;
    }
}
