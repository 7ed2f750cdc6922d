package decision.domain;

import decision.utility.Enums;

import java.util.Arrays;

/**
 * Base class of influence diagram nodes.
 * Holds the name of the node and the indices of the nodes in its information set.
 */
public abstract class Node {
    private final String name;
    private final int[] informationSet;

    Node(String name, int[] informationSet) {
        this.name = name;
        this.informationSet = informationSet.clone();
    }

    public String getName() {
        return name;
    }

    public int[] getInformationSet() {
        return informationSet.clone();
    }

    public abstract Enums.NodeRole getRole();

    @Override
    public String toString() {
        return getRole().name().toLowerCase() + "(" + name + " | " + Arrays.toString(informationSet) + ")";
    }
}
