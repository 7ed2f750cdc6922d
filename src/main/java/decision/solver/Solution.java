package decision.solver;

import decision.model.CandidateSolution;
import org.ojalgo.optimisation.Optimisation;

import java.util.TreeMap;

/**
 * Final result of solving a decision model.
 */
public class Solution {
    private final CandidateSolution candidate;
    private final double objectiveValue;
    private final int numCutRounds;
    private final int numCutsAdded;
    private final double solutionTime;

    Solution(CandidateSolution candidate, double objectiveValue, int numCutRounds, int numCutsAdded,
             double solutionTime) {
        this.candidate = candidate;
        this.objectiveValue = objectiveValue;
        this.numCutRounds = numCutRounds;
        this.numCutsAdded = numCutsAdded;
        this.solutionTime = solutionTime;
    }

    public CandidateSolution getCandidate() {
        return candidate;
    }

    public Optimisation.State getState() {
        return candidate.getState();
    }

    public boolean isFeasible() {
        return candidate.isFeasible();
    }

    public double getObjectiveValue() {
        return objectiveValue;
    }

    public int getNumCutRounds() {
        return numCutRounds;
    }

    public int getNumCutsAdded() {
        return numCutsAdded;
    }

    /**
     * @return wall clock solution time in seconds.
     */
    public double getSolutionTime() {
        return solutionTime;
    }

    public TreeMap<String, Object> asMap(String prefix) {
        TreeMap<String, Object> map = new TreeMap<>();
        map.put(prefix + "State", getState().name());
        map.put(prefix + "ObjectiveValue", objectiveValue);
        map.put(prefix + "CutRounds", numCutRounds);
        map.put(prefix + "CutsAdded", numCutsAdded);
        map.put(prefix + "SolutionTime", solutionTime);
        return map;
    }
}
