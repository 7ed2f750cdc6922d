package decision.solver;

import decision.model.CandidateSolution;
import decision.model.DecisionModel;
import decision.model.LinearConstraint;

import java.util.Optional;

/**
 * A constraint that is left out of the model and added only once a candidate solution violates it.
 * <p>
 * The solver hands every candidate to submit(). The candidate values are only read. Once the cut has
 * been added to the model it is global and is never submitted again.
 */
public abstract class LazyCut {
    private boolean added = false;

    /**
     * @return the constraint to add if the candidate calls for it, empty otherwise.
     */
    protected abstract Optional<LinearConstraint> separate(CandidateSolution candidate);

    /**
     * @return true if a constraint was added to the model.
     */
    public final boolean submit(CandidateSolution candidate, DecisionModel model) {
        if (added)
            return false;

        Optional<LinearConstraint> cut = separate(candidate);
        if (cut.isEmpty())
            return false;

        model.addConstraint(cut.get());
        added = true;
        return true;
    }

    public boolean isAdded() {
        return added;
    }
}
