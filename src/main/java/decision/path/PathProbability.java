package decision.path;

/**
 * Probability of a path: the product of the conditional probabilities of its chance states.
 * Implementations must be pure and total over the paths of the state space.
 */
@FunctionalInterface
public interface PathProbability {
    double probability(Path path);
}
