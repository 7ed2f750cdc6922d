package decision.path;

/**
 * Utility of a path: the sum of the value node contributions along it.
 */
@FunctionalInterface
public interface PathUtility {
    double utility(Path path);
}
