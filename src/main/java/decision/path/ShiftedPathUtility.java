package decision.path;

import decision.utility.Enums;

/**
 * Path utility translated by a constant. Translation keeps the order of path utilities, which is all
 * the CVaR encoding depends on, while moving the values away from zero.
 */
public class ShiftedPathUtility implements PathUtility {
    private final PathUtility utility;
    private final double shift;

    private ShiftedPathUtility(PathUtility utility, double shift) {
        this.utility = utility;
        this.shift = shift;
    }

    /**
     * @return utility U(s) - min(U) + 1, so that every path has utility at least 1.
     */
    public static ShiftedPathUtility positive(PathUtility utility, StateSpace stateSpace) {
        double min = Double.POSITIVE_INFINITY;
        for (Path path : stateSpace.paths())
            min = Math.min(min, utility.utility(path));
        return new ShiftedPathUtility(utility, min - 1);
    }

    /**
     * @return utility U(s) - max(U) - 1, so that every path has utility at most -1.
     */
    public static ShiftedPathUtility negative(PathUtility utility, StateSpace stateSpace) {
        double max = Double.NEGATIVE_INFINITY;
        for (Path path : stateSpace.paths())
            max = Math.max(max, utility.utility(path));
        return new ShiftedPathUtility(utility, max + 1);
    }

    public static PathUtility apply(Enums.UtilityShift shift, PathUtility utility, StateSpace stateSpace) {
        switch (shift) {
            case POSITIVE:
                return positive(utility, stateSpace);
            case NEGATIVE:
                return negative(utility, stateSpace);
            default:
                return utility;
        }
    }

    /**
     * @return the constant subtracted from every original utility.
     */
    public double getShift() {
        return shift;
    }

    @Override
    public double utility(Path path) {
        return utility.utility(path) - shift;
    }
}
