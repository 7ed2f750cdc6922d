package decision.utility;

public class Enums {

    /**
     * NodeRole is the role tag of an influence diagram node.
     */
    public enum NodeRole {
        CHANCE, DECISION, VALUE;

        /**
         * Classifies a role tag such as the "type" entry of a diagram file.
         *
         * @param tag one of chance, decision or value (case insensitive).
         * @return the matching role.
         * @throws OptException with kind UNKNOWN_NODE_CLASS for any other tag.
         */
        public static NodeRole fromTag(String tag) throws OptException {
            if (tag != null) {
                switch (tag.trim().toLowerCase()) {
                    case "chance":
                        return CHANCE;
                    case "decision":
                        return DECISION;
                    case "value":
                        return VALUE;
                    default:
                        break;
                }
            }
            throw new OptException(ErrorKind.UNKNOWN_NODE_CLASS, "unknown node class: " + tag);
        }
    }

    /**
     * ErrorKind classifies every OptException raised while building, solving or analysing a model.
     * <p>
     * None of these are retried. IO_FAILURE covers unreadable input and unwritable output files,
     * INVALID_OPTION command line arguments that cannot be parsed.
     */
    public enum ErrorKind {
        INVALID_FIXED_STATE,
        INVALID_SCALE_FACTOR,
        INVALID_RISK_LEVEL,
        UNKNOWN_NODE_CLASS,
        MALFORMED_STRATEGY,
        INACTIVE_CHANCE_STATES,
        INVALID_DIAGRAM,
        SOLVER_FAILURE,
        IO_FAILURE,
        INVALID_OPTION
    }

    /**
     * ObjectiveType specifies what the decision model maximises.
     * <p>
     * EXPECTED_VALUE: expected utility of the strategy.
     * CVAR: conditional value-at-risk of the utility distribution at level alpha.
     * MIXED: weight * expected value + (1 - weight) * CVaR.
     */
    public enum ObjectiveType {EXPECTED_VALUE, CVAR, MIXED}

    /**
     * UtilityShift specifies the affine transformation applied to path utilities before the CVaR
     * encoding is built.
     * <p>
     * NONE: utilities are used as given.
     * POSITIVE: utilities are shifted so that all of them are at least 1.
     * NEGATIVE: utilities are shifted so that all of them are at most -1.
     */
    public enum UtilityShift {NONE, POSITIVE, NEGATIVE}
}
