package decision.utility;

public class Constants {
    public final static double PROBABILITY_TOLERANCE = 1e-6;
    public final static double DEFAULT_ACTIVE_PATHS_TOLERANCE = 0.9;
    public final static int DEFAULT_CUT_ROUNDS = 10;
    public final static int ERROR_CODE = 17;
}
