package decision.registry;

import decision.utility.Constants;
import decision.utility.Enums;

import java.util.HashMap;

public class Parameters {
    private static String diagramPath;
    private static String outputPath;

    private static Enums.ObjectiveType objectiveType = Enums.ObjectiveType.EXPECTED_VALUE;
    private static double riskLevel = 0.05; // alpha of the CVaR objective, in (0, 1].

    /**
     * Weight of the expected value in the MIXED objective, which maximises
     * expectedValueWeight * EV + (1 - expectedValueWeight) * CVaR.
     */
    private static double expectedValueWeight = 0.5;

    private static double probabilityScaleFactor = 1.0;
    private static Enums.UtilityShift utilityShift = Enums.UtilityShift.NONE;

    private static boolean useLazyProbabilityCut;
    private static boolean useActivePathsCut;
    private static double activePathsTolerance = Constants.DEFAULT_ACTIVE_PATHS_TOLERANCE;
    private static int numCutRounds = Constants.DEFAULT_CUT_ROUNDS; // maximum number of re-solves triggered by lazy cuts.

    private static int solverTimeLimitInSeconds; // 0 disables the limit.
    private static boolean debugVerbose; // generates additional logging.

    public static void setDiagramPath(String diagramPath) {
        Parameters.diagramPath = diagramPath;
    }

    public static String getDiagramPath() {
        return diagramPath;
    }

    public static void setOutputPath(String outputPath) {
        Parameters.outputPath = outputPath;
    }

    public static String getOutputPath() {
        return outputPath;
    }

    public static void setObjectiveType(Enums.ObjectiveType objectiveType) {
        Parameters.objectiveType = objectiveType;
    }

    public static Enums.ObjectiveType getObjectiveType() {
        return objectiveType;
    }

    public static void setRiskLevel(double riskLevel) {
        Parameters.riskLevel = riskLevel;
    }

    public static double getRiskLevel() {
        return riskLevel;
    }

    public static void setExpectedValueWeight(double expectedValueWeight) {
        Parameters.expectedValueWeight = expectedValueWeight;
    }

    public static double getExpectedValueWeight() {
        return expectedValueWeight;
    }

    public static void setProbabilityScaleFactor(double probabilityScaleFactor) {
        Parameters.probabilityScaleFactor = probabilityScaleFactor;
    }

    public static double getProbabilityScaleFactor() {
        return probabilityScaleFactor;
    }

    public static void setUtilityShift(Enums.UtilityShift utilityShift) {
        Parameters.utilityShift = utilityShift;
    }

    public static Enums.UtilityShift getUtilityShift() {
        return utilityShift;
    }

    public static void setUseLazyProbabilityCut(boolean useLazyProbabilityCut) {
        Parameters.useLazyProbabilityCut = useLazyProbabilityCut;
    }

    public static boolean isUseLazyProbabilityCut() {
        return useLazyProbabilityCut;
    }

    public static void setUseActivePathsCut(boolean useActivePathsCut) {
        Parameters.useActivePathsCut = useActivePathsCut;
    }

    public static boolean isUseActivePathsCut() {
        return useActivePathsCut;
    }

    public static void setActivePathsTolerance(double activePathsTolerance) {
        Parameters.activePathsTolerance = activePathsTolerance;
    }

    public static double getActivePathsTolerance() {
        return activePathsTolerance;
    }

    public static void setNumCutRounds(int numCutRounds) {
        Parameters.numCutRounds = numCutRounds;
    }

    public static int getNumCutRounds() {
        return numCutRounds;
    }

    public static void setSolverTimeLimitInSeconds(int solverTimeLimitInSeconds) {
        Parameters.solverTimeLimitInSeconds = solverTimeLimitInSeconds;
    }

    public static int getSolverTimeLimitInSeconds() {
        return solverTimeLimitInSeconds;
    }

    public static void setDebugVerbose(boolean debugVerbose) {
        Parameters.debugVerbose = debugVerbose;
    }

    public static boolean isDebugVerbose() {
        return debugVerbose;
    }

    public static HashMap<String, Object> asMap() {
        HashMap<String, Object> results = new HashMap<>();
        results.put("diagramPath", diagramPath);
        results.put("objective", objectiveType.name());
        results.put("riskLevel", riskLevel);
        results.put("expectedValueWeight", expectedValueWeight);
        results.put("probabilityScaleFactor", probabilityScaleFactor);
        results.put("utilityShift", utilityShift.name());
        results.put("lazyProbabilityCut", useLazyProbabilityCut);
        results.put("activePathsCut", useActivePathsCut);
        results.put("activePathsTolerance", activePathsTolerance);
        results.put("cutRounds", numCutRounds);
        results.put("timeLimitInSeconds", solverTimeLimitInSeconds);
        return results;
    }
}
