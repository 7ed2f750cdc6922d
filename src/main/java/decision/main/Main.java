package decision.main;

import decision.registry.Parameters;
import decision.utility.Constants;
import decision.utility.Enums;
import decision.utility.OptException;
import org.apache.commons.cli.*;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Class that owns main().
 */
public class Main {
    private final static Logger logger = LogManager.getLogger(Main.class);

    public static void main(String[] args) {
        try {
            CommandLine cmd = addOptions(args);
            if (cmd == null)
                return;

            setDefaultParameters();
            updateParameters(cmd);
            singleRun();
        } catch (OptException ex) {
            logger.error(ex);
            System.exit(Constants.ERROR_CODE);
        }
    }

    static CommandLine addOptions(String[] args) throws OptException {
        Options options = new Options();
        options.addOption("diagram", true, "path to diagram YAML file");
        options.addOption("objective", true, "objective (ev/cvar/mixed)");
        options.addOption("alpha", true, "CVaR risk level in (0, 1]");
        options.addOption("weight", true, "weight of expected value in mixed objective");
        options.addOption("scale", true, "probability scale factor");
        options.addOption("shift", true, "utility shift for CVaR (none/positive/negative)");
        options.addOption("lazyCut", true, "add probability constraint as lazy cut (y/n)");
        options.addOption("activePathsCut", true, "add active paths cut (y/n)");
        options.addOption("activeTolerance", true, "active paths cut tolerance");
        options.addOption("cutRounds", true, "maximum number of lazy cut rounds");
        options.addOption("timeLimit", true, "solver time limit in seconds");
        options.addOption("outputPath", true, "path to output folder");
        options.addOption("debug", false, "log the full solver model");
        options.addOption("h", false, "help (show options and exit)");

        CommandLineParser parser = new DefaultParser();
        try {
            CommandLine cmd = parser.parse(options, args);
            if (cmd.hasOption('h')) {
                HelpFormatter helpFormatter = new HelpFormatter();
                helpFormatter.printHelp("decision-programming.jar", options);
                return null;
            }
            return cmd;
        } catch (ParseException ex) {
            logger.error(ex);
            throw new OptException(Enums.ErrorKind.INVALID_OPTION, "error parsing CLI args: " + ex.getMessage());
        }
    }

    private static void singleRun() throws OptException {
        logger.info("Started optimization...");
        Controller controller = new Controller();
        controller.buildModel();
        controller.solve();
        controller.analyze();
        controller.writeOutput();
        logger.info("completed optimization.");
    }

    static void setDefaultParameters() {
        Parameters.setObjectiveType(Enums.ObjectiveType.EXPECTED_VALUE);
        Parameters.setRiskLevel(0.05);
        Parameters.setExpectedValueWeight(0.5);
        Parameters.setProbabilityScaleFactor(1.0);
        Parameters.setUtilityShift(Enums.UtilityShift.NONE);

        // Cut parameters
        Parameters.setUseLazyProbabilityCut(false);
        Parameters.setUseActivePathsCut(false);
        Parameters.setActivePathsTolerance(Constants.DEFAULT_ACTIVE_PATHS_TOLERANCE);
        Parameters.setNumCutRounds(Constants.DEFAULT_CUT_ROUNDS);

        Parameters.setSolverTimeLimitInSeconds(0); // no limit.
        Parameters.setDebugVerbose(false);
    }

    static void updateParameters(CommandLine cmd) throws OptException {
        Parameters.setDiagramPath(cmd.getOptionValue("diagram", "data/diagram.yaml"));
        Parameters.setOutputPath(cmd.getOptionValue("outputPath", "solution"));
        if (cmd.hasOption("objective")) {
            final String objective = cmd.getOptionValue("objective").toLowerCase();
            switch (objective) {
                case "ev":
                    Parameters.setObjectiveType(Enums.ObjectiveType.EXPECTED_VALUE);
                    break;
                case "cvar":
                    Parameters.setObjectiveType(Enums.ObjectiveType.CVAR);
                    break;
                case "mixed":
                    Parameters.setObjectiveType(Enums.ObjectiveType.MIXED);
                    break;
                default:
                    throw new OptException(Enums.ErrorKind.INVALID_OPTION,
                        "unknown objective type " + objective + ", use ev/cvar/mixed");
            }
        }
        else
            logger.info("objective not provided, defaulting to expected value");
        if (cmd.hasOption("shift")) {
            final String shift = cmd.getOptionValue("shift").toLowerCase();
            switch (shift) {
                case "none":
                    Parameters.setUtilityShift(Enums.UtilityShift.NONE);
                    break;
                case "positive":
                    Parameters.setUtilityShift(Enums.UtilityShift.POSITIVE);
                    break;
                case "negative":
                    Parameters.setUtilityShift(Enums.UtilityShift.NEGATIVE);
                    break;
                default:
                    throw new OptException(Enums.ErrorKind.INVALID_OPTION,
                        "unknown utility shift " + shift + ", use none/positive/negative");
            }
        }
        if (cmd.hasOption("alpha")) {
            final double alpha = parseDouble(cmd, "alpha");
            Parameters.setRiskLevel(alpha);
        }
        if (cmd.hasOption("weight")) {
            final double weight = parseDouble(cmd, "weight");
            Parameters.setExpectedValueWeight(weight);
        }
        if (cmd.hasOption("scale")) {
            final double scale = parseDouble(cmd, "scale");
            Parameters.setProbabilityScaleFactor(scale);
        }
        if (cmd.hasOption("lazyCut")) {
            final boolean useLazyCut = cmd.getOptionValue("lazyCut").equals("y");
            Parameters.setUseLazyProbabilityCut(useLazyCut);
            logger.info("use lazy probability cut: " + useLazyCut);
        }
        if (cmd.hasOption("activePathsCut")) {
            final boolean useActivePathsCut = cmd.getOptionValue("activePathsCut").equals("y");
            Parameters.setUseActivePathsCut(useActivePathsCut);
            logger.info("use active paths cut: " + useActivePathsCut);
        }
        if (cmd.hasOption("activeTolerance")) {
            final double tolerance = parseDouble(cmd, "activeTolerance");
            Parameters.setActivePathsTolerance(tolerance);
        }
        if (cmd.hasOption("cutRounds")) {
            final int numCutRounds = parseInt(cmd, "cutRounds");
            Parameters.setNumCutRounds(numCutRounds);
        }
        if (cmd.hasOption("debug"))
            Parameters.setDebugVerbose(true);
        if (cmd.hasOption("timeLimit")) {
            final int timeLimit = parseInt(cmd, "timeLimit");
            Parameters.setSolverTimeLimitInSeconds(timeLimit);
        }
    }

    private static double parseDouble(CommandLine cmd, String option) throws OptException {
        try {
            return Double.parseDouble(cmd.getOptionValue(option));
        } catch (NumberFormatException ex) {
            logger.error(ex);
            throw new OptException(Enums.ErrorKind.INVALID_OPTION,
                "option " + option + " expects a number, got " + cmd.getOptionValue(option));
        }
    }

    private static int parseInt(CommandLine cmd, String option) throws OptException {
        try {
            return Integer.parseInt(cmd.getOptionValue(option));
        } catch (NumberFormatException ex) {
            logger.error(ex);
            throw new OptException(Enums.ErrorKind.INVALID_OPTION,
                "option " + option + " expects an integer, got " + cmd.getOptionValue(option));
        }
    }
}
