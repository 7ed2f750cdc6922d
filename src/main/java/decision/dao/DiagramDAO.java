package decision.dao;

import decision.registry.InfluenceDiagram;
import decision.registry.InfluenceDiagramBuilder;
import decision.utility.Enums;
import decision.utility.OptException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Used to read an influence diagram from a YAML file of the form
 * <pre>
 * nodes:
 *   - name: O
 *     type: chance
 *     states: [lemon, peach]
 *     probabilities: [0.2, 0.8]
 *   - name: V
 *     type: value
 *     parents: [O]
 *     utilities: [-100, 60]
 * </pre>
 * Nodes must be listed parents first. Tables are flat and row-major over the parents, with the states of
 * the node itself varying fastest.
 */
public class DiagramDAO {
    private final static Logger logger = LogManager.getLogger(DiagramDAO.class);
    private final InfluenceDiagram diagram;

    public DiagramDAO(String filePath) throws OptException {
        try (InputStream in = new FileInputStream(filePath)) {
            diagram = parse(in);
        } catch (IOException ex) {
            logger.error(ex);
            throw new OptException(Enums.ErrorKind.IO_FAILURE, "unable to read diagram file " + filePath);
        }
        logger.info("read diagram from " + filePath);
    }

    public DiagramDAO(InputStream in) throws OptException {
        diagram = parse(in);
    }

    public InfluenceDiagram getDiagram() {
        return diagram;
    }

    private static InfluenceDiagram parse(InputStream in) throws OptException {
        Object document;
        try {
            document = new Yaml().load(in);
        } catch (YAMLException ex) {
            logger.error(ex);
            throw new OptException(Enums.ErrorKind.INVALID_DIAGRAM, "ill-formed diagram YAML");
        }
        if (!(document instanceof Map))
            throw new OptException(Enums.ErrorKind.INVALID_DIAGRAM, "diagram YAML must be a map with a nodes entry");

        Object nodes = ((Map<?, ?>) document).get("nodes");
        if (!(nodes instanceof List))
            throw new OptException(Enums.ErrorKind.INVALID_DIAGRAM, "diagram YAML has no list of nodes");

        InfluenceDiagramBuilder builder = new InfluenceDiagramBuilder();
        for (Object entry : (List<?>) nodes) {
            if (!(entry instanceof Map))
                throw new OptException(Enums.ErrorKind.INVALID_DIAGRAM, "node entry is not a map: " + entry);
            addNode(builder, (Map<?, ?>) entry);
        }
        return builder.build();
    }

    private static void addNode(InfluenceDiagramBuilder builder, Map<?, ?> entry) throws OptException {
        final String name = readString(entry, "name");
        final Enums.NodeRole role = Enums.NodeRole.fromTag(readString(entry, "type"));
        final List<String> parents = readStrings(entry, "parents");

        switch (role) {
            case CHANCE:
                builder.addChanceNode(name, parents, readStrings(entry, "states"));
                builder.setProbabilities(name, readNumbers(entry, "probabilities"));
                break;
            case DECISION:
                builder.addDecisionNode(name, parents, readStrings(entry, "states"));
                break;
            case VALUE:
                builder.addValueNode(name, parents);
                builder.setUtilities(name, readNumbers(entry, "utilities"));
                break;
        }
        logger.debug("read " + role + " node " + name);
    }

    private static String readString(Map<?, ?> entry, String key) throws OptException {
        Object value = entry.get(key);
        if (value == null)
            throw new OptException(Enums.ErrorKind.INVALID_DIAGRAM, "node entry is missing " + key + ": " + entry);
        return value.toString();
    }

    private static List<String> readStrings(Map<?, ?> entry, String key) throws OptException {
        Object value = entry.get(key);
        if (value == null)
            return Collections.emptyList();
        if (!(value instanceof List))
            throw new OptException(Enums.ErrorKind.INVALID_DIAGRAM, key + " must be a list: " + entry);

        ArrayList<String> strings = new ArrayList<>();
        for (Object item : (List<?>) value)
            strings.add(item.toString());
        return strings;
    }

    private static double[] readNumbers(Map<?, ?> entry, String key) throws OptException {
        Object value = entry.get(key);
        if (!(value instanceof List))
            throw new OptException(Enums.ErrorKind.INVALID_DIAGRAM, key + " must be a list of numbers: " + entry);

        List<?> items = (List<?>) value;
        double[] numbers = new double[items.size()];
        for (int i = 0; i < numbers.length; ++i) {
            if (!(items.get(i) instanceof Number))
                throw new OptException(Enums.ErrorKind.INVALID_DIAGRAM, key + " must contain numbers: " + entry);
            numbers[i] = ((Number) items.get(i)).doubleValue();
        }
        return numbers;
    }
}
