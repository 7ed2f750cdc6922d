package decision.path;

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * A conjunction of (node, excluded states) rules.
 * <p>
 * A path is forbidden when, for every rule, the state of the path at the rule's node is one of the
 * rule's excluded states. A forbidden path without rules forbids nothing.
 */
public final class ForbiddenPath {
    private final LinkedHashMap<Integer, Set<Integer>> rules;

    private ForbiddenPath(LinkedHashMap<Integer, Set<Integer>> rules) {
        this.rules = rules;
    }

    public static ForbiddenPath of(Map<Integer, Set<Integer>> rules) {
        LinkedHashMap<Integer, Set<Integer>> copy = new LinkedHashMap<>();
        for (Map.Entry<Integer, Set<Integer>> entry : rules.entrySet())
            copy.put(entry.getKey(), Collections.unmodifiableSet(new HashSet<>(entry.getValue())));
        return new ForbiddenPath(copy);
    }

    public boolean forbids(Path path) {
        if (rules.isEmpty())
            return false;
        for (Map.Entry<Integer, Set<Integer>> rule : rules.entrySet())
            if (!rule.getValue().contains(path.get(rule.getKey())))
                return false;
        return true;
    }

    public static boolean isForbidden(Path path, Iterable<ForbiddenPath> forbiddenPaths) {
        for (ForbiddenPath forbiddenPath : forbiddenPaths)
            if (forbiddenPath.forbids(path))
                return true;
        return false;
    }

    @Override
    public String toString() {
        return "ForbiddenPath" + rules;
    }
}
