package work.lcod.strata.resolve;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.strata.tree.KeySpec;
import work.lcod.strata.tree.Node;

/**
 * Resolves key specs against a tree and the scopes it inherits from.
 *
 * <p>Within one scope the spec is matched depth first. A {@code *} segment expands over every
 * child in child order. A literal segment follows the child with that key and then, when present,
 * the child literally keyed {@code *}, so one literal can produce two branches.
 *
 * <p>When the limit is not reached the search continues in the inherited scope of the start
 * node's tree, and so on up the stack. A start node below its tree top is re-anchored there with
 * its absolute path. Results of nearer scopes always come before those of farther scopes; they
 * are never re-sorted.
 */
public final class PathResolver {
    private static final Logger LOGGER = LoggerFactory.getLogger(PathResolver.class);

    private PathResolver() {}

    /**
     * Returns the nodes matching {@code segments} from {@code start}, at most {@code limit} of
     * them ({@code 0} for no limit). A {@code null} start yields an empty list and an empty spec
     * yields the start node.
     */
    public static List<Node> resolve(Node start, List<String> segments, int limit) {
        List<Node> result = new ArrayList<>();
        if (start == null) {
            return result;
        }
        if (segments.isEmpty()) {
            result.add(start);
            return result;
        }

        Node node = start;
        List<String> spec = segments;
        while (true) {
            int before = result.size();
            collect(node, spec, 0, limit, result);
            if (LOGGER.isTraceEnabled()) {
                LOGGER.trace("{} matched {} node(s) in scope at depth {}",
                    String.join(KeySpec.SEPARATOR, spec), result.size() - before, node.depth());
            }
            if (isFull(result, limit)) {
                break;
            }
            Node inherited = node.root().inheritedRoot();
            if (inherited == null) {
                break;
            }
            if (!node.isScopeRoot()) {
                List<String> absolute = new ArrayList<>(node.path());
                absolute.addAll(spec);
                spec = absolute;
            }
            node = inherited;
        }
        return result;
    }

    /**
     * First match of {@code segments}, or empty when no scope has one.
     */
    public static Optional<Node> findFirst(Node start, List<String> segments) {
        List<Node> found = resolve(start, segments, 1);
        return found.isEmpty() ? Optional.empty() : Optional.of(found.get(0));
    }

    // Returns true once the limit is reached so callers stop expanding.
    private static boolean collect(Node node, List<String> spec, int index, int limit, List<Node> result) {
        String segment = spec.get(index);
        if (KeySpec.WILDCARD.equals(segment)) {
            for (Node child : node.children()) {
                if (visit(child, spec, index, limit, result)) {
                    return true;
                }
            }
            return false;
        }
        Node exact = node.child(segment);
        if (exact != null && visit(exact, spec, index, limit, result)) {
            return true;
        }
        Node fallback = node.child(KeySpec.WILDCARD);
        return fallback != null && visit(fallback, spec, index, limit, result);
    }

    private static boolean visit(Node child, List<String> spec, int index, int limit, List<Node> result) {
        if (index + 1 == spec.size()) {
            result.add(child);
            return isFull(result, limit);
        }
        return collect(child, spec, index + 1, limit, result);
    }

    private static boolean isFull(List<Node> result, int limit) {
        return limit > 0 && result.size() >= limit;
    }
}
