package work.lcod.strata.tree;

import java.io.IOException;
import java.util.List;

/**
 * Text renderings of a subtree, used by {@link Node#toString()} and the CLI.
 */
final class NodeDump {
    private NodeDump() {}

    static void write(Node node, Appendable out, boolean compact) throws IOException {
        if (compact) {
            out.append('{');
        }
        visit(node, out, compact, 0);
        if (compact) {
            out.append('}');
        }
    }

    private static void visit(Node node, Appendable out, boolean compact, int depth) throws IOException {
        boolean nested = compact && depth > 0;
        if (nested) {
            out.append(node.key()).append('=');
            if (node.value() != null) {
                out.append(node.textValue());
            }
        }
        if (!node.isLeaf()) {
            if (nested) {
                out.append('{');
            }
            List<Node> children = node.children();
            for (int i = 0; i < children.size(); i++) {
                if (compact && i > 0) {
                    out.append(',');
                }
                visit(children.get(i), out, compact, depth + 1);
            }
            if (nested) {
                out.append('}');
            }
        } else if (!compact && (depth > 0 || node.value() != null)) {
            out.append(String.join(KeySpec.SEPARATOR, node.path()))
                .append('=')
                .append(node.textValue())
                .append('\n');
        }
    }
}
