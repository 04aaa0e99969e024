package work.lcod.strata.template;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import work.lcod.strata.tree.Node;

/**
 * Function table for templating engines, with every function reading from one bound node. The
 * built-in names are {@code get}, {@code getnodes}, {@code getvalues}, {@code getmap} and
 * {@code getsettings}; callers may register more.
 */
public final class TemplateFunctions {
    private final Node node;
    private final Map<String, TreeFunction> functions = new LinkedHashMap<>();

    private TemplateFunctions(Node node) {
        this.node = Objects.requireNonNull(node, "node");
    }

    public static TemplateFunctions bind(Node node) {
        TemplateFunctions table = new TemplateFunctions(node);
        table.register("get", node::get);
        table.register("getnodes", node::getNodes);
        table.register("getvalues", node::getValues);
        table.register("getmap", node::getMap);
        table.register("getsettings", node::getSettings);
        return table;
    }

    public TemplateFunctions register(String name, TreeFunction function) {
        functions.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(function, "function"));
        return this;
    }

    public Node node() {
        return node;
    }

    public TreeFunction get(String name) {
        return functions.get(name);
    }

    public Object invoke(String name, Object... keys) {
        TreeFunction function = functions.get(name);
        if (function == null) {
            throw new IllegalArgumentException("Unknown template function: " + name);
        }
        return function.apply(keys);
    }

    /**
     * Ordered, read-only view suitable as a template engine's function namespace.
     */
    public Map<String, TreeFunction> asMap() {
        return Collections.unmodifiableMap(functions);
    }
}
