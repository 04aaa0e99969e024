package work.lcod.strata.settings;

import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.strata.shared.EscapedSplitter;
import work.lcod.strata.tree.KeySpec;
import work.lcod.strata.tree.Node;
import work.lcod.strata.tree.Reply;
import work.lcod.strata.value.Value;

/**
 * Evaluates settings groups: ordered lists of cases, each matched either unconditionally
 * ({@code default}) or by looking up context values ({@code keys}), much like a switch statement.
 *
 * <pre>
 * settings.1.default=label:Zip code
 * settings.1.continue=1
 * settings.2.keys.1=category
 * settings.2.keys.2=type
 * settings.2.1001.sale.value=suffix:(of house)
 * settings.3.keys.1=?pickup_location
 * settings.3.true.value=suffix:(of pick-up location)
 * </pre>
 *
 * <p>The first matching case ends the group unless it has a truthy {@code continue} child. A
 * matched payload is a comma separated list of {@code key:value} items; items without a key are
 * stored under {@code value}. A {@code ?name} key probes for the presence of {@code name} in the
 * context and contributes {@code true} or {@code false}.
 */
public final class SettingsEngine {
    private static final Logger LOGGER = LoggerFactory.getLogger(SettingsEngine.class);

    static final String DEFAULT = "default";
    static final String KEYS = "keys";
    static final String VALUE = "value";
    static final String CONTINUE = "continue";
    static final String PRESENCE_PROBE = "?";

    private SettingsEngine() {}

    /**
     * Runs every settings group matched by {@code keys}, looking up case keys in {@code context}.
     * When the spec ends with a wildcard, result keys are prefixed with the group key.
     */
    public static Reply evaluate(Node context, Object... keys) {
        Reply reply = new Reply();
        if (context == null || keys == null || keys.length == 0) {
            return reply;
        }
        boolean prefixed = KeySpec.endsWithWildcard(KeySpec.parse(keys));

        for (Node group : context.getNodes(keys)) {
            String prefix = prefixed ? group.key() : null;
            for (Node caseNode : group.getNodes(KeySpec.WILDCARD)) {
                boolean matched = false;
                Node defaultNode = caseNode.getNode(DEFAULT);
                if (defaultNode != null) {
                    addPayload(reply, prefix, defaultNode.textValue());
                    matched = true;
                } else {
                    Node keysNode = caseNode.getNode(KEYS);
                    if (keysNode != null) {
                        Node valueNode = caseNode.getNode(valueSpec(context, keysNode));
                        if (valueNode != null) {
                            addPayload(reply, prefix, valueNode.textValue());
                            matched = true;
                        }
                    }
                }
                if (matched) {
                    LOGGER.debug("settings case {} of {} matched", caseNode.key(), group.key());
                    if (!caseNode.getBool(CONTINUE)) {
                        break;
                    }
                }
            }
        }
        return reply;
    }

    private static List<Object> valueSpec(Node context, Node keysNode) {
        List<Object> spec = new ArrayList<>();
        for (String wanted : keysNode.getStringValues(KeySpec.WILDCARD)) {
            if (wanted.startsWith(PRESENCE_PROBE)) {
                spec.add(Boolean.toString(context.has(wanted.substring(PRESENCE_PROBE.length()))));
            } else {
                spec.add(Value.textOf(context.get(wanted)));
            }
        }
        spec.add(VALUE);
        return spec;
    }

    private static void addPayload(Reply reply, String prefix, String payload) {
        for (String item : EscapedSplitter.split(payload, ",")) {
            List<String> parts = EscapedSplitter.split(item, ":", EscapedSplitter.BACKSLASH, 2);
            String subKey = parts.size() == 2 ? parts.get(0) : VALUE;
            String subValue = parts.get(parts.size() - 1);
            if (prefix != null) {
                subKey = VALUE.equals(subKey) ? prefix : prefix + "_" + subKey;
            }
            reply.add(subKey, subValue);
        }
    }
}
