package work.lcod.strata.tree;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import work.lcod.strata.resolve.PathResolver;
import work.lcod.strata.settings.SettingsEngine;
import work.lcod.strata.value.Coercions;
import work.lcod.strata.value.Lookup;
import work.lcod.strata.value.Value;

/**
 * Vertex of a configuration tree: a key, an optional typed value and ordered, uniquely keyed
 * children. A tree whose top node is a scope root may inherit from another tree (see
 * {@link #with(Map)}); lookups that miss in the scope continue in the inherited trees.
 *
 * <p>Key arguments ({@code Object... keys}) are parsed with {@link KeySpec}: each argument is
 * converted to text and split on dots, and {@code *} matches every child at its level. Without
 * key arguments a lookup addresses the node itself.
 *
 * <p>Trees are not thread-safe.
 */
public final class Node {
    private String key;
    private Value value;
    private final Map<String, Node> children = new HashMap<>();
    private final List<String> childKeys = new ArrayList<>();
    private final EnumSet<NodeFlag> flags = EnumSet.noneOf(NodeFlag.class);
    private ParentLink link;

    private Node(String key) {
        this.key = Objects.requireNonNull(key, "key");
    }

    public static Node newNode(String key) {
        return new Node(key);
    }

    /**
     * Creates an empty scope root that inherits from nothing.
     */
    public static Node newRoot() {
        Node root = new Node("");
        root.flags.add(NodeFlag.IS_ROOT);
        return root;
    }

    public static Node fromMap(Map<String, ?> entries) {
        return newRoot().mergeMap(entries);
    }

    public String key() {
        return key;
    }

    public Value value() {
        return value;
    }

    public Node setValue(Object raw) {
        this.value = Value.of(raw);
        return this;
    }

    /**
     * Text form of this node's own value; empty when the node carries none.
     */
    public String textValue() {
        return Value.textOf(value);
    }

    public Set<NodeFlag> flags() {
        return Collections.unmodifiableSet(EnumSet.copyOf(flags));
    }

    public boolean hasFlag(NodeFlag flag) {
        return flags.contains(flag);
    }

    public Node addFlag(NodeFlag flag) {
        if (flag == NodeFlag.IS_ROOT) {
            throw new IllegalArgumentException("IS_ROOT is managed by scope creation");
        }
        flags.add(flag);
        return this;
    }

    public Node removeFlag(NodeFlag flag) {
        if (flag == NodeFlag.IS_ROOT) {
            throw new IllegalArgumentException("IS_ROOT is managed by scope creation");
        }
        flags.remove(flag);
        return this;
    }

    public boolean isScopeRoot() {
        return flags.contains(NodeFlag.IS_ROOT);
    }

    public ParentLink link() {
        return link;
    }

    /**
     * The node owning this one in the same tree, or {@code null} for a tree top or a detached node.
     */
    public Node parent() {
        return link instanceof ParentLink.Structural structural ? structural.parent() : null;
    }

    /**
     * For a scope root, the root of the tree it inherits from; {@code null} otherwise.
     */
    public Node inheritedRoot() {
        return link instanceof ParentLink.Scope scope ? scope.inheritedRoot() : null;
    }

    public List<String> childKeys() {
        return Collections.unmodifiableList(childKeys);
    }

    public Node child(String childKey) {
        return children.get(childKey);
    }

    public List<Node> children() {
        List<Node> ordered = new ArrayList<>(childKeys.size());
        for (String childKey : childKeys) {
            ordered.add(children.get(childKey));
        }
        return ordered;
    }

    public int size() {
        return childKeys.size();
    }

    public boolean isLeaf() {
        return childKeys.isEmpty();
    }

    /**
     * Top of the tree this node belongs to: the closest ancestor that has no structural parent.
     */
    public Node root() {
        Node current = this;
        while (current.link instanceof ParentLink.Structural structural) {
            current = structural.parent();
        }
        return current;
    }

    /**
     * Number of structural hops up to the tree top; a scope root is always at depth 0.
     */
    public int depth() {
        int depth = 0;
        Node current = this;
        while (current.link instanceof ParentLink.Structural structural) {
            depth++;
            current = structural.parent();
        }
        return depth;
    }

    /**
     * Keys from the tree top (excluded) down to this node.
     */
    public List<String> path() {
        int depth = depth();
        String[] path = new String[depth];
        Node current = this;
        for (int index = depth - 1; index >= 0; index--) {
            path[index] = current.key;
            current = current.parent();
        }
        return List.of(path);
    }

    // Structure

    /**
     * Moves {@code child} under this node. The child leaves its previous parent and replaces any
     * existing child with the same key; the key is appended to the child order.
     */
    public Node adopt(Node child) {
        Objects.requireNonNull(child, "child");
        for (Node ancestor = this; ancestor != null; ancestor = ancestor.parent()) {
            if (ancestor == child) {
                throw new IllegalArgumentException("Cannot adopt a node into its own subtree: " + child.key);
            }
        }
        for (Node scope = root().inheritedRoot(); scope != null; scope = scope.inheritedRoot()) {
            if (scope == child) {
                throw new IllegalArgumentException("Cannot adopt a tree this node inherits from: " + child.key);
            }
        }
        Node former = child.parent();
        if (former != null) {
            former.detach(child.key);
        }
        if (children.containsKey(child.key)) {
            detach(child.key);
        }
        children.put(child.key, child);
        childKeys.add(child.key);
        child.link = new ParentLink.Structural(this);
        child.flags.remove(NodeFlag.IS_ROOT);
        return child;
    }

    /**
     * Detaches the node at the given path and returns it with its subtree intact, or {@code null}
     * when any segment is missing.
     */
    public Node unset(Object... keys) {
        List<String> segments = KeySpec.parse(keys);
        if (segments.isEmpty()) {
            return null;
        }
        Node holder = this;
        for (int index = 0; index < segments.size() - 1; index++) {
            holder = holder.children.get(segments.get(index));
            if (holder == null) {
                return null;
            }
        }
        return holder.detach(segments.get(segments.size() - 1));
    }

    private Node detach(String childKey) {
        Node child = children.remove(childKey);
        if (child == null) {
            return null;
        }
        childKeys.remove(childKey);
        child.link = null;
        return child;
    }

    /**
     * Changes this node's key, keeping the parent's index consistent. The node moves to the end
     * of its parent's child order.
     */
    public Node rename(String newKey) {
        Objects.requireNonNull(newKey, "newKey");
        Node parent = parent();
        if (parent == null) {
            this.key = newKey;
            return this;
        }
        parent.detach(key);
        this.key = newKey;
        parent.adopt(this);
        return this;
    }

    /**
     * Copies {@code source} (value and descendants) into the child of this node with the same
     * key, creating it when needed. Values are overwritten, even with an unset value; existing
     * children missing from the source are kept. Returns the destination node.
     */
    public Node merge(Node source) {
        if (source == null) {
            return null;
        }
        Node target = children.get(source.key);
        if (target == null) {
            target = adopt(new Node(source.key));
            sort();
        }
        target.value = source.value;
        for (Node sourceChild : source.children()) {
            target.merge(sourceChild);
        }
        return target;
    }

    /**
     * Sorts the child order: numerically when every key is an integer, by text otherwise.
     */
    public Node sort() {
        if (NumericKeyComparator.allNumeric(childKeys)) {
            childKeys.sort(NumericKeyComparator.INSTANCE);
        } else {
            Collections.sort(childKeys);
        }
        return this;
    }

    public Node sortRecursively() {
        sort();
        for (Node child : children.values()) {
            if (!child.isLeaf()) {
                child.sortRecursively();
            }
        }
        return this;
    }

    // Writes

    /**
     * Creates or updates the node at {@code keys}, creating intermediate nodes as needed. A
     * {@code null} value leaves an existing value untouched. Returns {@code null} for an empty path.
     */
    public Node set(Collection<?> keys, Object raw) {
        return write(KeySpec.parse(keys), Value.of(raw));
    }

    public Node setKey(String path, Object raw) {
        return write(KeySpec.parse(path), Value.of(raw));
    }

    private Node write(List<String> segments, Value newValue) {
        if (segments.isEmpty()) {
            return null;
        }
        Node target = this;
        for (String segment : segments) {
            Node next = target.children.get(segment);
            if (next == null) {
                next = target.adopt(new Node(segment));
            }
            target = next;
        }
        if (newValue != null) {
            target.value = newValue;
        }
        return target;
    }

    public Node addNode(Object... keys) {
        return write(KeySpec.parse(keys), null);
    }

    public Node mergeMap(Map<String, ?> entries) {
        if (entries != null) {
            for (Map.Entry<String, ?> entry : entries.entrySet()) {
                setKey(entry.getKey(), entry.getValue());
            }
        }
        return this;
    }

    /**
     * Adds a child keyed by the next unused integer, starting at the current child count plus one.
     */
    public Node push() {
        int id = childKeys.size();
        while (true) {
            id++;
            String candidate = Integer.toString(id);
            if (!children.containsKey(candidate)) {
                return write(List.of(candidate), null);
            }
        }
    }

    public Node pushValues(Object... raws) {
        for (Object raw : raws) {
            push().setValue(raw);
        }
        return this;
    }

    /**
     * Sets the value on the first call; later calls turn the node into a numbered list and append.
     * Returns the node holding {@code raw}.
     */
    public Node fillKey(String path, Object raw) {
        Node holder = write(KeySpec.parse(path), null);
        Node target = null;
        if (holder.isLeaf()) {
            if (holder.value == null) {
                target = holder;
            } else {
                holder.push().value = holder.value;
                holder.value = null;
            }
        }
        if (target == null) {
            target = holder.push();
        }
        target.setValue(raw);
        return target;
    }

    // Scopes

    public Node with() {
        return with(Map.of());
    }

    /**
     * Stacks a new scope on top of this node's tree and writes {@code entries} into it. When called
     * on an interior node the entries are written under the same path in the new scope. Returns the
     * new scope root; the inherited tree is never modified.
     */
    public Node with(Map<String, ?> entries) {
        Node inherited = root();
        Node scope = newRoot();
        scope.link = new ParentLink.Scope(inherited);
        Node target = inherited == this ? scope : scope.write(path(), null);
        target.mergeMap(entries);
        return scope;
    }

    // Lookups

    public NodeList getNodes(Object... keys) {
        return new NodeList(PathResolver.resolve(this, KeySpec.parse(keys), 0));
    }

    public Optional<Node> findNode(Object... keys) {
        return PathResolver.findFirst(this, KeySpec.parse(keys));
    }

    public Node getNode(Object... keys) {
        return findNode(keys).orElse(null);
    }

    public Node getNodeOrDefault(Node fallback, Object... keys) {
        return findNode(keys).orElse(fallback);
    }

    public Lookup<Node> tryGetNode(Object... keys) {
        return this.<Node>lookupNode(Lookup::found, keys);
    }

    public Node requireNode(Object... keys) {
        return tryGetNode(keys).orElseThrow(KeySpec.join(keys));
    }

    public boolean has(Object... keys) {
        return findNode(keys).isPresent();
    }

    /**
     * Value of the first matching node, or {@code null}.
     */
    public Value get(Object... keys) {
        Node found = getNode(keys);
        return found == null ? null : found.value;
    }

    public Value getOrDefault(Object fallback, Object... keys) {
        return findNode(keys).map(node -> node.value).orElseGet(() -> Value.of(fallback));
    }

    public Value require(Object... keys) {
        return requireNode(keys).value;
    }

    /**
     * Values of every matching leaf, in resolution order.
     */
    public List<Value> getValues(Object... keys) {
        List<Value> values = new ArrayList<>();
        for (Node node : getNodes(keys)) {
            if (node.isLeaf()) {
                values.add(node.value);
            }
        }
        return values;
    }

    public List<String> getStringValues(Object... keys) {
        return getNodes(keys).map(Node::textValue);
    }

    /**
     * Builds a map for specs like {@code *.*.common.region.*.name}: the key of the node matched at
     * the last wildcard maps to the text value found by the rest of the spec.
     */
    public Map<String, String> getMap(Object... keys) {
        List<String> segments = keys.length == 0 ? List.of(KeySpec.WILDCARD) : KeySpec.parse(keys);
        int lastWildcard = Math.max(0, segments.lastIndexOf(KeySpec.WILDCARD));
        List<String> head = segments.subList(0, lastWildcard + 1);
        List<String> tail = segments.subList(lastWildcard + 1, segments.size());

        Map<String, String> result = new LinkedHashMap<>();
        for (Node node : getNodes(head)) {
            Node target = tail.isEmpty() ? node : node.getNode(tail);
            if (target != null) {
                result.put(node.key, target.textValue());
            }
        }
        return result;
    }

    /**
     * Evaluates the settings groups matched by {@code keys}, using this node's tree as the
     * key/value context.
     */
    public Reply getSettings(Object... keys) {
        return SettingsEngine.evaluate(this, keys);
    }

    // Typed accessors

    public Lookup<String> tryGetString(Object... keys) {
        return lookup(Coercions::toText, keys);
    }

    public Lookup<Long> tryGetInt(Object... keys) {
        return lookup(Coercions::toLong, keys);
    }

    public Lookup<Double> tryGetFloat(Object... keys) {
        return lookup(Coercions::toDouble, keys);
    }

    public Lookup<Boolean> tryGetBool(Object... keys) {
        return lookup(Coercions::toBoolean, keys);
    }

    public Lookup<Duration> tryGetDuration(Object... keys) {
        return lookup(Coercions::toDuration, keys);
    }

    public Lookup<Instant> tryGetTime(Object... keys) {
        return lookup(Coercions::toInstant, keys);
    }

    public String getString(Object... keys) {
        return tryGetString(keys).orElse("");
    }

    public long getInt(Object... keys) {
        return tryGetInt(keys).orElse(0L);
    }

    public double getFloat(Object... keys) {
        return tryGetFloat(keys).orElse(0.0);
    }

    public boolean getBool(Object... keys) {
        return tryGetBool(keys).orElse(false);
    }

    public Duration getDuration(Object... keys) {
        return tryGetDuration(keys).orElse(Duration.ZERO);
    }

    public Instant getTime(Object... keys) {
        return tryGetTime(keys).orElse(Instant.EPOCH);
    }

    public String getStringOrDefault(String fallback, Object... keys) {
        return tryGetString(keys).orElse(fallback);
    }

    public long getIntOrDefault(long fallback, Object... keys) {
        return tryGetInt(keys).orElse(fallback);
    }

    public double getFloatOrDefault(double fallback, Object... keys) {
        return tryGetFloat(keys).orElse(fallback);
    }

    public boolean getBoolOrDefault(boolean fallback, Object... keys) {
        return tryGetBool(keys).orElse(fallback);
    }

    public Duration getDurationOrDefault(Duration fallback, Object... keys) {
        return tryGetDuration(keys).orElse(fallback);
    }

    public Instant getTimeOrDefault(Instant fallback, Object... keys) {
        return tryGetTime(keys).orElse(fallback);
    }

    public String requireString(Object... keys) {
        return tryGetString(keys).orElseThrow(KeySpec.join(keys));
    }

    public long requireInt(Object... keys) {
        return tryGetInt(keys).orElseThrow(KeySpec.join(keys));
    }

    public double requireFloat(Object... keys) {
        return tryGetFloat(keys).orElseThrow(KeySpec.join(keys));
    }

    public boolean requireBool(Object... keys) {
        return tryGetBool(keys).orElseThrow(KeySpec.join(keys));
    }

    public Duration requireDuration(Object... keys) {
        return tryGetDuration(keys).orElseThrow(KeySpec.join(keys));
    }

    public Instant requireTime(Object... keys) {
        return tryGetTime(keys).orElseThrow(KeySpec.join(keys));
    }

    private <T> Lookup<T> lookupNode(Function<Node, Lookup<T>> conversion, Object... keys) {
        Optional<Node> found = findNode(keys);
        return found.isPresent() ? conversion.apply(found.get()) : Lookup.notFound();
    }

    private <T> Lookup<T> lookup(Function<Value, Lookup<T>> conversion, Object... keys) {
        return lookupNode(node -> conversion.apply(node.value), keys);
    }

    // Dumps

    /**
     * Writes this subtree either in the compact form {@code {a=1,b={c=2}}} or, when
     * {@code compact} is false, as one {@code path=value} line per leaf.
     */
    public void dump(Appendable out, boolean compact) throws IOException {
        NodeDump.write(this, out, compact);
    }

    @Override
    public String toString() {
        StringBuilder text = new StringBuilder();
        try {
            dump(text, true);
        } catch (IOException ex) {
            throw new UncheckedIOException(ex);
        }
        return text.toString();
    }
}
