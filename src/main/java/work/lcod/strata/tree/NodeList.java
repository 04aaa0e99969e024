package work.lcod.strata.tree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.stream.Stream;
import work.lcod.strata.value.Value;

/**
 * Ordered result of a path lookup.
 */
public final class NodeList implements Iterable<Node> {
    private final List<Node> nodes;

    public NodeList(List<Node> nodes) {
        this.nodes = Collections.unmodifiableList(new ArrayList<>(nodes));
    }

    public int size() {
        return nodes.size();
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    public Node get(int index) {
        return nodes.get(index);
    }

    public Optional<Node> first() {
        return nodes.isEmpty() ? Optional.empty() : Optional.of(nodes.get(0));
    }

    public List<Node> asList() {
        return nodes;
    }

    public Stream<Node> stream() {
        return nodes.stream();
    }

    @Override
    public Iterator<Node> iterator() {
        return nodes.iterator();
    }

    public <R> List<R> map(Function<? super Node, ? extends R> mapper) {
        List<R> result = new ArrayList<>(nodes.size());
        for (Node node : nodes) {
            result.add(mapper.apply(node));
        }
        return result;
    }

    public NodeList filter(Predicate<? super Node> predicate) {
        List<Node> kept = new ArrayList<>(nodes.size());
        for (Node node : nodes) {
            if (predicate.test(node)) {
                kept.add(node);
            }
        }
        return new NodeList(kept);
    }

    public NodeList filterByValue(Object raw) {
        Value wanted = Value.of(raw);
        return filter(node -> Objects.equals(node.value(), wanted));
    }

    /**
     * Replaces the value of every node whose key is listed (every node when no key is given) with
     * the converter's result.
     */
    public NodeList convertValues(Function<? super Node, ?> converter, String... keys) {
        Set<String> wanted = Set.of(keys);
        for (Node node : nodes) {
            if (wanted.isEmpty() || wanted.contains(node.key())) {
                node.setValue(converter.apply(node));
            }
        }
        return this;
    }

    public NodeList valuesToString(String... keys) {
        return convertValues(Node::getString, keys);
    }

    public NodeList valuesToInt(String... keys) {
        return convertValues(Node::getInt, keys);
    }

    public NodeList valuesToFloat(String... keys) {
        return convertValues(Node::getFloat, keys);
    }

    public NodeList valuesToBool(String... keys) {
        return convertValues(Node::getBool, keys);
    }

    public NodeList valuesToDuration(String... keys) {
        return convertValues(Node::getDuration, keys);
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof NodeList list && nodes.equals(list.nodes);
    }

    @Override
    public int hashCode() {
        return nodes.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder text = new StringBuilder("[");
        for (int i = 0; i < nodes.size(); i++) {
            if (i > 0) {
                text.append(' ');
            }
            text.append(nodes.get(i));
        }
        return text.append(']').toString();
    }
}
