package work.lcod.strata.tree;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.junit.jupiter.api.Test;
import work.lcod.strata.value.Value;

class NodeListTest {
    private static Node items() {
        Node root = Node.newRoot();
        root.setKey("item.1.price", "10");
        root.setKey("item.1.name", "Socks");
        root.setKey("item.2.price", "25");
        root.setKey("item.2.name", "Cool shirt");
        root.setKey("item.3.price", "17");
        root.setKey("item.3.name", "Coffee mug");
        return root;
    }

    @Test
    void mapsNodesInResolutionOrder() {
        Node root = items();
        root.setKey("sales.vat", "0.5");
        double vat = root.getFloat("sales.vat");

        List<String> described = root.getNodes("item.*")
            .map(node -> String.format(Locale.ROOT, "%s (%.2f)", node.getString("name"), node.getFloat("price") * (1 + vat)));

        assertEquals(List.of("Socks (15.00)", "Cool shirt (37.50)", "Coffee mug (25.50)"), described);
    }

    @Test
    void filtersByValue() {
        NodeList prices = items().getNodes("item.*.price");
        NodeList cheap = prices.filterByValue("10");
        assertEquals(1, cheap.size());
        assertEquals(List.of("item", "1", "price"), cheap.get(0).path());
        assertTrue(prices.filterByValue("99").isEmpty());
        assertFalse(prices.first().isEmpty());
    }

    @Test
    void convertsSelectedValuesInPlace() {
        Node root = items();
        root.getNodes("item.*.*").valuesToInt("price");

        assertEquals(Value.of(10L), root.get("item.1.price"));
        assertEquals(Value.of("Socks"), root.get("item.1.name"));
    }

    @Test
    void convertsDurations() {
        Node root = Node.newRoot();
        root.setKey("timeouts.read", "1m30s");
        root.setKey("timeouts.write", "bogus");
        root.getNodes("timeouts.*").valuesToDuration();

        assertEquals(Value.of(Duration.ofSeconds(90)), root.get("timeouts.read"));
        assertEquals(Value.of(Duration.ZERO), root.get("timeouts.write"));
    }

    @Test
    void rendersNodesInBrackets() {
        Node base = Node.fromMap(Map.of("x.a", 1));
        Node scope = base.with(Map.of("y.b", 2));
        assertEquals("[{b=2} {a=1}]", scope.getNodes("*").toString());
    }
}
