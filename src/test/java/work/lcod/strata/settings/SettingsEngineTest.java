package work.lcod.strata.settings;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import work.lcod.strata.tree.Node;
import work.lcod.strata.tree.NodeFlag;
import work.lcod.strata.tree.Reply;

class SettingsEngineTest {
    private Node root;

    @BeforeEach
    void setUp() {
        root = Node.newRoot();
        root.setKey("settings.types.1.keys.1", "category");
        root.setKey("settings.types.1.1001.value", "sell,rent,buy");
        root.setKey("settings.types.1.1002.value", "sell,rent,buy,donation");
        root.setKey("settings.types.1.1003.value", "rent,buy");
        root.setKey("settings.types.2.default", "sell");

        root.setKey("settings.params.1.keys.1", "category");
        root.setKey("settings.params.1.keys.2", "type");
        root.setKey("settings.params.1.1001.sell.value", "price");
        root.setKey("settings.params.1.1002.*.value", "price,mileage");
        root.setKey("settings.params.1.continue", "1");
        root.setKey("settings.params.2.default", "color");

        root.setKey("settings.images.1.keys.1", "?category");
        root.setKey("settings.images.1.false.value", "max:0");
        root.setKey("settings.images.2.keys.1", "?type");
        root.setKey("settings.images.2.false.value", "max:0");
        root.setKey("settings.images.3.keys.1", "type");
        root.setKey("settings.images.3.buy.value", "max:0");
        root.setKey("settings.images.4.keys.1", "category");
        root.setKey("settings.images.4.1001.value", "max:12,extra:4,extra_price:5");
        root.setKey("settings.images.4.1002.value", "max:12");
        root.setKey("settings.images.4.1003.value", "max:0,comment:Easy as 1\\,2\\,3");
        root.setKey("settings.images.5.default", "max:8");
        root.sortRecursively();
    }

    private Reply settings(String group, Map<String, ?> context) {
        return root.with(context).getSettings("settings", group);
    }

    private static Reply reply(String... pairs) {
        Reply reply = new Reply();
        for (int i = 0; i < pairs.length; i += 2) {
            reply.add(pairs[i], pairs[i + 1]);
        }
        return reply;
    }

    @Test
    void singleKeyCasesWithDefault() {
        assertEquals(reply("value", "sell"), settings("types", Map.of()));
        assertEquals(reply("value", "sell", "value", "rent", "value", "buy"), settings("types", Map.of("category", 1001)));
        assertEquals(reply("value", "sell", "value", "rent", "value", "buy", "value", "donation"),
            settings("types", Map.of("category", 1002)));
        assertEquals(reply("value", "rent", "value", "buy"), settings("types", Map.of("category", 1003)));
        assertEquals(reply("value", "sell"), settings("types", Map.of("category", 1099)));
    }

    @Test
    void twoKeysWithLiteralWildcardAndContinue() {
        assertEquals(reply("value", "color"), settings("params", Map.of()));
        assertEquals(reply("value", "color"), settings("params", Map.of("category", 1001)));
        assertEquals(reply("value", "color"), settings("params", Map.of("category", "1001")));
        assertEquals(reply("value", "color"), settings("params", Map.of("type", "sell")));
        assertEquals(reply("value", "price", "value", "color"),
            settings("params", Map.of("category", 1001, "type", "sell")));
        assertEquals(reply("value", "price", "value", "mileage", "value", "color"),
            settings("params", Map.of("category", 1002, "type", "sell")));
        assertEquals(reply("value", "price", "value", "mileage", "value", "color"),
            settings("params", Map.of("category", 1002, "type", "whatever")));
    }

    @Test
    void presenceProbesNamedValuesAndEscapes() {
        assertEquals(reply("max", "0"), settings("images", Map.of()));
        assertEquals(reply("max", "0"), settings("images", Map.of("category", 1001)));
        assertEquals(reply("max", "0"), settings("images", Map.of("type", "sell")));
        assertEquals(reply("max", "8"), settings("images", Map.of("category", 1099, "type", "whatever")));
        assertEquals(reply("max", "12", "extra", "4", "extra_price", "5"),
            settings("images", Map.of("category", 1001, "type", "whatever")));
        assertEquals(reply("max", "0", "comment", "Easy as 1,2,3"),
            settings("images", Map.of("category", 1003, "type", "whatever")));
    }

    @Test
    void wildcardSpecPrefixesKeysWithGroupName() {
        Reply reply = root.with(Map.of("category", 1001, "type", "whatever")).getSettings("settings.*");

        assertEquals(reply(
            "images_max", "12", "images_extra", "4", "images_extra_price", "5",
            "params", "color",
            "types", "sell", "types", "rent", "types", "buy"), reply);
    }

    @Test
    void zipCodeLabelExample() {
        Node conf = Node.newRoot();
        conf.setKey("settings.1.default", "label:Zip code");
        conf.setKey("settings.1.continue", "1");
        conf.setKey("settings.2.keys.1", "category");
        conf.setKey("settings.2.keys.2", "type");
        conf.setKey("settings.2.3041.s.value", "suffix:(of house)");

        assertEquals(reply("label", "Zip code", "suffix", "(of house)"),
            conf.with(Map.of("category", 3041, "type", "s")).getSettings("settings"));
        assertEquals(reply("label", "Zip code"),
            conf.with(Map.of("category", 9999)).getSettings("settings"));
    }

    @Test
    void emptyKeysListResolvesLiteralValueChild() {
        Node conf = Node.newRoot();
        conf.addNode("group.1.keys").addFlag(NodeFlag.FORCE_ARRAY);
        conf.setKey("group.1.value", "found");

        assertEquals(reply("value", "found"), conf.getSettings("group"));
    }

    @Test
    void degenerateInputsYieldEmptyReply() {
        assertTrue(SettingsEngine.evaluate(null, "settings").isEmpty());
        assertTrue(root.getSettings().isEmpty());
        assertTrue(root.getSettings("missing").isEmpty());
    }
}
