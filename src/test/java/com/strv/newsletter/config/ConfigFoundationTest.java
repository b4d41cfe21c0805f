package com.strv.newsletter.config;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ConfigFoundationTest {

    @Test
    void parseJson5() {
        Map<String, Object> map = ConfigFoundation.parse("{\n" +
                "  // comment\n" +
                "  name: 'dispatch',\n" +
                "  count: 4,\n" +
                "  nested: { enabled: true }\n" +
                "}");

        BasicConfig config = new BasicConfig(map);
        assertEquals("dispatch", config.getStringProperty("name"));
        assertEquals(4L, config.getLongProperty("count"));
        assertTrue(new BasicConfig(config.getMapProperty("nested")).getBooleanProperty("enabled"));
    }

    @Test
    void parseEmpty() {
        assertTrue(ConfigFoundation.parse("").isEmpty(), "Blank content should give empty map");
    }

    @Test
    void magicReplaceSystemProperty() {
        System.setProperty("DISPATCH_MAGIC_TEST", "value");
        try {
            assertEquals("a value b", ConfigFoundation.magicReplace("a {$DISPATCH_MAGIC_TEST} b"));
        } finally {
            System.clearProperty("DISPATCH_MAGIC_TEST");
        }
    }

    @Test
    void magicReplaceUnknown() {
        assertEquals("key=", ConfigFoundation.magicReplace("key={$DISPATCH_MAGIC_UNSET_42}"));
    }

    @Test
    void magicReplaceKeepsSpecialCharacters() {
        System.setProperty("DISPATCH_MAGIC_DOLLAR", "p$ss\\word");
        try {
            assertEquals("p$ss\\word", ConfigFoundation.magicReplace("{$DISPATCH_MAGIC_DOLLAR}"));
        } finally {
            System.clearProperty("DISPATCH_MAGIC_DOLLAR");
        }
    }

    @Test
    void longPropertyFromString() {
        BasicConfig config = new BasicConfig(Map.of("port", "2525", "bad", "x"));
        assertEquals(2525L, config.getLongProperty("port"));
        assertEquals(7L, config.getLongProperty("bad", 7L), "Unparsable value should fall back to default");
        assertEquals(9L, config.getLongProperty("missing", 9L));
    }
}
