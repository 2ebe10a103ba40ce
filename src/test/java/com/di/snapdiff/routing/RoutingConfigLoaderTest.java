package com.di.snapdiff.routing;

import com.di.snapdiff.EngineFixture;
import com.di.snapdiff.exception.ConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.springframework.core.io.DefaultResourceLoader;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RoutingConfigLoader Tests")
class RoutingConfigLoaderTest {

    private final RoutingConfigLoader loader = new RoutingConfigLoader(new DefaultResourceLoader());

    private RoutingRuleSet parse(String yaml) {
        return loader.parse(new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    @DisplayName("Should load rules in file order with enabled defaulting to true")
    void testLoadFixture() {
        RoutingRuleSet rules = loader.parse(EngineFixture.classpath(EngineFixture.ROUTING));
        assertEquals(4, rules.rules().size());
        assertEquals(3, rules.enabledRules().size());
        assertEquals("unhcr_refugees", rules.rules().get(0).getRouteId());
        assertEquals(Grain.MONTH, rules.rules().get(1).getGrain());
        assertFalse(rules.rules().get(3).isEnabled());
    }

    @Test
    @DisplayName("Should load the packaged routing file from the classpath")
    void testLoadByLocation() {
        RoutingRuleSet rules = loader.load("classpath:routing.yml");
        assertFalse(rules.enabledRules().isEmpty());
    }

    @Test
    @DisplayName("Should fail for a missing routing file")
    void testMissingFile() {
        assertThrows(ConfigurationException.class, () -> loader.load("classpath:no-such-routing.yml"));
    }

    @Test
    @DisplayName("Should keep the raw source id when no canonical source is set")
    void testCanonicalSourceDefault() {
        RoutingRuleSet rules = parse("rules:\n  - {route_id: r, pattern: 'a.*', entity: e, grain: year}\n");
        assertEquals("abc", rules.rules().get(0).canonicalSource("abc"));
        assertTrue(rules.rules().get(0).matches("abc"));
        assertFalse(rules.rules().get(0).matches("xabc"));
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "rules: []\n",
            "rules:\n  - {pattern: 'a', entity: e, grain: year}\n",
            "rules:\n  - {route_id: r, entity: e, grain: year}\n",
            "rules:\n  - {route_id: r, pattern: 'a', entity: e, grain: week}\n",
            "rules:\n  - {route_id: r, pattern: '(', entity: e, grain: year}\n",
            "rules:\n  - {route_id: r, pattern: 'a', entity: e, grain: year}\n  - {route_id: r, pattern: 'b', entity: f, grain: year}\n",
            "rules:\n  - {route_id: r, pattern: 'a', entity: e, grain: year, colour: red}\n",
            "rules: [unclosed\n"
    })
    @DisplayName("Should reject malformed routing YAML")
    void testInvalid(String yaml) {
        assertThrows(ConfigurationException.class, () -> parse(yaml));
    }
}
