package com.di.snapdiff.routing;

import com.di.snapdiff.EngineFixture;
import com.di.snapdiff.exception.ConfigurationException;
import com.di.snapdiff.hashing.ContentHasher;
import com.di.snapdiff.manifest.PartitionKey;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.DefaultResourceLoader;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Router Tests")
class RouterTest {

    private Router router;

    @BeforeEach
    void setUp() {
        router = new Router(new RoutingConfigLoader(new DefaultResourceLoader())
                .parse(EngineFixture.classpath(EngineFixture.ROUTING)));
    }

    @Test
    @DisplayName("Should map a yearly file to one key with the canonical source id")
    void testSameGrain() {
        List<RoutedPartition> routed = router.route("unhcr_population", RawPartitionId.parse("2021"), "h");
        assertEquals(1, routed.size());
        assertEquals(PartitionKey.of("unhcr", "refugees", "2021"), routed.get(0).key());
        assertEquals("h", routed.get(0).scopedHash());
        assertEquals("unhcr_refugees", routed.get(0).routeId());
    }

    @Test
    @DisplayName("Should fan a yearly file out to twelve monthly keys with distinct slice hashes")
    void testFanOut() {
        List<RoutedPartition> routed = router.route("acled", RawPartitionId.parse("2020"), "h");
        assertEquals(12, routed.size());
        assertEquals("acled", routed.get(0).key().getSourceId());
        Set<String> hashes = routed.stream().map(RoutedPartition::scopedHash).collect(Collectors.toSet());
        assertEquals(12, hashes.size());
        assertEquals(ContentHasher.slice("h", "2020-05"), routed.get(4).scopedHash());
    }

    @Test
    @DisplayName("Should collapse monthly files into one yearly key")
    void testCollapse() {
        RoutedPartition jan = router.route("wdi_monthly", RawPartitionId.parse("2020-01"), "a").get(0);
        RoutedPartition feb = router.route("wdi_monthly", RawPartitionId.parse("2020-02"), "b").get(0);
        assertEquals(jan.key(), feb.key());
        assertEquals(PartitionKey.of("wdi", "indicators", "2020"), jan.key());

        String both = Router.collapseHash(List.of(jan, feb));
        assertEquals(both, Router.collapseHash(List.of(feb, jan)));

        RoutedPartition febChanged = router.route("wdi_monthly", RawPartitionId.parse("2020-02"), "c").get(0);
        assertNotEquals(both, Router.collapseHash(List.of(jan, febChanged)));
    }

    @Test
    @DisplayName("Should fail for a raw source no enabled rule matches")
    void testUnmatchedSource() {
        assertThrows(ConfigurationException.class, () -> router.resolve("mystery", "2020"));
        assertThrows(ConfigurationException.class, () -> router.resolve("retired", "2020"));
    }

    @Test
    @DisplayName("Should resolve keys without a hash")
    void testResolve() {
        List<PartitionKey> keys = router.resolve("unhcr", "2019-2020");
        assertEquals(List.of(PartitionKey.of("unhcr", "refugees", "2019"),
                PartitionKey.of("unhcr", "refugees", "2020")), keys);
    }
}
