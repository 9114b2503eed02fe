package com.gaia3d.globe.tile;

import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@Slf4j
@Tag("default")
public class LodPolicyTest {

    @Test
    void testDefaultTierSelection() {
        LodPolicy policy = LodPolicy.defaultPolicy();
        assertEquals("110m", policy.activeTier(150).getName());
        assertEquals("110m", policy.activeTier(339.9).getName());
        assertEquals("50m", policy.activeTier(340).getName());
        assertEquals("50m", policy.activeTier(519).getName());
        assertEquals("10m", policy.activeTier(520).getName());
        assertEquals("10m", policy.activeTier(1200).getName());
    }

    @Test
    void testTierSizes() {
        LodPolicy policy = LodPolicy.defaultPolicy();
        assertEquals(36.0, policy.activeTier(300).getTileSizeDegrees());
        assertEquals(18.0, policy.activeTier(400).getTileSizeDegrees());
        assertEquals(6.0, policy.activeTier(600).getTileSizeDegrees());
    }

    @Test
    void testScaleBeyondEveryTierFallsBackToFinest() {
        LodPolicy policy = new LodPolicy(List.of(new TileTier("coarse", 36, 300), new TileTier("fine", 18, 600)));
        assertEquals("fine", policy.activeTier(600).getName());
        assertEquals("fine", policy.activeTier(1e6).getName());
    }

    @Test
    void testBaseTierIsCoarsest() {
        LodPolicy policy = new LodPolicy(List.of(
                new TileTier("10m", 6, 9999),
                new TileTier("110m", 36, 340),
                new TileTier("50m", 18, 520)));
        assertEquals("110m", policy.baseTier().getName());
        assertEquals(List.of("110m", "50m", "10m"),
                policy.getTiers().stream().map(TileTier::getName).collect(java.util.stream.Collectors.toList()));
    }

    @Test
    void testEmptyTierListIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new LodPolicy(List.of()));
        assertThrows(IllegalArgumentException.class, () -> new LodPolicy(null));
    }

    @Test
    void testTierParsing() {
        TileTier tier = TileTier.parse(" 50m:18:520 ");
        assertEquals("50m", tier.getName());
        assertEquals(18.0, tier.getTileSizeDegrees());
        assertEquals(520.0, tier.getMaxScale());

        List<TileTier> tiers = TileTier.parseList("110m:36:340,50m:18:520,10m:6:9999");
        assertEquals(TileTier.defaultTiers(), tiers);

        assertThrows(IllegalArgumentException.class, () -> TileTier.parse("50m:18"));
        assertThrows(IllegalArgumentException.class, () -> TileTier.parse("50m:x:520"));
        assertThrows(IllegalArgumentException.class, () -> TileTier.parse("50m:0:520"));
        assertThrows(IllegalArgumentException.class, () -> TileTier.parse(":18:520"));
    }
}
