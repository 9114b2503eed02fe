package com.gaia3d.globe.tile;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Maps the view scale to a detail tier. The coarsest tier is the base layer drawn everywhere,
 * the active tier is drawn on top of it when finer.
 */
@Slf4j
public class LodPolicy {
    private final List<TileTier> tiers;

    public LodPolicy(List<TileTier> tiers) {
        if (tiers == null || tiers.isEmpty()) {
            throw new IllegalArgumentException("At least one tile tier is required");
        }
        List<TileTier> sorted = new ArrayList<>(tiers);
        sorted.sort(Comparator.comparingDouble(TileTier::getMaxScale));
        this.tiers = List.copyOf(sorted);
    }

    public static LodPolicy defaultPolicy() {
        return new LodPolicy(TileTier.defaultTiers());
    }

    /**
     * First tier whose max scale exceeds the given scale, the finest tier otherwise.
     */
    public TileTier activeTier(double scale) {
        for (TileTier tier : tiers) {
            if (scale < tier.getMaxScale()) {
                return tier;
            }
        }
        TileTier finest = tiers.get(tiers.size() - 1);
        log.debug("[Tile][LOD] no tier covers scale {}, using {}", scale, finest.getName());
        return finest;
    }

    public TileTier baseTier() {
        return tiers.get(0);
    }

    public List<TileTier> getTiers() {
        return tiers;
    }
}
