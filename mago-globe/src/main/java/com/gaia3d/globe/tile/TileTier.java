package com.gaia3d.globe.tile;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.ArrayList;
import java.util.List;

/**
 * A named resolution level of the surface geometry tiles.
 * The name doubles as the tile file suffix ("110m" in {@code land_110m_-180_-90.json}).
 * Tile corners are named in whole degrees, so the tile size must be a whole number of degrees.
 */
@Getter
@EqualsAndHashCode
public class TileTier {
    private final String name;
    private final double tileSizeDegrees;
    private final double maxScale;

    public TileTier(String name, double tileSizeDegrees, double maxScale) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Tier name cannot be null or empty");
        }
        if (!(tileSizeDegrees > 0) || tileSizeDegrees > 180) {
            throw new IllegalArgumentException("Tile size must be in (0, 180] degrees: " + tileSizeDegrees);
        }
        if (tileSizeDegrees != Math.rint(tileSizeDegrees)) {
            throw new IllegalArgumentException("Tile size must be a whole number of degrees: " + tileSizeDegrees);
        }
        if (!(maxScale > 0)) {
            throw new IllegalArgumentException("Tier max scale must be positive: " + maxScale);
        }
        this.name = name;
        this.tileSizeDegrees = tileSizeDegrees;
        this.maxScale = maxScale;
    }

    /**
     * Parses {@code name:tileSize:maxScale}, e.g. {@code 50m:18:520}.
     */
    public static TileTier parse(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Tier definition cannot be null");
        }
        String[] tokens = value.trim().split(":");
        if (tokens.length != 3) {
            throw new IllegalArgumentException(
                    String.format("Invalid tier definition: '%s'. Expected name:tileSizeDegrees:maxScale", value));
        }
        try {
            return new TileTier(tokens[0].trim(), Double.parseDouble(tokens[1].trim()), Double.parseDouble(tokens[2].trim()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(
                    String.format("Invalid number in tier definition: '%s'", value), e);
        }
    }

    /**
     * Parses a comma separated list of tier definitions.
     */
    public static List<TileTier> parseList(String value) {
        List<TileTier> tiers = new ArrayList<>();
        for (String token : value.split(",")) {
            if (!token.isBlank()) {
                tiers.add(parse(token));
            }
        }
        return tiers;
    }

    /**
     * Natural Earth land tiers: 110m in 36 degree tiles, 50m in 18 degree tiles, 10m in 6 degree tiles.
     */
    public static List<TileTier> defaultTiers() {
        return List.of(
                new TileTier("110m", 36, 340),
                new TileTier("50m", 18, 520),
                new TileTier("10m", 6, 9999));
    }

    @Override
    public String toString() {
        return name + "(" + tileSizeDegrees + "deg, <" + maxScale + ")";
    }
}
