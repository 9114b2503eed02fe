package com.gaia3d.globe.tile.source;

import com.gaia3d.globe.tile.TileDescriptor;
import lombok.Getter;

/**
 * Resource naming of tiles with the placeholders {@code {tier}}, {@code {x}} and {@code {y}}.
 */
@Getter
public class TileNameTemplate {
    public static final String DEFAULT_PATTERN = "land_{tier}_{x}_{y}.json";

    private final String pattern;

    public TileNameTemplate() {
        this(DEFAULT_PATTERN);
    }

    public TileNameTemplate(String pattern) {
        if (pattern == null || !pattern.contains("{x}") || !pattern.contains("{y}")) {
            throw new IllegalArgumentException("Tile name template must contain {x} and {y}: " + pattern);
        }
        this.pattern = pattern;
    }

    public String resolve(TileDescriptor descriptor) {
        return pattern
                .replace("{tier}", descriptor.getTier().getName())
                .replace("{x}", Integer.toString(descriptor.getX()))
                .replace("{y}", Integer.toString(descriptor.getY()));
    }

    @Override
    public String toString() {
        return pattern;
    }
}
