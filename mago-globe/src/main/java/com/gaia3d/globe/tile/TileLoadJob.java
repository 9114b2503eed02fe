package com.gaia3d.globe.tile;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
class TileLoadJob {
    private final TileRecord record;
    private final Runnable continuation;
}
