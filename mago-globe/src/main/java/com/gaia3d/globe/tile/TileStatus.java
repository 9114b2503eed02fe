package com.gaia3d.globe.tile;

public enum TileStatus {
    PENDING,
    LOADED,
    FAILED;

    public boolean isTerminal() {
        return this != PENDING;
    }
}
