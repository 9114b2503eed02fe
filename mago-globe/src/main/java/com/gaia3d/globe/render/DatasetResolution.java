package com.gaia3d.globe.render;

public enum DatasetResolution {
    LOW,
    HIGH
}
