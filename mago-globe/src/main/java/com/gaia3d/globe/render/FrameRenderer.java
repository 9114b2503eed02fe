package com.gaia3d.globe.render;

/**
 * Paints a composed frame. Called on the event loop thread and must not block.
 */
@FunctionalInterface
public interface FrameRenderer {

    void render(GlobeFrame frame);
}
