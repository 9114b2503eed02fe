package com.gaia3d.globe.render;

import lombok.extern.slf4j.Slf4j;

/**
 * Headless renderer that reports each frame on the log and keeps the last one.
 */
@Slf4j
public class LoggingFrameRenderer implements FrameRenderer {
    private volatile GlobeFrame lastFrame;

    @Override
    public void render(GlobeFrame frame) {
        lastFrame = frame;
        if (log.isDebugEnabled()) {
            log.debug("[Render] frame #{} {} base {}:{} detail {}:{} pending {} failed {} dataset {} field {}",
                    frame.getFrameNumber(),
                    frame.getView(),
                    frame.getBaseTier().getName(), frame.getBaseTiles().size(),
                    frame.getActiveTier().getName(), frame.getDetailTiles().size(),
                    frame.getPendingTiles(),
                    frame.getFailedTiles(),
                    frame.getDatasetResolution(),
                    frame.getFieldGrid() == null ? "off" : frame.getFieldGrid());
        }
    }

    public GlobeFrame getLastFrame() {
        return lastFrame;
    }
}
