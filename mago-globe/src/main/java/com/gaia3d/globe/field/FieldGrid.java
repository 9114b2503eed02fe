package com.gaia3d.globe.field;

import com.gaia3d.globe.view.ViewState;
import lombok.Getter;

import java.util.List;

/**
 * Immutable result of one regeneration, ordered by longitude then latitude.
 */
@Getter
public class FieldGrid {
    private final List<FieldSample> samples;
    private final int detailLevel;
    private final boolean highDetail;
    private final ViewState generatedAgainstView;
    private final FieldModelParameters modelParameters;
    private final int skippedSamples;

    public FieldGrid(List<FieldSample> samples, int detailLevel, boolean highDetail,
                     ViewState generatedAgainstView, FieldModelParameters modelParameters, int skippedSamples) {
        this.samples = List.copyOf(samples);
        this.detailLevel = detailLevel;
        this.highDetail = highDetail;
        this.generatedAgainstView = generatedAgainstView.copy();
        this.modelParameters = modelParameters;
        this.skippedSamples = skippedSamples;
    }

    /**
     * Spacing between samples in degrees.
     */
    public double getSpacingDegrees() {
        return 180.0 / detailLevel;
    }

    public int size() {
        return samples.size();
    }

    @Override
    public String toString() {
        return String.format("FieldGrid[detail=%d%s, samples=%d, skipped=%d, %s]",
                detailLevel, highDetail ? " (high)" : "", samples.size(), skippedSamples, modelParameters);
    }
}
