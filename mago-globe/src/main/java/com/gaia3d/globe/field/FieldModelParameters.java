package com.gaia3d.globe.field;

import com.gaia3d.util.DecimalYearUtils;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Inputs of the field model that a cached grid depends on besides the view.
 */
@Getter
@ToString
@EqualsAndHashCode
public class FieldModelParameters {
    private final double decimalYear;
    private final double altitudeKm;

    public FieldModelParameters(double decimalYear, double altitudeKm) {
        if (!Double.isFinite(decimalYear) || !Double.isFinite(altitudeKm)) {
            throw new IllegalArgumentException("Model parameters must be finite");
        }
        this.decimalYear = decimalYear;
        this.altitudeKm = altitudeKm;
    }

    public static FieldModelParameters now() {
        return new FieldModelParameters(DecimalYearUtils.currentDecimalYear(), 0.0);
    }

    public FieldModelParameters withDecimalYear(double year) {
        return new FieldModelParameters(year, altitudeKm);
    }

    public FieldModelParameters withAltitudeKm(double altitude) {
        return new FieldModelParameters(decimalYear, altitude);
    }
}
