package com.gaia3d.globe.projection;

import com.gaia3d.globe.view.ViewState;
import com.gaia3d.util.GlobeUtils;
import lombok.Getter;
import org.joml.Vector2d;
import org.joml.Vector2dc;

import java.util.Optional;

/**
 * Spherical orthographic projection with a three-axis rotation and a 90 degree clip circle.
 * Screen y grows downward.
 */
public class OrthographicProjection implements Projection {
    private static final double CLIP_ANGLE_DEG = 90.0;
    private static final double CLIP_COS = Math.cos(Math.toRadians(CLIP_ANGLE_DEG));

    @Getter
    private final double scale;
    private final Vector2d translate;

    private final double deltaLambda;
    private final double cosDeltaPhi;
    private final double sinDeltaPhi;
    private final double cosDeltaGamma;
    private final double sinDeltaGamma;
    private final boolean identityRotation;

    public OrthographicProjection(double scale, double yaw, double pitch, double roll, double translateX, double translateY) {
        this.scale = scale;
        this.translate = new Vector2d(translateX, translateY);
        this.deltaLambda = Math.toRadians(yaw);
        double deltaPhi = Math.toRadians(pitch);
        double deltaGamma = Math.toRadians(roll);
        this.cosDeltaPhi = Math.cos(deltaPhi);
        this.sinDeltaPhi = Math.sin(deltaPhi);
        this.cosDeltaGamma = Math.cos(deltaGamma);
        this.sinDeltaGamma = Math.sin(deltaGamma);
        this.identityRotation = yaw == 0.0 && pitch == 0.0 && roll == 0.0;
    }

    public static OrthographicProjection forView(ViewState view, double width, double height) {
        return new OrthographicProjection(view.getScale(), view.getYaw(), view.getPitch(), view.getRoll(), width / 2.0, height / 2.0);
    }

    @Override
    public Vector2dc getTranslate() {
        return translate;
    }

    @Override
    public Optional<ProjectedPoint> project(double lonDeg, double latDeg) {
        double[] rotated = rotate(Math.toRadians(lonDeg), Math.toRadians(latDeg));
        double lambda = rotated[0];
        double phi = rotated[1];

        double visibility = Math.cos(lambda) * Math.cos(phi);
        if (!(visibility > CLIP_COS)) {
            return Optional.empty();
        }

        double x = Math.cos(phi) * Math.sin(lambda);
        double y = Math.sin(phi);
        return Optional.of(new ProjectedPoint(translate.x + scale * x, translate.y - scale * y, visibility));
    }

    @Override
    public Optional<Vector2d> invert(double screenX, double screenY) {
        double x = (screenX - translate.x) / scale;
        double y = (translate.y - screenY) / scale;
        double rho = Math.sqrt(x * x + y * y);
        if (rho > 1.0) {
            return Optional.empty();
        }

        double c = Math.asin(rho);
        double sinC = Math.sin(c);
        double cosC = Math.cos(c);
        double lambda = Math.atan2(x * sinC, rho * cosC);
        double phi = rho == 0.0 ? 0.0 : Math.asin(y * sinC / rho);

        double[] geographic = rotateInverse(lambda, phi);
        double lonDeg = GlobeUtils.normalizeLongitude(Math.toDegrees(geographic[0]));
        double latDeg = GlobeUtils.clampLatitude(Math.toDegrees(geographic[1]));
        return Optional.of(new Vector2d(lonDeg, latDeg));
    }

    private double[] rotate(double lambda, double phi) {
        if (identityRotation) {
            return new double[]{lambda, phi};
        }
        double lambdaRotated = wrapRadians(lambda + deltaLambda);
        double cosPhi = Math.cos(phi);
        double x = Math.cos(lambdaRotated) * cosPhi;
        double y = Math.sin(lambdaRotated) * cosPhi;
        double z = Math.sin(phi);
        double k = z * cosDeltaPhi + x * sinDeltaPhi;
        return new double[]{
                Math.atan2(y * cosDeltaGamma - k * sinDeltaGamma, x * cosDeltaPhi - z * sinDeltaPhi),
                asinClamped(k * cosDeltaGamma + y * sinDeltaGamma)
        };
    }

    private double[] rotateInverse(double lambda, double phi) {
        if (identityRotation) {
            return new double[]{lambda, phi};
        }
        double cosPhi = Math.cos(phi);
        double x = Math.cos(lambda) * cosPhi;
        double y = Math.sin(lambda) * cosPhi;
        double z = Math.sin(phi);
        double k = z * cosDeltaGamma - y * sinDeltaGamma;
        double lambdaRotated = Math.atan2(y * cosDeltaGamma + z * sinDeltaGamma, x * cosDeltaPhi + k * sinDeltaPhi);
        double phiRotated = asinClamped(k * cosDeltaPhi - x * sinDeltaPhi);
        return new double[]{wrapRadians(lambdaRotated - deltaLambda), phiRotated};
    }

    private static double wrapRadians(double lambda) {
        double wrapped = lambda % (2.0 * Math.PI);
        if (wrapped > Math.PI) {
            return wrapped - 2.0 * Math.PI;
        }
        if (wrapped < -Math.PI) {
            return wrapped + 2.0 * Math.PI;
        }
        return wrapped;
    }

    private static double asinClamped(double value) {
        return Math.asin(Math.max(-1.0, Math.min(1.0, value)));
    }
}
