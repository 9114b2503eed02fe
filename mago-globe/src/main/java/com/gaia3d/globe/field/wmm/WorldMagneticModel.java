package com.gaia3d.globe.field.wmm;

import com.gaia3d.globe.field.FieldEvaluationException;
import com.gaia3d.globe.field.FieldModel;
import com.gaia3d.globe.field.FieldModelParameters;
import com.gaia3d.util.CelestialBody;
import com.gaia3d.util.GlobeUtils;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.joml.Vector3d;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Spherical harmonic geomagnetic model read from a NOAA World Magnetic Model coefficient (.COF) file.
 * Instances are immutable and safe to evaluate from any thread.
 */
@Slf4j
public class WorldMagneticModel {
    /** A model is published for five years of secular variation. */
    public static final double VALIDITY_YEARS = 5.0;
    private static final double POLE_EPSILON_DEG = 1e-6;
    private static final String TERMINATOR = "9999";

    @Getter
    private final double epoch;
    @Getter
    private final String modelName;
    @Getter
    private final String releaseDate;
    @Getter
    private final int maxDegree;
    private final double[][] g;
    private final double[][] h;
    private final double[][] gDot;
    private final double[][] hDot;
    private final double[][] schmidt;
    private final CelestialBody body;

    private WorldMagneticModel(double epoch, String modelName, String releaseDate, int maxDegree,
                               double[][] g, double[][] h, double[][] gDot, double[][] hDot, CelestialBody body) {
        this.epoch = epoch;
        this.modelName = modelName;
        this.releaseDate = releaseDate;
        this.maxDegree = maxDegree;
        this.g = g;
        this.h = h;
        this.gDot = gDot;
        this.hDot = hDot;
        this.schmidt = schmidtFactors(maxDegree);
        this.body = body;
    }

    /**
     * Same coefficients evaluated on another reference body, e.g. {@link CelestialBody#EARTH_SPHERE}
     * to skip the ellipsoidal latitude correction.
     */
    public WorldMagneticModel onBody(CelestialBody otherBody) {
        if (otherBody == body) {
            return this;
        }
        return new WorldMagneticModel(epoch, modelName, releaseDate, maxDegree, g, h, gDot, hDot, otherBody);
    }

    public CelestialBody getBody() {
        return body;
    }

    public static WorldMagneticModel load(Path cofFile) throws IOException {
        try (BufferedReader reader = Files.newBufferedReader(cofFile, StandardCharsets.UTF_8)) {
            WorldMagneticModel model = parse(reader, cofFile.toString());
            log.info("[Field][WMM] loaded {} (epoch {}, degree {}) from {}", model.modelName, model.epoch, model.maxDegree, cofFile);
            return model;
        }
    }

    public static WorldMagneticModel load(InputStream cofStream, String sourceName) throws IOException {
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(cofStream, StandardCharsets.UTF_8))) {
            return parse(reader, sourceName);
        }
    }

    public static WorldMagneticModel parse(String cofContent) {
        try (BufferedReader reader = new BufferedReader(new StringReader(cofContent))) {
            return parse(reader, "<string>");
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read coefficient text", e);
        }
    }

    /**
     * Parses the header line ({@code epoch name releaseDate}) and the {@code n m g h gDot hDot} rows.
     * Lines starting with the 9999 terminator are ignored.
     *
     * @throws IllegalStateException if the content is malformed
     */
    static WorldMagneticModel parse(BufferedReader reader, String sourceName) throws IOException {
        String header = null;
        int lineNumber = 0;
        String line;
        while ((line = reader.readLine()) != null) {
            lineNumber++;
            if (!line.isBlank()) {
                header = line.trim();
                break;
            }
        }
        if (header == null) {
            throw new IllegalStateException("Empty coefficient file: " + sourceName);
        }

        String[] headerTokens = header.split("\\s+", 3);
        double epoch;
        try {
            epoch = Double.parseDouble(headerTokens[0]);
        } catch (NumberFormatException e) {
            throw new IllegalStateException(String.format("Invalid header in %s: '%s'", sourceName, header), e);
        }
        String name = headerTokens.length > 1 ? headerTokens[1] : "WMM";
        String date = headerTokens.length > 2 ? headerTokens[2].trim() : "";

        CoefficientTable table = new CoefficientTable();
        while ((line = reader.readLine()) != null) {
            lineNumber++;
            String trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith(TERMINATOR)) {
                continue;
            }
            String[] tokens = trimmed.split("\\s+");
            if (tokens.length < 6) {
                throw new IllegalStateException(String.format("%s:%d: expected 'n m g h gDot hDot', got '%s'", sourceName, lineNumber, trimmed));
            }
            try {
                int n = Integer.parseInt(tokens[0]);
                int m = Integer.parseInt(tokens[1]);
                if (n < 1 || m < 0 || m > n) {
                    throw new IllegalStateException(String.format("%s:%d: invalid degree/order n=%d m=%d", sourceName, lineNumber, n, m));
                }
                table.put(n, m, Double.parseDouble(tokens[2]), Double.parseDouble(tokens[3]),
                        Double.parseDouble(tokens[4]), Double.parseDouble(tokens[5]));
            } catch (NumberFormatException e) {
                throw new IllegalStateException(String.format("%s:%d: invalid number in '%s'", sourceName, lineNumber, trimmed), e);
            }
        }
        if (table.maxDegree == 0) {
            throw new IllegalStateException("No coefficients in " + sourceName);
        }
        return table.toModel(epoch, name, date);
    }

    /**
     * Magnetic field vector in the geodetic north/east/down frame, in the units of the coefficients (nT).
     */
    public Vector3d computeField(double latitude, double longitude, double altitudeKm, double decimalYear) {
        Vector3d geocentric = GlobeUtils.geodeticToGeocentric(longitude, latitude, altitudeKm * 1000.0, body);
        double geocentricLat = geocentric.x;
        double lonRad = geocentric.y;
        double ratio = body.getReferenceRadius() / geocentric.z;
        double dt = decimalYear - epoch;

        double theta = Math.PI / 2.0 - geocentricLat;
        double cosTheta = Math.cos(theta);
        double sinTheta = Math.sin(theta);
        double[][] p = new double[maxDegree + 1][maxDegree + 1];
        double[][] dp = new double[maxDegree + 1][maxDegree + 1];
        legendre(cosTheta, sinTheta, p, dp);

        double[] cosM = new double[maxDegree + 1];
        double[] sinM = new double[maxDegree + 1];
        for (int m = 0; m <= maxDegree; m++) {
            cosM[m] = Math.cos(m * lonRad);
            sinM[m] = Math.sin(m * lonRad);
        }

        double x = 0.0;
        double y = 0.0;
        double z = 0.0;
        double cosLat = Math.cos(geocentricLat);
        double rn = ratio * ratio;
        for (int n = 1; n <= maxDegree; n++) {
            rn *= ratio; // (a/r)^(n+2)
            for (int m = 0; m <= n; m++) {
                double gnm = g[n][m] + gDot[n][m] * dt;
                double hnm = h[n][m] + hDot[n][m] * dt;
                double ps = p[n][m] * schmidt[n][m];
                double dps = dp[n][m] * schmidt[n][m];
                double a = gnm * cosM[m] + hnm * sinM[m];
                double b = gnm * sinM[m] - hnm * cosM[m];
                x += rn * a * dps;
                if (m != 0) {
                    y += rn * m * b * ps / cosLat;
                }
                z -= rn * (n + 1) * a * ps;
            }
        }

        double latDiff = Math.toRadians(latitude) - geocentricLat;
        double cosDiff = Math.cos(latDiff);
        double sinDiff = Math.sin(latDiff);
        return new Vector3d(x * cosDiff + z * sinDiff, y, -x * sinDiff + z * cosDiff);
    }

    /**
     * Angle between true and magnetic north in degrees, positive east.
     *
     * @throws FieldEvaluationException at the geographic poles or where the horizontal field vanishes
     */
    public double declination(double latitude, double longitude, double altitudeKm, double decimalYear) throws FieldEvaluationException {
        if (Math.abs(latitude) >= 90.0 - POLE_EPSILON_DEG) {
            throw new FieldEvaluationException("Declination is undefined at the geographic pole (lat " + latitude + ")");
        }
        Vector3d field = computeField(latitude, longitude, altitudeKm, decimalYear);
        double horizontal = Math.hypot(field.x, field.y);
        if (!(horizontal > 0.0)) {
            throw new FieldEvaluationException(String.format("No horizontal field at (%.3f, %.3f)", latitude, longitude));
        }
        return Math.toDegrees(Math.atan2(field.y, field.x));
    }

    /**
     * Declination field for a fixed year and altitude.
     */
    public FieldModel declinationModel(FieldModelParameters parameters) {
        double years = parameters.getDecimalYear() - epoch;
        if (years < 0 || years > VALIDITY_YEARS) {
            log.warn("[Field][WMM] year {} is outside the validity of {} ({} - {})",
                    parameters.getDecimalYear(), modelName, epoch, epoch + VALIDITY_YEARS);
        }
        double altitudeKm = parameters.getAltitudeKm();
        double decimalYear = parameters.getDecimalYear();
        return (latitude, longitude) -> declination(latitude, longitude, altitudeKm, decimalYear);
    }

    private void legendre(double cosTheta, double sinTheta, double[][] p, double[][] dp) {
        p[0][0] = 1.0;
        dp[0][0] = 0.0;
        for (int n = 1; n <= maxDegree; n++) {
            for (int m = 0; m <= n; m++) {
                if (n == m) {
                    p[n][m] = sinTheta * p[n - 1][m - 1];
                    dp[n][m] = cosTheta * p[n - 1][m - 1] + sinTheta * dp[n - 1][m - 1];
                } else if (n == 1 || m == n - 1) {
                    p[n][m] = cosTheta * p[n - 1][m];
                    dp[n][m] = -sinTheta * p[n - 1][m] + cosTheta * dp[n - 1][m];
                } else {
                    double k = ((n - 1.0) * (n - 1.0) - m * m) / ((2.0 * n - 1.0) * (2.0 * n - 3.0));
                    p[n][m] = cosTheta * p[n - 1][m] - k * p[n - 2][m];
                    dp[n][m] = -sinTheta * p[n - 1][m] + cosTheta * dp[n - 1][m] - k * dp[n - 2][m];
                }
            }
        }
    }

    private static double[][] schmidtFactors(int maxDegree) {
        double[][] s = new double[maxDegree + 1][maxDegree + 1];
        s[0][0] = 1.0;
        for (int n = 1; n <= maxDegree; n++) {
            s[n][0] = s[n - 1][0] * (2.0 * n - 1.0) / n;
            for (int m = 1; m <= n; m++) {
                s[n][m] = s[n][m - 1] * Math.sqrt((n - m + 1.0) * (m == 1 ? 2.0 : 1.0) / (n + m));
            }
        }
        return s;
    }

    private static class CoefficientTable {
        private static final int MAX_SUPPORTED_DEGREE = 720;

        private double[][] g = new double[1][1];
        private double[][] h = new double[1][1];
        private double[][] gDot = new double[1][1];
        private double[][] hDot = new double[1][1];
        private int maxDegree = 0;

        void put(int n, int m, double gnm, double hnm, double gDotNm, double hDotNm) {
            if (n > MAX_SUPPORTED_DEGREE) {
                throw new IllegalStateException("Degree " + n + " exceeds " + MAX_SUPPORTED_DEGREE);
            }
            if (n > maxDegree) {
                grow(n);
            }
            g[n][m] = gnm;
            h[n][m] = hnm;
            gDot[n][m] = gDotNm;
            hDot[n][m] = hDotNm;
        }

        private void grow(int degree) {
            g = resize(g, degree);
            h = resize(h, degree);
            gDot = resize(gDot, degree);
            hDot = resize(hDot, degree);
            maxDegree = degree;
        }

        private static double[][] resize(double[][] source, int degree) {
            double[][] target = new double[degree + 1][degree + 1];
            for (int n = 0; n < source.length; n++) {
                System.arraycopy(source[n], 0, target[n], 0, source[n].length);
            }
            return target;
        }

        WorldMagneticModel toModel(double epoch, String name, String date) {
            return new WorldMagneticModel(epoch, name, date, maxDegree, g, h, gDot, hDot, CelestialBody.EARTH);
        }
    }
}
