package com.gaia3d.globe.field.wmm;

import com.gaia3d.globe.field.FieldEvaluationException;
import com.gaia3d.globe.field.FieldModel;
import com.gaia3d.globe.field.FieldModelParameters;
import com.gaia3d.util.CelestialBody;
import lombok.extern.slf4j.Slf4j;
import org.joml.Vector3d;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;

import static org.junit.jupiter.api.Assertions.*;

@Slf4j
@Tag("default")
public class WorldMagneticModelTest {

    private static final String DIPOLE = "2020.0 DIPOLE 01/01/2020\n"
            + "  1  0  -29404.5       0.0        0.0        0.0\n"
            + "999999999999999999999999999999999999999999999999\n";

    // geomagnetic north pole of the tilted dipole fixture
    private static final double POLE_LAT = Math.toDegrees(Math.atan2(29404.5, Math.hypot(1450.7, 4652.9)));
    private static final double POLE_LON = Math.toDegrees(Math.atan2(-4652.9, 1450.7));

    private static WorldMagneticModel tiltedDipole() throws IOException {
        try (InputStream stream = WorldMagneticModelTest.class.getResourceAsStream("/wmm/TILTED_DIPOLE.COF")) {
            assertNotNull(stream);
            return WorldMagneticModel.load(stream, "TILTED_DIPOLE.COF");
        }
    }

    private static double bearingToPole(double lat, double lon) {
        double lat1 = Math.toRadians(lat);
        double lat2 = Math.toRadians(POLE_LAT);
        double dLon = Math.toRadians(POLE_LON - lon);
        return Math.toDegrees(Math.atan2(Math.sin(dLon) * Math.cos(lat2),
                Math.cos(lat1) * Math.sin(lat2) - Math.sin(lat1) * Math.cos(lat2) * Math.cos(dLon)));
    }

    @Test
    void testHeaderAndCoefficients() throws IOException {
        WorldMagneticModel model = tiltedDipole();
        assertEquals(2020.0, model.getEpoch(), 1e-12);
        assertEquals("WMM-2020", model.getModelName());
        assertEquals("12/10/2019", model.getReleaseDate());
        assertEquals(1, model.getMaxDegree());
        assertEquals(CelestialBody.EARTH, model.getBody());
    }

    @Test
    void testAxialDipoleHasNoDeclination() throws FieldEvaluationException {
        WorldMagneticModel model = WorldMagneticModel.parse(DIPOLE);
        for (double lat = -80; lat <= 80; lat += 20) {
            for (double lon = -180; lon < 180; lon += 45) {
                assertEquals(0.0, model.declination(lat, lon, 0.0, 2020.0), 1e-9, "at " + lat + "," + lon);
            }
        }
    }

    @Test
    void testAxialDipoleFieldPointsNorthAndDown() {
        WorldMagneticModel model = WorldMagneticModel.parse(DIPOLE).onBody(CelestialBody.EARTH_SPHERE);
        Vector3d equator = model.computeField(0.0, 0.0, 0.0, 2020.0);
        assertEquals(29404.5, equator.x, 1e-6);
        assertEquals(0.0, equator.z, 1e-6);

        Vector3d north = model.computeField(60.0, 0.0, 0.0, 2020.0);
        assertTrue(north.z > 0, "field dips down in the northern hemisphere");
        Vector3d high = model.computeField(60.0, 0.0, 6371.2, 2020.0);
        assertEquals(north.length() / 8.0, high.length(), 1e-6);
    }

    @Test
    void testTiltedDipoleDeclinationPointsToGeomagneticPole() throws Exception {
        WorldMagneticModel model = tiltedDipole().onBody(CelestialBody.EARTH_SPHERE);
        double[][] points = {{0, 0}, {0, 180}, {45, -100}, {45, 100}, {-30, 20}};
        for (double[] point : points) {
            assertEquals(bearingToPole(point[0], point[1]), model.declination(point[0], point[1], 0.0, 2020.0), 1e-6,
                    "at " + point[0] + "," + point[1]);
        }
        // westward at the prime meridian, eastward on the far side
        assertEquals(-8.99, model.declination(0, 0, 0, 2020.0), 0.01);
        assertEquals(8.99, model.declination(0, 180, 0, 2020.0), 0.01);
    }

    @Test
    void testEllipsoidAgreesAtTheEquator() throws Exception {
        WorldMagneticModel model = tiltedDipole();
        assertEquals(bearingToPole(0, 0), model.declination(0, 0, 0, 2020.0), 1e-6);
    }

    @Test
    void testSecularVariation() throws FieldEvaluationException {
        WorldMagneticModel model = WorldMagneticModel.parse("2020.0 SV 01/01/2020\n"
                + "1 0 -29404.5 0.0 0.0 0.0\n"
                + "1 1 0.0 0.0 0.0 100.0\n").onBody(CelestialBody.EARTH_SPHERE);
        assertEquals(0.0, model.declination(0, 0, 0, 2020.0), 1e-9);
        assertEquals(Math.toDegrees(Math.atan2(-200.0, 29404.5)), model.declination(0, 0, 0, 2022.0), 1e-9);
    }

    @Test
    void testDeclinationIsUndefinedAtThePoles() {
        WorldMagneticModel model = WorldMagneticModel.parse(DIPOLE);
        assertThrows(FieldEvaluationException.class, () -> model.declination(90.0, 0.0, 0.0, 2020.0));
        assertThrows(FieldEvaluationException.class, () -> model.declination(-90.0, 45.0, 0.0, 2020.0));
    }

    @Test
    void testDeclinationModelBindsParameters() throws Exception {
        WorldMagneticModel model = tiltedDipole();
        FieldModel field = model.declinationModel(new FieldModelParameters(2021.0, 0.0));
        assertEquals(model.declination(10.0, 20.0, 0.0, 2021.0), field.evaluate(10.0, 20.0), 1e-12);
        assertThrows(FieldEvaluationException.class, () -> field.evaluate(90.0, 0.0));
    }

    @Test
    void testMalformedFilesAreRejected() {
        assertThrows(IllegalStateException.class, () -> WorldMagneticModel.parse(""));
        assertThrows(IllegalStateException.class, () -> WorldMagneticModel.parse("epoch WMM 2020\n1 0 1 0 0 0\n"));
        assertThrows(IllegalStateException.class, () -> WorldMagneticModel.parse("2020.0 WMM 2020\n1 0 1 0\n"));
        assertThrows(IllegalStateException.class, () -> WorldMagneticModel.parse("2020.0 WMM 2020\n1 2 1 0 0 0\n"));
        assertThrows(IllegalStateException.class, () -> WorldMagneticModel.parse("2020.0 WMM 2020\n1 0 x 0 0 0\n"));
        assertThrows(IllegalStateException.class, () -> WorldMagneticModel.parse("2020.0 WMM 2020\n9999999999\n"));
    }
}
