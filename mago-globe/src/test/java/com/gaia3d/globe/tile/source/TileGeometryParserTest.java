package com.gaia3d.globe.tile.source;

import com.gaia3d.globe.support.GeoJsonFixtures;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

@Slf4j
@Tag("default")
public class TileGeometryParserTest {

    private final TileGeometryParser parser = new TileGeometryParser();

    private static byte[] bytes(String json) {
        return json.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    void testFeatureCollection() {
        Geometry geometry = parser.parse(bytes(GeoJsonFixtures.SQUARE_ISLAND));
        assertEquals(1, geometry.getNumGeometries());
        Envelope envelope = geometry.getEnvelopeInternal();
        assertEquals(0.0, envelope.getMinX(), 1e-12);
        assertEquals(10.0, envelope.getMaxX(), 1e-12);
        assertEquals(10.0, envelope.getMaxY(), 1e-12);
        assertEquals(100.0, geometry.getArea(), 1e-9);
    }

    @Test
    void testMultipleFeatures() {
        Geometry geometry = parser.parse(bytes(GeoJsonFixtures.TWO_ISLANDS));
        assertEquals(2, geometry.getNumGeometries());
        assertEquals(2.0, geometry.getArea(), 1e-9);
    }

    @Test
    void testEmptyCollectionIsValid() {
        Geometry geometry = parser.parse(bytes(GeoJsonFixtures.EMPTY_COLLECTION));
        assertTrue(geometry.isEmpty());
    }

    @Test
    void testBareGeometry() {
        Geometry geometry = parser.parse(bytes("{\"type\":\"Point\",\"coordinates\":[126.9,37.5]}"));
        assertEquals("Point", geometry.getGeometryType());
        assertEquals(126.9, geometry.getCoordinate().x, 1e-12);
        assertEquals(37.5, geometry.getCoordinate().y, 1e-12);
    }

    @Test
    void testInvalidPayloads() {
        assertThrows(TileParseException.class, () -> parser.parse(bytes(GeoJsonFixtures.NOT_JSON)));
        assertThrows(TileParseException.class, () -> parser.parse(new byte[0]));
        assertThrows(TileParseException.class, () -> parser.parse(null));
    }
}
