package com.gaia3d.globe.tile.source;

import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.PrecisionModel;
import org.locationtech.jts.io.ParseException;
import org.locationtech.jts.io.geojson.GeoJsonReader;

import java.nio.charset.StandardCharsets;

/**
 * Turns a GeoJSON payload (FeatureCollection, Feature or bare geometry) into a JTS geometry.
 * Coordinates stay in longitude/latitude degrees.
 */
public class TileGeometryParser {
    private static final int WGS84_SRID = 4326;

    private final GeometryFactory geometryFactory;

    public TileGeometryParser() {
        this(new GeometryFactory(new PrecisionModel(), WGS84_SRID));
    }

    public TileGeometryParser(GeometryFactory geometryFactory) {
        this.geometryFactory = geometryFactory;
    }

    public Geometry parse(byte[] payload) {
        if (payload == null || payload.length == 0) {
            throw new TileParseException("Empty payload", null);
        }
        String json = new String(payload, StandardCharsets.UTF_8);
        Geometry geometry;
        try {
            // the reader keeps parser state, one per call
            geometry = new GeoJsonReader(geometryFactory).read(json);
        } catch (ParseException | RuntimeException e) {
            throw new TileParseException("Invalid GeoJSON payload: " + e.getMessage(), e);
        }
        if (geometry == null) {
            throw new TileParseException("Payload contains no geometry", null);
        }
        return geometry;
    }

    public GeometryFactory getGeometryFactory() {
        return geometryFactory;
    }
}
