package com.gaia3d.globe.command;

import lombok.Getter;

/**
 * Command line options of {@link MagoGlobeMain}.
 */
@Getter
public enum ProcessOptions {
    HELP("help", "h", false, "Print this message"),
    INPUT("input", "i", true, "Tile directory or http(s) base URL"),
    TEMPLATE("template", "tp", true, "Tile name template (default: land_{tier}_{x}_{y}.json)"),
    TIERS("tiers", "ti", true, "Tile tiers as name:tileSizeDegrees:maxScale, comma separated (default: 110m:36:340,50m:18:520,10m:6:9999)"),
    LOW_RES("low", "lo", true, "Low resolution land dataset name (default: land_110m.json)"),
    HIGH_RES("high", "hi", true, "High resolution land dataset name (default: land_50m.json)"),
    CONCURRENCY("concurrency", "c", true, "Maximum concurrent tile fetches (default: 6)"),
    CACHE("cache", "ca", true, "Maximum cached tiles, 0 for unbounded (default: 0)"),
    COF("cof", "m", true, "World Magnetic Model coefficient file (.COF), enables the declination overlay"),
    YEAR("year", "y", true, "Decimal year of the magnetic model (default: today)"),
    ALTITUDE("altitude", "a", true, "Altitude of the magnetic model in km (default: 0)"),
    RESOLUTION("resolution", "r", true, "Declination grid resolution (default: 8)"),
    BODY("body", "b", true, "Reference body of the magnetic model: earth, earth_sphere (default: earth)"),
    SCALE("scale", "s", true, "Globe radius in pixels (default: 280)"),
    ROTATION("rotation", "ro", true, "View rotation as yaw,pitch[,roll] in degrees (default: 0,10,0)"),
    LOD_SCALE("lodScale", "ls", true, "Scale above which the high resolution dataset is used (default: 600)"),
    LOD_DELAY("lodDelay", "ld", true, "Delay in ms before switching to the high resolution dataset (default: 300)"),
    TIMEOUT("timeout", "to", true, "Seconds to wait for tiles to load (default: 30)"),
    DEBUG("debug", "d", false, "Debug mode, print more detail log");

    private final String longName;
    private final String shortName;
    private final boolean argRequired;
    private final String description;

    ProcessOptions(String longName, String shortName, boolean argRequired, String description) {
        this.longName = longName;
        this.shortName = shortName;
        this.argRequired = argRequired;
        this.description = description;
    }

    public String getArgName() {
        return longName;
    }
}
