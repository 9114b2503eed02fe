package com.gaia3d.globe.command;

import com.gaia3d.globe.dataset.SurfaceDatasets;
import com.gaia3d.globe.field.FieldModelParameters;
import com.gaia3d.globe.field.FieldSampleCache;
import com.gaia3d.globe.render.DatasetLodSwitch;
import com.gaia3d.globe.tile.BoundedTileLoader;
import com.gaia3d.globe.tile.TileTier;
import com.gaia3d.globe.tile.source.TileNameTemplate;
import com.gaia3d.globe.view.InteractionController;
import com.gaia3d.util.CelestialBody;
import com.gaia3d.util.DecimalYearUtils;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.cli.CommandLine;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

/**
 * Settings of one globe session with their defaults. Built from the command line by
 * {@link #fromCommandLine(CommandLine)} or filled programmatically, then handed to
 * {@link com.gaia3d.globe.GlobeSession}.
 */
@Slf4j
@Getter
@Setter
@NoArgsConstructor
public class GlobalOptions {
    public static final double DEFAULT_SCALE = 280.0;
    public static final long DEFAULT_TIMEOUT_MS = 30_000;

    /* input */
    private String input;
    private String tileTemplate = TileNameTemplate.DEFAULT_PATTERN;
    private List<TileTier> tiers = TileTier.defaultTiers();
    private String lowResDataset = SurfaceDatasets.DEFAULT_LOW_RES;
    private String highResDataset = SurfaceDatasets.DEFAULT_HIGH_RES;

    /* loading */
    private int maxConcurrentFetches = BoundedTileLoader.DEFAULT_MAX_CONCURRENT;
    // 0 keeps every tile for the session
    private int tileCacheSize = 0;

    /* field model */
    private Path cofPath;
    private double decimalYear = DecimalYearUtils.currentDecimalYear();
    private double altitudeKm = 0.0;
    private int fieldResolution = FieldSampleCache.DEFAULT_RESOLUTION;
    private CelestialBody celestialBody = CelestialBody.EARTH;

    /* view */
    private double scale = DEFAULT_SCALE;
    private double yaw = 0.0;
    private double pitch = 10.0;
    private double roll = 0.0;
    private double minScale = InteractionController.DEFAULT_MIN_SCALE;
    private double maxScale = InteractionController.DEFAULT_MAX_SCALE;
    private double sensitivity = InteractionController.DEFAULT_SENSITIVITY;
    private int viewportWidth = 960;
    private int viewportHeight = 720;

    /* dataset switch */
    private double lodThresholdScale = DatasetLodSwitch.DEFAULT_THRESHOLD_SCALE;
    private long lodDelayMillis = DatasetLodSwitch.DEFAULT_UPGRADE_DELAY_MS;

    private long timeoutMillis = DEFAULT_TIMEOUT_MS;
    private boolean debugMode = false;

    public static GlobalOptions fromCommandLine(CommandLine command) {
        GlobalOptions options = new GlobalOptions();

        if (command.hasOption(ProcessOptions.INPUT.getArgName())) {
            options.setInput(command.getOptionValue(ProcessOptions.INPUT.getArgName()));
        } else {
            throw new IllegalArgumentException("Please enter the value of the input argument.");
        }
        if (!isRemote(options.getInput()) && !Files.isDirectory(Paths.get(options.getInput()))) {
            throw new IllegalArgumentException("Input is neither a directory nor an http(s) URL: " + options.getInput());
        }

        if (command.hasOption(ProcessOptions.TEMPLATE.getArgName())) {
            options.setTileTemplate(command.getOptionValue(ProcessOptions.TEMPLATE.getArgName()));
        }
        if (command.hasOption(ProcessOptions.TIERS.getArgName())) {
            List<TileTier> tiers = TileTier.parseList(command.getOptionValue(ProcessOptions.TIERS.getArgName()));
            if (tiers.isEmpty()) {
                throw new IllegalArgumentException("At least one tile tier is required");
            }
            options.setTiers(tiers);
        }
        if (command.hasOption(ProcessOptions.LOW_RES.getArgName())) {
            options.setLowResDataset(command.getOptionValue(ProcessOptions.LOW_RES.getArgName()));
        }
        if (command.hasOption(ProcessOptions.HIGH_RES.getArgName())) {
            options.setHighResDataset(command.getOptionValue(ProcessOptions.HIGH_RES.getArgName()));
        }

        if (command.hasOption(ProcessOptions.CONCURRENCY.getArgName())) {
            int concurrency = parseInt(command, ProcessOptions.CONCURRENCY);
            if (concurrency <= 0) {
                throw new IllegalArgumentException("Concurrency must be positive: " + concurrency);
            }
            options.setMaxConcurrentFetches(concurrency);
        }
        if (command.hasOption(ProcessOptions.CACHE.getArgName())) {
            int cacheSize = parseInt(command, ProcessOptions.CACHE);
            if (cacheSize < 0) {
                throw new IllegalArgumentException("Cache size cannot be negative: " + cacheSize);
            }
            options.setTileCacheSize(cacheSize);
        }

        if (command.hasOption(ProcessOptions.COF.getArgName())) {
            Path cofPath = Paths.get(command.getOptionValue(ProcessOptions.COF.getArgName()));
            if (!Files.isRegularFile(cofPath)) {
                throw new IllegalArgumentException("Coefficient file does not exist: " + cofPath);
            }
            options.setCofPath(cofPath);
        }
        if (command.hasOption(ProcessOptions.YEAR.getArgName())) {
            options.setDecimalYear(parseDouble(command, ProcessOptions.YEAR));
        }
        if (command.hasOption(ProcessOptions.ALTITUDE.getArgName())) {
            options.setAltitudeKm(parseDouble(command, ProcessOptions.ALTITUDE));
        }
        if (command.hasOption(ProcessOptions.RESOLUTION.getArgName())) {
            int resolution = parseInt(command, ProcessOptions.RESOLUTION);
            if (resolution <= 0) {
                throw new IllegalArgumentException("Field resolution must be positive: " + resolution);
            }
            options.setFieldResolution(resolution);
        }
        if (command.hasOption(ProcessOptions.BODY.getArgName())) {
            options.setCelestialBody(CelestialBody.fromString(command.getOptionValue(ProcessOptions.BODY.getArgName())));
        }

        if (command.hasOption(ProcessOptions.SCALE.getArgName())) {
            double scale = parseDouble(command, ProcessOptions.SCALE);
            if (!(scale > 0)) {
                throw new IllegalArgumentException("Scale must be positive: " + scale);
            }
            options.setScale(scale);
        }
        if (command.hasOption(ProcessOptions.ROTATION.getArgName())) {
            options.applyRotation(command.getOptionValue(ProcessOptions.ROTATION.getArgName()));
        }

        if (command.hasOption(ProcessOptions.LOD_SCALE.getArgName())) {
            options.setLodThresholdScale(parseDouble(command, ProcessOptions.LOD_SCALE));
        }
        if (command.hasOption(ProcessOptions.LOD_DELAY.getArgName())) {
            long delay = parseInt(command, ProcessOptions.LOD_DELAY);
            if (delay < 0) {
                throw new IllegalArgumentException("Dataset switch delay cannot be negative: " + delay);
            }
            options.setLodDelayMillis(delay);
        }
        if (command.hasOption(ProcessOptions.TIMEOUT.getArgName())) {
            options.setTimeoutMillis(parseInt(command, ProcessOptions.TIMEOUT) * 1000L);
        }
        options.setDebugMode(command.hasOption(ProcessOptions.DEBUG.getArgName()));

        options.printDebugOptions();
        return options;
    }

    public FieldModelParameters getFieldModelParameters() {
        return new FieldModelParameters(decimalYear, altitudeKm);
    }

    public boolean isRemoteInput() {
        return isRemote(input);
    }

    /**
     * Accepts {@code yaw,pitch} or {@code yaw,pitch,roll} in degrees.
     */
    void applyRotation(String value) {
        String[] tokens = value.split(",");
        if (tokens.length < 2 || tokens.length > 3) {
            throw new IllegalArgumentException("Rotation must be 'yaw,pitch[,roll]': " + value);
        }
        try {
            this.yaw = Double.parseDouble(tokens[0].trim());
            this.pitch = Double.parseDouble(tokens[1].trim());
            this.roll = tokens.length == 3 ? Double.parseDouble(tokens[2].trim()) : 0.0;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid rotation: " + value, e);
        }
    }

    private static boolean isRemote(String input) {
        return input != null && (input.startsWith("http://") || input.startsWith("https://"));
    }

    private static int parseInt(CommandLine command, ProcessOptions option) {
        String value = command.getOptionValue(option.getArgName());
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(String.format("Invalid integer for -%s: '%s'", option.getArgName(), value), e);
        }
    }

    private static double parseDouble(CommandLine command, ProcessOptions option) {
        String value = command.getOptionValue(option.getArgName());
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(String.format("Invalid number for -%s: '%s'", option.getArgName(), value), e);
        }
    }

    private void printDebugOptions() {
        if (!debugMode) {
            return;
        }
        log.debug("========================================");
        log.debug("Input: {}", input);
        log.debug("Tile Template: {}", tileTemplate);
        log.debug("Tiers: {}", tiers);
        log.debug("Datasets: low={} high={}", lowResDataset, highResDataset);
        log.debug("Max Concurrent Fetches: {}", maxConcurrentFetches);
        log.debug("Tile Cache Size: {}", tileCacheSize == 0 ? "unbounded" : tileCacheSize);
        log.debug("Coefficient File: {}", cofPath);
        log.debug("Decimal Year: {}", decimalYear);
        log.debug("Altitude: {} km", altitudeKm);
        log.debug("Field Resolution: {}", fieldResolution);
        log.debug("Celestial Body: {}", celestialBody.getName());
        log.debug("Scale: {}", scale);
        log.debug("Rotation: {}, {}, {}", yaw, pitch, roll);
        log.debug("Dataset Switch: scale>{} after {} ms", lodThresholdScale, lodDelayMillis);
        log.debug("Timeout: {} ms", timeoutMillis);
        log.debug("========================================");
    }
}
