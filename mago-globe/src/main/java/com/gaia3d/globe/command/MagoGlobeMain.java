package com.gaia3d.globe.command;

import com.gaia3d.globe.GlobeSession;
import com.gaia3d.globe.field.FieldGrid;
import com.gaia3d.globe.tile.TileLoaderStats;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.core.config.Configurator;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Headless globe session: loads the tiles and the declination grid of one view and reports what arrived.
 */
@Slf4j
public class MagoGlobeMain {
    private static final String PROGRAM_NAME = "mago-globe";

    public static void main(String[] args) {
        Options options = createOptions();
        CommandLineParser parser = new DefaultParser();
        try {
            CommandLine command = parser.parse(options, args);
            if (command.hasOption(ProcessOptions.HELP.getArgName()) || args.length == 0) {
                printUsage(options);
                return;
            }
            if (command.hasOption(ProcessOptions.DEBUG.getArgName())) {
                Configurator.setAllLevels(LogManager.ROOT_LOGGER_NAME, Level.DEBUG);
            }
            GlobalOptions globalOptions = GlobalOptions.fromCommandLine(command);
            execute(globalOptions);
        } catch (ParseException e) {
            log.error("[ERROR] Failed to parse command line options: {}", e.getMessage());
            printUsage(options);
        } catch (IllegalArgumentException | IllegalStateException e) {
            log.error("[ERROR] {}", e.getMessage());
        } catch (IOException e) {
            log.error("[ERROR] Failed to load input.", e);
        } catch (InterruptedException e) {
            log.error("[ERROR] Interrupted while waiting for tiles.");
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Runs one session until it is idle or the timeout expires.
     *
     * @return true if every requested tile settled in time
     */
    public static boolean execute(GlobalOptions globalOptions) throws IOException, InterruptedException {
        long start = System.currentTimeMillis();
        try (GlobeSession session = GlobeSession.create(globalOptions)) {
            session.start();
            boolean idle = session.awaitIdle(globalOptions.getTimeoutMillis());
            if (!idle) {
                log.warn("[Session] timed out after {} ms, reporting partial results.", globalOptions.getTimeoutMillis());
            }
            report(session);
            log.info("[Session] finished in {} ms", System.currentTimeMillis() - start);
            return idle;
        }
    }

    private static void report(GlobeSession session) throws InterruptedException {
        try {
            Map<String, int[]> counts = session.call(session::tileCountsByTier).get(5, TimeUnit.SECONDS);
            counts.forEach((tier, values) ->
                    log.info("[Tile] {}: loaded {}, failed {}, pending {}", tier, values[0], values[1], values[2]));
        } catch (ExecutionException | TimeoutException e) {
            log.error("[Tile] failed to collect tile counts", e);
        }

        TileLoaderStats stats = session.getTileManager().getStats();
        log.info("[Tile][Loader] {}", stats);

        FieldGrid grid = session.getCurrentFieldGrid();
        if (grid != null) {
            log.info("[Field] {}", grid);
        }
        log.info("[Render] {} frame(s), dataset {}", session.getRenderScheduler().getFrameCount(),
                session.getDatasetLodSwitch().getState());
    }

    static Options createOptions() {
        Options options = new Options();
        for (ProcessOptions processOption : ProcessOptions.values()) {
            options.addOption(Option.builder(processOption.getShortName())
                    .longOpt(processOption.getLongName())
                    .hasArg(processOption.isArgRequired())
                    .desc(processOption.getDescription())
                    .build());
        }
        return options;
    }

    private static void printUsage(Options options) {
        HelpFormatter formatter = new HelpFormatter();
        formatter.setWidth(200);
        formatter.printHelp(PROGRAM_NAME, options, true);
    }
}
