package com.gaia3d.globe.command;

import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

import static org.junit.jupiter.api.Assertions.*;

@Slf4j
@Tag("default")
public class MagoGlobeMainTest {

    private static final String LAND = "{\"type\":\"FeatureCollection\",\"features\":["
            + "{\"type\":\"Feature\",\"properties\":{},"
            + "\"geometry\":{\"type\":\"Polygon\",\"coordinates\":[[[0,0],[10,0],[10,10],[0,10],[0,0]]]}}]}";

    @TempDir
    Path tempDir;

    @Test
    void testHelp() {
        assertDoesNotThrow(() -> MagoGlobeMain.main(new String[]{"-h"}));
        assertDoesNotThrow(() -> MagoGlobeMain.main(new String[]{}));
    }

    @Test
    void testInvalidArgumentsAreReported() {
        assertDoesNotThrow(() -> MagoGlobeMain.main(new String[]{"-scale", "300"}));
        assertDoesNotThrow(() -> MagoGlobeMain.main(new String[]{"-unknown"}));
        assertDoesNotThrow(() -> MagoGlobeMain.main(new String[]{"-input", tempDir.resolve("missing").toString()}));
    }

    @Test
    void testHeadlessSessionOnLocalTiles() throws IOException, InterruptedException {
        Files.writeString(tempDir.resolve("land_110m.json"), LAND, StandardCharsets.UTF_8);
        Files.writeString(tempDir.resolve("land_110m_0_0.json"), LAND, StandardCharsets.UTF_8);
        Files.writeString(tempDir.resolve("land_110m_-36_-18.json"), LAND, StandardCharsets.UTF_8);
        Path cof = tempDir.resolve("WMM.COF");
        try (InputStream stream = MagoGlobeMainTest.class.getResourceAsStream("/wmm/TILTED_DIPOLE.COF")) {
            assertNotNull(stream);
            Files.copy(stream, cof, StandardCopyOption.REPLACE_EXISTING);
        }

        GlobalOptions options = new GlobalOptions();
        options.setInput(tempDir.toString());
        options.setCofPath(cof);
        options.setDecimalYear(2022.0);
        options.setTimeoutMillis(20_000);

        // missing tiles and the missing high resolution dataset fail without stopping the session
        assertTrue(MagoGlobeMain.execute(options));
    }
}
