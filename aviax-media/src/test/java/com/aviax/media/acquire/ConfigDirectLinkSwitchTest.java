package com.aviax.media.acquire;

import com.aviax.common.config.ConfigService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class ConfigDirectLinkSwitchTest {

    @TempDir
    Path tempDir;

    @Test
    void isEnabled_followsPersistedFlag() throws Exception {
        var configService = new ConfigService(tempDir.resolve("aviax.json"), Duration.ofMinutes(5));
        var directLinks = new ConfigDirectLinkSwitch(configService);

        assertFalse(directLinks.isEnabled());

        configService.setDirectLinkEnabled(true);
        assertTrue(directLinks.isEnabled());

        configService.setDirectLinkEnabled(false);
        assertFalse(directLinks.isEnabled());
    }
}
