package com.aviax.media.acquire;

import com.aviax.common.config.ConfigService;

/**
 * Reads the direct-link flag from the cached config on every call, so a
 * toggle takes effect without restarting.
 */
public class ConfigDirectLinkSwitch implements DirectLinkSwitch {

    private final ConfigService configService;

    public ConfigDirectLinkSwitch(ConfigService configService) {
        this.configService = configService;
    }

    @Override
    public boolean isEnabled() {
        return configService.loadConfig().getDownload().isDirectLinkEnabled();
    }
}
