package com.aviax.media.acquire;

/**
 * Runtime on/off flag for direct-link mode, owned by the host process.
 */
@FunctionalInterface
public interface DirectLinkSwitch {

    DirectLinkSwitch DISABLED = () -> false;

    boolean isEnabled();
}
