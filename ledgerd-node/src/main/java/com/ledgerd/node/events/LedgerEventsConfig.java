package com.ledgerd.node.events;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration for block event emission.
 */
@ConfigurationProperties(prefix = "ledgerd.events")
public class LedgerEventsConfig {

    private boolean logEmitted = false;

    public boolean isLogEmitted() { return logEmitted; }
    public void setLogEmitted(boolean logEmitted) { this.logEmitted = logEmitted; }
}
