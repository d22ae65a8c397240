package com.ledgerd.node.events;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;

/**
 * Wires block event emission into the node's application context.
 */
@Configuration
@EnableConfigurationProperties(LedgerEventsConfig.class)
@Import(BlockEventEmitter.class)
public class LedgerEventsConfiguration {
}
