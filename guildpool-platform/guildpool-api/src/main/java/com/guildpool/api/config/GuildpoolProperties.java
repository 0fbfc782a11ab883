package com.guildpool.api.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Engine settings.
 */
@Configuration
@ConfigurationProperties(prefix = "guildpool.engine")
public class GuildpoolProperties {

    private int maxRecipients = 10;
    private long initialRound = 1;

    public int getMaxRecipients() { return maxRecipients; }
    public void setMaxRecipients(int maxRecipients) { this.maxRecipients = maxRecipients; }
    public long getInitialRound() { return initialRound; }
    public void setInitialRound(long initialRound) { this.initialRound = initialRound; }
}
