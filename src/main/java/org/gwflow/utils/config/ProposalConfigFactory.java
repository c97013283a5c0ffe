package org.gwflow.utils.config;

import org.aeonbits.owner.ConfigCache;
import org.aeonbits.owner.ConfigFactory;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Map;

/**
 * Creates {@link ProposalConfig} instances.  System properties take precedence over the configured sources.
 */
public final class ProposalConfigFactory {
    private static final Logger logger = LogManager.getLogger(ProposalConfigFactory.class);

    private ProposalConfigFactory() {}

    /**
     * @return the process-wide {@link ProposalConfig}, created on first use
     */
    public static ProposalConfig getProposalConfig() {
        return ConfigCache.getOrCreate(ProposalConfig.class, System.getProperties());
    }

    /**
     * Creates a fresh, uncached {@link ProposalConfig} in which {@code overrides} take precedence over every other source.
     */
    public static ProposalConfig create(final Map<?, ?> overrides) {
        final ProposalConfig config = ConfigFactory.create(ProposalConfig.class, overrides, System.getProperties());
        logger.debug("Created proposal configuration: retry limit " + config.retryLimit()
                + ", random seed " + config.randomSeed());
        return config;
    }
}
