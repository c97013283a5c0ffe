package org.gwflow.utils.config;

import org.aeonbits.owner.Accessible;
import org.aeonbits.owner.Config.LoadPolicy;
import org.aeonbits.owner.Config.LoadType;
import org.aeonbits.owner.Config.Sources;

/**
 * Default options for reparameterised proposals.
 * All specified {@code Sources} will be loaded.
 * The {@link LoadPolicy} is set to {@link LoadType#MERGE}, which specifies that if a configuration option is not found
 * in the first source, the option will be sought in all following sources until a definition is found.
 * If the option is not specified in any file, the coded default value will be used (as defined by @DefaultValue).
 *
 * The load order is:
 *        1)   system properties (imported by {@link ProposalConfigFactory})
 *        2)   "file:ProposalConfig.properties",
 *        3)   "classpath:org/gwflow/utils/config/ProposalConfig.properties"
 *        4)   hard-coded values specified by @DefaultValue
 *
 * Builders read these values only for options the caller leaves unset.
 */
@LoadPolicy(LoadType.MERGE)
@Sources({
        "file:ProposalConfig.properties",
        "classpath:org/gwflow/utils/config/ProposalConfig.properties"
})
public interface ProposalConfig extends Accessible {

    // ----------------------------------------------------------
    // Wrapper options:
    // ----------------------------------------------------------

    @Key("gwflow.proposal.retry_limit")
    @DefaultValue("100")
    int retryLimit();

    @Key("gwflow.proposal.random_seed")
    @DefaultValue("1234")
    long randomSeed();

    // ----------------------------------------------------------
    // Augmented variant:
    // ----------------------------------------------------------

    @Key("gwflow.proposal.augment_dimensions")
    @DefaultValue("1")
    int augmentDimensions();

    @Key("gwflow.proposal.marginalise_augment")
    @DefaultValue("true")
    boolean marginaliseAugment();

    @Key("gwflow.proposal.marginalisation_samples")
    @DefaultValue("50")
    int marginalisationSamples();

    // ----------------------------------------------------------
    // Clustering variant:
    // ----------------------------------------------------------

    @Key("gwflow.proposal.max_clusters")
    @DefaultValue("4")
    int maxClusters();

    @Key("gwflow.proposal.min_cluster_size")
    @DefaultValue("20")
    int minClusterSize();

    @Key("gwflow.proposal.kmeans_max_iterations")
    @DefaultValue("100")
    int kMeansMaxIterations();

    // ----------------------------------------------------------
    // MCMC variant:
    // ----------------------------------------------------------

    @Key("gwflow.proposal.mcmc_steps")
    @DefaultValue("20")
    int mcmcSteps();

    @Key("gwflow.proposal.mcmc_step_scale")
    @DefaultValue("2.38")
    double mcmcStepScale();
}
