package org.gwflow.proposals;

import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.RandomGeneratorFactory;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.gwflow.exceptions.GWFlowException.ConfigurationException;
import org.gwflow.exceptions.GWFlowException.DomainException;
import org.gwflow.exceptions.GWFlowException.ProposalExhaustedException;
import org.gwflow.reparameterisations.CompositeReparameterisation;
import org.gwflow.reparameterisations.DefaultReparameterisations;
import org.gwflow.reparameterisations.Reparameterisation;
import org.gwflow.reparameterisations.ReparameterisationRegistry;
import org.gwflow.reparameterisations.TransformResult;
import org.gwflow.utils.MathUtils;
import org.gwflow.utils.Utils;
import org.gwflow.utils.clustering.KMeansPartitioner;
import org.gwflow.utils.config.ProposalConfig;
import org.gwflow.utils.config.ProposalConfigFactory;
import org.gwflow.utils.mcmc.ParameterDescriptor;
import org.gwflow.utils.mcmc.Point;
import org.gwflow.utils.param.ParamUtils;

import java.util.*;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Wraps a base proposal that works in transformed space with a {@link CompositeReparameterisation}, so that the
 * sampling engine sees proposals and densities in physical units.
 *
 * <p>
 *     {@link #sample} draws in transformed space, maps each draw back to physical space and reports
 *     {@code log q(y) - log|J_inverse(y)|}; draws outside the domain of the reparameterisations are discarded and
 *     redrawn, up to the retry limit.  {@link #logProb} returns {@code log q(T(x)) + log|J_forward(x)|}.  Where a
 *     reflective bound folds several transformed points onto one physical point, {@code q} is summed over all of
 *     them in both directions.
 *     {@link #update} refits the reparameterisations and the base proposal to the live points, together with
 *     their reflections across reflective bounds; the new composite replaces the current one only once the whole
 *     update has succeeded.
 * </p>
 *
 * <p>
 *     Construct with {@link Builder}:
 * </p>
 * <pre>
 *     final GWFlowProposal proposal = new GWFlowProposal.Builder(descriptors)
 *             .baseProposal(flow)
 *             .variant(GWFlowProposal.Variant.AUGMENTED)
 *             .augmentDimensions(2)
 *             .build();
 * </pre>
 * Options left unset take their values from {@link ProposalConfig}.
 */
public final class GWFlowProposal implements Proposal {
    private static final Logger logger = LogManager.getLogger(GWFlowProposal.class);

    /**
     * Strategy used to draw and evaluate points in transformed space.
     */
    public enum Variant {
        /** delegates directly to the base proposal */
        PLAIN,
        /** adds standard-normal latent dimensions to the base proposal */
        AUGMENTED,
        /** one base proposal per k-means++ cluster of the live points */
        CLUSTERING,
        /** refines base draws with random-walk Metropolis-Hastings within the likelihood constraint */
        MCMC
    }

    private final List<ParameterDescriptor> parameters;
    private final ProposalStrategy strategy;
    private final Variant variant;
    private final int retryLimit;
    private CompositeReparameterisation composite;

    private GWFlowProposal(final Builder builder, final CompositeReparameterisation composite,
                           final ProposalStrategy strategy, final int retryLimit) {
        this.parameters = Collections.unmodifiableList(new ArrayList<>(builder.parameters));
        this.variant = builder.variant;
        this.composite = composite;
        this.strategy = strategy;
        this.retryLimit = retryLimit;
    }

    public static final class Builder {
        private final List<ParameterDescriptor> parameters;
        private Map<String, Reparameterisation> overrides = Collections.emptyMap();
        private ReparameterisationRegistry registry = null;
        private BaseProposal baseProposal = null;
        private Supplier<BaseProposal> baseProposalFactory = null;
        private Variant variant = Variant.PLAIN;
        private LikelihoodConstraint likelihoodConstraint = LikelihoodConstraint.NONE;
        private RandomGenerator rng = null;
        private ProposalConfig config = null;
        private Integer retryLimit = null;
        private Integer augmentDimensions = null;
        private Boolean marginaliseAugment = null;
        private Integer marginalisationSamples = null;
        private Integer maxClusters = null;
        private Integer minClusterSize = null;
        private Integer kMeansMaxIterations = null;
        private Integer mcmcSteps = null;
        private Double mcmcStepScale = null;

        /**
         * @param parameters physical parameters, in the order physical points are returned
         */
        public Builder(final List<ParameterDescriptor> parameters) {
            Utils.nonEmpty(parameters, "List of parameters cannot be null or empty.");
            Utils.containsNoNull(parameters, "List of parameters cannot contain nulls.");
            this.parameters = new ArrayList<>(parameters);
        }

        /**
         * Reparameterisations that replace the defaults for the parameters they consume, keyed by parameter name.
         */
        public Builder overrides(final Map<String, Reparameterisation> overrides) {
            this.overrides = new LinkedHashMap<>(Utils.nonNull(overrides, "Map of overrides cannot be null."));
            return this;
        }

        public Builder registry(final ReparameterisationRegistry registry) {
            this.registry = Utils.nonNull(registry, "Reparameterisation registry cannot be null.");
            return this;
        }

        public Builder baseProposal(final BaseProposal baseProposal) {
            this.baseProposal = Utils.nonNull(baseProposal, "Base proposal cannot be null.");
            return this;
        }

        /**
         * Required by {@link Variant#CLUSTERING}, which needs one base proposal per cluster.
         */
        public Builder baseProposalFactory(final Supplier<BaseProposal> baseProposalFactory) {
            this.baseProposalFactory = Utils.nonNull(baseProposalFactory, "Base proposal factory cannot be null.");
            return this;
        }

        public Builder variant(final Variant variant) {
            this.variant = Utils.nonNull(variant, "Proposal variant cannot be null.");
            return this;
        }

        public Builder likelihoodConstraint(final LikelihoodConstraint likelihoodConstraint) {
            this.likelihoodConstraint = Utils.nonNull(likelihoodConstraint, "Likelihood constraint cannot be null.");
            return this;
        }

        public Builder rng(final RandomGenerator rng) {
            this.rng = Utils.nonNull(rng, "Random generator cannot be null.");
            return this;
        }

        public Builder config(final ProposalConfig config) {
            this.config = Utils.nonNull(config, "Proposal configuration cannot be null.");
            return this;
        }

        public Builder retryLimit(final int retryLimit) {
            this.retryLimit = ParamUtils.isPositiveOrZero(retryLimit, "Retry limit must be non-negative.");
            return this;
        }

        public Builder augmentDimensions(final int augmentDimensions) {
            this.augmentDimensions = ParamUtils.isPositive(augmentDimensions, "Number of augment dimensions must be positive.");
            return this;
        }

        public Builder marginaliseAugment(final boolean marginaliseAugment) {
            this.marginaliseAugment = marginaliseAugment;
            return this;
        }

        public Builder marginalisationSamples(final int marginalisationSamples) {
            this.marginalisationSamples = ParamUtils.isPositive(marginalisationSamples, "Number of marginalisation samples must be positive.");
            return this;
        }

        public Builder maxClusters(final int maxClusters) {
            this.maxClusters = ParamUtils.isPositive(maxClusters, "Maximum number of clusters must be positive.");
            return this;
        }

        public Builder minClusterSize(final int minClusterSize) {
            this.minClusterSize = ParamUtils.isPositive(minClusterSize, "Minimum cluster size must be positive.");
            return this;
        }

        public Builder kMeansMaxIterations(final int kMeansMaxIterations) {
            this.kMeansMaxIterations = ParamUtils.isPositive(kMeansMaxIterations, "Maximum number of k-means iterations must be positive.");
            return this;
        }

        public Builder mcmcSteps(final int mcmcSteps) {
            this.mcmcSteps = ParamUtils.isPositiveOrZero(mcmcSteps, "Number of MCMC steps must be non-negative.");
            return this;
        }

        public Builder mcmcStepScale(final double mcmcStepScale) {
            this.mcmcStepScale = ParamUtils.isPositive(mcmcStepScale, "MCMC step scale must be positive.");
            return this;
        }

        /**
         * @throws ConfigurationException if the reparameterisations are inconsistent or the base proposal required by
         *                                the variant is missing
         */
        public GWFlowProposal build() {
            final ProposalConfig resolvedConfig = config == null ? ProposalConfigFactory.getProposalConfig() : config;
            final RandomGenerator resolvedRng = rng == null ?
                    RandomGeneratorFactory.createRandomGenerator(new Random(resolvedConfig.randomSeed())) : rng;
            final ReparameterisationRegistry resolvedRegistry = registry == null ? ReparameterisationRegistry.createDefault() : registry;
            final CompositeReparameterisation composite =
                    DefaultReparameterisations.create(parameters, overrides, resolvedRegistry, resolvedRng);
            final ProposalStrategy strategy = createStrategy(resolvedConfig, resolvedRng);
            final int resolvedRetryLimit = retryLimit == null ? resolvedConfig.retryLimit() : retryLimit;
            logger.info("Created " + variant + " proposal over " + parameters.size() + " parameters with "
                    + composite.getMembers().size() + " reparameterisation(s) and retry limit " + resolvedRetryLimit);
            return new GWFlowProposal(this, composite, strategy, resolvedRetryLimit);
        }

        private ProposalStrategy createStrategy(final ProposalConfig resolvedConfig, final RandomGenerator resolvedRng) {
            switch (variant) {
                case PLAIN:
                    return new PlainStrategy(requireBaseProposal());
                case AUGMENTED:
                    return new AugmentedStrategy(requireBaseProposal(),
                            augmentDimensions == null ? resolvedConfig.augmentDimensions() : augmentDimensions,
                            marginaliseAugment == null ? resolvedConfig.marginaliseAugment() : marginaliseAugment,
                            marginalisationSamples == null ? resolvedConfig.marginalisationSamples() : marginalisationSamples,
                            resolvedRng);
                case CLUSTERING:
                    if (baseProposalFactory == null) {
                        throw new ConfigurationException("The clustering proposal requires a base proposal factory.");
                    }
                    return new ClusteringStrategy(baseProposalFactory, new KMeansPartitioner(
                            maxClusters == null ? resolvedConfig.maxClusters() : maxClusters,
                            minClusterSize == null ? resolvedConfig.minClusterSize() : minClusterSize,
                            kMeansMaxIterations == null ? resolvedConfig.kMeansMaxIterations() : kMeansMaxIterations,
                            resolvedRng), resolvedRng);
                case MCMC:
                    return new MCMCStrategy(requireBaseProposal(),
                            mcmcSteps == null ? resolvedConfig.mcmcSteps() : mcmcSteps,
                            mcmcStepScale == null ? resolvedConfig.mcmcStepScale() : mcmcStepScale,
                            likelihoodConstraint, resolvedRng);
                default:
                    throw new ConfigurationException("Unknown proposal variant: " + variant);
            }
        }

        private BaseProposal requireBaseProposal() {
            if (baseProposal != null) {
                return baseProposal;
            }
            if (baseProposalFactory != null) {
                return Utils.nonNull(baseProposalFactory.get(), "Base proposal factory returned null.");
            }
            throw new ConfigurationException("The " + variant + " proposal requires a base proposal.");
        }
    }

    @Override
    public List<ProposalSample> sample(final int n) {
        ParamUtils.isPositive(n, "Number of samples must be positive.");
        final CompositeReparameterisation current = composite;
        final List<ProposalSample> samples = new ArrayList<>(n);
        DomainException lastFailure = null;
        int numRetries = 0;
        while (true) {
            final List<Point> draws = strategy.sample(n - samples.size(), current);
            int numDiscarded = 0;
            for (final Point draw : draws) {
                if (samples.size() == n) {
                    break;
                }
                try {
                    final TransformResult inverse = current.inverse(draw);
                    samples.add(new ProposalSample(inverse.getPoint(), logProbTransformed(current, draw) - inverse.getLogJacobian()));
                } catch (final DomainException e) {
                    lastFailure = e;
                    numDiscarded++;
                }
            }
            if (numDiscarded > 0) {
                logger.debug("Discarded " + numDiscarded + " of " + draws.size() + " draws; last failure: "
                        + (lastFailure == null ? "none" : lastFailure.getMessage()));
            }
            if (samples.size() == n) {
                return samples;
            }
            if (numRetries == retryLimit) {
                throw new ProposalExhaustedException(retryLimit, n, samples.size(), lastFailure);
            }
            numRetries++;
            logger.debug("Retry " + numRetries + " of " + retryLimit + ": " + (n - samples.size()) + " points still required");
        }
    }

    @Override
    public double logProb(final Point point) {
        Utils.nonNull(point, "Point cannot be null.");
        final CompositeReparameterisation current = composite;
        final TransformResult forward = current.forward(point);
        return logProbTransformed(current, forward.getPoint()) + forward.getLogJacobian();
    }

    /**
     * Log density of the strategy summed over every transformed point that maps to the same physical point as
     * {@code transformed}.
     */
    private double logProbTransformed(final CompositeReparameterisation current, final Point transformed) {
        final List<Point> preimages = current.preimages(transformed);
        if (preimages.size() == 1) {
            return strategy.logProb(preimages.get(0));
        }
        return MathUtils.logSumExp(preimages.stream().mapToDouble(strategy::logProb).toArray());
    }

    @Override
    public void update(final List<Point> livePoints) {
        Utils.nonEmpty(livePoints, "List of live points cannot be null or empty.");
        final CompositeReparameterisation fitted = composite.fit(livePoints);
        //points reflected across reflective bounds are trained on alongside the originals
        final List<Point> trainingPoints = livePoints.stream()
                .map(p -> fitted.forward(p).getPoint())
                .flatMap(y -> fitted.preimages(y).stream())
                .collect(Collectors.toList());
        strategy.fit(trainingPoints);
        composite = fitted;
        logger.debug("Updated " + variant + " proposal with " + livePoints.size() + " live points ("
                + trainingPoints.size() + " training points)");
    }

    public CompositeReparameterisation getComposite() {
        return composite;
    }

    public List<ParameterDescriptor> getParameters() {
        return parameters;
    }

    public Variant getVariant() {
        return variant;
    }

    public int getRetryLimit() {
        return retryLimit;
    }

    /**
     * Names of the transformed parameters the base proposal works with, excluding any latent dimensions.
     */
    public List<String> getTransformedParameters() {
        return composite.getOutputParameters();
    }

    int getNumClusters() {
        return strategy instanceof ClusteringStrategy ? ((ClusteringStrategy) strategy).getNumClusters() : 1;
    }
}
