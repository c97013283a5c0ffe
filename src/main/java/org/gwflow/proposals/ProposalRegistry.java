package org.gwflow.proposals;

import com.google.common.collect.ImmutableMap;
import org.gwflow.exceptions.GWFlowException.ConfigurationException;
import org.gwflow.utils.Utils;
import org.gwflow.utils.mcmc.ParameterDescriptor;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Maps proposal names, as used in run configuration, to {@link GWFlowProposal.Variant}s.  Names are case-insensitive.
 */
public final class ProposalRegistry {
    private static final Map<String, GWFlowProposal.Variant> VARIANTS = ImmutableMap.of(
            "gwflowproposal", GWFlowProposal.Variant.PLAIN,
            "augmentedgwflowproposal", GWFlowProposal.Variant.AUGMENTED,
            "clusteringgwflowproposal", GWFlowProposal.Variant.CLUSTERING,
            "mcmcgwflowproposal", GWFlowProposal.Variant.MCMC);

    private ProposalRegistry() {}

    /**
     * @throws ConfigurationException if {@code name} is not a known proposal
     */
    public static GWFlowProposal.Variant getVariant(final String name) {
        Utils.nonNull(name, "Proposal name cannot be null.");
        final GWFlowProposal.Variant variant = VARIANTS.get(name.toLowerCase(Locale.ROOT));
        if (variant == null) {
            throw new ConfigurationException("Unknown proposal: " + name + ". Known proposals: " + VARIANTS.keySet());
        }
        return variant;
    }

    public static Set<String> getNames() {
        return VARIANTS.keySet();
    }

    /**
     * @return a builder for the named proposal with its variant already selected
     */
    public static GWFlowProposal.Builder builder(final String name, final List<ParameterDescriptor> parameters) {
        return new GWFlowProposal.Builder(parameters).variant(getVariant(name));
    }
}
