package org.gwflow.proposals;

import org.gwflow.exceptions.GWFlowException.ConfigurationException;
import org.gwflow.utils.mcmc.ParameterDescriptor;
import org.gwflow.utils.test.BaseTest;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.util.Arrays;
import java.util.Collections;

public final class ProposalRegistryUnitTest extends BaseTest {

    @Test
    public void testNamesMapToVariants() {
        Assert.assertEquals(ProposalRegistry.getVariant("GWFlowProposal"), GWFlowProposal.Variant.PLAIN);
        Assert.assertEquals(ProposalRegistry.getVariant("AugmentedGWFlowProposal"), GWFlowProposal.Variant.AUGMENTED);
        Assert.assertEquals(ProposalRegistry.getVariant("clusteringgwflowproposal"), GWFlowProposal.Variant.CLUSTERING);
        Assert.assertEquals(ProposalRegistry.getVariant("MCMCGWFlowProposal"), GWFlowProposal.Variant.MCMC);
        Assert.assertEquals(ProposalRegistry.getNames().size(), 4);
    }

    @Test(expectedExceptions = ConfigurationException.class)
    public void testUnknownName() {
        ProposalRegistry.getVariant("FlowProposal");
    }

    @Test
    public void testBuilderSelectsVariant() {
        final GWFlowProposal proposal = ProposalRegistry.builder("AugmentedGWFlowProposal",
                        Collections.singletonList(ParameterDescriptor.linear("y")))
                .baseProposal(new GaussianBaseProposal(Arrays.asList("y", "augment_0"), createRandomGenerator(0)))
                .rng(createRandomGenerator(0))
                .build();
        Assert.assertEquals(proposal.getVariant(), GWFlowProposal.Variant.AUGMENTED);
    }
}
